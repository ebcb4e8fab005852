package org.janelia.mialign;

import org.junit.Assert;
import org.junit.Test;

import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.real.DoubleType;

public class HillClimbingTest
{
	private static PyramidLevel shiftedLevel()
	{
		// image2( x, y ) = image1( x + 3, y - 2 )
		final ArrayImg< DoubleType, DoubleArray > scene = SyntheticImages.scene( 5 );
		final ArrayImg< DoubleType, DoubleArray > image1 = SyntheticImages.crop( scene, 40, 40, 80, 80 );
		final ArrayImg< DoubleType, DoubleArray > image2 = SyntheticImages.crop( scene, 43, 38, 80, 80 );
		return new PyramidLevel( 1, image1, image2, MutualInformationTest.allValid( 80, 80 ), MutualInformationTest.allValid( 80, 80 ) );
	}

	@Test
	public void testClimbsToOptimum()
	{
		final PyramidLevel level = shiftedLevel();
		final ScoredOffset result = HillClimbing.climb( level, new Offset( 1, -1 ), level.baselineScore() );
		Assert.assertEquals( new Offset( 3, -2 ), result.getOffset() );
		Assert.assertEquals( MutualInformation.score( level, new Offset( 3, -2 ) ), result.getScore(), 0 );
	}

	@Test
	public void testIdempotent()
	{
		final PyramidLevel level = shiftedLevel();
		final ScoredOffset first = HillClimbing.climb( level, new Offset( 5, -4 ), level.baselineScore() );
		final ScoredOffset second = HillClimbing.climb( level, first.getOffset(), first.getScore() );
		Assert.assertEquals( first.getOffset(), second.getOffset() );
		Assert.assertEquals( first.getScore(), second.getScore(), 0 );
	}

	@Test
	public void testDoesNotMoveBelowStartScore()
	{
		final PyramidLevel level = shiftedLevel();
		final ScoredOffset result = HillClimbing.climb( level, new Offset( 2, -1 ), Double.POSITIVE_INFINITY );
		Assert.assertEquals( new Offset( 2, -1 ), result.getOffset() );
		Assert.assertEquals( Double.POSITIVE_INFINITY, result.getScore(), 0 );
	}

	@Test
	public void testZeroOffsetIsNeverVisited()
	{
		final ArrayImg< DoubleType, DoubleArray > image = SyntheticImages.crop( SyntheticImages.scene( 5 ), 40, 40, 80, 80 );
		final PyramidLevel level = new PyramidLevel( 1, image, image, MutualInformationTest.allValid( 80, 80 ), MutualInformationTest.allValid( 80, 80 ) );

		final ScoredOffset result = HillClimbing.climb( level, new Offset( 1, 1 ), Double.NEGATIVE_INFINITY );
		Assert.assertFalse( result.getOffset().isZero() );
		Assert.assertEquals( MutualInformation.score( level, result.getOffset() ), result.getScore(), 0 );
	}
}
