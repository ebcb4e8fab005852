package org.janelia.mialign;

import org.junit.Assert;
import org.junit.Test;

import net.imglib2.Cursor;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.img.basictypeaccess.array.LongArray;
import net.imglib2.type.logic.BitType;
import net.imglib2.type.numeric.real.DoubleType;

public class ExhaustiveSearchTest
{
	@Test
	public void testSearchRange()
	{
		final ArrayImg< DoubleType, DoubleArray > scene = SyntheticImages.scene( 11 );
		final ArrayImg< DoubleType, DoubleArray > image1 = SyntheticImages.crop( scene, 70, 70, 60, 56 );
		final ArrayImg< DoubleType, DoubleArray > image2 = SyntheticImages.crop( scene, 72, 69, 60, 56 );
		final PyramidLevel level = new PyramidLevel( 1, image1, image2, MutualInformationTest.allValid( 60, 56 ), MutualInformationTest.allValid( 60, 56 ) );

		final ScoreSurface surface = ExhaustiveSearch.searchAll( level, 20 );
		Assert.assertEquals( -40, surface.getMinJ() );
		Assert.assertEquals( -36, surface.getMinI() );
		Assert.assertEquals( 80, surface.getWidth() );
		Assert.assertEquals( 72, surface.getHeight() );

		// image2( x, y ) = image1( x + 2, y - 1 )
		Assert.assertEquals( new Offset( 2, -1 ), surface.maximum().getOffset() );
		Assert.assertEquals( MutualInformation.score( level, new Offset( 2, -1 ) ), surface.maximum().getScore(), 0 );
		Assert.assertEquals( MutualInformation.score( level, new Offset( -30, 25 ) ), surface.get( new Offset( -30, 25 ) ), 0 );
	}

	@Test
	public void testOffsetsWithoutValidOverlapAreSkipped()
	{
		final ArrayImg< DoubleType, DoubleArray > image = SyntheticImages.crop( SyntheticImages.scene( 11 ), 80, 70, 40, 40 );

		// only the left half of the first image is valid
		final ArrayImg< BitType, LongArray > mask1 = ArrayImgs.bits( 40, 40 );
		final Cursor< BitType > cursor = mask1.localizingCursor();
		while ( cursor.hasNext() )
		{
			cursor.fwd();
			cursor.get().set( cursor.getLongPosition( 0 ) < 20 );
		}

		final PyramidLevel level = new PyramidLevel( 1, image, image, mask1, MutualInformationTest.allValid( 40, 40 ) );
		final ScoreSurface surface = ExhaustiveSearch.searchAll( level, 0 );

		// the first image is paired from column 25 on
		Assert.assertFalse( MutualInformation.hasValidOverlap( level, new Offset( 25, 0 ) ) );
		Assert.assertEquals( 0, surface.get( new Offset( 25, 0 ) ), 0 );

		Assert.assertTrue( MutualInformation.hasValidOverlap( level, new Offset( 15, 0 ) ) );
		Assert.assertEquals( MutualInformation.score( level, new Offset( 15, 0 ) ), surface.get( new Offset( 15, 0 ) ), 0 );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testBorderTooLarge()
	{
		final ArrayImg< DoubleType, DoubleArray > image = SyntheticImages.ramp( 12, 12 );
		ExhaustiveSearch.searchAll( new PyramidLevel( 1, image, image, MutualInformationTest.allValid( 12, 12 ), MutualInformationTest.allValid( 12, 12 ) ), 12 );
	}
}
