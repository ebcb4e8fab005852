package org.janelia.mialign;

import org.junit.Assert;
import org.junit.BeforeClass;
import org.junit.Test;

import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.real.DoubleType;

public class MutualInformationAlignerTest
{
	private static final int[] DOWNSAMPLE_FACTORS = new int[] { 4, 2 };

	private static ArrayImg< DoubleType, DoubleArray > scene;

	@BeforeClass
	public static void setUp()
	{
		scene = SyntheticImages.scene( 42 );
	}

	@Test
	public void testIdenticalImages()
	{
		final ArrayImg< DoubleType, DoubleArray > image = SyntheticImages.crop( scene, 36, 36 );
		final PyramidLevel fullResolution = MutualInformationAligner.fullResolutionLevel( image, image, null, null );
		for ( final AlignmentVariant variant : AlignmentVariant.values() )
		{
			final AlignmentResult result = MutualInformationAligner.align( image, image, null, null, DOWNSAMPLE_FACTORS, variant );
			Assert.assertEquals( variant.toString(), Offset.ZERO, result.getOffset() );

			// the zero offset is a strict local maximum
			for ( int di = -1; di <= 1; ++di )
				for ( int dj = -1; dj <= 1; ++dj )
					if ( di != 0 || dj != 0 )
						Assert.assertTrue( variant + " at " + dj + "," + di,
								result.getScore() > MutualInformation.score( fullResolution, new Offset( dj, di ) ) );
		}
	}

	@Test
	public void testHypothesesCarryTheirOwnScores()
	{
		final ArrayImg< DoubleType, DoubleArray > image1 = SyntheticImages.crop( scene, 36, 36 );
		final ArrayImg< DoubleType, DoubleArray > image2 = SyntheticImages.crop( scene, 31, 39 );
		assertHypothesesScoredAtFullResolution( image1, image2 );

		// a climb started from a borrowed zero-offset score could stay put and report that score
		assertHypothesesScoredAtFullResolution( image1, image1 );
	}

	private static void assertHypothesesScoredAtFullResolution(
			final ArrayImg< DoubleType, DoubleArray > image1,
			final ArrayImg< DoubleType, DoubleArray > image2 )
	{
		final PyramidLevel fullResolution = MutualInformationAligner.fullResolutionLevel( image1, image2, null, null );
		for ( final AlignmentVariant variant : AlignmentVariant.values() )
		{
			final AlignmentResult result = MutualInformationAligner.align( image1, image2, null, null, DOWNSAMPLE_FACTORS, variant );
			Assert.assertFalse( result.getHypotheses().isEmpty() );
			for ( final ScoredOffset hypothesis : result.getHypotheses() )
				Assert.assertEquals( variant + " " + hypothesis,
						MutualInformation.score( fullResolution, hypothesis.getOffset() ), hypothesis.getScore(), 1e-12 );
			Assert.assertEquals( MutualInformation.score( fullResolution, result.getOffset() ), result.getScore(), 1e-12 );
		}
	}

	@Test
	public void testKnownShift()
	{
		// image2( x, y ) = image1( x - 8, y + 4 )
		final ArrayImg< DoubleType, DoubleArray > image1 = SyntheticImages.crop( scene, 36, 36 );
		final ArrayImg< DoubleType, DoubleArray > image2 = SyntheticImages.crop( scene, 28, 40 );
		for ( final AlignmentVariant variant : AlignmentVariant.values() )
		{
			final AlignmentResult result = MutualInformationAligner.align( image1, image2, null, null, DOWNSAMPLE_FACTORS, variant );
			Assert.assertEquals( variant.toString(), new Offset( -8, 4 ), result.getOffset() );
		}
	}

	@Test
	public void testShiftNotAlignedWithPyramidGrid()
	{
		// image2( x, y ) = image1( x - 5, y + 3 )
		final ArrayImg< DoubleType, DoubleArray > image1 = SyntheticImages.crop( scene, 36, 36 );
		final ArrayImg< DoubleType, DoubleArray > image2 = SyntheticImages.crop( scene, 31, 39 );

		final AlignmentResult result = new MutualInformationAligner( AlignmentVariant.MULTI_HYPOTHESIS.createStrategy(), DOWNSAMPLE_FACTORS ).align( image1, image2 );
		Assert.assertEquals( new Offset( -5, 3 ), result.getOffset() );
		Assert.assertEquals( LaplacianBlockMinimaSelector.DEFAULT_NUM_HYPOTHESES, result.getHypotheses().size() );

		// the winner is the best of the refined hypotheses
		for ( final ScoredOffset hypothesis : result.getHypotheses() )
			Assert.assertTrue( hypothesis.getScore() <= result.getScore() );

		// the reported score is measured on the equalized full resolution images
		final PyramidLevel fullResolution = MutualInformationAligner.fullResolutionLevel( image1, image2, null, null );
		Assert.assertEquals( MutualInformation.score( fullResolution, result.getOffset() ), result.getScore(), 1e-12 );
	}

	@Test
	public void testMasks()
	{
		final ArrayImg< DoubleType, DoubleArray > image1 = SyntheticImages.crop( scene, 36, 36 );
		final ArrayImg< DoubleType, DoubleArray > image2 = SyntheticImages.crop( scene, 28, 40 );

		final AlignmentResult result = new MutualInformationAligner( new AlignmentParameters().setDownsampleFactors( DOWNSAMPLE_FACTORS ) ).align(
				image1, image2, EdgeMask.create( image1, 6, 6 ), EdgeMask.create( image2, 6, 6 ) );
		Assert.assertEquals( new Offset( -8, 4 ), result.getOffset() );
	}

	@Test
	public void testInputsAreNotModified()
	{
		final ArrayImg< DoubleType, DoubleArray > image1 = SyntheticImages.crop( scene, 36, 36 );
		final ArrayImg< DoubleType, DoubleArray > image2 = SyntheticImages.crop( scene, 28, 40 );
		final double[] copy1 = image1.update( null ).getCurrentStorageArray().clone();
		final double[] copy2 = image2.update( null ).getCurrentStorageArray().clone();

		MutualInformationAligner.align( image1, image2, null, null, DOWNSAMPLE_FACTORS, AlignmentVariant.SINGLE_PEAK );
		Assert.assertArrayEquals( copy1, image1.update( null ).getCurrentStorageArray(), 0 );
		Assert.assertArrayEquals( copy2, image2.update( null ).getCurrentStorageArray(), 0 );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testNotTwoDimensional()
	{
		MutualInformationAligner.align( ArrayImgs.doubles( 64, 64, 3 ), ArrayImgs.doubles( 64, 64, 3 ), null, null, DOWNSAMPLE_FACTORS, AlignmentVariant.SINGLE_PEAK );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testIncreasingDownsampleFactors()
	{
		new MutualInformationAligner( AlignmentVariant.SINGLE_PEAK.createStrategy(), 2, 4 );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testImagesTooSmallForSchedule()
	{
		final ArrayImg< DoubleType, DoubleArray > image = SyntheticImages.crop( scene, 0, 0, 20, 20 );
		MutualInformationAligner.align( image, image, null, null, new int[] { 16 }, AlignmentVariant.SINGLE_PEAK );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testMismatchedMask()
	{
		final ArrayImg< DoubleType, DoubleArray > image = SyntheticImages.crop( scene, 36, 36 );
		MutualInformationAligner.align( image, image, ArrayImgs.bits( 10, 10 ), null, DOWNSAMPLE_FACTORS, AlignmentVariant.SINGLE_PEAK );
	}
}
