package org.janelia.mialign;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.logic.BitType;
import net.imglib2.type.numeric.real.DoubleType;

/**
 * Image pair and validity masks at one working resolution.
 * A factor of 1 with untrimmed images represents the full resolution.
 */
public class PyramidLevel
{
	private final int factor;
	private final RandomAccessibleInterval< DoubleType > image1, image2;
	private final RandomAccessibleInterval< BitType > mask1, mask2;

	public PyramidLevel(
			final int factor,
			final RandomAccessibleInterval< DoubleType > image1,
			final RandomAccessibleInterval< DoubleType > image2,
			final RandomAccessibleInterval< BitType > mask1,
			final RandomAccessibleInterval< BitType > mask2 )
	{
		ImageChecks.checkNonEmpty( image1, "First image" );
		ImageChecks.checkNonEmpty( image2, "Second image" );
		ImageChecks.checkSameDimensions( image1, mask1, "First image and mask" );
		ImageChecks.checkSameDimensions( image2, mask2, "Second image and mask" );

		this.factor = factor;
		this.image1 = image1;
		this.image2 = image2;
		this.mask1 = mask1;
		this.mask2 = mask2;
	}

	public int getFactor() { return factor; }
	public RandomAccessibleInterval< DoubleType > getImage1() { return image1; }
	public RandomAccessibleInterval< DoubleType > getImage2() { return image2; }
	public RandomAccessibleInterval< BitType > getMask1() { return mask1; }
	public RandomAccessibleInterval< BitType > getMask2() { return mask2; }

	/**
	 * Mutual information of the two images when they are not displaced.
	 */
	public double baselineScore()
	{
		return MutualInformation.score( this, Offset.ZERO );
	}

	@Override
	public String toString()
	{
		return "factor=" + factor + ", size1=" + image1.dimension( 0 ) + "x" + image1.dimension( 1 ) + ", size2=" + image2.dimension( 0 ) + "x" + image2.dimension( 1 );
	}
}
