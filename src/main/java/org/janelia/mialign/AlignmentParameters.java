package org.janelia.mialign;

import java.io.Serializable;
import java.util.Arrays;

/**
 * Tunable settings of a mutual information alignment.
 * The defaults reproduce the multi-hypothesis search on a 16, 8, 4, 2 pyramid.
 */
public class AlignmentParameters implements Serializable
{
	private static final long serialVersionUID = -3374108196627445312L;

	public static final int[] DEFAULT_DOWNSAMPLE_FACTORS = new int[] { 16, 8, 4, 2 };

	private int[] downsampleFactors = DEFAULT_DOWNSAMPLE_FACTORS.clone();
	private AlignmentVariant variant = AlignmentVariant.MULTI_HYPOTHESIS;
	private int border = SearchStrategy.DEFAULT_BORDER;
	private double sigma = LaplacianMinimumSelector.DEFAULT_SIGMA;
	private int blocksPerAxis = LaplacianBlockMinimaSelector.DEFAULT_BLOCKS_PER_AXIS;
	private int numHypotheses = LaplacianBlockMinimaSelector.DEFAULT_NUM_HYPOTHESES;

	public int[] getDownsampleFactors() { return downsampleFactors.clone(); }
	public AlignmentVariant getVariant() { return variant; }
	public int getBorder() { return border; }
	public double getSigma() { return sigma; }
	public int getBlocksPerAxis() { return blocksPerAxis; }
	public int getNumHypotheses() { return numHypotheses; }

	public AlignmentParameters setDownsampleFactors( final int... downsampleFactors )
	{
		ImageChecks.checkDownsampleFactors( downsampleFactors );
		this.downsampleFactors = downsampleFactors.clone();
		return this;
	}

	public AlignmentParameters setVariant( final AlignmentVariant variant )
	{
		this.variant = variant;
		return this;
	}

	public AlignmentParameters setBorder( final int border )
	{
		this.border = border;
		return this;
	}

	public AlignmentParameters setSigma( final double sigma )
	{
		this.sigma = sigma;
		return this;
	}

	public AlignmentParameters setBlocksPerAxis( final int blocksPerAxis )
	{
		this.blocksPerAxis = blocksPerAxis;
		return this;
	}

	public AlignmentParameters setNumHypotheses( final int numHypotheses )
	{
		this.numHypotheses = numHypotheses;
		return this;
	}

	public SearchStrategy createStrategy()
	{
		return variant.createStrategy( border, sigma, blocksPerAxis, numHypotheses );
	}

	@Override
	public String toString()
	{
		return "factors=" + Arrays.toString( downsampleFactors ) + ", variant=" + variant + ", border=" + border +
				", sigma=" + sigma + ", blocks=" + blocksPerAxis + ", hypotheses=" + numHypotheses;
	}
}
