package org.janelia.mialign;

/**
 * Built-in coarse search policies.
 */
public enum AlignmentVariant
{
	/** Full offset range, single hypothesis at the score maximum. */
	SINGLE_PEAK,

	/** Border-trimmed offset range, single hypothesis at the minimum of the Gaussian-Laplace filtered scores. */
	LAPLACIAN_PEAK,

	/** Border-trimmed offset range, several hypotheses at the smallest block minima of the filtered scores. */
	MULTI_HYPOTHESIS;

	public SearchStrategy createStrategy()
	{
		return createStrategy( SearchStrategy.DEFAULT_BORDER, LaplacianMinimumSelector.DEFAULT_SIGMA,
				LaplacianBlockMinimaSelector.DEFAULT_BLOCKS_PER_AXIS, LaplacianBlockMinimaSelector.DEFAULT_NUM_HYPOTHESES );
	}

	/**
	 * @param border border excluded from the coarse offset range, ignored by {@link #SINGLE_PEAK}
	 */
	public SearchStrategy createStrategy( final int border, final double sigma, final int blocksPerAxis, final int numHypotheses )
	{
		switch ( this )
		{
		case SINGLE_PEAK:
			return new SearchStrategy( 0, new MaximumSelector() );
		case LAPLACIAN_PEAK:
			return new SearchStrategy( border, new LaplacianMinimumSelector( sigma ) );
		case MULTI_HYPOTHESIS:
			return new SearchStrategy( border, new LaplacianBlockMinimaSelector( sigma, blocksPerAxis, numHypotheses ) );
		default:
			throw new UnsupportedOperationException( "Unknown alignment variant: " + this );
		}
	}

	public static AlignmentVariant fromString( final String str )
	{
		for ( final AlignmentVariant variant : values() )
			if ( variant.name().replace( "_", "-" ).equalsIgnoreCase( str ) || variant.name().equalsIgnoreCase( str ) )
				return variant;
		throw new IllegalArgumentException( "Unknown alignment variant '" + str + "'. Possible values are: 'single-peak', 'laplacian-peak', 'multi-hypothesis'" );
	}
}
