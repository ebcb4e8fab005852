package org.janelia.histogram;

/**
 * Plug-in entropy estimators (in bits) used for mutual information scoring.
 *
 * Empty and constant sample sets have zero entropy, they never produce NaN.
 */
public class Entropy
{
	public static final int NUM_BINS = 256;

	private static final double LOG2 = Math.log( 2 );

	/**
	 * Entropy of the sample set binned into {@link #NUM_BINS} bins spanning [min, max] of the samples.
	 */
	public static double entropy( final double[] samples )
	{
		if ( samples.length == 0 )
			return 0;

		double min = Double.POSITIVE_INFINITY, max = Double.NEGATIVE_INFINITY;
		for ( final double value : samples )
		{
			min = Math.min( min, value );
			max = Math.max( max, value );
		}

		// a single occupied bin
		if ( min == max )
			return 0;

		final Histogram histogram = new Histogram( min, max, NUM_BINS );
		for ( final double value : samples )
			histogram.put( value );
		return histogram.entropy();
	}

	/**
	 * Joint entropy of paired samples. Both sets are stretched to 256 integer levels and
	 * each pair is binned into a sparse 256x256 histogram.
	 */
	public static double jointEntropy( final double[] x, final double[] y )
	{
		if ( x.length != y.length )
			throw new IllegalArgumentException( "Paired samples have different sizes: " + x.length + " and " + y.length );

		if ( x.length == 0 )
			return 0;

		final int[] xLevels = stretchToLevels( x );
		final int[] yLevels = stretchToLevels( y );

		final JointHistogram histogram = new JointHistogram( x.length );
		for ( int k = 0; k < x.length; ++k )
			histogram.put( xLevels[ k ], yLevels[ k ] );
		return histogram.entropy();
	}

	/**
	 * Min-max contrast stretch to integer levels in [0, {@link #NUM_BINS} - 1].
	 * Constant input maps to level 0.
	 */
	public static int[] stretchToLevels( final double[] values )
	{
		final int[] levels = new int[ values.length ];
		if ( values.length == 0 )
			return levels;

		double min = Double.POSITIVE_INFINITY, max = Double.NEGATIVE_INFINITY;
		for ( final double value : values )
		{
			min = Math.min( min, value );
			max = Math.max( max, value );
		}

		if ( min == max )
			return levels;

		final double range = max - min;
		for ( int k = 0; k < values.length; ++k )
			levels[ k ] = ( int ) ( ( values[ k ] - min ) / range * ( NUM_BINS - 1 ) );
		return levels;
	}

	/**
	 * log2(N) - sum( h * log2(h) ) / N over the non-zero counts h, where N is the total count.
	 */
	public static double entropyOfCounts( final double[] counts )
	{
		double n = 0, sum = 0;
		for ( final double h : counts )
		{
			if ( h > 0 )
			{
				n += h;
				sum += h * log2( h );
			}
		}
		return n > 0 ? log2( n ) - sum / n : 0;
	}

	static double log2( final double value )
	{
		return Math.log( value ) / LOG2;
	}
}
