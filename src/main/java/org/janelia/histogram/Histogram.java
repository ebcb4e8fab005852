package org.janelia.histogram;

import java.io.Serializable;

/**
 * Fixed-width histogram over a closed value range [minValue, maxValue].
 * Values equal to maxValue fall into the last bin, values outside the range are counted
 * in the first/last bin and tracked separately.
 */
public class Histogram implements Serializable
{
	private static final long serialVersionUID = 4390834711216543291L;

	private final double[] histogram;
	private final double minValue, maxValue, binWidth;
	private double quantityTotal, quantityLessThanMin, quantityGreaterThanMax;

	public Histogram( final double minValue, final double maxValue, final int bins )
	{
		if ( !( minValue < maxValue ) )
			throw new IllegalArgumentException( "Histogram range is empty: [" + minValue + ", " + maxValue + "]" );
		if ( bins <= 0 )
			throw new IllegalArgumentException( "Number of bins should be positive, got " + bins );

		this.histogram = new double[ bins ];
		this.minValue = minValue;
		this.maxValue = maxValue;
		this.binWidth = ( maxValue - minValue ) / bins;
	}

	public int getNumBins() { return histogram.length; }
	public double getMinValue() { return minValue; }
	public double getMaxValue() { return maxValue; }
	public double getBinWidth() { return binWidth; }
	public double getQuantityTotal() { return quantityTotal; }
	public double getQuantityLessThanMin() { return quantityLessThanMin; }
	public double getQuantityGreaterThanMax() { return quantityGreaterThanMax; }

	public double get( final int bin )
	{
		return histogram[ bin ];
	}

	public double getBinCenter( final int bin )
	{
		return minValue + ( bin + 0.5 ) * binWidth;
	}

	public int getBin( final double value )
	{
		if ( value < minValue )
			return 0;
		if ( value >= maxValue )
			return histogram.length - 1;
		// scale first and divide later, matches the bin edges of numpy-style histograms
		return Math.min( ( int ) Math.floor( ( value - minValue ) * histogram.length / ( maxValue - minValue ) ), histogram.length - 1 );
	}

	public void put( final double value )
	{
		put( value, 1 );
	}

	public void put( final double value, final double quantity )
	{
		if ( value < minValue )
			quantityLessThanMin += quantity;
		else if ( value > maxValue )
			quantityGreaterThanMax += quantity;

		histogram[ getBin( value ) ] += quantity;
		quantityTotal += quantity;
	}

	/**
	 * Cumulative distribution normalized by the total quantity.
	 * Returns all zeros for an empty histogram.
	 */
	public double[] getNormalizedCumulative()
	{
		final double[] cdf = new double[ histogram.length ];
		double sum = 0;
		for ( int bin = 0; bin < histogram.length; ++bin )
		{
			sum += histogram[ bin ];
			cdf[ bin ] = sum;
		}
		if ( quantityTotal > 0 )
			for ( int bin = 0; bin < cdf.length; ++bin )
				cdf[ bin ] /= quantityTotal;
		return cdf;
	}

	/**
	 * Plug-in Shannon entropy of the binned quantities in bits.
	 */
	public double entropy()
	{
		return Entropy.entropyOfCounts( histogram );
	}
}
