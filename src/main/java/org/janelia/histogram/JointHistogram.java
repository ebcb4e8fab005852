package org.janelia.histogram;

import java.util.Arrays;

/**
 * Sparse 2D histogram of paired integer levels, each in [0, {@link Entropy#NUM_BINS} - 1].
 * A pair (x, y) is keyed as {@code NUM_BINS * x + y}; only occupied keys are ever counted.
 */
public class JointHistogram
{
	private final int[] codes;
	private int size;

	public JointHistogram( final int capacity )
	{
		codes = new int[ capacity ];
	}

	public void put( final int xLevel, final int yLevel )
	{
		if ( xLevel < 0 || xLevel >= Entropy.NUM_BINS || yLevel < 0 || yLevel >= Entropy.NUM_BINS )
			throw new IllegalArgumentException( "Level pair (" + xLevel + ", " + yLevel + ") is out of range" );

		codes[ size++ ] = Entropy.NUM_BINS * xLevel + yLevel;
	}

	public int getQuantityTotal()
	{
		return size;
	}

	/**
	 * Counts of the occupied keys in ascending key order.
	 */
	public double[] getOccupiedCounts()
	{
		final int[] sorted = Arrays.copyOf( codes, size );
		Arrays.sort( sorted );

		final double[] counts = new double[ size ];
		int numOccupied = 0;
		for ( int k = 0; k < sorted.length; )
		{
			int next = k + 1;
			while ( next < sorted.length && sorted[ next ] == sorted[ k ] )
				++next;
			counts[ numOccupied++ ] = next - k;
			k = next;
		}
		return Arrays.copyOf( counts, numOccupied );
	}

	public double entropy()
	{
		return Entropy.entropyOfCounts( getOccupiedCounts() );
	}
}
