package org.janelia.mialign;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import net.imglib2.FinalInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;

/**
 * Several independent hypotheses from the Gaussian-Laplace filtered score surface.
 *
 * The filtered surface is split into a grid of blocks along both axes (block edges at {@code floor( k * size / blocks )}),
 * the minimum of every block is found, and the offsets of the smallest block minima are returned in ascending order.
 * Equal block minima keep the row-major order of their blocks, and within a block the first minimum in row-major order is used.
 */
public class LaplacianBlockMinimaSelector implements CandidateSelector
{
	public static final int DEFAULT_BLOCKS_PER_AXIS = 5;
	public static final int DEFAULT_NUM_HYPOTHESES = 5;

	private final double sigma;
	private final int blocksPerAxis;
	private final int numHypotheses;

	public LaplacianBlockMinimaSelector()
	{
		this( LaplacianMinimumSelector.DEFAULT_SIGMA, DEFAULT_BLOCKS_PER_AXIS, DEFAULT_NUM_HYPOTHESES );
	}

	public LaplacianBlockMinimaSelector( final double sigma, final int blocksPerAxis, final int numHypotheses )
	{
		if ( blocksPerAxis <= 0 || numHypotheses <= 0 )
			throw new IllegalArgumentException( "Block grid and number of hypotheses should be positive, got " + blocksPerAxis + " and " + numHypotheses );

		this.sigma = sigma;
		this.blocksPerAxis = blocksPerAxis;
		this.numHypotheses = numHypotheses;
	}

	public double getSigma() { return sigma; }
	public int getBlocksPerAxis() { return blocksPerAxis; }
	public int getNumHypotheses() { return numHypotheses; }

	@Override
	public List< Offset > select( final ScoreSurface surface )
	{
		final ArrayImg< DoubleType, DoubleArray > filtered = LaplacianOfGaussian.filter( surface.getScores(), sigma );
		final long[] edgesX = blockEdges( surface.getWidth() );
		final long[] edgesY = blockEdges( surface.getHeight() );

		final List< BlockMinimum > blockMinima = new ArrayList<>();
		for ( int by = 0; by < blocksPerAxis; ++by )
		{
			for ( int bx = 0; bx < blocksPerAxis; ++bx )
			{
				// narrow surfaces produce empty blocks
				if ( edgesX[ bx ] == edgesX[ bx + 1 ] || edgesY[ by ] == edgesY[ by + 1 ] )
					continue;

				final FinalInterval block = new FinalInterval(
						new long[] { edgesX[ bx ], edgesY[ by ] },
						new long[] { edgesX[ bx + 1 ] - 1, edgesY[ by + 1 ] - 1 } );
				final ScoredOffset minimum = surface.extremum( Views.interval( filtered, block ), false );
				blockMinima.add( new BlockMinimum( minimum, blockMinima.size() ) );
			}
		}

		Collections.sort( blockMinima );

		final List< Offset > candidates = new ArrayList<>();
		for ( int k = 0; k < Math.min( numHypotheses, blockMinima.size() ); ++k )
			candidates.add( blockMinima.get( k ).minimum.getOffset() );
		return candidates;
	}

	private long[] blockEdges( final long size )
	{
		final long[] edges = new long[ blocksPerAxis + 1 ];
		for ( int k = 0; k <= blocksPerAxis; ++k )
			edges[ k ] = k * size / blocksPerAxis;
		return edges;
	}

	@Override
	public String toString()
	{
		return "laplacian block minima (sigma=" + sigma + ", blocks=" + blocksPerAxis + "x" + blocksPerAxis + ", hypotheses=" + numHypotheses + ")";
	}

	private static class BlockMinimum implements Comparable< BlockMinimum >
	{
		final ScoredOffset minimum;
		final int blockIndex;

		BlockMinimum( final ScoredOffset minimum, final int blockIndex )
		{
			this.minimum = minimum;
			this.blockIndex = blockIndex;
		}

		@Override
		public int compareTo( final BlockMinimum other )
		{
			final int compareValue = Double.compare( minimum.getScore(), other.minimum.getScore() );
			if ( compareValue != 0 )
				return compareValue;

			return Integer.compare( blockIndex, other.blockIndex );
		}
	}
}
