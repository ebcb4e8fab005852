package org.janelia.mialign;

import net.imglib2.Cursor;
import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;

/**
 * Mutual information scores of a rectangular range of offsets at one resolution.
 * The grid is indexed by (j, i) relative to the minimum offset, dimension 0 is j and dimension 1 is i,
 * so the flat iteration order is the row-major scan over (i, j).
 */
public class ScoreSurface
{
	private final long minJ, minI;
	private final ArrayImg< DoubleType, DoubleArray > scores;

	public ScoreSurface( final long minJ, final long maxJExclusive, final long minI, final long maxIExclusive )
	{
		if ( maxJExclusive <= minJ || maxIExclusive <= minI )
			throw new IllegalArgumentException( "Offset range is empty: j in [" + minJ + ", " + maxJExclusive + "), i in [" + minI + ", " + maxIExclusive + ")" );

		this.minJ = minJ;
		this.minI = minI;
		this.scores = ArrayImgs.doubles( maxJExclusive - minJ, maxIExclusive - minI );
	}

	public long getMinJ() { return minJ; }
	public long getMinI() { return minI; }
	public long getWidth() { return scores.dimension( 0 ); }
	public long getHeight() { return scores.dimension( 1 ); }

	/**
	 * Scores indexed from zero, see {@link #offsetAt(long, long)} for the offset of a grid position.
	 */
	public ArrayImg< DoubleType, DoubleArray > getScores() { return scores; }

	public Offset offsetAt( final long gridX, final long gridY )
	{
		return new Offset( minJ + gridX, minI + gridY );
	}

	public double get( final Offset offset )
	{
		final RandomAccess< DoubleType > randomAccess = scores.randomAccess();
		randomAccess.setPosition( new long[] { offset.getJ() - minJ, offset.getI() - minI } );
		return randomAccess.get().get();
	}

	public void set( final Offset offset, final double score )
	{
		final RandomAccess< DoubleType > randomAccess = scores.randomAccess();
		randomAccess.setPosition( new long[] { offset.getJ() - minJ, offset.getI() - minI } );
		randomAccess.get().set( score );
	}

	/**
	 * Offset with the highest score, the first one in row-major order if there are several.
	 */
	public ScoredOffset maximum()
	{
		return extremum( scores, true );
	}

	/**
	 * Finds the extremum of a grid in the coordinates of the score grid (e.g. a filtered copy of the scores or a block of it)
	 * and maps it to an offset. Ties resolve to the first position in row-major order.
	 */
	ScoredOffset extremum( final RandomAccessibleInterval< DoubleType > grid, final boolean maximum )
	{
		final Cursor< DoubleType > cursor = Views.flatIterable( grid ).localizingCursor();
		double best = maximum ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
		long bestX = 0, bestY = 0;
		while ( cursor.hasNext() )
		{
			final double value = cursor.next().get();
			if ( maximum ? value > best : value < best )
			{
				best = value;
				bestX = cursor.getLongPosition( 0 );
				bestY = cursor.getLongPosition( 1 );
			}
		}
		return new ScoredOffset( offsetAt( bestX, bestY ), best );
	}
}
