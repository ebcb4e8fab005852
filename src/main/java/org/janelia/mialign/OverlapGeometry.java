package org.janelia.mialign;

import net.imglib2.Dimensions;
import net.imglib2.FinalInterval;
import net.imglib2.Interval;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.util.Intervals;
import net.imglib2.util.Pair;
import net.imglib2.util.ValuePair;
import net.imglib2.view.IntervalView;
import net.imglib2.view.Views;

/**
 * Slicing of two 2D images into their overlapping windows when the second one is displaced by (i, j).
 * The vertical offset {@code i} applies to dimension 1 (rows), the horizontal offset {@code j} to dimension 0 (columns).
 *
 * For each axis independently:
 * <ul>
 * <li>negative offset: length = min( a + offset, b ), the window of A starts at -offset, the window of B at 0;</li>
 * <li>non-negative offset: length = min( a, b - offset ), the window of A starts at 0, the window of B at offset.</li>
 * </ul>
 * Negative lengths are clamped to zero, so both windows always have the same (possibly empty) size.
 */
public class OverlapGeometry
{
	public static final int DIM_J = 0;
	public static final int DIM_I = 1;

	/**
	 * @return zero-min views of the overlapping windows of {@code a} and {@code b}
	 */
	public static < A, B > Pair< IntervalView< A >, IntervalView< B > > overlap(
			final RandomAccessibleInterval< A > a,
			final RandomAccessibleInterval< B > b,
			final long i,
			final long j )
	{
		final Pair< Interval, Interval > windows = overlapWindows( a, b, i, j );
		return new ValuePair<>(
				Views.zeroMin( Views.interval( a, Intervals.translate( windows.getA(), Intervals.minAsLongArray( a ) ) ) ),
				Views.zeroMin( Views.interval( b, Intervals.translate( windows.getB(), Intervals.minAsLongArray( b ) ) ) )
			);
	}

	public static < A, B > Pair< IntervalView< A >, IntervalView< B > > overlap(
			final RandomAccessibleInterval< A > a,
			final RandomAccessibleInterval< B > b,
			final Offset offset )
	{
		return overlap( a, b, offset.getI(), offset.getJ() );
	}

	/**
	 * Computes the overlapping windows in zero-min coordinates of {@code a} and {@code b} respectively.
	 */
	public static Pair< Interval, Interval > overlapWindows( final Dimensions a, final Dimensions b, final long i, final long j )
	{
		ImageChecks.checkTwoDimensional( a, "first image" );
		ImageChecks.checkTwoDimensional( b, "second image" );

		final long[] aMin = new long[ 2 ], bMin = new long[ 2 ], size = new long[ 2 ];
		final long[] offsets = new long[ 2 ];
		offsets[ DIM_J ] = j;
		offsets[ DIM_I ] = i;

		for ( int d = 0; d < 2; ++d )
		{
			final long offset = offsets[ d ];
			if ( offset < 0 )
			{
				size[ d ] = Math.min( a.dimension( d ) + offset, b.dimension( d ) );
				aMin[ d ] = -offset;
				bMin[ d ] = 0;
			}
			else
			{
				size[ d ] = Math.min( a.dimension( d ), b.dimension( d ) - offset );
				aMin[ d ] = 0;
				bMin[ d ] = offset;
			}
			size[ d ] = Math.max( size[ d ], 0 );
		}

		return new ValuePair<>( createWindow( aMin, size ), createWindow( bMin, size ) );
	}

	public static boolean isEmpty( final Interval interval )
	{
		for ( int d = 0; d < interval.numDimensions(); ++d )
			if ( interval.dimension( d ) <= 0 )
				return true;
		return false;
	}

	private static Interval createWindow( final long[] min, final long[] size )
	{
		final long[] max = new long[ min.length ];
		for ( int d = 0; d < min.length; ++d )
			max[ d ] = min[ d ] + size[ d ] - 1;
		return new FinalInterval( min, max );
	}
}
