package org.janelia.mialign;

import java.util.Arrays;

import org.janelia.histogram.Entropy;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.logic.BitType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.util.Intervals;
import net.imglib2.util.Pair;
import net.imglib2.view.IntervalView;
import net.imglib2.view.Views;

/**
 * Mutual information between two equally sized image windows, restricted to the samples where both masks are set:
 * H(x) + H(y) - H(x, y), in bits. Higher is better.
 */
public class MutualInformation
{
	public static < T extends RealType< T >, U extends RealType< U > > double score(
			final RandomAccessibleInterval< T > pixels1,
			final RandomAccessibleInterval< U > pixels2,
			final RandomAccessibleInterval< BitType > mask1,
			final RandomAccessibleInterval< BitType > mask2 )
	{
		ImageChecks.checkSameDimensions( pixels1, pixels2, "Images" );
		ImageChecks.checkSameDimensions( pixels1, mask1, "First image and mask" );
		ImageChecks.checkSameDimensions( pixels2, mask2, "Second image and mask" );

		final long numElements = Intervals.numElements( pixels1 );
		if ( numElements == 0 )
			return 0;

		final double[] x = new double[ ( int ) numElements ];
		final double[] y = new double[ ( int ) numElements ];
		int numSamples = 0;

		final Cursor< T > cursor1 = Views.flatIterable( pixels1 ).cursor();
		final Cursor< U > cursor2 = Views.flatIterable( pixels2 ).cursor();
		final Cursor< BitType > maskCursor1 = Views.flatIterable( mask1 ).cursor();
		final Cursor< BitType > maskCursor2 = Views.flatIterable( mask2 ).cursor();
		while ( cursor1.hasNext() )
		{
			cursor1.fwd();
			cursor2.fwd();
			if ( maskCursor1.next().get() & maskCursor2.next().get() )
			{
				x[ numSamples ] = cursor1.get().getRealDouble();
				y[ numSamples ] = cursor2.get().getRealDouble();
				++numSamples;
			}
		}

		return score( Arrays.copyOf( x, numSamples ), Arrays.copyOf( y, numSamples ) );
	}

	public static double score( final double[] x, final double[] y )
	{
		return Entropy.entropy( x ) + Entropy.entropy( y ) - Entropy.jointEntropy( x, y );
	}

	/**
	 * Scores the given offset of the second image relative to the first one on a pyramid level.
	 * An empty overlap scores 0.
	 */
	public static double score( final PyramidLevel level, final Offset offset )
	{
		final Pair< IntervalView< DoubleType >, IntervalView< DoubleType > > pixels = OverlapGeometry.overlap( level.getImage2(), level.getImage1(), offset );
		if ( OverlapGeometry.isEmpty( pixels.getA() ) )
			return 0;

		final Pair< IntervalView< BitType >, IntervalView< BitType > > masks = OverlapGeometry.overlap( level.getMask2(), level.getMask1(), offset );
		return score( pixels.getB(), pixels.getA(), masks.getB(), masks.getA() );
	}

	/**
	 * @return true if the overlap of the given offset is not empty and both mask windows contain a valid sample
	 */
	public static boolean hasValidOverlap( final PyramidLevel level, final Offset offset )
	{
		final Pair< IntervalView< BitType >, IntervalView< BitType > > masks = OverlapGeometry.overlap( level.getMask2(), level.getMask1(), offset );
		return !OverlapGeometry.isEmpty( masks.getA() ) && containsValid( masks.getA() ) && containsValid( masks.getB() );
	}

	private static boolean containsValid( final RandomAccessibleInterval< BitType > mask )
	{
		for ( final BitType valid : Views.flatIterable( mask ) )
			if ( valid.get() )
				return true;
		return false;
	}
}
