package org.janelia.histogram;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.util.Intervals;
import net.imglib2.view.Views;

/**
 * Global histogram equalization: every value is replaced by the normalized cumulative
 * histogram linearly interpolated at the bin centers. The result lies in [0, 1].
 */
public class HistogramEqualization
{
	public static < T extends RealType< T > > ArrayImg< DoubleType, DoubleArray > equalize( final RandomAccessibleInterval< T > image )
	{
		return equalize( image, Entropy.NUM_BINS );
	}

	public static < T extends RealType< T > > ArrayImg< DoubleType, DoubleArray > equalize( final RandomAccessibleInterval< T > image, final int bins )
	{
		final ArrayImg< DoubleType, DoubleArray > output = ArrayImgs.doubles( Intervals.dimensionsAsLongArray( image ) );
		if ( Intervals.numElements( image ) == 0 )
			return output;

		double min = Double.POSITIVE_INFINITY, max = Double.NEGATIVE_INFINITY;
		for ( final T type : Views.flatIterable( image ) )
		{
			min = Math.min( min, type.getRealDouble() );
			max = Math.max( max, type.getRealDouble() );
		}

		// same fallback range as numpy for a constant image
		if ( min == max )
		{
			min -= 0.5;
			max += 0.5;
		}

		final Histogram histogram = new Histogram( min, max, bins );
		for ( final T type : Views.flatIterable( image ) )
			histogram.put( type.getRealDouble() );

		final double[] cdf = histogram.getNormalizedCumulative();
		final double firstCenter = histogram.getBinCenter( 0 );
		final double lastCenter = histogram.getBinCenter( bins - 1 );

		final Cursor< T > inputCursor = Views.flatIterable( image ).cursor();
		final Cursor< DoubleType > outputCursor = output.cursor();
		while ( inputCursor.hasNext() )
		{
			final double value = inputCursor.next().getRealDouble();
			final double equalized;
			if ( value <= firstCenter )
			{
				equalized = cdf[ 0 ];
			}
			else if ( value >= lastCenter )
			{
				equalized = cdf[ bins - 1 ];
			}
			else
			{
				final double position = ( value - firstCenter ) / histogram.getBinWidth();
				final int bin = Math.min( ( int ) Math.floor( position ), bins - 2 );
				final double fraction = position - bin;
				equalized = cdf[ bin ] + fraction * ( cdf[ bin + 1 ] - cdf[ bin ] );
			}
			outputCursor.next().set( equalized );
		}
		return output;
	}
}
