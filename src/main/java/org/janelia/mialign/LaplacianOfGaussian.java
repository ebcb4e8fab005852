package org.janelia.mialign;

import net.imglib2.Cursor;
import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.util.Intervals;
import net.imglib2.view.Views;

/**
 * Gaussian-Laplace filter of a 2D grid: the sum of the second Gaussian derivatives along each axis.
 * Sampled kernels are truncated at 4 sigma and the boundary is mirrored with the edge value repeated.
 */
public class LaplacianOfGaussian
{
	private static final double TRUNCATE = 4.0;

	public static ArrayImg< DoubleType, DoubleArray > filter( final RandomAccessibleInterval< DoubleType > input, final double sigma )
	{
		if ( !( sigma > 0 ) )
			throw new IllegalArgumentException( "Sigma should be positive, got " + sigma );

		final double[] smoothing = halfKernel( sigma, 0 );
		final double[] secondDerivative = halfKernel( sigma, 2 );

		final ArrayImg< DoubleType, DoubleArray > derivativeX = convolve( convolve( input, secondDerivative, 0 ), smoothing, 1 );
		final ArrayImg< DoubleType, DoubleArray > derivativeY = convolve( convolve( input, smoothing, 0 ), secondDerivative, 1 );

		final Cursor< DoubleType > cursorX = derivativeX.cursor();
		final Cursor< DoubleType > cursorY = derivativeY.cursor();
		while ( cursorX.hasNext() )
			cursorX.next().add( cursorY.next() );

		return derivativeX;
	}

	/**
	 * Correlates the input with a symmetric kernel along one dimension, the input is mirrored at its boundary.
	 */
	static ArrayImg< DoubleType, DoubleArray > convolve( final RandomAccessibleInterval< DoubleType > input, final double[] halfKernel, final int d )
	{
		final int radius = halfKernel.length - 1;
		final ArrayImg< DoubleType, DoubleArray > output = ArrayImgs.doubles( Intervals.dimensionsAsLongArray( input ) );
		final RandomAccess< DoubleType > inputAccess = Views.extendMirrorDouble( Views.zeroMin( input ) ).randomAccess();
		final Cursor< DoubleType > cursor = output.localizingCursor();
		while ( cursor.hasNext() )
		{
			cursor.fwd();
			inputAccess.setPosition( cursor );
			inputAccess.move( -radius, d );

			double sum = 0;
			for ( int k = -radius; k <= radius; ++k )
			{
				sum += halfKernel[ Math.abs( k ) ] * inputAccess.get().get();
				inputAccess.fwd( d );
			}
			cursor.get().set( sum );
		}
		return output;
	}

	/**
	 * Sampled Gaussian (order 0) or its second derivative (order 2), from the center to the truncation radius.
	 * The Gaussian is normalized to a unit sum before the derivative polynomial is applied.
	 */
	static double[] halfKernel( final double sigma, final int order )
	{
		if ( order != 0 && order != 2 )
			throw new IllegalArgumentException( "Only orders 0 and 2 are supported, got " + order );

		final int radius = ( int ) ( TRUNCATE * sigma + 0.5 );
		final double variance = sigma * sigma;

		final double[] gaussian = new double[ radius + 1 ];
		double sum = 0;
		for ( int x = 0; x <= radius; ++x )
		{
			gaussian[ x ] = Math.exp( -0.5 * x * x / variance );
			sum += x == 0 ? gaussian[ x ] : 2 * gaussian[ x ];
		}

		final double[] halfKernel = new double[ radius + 1 ];
		for ( int x = 0; x <= radius; ++x )
		{
			halfKernel[ x ] = gaussian[ x ] / sum;
			if ( order == 2 )
				halfKernel[ x ] *= ( x * x - variance ) / ( variance * variance );
		}
		return halfKernel;
	}
}
