package org.janelia.mialign;

import net.imglib2.Cursor;
import net.imglib2.Dimensions;
import net.imglib2.FinalInterval;
import net.imglib2.Interval;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.img.basictypeaccess.array.LongArray;
import net.imglib2.type.logic.BitType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;

/**
 * Block-averaging reduction used to build the coarse-to-fine working resolutions.
 *
 * The image is reduced by averaging factor x factor blocks, where the trailing partial blocks are padded with zeros.
 * One pixel is then trimmed off every edge of the reduced image, so the result has {@code ceil( size / factor ) - 2}
 * pixels along each axis. Masks are reduced the same way and re-binarized: a block is valid if any of its pixels is.
 */
public class Pyramid
{
	private static final int TRIM = 1;

	public static PyramidLevel level(
			final int factor,
			final RandomAccessibleInterval< DoubleType > image1,
			final RandomAccessibleInterval< DoubleType > image2,
			final RandomAccessibleInterval< BitType > mask1,
			final RandomAccessibleInterval< BitType > mask2 )
	{
		return new PyramidLevel(
				factor,
				downsample( image1, factor ),
				downsample( image2, factor ),
				downsampleMask( mask1, factor ),
				downsampleMask( mask2, factor ) );
	}

	public static < T extends RealType< T > > ArrayImg< DoubleType, DoubleArray > downsample( final RandomAccessibleInterval< T > image, final int factor )
	{
		final long[] reducedDimensions = reducedDimensions( image, factor );
		final ArrayImg< DoubleType, DoubleArray > output = ArrayImgs.doubles( reducedDimensions );
		final double blockArea = ( double ) factor * factor;

		final RandomAccessibleInterval< T > source = Views.zeroMin( image );
		final Cursor< DoubleType > cursor = output.localizingCursor();
		while ( cursor.hasNext() )
		{
			cursor.fwd();
			double sum = 0;
			for ( final T type : Views.interval( source, blockInterval( source, factor, cursor.getLongPosition( 0 ) + TRIM, cursor.getLongPosition( 1 ) + TRIM ) ) )
				sum += type.getRealDouble();
			cursor.get().set( sum / blockArea );
		}
		return output;
	}

	public static ArrayImg< BitType, LongArray > downsampleMask( final RandomAccessibleInterval< BitType > mask, final int factor )
	{
		final long[] reducedDimensions = reducedDimensions( mask, factor );
		final ArrayImg< BitType, LongArray > output = ArrayImgs.bits( reducedDimensions );

		final RandomAccessibleInterval< BitType > source = Views.zeroMin( mask );
		final Cursor< BitType > cursor = output.localizingCursor();
		while ( cursor.hasNext() )
		{
			cursor.fwd();
			boolean anyValid = false;
			for ( final BitType valid : Views.interval( source, blockInterval( source, factor, cursor.getLongPosition( 0 ) + TRIM, cursor.getLongPosition( 1 ) + TRIM ) ) )
				anyValid |= valid.get();
			cursor.get().set( anyValid );
		}
		return output;
	}

	static long[] reducedDimensions( final RandomAccessibleInterval< ? > image, final int factor )
	{
		ImageChecks.checkNonEmpty( image, "Image" );
		if ( factor <= 0 )
			throw new IllegalArgumentException( "Downsample factor should be positive, got " + factor );

		final long[] dimensions = new long[ 2 ];
		for ( int d = 0; d < 2; ++d )
		{
			dimensions[ d ] = ( image.dimension( d ) + factor - 1 ) / factor - 2 * TRIM;
			if ( dimensions[ d ] <= 0 )
				throw new IllegalArgumentException( "Downsample factor " + factor + " is too large for an image of size " +
						image.dimension( 0 ) + "x" + image.dimension( 1 ) + ": nothing is left after trimming the border" );
		}
		return dimensions;
	}

	/**
	 * In-bounds part of a reduction block, the zero-padded part is left out.
	 */
	private static Interval blockInterval( final Dimensions image, final int factor, final long blockX, final long blockY )
	{
		final long[] min = new long[] { blockX * factor, blockY * factor };
		final long[] max = new long[ 2 ];
		for ( int d = 0; d < 2; ++d )
			max[ d ] = Math.min( min[ d ] + factor, image.dimension( d ) ) - 1;
		return new FinalInterval( min, max );
	}
}
