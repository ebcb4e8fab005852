package org.janelia.mialign;

import org.apache.log4j.Logger;

import net.imglib2.Cursor;
import net.imglib2.RandomAccess;
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
 * Single-resolution alignment for images that are already roughly aligned: climbs from the zero offset at full resolution.
 *
 * Images of different sizes are zero-padded to the common size first, padded pixels are excluded by the masks.
 * No histogram equalization and no pyramid are involved.
 */
public class LocalMutualInformationAligner
{
	private static final Logger LOG = Logger.getLogger( LocalMutualInformationAligner.class );

	public static < T extends RealType< T >, U extends RealType< U > > ScoredOffset align(
			final RandomAccessibleInterval< T > image1,
			final RandomAccessibleInterval< U > image2,
			final RandomAccessibleInterval< BitType > mask1,
			final RandomAccessibleInterval< BitType > mask2 )
	{
		ImageChecks.checkNonEmpty( image1, "First image" );
		ImageChecks.checkNonEmpty( image2, "Second image" );
		if ( mask1 != null )
			ImageChecks.checkSameDimensions( image1, mask1, "First image and mask" );
		if ( mask2 != null )
			ImageChecks.checkSameDimensions( image2, mask2, "Second image and mask" );

		final long[] commonDimensions = new long[ 2 ];
		for ( int d = 0; d < 2; ++d )
			commonDimensions[ d ] = Math.max( image1.dimension( d ), image2.dimension( d ) );

		final PyramidLevel level = new PyramidLevel(
				1,
				padImage( image1, commonDimensions ),
				padImage( image2, commonDimensions ),
				padMask( mask1 != null ? mask1 : MutualInformationAligner.allValid( image1 ), commonDimensions ),
				padMask( mask2 != null ? mask2 : MutualInformationAligner.allValid( image2 ), commonDimensions ) );

		final ScoredOffset result = HillClimbing.climb( level, Offset.ZERO, level.baselineScore() );
		LOG.info( "Local alignment: offset " + result.getOffset() + ", mutual information " + result.getScore() );
		return result;
	}

	static < T extends RealType< T > > ArrayImg< DoubleType, DoubleArray > padImage( final RandomAccessibleInterval< T > image, final long[] dimensions )
	{
		final ArrayImg< DoubleType, DoubleArray > padded = ArrayImgs.doubles( dimensions );
		final Cursor< T > cursor = Views.flatIterable( Views.zeroMin( image ) ).localizingCursor();
		final RandomAccess< DoubleType > randomAccess = padded.randomAccess();
		while ( cursor.hasNext() )
		{
			cursor.fwd();
			randomAccess.setPosition( cursor );
			randomAccess.get().set( cursor.get().getRealDouble() );
		}
		return padded;
	}

	static ArrayImg< BitType, LongArray > padMask( final RandomAccessibleInterval< BitType > mask, final long[] dimensions )
	{
		final ArrayImg< BitType, LongArray > padded = ArrayImgs.bits( dimensions );
		final Cursor< BitType > cursor = Views.flatIterable( Views.zeroMin( mask ) ).localizingCursor();
		final RandomAccess< BitType > randomAccess = padded.randomAccess();
		while ( cursor.hasNext() )
		{
			cursor.fwd();
			randomAccess.setPosition( cursor );
			randomAccess.get().set( cursor.get().get() );
		}
		return padded;
	}
}
