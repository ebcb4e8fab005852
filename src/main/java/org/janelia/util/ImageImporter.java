package org.janelia.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Arrays;

import ij.IJ;
import ij.ImagePlus;
import ij.process.FloatProcessor;
import net.imglib2.Cursor;
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
 * Reads and writes single-plane 2D images through ImageJ. Color images are reduced to their intensity.
 */
public class ImageImporter
{
	public static ArrayImg< DoubleType, DoubleArray > openImage( final String path ) throws IOException
	{
		final FloatProcessor processor = openPlane( path );
		final float[] pixels = ( float[] ) processor.getPixels();
		final double[] values = new double[ pixels.length ];
		for ( int k = 0; k < pixels.length; ++k )
			values[ k ] = pixels[ k ];
		return ArrayImgs.doubles( values, processor.getWidth(), processor.getHeight() );
	}

	/**
	 * Opens a mask image where non-zero pixels are valid.
	 */
	public static ArrayImg< BitType, LongArray > openMask( final String path ) throws IOException
	{
		final FloatProcessor processor = openPlane( path );
		final float[] pixels = ( float[] ) processor.getPixels();
		final ArrayImg< BitType, LongArray > mask = ArrayImgs.bits( processor.getWidth(), processor.getHeight() );
		final Cursor< BitType > cursor = mask.cursor();
		for ( int k = 0; k < pixels.length; ++k )
			cursor.next().set( pixels[ k ] != 0 );
		return mask;
	}

	public static < T extends RealType< T > > void saveAsTiff( final RandomAccessibleInterval< T > image, final String path ) throws IOException
	{
		final int width = ( int ) image.dimension( 0 ), height = ( int ) image.dimension( 1 );
		final float[] pixels = new float[ width * height ];
		int k = 0;
		for ( final T type : Views.flatIterable( image ) )
			pixels[ k++ ] = type.getRealFloat();

		final ImagePlus imp = new ImagePlus( path, new FloatProcessor( width, height, pixels ) );
		if ( !IJ.saveAsTiff( imp, path ) )
			throw new IOException( "Cannot save image to " + path );
	}

	private static FloatProcessor openPlane( final String path ) throws IOException
	{
		if ( !Files.exists( Paths.get( path ) ) )
			throw new IOException( "Image does not exist: " + path );

		final ImagePlus imp = IJ.openImage( path );
		if ( imp == null )
			throw new IOException( "Cannot open image " + path );
		if ( imp.getStackSize() != 1 )
			throw new IllegalArgumentException( "Expected a single 2D plane but " + path + " has dimensions " + Arrays.toString( imp.getDimensions() ) );

		System.out.println( "Opened " + path + " of size " + imp.getWidth() + "x" + imp.getHeight() );
		return imp.getProcessor().convertToFloatProcessor();
	}
}
