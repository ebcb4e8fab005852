package org.janelia.mialign;

import java.util.Arrays;

import net.imglib2.Dimensions;
import net.imglib2.util.Intervals;

/**
 * Argument checks for caller misuse. Violations are reported with {@link IllegalArgumentException}
 * instead of degrading silently to a zero score.
 */
public class ImageChecks
{
	public static void checkTwoDimensional( final Dimensions image, final String name )
	{
		if ( image == null )
			throw new IllegalArgumentException( name + " is null" );
		if ( image.numDimensions() != 2 )
			throw new IllegalArgumentException( name + " should be 2D, got " + image.numDimensions() + " dimensions" );
	}

	public static void checkNonEmpty( final Dimensions image, final String name )
	{
		checkTwoDimensional( image, name );
		for ( int d = 0; d < image.numDimensions(); ++d )
			if ( image.dimension( d ) <= 0 )
				throw new IllegalArgumentException( name + " has zero size: " + Arrays.toString( Intervals.dimensionsAsLongArray( image ) ) );
	}

	public static void checkSameDimensions( final Dimensions first, final Dimensions second, final String description )
	{
		if ( !Arrays.equals( Intervals.dimensionsAsLongArray( first ), Intervals.dimensionsAsLongArray( second ) ) )
			throw new IllegalArgumentException( description + " have different dimensions: " +
					Arrays.toString( Intervals.dimensionsAsLongArray( first ) ) + " and " +
					Arrays.toString( Intervals.dimensionsAsLongArray( second ) ) );
	}

	public static void checkDownsampleFactors( final int[] factors )
	{
		if ( factors == null || factors.length == 0 )
			throw new IllegalArgumentException( "Downsample schedule is empty" );

		for ( int k = 0; k < factors.length; ++k )
		{
			if ( factors[ k ] <= 0 )
				throw new IllegalArgumentException( "Downsample factors should be positive, got " + Arrays.toString( factors ) );
			if ( k > 0 && factors[ k ] >= factors[ k - 1 ] )
				throw new IllegalArgumentException( "Downsample factors should be strictly decreasing, got " + Arrays.toString( factors ) );
		}
	}
}
