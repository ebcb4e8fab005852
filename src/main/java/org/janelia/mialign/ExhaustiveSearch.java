package org.janelia.mialign;

import org.apache.log4j.Logger;

/**
 * Scores every integer offset within the extent of a (coarse) pyramid level.
 *
 * The evaluated range is i in [-H + border, H - border), j in [-W + border, W - border), where H and W are the
 * dimensions of the first image. The cost is quadratic in the number of pixels, so it should only run at the coarsest level.
 */
public class ExhaustiveSearch
{
	private static final Logger LOG = Logger.getLogger( ExhaustiveSearch.class );

	public static ScoreSurface searchAll( final PyramidLevel level, final int border )
	{
		if ( border < 0 )
			throw new IllegalArgumentException( "Border should be non-negative, got " + border );

		final long width = level.getImage1().dimension( OverlapGeometry.DIM_J );
		final long height = level.getImage1().dimension( OverlapGeometry.DIM_I );
		if ( width <= border || height <= border )
			throw new IllegalArgumentException( "Level " + level + " is too small for the border of " + border + " px, nothing is left to search" );

		final ScoreSurface surface = new ScoreSurface( -width + border, width - border, -height + border, height - border );
		int numEvaluated = 0;
		for ( long i = -height + border; i < height - border; ++i )
		{
			for ( long j = -width + border; j < width - border; ++j )
			{
				final Offset offset = new Offset( j, i );
				if ( MutualInformation.hasValidOverlap( level, offset ) )
				{
					surface.set( offset, MutualInformation.score( level, offset ) );
					++numEvaluated;
				}
			}
		}

		LOG.debug( "Exhaustive search at " + level + ": evaluated " + numEvaluated + " of " + surface.getWidth() * surface.getHeight() + " offsets" );
		return surface;
	}
}
