package org.janelia.mialign;

import org.apache.log4j.Logger;

/**
 * Strict-ascent local search for the offset with the highest mutual information.
 *
 * Every step scores the 3x3 neighborhood of the current offset, including the offset itself, and moves to the
 * highest-scoring cell if it is strictly better than the best score so far (the first one in row-major order on ties).
 * The zero offset is never scored because the starting best score is taken from it.
 * The search stops when a step does not move, there is no escape from local maxima and no iteration cap.
 */
public class HillClimbing
{
	private static final Logger LOG = Logger.getLogger( HillClimbing.class );

	public static ScoredOffset climb( final PyramidLevel level, final Offset start, final double startScore )
	{
		Offset current = start;
		double best = startScore;
		int numSteps = 0;

		while ( true )
		{
			final Offset last = current;
			for ( long i = last.getI() - 1; i <= last.getI() + 1; ++i )
			{
				for ( long j = last.getJ() - 1; j <= last.getJ() + 1; ++j )
				{
					if ( i == 0 && j == 0 )
						continue;

					final Offset candidate = new Offset( j, i );
					final double score = MutualInformation.score( level, candidate );
					if ( score > best )
					{
						best = score;
						current = candidate;
					}
				}
			}

			if ( current.equals( last ) )
			{
				LOG.debug( "Hill climbing at " + level + ": " + start + " -> " + current + " in " + numSteps + " steps, score " + best );
				return new ScoredOffset( current, best );
			}
			++numSteps;
		}
	}
}
