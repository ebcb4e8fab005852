package org.janelia.mialign;

import java.util.List;

/**
 * Picks the starting offsets for the coarse-to-fine refinement from the score surface of the coarsest level.
 */
public interface CandidateSelector
{
	/**
	 * @return starting offsets in the order of preference, never empty
	 */
	List< Offset > select( ScoreSurface surface );
}
