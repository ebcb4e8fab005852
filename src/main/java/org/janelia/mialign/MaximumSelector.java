package org.janelia.mialign;

import java.util.Collections;
import java.util.List;

/**
 * Single hypothesis at the maximum of the score surface.
 */
public class MaximumSelector implements CandidateSelector
{
	@Override
	public List< Offset > select( final ScoreSurface surface )
	{
		return Collections.singletonList( surface.maximum().getOffset() );
	}

	@Override
	public String toString()
	{
		return "maximum";
	}
}
