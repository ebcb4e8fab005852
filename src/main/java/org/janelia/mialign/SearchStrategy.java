package org.janelia.mialign;

/**
 * Coarse search policy of an alignment: how much of the offset range is excluded at the borders of the coarsest level,
 * and how the starting hypotheses are picked from its score surface.
 */
public class SearchStrategy
{
	public static final int DEFAULT_BORDER = 10;

	private final int border;
	private final CandidateSelector selector;

	public SearchStrategy( final int border, final CandidateSelector selector )
	{
		if ( border < 0 )
			throw new IllegalArgumentException( "Border should be non-negative, got " + border );
		if ( selector == null )
			throw new IllegalArgumentException( "Candidate selector is null" );

		this.border = border;
		this.selector = selector;
	}

	public int getBorder() { return border; }
	public CandidateSelector getSelector() { return selector; }

	@Override
	public String toString()
	{
		return "border=" + border + ", selector=" + selector;
	}
}
