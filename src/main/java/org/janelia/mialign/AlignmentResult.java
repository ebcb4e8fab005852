package org.janelia.mialign;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Final offset and score of an alignment, along with the refined result of every starting hypothesis.
 */
public final class AlignmentResult implements Serializable
{
	private static final long serialVersionUID = 8852170234659164015L;

	private final Offset offset;
	private final double score;
	private final List< ScoredOffset > hypotheses;

	public AlignmentResult( final Offset offset, final double score, final List< ScoredOffset > hypotheses )
	{
		this.offset = offset;
		this.score = score;
		this.hypotheses = Collections.unmodifiableList( new ArrayList<>( hypotheses ) );
	}

	public Offset getOffset() { return offset; }
	public double getScore() { return score; }
	public List< ScoredOffset > getHypotheses() { return hypotheses; }

	@Override
	public String toString()
	{
		return "offset=" + offset + ", score=" + score + ", hypotheses=" + hypotheses.size();
	}
}
