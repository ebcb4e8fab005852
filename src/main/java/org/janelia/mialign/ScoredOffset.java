package org.janelia.mialign;

import java.io.Serializable;

/**
 * An offset together with the mutual information measured at it.
 */
public final class ScoredOffset implements Serializable
{
	private static final long serialVersionUID = -6181402360813375521L;

	private final Offset offset;
	private final double score;

	public ScoredOffset( final Offset offset, final double score )
	{
		this.offset = offset;
		this.score = score;
	}

	public Offset getOffset() { return offset; }
	public double getScore() { return score; }

	/**
	 * Returns this if its score is at least as high as the other's, so the first of equally scored offsets wins.
	 */
	public ScoredOffset best( final ScoredOffset other )
	{
		return other == null || score >= other.score ? this : other;
	}

	@Override
	public String toString()
	{
		return offset + ": " + score;
	}
}
