package org.janelia.mialign;

import java.util.Collections;
import java.util.List;

/**
 * Single hypothesis at the minimum of the Gaussian-Laplace filtered score surface.
 * Peaks of the mutual information turn into minima of the filtered surface, while broad plateaus and slopes are flattened.
 */
public class LaplacianMinimumSelector implements CandidateSelector
{
	public static final double DEFAULT_SIGMA = 1.0;

	private final double sigma;

	public LaplacianMinimumSelector()
	{
		this( DEFAULT_SIGMA );
	}

	public LaplacianMinimumSelector( final double sigma )
	{
		this.sigma = sigma;
	}

	public double getSigma() { return sigma; }

	@Override
	public List< Offset > select( final ScoreSurface surface )
	{
		return Collections.singletonList( surface.extremum( LaplacianOfGaussian.filter( surface.getScores(), sigma ), false ).getOffset() );
	}

	@Override
	public String toString()
	{
		return "laplacian minimum (sigma=" + sigma + ")";
	}
}
