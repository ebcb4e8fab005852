package org.janelia.mialign;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.log4j.Logger;
import org.janelia.histogram.HistogramEqualization;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.LongArray;
import net.imglib2.type.logic.BitType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.util.Intervals;

/**
 * Coarse-to-fine search for the integer translation that maximizes the mutual information of two images.
 *
 * Both images are histogram-equalized first. At the coarsest pyramid level every offset is scored and the search
 * strategy picks one or more starting hypotheses. Each hypothesis is rescaled to the next finer level and refined by
 * {@link HillClimbing} starting from the zero-offset score of that level. The final climb at full resolution starts from
 * the hypothesis' own score, so every reported hypothesis carries the mutual information of its offset.
 * The best refined hypothesis wins (the first one if several have the same score).
 *
 * The aligner does not keep any state between calls and never modifies the input images.
 */
public class MutualInformationAligner
{
	private static final Logger LOG = Logger.getLogger( MutualInformationAligner.class );

	private final SearchStrategy strategy;
	private final int[] downsampleFactors;

	public MutualInformationAligner( final AlignmentParameters parameters )
	{
		this( parameters.createStrategy(), parameters.getDownsampleFactors() );
	}

	public MutualInformationAligner( final SearchStrategy strategy, final int... downsampleFactors )
	{
		if ( strategy == null )
			throw new IllegalArgumentException( "Search strategy is null" );
		ImageChecks.checkDownsampleFactors( downsampleFactors );

		this.strategy = strategy;
		this.downsampleFactors = downsampleFactors.clone();
	}

	public SearchStrategy getStrategy() { return strategy; }
	public int[] getDownsampleFactors() { return downsampleFactors.clone(); }

	public static < T extends RealType< T >, U extends RealType< U > > AlignmentResult align(
			final RandomAccessibleInterval< T > image1,
			final RandomAccessibleInterval< U > image2,
			final RandomAccessibleInterval< BitType > mask1,
			final RandomAccessibleInterval< BitType > mask2,
			final int[] downsampleFactors,
			final AlignmentVariant variant )
	{
		return new MutualInformationAligner( variant.createStrategy(), downsampleFactors ).align( image1, image2, mask1, mask2 );
	}

	public < T extends RealType< T >, U extends RealType< U > > AlignmentResult align(
			final RandomAccessibleInterval< T > image1,
			final RandomAccessibleInterval< U > image2 )
	{
		return align( image1, image2, null, null );
	}

	/**
	 * @param mask1 valid pixels of the first image, or null if all of them are valid
	 * @param mask2 valid pixels of the second image, or null if all of them are valid
	 */
	public < T extends RealType< T >, U extends RealType< U > > AlignmentResult align(
			final RandomAccessibleInterval< T > image1,
			final RandomAccessibleInterval< U > image2,
			final RandomAccessibleInterval< BitType > mask1,
			final RandomAccessibleInterval< BitType > mask2 )
	{
		final PyramidLevel fullResolution = fullResolutionLevel( image1, image2, mask1, mask2 );

		final PyramidLevel[] levels = new PyramidLevel[ downsampleFactors.length ];
		final double[] baselineScores = new double[ downsampleFactors.length ];
		for ( int n = 0; n < downsampleFactors.length; ++n )
		{
			levels[ n ] = Pyramid.level(
					downsampleFactors[ n ],
					fullResolution.getImage1(),
					fullResolution.getImage2(),
					fullResolution.getMask1(),
					fullResolution.getMask2() );
			if ( n > 0 )
				baselineScores[ n ] = levels[ n ].baselineScore();
		}

		final ScoreSurface surface = ExhaustiveSearch.searchAll( levels[ 0 ], strategy.getBorder() );
		final List< Offset > candidates = strategy.getSelector().select( surface );
		LOG.debug( "Coarse search (" + strategy + ") at " + levels[ 0 ] + " selected " + candidates );

		final List< ScoredOffset > hypotheses = new ArrayList<>();
		ScoredOffset best = null;
		for ( final Offset candidate : candidates )
		{
			Offset offset = candidate;
			for ( int n = 1; n < levels.length; ++n )
			{
				offset = offset.scale( downsampleFactors[ n - 1 ] / downsampleFactors[ n ] );
				offset = HillClimbing.climb( levels[ n ], offset, baselineScores[ n ] ).getOffset();
			}
			offset = offset.scale( downsampleFactors[ downsampleFactors.length - 1 ] );

			final ScoredOffset refined = HillClimbing.climb( fullResolution, offset, MutualInformation.score( fullResolution, offset ) );
			LOG.debug( "Hypothesis " + candidate + " refined to " + refined );
			hypotheses.add( refined );
			best = best == null ? refined : best.best( refined );
		}

		LOG.info( "Aligned images of size " + Arrays.toString( Intervals.dimensionsAsLongArray( image1 ) ) + " and " +
				Arrays.toString( Intervals.dimensionsAsLongArray( image2 ) ) + ": offset " + best.getOffset() + ", mutual information " + best.getScore() );

		return new AlignmentResult( best.getOffset(), best.getScore(), hypotheses );
	}

	/**
	 * Validates the inputs and creates the full resolution working level: equalized images and the masks (all valid where null).
	 */
	public static < T extends RealType< T >, U extends RealType< U > > PyramidLevel fullResolutionLevel(
			final RandomAccessibleInterval< T > image1,
			final RandomAccessibleInterval< U > image2,
			final RandomAccessibleInterval< BitType > mask1,
			final RandomAccessibleInterval< BitType > mask2 )
	{
		ImageChecks.checkNonEmpty( image1, "First image" );
		ImageChecks.checkNonEmpty( image2, "Second image" );

		return new PyramidLevel(
				1,
				HistogramEqualization.equalize( image1 ),
				HistogramEqualization.equalize( image2 ),
				mask1 != null ? mask1 : allValid( image1 ),
				mask2 != null ? mask2 : allValid( image2 ) );
	}

	static ArrayImg< BitType, LongArray > allValid( final RandomAccessibleInterval< ? > image )
	{
		final ArrayImg< BitType, LongArray > mask = ArrayImgs.bits( Intervals.dimensionsAsLongArray( image ) );
		for ( final BitType valid : mask )
			valid.set( true );
		return mask;
	}
}
