package org.janelia.mialign;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.util.Pair;
import net.imglib2.util.ValuePair;
import net.imglib2.view.IntervalView;

/**
 * Crops two full resolution images to their common region under an alignment offset.
 */
public class AlignedCrop
{
	/**
	 * @return zero-min views of the aligned regions of the first and the second image, both of the same size
	 */
	public static < A, B > Pair< IntervalView< A >, IntervalView< B > > crop(
			final RandomAccessibleInterval< A > image1,
			final RandomAccessibleInterval< B > image2,
			final Offset offset )
	{
		final Pair< IntervalView< B >, IntervalView< A > > crops = OverlapGeometry.overlap( image2, image1, offset );
		return new ValuePair<>( crops.getB(), crops.getA() );
	}
}
