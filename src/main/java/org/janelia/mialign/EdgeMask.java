package org.janelia.mialign;

import net.imglib2.Cursor;
import net.imglib2.Dimensions;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.LongArray;
import net.imglib2.type.logic.BitType;

/**
 * Validity masks that exclude a fixed margin along the image border.
 */
public class EdgeMask
{
	/**
	 * @param marginX number of excluded columns on the left and on the right
	 * @param marginY number of excluded rows at the top and at the bottom
	 * @return mask that is false within the margins and true inside
	 */
	public static ArrayImg< BitType, LongArray > create( final Dimensions dimensions, final long marginX, final long marginY )
	{
		ImageChecks.checkTwoDimensional( dimensions, "Mask" );
		if ( marginX < 0 || marginY < 0 )
			throw new IllegalArgumentException( "Margins should be non-negative, got " + marginX + " and " + marginY );

		final long width = dimensions.dimension( 0 ), height = dimensions.dimension( 1 );
		final ArrayImg< BitType, LongArray > mask = ArrayImgs.bits( width, height );
		final Cursor< BitType > cursor = mask.localizingCursor();
		while ( cursor.hasNext() )
		{
			cursor.fwd();
			final long x = cursor.getLongPosition( 0 ), y = cursor.getLongPosition( 1 );
			cursor.get().set( x >= marginX && x < width - marginX && y >= marginY && y < height - marginY );
		}
		return mask;
	}
}
