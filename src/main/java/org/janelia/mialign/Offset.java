package org.janelia.mialign;

import java.io.Serializable;

/**
 * Integer translation of the second image's coordinate grid relative to the first one.
 * {@code j} is the horizontal (column, dimension 0) component, {@code i} is the vertical (row, dimension 1) component.
 * Pixel (x, y) of the second image corresponds to pixel (x + j, y + i) of the first image.
 */
public final class Offset implements Serializable
{
	private static final long serialVersionUID = 2783145470962305112L;

	public static final Offset ZERO = new Offset( 0, 0 );

	private final long j, i;

	public Offset( final long j, final long i )
	{
		this.j = j;
		this.i = i;
	}

	public long getJ() { return j; }
	public long getI() { return i; }

	public boolean isZero()
	{
		return j == 0 && i == 0;
	}

	public Offset scale( final long factor )
	{
		return new Offset( j * factor, i * factor );
	}

	@Override
	public boolean equals( final Object obj )
	{
		if ( this == obj )
			return true;
		if ( !( obj instanceof Offset ) )
			return false;
		final Offset other = ( Offset ) obj;
		return j == other.j && i == other.i;
	}

	@Override
	public int hashCode()
	{
		return 31 * Long.hashCode( j ) + Long.hashCode( i );
	}

	@Override
	public String toString()
	{
		return String.format( "(j=%d,i=%d)", j, i );
	}
}
