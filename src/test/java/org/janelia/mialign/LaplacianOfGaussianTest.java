package org.janelia.mialign;

import org.junit.Assert;
import org.junit.Test;

import net.imglib2.RandomAccess;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.real.DoubleType;

public class LaplacianOfGaussianTest
{
	private static final double EPSILON = 1e-12;

	@Test
	public void testKernels()
	{
		final double[] gaussian = LaplacianOfGaussian.halfKernel( 1, 0 );
		Assert.assertEquals( 5, gaussian.length );
		Assert.assertEquals( 9, LaplacianOfGaussian.halfKernel( 2, 0 ).length );

		double sum = gaussian[ 0 ];
		for ( int x = 1; x < gaussian.length; ++x )
			sum += 2 * gaussian[ x ];
		Assert.assertEquals( 1, sum, EPSILON );

		final double[] secondDerivative = LaplacianOfGaussian.halfKernel( 1, 2 );
		Assert.assertEquals( -gaussian[ 0 ], secondDerivative[ 0 ], EPSILON );
		Assert.assertEquals( 0, secondDerivative[ 1 ], EPSILON );
		Assert.assertEquals( 3 * gaussian[ 2 ], secondDerivative[ 2 ], EPSILON );
	}

	@Test
	public void testImpulseResponse()
	{
		final ArrayImg< DoubleType, DoubleArray > impulse = ArrayImgs.doubles( 21, 21 );
		final RandomAccess< DoubleType > randomAccess = impulse.randomAccess();
		randomAccess.setPosition( new long[] { 10, 10 } );
		randomAccess.get().set( 1 );

		final ArrayImg< DoubleType, DoubleArray > filtered = LaplacianOfGaussian.filter( impulse, 1 );
		final double g0 = LaplacianOfGaussian.halfKernel( 1, 0 )[ 0 ];
		final double g1 = LaplacianOfGaussian.halfKernel( 1, 0 )[ 1 ];
		Assert.assertEquals( -2 * g0 * g0, valueAt( filtered, 10, 10 ), EPSILON );
		Assert.assertEquals( -g0 * g1, valueAt( filtered, 11, 10 ), EPSILON );
		Assert.assertEquals( -g0 * g1, valueAt( filtered, 10, 9 ), EPSILON );
		Assert.assertEquals( 0, valueAt( filtered, 0, 0 ), EPSILON );

		final ScoreSurface surface = new ScoreSurface( 0, 21, 0, 21 );
		Assert.assertEquals( new Offset( 10, 10 ), surface.extremum( filtered, false ).getOffset() );
	}

	@Test
	public void testMirroredBoundary()
	{
		// an impulse at the corner is mirrored with the edge value repeated, the response sees it four times
		final ArrayImg< DoubleType, DoubleArray > impulse = ArrayImgs.doubles( 15, 15 );
		final RandomAccess< DoubleType > randomAccess = impulse.randomAccess();
		randomAccess.setPosition( new long[] { 0, 0 } );
		randomAccess.get().set( 1 );

		final double[] g = LaplacianOfGaussian.halfKernel( 1, 0 );
		final double[] d2 = LaplacianOfGaussian.halfKernel( 1, 2 );
		final double expected = 2 * ( d2[ 0 ] + d2[ 1 ] ) * ( g[ 0 ] + g[ 1 ] );
		Assert.assertEquals( expected, valueAt( LaplacianOfGaussian.filter( impulse, 1 ), 0, 0 ), EPSILON );
	}

	@Test
	public void testConvolveMirrorsBoundary()
	{
		final ArrayImg< DoubleType, DoubleArray > row = ArrayImgs.doubles( new double[] { 1, 2, 3 }, 3, 1 );
		final ArrayImg< DoubleType, DoubleArray > convolved = LaplacianOfGaussian.convolve( row, new double[] { 0.5, 0.25 }, 0 );
		Assert.assertArrayEquals( new double[] { 1.25, 2, 2.75 }, convolved.update( null ).getCurrentStorageArray(), EPSILON );

		// a single row is its own mirror image
		Assert.assertArrayEquals( new double[] { 1, 2, 3 }, LaplacianOfGaussian.convolve( row, new double[] { 0.5, 0.25 }, 1 ).update( null ).getCurrentStorageArray(), EPSILON );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testNonPositiveSigma()
	{
		LaplacianOfGaussian.filter( ArrayImgs.doubles( 5, 5 ), 0 );
	}

	private static double valueAt( final ArrayImg< DoubleType, DoubleArray > image, final long x, final long y )
	{
		final RandomAccess< DoubleType > randomAccess = image.randomAccess();
		randomAccess.setPosition( new long[] { x, y } );
		return randomAccess.get().get();
	}
}
