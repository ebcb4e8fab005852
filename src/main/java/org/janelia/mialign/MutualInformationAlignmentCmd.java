package org.janelia.mialign;

import java.io.FileWriter;
import java.io.IOException;

import org.apache.log4j.Logger;
import org.janelia.util.ImageImporter;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.logic.BitType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.util.Pair;
import net.imglib2.view.IntervalView;

/**
 * Aligns a pair of images from the command line and optionally stores the result and the aligned crops.
 */
public class MutualInformationAlignmentCmd
{
	private static final Logger LOG = Logger.getLogger( MutualInformationAlignmentCmd.class );

	public static void main( final String[] args )
	{
		final int exitCode = execute( args );
		if ( exitCode != 0 )
			System.exit( exitCode );
	}

	/**
	 * Parses the arguments and runs the alignment.
	 *
	 * @return 0 on success, 1 if the arguments could not be parsed, 2 if the alignment was aborted
	 */
	public static int execute( final String[] args )
	{
		final MutualInformationAlignmentArguments alignmentArgs;
		try
		{
			alignmentArgs = new MutualInformationAlignmentArguments( args );
		}
		catch ( final IllegalArgumentException e )
		{
			System.err.println( e.getMessage() );
			return 1;
		}
		if ( !alignmentArgs.parsedSuccessfully() )
			return 1;

		try
		{
			new MutualInformationAlignmentCmd( alignmentArgs ).run();
			return 0;
		}
		catch ( final IOException | IllegalArgumentException e )
		{
			System.out.println( "Aborted: " + e.getMessage() );
			e.printStackTrace();
			return 2;
		}
	}

	private final MutualInformationAlignmentArguments args;

	public MutualInformationAlignmentCmd( final MutualInformationAlignmentArguments args )
	{
		this.args = args;
	}

	public AlignmentResult run() throws IOException
	{
		final ArrayImg< DoubleType, DoubleArray > image1 = ImageImporter.openImage( args.image1Path() );
		final ArrayImg< DoubleType, DoubleArray > image2 = ImageImporter.openImage( args.image2Path() );

		RandomAccessibleInterval< BitType > mask1 = args.mask1Path() != null ? ImageImporter.openMask( args.mask1Path() ) : null;
		RandomAccessibleInterval< BitType > mask2 = args.mask2Path() != null ? ImageImporter.openMask( args.mask2Path() ) : null;

		final long[] edgeMargin = args.edgeMargin();
		if ( edgeMargin != null )
		{
			mask1 = EdgeMask.create( image1, edgeMargin[ 0 ], edgeMargin[ 1 ] );
			mask2 = EdgeMask.create( image2, edgeMargin[ 0 ], edgeMargin[ 1 ] );
		}

		final AlignmentParameters parameters = args.createParameters();
		LOG.info( "Aligning " + args.image1Path() + " and " + args.image2Path() + " with " + parameters );

		final AlignmentResult result = new MutualInformationAligner( parameters ).align( image1, image2, mask1, mask2 );
		System.out.println( "Offset: " + result.getOffset() + ", mutual information: " + result.getScore() );

		if ( args.outputJsonPath() != null )
		{
			AlignmentResultJSONProvider.saveResult( result, new FileWriter( args.outputJsonPath() ) );
			System.out.println( "Saved the alignment result to " + args.outputJsonPath() );
		}

		if ( args.outputCropsPrefix() != null )
		{
			final Pair< IntervalView< DoubleType >, IntervalView< DoubleType > > crops = AlignedCrop.crop( image1, image2, result.getOffset() );
			ImageImporter.saveAsTiff( crops.getA(), args.outputCropsPrefix() + "-1.tif" );
			ImageImporter.saveAsTiff( crops.getB(), args.outputCropsPrefix() + "-2.tif" );
			System.out.println( "Saved the aligned crops to " + args.outputCropsPrefix() + "-{1,2}.tif" );
		}

		return result;
	}
}
