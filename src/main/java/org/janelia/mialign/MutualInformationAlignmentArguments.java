package org.janelia.mialign;

import java.io.Serializable;

import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;

/**
 * Command line arguments parser for aligning a pair of images.
 */
public class MutualInformationAlignmentArguments implements Serializable
{
	private static final long serialVersionUID = 1620451387262290741L;

	@Option(name = "-i1", aliases = { "--image1" }, required = true,
			usage = "Path to the first (reference) image")
	private String image1Path;

	@Option(name = "-i2", aliases = { "--image2" }, required = true,
			usage = "Path to the second image")
	private String image2Path;

	@Option(name = "--mask1", required = false,
			usage = "Path to the validity mask of the first image (non-zero pixels are valid). All pixels are valid if omitted.")
	private String mask1Path = null;

	@Option(name = "--mask2", required = false,
			usage = "Path to the validity mask of the second image (non-zero pixels are valid). All pixels are valid if omitted.")
	private String mask2Path = null;

	@Option(name = "--edgeMargin", required = false,
			usage = "Exclude a border of this many pixels from both images when no masks are given, e.g. '20,10' for X,Y")
	private String edgeMargin = null;

	@Option(name = "-d", aliases = { "--downsampling" }, required = false,
			usage = "Strictly decreasing downsampling factors of the resolution pyramid, the first one is used for the exhaustive search")
	private String downsampleFactors = "16,8,4,2";

	@Option(name = "-v", aliases = { "--variant" }, required = false,
			usage = "Coarse search variant: 'single-peak', 'laplacian-peak', or 'multi-hypothesis'")
	private String variantStr = "multi-hypothesis";

	@Option(name = "--border", required = false,
			usage = "Border (in pixels of the coarsest level) excluded from the exhaustive search range of the laplacian variants")
	private int border = SearchStrategy.DEFAULT_BORDER;

	@Option(name = "--sigma", required = false,
			usage = "Sigma of the Gaussian-Laplace filter applied to the coarse scores")
	private double sigma = LaplacianMinimumSelector.DEFAULT_SIGMA;

	@Option(name = "--blocks", required = false,
			usage = "Number of blocks per axis used to pick the hypotheses")
	private int blocksPerAxis = LaplacianBlockMinimaSelector.DEFAULT_BLOCKS_PER_AXIS;

	@Option(name = "--hypotheses", required = false,
			usage = "Number of hypotheses refined by the multi-hypothesis variant")
	private int numHypotheses = LaplacianBlockMinimaSelector.DEFAULT_NUM_HYPOTHESES;

	@Option(name = "-o", aliases = { "--outputCrops" }, required = false,
			usage = "Output path prefix for the aligned crops of both images (saved as <prefix>-1.tif and <prefix>-2.tif)")
	private String outputCropsPrefix = null;

	@Option(name = "--json", required = false,
			usage = "Output path for the alignment result in JSON format")
	private String outputJsonPath = null;

	private boolean parsedSuccessfully = false;

	public MutualInformationAlignmentArguments( final String[] args ) throws IllegalArgumentException
	{
		final CmdLineParser parser = new CmdLineParser( this );
		try {
			parser.parseArgument( args );
			parsedSuccessfully = true;
		} catch ( final CmdLineException e ) {
			System.err.println( e.getMessage() );
			parser.printUsage( System.err );
		}

		if ( parsedSuccessfully )
		{
			if ( edgeMargin != null && ( mask1Path != null || mask2Path != null ) )
				throw new IllegalArgumentException( "Please specify either the masks or the edge margin" );

			if ( edgeMargin != null && parseArray( edgeMargin ).length != 2 )
				throw new IllegalArgumentException( "Edge margin should be specified as 'x,y', got '" + edgeMargin + "'" );

			// fail early on invalid values
			createParameters().createStrategy();
		}
	}

	protected MutualInformationAlignmentArguments() { }

	public boolean parsedSuccessfully() { return parsedSuccessfully; }

	public String image1Path() { return image1Path; }
	public String image2Path() { return image2Path; }
	public String mask1Path() { return mask1Path; }
	public String mask2Path() { return mask2Path; }
	public String outputCropsPrefix() { return outputCropsPrefix; }
	public String outputJsonPath() { return outputJsonPath; }

	public long[] edgeMargin()
	{
		if ( edgeMargin == null )
			return null;

		final int[] values = parseArray( edgeMargin );
		return new long[] { values[ 0 ], values[ 1 ] };
	}

	public AlignmentParameters createParameters()
	{
		return new AlignmentParameters()
				.setDownsampleFactors( parseArray( downsampleFactors ) )
				.setVariant( AlignmentVariant.fromString( variantStr ) )
				.setBorder( border )
				.setSigma( sigma )
				.setBlocksPerAxis( blocksPerAxis )
				.setNumHypotheses( numHypotheses );
	}

	private int[] parseArray( final String str )
	{
		final String[] tokens = str.split( "," );
		final int[] values = new int[ tokens.length ];
		for ( int i = 0; i < values.length; i++ )
			values[ i ] = Integer.parseInt( tokens[ i ].trim() );
		return values;
	}
}
