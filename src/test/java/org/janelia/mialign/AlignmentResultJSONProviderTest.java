package org.janelia.mialign;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.Arrays;

import org.junit.Assert;
import org.junit.Test;

public class AlignmentResultJSONProviderTest
{
	@Test
	public void testSaveAndLoad() throws IOException
	{
		final AlignmentResult result = new AlignmentResult(
				new Offset( -5, 3 ),
				2.25,
				Arrays.asList( new ScoredOffset( new Offset( -5, 3 ), 2.25 ), new ScoredOffset( new Offset( 12, -40 ), 0.5 ) ) );

		final StringWriter writer = new StringWriter();
		AlignmentResultJSONProvider.saveResult( result, writer );
		Assert.assertTrue( writer.toString().contains( "\"hypotheses\"" ) );

		final AlignmentResult loaded = AlignmentResultJSONProvider.loadResult( new StringReader( writer.toString() ) );
		Assert.assertEquals( result.getOffset(), loaded.getOffset() );
		Assert.assertEquals( result.getScore(), loaded.getScore(), 0 );
		Assert.assertEquals( 2, loaded.getHypotheses().size() );
		Assert.assertEquals( new Offset( 12, -40 ), loaded.getHypotheses().get( 1 ).getOffset() );
		Assert.assertEquals( 0.5, loaded.getHypotheses().get( 1 ).getScore(), 0 );
	}
}
