package org.janelia.mialign;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Stores and loads alignment results in JSON format.
 */
public class AlignmentResultJSONProvider
{
	public static AlignmentResult loadResult( final Reader reader ) throws IOException
	{
		try ( final Reader closeableReader = reader )
		{
			return createGson().fromJson( closeableReader, AlignmentResult.class );
		}
	}

	public static void saveResult( final AlignmentResult result, final Writer writer ) throws IOException
	{
		try ( final Writer closeableWriter = writer )
		{
			closeableWriter.write( createGson().toJson( result ) );
		}
	}

	private static Gson createGson()
	{
		return new GsonBuilder()
				.setPrettyPrinting()
				.serializeSpecialFloatingPointValues()
				.create();
	}
}
