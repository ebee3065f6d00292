package mhcbatch.predict;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;

/*
 * Flat tab-separated dump of a run, one record per line, header first. Absent values are written
 * as empty fields.
 */
public final class PredictionWriter {

	public static final String SUFFIX = ".predictions.tsv";

	public static final String HEADER = "source_sequence_key\toffset\tpeptide\tallele\taffinity\tscore\tpercentile_rank\tmethod";

	private PredictionWriter(){}

	/** {@code dir/name.predictions.tsv}, next to the input when no directory is given. */
	public static File outputFile( File input, File dir ){
		File parent = ( dir == null ? input.getAbsoluteFile().getParentFile() : dir );
		return new File( parent, input.getName().concat( SUFFIX ));
	}

	public static void write( RunResult result, File file ) throws IOException {

		Writer writer = null;
		try {
			writer = new BufferedWriter( new OutputStreamWriter( new FileOutputStream( file, false ), "UTF-8" ));
			writer.write( HEADER );
			writer.write( '\n' );

			for( PredictionRecord record : result ){
				writer.write( format( record ));
				writer.write( '\n' );
			}

		} finally {
			if( writer != null ){
				writer.close();
			}
		}
	}

	static String format( PredictionRecord record ){
		return new StringBuffer( value( record.getSourceSequenceKey())).append( '\t' ).append(
				record.getOffset()).append( '\t' ).append(
				record.getPeptide()).append( '\t' ).append(
				record.getAllele()).append( '\t' ).append(
				value( record.getAffinity())).append( '\t' ).append(
				value( record.getScore())).append( '\t' ).append(
				value( record.getPercentileRank())).append( '\t' ).append(
				record.getMethodName()).toString();
	}

	private static String value( Object o ){
		return( o == null ? "" : String.valueOf( o ));
	}
}
