package mhcbatch.predict;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.apache.commons.lang3.CharUtils;
import org.apache.log4j.Logger;

/*
 * Splits sequences (FASTA records) or bare peptides into input files of bounded size.
 *
 * Several predictors truncate record identifiers, so every FASTA record is written under a short
 * key of at most 15 characters: the sanitized original key cut down to leave room for "_" and the
 * record's 0-based position in the whole input, which keeps the short keys unique.
 */
public final class SequencePartitioner {

	public static final int MAX_KEY_LENGTH = 15;

	private static Logger logger = PredictionLogger.getLogger();

	private SequencePartitioner(){}

	public static String shortKey( String originalKey, int index ){

		String unique = String.valueOf( index );
		StringBuffer sanitized = new StringBuffer();
		String key = String.valueOf( originalKey );

		for( int i = 0; i < key.length(); i++ ){
			char c = key.charAt( i );
			sanitized.append(( CharUtils.isAsciiAlphanumeric( c ) ? c : '_' ));
		}

		int room = Math.max( 0, ( MAX_KEY_LENGTH - 1 ) - unique.length());
		if( sanitized.length() > room ){
			sanitized.setLength( room );
		}

		return sanitized.append( '_' ).append( unique ).toString();
	}

	/**
	 * Writes the sequences as FASTA records, at most {@code maxRecordsPerFile} per file
	 * (zero or negative for a single file). Chunks come back in input order.
	 */
	public static List<InputChunk> partitionSequences( Map<String,String> sequences, int maxRecordsPerFile, File dir ) throws IOException {

		List<InputChunk> chunks = new ArrayList<InputChunk>();
		if( sequences.isEmpty()){
			return chunks;
		}

		int perFile = ( maxRecordsPerFile <= 0 ? sequences.size() : maxRecordsPerFile );
		Map<String,String> keyMap = new LinkedHashMap<String,String>();
		Writer writer = null;
		File current = null;
		int partition = 0, inFile = 0, index = 0;

		try {

			for( Map.Entry<String,String> entry : sequences.entrySet()){

				if( index % perFile == 0 ){
//
// wrap up the current chunk before opening the next one.
					if( writer != null ){
						writer.close();
						writer = null;
						chunks.add( new InputChunk( current, inFile, null, keyMap ));
						keyMap = new LinkedHashMap<String,String>();
						partition++;
					}

					current = createInputFile( partition, "", ".fa", dir );
					writer = open( current );
					inFile = 0;
				}

				String key = shortKey( entry.getKey(), index );
				keyMap.put( key, entry.getKey());

				if( inFile > 0 ){
					writer.write( '\n' );
				}

				writer.write( '>' );
				writer.write( key );
				writer.write( '\n' );
				writer.write( entry.getValue());

				inFile++;
				index++;
			}

			writer.close();
			writer = null;
			chunks.add( new InputChunk( current, inFile, null, keyMap ));
			current = null;

		} catch( IOException e ){
			closeQuietly( writer );
			writer = null;
			discard( chunks, current );
			throw e;

		} finally {
			closeQuietly( writer );
		}

		logger.debug( "Wrote " + index + " sequences into " + chunks.size() + " FASTA file(s)" );
		return chunks;
	}

	/**
	 * Writes one peptide per line, optionally with one group of files per peptide length.
	 */
	public static List<InputChunk> partitionPeptides( List<String> peptides, int maxRecordsPerFile, boolean groupByLength, File dir ) throws IOException {

		Map<Integer,List<String>> groups = new TreeMap<Integer,List<String>>();
		if( groupByLength ){
			for( String peptide : peptides ){
				List<String> group = groups.get( peptide.length());
				if( group == null ){
					group = new ArrayList<String>();
					groups.put( peptide.length(), group );
				}

				group.add( peptide );
			}

		} else if( !peptides.isEmpty()){
			groups.put( -1, peptides );
		}

		List<InputChunk> chunks = new ArrayList<InputChunk>();
		Map<String,String> none = new LinkedHashMap<String,String>();

		Writer writer = null;
		File current = null;

		try {

			for( Map.Entry<Integer,List<String>> entry : groups.entrySet()){

				List<String> group = entry.getValue();
				Integer length = ( entry.getKey() < 0 ? null : entry.getKey());
				String name = ( length == null ? "" : String.valueOf( length ));
				int perFile = ( maxRecordsPerFile <= 0 ? group.size() : maxRecordsPerFile );
				int inFile = 0;

				for( int i = 0; i < group.size(); i++ ){

					if( i % perFile == 0 ){
						if( writer != null ){
							writer.close();
							writer = null;
							chunks.add( new InputChunk( current, inFile, length, none ));
						}

						current = createInputFile( i / perFile, name, ".txt", dir );
						writer = open( current );
						inFile = 0;

					} else {
						writer.write( '\n' );
					}

					writer.write( group.get( i ));
					inFile++;
				}

				if( writer != null ){
					writer.close();
					writer = null;
					chunks.add( new InputChunk( current, inFile, length, none ));
					current = null;
				}
			}

		} catch( IOException e ){
			closeQuietly( writer );
			writer = null;
			discard( chunks, current );
			throw e;

		} finally {
			closeQuietly( writer );
		}

		logger.debug( "Wrote " + peptides.size() + " peptides into " + chunks.size() + " file(s)" );
		return chunks;
	}

	public static Map<String,String> combinedKeyMap( List<InputChunk> chunks ){
		Map<String,String> combined = new LinkedHashMap<String,String>();
		for( InputChunk chunk : chunks ){
			combined.putAll( chunk.getKeyMap());
		}

		return combined;
	}

	private static File createInputFile( int number, String name, String suffix, File dir ) throws IOException {
		return File.createTempFile( new StringBuffer( "input_file_" ).append( number ).append( '_' ).append( name ).toString(), suffix, dir );
	}

	private static Writer open( File file ) throws IOException {
		return new BufferedWriter( new OutputStreamWriter( new FileOutputStream( file, false ), "UTF-8" ));
	}

	private static void closeQuietly( Writer writer ){
		if( writer == null ){
			return;
		}

		try {
			writer.close();

		} catch( IOException e ){
			logger.warn( "Unable to close input file: " + e.getMessage());
		}
	}

	// the caller never sees these files, so they are removed here.
	private static void discard( List<InputChunk> chunks, File current ){
		List<File> files = new ArrayList<File>();
		for( InputChunk chunk : chunks ){
			files.add( chunk.getFile());
		}

		if( current != null ){
			files.add( current );
		}

		CleanupFiles cleanup = new CleanupFiles( files, null, null );
		cleanup.close();
	}
}
