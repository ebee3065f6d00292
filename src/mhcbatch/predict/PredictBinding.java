/*
 * PredictBinding is the command-line entry point of mhcbatch. It runs one external MHC binding
 * predictor over one or more input files (tab delimited id/sequence, or one peptide per line with
 * -peptides) and writes a {file}.predictions.tsv table for each of them.
 *
 * Every input file becomes its own Quartz job; see PredictionBatch.
 */

package mhcbatch.predict;

import java.io.File;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;

public class PredictBinding {

	static Logger log4j = PredictionLogger.getLogger();

	static final String USAGE = "Usage: mhcbatch.predict.PredictBinding file [file...] -program= -alleles= [-lengths=] [-format=] [-co=] [-max=] [-list=] [-out=] [-threads=] [-peptides]";

	public static void main( String[] args ){
		System.exit( run( args ));
	}

	/** Runs the batch described by the command line, returns the exit status. */
	static int run( String[] args ){

		if( args.length == 0 ){
			System.err.println( USAGE );
			return 1;
		}

		if( args[0].equals( "--examples" )){
			System.out.println( "example usage (all opts):" );
			System.out.println( "java -cp ~args~ mhcbatch.predict.PredictBinding proteins.tsv -program=netMHCpan -alleles=HLA-A*02:01,HLA-B*07:02 -lengths=8-10 -format=netmhcpan28 -co=4 -max=5000 -list=-listMHC -out=results" );
			return 0;
		}

		List<File> inputs = new ArrayList<File>();
		StringBuffer options = new StringBuffer();

		for( int i = 0; i < args.length; i++ ){
			if( args[i].startsWith( "-" )){
				options.append( args[i] ).append( " " );

			} else {
				inputs.add( new File( args[i] ));
			}

		} options.append( " " ); // one terminal space to match on for the last option.

		String arg = options.toString();
		String program = option( arg, "-program=" );
		String alleles = option( arg, "-alleles=" );

		if( inputs.isEmpty() || program == null || alleles == null ){
			System.err.println( USAGE );
			return 1;
		}

		for( File input : inputs ){
			if( !input.isFile()){
				System.err.println( "Input file: " + input + " does not exist" );
				return 1;
			}
		}

		PredictionBatch batch = new PredictionBatch( program, PredictionJob.split( alleles ));
		batch.setPeptideMode( arg.indexOf( "-peptides " ) != -1 );
		batch.setFormat( option( arg, "-format=" ));
		batch.setSupportedAllelesFlag( option( arg, "-list=" ));

		try {
			String tmp = option( arg, "-lengths=" );
			if( tmp != null ){
				parseLengths( tmp );
				batch.setLengths( tmp );
			}

			if(( tmp = option( arg, "-co=" )) != null ){
				batch.setProcessLimit( Integer.valueOf( tmp ));
			}

			if(( tmp = option( arg, "-max=" )) != null ){
				batch.setMaxRecordsPerFile( Integer.valueOf( tmp ));
			}

			if(( tmp = option( arg, "-threads=" )) != null ){
				batch.setThreadCount( Integer.parseInt( tmp ));
			}

		} catch( NumberFormatException e ){
			System.err.println( "Not a number: " + e.getMessage());
			System.err.println( USAGE );
			return 1;
		}

		String outputdir = option( arg, "-out=" );
		if( outputdir != null ){
			File f = new File( outputdir );
			if( !f.isDirectory()){
				System.err.println( "Output directory: " + outputdir + " does not exist" );
				System.err.println( "-------------------------------------------------" );
				return 1;
			}

			batch.setOutputDir( f );
		}

		log4j.info( "Using predictor: " + program + " for alleles " + alleles );
		log4j.info( "Using source file(s): " + inputs );

		try {
			int failed = batch.run( inputs );
			if( failed > 0 ){
				System.err.println( failed + " of " + inputs.size() + " input file(s) failed; see the log for details" );
				return 2;
			}

			return 0;

		} catch( PredictionException e ){
			log4j.error( "Error occurred at " + PredictionLogger.getTime(), e );
			System.err.println( e.getMessage());
			return 2;
		}
	}

	// value of "-name=value", or null.
	static String option( String arg, String name ){
		int at = arg.indexOf( name );
		if( at == -1 ){
			return null;
		}

		String value = arg.substring( at + name.length(), arg.indexOf( " ", at ));
		return( value.length() == 0 ? null : value );
	}

	/**
	 * Peptide lengths written as {@code 9}, {@code 8,9,11} or {@code 8-10}; null or blank for the
	 * predictor's defaults.
	 */
	public static List<Integer> parseLengths( String spec ){

		Set<Integer> lengths = new LinkedHashSet<Integer>();
		if( spec == null || spec.trim().length() == 0 ){
			return new ArrayList<Integer>( lengths );
		}

		for( String part : spec.split( "," )){
			part = part.trim();
			int dash = part.indexOf( '-', 1 );

			if( dash == -1 ){
				lengths.add( Integer.valueOf( part ));
				continue;
			}

			int from = Integer.parseInt( part.substring( 0, dash ).trim());
			int to = Integer.parseInt( part.substring( dash + 1 ).trim());
			if( from > to ){
				throw new NumberFormatException( "empty length range " + part );
			}

			for( int length = from; length <= to; length++ ){
				lengths.add( length );
			}
		}

		return new ArrayList<Integer>( lengths );
	}
}
