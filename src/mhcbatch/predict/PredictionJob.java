package mhcbatch.predict;

import java.io.File;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;
import org.quartz.Job;
import org.quartz.JobDataMap;
import org.quartz.JobExecutionContext;
import org.quartz.JobExecutionException;

public class PredictionJob implements Job {

	private static Logger logger = PredictionLogger.getLogger();

	static final String ID = "id";
	static final String INPUT = "input";
	static final String OUTPUT = "output";
	static final String PROGRAM = "program";
	static final String FORMAT = "format";
	static final String ALLELES = "alleles";
	static final String LENGTHS = "lengths";
	static final String PROCESS_LIMIT = "processlimit";
	static final String MAX_RECORDS = "maxrecords";
	static final String LIST_FLAG = "listflag";
	static final String PEPTIDES = "peptides";

	// netMHC 3.x or 4.0, told apart by the help screen.
	static final String AUTO_FORMAT = "auto";

//
// there is a single prediction job for every input file. the job runs
// the predictor over the whole file and writes one table of records.
	public void execute( JobExecutionContext cntxt ) throws JobExecutionException {

		JobDataMap map = cntxt.getJobDetail().getJobDataMap();
		String id = map.getString( ID );
		long start = System.currentTimeMillis();

		try {

			File input = new File( map.getString( INPUT ));
			File output = new File( map.getString( OUTPUT ));
			boolean peptideMode = Boolean.parseBoolean( map.getString( PEPTIDES ));

			PredictionLogger.logInfo( logger, "Predicting " + input + " with " + map.getString( PROGRAM ), id );

			CommandLinePredictor predictor = new CommandLinePredictor( toolSpec( map ), split( map.getString( ALLELES )));
			RunResult result;

			if( peptideMode ){
				result = predictor.predictPeptides( PredictionBatch.readPeptides( input ));

			} else {
				Map<String,String> sequences = PredictionBatch.readSequences( input );
				result = predictor.predictSubsequences( sequences, PredictBinding.parseLengths( map.getString( LENGTHS )));
			}

			if( result.isEmpty()){
				PredictionLogger.logWarn( logger, "No peptides to predict in " + input, id );
			}

			PredictionWriter.write( result, output );
			PredictionLogger.logInfo( logger, new StringBuffer( "Wrote " ).append( result.size()).append( " records to " ).append(
					output ).append( " in " ).append(( System.currentTimeMillis() - start ) / 1000.0 ).append( " s" ).toString(), id );

		} catch( Exception e ){
			PredictionLogger.logError( logger, "Prediction failed: " + e.getMessage(), id, e );
			throw new JobExecutionException( e, false );
		}
	}

	static ToolSpec toolSpec( JobDataMap map ) throws PredictionException {

		String program = map.getString( PROGRAM );
		String format = map.getString( FORMAT );
		ParserSpec layout;

		if( format == null ){
			layout = ParserSpecs.NETMHCPAN28;

		} else if( format.equalsIgnoreCase( AUTO_FORMAT )){
			layout = ToolVersionDetector.detectNetMhc( program );

		} else {
			try {
				layout = ParserSpecs.forName( format );

			} catch( IllegalArgumentException e ){
				throw new ConfigurationException( e.getMessage());
			}
		}

		ToolSpec.Builder builder = ToolSpec.builder( program ).parserSpec( layout );

		if( map.getString( PROCESS_LIMIT ) != null ){
			builder.processLimit( Integer.parseInt( map.getString( PROCESS_LIMIT )));
		}

		if( map.getString( MAX_RECORDS ) != null ){
			builder.maxRecordsPerFile( Integer.parseInt( map.getString( MAX_RECORDS )));
		}

		if( map.getString( LIST_FLAG ) != null ){
			builder.supportedAllelesFlag( map.getString( LIST_FLAG ));
		}

		return builder.build();
	}

	static List<String> split( String commaSeparated ){
		return Arrays.asList(( commaSeparated == null ? new String[0] : commaSeparated.split( "," )));
	}
}
