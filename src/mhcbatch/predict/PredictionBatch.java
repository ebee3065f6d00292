package mhcbatch.predict;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Date;
import java.util.Hashtable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;
import org.quartz.JobDetail;
import org.quartz.JobExecutionContext;
import org.quartz.JobExecutionException;
import org.quartz.JobListener;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.SimpleTrigger;
import org.quartz.impl.StdSchedulerFactory;

/**
 * Runs one predictor over many input files, one Quartz job ({@link PredictionJob}) per file, and
 * waits until every job has reported back.
 *
 * <p>The scheduler's worker pool defaults to a single thread: every job already runs up to the
 * predictor's process limit in parallel, and more workers would multiply that bound.
 */
public class PredictionBatch implements JobListener {

	private static Logger logger = PredictionLogger.getLogger();

	private static final AtomicInteger instances = new AtomicInteger();

	private final String programName;
	private final List<String> alleles;
	private String format;
	private String lengths;
	private Integer processLimit;
	private Integer maxRecordsPerFile;
	private String supportedAllelesFlag;
	private File outputDir;
	private boolean peptideMode = false;
	private int threadCount = PredictorSettings.getBatchThreads();
	private long pollingInterval = PredictorSettings.getPollingInterval();

	// job name -> error message, or "" when the job succeeded.
	private final Hashtable<String,String> outcomes = new Hashtable<String,String>();

	public PredictionBatch( String programName, List<String> alleles ){
		this.programName = programName;
		this.alleles = new ArrayList<String>( alleles );
	}

	public void setFormat( String format ){
		this.format = format;
	}

	public void setLengths( String lengths ){
		this.lengths = lengths;
	}

	public void setProcessLimit( Integer processLimit ){
		this.processLimit = processLimit;
	}

	public void setMaxRecordsPerFile( Integer maxRecordsPerFile ){
		this.maxRecordsPerFile = maxRecordsPerFile;
	}

	public void setSupportedAllelesFlag( String flag ){
		this.supportedAllelesFlag = flag;
	}

	public void setOutputDir( File outputDir ){
		this.outputDir = outputDir;
	}

	public void setPeptideMode( boolean peptideMode ){
		this.peptideMode = peptideMode;
	}

	public void setThreadCount( int threadCount ){
		this.threadCount = Math.max( 1, threadCount );
	}

	public void setPollingInterval( long pollingInterval ){
		this.pollingInterval = pollingInterval;
	}

	/** Error message per failed job, keyed by job name. Empty after a clean run. */
	public Map<String,String> getFailures(){
		Map<String,String> failures = new LinkedHashMap<String,String>();
		synchronized( outcomes ){
			for( Map.Entry<String,String> entry : outcomes.entrySet()){
				if( entry.getValue().length() > 0 ){
					failures.put( entry.getKey(), entry.getValue());
				}
			}
		}

		return failures;
	}

	/**
	 * Schedules one job per input file and blocks until all of them have run. Returns the number
	 * of jobs that failed.
	 */
	public int run( List<File> inputs ) throws PredictionException {

		outcomes.clear();
		if( inputs.isEmpty()){
			return 0;
		}

		Scheduler sched = null;
		try {
			sched = new StdSchedulerFactory( schedulerProperties()).getScheduler();
			sched.addGlobalJobListener( this );

			List<String> names = new ArrayList<String>();
			for( int m = 0; m < inputs.size(); m++ ){
				File input = inputs.get( m );
				String name = new StringBuffer( "predict_" ).append( m ).append( '_' ).append( input.getName()).toString();

				JobDetail job = new JobDetail( name, null, PredictionJob.class );
				job.getJobDataMap().put( PredictionJob.ID, name );
				job.getJobDataMap().put( PredictionJob.INPUT, input.getPath());
				job.getJobDataMap().put( PredictionJob.OUTPUT, PredictionWriter.outputFile( input, outputDir ).getPath());
				job.getJobDataMap().put( PredictionJob.PROGRAM, programName );
				job.getJobDataMap().put( PredictionJob.ALLELES, StringUtils.join( alleles, "," ));
				job.getJobDataMap().put( PredictionJob.PEPTIDES, String.valueOf( peptideMode ));
				putIfSet( job, PredictionJob.FORMAT, format );
				putIfSet( job, PredictionJob.LENGTHS, lengths );
				putIfSet( job, PredictionJob.PROCESS_LIMIT, processLimit );
				putIfSet( job, PredictionJob.MAX_RECORDS, maxRecordsPerFile );
				putIfSet( job, PredictionJob.LIST_FLAG, supportedAllelesFlag );

				SimpleTrigger trigger = new SimpleTrigger( "t".concat( name ), null, new Date(), null, 0, 0L );
				sched.scheduleJob( job, trigger );
				names.add( name );
			}

			logger.info( "Scheduled " + names.size() + " prediction job(s) on " + threadCount + " thread(s)" );
			sched.start();

			while( outcomes.size() < names.size()){
				Thread.sleep( pollingInterval );
			}

		} catch( SchedulerException e ){
			throw new PredictionException( "Unable to schedule prediction jobs: " + e.getMessage(), e );

		} catch( InterruptedException e ){
			Thread.currentThread().interrupt();
			throw new PredictionException( "Interrupted while waiting for prediction jobs", e );

		} finally {
			shutdown( sched );
		}

		Map<String,String> failures = getFailures();
		for( Map.Entry<String,String> entry : failures.entrySet()){
			logger.error( entry.getKey() + " failed: " + entry.getValue());
		}

		logger.info(( inputs.size() - failures.size()) + " of " + inputs.size() + " job(s) succeeded" );
		return failures.size();
	}

	private Properties schedulerProperties(){
		Properties props = new Properties();
		props.setProperty( "org.quartz.scheduler.instanceName", "mhcbatch_" + instances.incrementAndGet());
		props.setProperty( "org.quartz.scheduler.skipUpdateCheck", "true" );
		props.setProperty( "org.quartz.threadPool.class", "org.quartz.simpl.SimpleThreadPool" );
		props.setProperty( "org.quartz.threadPool.threadCount", String.valueOf( threadCount ));
		props.setProperty( "org.quartz.jobStore.class", "org.quartz.simpl.RAMJobStore" );
		return props;
	}

	private static void putIfSet( JobDetail job, String key, Object value ){
		if( value != null ){
			job.getJobDataMap().put( key, String.valueOf( value ));
		}
	}

	private static void shutdown( Scheduler sched ){
		if( sched == null ){
			return;
		}

		try {
			sched.shutdown( true );

		} catch( SchedulerException e ){
			logger.warn( "Unable to shut the scheduler down cleanly: " + e.getMessage());
		}
	}

	public String getName(){
		return "mhcbatch.predict.PredictionBatch";
	}

	public void jobToBeExecuted( JobExecutionContext context ){
		PredictionLogger.logDebug( logger, "Starting", context.getJobDetail().getName());
	}

	public void jobExecutionVetoed( JobExecutionContext context ){
		outcomes.put( context.getJobDetail().getName(), "vetoed" );
	}

	public void jobWasExecuted( JobExecutionContext context, JobExecutionException jobException ){
		String message = "";
		if( jobException != null ){
			Throwable cause = ( jobException.getCause() == null ? jobException : jobException.getCause());
			message = String.valueOf( cause.getMessage());
		}

		outcomes.put( context.getJobDetail().getName(), message );
	}

	/**
	 * Reads {@code id<TAB>sequence} lines, in file order. Blank lines are skipped.
	 */
	public static Map<String,String> readSequences( File file ) throws IOException, ConfigurationException {

		Map<String,String> sequences = new LinkedHashMap<String,String>();
		int lineNumber = 0;

		for( String line : FileUtils.readLines( file, StandardCharsets.UTF_8 )){
			lineNumber++;
			if( StringUtils.isBlank( line )){
				continue;
			}

			String[] fields = line.split( "\t" );
			if( fields.length != 2 || StringUtils.isBlank( fields[0] ) || StringUtils.isBlank( fields[1] )){
				throw new ConfigurationException( file + ":" + lineNumber + ": expect a 2 column line with format: sequence-name\\tsequence" );
			}

			String id = fields[0].trim();
			if( sequences.containsKey( id )){
				throw new ConfigurationException( file + ":" + lineNumber + ": duplicate sequence name " + id );
			}

			sequences.put( id, fields[1].trim().toUpperCase());
		}

		return sequences;
	}

	/** One peptide per line; blank lines are skipped. */
	public static List<String> readPeptides( File file ) throws IOException {

		List<String> peptides = new ArrayList<String>();
		for( String line : FileUtils.readLines( file, StandardCharsets.UTF_8 )){
			if( StringUtils.isNotBlank( line )){
				peptides.add( line.trim().toUpperCase());
			}
		}

		return peptides;
	}
}
