package mhcbatch.predict;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import org.apache.log4j.Logger;

/*
 * Process-wide defaults read once from mhcbatch.properties (classpath first, then the working
 * directory). A ToolSpec copies these values when the caller does not set them explicitly.
 */
public final class PredictorSettings {

	static final String FILE_NAME = "mhcbatch.properties";

	public static final int DEFAULT_MAX_RECORDS_PER_FILE = 10000;
	public static final int DEFAULT_PROCESS_LIMIT = -1;
	public static final long DEFAULT_POLLING_INTERVAL = 1000L;
	public static final int DEFAULT_BATCH_THREADS = 1;

	private static Logger logger = PredictionLogger.getLogger();

	private static int maxRecordsPerFile = DEFAULT_MAX_RECORDS_PER_FILE;
	private static int processLimit = DEFAULT_PROCESS_LIMIT;
	private static long pollingInterval = DEFAULT_POLLING_INTERVAL;
	private static int batchThreads = DEFAULT_BATCH_THREADS;
	private static boolean showStderr = false;
	private static File workDir = null;

	static {
		load();
	}

	private PredictorSettings(){}

	static void load(){

		Properties props = new Properties();
		InputStream in = null;

		try {
			in = PredictorSettings.class.getClassLoader().getResourceAsStream( FILE_NAME );
			if( in == null && new File( FILE_NAME ).isFile()){
				in = new FileInputStream( FILE_NAME );
			}

			if( in == null ){
				logger.info( "No " + FILE_NAME + " found, using built-in defaults." );
				return;
			}

			props.load( in );
			apply( props );
			logger.info( "Loaded settings. Max records per file: " + maxRecordsPerFile + ", process limit: " + processLimit );

		} catch( IOException e ){
			logger.error( "Error loading " + FILE_NAME + ". Make sure that it is in the classpath and that the properties are correctly labeled.", e );

		} finally {
			if( in != null ){
				try {
					in.close();

				} catch( IOException e ){
					logger.warn( "Unable to close " + FILE_NAME + ": " + e.getMessage());
				}
			}
		}
	}

	static void apply( Properties props ){

		maxRecordsPerFile = intProperty( props, "maxrecordsperfile", maxRecordsPerFile );
		processLimit = intProperty( props, "processlimit", processLimit );
		batchThreads = Math.max( 1, intProperty( props, "batchthreads", batchThreads ));

		String tmp = props.getProperty( "pollinginterval" );
		if( tmp != null ){
			try {
				pollingInterval = Long.parseLong( tmp.trim());

			} catch( NumberFormatException e ){
				logger.error( "Ignoring pollinginterval=" + tmp + ", not a number." );
			}
		}

		if( props.containsKey( "showstderr" )){
			showStderr = Boolean.parseBoolean( props.getProperty( "showstderr" ).trim());
		}

		tmp = props.getProperty( "workdir" );
		if( tmp != null && tmp.trim().length() > 0 ){
			workDir = new File( tmp.trim());
		}
	}

	private static int intProperty( Properties props, String key, int fallback ){
		String value = props.getProperty( key );
		if( value == null ){
			return fallback;
		}

		try {
			return Integer.parseInt( value.trim());

		} catch( NumberFormatException e ){
			logger.error( "Ignoring " + key + "=" + value + ", not a number." );
			return fallback;
		}
	}

	public static int getMaxRecordsPerFile(){
		return maxRecordsPerFile;
	}

	public static int getProcessLimit(){
		return processLimit;
	}

	public static long getPollingInterval(){
		return pollingInterval;
	}

	public static int getBatchThreads(){
		return batchThreads;
	}

	public static boolean isShowStderr(){
		return showStderr;
	}

	// null means java.io.tmpdir
	public static File getWorkDir(){
		return workDir;
	}
}
