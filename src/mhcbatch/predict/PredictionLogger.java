package mhcbatch.predict;

import java.text.SimpleDateFormat;
import java.util.Calendar;

import org.apache.log4j.Logger;

public final class PredictionLogger {

	public static final String NAME = "mhcbatch.predict";

	private PredictionLogger(){}

	public static Logger getLogger(){
		return Logger.getLogger( NAME );
	}

	public synchronized static String getTime(){
		SimpleDateFormat fmt = new SimpleDateFormat();
		fmt.setCalendar(Calendar.getInstance());
		fmt.applyPattern("MMddyy-HHmmss");
		return fmt.format( fmt.getCalendar().getTime());
	}

	public static void logDebug( Logger logger, String debug, String runId ){
		if( logger.isDebugEnabled()){
			logger.debug( format( debug, runId ));
		}
	}

	public static void logInfo( Logger logger, String info, String runId ){
		logger.info( format( info, runId ));
	}

	public static void logWarn( Logger logger, String warning, String runId ){
		logger.warn( format( warning, runId ));
	}

	public static void logError( Logger logger, String error, String runId ){
		logger.error( format( error, runId ));
	}

	public static void logError( Logger logger, String error, String runId, Throwable cause ){
		logger.error( format( error, runId ), cause );
	}

	static String format( String message, String runId ){
		return new StringBuffer(( runId == null ? "" : "Id: ".concat( runId ).concat( " " ))).append( "time: " ).append(
				getTime()).append( " " ).append( message ).toString();
	}
}
