package mhcbatch.predict;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.apache.commons.io.IOUtils;
import org.apache.log4j.Logger;

/*
 * Runs a single command in the foreground: the probes a predictor makes before its first batch.
 */
public final class CommandRunner {

	private static Logger logger = PredictionLogger.getLogger();

	private CommandRunner(){}

	public static void runCommand( List<String> argv ) throws PredictionException {

		String program = argv.get( 0 );
		long start = System.currentTimeMillis();

		ProcessBuilder builder = new ProcessBuilder( argv );
		builder.redirectOutput( ProcessBuilder.Redirect.DISCARD );
		builder.redirectError( ProcessBuilder.Redirect.DISCARD );

		try {
			Process proc = builder.start();
			int exitCode = proc.waitFor();
			if( exitCode != 0 ){
				throw new ProcessFailureException( program, exitCode );
			}

		} catch( IOException e ){
			throw new ProcessFailureException( program, e );

		} catch( InterruptedException e ){
			Thread.currentThread().interrupt();
			throw new PredictionException( "Interrupted while running " + program, e );
		}

		logger.info( String.format( "%s took %.4f seconds", program, ( System.currentTimeMillis() - start ) / 1000.0 ));
	}

	/** Runs the command and returns everything it printed on stdout. */
	public static String captureOutput( List<String> argv ) throws PredictionException {

		String program = argv.get( 0 );
		ProcessBuilder builder = new ProcessBuilder( argv );
		builder.redirectError( ProcessBuilder.Redirect.DISCARD );

		Process proc = null;
		InputStream out = null;

		try {
			proc = builder.start();
			out = proc.getInputStream();
			String output = IOUtils.toString( out, StandardCharsets.UTF_8 );

			int exitCode = proc.waitFor();
			if( exitCode != 0 ){
				throw new ProcessFailureException( program, exitCode );
			}

			return output;

		} catch( IOException e ){
			throw new ProcessFailureException( program, e );

		} catch( InterruptedException e ){
			Thread.currentThread().interrupt();
			throw new PredictionException( "Interrupted while running " + program, e );

		} finally {
			if( out != null ){
				try {
					out.close();

				} catch( IOException e ){
					logger.warn( "Unable to close output of " + program + ": " + e.getMessage());
				}
			}
		}
	}
}
