package mhcbatch.predict;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import org.apache.log4j.Logger;

/**
 * Runs a batch of invocations as child processes, each writing its stdout to its own output file,
 * with at most a fixed number of them alive at once.
 *
 * <p>The limit is read as: {@code 0} no limit, negative one process per available processor,
 * {@code N > 0} at most N. When the active set is full the scheduler polls it at a fixed interval,
 * reaps whatever has exited and then starts the next command.
 *
 * <p>Fail fast: the first non-zero exit code (or a process that cannot be started) stops any
 * further process from being started. Processes that are already running are waited on, not
 * killed, and then the failure is raised. There is no timeout; a hung tool blocks the batch.
 */
public class ProcessScheduler {

	private static Logger logger = PredictionLogger.getLogger();

	private final long pollingInterval;
	private final boolean showStderr;
	private int peakConcurrency = 0;

	public ProcessScheduler(){
		this( PredictorSettings.getPollingInterval(), PredictorSettings.isShowStderr());
	}

	public ProcessScheduler( long pollingInterval, boolean showStderr ){
		if( pollingInterval <= 0 ){
			throw new IllegalArgumentException( "Polling interval must be positive: " + pollingInterval );
		}

		this.pollingInterval = pollingInterval;
		this.showStderr = showStderr;
	}

	public static int resolveLimit( int concurrencyLimit, int commandCount ){
		if( concurrencyLimit == 0 ){
			return Math.max( 1, commandCount );
		}

		if( concurrencyLimit < 0 ){
			return Math.max( 1, Runtime.getRuntime().availableProcessors());
		}

		return concurrencyLimit;
	}

	/** Largest number of processes that were alive together during the last {@link #runAll}. */
	public synchronized int getPeakConcurrency(){
		return peakConcurrency;
	}

	public void runAll( List<Invocation> invocations, int concurrencyLimit ) throws PredictionException {

		if( invocations.isEmpty()){
			return;
		}

		int capacity = resolveLimit( concurrencyLimit, invocations.size());
		long start = System.currentTimeMillis();
		List<Running> active = new ArrayList<Running>( capacity );
		ProcessFailureException failure = null;
		boolean interrupted = false;

		synchronized( this ){
			peakConcurrency = 0;
		}

		logger.debug( "Running " + invocations.size() + " commands, at most " + capacity + " at a time" );

		try {

			for( Invocation invocation : invocations ){

				while( failure == null && active.size() >= capacity ){
					failure = reap( active );
					if( failure == null && active.size() >= capacity ){
						Thread.sleep( pollingInterval );
					}
				}

				if( failure != null ){
					break;
				}

				try {
					active.add( new Running( invocation, start( invocation )));
					synchronized( this ){
						peakConcurrency = Math.max( peakConcurrency, active.size());
					}

				} catch( IOException e ){
					failure = new ProcessFailureException( invocation.getProgram(), e );
				}
			}

		} catch( InterruptedException e ){
			interrupted = true;
		}

//
// wait for whatever is still running, even after a failure.
		for( Running running : active ){
			while( true ){
				try {
					int exitCode = running.process.waitFor();
					ProcessFailureException f = check( running, exitCode );
					if( failure == null ){
						failure = f;
					}
					break;

				} catch( InterruptedException e ){
					interrupted = true;
				}
			}
		}

		active.clear();

		if( interrupted ){
			Thread.currentThread().interrupt();
			throw new PredictionException( "Interrupted while running " + invocations.get( 0 ).getProgram());
		}

		if( failure != null ){
			logger.error( failure.getMessage());
			throw failure;
		}

		logger.info( String.format( "Ran %d commands in %.4f seconds", invocations.size(), ( System.currentTimeMillis() - start ) / 1000.0 ));
	}

	private Process start( Invocation invocation ) throws IOException {

		logger.debug( "Running: " + invocation.getCommandLine());

		ProcessBuilder builder = new ProcessBuilder( invocation.getArgv());
		builder.redirectOutput( ProcessBuilder.Redirect.to( invocation.getOutputFile()));
		builder.redirectError(( showStderr ? ProcessBuilder.Redirect.INHERIT : ProcessBuilder.Redirect.DISCARD ));
		return builder.start();
	}

	// removes exited processes from the active set, returns the first failure among them.
	private ProcessFailureException reap( List<Running> active ) throws InterruptedException {

		ProcessFailureException failure = null;
		Iterator<Running> it = active.iterator();

		while( it.hasNext()){
			Running running = it.next();
			if( !running.process.isAlive()){
				ProcessFailureException f = check( running, running.process.waitFor());
				if( failure == null ){
					failure = f;
				}

				it.remove();
			}
		}

		return failure;
	}

	private ProcessFailureException check( Running running, int exitCode ){

		logger.debug( String.format( "%s finished with return code %d after %.3f seconds", running.invocation.getProgram(),
				exitCode, ( System.currentTimeMillis() - running.started ) / 1000.0 ));

		if( exitCode != 0 ){
			logger.warn( "Command failed (" + exitCode + "): " + running.invocation.getCommandLine());
			return new ProcessFailureException( running.invocation.getProgram(), exitCode );
		}

		return null;
	}

	private static final class Running {

		final Invocation invocation;
		final Process process;
		final long started = System.currentTimeMillis();

		Running( Invocation invocation, Process process ){
			this.invocation = invocation;
			this.process = process;
		}
	}
}
