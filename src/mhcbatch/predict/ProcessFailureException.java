package mhcbatch.predict;

@SuppressWarnings("serial")
public class ProcessFailureException extends PredictionException {

	// exit code reported when the process could not be started at all.
	public static final int NOT_STARTED = -1;

	private final String program;
	private final int exitCode;

	public ProcessFailureException( String program, int exitCode ){
		super( new StringBuffer( program ).append( " failed with exit code " ).append( exitCode ).toString());
		this.program = program;
		this.exitCode = exitCode;
	}

	public ProcessFailureException( String program, Throwable cause ){
		super( new StringBuffer( "Unable to start " ).append( program ).append( ": " ).append( cause.getMessage()).toString(), cause );
		this.program = program;
		this.exitCode = NOT_STARTED;
	}

	public String getProgram(){
		return program;
	}

	public int getExitCode(){
		return exitCode;
	}
}
