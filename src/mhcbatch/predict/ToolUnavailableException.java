package mhcbatch.predict;

@SuppressWarnings("serial")
public class ToolUnavailableException extends PredictionException {

	private final String program;

	public ToolUnavailableException( String program, String message ){
		super( message );
		this.program = program;
	}

	public ToolUnavailableException( String program, String message, Throwable cause ){
		super( message, cause );
		this.program = program;
	}

	public String getProgram(){
		return program;
	}
}
