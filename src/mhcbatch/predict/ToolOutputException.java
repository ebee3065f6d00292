package mhcbatch.predict;

@SuppressWarnings("serial")
public class ToolOutputException extends PredictionException {

	private final String errorLine;

	public ToolOutputException( String program, String errorLine ){
		super( new StringBuffer( program ).append( " failed - " ).append( errorLine ).toString());
		this.errorLine = errorLine;
	}

	public String getErrorLine(){
		return errorLine;
	}
}
