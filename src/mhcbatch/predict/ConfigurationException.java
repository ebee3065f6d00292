package mhcbatch.predict;

/*
 * Raised while a tool's flag table or a predictor is being set up, always before
 * any external process has been started.
 */
@SuppressWarnings("serial")
public class ConfigurationException extends PredictionException {

	public ConfigurationException( String message ){
		super( message );
	}
}
