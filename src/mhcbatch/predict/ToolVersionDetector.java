package mhcbatch.predict;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

/*
 * Tells incompatible releases of one program apart by the text of their help screen. netMHC 3.x
 * and 4.0 share a name but not an output layout; only 4.0 knows -listMHC and only 3.x --Alleles.
 */
public final class ToolVersionDetector {

	public static final String HELP_FLAG = "-h";

	public static final Map<String,ParserSpec> NETMHC_LAYOUTS;

	static {
		Map<String,ParserSpec> layouts = new LinkedHashMap<String,ParserSpec>();
		layouts.put( "-listMHC", ParserSpecs.NETMHC4 );
		layouts.put( "--Alleles", ParserSpecs.NETMHC3 );
		NETMHC_LAYOUTS = Collections.unmodifiableMap( layouts );
	}

	private static Logger logger = PredictionLogger.getLogger();

	private ToolVersionDetector(){}

	public static <T> T detect( String program, String helpFlag, Map<String,T> substringToChoice ) throws ToolUnavailableException {

		String help;
		try {
			help = CommandRunner.captureOutput( Arrays.asList( program, helpFlag ));

		} catch( PredictionException e ){
			throw new ToolUnavailableException( program, "Unable to run " + program + " " + helpFlag, e );
		}

		List<String> matched = new ArrayList<String>();
		for( String marker : substringToChoice.keySet()){
			if( help.contains( marker )){
				matched.add( marker );
			}
		}

		if( matched.size() > 1 ){
			throw new ToolUnavailableException( program, "Command " + program + " matches several versions: " + matched );
		}

		if( matched.isEmpty()){
			throw new ToolUnavailableException( program, "Command " + program + " is not a known version of the tool" );
		}

		T choice = substringToChoice.get( matched.get( 0 ));
		logger.info( program + " identified by '" + matched.get( 0 ) + "' as " + choice );
		return choice;
	}

	/** The output layout of whichever netMHC release answers to {@code program}. */
	public static ParserSpec detectNetMhc( String program ) throws ToolUnavailableException {
		return detect( program, HELP_FLAG, NETMHC_LAYOUTS );
	}
}
