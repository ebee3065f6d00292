package mhcbatch.predict;

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/*
 * One external process: its argv, the file its stdout goes to, and its private temp
 * directory (null when the tool does not take one).
 */
public final class Invocation {

	private final List<String> argv;
	private final File outputFile;
	private final File tempDir;

	public Invocation( List<String> argv, File outputFile, File tempDir ){
		if( argv == null || argv.isEmpty()){
			throw new IllegalArgumentException( "An invocation needs at least a program name" );
		}

		if( outputFile == null ){
			throw new IllegalArgumentException( "An invocation needs an output file" );
		}

		this.argv = Collections.unmodifiableList( new ArrayList<String>( argv ));
		this.outputFile = outputFile;
		this.tempDir = tempDir;
	}

	public List<String> getArgv(){
		return argv;
	}

	public String getProgram(){
		return argv.get( 0 );
	}

	public File getOutputFile(){
		return outputFile;
	}

	public File getTempDir(){
		return tempDir;
	}

	public String getCommandLine(){
		StringBuffer line = new StringBuffer();
		for( String arg : argv ){
			if( line.length() > 0 ){
				line.append( ' ' );
			}

			line.append( arg );
		}

		return line.toString();
	}

	@Override
	public String toString(){
		return new StringBuffer( "Invocation(" ).append( getCommandLine()).append( " > " ).append( outputFile.getName()).append( ")" ).toString();
	}
}
