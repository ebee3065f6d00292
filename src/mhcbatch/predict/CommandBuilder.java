package mhcbatch.predict;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

/*
 * Turns a tool's flag table plus one (input file, allele, length) combination into an argv.
 * Never touches the filesystem.
 *
 *   program [peptide-mode flags] allele-flag ALLELE [length-flag N] [input-flag] INPUT
 *           [tempdir-flag DIR] [extra flags]
 */
public final class CommandBuilder {

	private CommandBuilder(){}

	public static List<String> build( ToolSpec spec, File inputFile, String allele, Integer length, File tempDir, boolean peptideMode ){

		List<String> args = new ArrayList<String>();
		args.add( spec.getProgramName());

		if( peptideMode ){
			args.addAll( spec.getPeptideModeFlags());
		}

		args.add( spec.getAlleleFlag());
		args.add( spec.prepareAlleleName( allele ));

		if( length != null ){
			args.add( spec.getLengthFlag());
			args.add( String.valueOf( length ));
		}

		if( spec.getInputFileFlag() != null ){
			args.add( spec.getInputFileFlag());
		}

		args.add( inputFile.getPath());

		if( spec.getTempDirFlag() != null && tempDir != null ){
			args.add( spec.getTempDirFlag());
			args.add( tempDir.getPath());
		}

		args.addAll( spec.getExtraFlags());
		return args;
	}
}
