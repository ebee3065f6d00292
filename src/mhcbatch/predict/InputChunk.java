package mhcbatch.predict;

import java.io.File;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/*
 * One input file handed to a predictor: FASTA records or one peptide per line.
 * The key map is empty for peptide files.
 */
public final class InputChunk {

	private final File file;
	private final int recordCount;
	private final Integer peptideLength;
	private final Map<String,String> keyMap;

	InputChunk( File file, int recordCount, Integer peptideLength, Map<String,String> keyMap ){
		this.file = file;
		this.recordCount = recordCount;
		this.peptideLength = peptideLength;
		this.keyMap = Collections.unmodifiableMap( new LinkedHashMap<String,String>( keyMap ));
	}

	public File getFile(){
		return file;
	}

	public int getRecordCount(){
		return recordCount;
	}

	// only set when peptides were grouped by length.
	public Integer getPeptideLength(){
		return peptideLength;
	}

	public Map<String,String> getKeyMap(){
		return keyMap;
	}

	@Override
	public String toString(){
		return new StringBuffer( "InputChunk(" ).append( file.getName()).append( ", records=" ).append( recordCount ).append( ")" ).toString();
	}
}
