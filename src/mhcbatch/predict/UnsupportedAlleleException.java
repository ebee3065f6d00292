package mhcbatch.predict;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@SuppressWarnings("serial")
public class UnsupportedAlleleException extends PredictionException {

	private final List<String> alleles;

	public UnsupportedAlleleException( List<String> alleles, String message ){
		super( message );
		this.alleles = Collections.unmodifiableList( new ArrayList<String>( alleles ));
	}

	public List<String> getAlleles(){
		return alleles;
	}
}
