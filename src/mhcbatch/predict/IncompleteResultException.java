package mhcbatch.predict;

/*
 * The (peptide, allele) pairs that came back from a run did not match the pairs that were
 * requested. Carries one offending pair, either missing or unexpected.
 */
@SuppressWarnings("serial")
public class IncompleteResultException extends PredictionException {

	private final String peptide;
	private final String allele;
	private final boolean missing;

	public IncompleteResultException( String peptide, String allele, boolean missing ){
		super( new StringBuffer(( missing ? "Missing prediction for " : "Unexpected prediction for " )).append(
				"peptide=" ).append( peptide ).append( ", allele=" ).append( allele ).toString());
		this.peptide = peptide;
		this.allele = allele;
		this.missing = missing;
	}

	public String getPeptide(){
		return peptide;
	}

	public String getAllele(){
		return allele;
	}

	public boolean isMissing(){
		return missing;
	}
}
