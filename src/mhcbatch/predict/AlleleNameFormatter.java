package mhcbatch.predict;

/*
 * How a tool expects to see allele names on its command line. Called once per allele per
 * command; the result is passed through as is.
 */
public interface AlleleNameFormatter {

	// HLA-A*02:01 -> HLA-A02:01
	AlleleNameFormatter STRIP_ASTERISK = new AlleleNameFormatter(){
		public String format( String allele ){
			return allele.replace( "*", "" );
		}
	};

	AlleleNameFormatter UNCHANGED = new AlleleNameFormatter(){
		public String format( String allele ){
			return allele;
		}
	};

	String format( String allele );
}
