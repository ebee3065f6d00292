package mhcbatch.predict;

/*
 * Rewrites one token of an output row before it is read by index.
 */
public interface FieldTransform {

	// some tool versions number positions from 1.
	FieldTransform ONE_BASED_TO_ZERO_BASED = new FieldTransform(){
		public String apply( String field ){
			return String.valueOf( Integer.parseInt( field ) - 1 );
		}
	};

	String apply( String field );
}
