package mhcbatch.predict;

import java.util.Comparator;

/**
 * One predicted (peptide, allele) binding value, normalized from whichever tool produced it.
 * Instances are immutable.
 */
public final class PredictionRecord implements Comparable<PredictionRecord> {

	/** Ascending affinity, records without an affinity last. */
	public static final Comparator<PredictionRecord> BY_AFFINITY = new Comparator<PredictionRecord>(){
		public int compare( PredictionRecord a, PredictionRecord b ){
			int c = compareNullable( a.affinity, b.affinity );
			return( c != 0 ? c : a.compareFields( b ));
		}
	};

	/** Ascending score, records without a score last. */
	public static final Comparator<PredictionRecord> BY_SCORE = new Comparator<PredictionRecord>(){
		public int compare( PredictionRecord a, PredictionRecord b ){
			int c = compareNullable( a.score, b.score );
			return( c != 0 ? c : a.compareFields( b ));
		}
	};

	private final String sourceSequenceKey;
	private final int offset;
	private final String peptide;
	private final String allele;
	private final Double affinity;
	private final Double score;
	private final Double percentileRank;
	private final String methodName;

	public PredictionRecord( String sourceSequenceKey, int offset, String peptide, String allele,
			Double affinity, Double score, Double percentileRank, String methodName ){

		if( peptide == null || allele == null ){
			throw new IllegalArgumentException( "Peptide and allele are required" );
		}

		if( affinity != null && !isValidAffinity( affinity )){
			throw new IllegalArgumentException( new StringBuffer( "Invalid affinity " ).append( affinity ).append(
					" for " ).append( peptide ).append( " w/ allele " ).append( allele ).toString());
		}

		if( percentileRank != null && !isValidPercentileRank( percentileRank )){
			throw new IllegalArgumentException( new StringBuffer( "Invalid percentile rank " ).append( percentileRank ).append(
					" for " ).append( peptide ).append( " w/ allele " ).append( allele ).toString());
		}

		this.sourceSequenceKey = sourceSequenceKey;
		this.offset = offset;
		this.peptide = peptide;
		this.allele = allele;
		this.affinity = affinity;
		this.score = score;
		this.percentileRank = percentileRank;
		this.methodName = ( methodName == null ? "" : methodName );
	}

	public static boolean isValidAffinity( double x ){
		return !( Double.isNaN( x ) || Double.isInfinite( x ) || x < 0 );
	}

	public static boolean isValidPercentileRank( double x ){
		return !( Double.isNaN( x ) || Double.isInfinite( x )) && x >= 0 && x <= 100;
	}

	public String getSourceSequenceKey(){
		return sourceSequenceKey;
	}

	public int getOffset(){
		return offset;
	}

	public String getPeptide(){
		return peptide;
	}

	public int getLength(){
		return peptide.length();
	}

	public String getAllele(){
		return allele;
	}

	public Double getAffinity(){
		return affinity;
	}

	public Double getScore(){
		return score;
	}

	public Double getPercentileRank(){
		return percentileRank;
	}

	public String getMethodName(){
		return methodName;
	}

	public PredictionRecord withSource( String sourceSequenceKey, int offset ){
		return new PredictionRecord( sourceSequenceKey, offset, peptide, allele, affinity, score, percentileRank, methodName );
	}

	public int compareTo( PredictionRecord other ){
		return BY_AFFINITY.compare( this, other );
	}

	// tie-break over the remaining fields so that ordering agrees with equals.
	private int compareFields( PredictionRecord other ){
		int c = compareNullable( sourceSequenceKey, other.sourceSequenceKey );
		if( c == 0 ){ c = ( offset < other.offset ? -1 : ( offset == other.offset ? 0 : 1 )); }
		if( c == 0 ){ c = peptide.compareTo( other.peptide ); }
		if( c == 0 ){ c = allele.compareTo( other.allele ); }
		if( c == 0 ){ c = compareNullable( affinity, other.affinity ); }
		if( c == 0 ){ c = compareNullable( score, other.score ); }
		if( c == 0 ){ c = compareNullable( percentileRank, other.percentileRank ); }
		if( c == 0 ){ c = methodName.compareTo( other.methodName ); }
		return c;
	}

	private static <T extends Comparable<T>> int compareNullable( T a, T b ){
		if( a == null ){
			return( b == null ? 0 : 1 );
		}

		return( b == null ? -1 : a.compareTo( b ));
	}

	@Override
	public boolean equals( Object o ){
		if( this == o ){
			return true;
		}

		if( !( o instanceof PredictionRecord )){
			return false;
		}

		PredictionRecord other = (PredictionRecord)o;
		return offset == other.offset &&
				equal( sourceSequenceKey, other.sourceSequenceKey ) &&
				peptide.equals( other.peptide ) &&
				allele.equals( other.allele ) &&
				equal( affinity, other.affinity ) &&
				equal( score, other.score ) &&
				equal( percentileRank, other.percentileRank ) &&
				methodName.equals( other.methodName );
	}

	private static boolean equal( Object a, Object b ){
		return( a == null ? b == null : a.equals( b ));
	}

	@Override
	public int hashCode(){
		int h = ( sourceSequenceKey == null ? 0 : sourceSequenceKey.hashCode());
		h = 31 * h + offset;
		h = 31 * h + peptide.hashCode();
		h = 31 * h + allele.hashCode();
		h = 31 * h + ( affinity == null ? 0 : affinity.hashCode());
		h = 31 * h + ( score == null ? 0 : score.hashCode());
		h = 31 * h + ( percentileRank == null ? 0 : percentileRank.hashCode());
		h = 31 * h + methodName.hashCode();
		return h;
	}

	@Override
	public String toString(){
		return new StringBuffer( "PredictionRecord(peptide='" ).append( peptide ).append(
				"', allele='" ).append( allele ).append(
				"', affinity=" ).append( affinity ).append(
				", score=" ).append( score ).append(
				", percentileRank=" ).append( percentileRank ).append(
				", sourceSequenceKey=" ).append( sourceSequenceKey ).append(
				", offset=" ).append( offset ).append(
				", methodName='" ).append( methodName ).append( "')" ).toString();
	}
}
