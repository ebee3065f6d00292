package mhcbatch.predict;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Column layout of one family of predictor output tables. A value, built once and shared; the
 * parser itself is the same for every layout.
 *
 * <p>Indices refer to the row after ignorable marker tokens have been dropped. Affinity, rank and
 * the log-affinity score are optional, but a layout needs at least one of affinity and score.
 */
public final class ParserSpec {

	private final String name;
	private final int keyIndex;
	private final int offsetIndex;
	private final int peptideIndex;
	private final int alleleIndex;
	private final Integer affinityIndex;
	private final Integer rankIndex;
	private final Integer scoreIndex;
	private final Map<String,Integer> ignoredValueIndices;
	private final Map<Integer,FieldTransform> transforms;
	private final boolean errorChecked;

	private ParserSpec( Builder b ){
		this.name = b.name;
		this.keyIndex = b.keyIndex;
		this.offsetIndex = b.offsetIndex;
		this.peptideIndex = b.peptideIndex;
		this.alleleIndex = b.alleleIndex;
		this.affinityIndex = b.affinityIndex;
		this.rankIndex = b.rankIndex;
		this.scoreIndex = b.scoreIndex;
		this.ignoredValueIndices = Collections.unmodifiableMap( new HashMap<String,Integer>( b.ignoredValueIndices ));
		this.transforms = Collections.unmodifiableMap( new HashMap<Integer,FieldTransform>( b.transforms ));
		this.errorChecked = b.errorChecked;
	}

	public static Builder builder( String name ){
		return new Builder( name );
	}

	public String getName(){
		return name;
	}

	public int getKeyIndex(){
		return keyIndex;
	}

	public int getOffsetIndex(){
		return offsetIndex;
	}

	public int getPeptideIndex(){
		return peptideIndex;
	}

	public int getAlleleIndex(){
		return alleleIndex;
	}

	public Integer getAffinityIndex(){
		return affinityIndex;
	}

	public Integer getRankIndex(){
		return rankIndex;
	}

	public Integer getScoreIndex(){
		return scoreIndex;
	}

	public Map<String,Integer> getIgnoredValueIndices(){
		return ignoredValueIndices;
	}

	public Map<Integer,FieldTransform> getTransforms(){
		return transforms;
	}

	// raw output is scanned for an ERROR banner before any row is read.
	public boolean isErrorChecked(){
		return errorChecked;
	}

	/** Highest column index a row must have. */
	public int getRequiredColumns(){
		int max = Math.max( Math.max( keyIndex, offsetIndex ), Math.max( peptideIndex, alleleIndex ));
		if( affinityIndex != null ){ max = Math.max( max, affinityIndex ); }
		if( rankIndex != null ){ max = Math.max( max, rankIndex ); }
		if( scoreIndex != null ){ max = Math.max( max, scoreIndex ); }
		return max + 1;
	}

	@Override
	public String toString(){
		return "ParserSpec(" + name + ")";
	}

	public static final class Builder {

		private final String name;
		private int keyIndex = -1;
		private int offsetIndex = -1;
		private int peptideIndex = -1;
		private int alleleIndex = -1;
		private Integer affinityIndex;
		private Integer rankIndex;
		private Integer scoreIndex;
		private final Map<String,Integer> ignoredValueIndices = new HashMap<String,Integer>();
		private final Map<Integer,FieldTransform> transforms = new HashMap<Integer,FieldTransform>();
		private boolean errorChecked = false;

		private Builder( String name ){
			this.name = name;
		}

		public Builder key( int index ){
			this.keyIndex = index;
			return this;
		}

		public Builder offset( int index ){
			this.offsetIndex = index;
			return this;
		}

		public Builder peptide( int index ){
			this.peptideIndex = index;
			return this;
		}

		public Builder allele( int index ){
			this.alleleIndex = index;
			return this;
		}

		public Builder affinity( int index ){
			this.affinityIndex = index;
			return this;
		}

		public Builder rank( int index ){
			this.rankIndex = index;
			return this;
		}

		public Builder score( int index ){
			this.scoreIndex = index;
			return this;
		}

		public Builder ignore( String token, int index ){
			this.ignoredValueIndices.put( token, index );
			return this;
		}

		public Builder transform( int index, FieldTransform transform ){
			this.transforms.put( index, transform );
			return this;
		}

		public Builder checkErrors( boolean check ){
			this.errorChecked = check;
			return this;
		}

		public ParserSpec build(){

			if( name == null || name.trim().length() == 0 ){
				throw new IllegalArgumentException( "A parser spec needs a name" );
			}

			if( keyIndex < 0 || offsetIndex < 0 || peptideIndex < 0 || alleleIndex < 0 ){
				throw new IllegalArgumentException( name + ": key, offset, peptide and allele columns are required" );
			}

			if( affinityIndex == null && scoreIndex == null ){
				throw new IllegalArgumentException( name + ": an affinity or a score column is required" );
			}

			if(( affinityIndex != null && affinityIndex < 0 ) || ( rankIndex != null && rankIndex < 0 ) || ( scoreIndex != null && scoreIndex < 0 )){
				throw new IllegalArgumentException( name + ": negative column index" );
			}

			return new ParserSpec( this );
		}
	}
}
