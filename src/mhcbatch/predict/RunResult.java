package mhcbatch.predict;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The validated outcome of one prediction run: every record in the predictor's order, together
 * with the peptides and alleles that were requested. Read-only.
 */
public final class RunResult implements Iterable<PredictionRecord> {

	private final List<PredictionRecord> records;
	private final Set<String> peptides;
	private final Set<String> alleles;

	RunResult( List<PredictionRecord> records, Set<String> peptides, Set<String> alleles ){
		this.records = Collections.unmodifiableList( new ArrayList<PredictionRecord>( records ));
		this.peptides = Collections.unmodifiableSet( new LinkedHashSet<String>( peptides ));
		this.alleles = Collections.unmodifiableSet( new LinkedHashSet<String>( alleles ));
	}

	public List<PredictionRecord> getRecords(){
		return records;
	}

	public Set<String> getPeptides(){
		return peptides;
	}

	public Set<String> getAlleles(){
		return alleles;
	}

	public int size(){
		return records.size();
	}

	public boolean isEmpty(){
		return records.isEmpty();
	}

	public Iterator<PredictionRecord> iterator(){
		return records.iterator();
	}

	/** Records per allele, in the order the alleles were requested. */
	public Map<String,List<PredictionRecord>> groupByAllele(){
		Map<String,List<PredictionRecord>> groups = new LinkedHashMap<String,List<PredictionRecord>>();
		for( String allele : alleles ){
			groups.put( allele, new ArrayList<PredictionRecord>());
		}

		for( PredictionRecord record : records ){
			add( groups, record.getAllele(), record );
		}

		return groups;
	}

	/** Records per peptide, in the order the peptides were requested. */
	public Map<String,List<PredictionRecord>> groupByPeptide(){
		Map<String,List<PredictionRecord>> groups = new LinkedHashMap<String,List<PredictionRecord>>();
		for( String peptide : peptides ){
			groups.put( peptide, new ArrayList<PredictionRecord>());
		}

		for( PredictionRecord record : records ){
			add( groups, record.getPeptide(), record );
		}

		return groups;
	}

	private static void add( Map<String,List<PredictionRecord>> groups, String key, PredictionRecord record ){
		List<PredictionRecord> group = groups.get( key );
		if( group == null ){
			group = new ArrayList<PredictionRecord>();
			groups.put( key, group );
		}

		group.add( record );
	}

	@Override
	public String toString(){
		return new StringBuffer( "RunResult(records=" ).append( records.size()).append( ", peptides=" ).append(
				peptides.size()).append( ", alleles=" ).append( alleles ).append( ")" ).toString();
	}
}
