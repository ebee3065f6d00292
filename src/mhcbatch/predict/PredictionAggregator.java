package mhcbatch.predict;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;

/**
 * Merges the records parsed from every output file of one run and checks them against what was
 * asked for.
 *
 * <p>The merged records are de-duplicated and sorted. The run is accepted only when the observed
 * (peptide, allele) pairs are exactly the requested peptides crossed with the requested alleles;
 * otherwise an {@link IncompleteResultException} names one pair that is missing or, failing that,
 * one that was never requested. Alleles on both sides are compared in their normalized spelling.
 */
public final class PredictionAggregator {

	private static Logger logger = PredictionLogger.getLogger();

	private PredictionAggregator(){}

	public static RunResult aggregate( List<List<PredictionRecord>> perCommand, Collection<String> expectedPeptides,
			Collection<String> expectedAlleles, Comparator<PredictionRecord> ordering ) throws IncompleteResultException {

		Set<PredictionRecord> unique = new LinkedHashSet<PredictionRecord>();
		int total = 0;

		for( List<PredictionRecord> records : perCommand ){
			total += records.size();
			unique.addAll( records );
		}

		if( total > unique.size()){
			logger.debug( "Removed " + ( total - unique.size()) + " duplicate record(s)" );
		}

		List<PredictionRecord> sorted = new ArrayList<PredictionRecord>( unique );
		Collections.sort( sorted, ordering );

		Set<String> peptides = new LinkedHashSet<String>( expectedPeptides );
		Set<String> alleles = new LinkedHashSet<String>();
		for( String allele : expectedAlleles ){
			alleles.add( AlleleNames.normalize( allele ));
		}

		validate( sorted, peptides, alleles );
		return new RunResult( sorted, peptides, alleles );
	}

	private static void validate( List<PredictionRecord> records, Set<String> peptides, Set<String> alleles ) throws IncompleteResultException {

		Set<String> observed = new LinkedHashSet<String>();
		for( PredictionRecord record : records ){
			observed.add( pair( record.getPeptide(), record.getAllele()));
		}

		for( String peptide : peptides ){
			for( String allele : alleles ){
				if( !observed.contains( pair( peptide, allele ))){
					throw new IncompleteResultException( peptide, allele, true );
				}
			}
		}

		for( PredictionRecord record : records ){
			if( !peptides.contains( record.getPeptide()) || !alleles.contains( record.getAllele())){
				throw new IncompleteResultException( record.getPeptide(), record.getAllele(), false );
			}
		}
	}

	// peptides are letters only, so a tab cannot collide.
	private static String pair( String peptide, String allele ){
		return new StringBuffer( peptide ).append( '\t' ).append( allele ).toString();
	}
}
