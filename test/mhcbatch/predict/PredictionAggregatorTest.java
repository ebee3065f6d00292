package mhcbatch.predict;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.junit.Test;

public class PredictionAggregatorTest {

	private static PredictionRecord record( String peptide, String allele, double affinity ){
		return new PredictionRecord( "seq", 0, peptide, allele, affinity, null, null, "netMHCpan" );
	}

	@Test
	public void mergesDeduplicatesAndSorts() throws Exception {
		PredictionRecord a = record( "SIINFEKL", "HLA-A*02:01", 500.0 );
		PredictionRecord b = record( "GILGFVFTL", "HLA-A*02:01", 20.0 );

		List<List<PredictionRecord>> runs = new ArrayList<List<PredictionRecord>>();
		runs.add( Arrays.asList( a ));
		runs.add( Arrays.asList( b, a ));

		RunResult result = PredictionAggregator.aggregate( runs,
				Arrays.asList( "SIINFEKL", "GILGFVFTL" ), Arrays.asList( "HLA-A02:01" ), PredictionRecord.BY_AFFINITY );

		assertEquals( 2, result.size());
		assertEquals( Arrays.asList( b, a ), result.getRecords());
		assertTrue( result.getAlleles().contains( "HLA-A*02:01" ));
	}

	@Test
	public void namesAMissingPair() throws Exception {
		List<List<PredictionRecord>> runs = new ArrayList<List<PredictionRecord>>();
		runs.add( Arrays.asList( record( "SIINFEKL", "HLA-A*02:01", 1.0 )));

		try {
			PredictionAggregator.aggregate( runs,
					Arrays.asList( "SIINFEKL", "GILGFVFTL" ), Arrays.asList( "HLA-A*02:01" ), PredictionRecord.BY_AFFINITY );
			fail( "expected a missing pair" );

		} catch( IncompleteResultException e ){
			assertTrue( e.isMissing());
			assertEquals( "GILGFVFTL", e.getPeptide());
			assertEquals( "HLA-A*02:01", e.getAllele());
			assertTrue( e.getMessage(), e.getMessage().contains( "peptide=GILGFVFTL" ));
		}
	}

	@Test
	public void namesAnUnexpectedPair() throws Exception {
		List<List<PredictionRecord>> runs = new ArrayList<List<PredictionRecord>>();
		runs.add( Arrays.asList( record( "SIINFEKL", "HLA-A*02:01", 1.0 ), record( "SIINFEKL", "HLA-B*07:02", 2.0 )));

		try {
			PredictionAggregator.aggregate( runs,
					Arrays.asList( "SIINFEKL" ), Arrays.asList( "HLA-A*02:01" ), PredictionRecord.BY_AFFINITY );
			fail( "expected an unexpected pair" );

		} catch( IncompleteResultException e ){
			assertFalse( e.isMissing());
			assertEquals( "SIINFEKL", e.getPeptide());
			assertEquals( "HLA-B*07:02", e.getAllele());
		}
	}

	@Test
	public void nothingExpectedNothingObserved() throws Exception {
		RunResult result = PredictionAggregator.aggregate( new ArrayList<List<PredictionRecord>>(),
				new ArrayList<String>(), Arrays.asList( "HLA-A*02:01" ), PredictionRecord.BY_AFFINITY );
		assertTrue( result.isEmpty());
	}

	@Test
	public void scoreOrderingAndGrouping() throws Exception {
		PredictionRecord a = new PredictionRecord( "seq", 0, "SIINFEKL", "HLA-A*02:01", null, 0.9, null, "mhc" );
		PredictionRecord b = new PredictionRecord( "seq", 1, "IINFEKLL", "HLA-A*02:01", null, 0.1, null, "mhc" );
		PredictionRecord c = new PredictionRecord( "seq", 0, "SIINFEKL", "HLA-B*07:02", null, 0.5, null, "mhc" );
		PredictionRecord d = new PredictionRecord( "seq", 1, "IINFEKLL", "HLA-B*07:02", null, null, null, "mhc" );

		List<List<PredictionRecord>> runs = new ArrayList<List<PredictionRecord>>();
		runs.add( Arrays.asList( a, b ));
		runs.add( Arrays.asList( c, d ));

		RunResult result = PredictionAggregator.aggregate( runs,
				Arrays.asList( "SIINFEKL", "IINFEKLL" ), Arrays.asList( "HLA-A*02:01", "HLA-B*07:02" ), PredictionRecord.BY_SCORE );

		assertEquals( Arrays.asList( b, c, a, d ), result.getRecords());

		Map<String,List<PredictionRecord>> byAllele = result.groupByAllele();
		assertEquals( Arrays.asList( "HLA-A*02:01", "HLA-B*07:02" ), new ArrayList<String>( byAllele.keySet()));
		assertEquals( Arrays.asList( b, a ), byAllele.get( "HLA-A*02:01" ));

		Map<String,List<PredictionRecord>> byPeptide = result.groupByPeptide();
		assertEquals( Arrays.asList( c, a ), byPeptide.get( "SIINFEKL" ));
	}
}
