package mhcbatch.predict;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.io.IOUtils;
import org.junit.Test;

public class TabularOutputParserTest {

	private static final double DELTA = 1e-6;

	private static String fixture( String name ) throws Exception {
		InputStream in = TabularOutputParserTest.class.getClassLoader().getResourceAsStream( name );
		try {
			return IOUtils.toString( in, StandardCharsets.UTF_8 );

		} finally {
			in.close();
		}
	}

	private static Map<String,String> keys( String... pairs ){
		Map<String,String> map = new HashMap<String,String>();
		for( int i = 0; i < pairs.length; i += 2 ){
			map.put( pairs[i], pairs[i + 1] );
		}

		return map;
	}

	@Test
	public void readsTwelveRowsLowestAffinityFirst() throws Exception {
		List<PredictionRecord> records = TabularOutputParser.parse( fixture( "netmhcpan28_a0203.txt" ),
				ParserSpecs.NETMHCPAN28, keys( "id0", "id0" ), "netMHCpan" );
		assertEquals( 12, records.size());

		for( PredictionRecord record : records ){
			assertEquals( "HLA-A*02:03", record.getAllele());
			assertEquals( "id0", record.getSourceSequenceKey());
			assertEquals( "netMHCpan", record.getMethodName());
		}

		Collections.sort( records );
		PredictionRecord best = records.get( 0 );
		assertEquals( "HIIIASSSL", best.getPeptide());
		assertEquals( 189.74, best.getAffinity(), DELTA );
		assertEquals( 4.0, best.getPercentileRank(), DELTA );
		assertEquals( 0.515, best.getScore(), DELTA );
		assertEquals( 11, best.getOffset());
	}

	@Test
	public void recoversInvalidAffinityFromScore() throws Exception {
		String raw = fixture( "netmhcpan28_a0203.txt" ).replace( "38534.25", "-1" );
		List<PredictionRecord> records = TabularOutputParser.parse( raw, ParserSpecs.NETMHCPAN28, keys( "id0", "id0" ), "netMHCpan" );
		assertEquals( 12, records.size());

		PredictionRecord first = records.get( 0 );
		assertEquals( "QQQQQYFPE", first.getPeptide());
		assertEquals( Math.pow( 50000, 1 - 0.024 ), first.getAffinity(), DELTA );
	}

	@Test
	public void recoversNanAffinity() throws Exception {
		String raw = fixture( "netmhcpan28_a0203.txt" ).replace( "2461.53", "nan" );
		List<PredictionRecord> records = TabularOutputParser.parse( raw, ParserSpecs.NETMHCPAN28, keys( "id0", "id0" ), "netMHCpan" );
		assertEquals( 12, records.size());
		assertEquals( Math.pow( 50000, 1 - 0.278 ), records.get( 1 ).getAffinity(), DELTA );
	}

	@Test
	public void dropsRowWithoutUsableAffinityOrScore() throws Exception {
		String raw = fixture( "netmhcpan28_a0203.txt" ).replace( "0.024     38534.25", "inf     -5" );
		List<PredictionRecord> records = TabularOutputParser.parse( raw, ParserSpecs.NETMHCPAN28, keys( "id0", "id0" ), "netMHCpan" );
		assertEquals( 11, records.size());
		assertEquals( "QQQQYFPEI", records.get( 0 ).getPeptide());
	}

	@Test
	public void dropsRowWithRankOutOfRange() throws Exception {
		String raw = fixture( "netmhcpan28_a0203.txt" ).replace( "4123.85   15.00", "4123.85   150.00" );
		assertEquals( 11, TabularOutputParser.parse( raw, ParserSpecs.NETMHCPAN28, keys( "id0", "id0" ), "netMHCpan" ).size());
	}

	@Test
	public void dropsRowWithUnknownKey() throws Exception {
		String raw = fixture( "netmhcpan28_a0203.txt" ).replace( "THIIIASSS   id0", "THIIIASSS   id9" );
		assertEquals( 11, TabularOutputParser.parse( raw, ParserSpecs.NETMHCPAN28, keys( "id0", "protein zero" ), "netMHCpan" ).size());
	}

	@Test
	public void mapsShortKeysBack() throws Exception {
		List<PredictionRecord> records = TabularOutputParser.parse( fixture( "netmhcpan28_a0203.txt" ),
				ParserSpecs.NETMHCPAN28, keys( "id0", "sp|P04637|P53_HUMAN" ), "netMHCpan" );
		assertEquals( "sp|P04637|P53_HUMAN", records.get( 5 ).getSourceSequenceKey());
	}

	@Test
	public void oneBasedPositionsBecomeZeroBased() throws Exception {
		List<PredictionRecord> records = TabularOutputParser.parse( fixture( "netmhcpan3_peptides.txt" ),
				ParserSpecs.NETMHCPAN3, null, "netMHCpan" );
		assertEquals( 2, records.size());

		PredictionRecord first = records.get( 0 );
		assertEquals( 0, first.getOffset());
		assertEquals( "SIINFEKL", first.getPeptide());
		assertEquals( "PEPLIST", first.getSourceSequenceKey());
		assertEquals( "HLA-A*02:01", first.getAllele());
		assertEquals( 14543.1, first.getAffinity(), DELTA );
		assertEquals( 18.986, first.getPercentileRank(), DELTA );

		assertEquals( 1, records.get( 1 ).getOffset());
	}

	@Test
	public void dropsBinderMarkerOnlyAtItsColumn() throws Exception {
		String raw = "NetMHC version 3.4. 9mer predictions using Artificial Neural Networks\n" +
				"----------------------------------------------------------------------------------------------------\n" +
				" pos    peptide      logscore affinity(nM) Bind Level    Protein Name     Allele\n" +
				"----------------------------------------------------------------------------------------------------\n" +
				"   0  SIINFEKLL         0.436         1200        WB        seq_0    HLA-A0201\n" +
				"   1  IINFEKLLA         0.100        30000                  seq_0    HLA-A0201\n" +
				"----------------------------------------------------------------------------------------------------\n";

		List<PredictionRecord> records = TabularOutputParser.parse( raw, ParserSpecs.NETMHC3, keys( "seq_0", "seq" ), "netMHC" );
		assertEquals( 2, records.size());
		assertEquals( "seq", records.get( 0 ).getSourceSequenceKey());
		assertEquals( "HLA-A*02:01", records.get( 0 ).getAllele());
		assertEquals( 1200.0, records.get( 0 ).getAffinity(), DELTA );
		assertNull( records.get( 0 ).getPercentileRank());
		assertEquals( "seq", records.get( 1 ).getSourceSequenceKey());
	}

	@Test
	public void ignoresEverythingBeforeTheFirstRule() throws Exception {
		String raw = "0 HLA-A*02:01 SIINFEKLL seq 0.5 100.0 1.0\n" +
				"-----\n" +
				"# comment\n" +
				"\n" +
				"1 HLA-A*02:01 IINFEKLLA seq 0.5 200.0 1.0\n" +
				"2 HLA-A*02:01 too short\n" +
				"x HLA-A*02:01 INFEKLLAB seq 0.5 300.0 1.0\n";

		List<PredictionRecord> records = TabularOutputParser.parse( raw, ParserSpecs.NETMHCCONS, null, "netMHCcons" );
		assertEquals( 1, records.size());
		assertEquals( "IINFEKLLA", records.get( 0 ).getPeptide());
	}

	@Test
	public void errorBannerRaises() throws Exception {
		String raw = "# NetMHCpan version 2.8\n\nERROR: Allele HLA-Z*99:99 not in list\nmore text\n";
		try {
			TabularOutputParser.parse( raw, ParserSpecs.NETMHCPAN28, null, "netMHCpan" );
			fail( "expected the error banner to be reported" );

		} catch( ToolOutputException e ){
			assertEquals( "ERROR: Allele HLA-Z*99:99 not in list", e.getErrorLine());
			assertTrue( e.getMessage().startsWith( "netMHCpan failed" ));
		}

		assertTrue( TabularOutputParser.parse( raw, ParserSpecs.NETMHCCONS, null, "netMHCcons" ).isEmpty());
	}

	@Test
	public void errorInsideAKeyIsData() throws Exception {
		String raw = "# NetMHCpan version 2.8\n" +
				"---------------------------------------------------\n" +
				"  0  HLA-A*02:03    QQQQQYFPE   Terror_0    0.024     38534.25   50.00\n" +
				"  1  HLA-A*02:03    QQQQYFPEI   Terror_0    0.278      2461.53   15.00\n";

		List<PredictionRecord> records = TabularOutputParser.parse( raw, ParserSpecs.NETMHCPAN28, null, "netMHCpan" );
		assertEquals( 2, records.size());
		assertEquals( "Terror_0", records.get( 0 ).getSourceSequenceKey());
	}

	@Test
	public void errorLineBelowTheRuleRaises() throws Exception {
		String raw = "# Stra\u00dfe run\n-----------\nerror: unable to read allele file\n";
		try {
			TabularOutputParser.parse( raw, ParserSpecs.NETMHCIIPAN, null, "netMHCIIpan" );
			fail( "expected the error line to be reported" );

		} catch( ToolOutputException e ){
			assertEquals( "error: unable to read allele file", e.getErrorLine());
		}
	}

	@Test
	public void bannerLineIsReportedWhole() throws Exception {
		String raw = "Stra\u00dfe: fatal ERROR reading input\n";
		try {
			TabularOutputParser.checkForError( raw, "netMHCpan" );
			fail( "expected the banner to be reported" );

		} catch( ToolOutputException e ){
			assertEquals( "Stra\u00dfe: fatal ERROR reading input", e.getErrorLine());
		}
	}

	@Test
	public void splitsOnWhitespaceRuns(){
		List<String[]> rows = TabularOutputParser.splitLines( "---\n  a \t b   c \n" );
		assertEquals( 1, rows.size());
		assertEquals( 3, rows.get( 0 ).length );
		assertEquals( "c", rows.get( 0 )[2] );
	}

	@Test
	public void recoveryNeedsAFiniteScore(){
		assertNull( TabularOutputParser.recoverAffinity( null ));
		assertNull( TabularOutputParser.recoverAffinity( Double.NaN ));
		assertEquals( 50000.0, TabularOutputParser.recoverAffinity( 0.0 ), DELTA );
		assertEquals( 1.0, TabularOutputParser.recoverAffinity( 1.0 ), DELTA );
	}
}
