package mhcbatch.predict;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class AlleleNamesTest {

	@Test
	public void hlaSpellings(){
		assertEquals( "HLA-A*02:01", AlleleNames.normalize( "HLA-A*02:01" ));
		assertEquals( "HLA-A*02:01", AlleleNames.normalize( "HLA-A02:01" ));
		assertEquals( "HLA-A*02:01", AlleleNames.normalize( "HLA-A0201" ));
		assertEquals( "HLA-A*02:01", AlleleNames.normalize( "hla-a*02:01" ));
		assertEquals( "HLA-A*02:01", AlleleNames.normalize( "A*02:01:01" ));
		assertEquals( "HLA-B*07:02", AlleleNames.normalize( " B0702 " ));
	}

	@Test
	public void classTwo(){
		assertEquals( "HLA-DRB1*03:01", AlleleNames.normalize( "DRB1_0301" ));
		assertEquals( "HLA-DRB1*01:01", AlleleNames.normalize( "HLA-DRB10101" ));
	}

	@Test
	public void alphaBetaPairs(){
		assertEquals( "HLA-DQA1*05:01-DQB1*02:01", AlleleNames.normalize( "HLA-DQA10501-DQB10201" ));
		assertEquals( AlleleNames.normalize( "HLA-DQA1*05:01-DQB1*02:01" ), AlleleNames.normalize( "HLA-DQA10501-DQB10201" ));
		assertEquals( "HLA-DPA1*01:03-DPB1*04:01", AlleleNames.normalize( "dpa10103-dpb10401" ));
	}

	@Test
	public void mouse(){
		assertEquals( "H-2-Kb", AlleleNames.normalize( "H-2-Kb" ));
		assertEquals( "H-2-Db", AlleleNames.normalize( "h2db" ));
	}

	@Test
	public void unknownNamesAreOnlyUpperCased(){
		assertEquals( "BOLA-1*023:01", AlleleNames.normalize( "BoLA-1*023:01" ));
	}

	@Test( expected = IllegalArgumentException.class )
	public void blankName(){
		AlleleNames.normalize( "  " );
	}

	@Test
	public void resultsAreMemoized(){
		AlleleNames.normalize( "HLA-C0702" );
		int size = AlleleNames.cacheSize();
		AlleleNames.normalize( "HLA-C0702" );
		assertEquals( size, AlleleNames.cacheSize());
		assertTrue( size > 0 );
	}
}
