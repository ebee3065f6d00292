package mhcbatch.predict;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;

import java.io.File;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class ToolVersionDetectorTest {

	@Rule
	public TemporaryFolder tmp = new TemporaryFolder();

	private File bin;

	@Before
	public void setUp() throws Exception {
		bin = tmp.newFolder( "bin" );
	}

	private File helpScreen( String name, String text ) throws Exception {
		return FakePredictor.script( bin, name, "#!/bin/sh\ncat <<'EOF'\n" + text + "\nEOF\n" );
	}

	@Test
	public void netMhcFour() throws Exception {
		File netmhc = helpScreen( "netMHC4", "Usage: netMHC [-h] [args] [fastafile/peptidefile]\n-listMHC    Print list of alleles included in netMHC" );
		assertSame( ParserSpecs.NETMHC4, ToolVersionDetector.detectNetMhc( netmhc.getPath()));
	}

	@Test
	public void netMhcThree() throws Exception {
		File netmhc = helpScreen( "netMHC3", "netMHC version 3.4\n--Alleles    list alleles with available predictions" );
		assertSame( ParserSpecs.NETMHC3, ToolVersionDetector.detectNetMhc( netmhc.getPath()));
	}

	@Test
	public void customChoices() throws Exception {
		Map<String,Integer> versions = new LinkedHashMap<String,Integer>();
		versions.put( "version 2.8", 28 );
		versions.put( "version 3.0", 30 );

		File pan = helpScreen( "netMHCpan", "NetMHCpan version 3.0b" );
		assertEquals( Integer.valueOf( 30 ), ToolVersionDetector.detect( pan.getPath(), "-h", versions ));
	}

	@Test( expected = ToolUnavailableException.class )
	public void ambiguousHelpScreen() throws Exception {
		File netmhc = helpScreen( "confused", "-listMHC and --Alleles" );
		ToolVersionDetector.detectNetMhc( netmhc.getPath());
	}

	@Test( expected = ToolUnavailableException.class )
	public void unknownHelpScreen() throws Exception {
		File netmhc = helpScreen( "other", "some other program" );
		ToolVersionDetector.detectNetMhc( netmhc.getPath());
	}

	@Test( expected = ToolUnavailableException.class )
	public void missingProgram() throws Exception {
		ToolVersionDetector.detectNetMhc( new File( bin, "absent" ).getPath());
	}
}
