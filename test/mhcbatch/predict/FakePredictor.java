package mhcbatch.predict;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;

/*
 * A /bin/sh stand-in for a NetMHCpan 2.8 style predictor, used by the tests that spawn real
 * processes. Understands -a, -l, -f and -p; lists HLA-A*02:01 and HLA-A*03:01 for -listMHC; and
 * prints one row per peptide (or per k-mer of every FASTA record) with a distinct affinity.
 *
 * Extra flags change its behavior: -fail exits 3, -error prints an ERROR banner and -drop
 * prints the table without rows. -log FILE appends one line per run to FILE: the input file name
 * and the number of FASTA records in it.
 */
final class FakePredictor {

	static final String SCRIPT = "#!/bin/sh\n" +
			"allele=\"\"; len=9; input=\"\"; pep=0; err=0; drop=0; log=\"\"\n" +
			"if [ $# -eq 0 ]; then exit 0; fi\n" +
			"while [ $# -gt 0 ]; do\n" +
			"  case \"$1\" in\n" +
			"    -listMHC) printf '# alleles\\nHLA-A02:01\\nHLA-A03:01\\n'; exit 0;;\n" +
			"    -h) echo 'fake predictor, see -listMHC for alleles'; exit 0;;\n" +
			"    -fail) exit 3;;\n" +
			"    -error) err=1;;\n" +
			"    -drop) drop=1;;\n" +
			"    -log) log=\"$2\"; shift;;\n" +
			"    -a) allele=\"$2\"; shift;;\n" +
			"    -l) len=\"$2\"; shift;;\n" +
			"    -f) input=\"$2\"; shift;;\n" +
			"    -p) pep=1;;\n" +
			"  esac\n" +
			"  shift\n" +
			"done\n" +
			"if [ -n \"$log\" ]; then echo \"$(basename \"$input\") $(grep -c '^>' \"$input\")\" >> \"$log\"; fi\n" +
			"echo '# fake predictor'\n" +
			"echo '-----------------------------------------------------------'\n" +
			"echo 'pos  HLA  peptide  Identity  1-log50k(aff)  Affinity(nM)  %Rank'\n" +
			"echo '-----------------------------------------------------------'\n" +
			"if [ $err -eq 1 ]; then echo 'ERROR: unable to read allele file'; exit 0; fi\n" +
			"if [ $drop -eq 1 ]; then exit 0; fi\n" +
			"awk -v allele=\"$allele\" -v len=\"$len\" -v pep=\"$pep\" '\n" +
			"function emit(pos, p, key) { printf \"%d %s %s %s 0.500 %.2f 1.00\\n\", pos, allele, p, key, 100 + 10 * length(p) + pos }\n" +
			"pep == 1 { if (length($0) > 0) emit(n++, $0, \"PEPLIST\"); next }\n" +
			"/^>/ { key = substr($0, 2); next }\n" +
			"{ for (i = 1; i + len - 1 <= length($0); i++) emit(i - 1, substr($0, i, len), key) }\n" +
			"' \"$input\"\n";

	private FakePredictor(){}

	static File install( File dir ) throws IOException {
		return script( dir, "fakepan", SCRIPT );
	}

	static File script( File dir, String name, String body ) throws IOException {
		File script = new File( dir, name );
		FileUtils.writeStringToFile( script, body, StandardCharsets.UTF_8 );
		if( !script.setExecutable( true )){
			throw new IOException( "Unable to make " + script + " executable" );
		}

		return script;
	}
}
