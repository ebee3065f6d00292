package mhcbatch.predict;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

/**
 * Runs one command-line binding predictor, described by a {@link ToolSpec}, over peptides or over
 * every subsequence of a set of protein sequences, and returns the validated records.
 *
 * <p>The tool is probed once, when the predictor is created: with a supported-alleles flag the
 * tool's allele list is read and every requested allele must be on it; without one the program is
 * simply run once on its own. Each prediction call then
 * <ol>
 * <li>writes the input into bounded chunk files,</li>
 * <li>builds one command per chunk and allele (and peptide length, for sequences),</li>
 * <li>runs the commands under the tool's process limit,</li>
 * <li>parses every output file and checks the merged records against the requested
 * (peptide, allele) pairs.</li>
 * </ol>
 * Every file and directory created by a call is removed before the call returns or throws.
 */
public class CommandLinePredictor {

	private static Logger logger = PredictionLogger.getLogger();

	private final ToolSpec spec;
	private final List<String> alleles;

	public CommandLinePredictor( ToolSpec spec, List<String> alleles ) throws PredictionException {

		if( spec == null ){
			throw new ConfigurationException( "A tool spec is required" );
		}

		this.spec = spec;
		this.alleles = Collections.unmodifiableList( normalizeAlleles( alleles ));

		checkAlleles( probe());
	}

	public ToolSpec getToolSpec(){
		return spec;
	}

	/** Normalized, de-duplicated alleles in the order they were first given. */
	public List<String> getAlleles(){
		return alleles;
	}

	static List<String> normalizeAlleles( List<String> raw ) throws ConfigurationException {

		if( raw == null || raw.isEmpty()){
			throw new ConfigurationException( "At least one allele is required" );
		}

		Set<String> unique = new LinkedHashSet<String>();
		for( String allele : raw ){
			if( StringUtils.isBlank( allele )){
				throw new ConfigurationException( "Blank allele name in " + raw );
			}

			unique.add( AlleleNames.normalize( allele.trim().toUpperCase()));
		}

		return new ArrayList<String>( unique );
	}

	// supported alleles, or null when the tool cannot list them.
	private Set<String> probe() throws ToolUnavailableException {

		String program = spec.getProgramName();
		String flag = spec.getSupportedAllelesFlag();

		if( flag == null ){
			try {
				CommandRunner.runCommand( Arrays.asList( program ));

			} catch( PredictionException e ){
				throw new ToolUnavailableException( program, "Failed to run " + program, e );
			}

			return null;
		}

		String listing;
		try {
			listing = CommandRunner.captureOutput( Arrays.asList( program, flag ));

		} catch( PredictionException e ){
			logger.error( "Unable to list alleles of " + program, e );
			throw new ToolUnavailableException( program, "Failed to run " + program + " " + flag +
					". Possibly an incorrect executable version?", e );
		}

		Set<String> supported = new LinkedHashSet<String>();
		for( String line : listing.split( "\n" )){
			line = line.trim();
			if( line.length() > 0 && !line.startsWith( "#" )){
				supported.add( AlleleNames.normalize( line ));
			}
		}

		if( supported.isEmpty()){
			throw new ToolUnavailableException( program, program + " " + flag + " returned an empty allele list" );
		}

		logger.debug( program + " supports " + supported.size() + " alleles" );
		return supported;
	}

	private void checkAlleles( Set<String> supported ) throws UnsupportedAlleleException {

		if( supported == null ){
			return;
		}

		List<String> missing = new ArrayList<String>();
		for( String allele : alleles ){
			if( !supported.contains( allele )){
				missing.add( allele );
			}
		}

		if( !missing.isEmpty()){
			throw new UnsupportedAlleleException( missing, new StringBuffer( "Unsupported HLA alleles: " ).append( missing ).append(
					"\nRun command " ).append( spec.getProgramName()).append( " " ).append( spec.getSupportedAllelesFlag()).append(
					" to see a list of valid alleles" ).toString());
		}
	}

	/**
	 * Predicts every peptide against every allele. Records carry no source sequence and offset 0.
	 */
	public RunResult predictPeptides( List<String> peptides ) throws PredictionException {

		checkPeptides( peptides );
		logger.info( "Predicting " + peptides.size() + " peptides for " + alleles.size() + " allele(s) with " + spec.getProgramName());

		CleanupFiles cleanup = new CleanupFiles();
		try {
			List<InputChunk> chunks = SequencePartitioner.partitionPeptides( peptides, spec.getMaxRecordsPerFile(),
					spec.isGroupPeptidesByLength(), workDir());
			register( cleanup, chunks );

			List<Invocation> invocations = new ArrayList<Invocation>();
			for( int i = 0; i < chunks.size(); i++ ){
				for( int j = 0; j < alleles.size(); j++ ){
					invocations.add( invocation( cleanup, chunks.get( i ), i, j, null, true ));
				}
			}

			List<List<PredictionRecord>> parsed = run( invocations, null );
			for( List<PredictionRecord> records : parsed ){
				for( int k = 0; k < records.size(); k++ ){
					records.set( k, records.get( k ).withSource( null, 0 ));
				}
			}

			return PredictionAggregator.aggregate( parsed, peptides, alleles, spec.getOrdering());

		} catch( IOException e ){
			throw new PredictionException( "Unable to prepare input for " + spec.getProgramName() + ": " + e.getMessage(), e );

		} finally {
			cleanup.close();
		}
	}

	/**
	 * Predicts every subsequence of the given lengths (the tool's defaults when null or empty) of
	 * every sequence against every allele. Records carry the caller's sequence key and the 0-based
	 * offset of the peptide in that sequence.
	 */
	public RunResult predictSubsequences( Map<String,String> sequences, List<Integer> lengths ) throws PredictionException {

		List<Integer> peptideLengths = checkLengths( lengths );
		List<String> peptides = new ArrayList<String>();

		for( String sequence : sequences.values()){
			if( sequence == null ){
				throw new ConfigurationException( "Null sequence given to " + spec.getProgramName());
			}

			for( Integer length : peptideLengths ){
				for( int i = 0; i + length <= sequence.length(); i++ ){
					peptides.add( sequence.substring( i, i + length ));
				}
			}
		}

		logger.info( "Predicting " + peptides.size() + " peptides from " + sequences.size() + " sequence(s) for " +
				alleles.size() + " allele(s) with " + spec.getProgramName());

		CleanupFiles cleanup = new CleanupFiles();
		try {
			List<InputChunk> chunks = SequencePartitioner.partitionSequences( sequences, spec.getMaxRecordsPerFile(), workDir());
			register( cleanup, chunks );

			List<Invocation> invocations = new ArrayList<Invocation>();
			for( int i = 0; i < chunks.size(); i++ ){
				for( int j = 0; j < alleles.size(); j++ ){
					for( Integer length : peptideLengths ){
						invocations.add( invocation( cleanup, chunks.get( i ), i, j, length, false ));
					}
				}
			}

			List<List<PredictionRecord>> parsed = run( invocations, SequencePartitioner.combinedKeyMap( chunks ));
			return PredictionAggregator.aggregate( parsed, peptides, alleles, spec.getOrdering());

		} catch( IOException e ){
			throw new PredictionException( "Unable to prepare input for " + spec.getProgramName() + ": " + e.getMessage(), e );

		} finally {
			cleanup.close();
		}
	}

	private List<List<PredictionRecord>> run( List<Invocation> invocations, Map<String,String> keyMap ) throws PredictionException, IOException {

		ProcessScheduler scheduler = new ProcessScheduler( spec.getPollingInterval(), spec.isShowStderr());
		scheduler.runAll( invocations, spec.getProcessLimit());

		List<List<PredictionRecord>> parsed = new ArrayList<List<PredictionRecord>>();
		int total = 0;

		for( Invocation invocation : invocations ){
			String raw = FileUtils.readFileToString( invocation.getOutputFile(), StandardCharsets.UTF_8 );
			List<PredictionRecord> records = TabularOutputParser.parse( raw, spec.getParserSpec(), keyMap, spec.getProgramName());
			total += records.size();
			parsed.add( records );
		}

		if( total == 0 ){
			logger.warn( "No binding predictions from " + spec.getProgramName());
		}

		return parsed;
	}

	private Invocation invocation( CleanupFiles cleanup, InputChunk chunk, int chunkIndex, int alleleIndex, Integer length, boolean peptideMode ) throws IOException {

		String name = toolName();
		File tempDir = null;

		if( spec.getTempDirFlag() != null ){
			String prefix = new StringBuffer( "tmp_" ).append( chunkIndex ).append( '_' ).append( alleleIndex ).append( '_' ).append( name ).toString();
			File dir = workDir();
			tempDir = cleanup.addDirectory(( dir == null ? Files.createTempDirectory( prefix ) : Files.createTempDirectory( dir.toPath(), prefix )).toFile());
			logger.debug( "Created temporary directory " + tempDir + " for allele " + alleles.get( alleleIndex ));
		}

		String prefix = new StringBuffer( name ).append( "_output_" ).append( chunkIndex ).append( '_' ).append( alleleIndex ).append(
				'_' ).append(( length == null ? "all" : String.valueOf( length ))).append( '_' ).toString();
		File output = cleanup.addFile( File.createTempFile( prefix, ".txt", workDir()));

		List<String> argv = CommandBuilder.build( spec, chunk.getFile(), alleles.get( alleleIndex ), length, tempDir, peptideMode );
		return new Invocation( argv, output, tempDir );
	}

	private static void register( CleanupFiles cleanup, List<InputChunk> chunks ){
		for( InputChunk chunk : chunks ){
			cleanup.addFile( chunk.getFile());
		}
	}

	// the program may be given as a path; only its file name goes into temp names.
	private String toolName(){
		String name = new File( spec.getProgramName()).getName();
		return( name.length() == 0 ? "predictor" : name );
	}

	private File workDir() throws IOException {
		File dir = spec.getWorkDir();
		if( dir != null && !dir.isDirectory()){
			FileUtils.forceMkdir( dir );
		}

		return dir;
	}

	private void checkPeptides( List<String> peptides ) throws ConfigurationException {

		if( peptides == null || peptides.isEmpty()){
			throw new ConfigurationException( "No peptides given to " + spec.getProgramName());
		}

		for( String peptide : peptides ){
			if( StringUtils.isEmpty( peptide ) || !StringUtils.isAlpha( peptide )){
				throw new ConfigurationException( "Invalid peptide: '" + peptide + "'" );
			}

			if( peptide.length() < spec.getMinPeptideLength()){
				throw new ConfigurationException( "Peptide " + peptide + " is shorter than " + spec.getMinPeptideLength() +
						", the minimum for " + spec.getProgramName());
			}

			if( spec.getMaxPeptideLength() != null && peptide.length() > spec.getMaxPeptideLength()){
				throw new ConfigurationException( "Peptide " + peptide + " is longer than " + spec.getMaxPeptideLength() +
						", the maximum for " + spec.getProgramName());
			}
		}
	}

	private List<Integer> checkLengths( List<Integer> lengths ) throws ConfigurationException {

		List<Integer> checked = ( lengths == null || lengths.isEmpty() ? spec.getDefaultPeptideLengths() : lengths );
		if( checked.isEmpty()){
			throw new ConfigurationException( "No peptide lengths given and " + spec.getProgramName() + " has no defaults" );
		}

		for( Integer length : checked ){
			if( length == null || length < spec.getMinPeptideLength() ||
					( spec.getMaxPeptideLength() != null && length > spec.getMaxPeptideLength())){
				throw new ConfigurationException( "Unsupported peptide length " + length + " for " + spec.getProgramName());
			}
		}

		return new ArrayList<Integer>( new LinkedHashSet<Integer>( checked ));
	}

	@Override
	public String toString(){
		return new StringBuffer( "CommandLinePredictor(" ).append( spec.getProgramName()).append( ", alleles=" ).append( alleles ).append( ")" ).toString();
	}
}
