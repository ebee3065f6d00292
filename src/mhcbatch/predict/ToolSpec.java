package mhcbatch.predict;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

/**
 * Declarative description of one command-line predictor: how its flags are spelled, how its
 * output is laid out, and how runs against it are sized. One engine, {@link CommandLinePredictor},
 * serves every tool through this table.
 *
 * <p>Values not set on the builder fall back to {@link PredictorSettings}.
 */
public final class ToolSpec {

	private final String programName;
	private final String alleleFlag;
	private final String lengthFlag;
	private final String inputFileFlag;
	private final String tempDirFlag;
	private final String supportedAllelesFlag;
	private final List<String> peptideModeFlags;
	private final List<String> extraFlags;
	private final AlleleNameFormatter alleleNameFormatter;
	private final ParserSpec parserSpec;
	private final int maxRecordsPerFile;
	private final int processLimit;
	private final List<Integer> defaultPeptideLengths;
	private final boolean groupPeptidesByLength;
	private final int minPeptideLength;
	private final Integer maxPeptideLength;
	private final Comparator<PredictionRecord> ordering;
	private final boolean showStderr;
	private final long pollingInterval;
	private final File workDir;

	private ToolSpec( Builder b ){
		this.programName = b.programName;
		this.alleleFlag = b.alleleFlag;
		this.lengthFlag = b.lengthFlag;
		this.inputFileFlag = b.inputFileFlag;
		this.tempDirFlag = b.tempDirFlag;
		this.supportedAllelesFlag = b.supportedAllelesFlag;
		this.peptideModeFlags = Collections.unmodifiableList( new ArrayList<String>( b.peptideModeFlags ));
		this.extraFlags = Collections.unmodifiableList( new ArrayList<String>( b.extraFlags ));
		this.alleleNameFormatter = b.alleleNameFormatter;
		this.parserSpec = b.parserSpec;
		this.maxRecordsPerFile = b.maxRecordsPerFile;
		this.processLimit = b.processLimit;
		this.defaultPeptideLengths = Collections.unmodifiableList( new ArrayList<Integer>( b.defaultPeptideLengths ));
		this.groupPeptidesByLength = b.groupPeptidesByLength;
		this.minPeptideLength = b.minPeptideLength;
		this.maxPeptideLength = b.maxPeptideLength;
		this.ordering = b.ordering;
		this.showStderr = b.showStderr;
		this.pollingInterval = b.pollingInterval;
		this.workDir = b.workDir;
	}

	public static Builder builder( String programName ){
		return new Builder( programName );
	}

	public String getProgramName(){
		return programName;
	}

	public String getAlleleFlag(){
		return alleleFlag;
	}

	public String getLengthFlag(){
		return lengthFlag;
	}

	// null when the tool takes its input file as a bare argument.
	public String getInputFileFlag(){
		return inputFileFlag;
	}

	public String getTempDirFlag(){
		return tempDirFlag;
	}

	public String getSupportedAllelesFlag(){
		return supportedAllelesFlag;
	}

	public List<String> getPeptideModeFlags(){
		return peptideModeFlags;
	}

	public List<String> getExtraFlags(){
		return extraFlags;
	}

	public String prepareAlleleName( String allele ){
		return alleleNameFormatter.format( allele );
	}

	public ParserSpec getParserSpec(){
		return parserSpec;
	}

	public int getMaxRecordsPerFile(){
		return maxRecordsPerFile;
	}

	public int getProcessLimit(){
		return processLimit;
	}

	public List<Integer> getDefaultPeptideLengths(){
		return defaultPeptideLengths;
	}

	public boolean isGroupPeptidesByLength(){
		return groupPeptidesByLength;
	}

	public int getMinPeptideLength(){
		return minPeptideLength;
	}

	public Integer getMaxPeptideLength(){
		return maxPeptideLength;
	}

	public Comparator<PredictionRecord> getOrdering(){
		return ordering;
	}

	public boolean isShowStderr(){
		return showStderr;
	}

	public long getPollingInterval(){
		return pollingInterval;
	}

	public File getWorkDir(){
		return workDir;
	}

	@Override
	public String toString(){
		return new StringBuffer( "ToolSpec(" ).append( programName ).append( ", " ).append( parserSpec ).append( ")" ).toString();
	}

	public static final class Builder {

		private final String programName;
		private String alleleFlag = "-a";
		private String lengthFlag = "-l";
		private String inputFileFlag = "-f";
		private String tempDirFlag;
		private String supportedAllelesFlag;
		private List<String> peptideModeFlags = Arrays.asList( "-p" );
		private List<String> extraFlags = new ArrayList<String>();
		private AlleleNameFormatter alleleNameFormatter = AlleleNameFormatter.STRIP_ASTERISK;
		private ParserSpec parserSpec;
		private int maxRecordsPerFile = PredictorSettings.getMaxRecordsPerFile();
		private int processLimit = PredictorSettings.getProcessLimit();
		private List<Integer> defaultPeptideLengths = Arrays.asList( 9 );
		private boolean groupPeptidesByLength = false;
		private int minPeptideLength = 8;
		private Integer maxPeptideLength;
		private Comparator<PredictionRecord> ordering = PredictionRecord.BY_AFFINITY;
		private boolean showStderr = PredictorSettings.isShowStderr();
		private long pollingInterval = PredictorSettings.getPollingInterval();
		private File workDir = PredictorSettings.getWorkDir();

		private Builder( String programName ){
			this.programName = programName;
		}

		public Builder alleleFlag( String flag ){
			this.alleleFlag = flag;
			return this;
		}

		public Builder lengthFlag( String flag ){
			this.lengthFlag = flag;
			return this;
		}

		public Builder inputFileFlag( String flag ){
			this.inputFileFlag = flag;
			return this;
		}

		public Builder tempDirFlag( String flag ){
			this.tempDirFlag = flag;
			return this;
		}

		public Builder supportedAllelesFlag( String flag ){
			this.supportedAllelesFlag = flag;
			return this;
		}

		public Builder peptideModeFlags( String... flags ){
			this.peptideModeFlags = Arrays.asList( flags );
			return this;
		}

		public Builder extraFlags( String... flags ){
			this.extraFlags = Arrays.asList( flags );
			return this;
		}

		public Builder alleleNameFormatter( AlleleNameFormatter formatter ){
			this.alleleNameFormatter = formatter;
			return this;
		}

		public Builder parserSpec( ParserSpec spec ){
			this.parserSpec = spec;
			return this;
		}

		public Builder maxRecordsPerFile( int max ){
			this.maxRecordsPerFile = max;
			return this;
		}

		public Builder processLimit( int limit ){
			this.processLimit = limit;
			return this;
		}

		public Builder defaultPeptideLengths( Integer... lengths ){
			this.defaultPeptideLengths = Arrays.asList( lengths );
			return this;
		}

		public Builder groupPeptidesByLength( boolean group ){
			this.groupPeptidesByLength = group;
			return this;
		}

		public Builder minPeptideLength( int length ){
			this.minPeptideLength = length;
			return this;
		}

		public Builder maxPeptideLength( Integer length ){
			this.maxPeptideLength = length;
			return this;
		}

		public Builder ordering( Comparator<PredictionRecord> ordering ){
			this.ordering = ordering;
			return this;
		}

		public Builder showStderr( boolean show ){
			this.showStderr = show;
			return this;
		}

		public Builder pollingInterval( long millis ){
			this.pollingInterval = millis;
			return this;
		}

		public Builder workDir( File dir ){
			this.workDir = dir;
			return this;
		}

		public ToolSpec build() throws ConfigurationException {

			if( StringUtils.isBlank( programName )){
				throw new ConfigurationException( "Predictor program name is required" );
			}

			if( StringUtils.isBlank( alleleFlag )){
				throw new ConfigurationException( programName + ": allele flag is required" );
			}

			if( StringUtils.isBlank( lengthFlag )){
				throw new ConfigurationException( programName + ": peptide length flag is required" );
			}

			if( inputFileFlag != null && StringUtils.isBlank( inputFileFlag )){
				throw new ConfigurationException( programName + ": input file flag may not be blank" );
			}

			if( tempDirFlag != null && StringUtils.isBlank( tempDirFlag )){
				throw new ConfigurationException( programName + ": temporary directory flag may not be blank" );
			}

			if( supportedAllelesFlag != null && StringUtils.isBlank( supportedAllelesFlag )){
				throw new ConfigurationException( programName + ": supported alleles flag may not be blank" );
			}

			checkFlags( "peptide mode", peptideModeFlags );
			checkFlags( "extra", extraFlags );

			if( alleleNameFormatter == null ){
				throw new ConfigurationException( programName + ": allele name formatter is required" );
			}

			if( parserSpec == null ){
				throw new ConfigurationException( programName + ": output parser spec is required" );
			}

			if( ordering == null ){
				throw new ConfigurationException( programName + ": result ordering is required" );
			}

			if( defaultPeptideLengths == null ){
				defaultPeptideLengths = new ArrayList<Integer>();
			}

			for( Integer length : defaultPeptideLengths ){
				if( length == null || length <= 0 ){
					throw new ConfigurationException( programName + ": invalid default peptide length " + length );
				}
			}

			if( minPeptideLength <= 0 ){
				throw new ConfigurationException( programName + ": minimum peptide length must be positive" );
			}

			if( maxPeptideLength != null && maxPeptideLength < minPeptideLength ){
				throw new ConfigurationException( programName + ": maximum peptide length " + maxPeptideLength +
						" is below the minimum " + minPeptideLength );
			}

			if( pollingInterval <= 0 ){
				throw new ConfigurationException( programName + ": polling interval must be positive" );
			}

			return new ToolSpec( this );
		}

		private void checkFlags( String kind, List<String> flags ) throws ConfigurationException {
			if( flags == null ){
				throw new ConfigurationException( programName + ": " + kind + " flags may not be null" );
			}

			for( String flag : flags ){
				if( StringUtils.isBlank( flag )){
					throw new ConfigurationException( programName + ": blank entry in " + kind + " flags" );
				}
			}
		}
	}
}
