package mhcbatch.predict;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

/**
 * Reads the whitespace-delimited result tables printed by the NetMHC family of predictors into
 * {@link PredictionRecord}s. The column layout comes from a {@link ParserSpec}; the rules for
 * finding the data rows are shared by every layout:
 *
 * <ul>
 * <li>nothing counts until the first rule of dashes ({@code ---...}); several versions print
 * banners and one sub-table per allele, each introduced by its own rule;</li>
 * <li>after that, blank lines, {@code #} comments, further rules and header lines that start with
 * a known header word are skipped;</li>
 * <li>a row that is too short or has an unparsable number is dropped, not reported.</li>
 * </ul>
 */
public final class TabularOutputParser {

	private static Logger logger = PredictionLogger.getLogger();

	public static final Set<String> HEADER_TOKENS = Collections.unmodifiableSet( new HashSet<String>( Arrays.asList(
			"pos", "Pos", "Seq", "Number", "Protein", "Allele", "NetMHC", "Strong", "Identity" )));

	// affinity = 50000^(1 - score)
	static final double LOG_AFFINITY_BASE = 50000.0;

	private TabularOutputParser(){}

	public static List<PredictionRecord> parse( String raw, ParserSpec spec, Map<String,String> keyMap, String methodName ) throws ToolOutputException {

		if( spec.isErrorChecked()){
			checkForError( raw, ( methodName == null ? spec.getName() : methodName ));
		}

		List<PredictionRecord> records = new ArrayList<PredictionRecord>();
		int dropped = 0;

		for( String[] fields : splitLines( raw )){
			PredictionRecord record = parseRow( clean( fields, spec ), spec, keyMap, methodName );
			if( record == null ){
				dropped++;

			} else {
				records.add( record );
			}
		}

		if( dropped > 0 ){
			logger.debug( "Dropped " + dropped + " unparsable row(s) of " + spec.getName() + " output" );
		}

		return records;
	}

	/**
	 * Tokenized data rows of a table, in order.
	 */
	public static List<String[]> splitLines( String raw ){

		List<String[]> rows = new ArrayList<String[]>();
		boolean seenDash = false;

		for( String line : raw.split( "\n" )){
			line = line.trim();

			if( line.startsWith( "---" )){
				seenDash = true;
				continue;
			}

			if( !seenDash || line.length() == 0 || line.startsWith( "#" ) || isHeader( line )){
				continue;
			}

			rows.add( StringUtils.split( line ));
		}

		return rows;
	}

	private static boolean isHeader( String line ){
		for( String token : HEADER_TOKENS ){
			if( line.startsWith( token )){
				return true;
			}
		}

		return false;
	}

	/**
	 * Drops marker tokens found at the column declared for them, then applies the per-column
	 * transforms. Indices of the transforms refer to the cleaned row.
	 */
	static List<String> clean( String[] fields, ParserSpec spec ){

		Map<String,Integer> ignored = spec.getIgnoredValueIndices();
		Map<Integer,FieldTransform> transforms = spec.getTransforms();
		List<String> cleaned = new ArrayList<String>( fields.length );

		for( int i = 0; i < fields.length; i++ ){
			Integer at = ignored.get( fields[i] );
			if( at != null && at.intValue() == i ){
				continue;
			}

			cleaned.add( fields[i] );
		}

		for( Map.Entry<Integer,FieldTransform> entry : transforms.entrySet()){
			int i = entry.getKey();
			if( i < cleaned.size()){
				try {
					cleaned.set( i, entry.getValue().apply( cleaned.get( i )));

				} catch( RuntimeException e ){
//
// leave the field as it is; reading it below fails and drops the row.
					logger.debug( "Transform failed on column " + i + ": " + e.getMessage());
					cleaned.set( i, "" );
				}
			}
		}

		return cleaned;
	}

	private static PredictionRecord parseRow( List<String> fields, ParserSpec spec, Map<String,String> keyMap, String methodName ){

		if( fields.size() < spec.getRequiredColumns()){
			return null;
		}

		int offset;
		Double affinity = null, score = null, rank = null;

		try {
			offset = Integer.parseInt( fields.get( spec.getOffsetIndex()));

			if( spec.getAffinityIndex() != null ){
				affinity = parseNumber( fields.get( spec.getAffinityIndex()));
			}

			if( spec.getScoreIndex() != null ){
				score = parseNumber( fields.get( spec.getScoreIndex()));
			}

			if( spec.getRankIndex() != null ){
				rank = parseNumber( fields.get( spec.getRankIndex()));
			}

		} catch( NumberFormatException e ){
			return null;
		}

		String peptide = fields.get( spec.getPeptideIndex());
		String allele = fields.get( spec.getAlleleIndex());
		String key = fields.get( spec.getKeyIndex());

		if( affinity != null && !PredictionRecord.isValidAffinity( affinity )){
			affinity = recoverAffinity( score );
			if( affinity == null ){
				logger.debug( "Dropping " + peptide + " w/ allele " + allele + ": invalid affinity" );
				return null;
			}
		}

		if( rank != null && !PredictionRecord.isValidPercentileRank( rank )){
			logger.debug( "Dropping " + peptide + " w/ allele " + allele + ": invalid percentile rank " + rank );
			return null;
		}

		String sourceKey = key;
		if( keyMap != null ){
			sourceKey = keyMap.get( key );
			if( sourceKey == null ){
				logger.warn( "Dropping " + peptide + ": unknown sequence key " + key );
				return null;
			}
		}

		return new PredictionRecord( sourceKey, offset, peptide, AlleleNames.normalize( allele ),
				affinity, score, rank, methodName );
	}

	// tools print nan/inf the C way, which Double.valueOf does not accept.
	static Double parseNumber( String field ){

		String lower = field.toLowerCase();
		if( lower.equals( "nan" ) || lower.equals( "-nan" )){
			return Double.NaN;
		}

		if( lower.equals( "inf" ) || lower.equals( "+inf" ) || lower.equals( "infinity" )){
			return Double.POSITIVE_INFINITY;
		}

		if( lower.equals( "-inf" ) || lower.equals( "-infinity" )){
			return Double.NEGATIVE_INFINITY;
		}

		return Double.valueOf( field );
	}

	/** The affinity behind a 1-log50k score, or null when neither is usable. */
	static Double recoverAffinity( Double score ){

		if( score == null || Double.isNaN( score ) || Double.isInfinite( score )){
			return null;
		}

		double affinity = Math.pow( LOG_AFFINITY_BASE, 1.0 - score );
		return( PredictionRecord.isValidAffinity( affinity ) ? Double.valueOf( affinity ) : null );
	}

	// an error is reported by a line that starts with ERROR, or by any banner line above the first
	// rule that mentions it. Data rows may carry "error" inside a sequence key.
	static void checkForError( String raw, String program ) throws ToolOutputException {

		boolean seenDash = false;

		for( String line : raw.split( "\n" )){
			line = line.trim();

			if( line.startsWith( "---" )){
				seenDash = true;
				continue;
			}

			String upper = line.toUpperCase( Locale.ROOT );
			if( upper.startsWith( "ERROR" )){
				throw new ToolOutputException( program, line );
			}

			if( !seenDash && upper.indexOf( "ERROR" ) != -1 ){
				throw new ToolOutputException( program, line );
			}
		}
	}
}
