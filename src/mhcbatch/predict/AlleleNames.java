package mhcbatch.predict;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/*
 * Canonical spelling of the allele names that predictors print, e.g. HLA-A0201, HLA-A02:01,
 * A*02:01:01 and hla-a*02:01 all become HLA-A*02:01; DRB1_0301 becomes HLA-DRB1*03:01 and the
 * pair HLA-DQA10501-DQB10201 becomes HLA-DQA1*05:01-DQB1*02:01.
 * Names that do not look like HLA or mouse H-2 alleles are only trimmed and upper-cased.
 *
 * Results are memoized process-wide; the table only grows and is safe to share between runs.
 */
public final class AlleleNames {

	private static final Pattern HLA = Pattern.compile( "^(?:HLA-?)?(A|B|C|E|F|G|D[RPQ][AB]\\d?)[*_]?(\\d[\\d:]*)([A-Z]?)$" );
	private static final Pattern MOUSE = Pattern.compile( "^H-?2-?([KDLI])([A-Za-z])$", Pattern.CASE_INSENSITIVE );

	private static final Map<String,String> cache = new ConcurrentHashMap<String,String>();

	private AlleleNames(){}

	public static String normalize( String raw ){

		if( raw == null || raw.trim().length() == 0 ){
			throw new IllegalArgumentException( "Empty allele name" );
		}

		String cached = cache.get( raw );
		if( cached != null ){
			return cached;
		}

		String normalized = parse( raw.trim());
		cache.put( raw, normalized );
		return normalized;
	}

	static int cacheSize(){
		return cache.size();
	}

	// class II alpha/beta pairs, e.g. HLA-DQA10501-DQB10201; each chain is normalized on its own.
	private static String parsePair( String upper ){

		String rest = ( upper.startsWith( "HLA-" ) ? upper.substring( 4 ) : upper );
		int dash = rest.indexOf( '-' );
		if( dash <= 0 || dash == rest.length() - 1 ){
			return null;
		}

		String alpha = rest.substring( 0, dash );
		String beta = rest.substring( dash + 1 );
		if( beta.startsWith( "HLA-" )){
			beta = beta.substring( 4 );
		}

		if( !isClassTwoChain( alpha ) || !isClassTwoChain( beta )){
			return null;
		}

		return new StringBuffer( parse( alpha )).append( '-' ).append( parse( beta ).substring( 4 )).toString();
	}

	private static boolean isClassTwoChain( String chain ){
		Matcher m = HLA.matcher( chain );
		return( m.matches() && m.group( 1 ).startsWith( "D" ));
	}

	private static String parse( String name ){

		Matcher mouse = MOUSE.matcher( name );
		if( mouse.matches()){
			return new StringBuffer( "H-2-" ).append( mouse.group( 1 ).toUpperCase()).append( mouse.group( 2 ).toLowerCase()).toString();
		}

		String upper = name.toUpperCase();
		String pair = parsePair( upper );
		if( pair != null ){
			return pair;
		}

		Matcher hla = HLA.matcher( upper );
		if( !hla.matches()){
			return upper;
		}

		String gene = hla.group( 1 );
		String digits = hla.group( 2 );
		String suffix = hla.group( 3 );
		String family, protein;

		if( digits.indexOf( ':' ) != -1 ){
			String[] fields = digits.split( ":" );
			if( fields.length < 2 ){
				return upper;
			}

			family = fields[0];
			protein = fields[1];

		} else if( digits.length() == 2 ){
			family = digits;
			protein = null;

		} else if( digits.length() == 4 ){
			family = digits.substring( 0, 2 );
			protein = digits.substring( 2 );

		} else if( digits.length() == 5 ){
			family = digits.substring( 0, 2 );
			protein = digits.substring( 2 );

		} else if( digits.length() == 6 ){
			family = digits.substring( 0, 3 );
			protein = digits.substring( 3 );

		} else {
			return upper;
		}

		StringBuffer buffer = new StringBuffer( "HLA-" ).append( gene ).append( '*' ).append( family );
		if( protein != null ){
			buffer.append( ':' ).append( protein );
		}

		return buffer.append( suffix ).toString();
	}
}
