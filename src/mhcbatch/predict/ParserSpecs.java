package mhcbatch.predict;

/*
 * Column layouts of the table formats printed by the NetMHC family of predictors.
 */
public final class ParserSpecs {

	private ParserSpecs(){}

//
// pos  peptide  logscore  affinity(nM)  [WB|SB]  Protein-Name  Allele
// the bind level only shows up on binder rows and shifts everything after it.
	public static final ParserSpec NETMHC3 = ParserSpec.builder( "NetMHC-3.x" )
			.offset( 0 ).peptide( 1 ).score( 2 ).affinity( 3 ).key( 4 ).allele( 5 )
			.ignore( "WB", 4 ).ignore( "SB", 4 )
			.build();

//
// pos  HLA  peptide  Core  Offset  I_pos  I_len  D_pos  D_len  iCore  Identity  1-log50k(aff)  Affinity(nM)  %Rank
	public static final ParserSpec NETMHC4 = ParserSpec.builder( "NetMHC-4.0" )
			.offset( 0 ).allele( 1 ).peptide( 2 ).key( 10 ).score( 11 ).affinity( 12 ).rank( 13 )
			.build();

//
// pos  HLA  peptide  Identity  1-log50k(aff)  Affinity(nM)  %Rank
	public static final ParserSpec NETMHCPAN28 = ParserSpec.builder( "NetMHCpan-2.8" )
			.offset( 0 ).allele( 1 ).peptide( 2 ).key( 3 ).score( 4 ).affinity( 5 ).rank( 6 )
			.checkErrors( true )
			.build();

//
// Pos  HLA  Peptide  Core  Of  Gp  Gl  Ip  Il  Icore  Identity  Score  Aff(nM)  %Rank
// positions are 1-based.
	public static final ParserSpec NETMHCPAN3 = ParserSpec.builder( "NetMHCpan-3.0" )
			.offset( 0 ).allele( 1 ).peptide( 2 ).key( 10 ).score( 11 ).affinity( 12 ).rank( 13 )
			.transform( 0, FieldTransform.ONE_BASED_TO_ZERO_BASED )
			.build();

	// same table as 3.0 when run in binding-affinity mode (-BA).
	public static final ParserSpec NETMHCPAN4 = ParserSpec.builder( "NetMHCpan-4.0" )
			.offset( 0 ).allele( 1 ).peptide( 2 ).key( 10 ).score( 11 ).affinity( 12 ).rank( 13 )
			.transform( 0, FieldTransform.ONE_BASED_TO_ZERO_BASED )
			.build();

	public static final ParserSpec NETMHCCONS = ParserSpec.builder( "NetMHCcons" )
			.offset( 0 ).allele( 1 ).peptide( 2 ).key( 3 ).score( 4 ).affinity( 5 ).rank( 6 )
			.build();

//
// Seq  Allele  Peptide  Identity  Pos  Core  Core_Rel  1-log50k(aff)  Affinity(nM)  %Rank  Exp_Bind
	public static final ParserSpec NETMHCIIPAN = ParserSpec.builder( "NetMHCIIpan" )
			.offset( 0 ).allele( 1 ).peptide( 2 ).key( 3 ).score( 7 ).affinity( 8 ).rank( 9 )
			.checkErrors( true )
			.build();

	public static ParserSpec forName( String name ){

		String key = name.trim().toLowerCase();
		if( key.equals( "netmhc3" )){ return NETMHC3; }
		if( key.equals( "netmhc4" )){ return NETMHC4; }
		if( key.equals( "netmhcpan28" ) || key.equals( "netmhcpan" )){ return NETMHCPAN28; }
		if( key.equals( "netmhcpan3" )){ return NETMHCPAN3; }
		if( key.equals( "netmhcpan4" )){ return NETMHCPAN4; }
		if( key.equals( "netmhccons" )){ return NETMHCCONS; }
		if( key.equals( "netmhciipan" )){ return NETMHCIIPAN; }

		throw new IllegalArgumentException( "Unknown output format: " + name );
	}
}
