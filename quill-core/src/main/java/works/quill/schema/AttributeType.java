package works.quill.schema;

import java.util.Locale;

/**
 * The value space of an attribute, as far as mutation validation cares.
 */
public enum AttributeType {
	STRING,
	TOKEN,
	NCNAME,
	ID,
	IDREF,
	ENUMERATED;

	/**
	 * @return the type corresponding to a grammar datatype name; unknown names are {@link #STRING}
	 */
	public static AttributeType fromDatatype(String datatype) {
		switch (datatype.trim().toUpperCase(Locale.ROOT)) {
			case "ID": return ID;
			case "IDREF":
			case "IDREFS":
			case "ANYURI": // TEI's pointers (who, ref, corresp...) are anyURI
				return IDREF;
			case "NCNAME": return NCNAME;
			case "TOKEN":
			case "NMTOKEN":
				return TOKEN;
			default: return STRING;
		}
	}
}
