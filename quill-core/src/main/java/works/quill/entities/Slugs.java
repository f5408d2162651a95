package works.quill.entities;

import java.util.Locale;
import java.util.regex.Pattern;
import works.quill.Identifier;

/**
 * Derives markup-safe identifiers from display names.
 */
public final class Slugs {
	private Slugs() { }

	private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");

	/**
	 * Lowercases <code>name</code>, turns each run of other characters into a single hyphen,
	 * and trims hyphens from the ends. The result is always a valid NCName:
	 * names that slug to nothing become <code>unnamed</code>, and
	 * slugs that would start with a digit get an <code>n-</code> prefix.
	 */
	public static String slug(String name) {
		String lowered = name.toLowerCase(Locale.ROOT);
		String hyphenated = NON_ALPHANUMERIC.matcher(lowered).replaceAll("-");
		int begin = 0;
		int end = hyphenated.length();
		while (begin < end && hyphenated.charAt(begin) == '-') {
			begin++;
		}
		while (end > begin && hyphenated.charAt(end - 1) == '-') {
			end--;
		}
		String result = hyphenated.substring(begin, end);
		if (result.isEmpty()) {
			return "unnamed";
		} else if (java.lang.Character.isDigit(result.charAt(0))) {
			return "n-" + result;
		} else {
			return result;
		}
	}

	/**
	 * @return the engine id for an entity of the given type with the given xmlId
	 */
	public static Identifier entityId(EntityType type, String xmlId) {
		return Identifier.prefixed(type.idPrefix(), xmlId);
	}
}
