package works.quill;

import java.util.Comparator;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * The key of anything that can be looked up in a {@link Catalog}:
 * passages, tags, entities and relationships.
 */
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
@EqualsAndHashCode
public final class Identifier implements Comparable<Identifier> {
	@NonNull final String value;

	/**
	 * Compares by lexicographic order on the string representation.
	 */
	@Override
	public int compareTo(Identifier other) {
		return value.compareTo(other.value);
	}

	public static Identifier from(String value) {
		if (value.isEmpty()) {
			throw new IllegalArgumentException("Identifier can't be empty");
		} else if (value.startsWith("-") || value.endsWith("-")) {
			throw new IllegalArgumentException("Identifier can't start or end with a hyphen");
		} else if (value.chars().anyMatch(Character::isWhitespace)) {
			throw new IllegalArgumentException("Identifier can't contain whitespace: \"" + value + "\"");
		}
		return new Identifier(value);
	}

	/**
	 * An identifier formed from <code>prefix</code>, a hyphen, and <code>suffix</code>.
	 */
	public static Identifier prefixed(String prefix, String suffix) {
		return from(prefix + "-" + suffix);
	}

	@Override public String toString() { return value; }

	public static final Comparator<Identifier> LEXICAL_ORDER = Identifier::compareTo;
}
