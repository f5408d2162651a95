package works.quill;

/**
 * Anything with a stable {@link Identifier} that can live in a {@link Catalog}.
 */
public interface Identified {
	Identifier id();
}
