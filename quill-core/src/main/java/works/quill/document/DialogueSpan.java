package works.quill.document;

import java.util.Optional;
import works.quill.Identified;
import works.quill.Identifier;

/**
 * A stretch of speech, derived from a speech tag.
 * Shares its id with the tag it came from.
 */
public record DialogueSpan(
	Identifier id,
	Identifier passageId,
	Optional<String> speaker,
	Optional<String> addressee,
	String content,
	TextRange range
) implements Identified { }
