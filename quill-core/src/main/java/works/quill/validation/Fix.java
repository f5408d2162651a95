package works.quill.validation;

import java.util.List;
import works.quill.Identifier;
import works.quill.document.TextRange;
import works.quill.entities.EntityType;

/**
 * A suggested change that would make a rejected mutation acceptable.
 * Applying a fix is up to the caller.
 */
public sealed interface Fix {
	/**
	 * Supply the missing attribute <code>attribute</code>, starting from <code>defaultValue</code>.
	 */
	record AddAttribute(String attribute, String defaultValue, List<String> suggestions) implements Fix {
		public AddAttribute {
			suggestions = List.copyOf(suggestions);
		}
	}

	/**
	 * Replace the value of <code>attribute</code> with one of <code>suggestions</code>.
	 */
	record ChangeAttribute(String attribute, String currentValue, List<String> suggestions) implements Fix {
		public ChangeAttribute {
			suggestions = List.copyOf(suggestions);
		}
	}

	/**
	 * Create an entity that an unresolved reference could then point to.
	 */
	record CreateEntity(EntityType type, String xmlId) implements Fix { }

	/**
	 * Retry with <code>range</code> as the selection.
	 */
	record ExpandSelection(TextRange range) implements Fix { }

	/**
	 * Archive the entity instead of deleting it.
	 */
	record ArchiveEntity(Identifier entityId) implements Fix { }
}
