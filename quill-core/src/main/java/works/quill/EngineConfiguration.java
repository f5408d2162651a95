package works.quill;

import java.util.List;
import works.quill.document.ParserConfiguration;

/**
 * @param schemaOrder schemas to try when validating a whole document, strictest first
 * @param editingSchemaId the schema whose constraints gate every mutation
 * @param maxHistory the most entity changes a session can undo
 */
public record EngineConfiguration(
	ParserConfiguration parser,
	List<String> schemaOrder,
	String editingSchemaId,
	int maxHistory
) {
	public EngineConfiguration {
		schemaOrder = List.copyOf(schemaOrder);
		if (maxHistory < 1) {
			throw new IllegalArgumentException("maxHistory must be positive: " + maxHistory);
		}
	}

	public static EngineConfiguration defaultConfiguration() {
		return new EngineConfiguration(
			ParserConfiguration.defaultConfiguration(),
			List.of("tei-all", "tei-novel", "tei-minimal"),
			"tei-all",
			DEFAULT_MAX_HISTORY);
	}

	public EngineConfiguration withEditingSchema(String schemaId) {
		return new EngineConfiguration(parser, schemaOrder, schemaId, maxHistory);
	}

	public EngineConfiguration withMaxHistory(int newMaxHistory) {
		return new EngineConfiguration(parser, schemaOrder, editingSchemaId, newMaxHistory);
	}

	public static final int DEFAULT_MAX_HISTORY = 500;
}
