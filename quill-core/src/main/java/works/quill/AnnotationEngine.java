package works.quill;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.quill.document.Document;
import works.quill.document.DocumentParser;
import works.quill.document.DocumentSerializer;
import works.quill.document.TextRange;
import works.quill.entities.EntityCollection;
import works.quill.entities.EntityDelta;
import works.quill.entities.EntityOperations;
import works.quill.exceptions.ParseException;
import works.quill.exceptions.SchemaConfigurationException;
import works.quill.exceptions.SchemaLoadException;
import works.quill.exceptions.ValidationException;
import works.quill.history.DeltaLog;
import works.quill.history.HistoryStep;
import works.quill.history.UndoRedoEngine;
import works.quill.mutation.DocumentEditor;
import works.quill.schema.Cache;
import works.quill.schema.ConstraintTable;
import works.quill.schema.InMemoryCache;
import works.quill.schema.SchemaResolver;
import works.quill.validation.DocumentValidator;
import works.quill.validation.ProgressiveValidator;
import works.quill.validation.ValidationCacheKey;
import works.quill.validation.ValidationIssue;
import works.quill.validation.ValidationReport;

/**
 * The entry point for loading, editing, validating and saving annotated documents.
 * <p>
 * Every operation here is a pure function of its arguments apart from the schema and
 * validation caches; documents, entity collections and logs are immutable values.
 * For a stateful editing context with its own history, use {@link #openSession}.
 */
public final class AnnotationEngine {
	@Getter private final EngineConfiguration configuration;
	@Getter private final SchemaResolver resolver;
	private final ProgressiveValidator validator;
	private final DocumentParser parser;
	private final DocumentSerializer serializer;
	private final UndoRedoEngine history;
	@Getter private final EntityOperations entityOperations;

	public AnnotationEngine(
		EngineConfiguration configuration,
		SchemaResolver resolver,
		Cache<ValidationCacheKey, List<ValidationIssue>> validationCache,
		Clock clock
	) {
		this.configuration = configuration;
		this.resolver = resolver;
		this.validator = new ProgressiveValidator(resolver, new DocumentValidator(), validationCache);
		this.parser = new DocumentParser(configuration.parser());
		this.serializer = new DocumentSerializer(configuration.parser());
		this.history = new UndoRedoEngine(configuration.maxHistory());
		this.entityOperations = new EntityOperations(clock);
	}

	public static AnnotationEngine withDefaults() {
		return new AnnotationEngine(
			EngineConfiguration.defaultConfiguration(),
			SchemaResolver.withDefaults(),
			new InMemoryCache<>(),
			Clock.systemUTC());
	}

	public Document loadDocument(String text) throws ParseException {
		return parser.parse(text);
	}

	public Document addTag(Document document, Identifier passageId, TextRange range, String type, Map<String, String> attributes) throws ValidationException {
		return editor().addTag(document, passageId, range, type, attributes);
	}

	public Document removeTag(Document document, Identifier passageId, Identifier tagId) throws ValidationException {
		return editor().removeTag(document, passageId, tagId);
	}

	/**
	 * Changes only the collection. Tag references into it are not checked;
	 * use {@link #applyEntityDelta(Document, EntityDelta)} for that.
	 */
	public EntityCollection applyEntityDelta(EntityCollection entities, EntityDelta delta) throws ValidationException {
		return EntityOperations.applyEntityDelta(entities, delta);
	}

	public Document applyEntityDelta(Document document, EntityDelta delta) throws ValidationException {
		return editor().applyEntityDelta(document, delta);
	}

	public ValidationReport validateDocument(Document document) {
		return validateDocument(document, configuration.schemaOrder());
	}

	public ValidationReport validateDocument(Document document, List<String> schemaOrder) {
		return validator.validate(document, schemaOrder);
	}

	public HistoryStep undo(DeltaLog log) {
		return history.undo(log);
	}

	public HistoryStep redo(DeltaLog log) {
		return history.redo(log);
	}

	public String serializeDocument(Document document) {
		return serializer.serialize(document);
	}

	/**
	 * Parses <code>text</code> and starts an editing session over it.
	 *
	 * @param name identifies the session's document in log output
	 */
	public EditSession openSession(String name, String text) throws ParseException {
		Document document = loadDocument(text);
		LOGGER.debug("Opened session \"{}\"", name);
		return new EditSession(name, document, editor(), history, validator, configuration.schemaOrder(), serializer, entityOperations);
	}

	/**
	 * @throws SchemaConfigurationException if the editing schema can't be loaded
	 */
	public DocumentEditor editor() {
		return new DocumentEditor(editingConstraints(), configuration.parser());
	}

	public ConstraintTable editingConstraints() {
		String schemaId = configuration.editingSchemaId();
		try {
			return resolver.resolve(schemaId);
		} catch (SchemaLoadException e) {
			throw new SchemaConfigurationException("Editing schema \"" + schemaId + "\" is unavailable", List.of(e));
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(AnnotationEngine.class);
}
