package works.quill.mutation;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.quill.Identifier;
import works.quill.document.DialogueSpan;
import works.quill.document.Document;
import works.quill.document.DocumentParser;
import works.quill.document.DocumentSerializer;
import works.quill.document.Passage;
import works.quill.document.ParserConfiguration;
import works.quill.document.Tag;
import works.quill.document.TextRange;
import works.quill.entities.EntityCollection;
import works.quill.entities.EntityDelta;
import works.quill.entities.EntityOperations;
import works.quill.exceptions.ValidationException;
import works.quill.markup.Element;
import works.quill.markup.MarkupWriter;
import works.quill.schema.ConstraintTable;
import works.quill.validation.MutationValidator;

/**
 * Applies {@link Mutation}s to {@link Document}s, checking each against a {@link ConstraintTable} first.
 * <p>
 * Each successful call returns a new document with a revision one higher than its input,
 * whose dialogue, tree and text have been re-derived to match. A rejected call throws
 * {@link ValidationException} and builds nothing; the caller's document is untouched.
 */
public final class DocumentEditor {
	@Getter private final ConstraintTable constraints;
	private final MutationValidator validator = new MutationValidator();
	private final DocumentParser indexer;
	private final DocumentSerializer serializer;

	public DocumentEditor(ConstraintTable constraints, ParserConfiguration configuration) {
		this.constraints = constraints;
		this.indexer = new DocumentParser(configuration);
		this.serializer = new DocumentSerializer(configuration);
	}

	public Document addTag(Document document, Identifier passageId, TextRange range, String type, Map<String, String> attributes) throws ValidationException {
		return apply(document, new AddTag(passageId, range, type, attributes));
	}

	public Document removeTag(Document document, Identifier passageId, Identifier tagId) throws ValidationException {
		return apply(document, new RemoveTag(passageId, tagId));
	}

	public Document changeTagAttributes(Document document, Identifier passageId, Identifier tagId, Map<String, String> attributes) throws ValidationException {
		return apply(document, new ChangeTagAttributes(passageId, tagId, attributes));
	}

	public Document applyEntityDelta(Document document, EntityDelta delta) throws ValidationException {
		return apply(document, new ChangeEntities(delta));
	}

	public Document restoreEntities(Document document, EntityCollection entities, String reason) throws ValidationException {
		return apply(document, new RestoreEntities(entities, reason));
	}

	public Document apply(Document document, Mutation mutation) throws ValidationException {
		validator.validate(document, constraints, mutation);
		Document result = new Applier(document).visit(mutation);
		LOGGER.debug("{} produced revision {}", mutation.getClass().getSimpleName(), result.revision());
		return result;
	}

	/**
	 * Only called after validation succeeds.
	 */
	private final class Applier implements MutationVisitor<Document> {
		final Document document;

		Applier(Document document) {
			this.document = document;
		}

		@Override
		public Document visitAddTag(AddTag m) {
			return withPassage(m.passageId(), p -> {
				List<Tag> tags = new ArrayList<>(p.tags());
				tags.add(Tag.unplaced(m.type(), m.attributes(), m.range()));
				return p.withTags(tags);
			});
		}

		@Override
		public Document visitRemoveTag(RemoveTag m) {
			return withPassage(m.passageId(), p -> p.withTags(p.tags().stream()
				.filter(t -> !t.id().equals(m.tagId()))
				.toList()));
		}

		@Override
		public Document visitChangeTagAttributes(ChangeTagAttributes m) {
			return withPassage(m.passageId(), p -> p.withTags(p.tags().stream()
				.map(t -> t.id().equals(m.tagId()) ? t.withAttributes(m.attributes()) : t)
				.toList()));
		}

		@Override
		public Document visitChangeEntities(ChangeEntities m) {
			EntityCollection entities;
			try {
				entities = EntityOperations.applyEntityDelta(document.entities(), m.delta());
			} catch (ValidationException e) {
				throw new IllegalStateException("Delta was rejected after passing validation", e);
			}
			return rebuild(document.passages(), entities);
		}

		@Override
		public Document visitRestoreEntities(RestoreEntities m) {
			return rebuild(document.passages(), m.entities());
		}

		private Document withPassage(Identifier passageId, UnaryOperator<Passage> change) {
			List<Passage> passages = document.passages().stream()
				.map(p -> p.id().equals(passageId) ? change.apply(p) : p)
				.toList();
			return rebuild(passages, document.entities());
		}

		private Document rebuild(List<Passage> passages, EntityCollection entities) {
			List<DialogueSpan> dialogue = indexer.deriveDialogue(passages);
			Document draft = new Document(document.rawText(), document.tree(), document.revision() + 1,
				document.metadata(), passages, dialogue, entities);
			Element tree = serializer.render(draft);
			return new Document(MarkupWriter.write(tree), tree, draft.revision(),
				draft.metadata(), passages, dialogue, entities);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(DocumentEditor.class);
}
