package works.quill.validation;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import works.quill.Identifier;
import works.quill.document.Document;
import works.quill.document.Tag;
import works.quill.document.TextRange;
import works.quill.entities.Entity;
import works.quill.entities.EntityCollection;
import works.quill.entities.EntityOperations;
import works.quill.entities.EntityType;
import works.quill.exceptions.ValidationException;
import works.quill.mutation.AddTag;
import works.quill.mutation.ChangeEntities;
import works.quill.mutation.ChangeTagAttributes;
import works.quill.mutation.DocumentEditor;
import works.quill.mutation.Mutation;
import works.quill.mutation.RemoveTag;
import works.quill.mutation.RestoreEntities;
import works.quill.schema.ConstraintTable;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static works.quill.QuillTestUtils.NOVEL;
import static works.quill.QuillTestUtils.constraints;
import static works.quill.QuillTestUtils.id;
import static works.quill.QuillTestUtils.novel;
import static works.quill.QuillTestUtils.parse;
import static works.quill.QuillTestUtils.strictEditor;

class MutationValidatorTest {
	final MutationValidator validator = new MutationValidator();
	final EntityOperations ops = new EntityOperations(Clock.systemUTC());
	ConstraintTable teiAll;
	Document doc;
	Identifier first;
	Identifier second;

	@BeforeEach
	void setupDocument() throws Exception {
		teiAll = constraints("tei-all");
		doc = novel();
		first = doc.passages().get(0).id();
		second = doc.passages().get(1).id();
	}

	@Test
	void speechWithoutSpeaker_missingRequiredAttr() {
		ValidationError error = rejected(new AddTag(first, TextRange.of(0, 0), "said", Map.of()));
		assertEquals(ErrorCode.MISSING_REQUIRED_ATTR, error.code());
		assertEquals(List.of(new Fix.AddAttribute("who", "", List.of("#alice", "#bob", "#london"))), error.fixes());
	}

	@Test
	void permissiveSchema_acceptsSpeechWithoutSpeaker() throws Exception {
		ConstraintTable minimal = constraints("tei-minimal");
		assertDoesNotThrow(() -> validator.validate(doc, minimal, new AddTag(first, TextRange.of(0, 0), "said", Map.of())));
	}

	@Test
	void validTag_accepted() {
		assertDoesNotThrow(() -> validator.validate(doc, teiAll,
			new AddTag(first, TextRange.of(27, 30), "persName", Map.of("ref", "#bob"))));
	}

	@Test
	void unknownPassage_rejected() {
		ValidationError error = rejected(new AddTag(id("passage-nope"), TextRange.of(0, 1), "persName", Map.of()));
		assertEquals(ErrorCode.PASSAGE_NOT_FOUND, error.code());
	}

	@Test
	void rangePastEnd_rejectedWithClampedSelection() {
		ValidationError error = rejected(new AddTag(first, TextRange.of(18, 100), "persName", Map.of()));
		assertEquals(ErrorCode.RANGE_OUT_OF_BOUNDS, error.code());
		assertEquals(List.of(new Fix.ExpandSelection(TextRange.of(18, 31))), error.fixes());
	}

	@Test
	void undeclaredType_rejected() {
		assertEquals(ErrorCode.UNKNOWN_TAG_TYPE, rejected(new AddTag(first, TextRange.of(0, 5), "blink", Map.of())).code());
	}

	@Test
	void disallowedEnumeratedValue_rejectedWithChoices() {
		ValidationError error = rejected(new AddTag(first, TextRange.of(27, 30), "rs", Map.of("type", "ship")));
		assertEquals(ErrorCode.INVALID_ATTR_VALUE, error.code());
		assertEquals(List.of(new Fix.ChangeAttribute("type", "ship", List.of("person", "place", "org", "object"))), error.fixes());
	}

	@Test
	void unknownCharacter_rejectedWithCreateFix() {
		ValidationError error = rejected(new AddTag(first, TextRange.of(27, 30), "persName", Map.of("ref", "#carol")));
		assertEquals(ErrorCode.UNRESOLVED_IDREF, error.code());
		assertEquals(List.of(
			new Fix.ChangeAttribute("ref", "#carol", List.of("#alice", "#bob", "#london")),
			new Fix.CreateEntity(EntityType.CHARACTER, "carol")), error.fixes());
	}

	@Test
	void unknownPlace_suggestsPlace() {
		ValidationError error = rejected(new AddTag(second, TextRange.of(0, 4), "placeName", Map.of("ref", "#paris")));
		assertEquals(new Fix.CreateEntity(EntityType.PLACE, "paris"), error.fixes().get(1));
	}

	@Test
	void identicalTag_rejected() {
		ValidationError error = rejected(new AddTag(first, TextRange.of(0, 11), "said", Map.of("who", "#alice")));
		assertEquals(ErrorCode.DUPLICATE_TAG, error.code());
	}

	@Test
	void sameRangeOtherAttributes_accepted() {
		assertDoesNotThrow(() -> validator.validate(doc, teiAll,
			new AddTag(first, TextRange.of(0, 11), "said", Map.of("who", "#bob"))));
	}

	@Test
	void crossingRange_rejectedWithUnion() {
		ValidationError error = rejected(new AddTag(first, TextRange.of(5, 15), "persName", Map.of()));
		assertEquals(ErrorCode.SPLITS_EXISTING_TAG, error.code());
		assertEquals(List.of(new Fix.ExpandSelection(TextRange.of(0, 15))), error.fixes());
	}

	@Test
	void adjacentRange_accepted() {
		assertDoesNotThrow(() -> validator.validate(doc, teiAll,
			new AddTag(first, TextRange.of(11, 17), "hi", Map.of())));
	}

	@Test
	void speechInsideName_contentModelViolation() {
		ValidationError error = rejected(new AddTag(first, TextRange.of(0, 12), "persName", Map.of()));
		assertEquals(ErrorCode.CONTENT_MODEL_VIOLATION, error.code());
	}

	@Test
	void emptyElementAroundText_contentModelViolation() {
		assertEquals(ErrorCode.CONTENT_MODEL_VIOLATION,
			rejected(new AddTag(first, TextRange.of(0, 5), "lb", Map.of())).code());
		assertDoesNotThrow(() -> validator.validate(doc, teiAll, new AddTag(first, TextRange.of(5, 5), "lb", Map.of())));
	}

	@Test
	void removeUnknownTag_rejected() {
		assertEquals(ErrorCode.TAG_NOT_FOUND, rejected(new RemoveTag(first, id("tag-nope"))).code());
		assertEquals(ErrorCode.PASSAGE_NOT_FOUND, rejected(new RemoveTag(id("passage-nope"), id("tag-nope"))).code());
	}

	@Test
	void removeExistingTag_accepted() {
		Tag said = doc.passages().get(0).tags().get(0);
		assertDoesNotThrow(() -> validator.validate(doc, teiAll, new RemoveTag(first, said.id())));
	}

	@Test
	void changeAttributes_checkedLikeNewTag() {
		Tag said = doc.passages().get(0).tags().get(0);
		assertEquals(ErrorCode.MISSING_REQUIRED_ATTR,
			rejected(new ChangeTagAttributes(first, said.id(), Map.of("toWhom", "#bob"))).code());
		assertDoesNotThrow(() -> validator.validate(doc, teiAll,
			new ChangeTagAttributes(first, said.id(), Map.of("who", "#alice", "toWhom", "#bob"))));
	}

	@Test
	void deleteRelatedCharacter_entityReferenced() {
		Entity alice = doc.entities().findByXmlId("alice").orElseThrow();
		ValidationError error = rejected(new ChangeEntities(ops.delete(alice)));
		assertEquals(ErrorCode.ENTITY_REFERENCED, error.code());
		assertEquals(List.of(new Fix.ArchiveEntity(alice.id())), error.fixes());
	}

	@Test
	void deleteTaggedPlace_entityReferenced() {
		Entity london = doc.entities().findByXmlId("london").orElseThrow();
		ValidationError error = rejected(new ChangeEntities(ops.delete(london)));
		assertEquals(ErrorCode.ENTITY_REFERENCED, error.code());
		assertEquals(List.of(new Fix.ArchiveEntity(london.id())), error.fixes());
	}

	@ParameterizedTest
	@ValueSource(strings = {"carol", "#carol", "char-carol", "#char-carol"})
	void deleteCharacterTaggedInAnyPointerForm_entityReferenced(String pointer) throws Exception {
		DocumentEditor editor = strictEditor();
		Document withCarol = editor.applyEntityDelta(doc, ops.createCharacter("Carol"));
		Document tagged = editor.addTag(withCarol, first, TextRange.of(18, 23), "persName", Map.of("ref", pointer));
		Entity carol = tagged.entities().findByXmlId("carol").orElseThrow();

		ValidationError error = assertThrows(ValidationException.class,
			() -> validator.validate(tagged, teiAll, new ChangeEntities(ops.delete(carol)))).error();
		assertEquals(ErrorCode.ENTITY_REFERENCED, error.code());
		assertEquals(List.of(new Fix.ArchiveEntity(carol.id())), error.fixes());
	}

	@Test
	void deleteCharacterWhoseNameAppearsInPlainAttribute_accepted() throws Exception {
		DocumentEditor editor = strictEditor();
		Document withCarol = editor.applyEntityDelta(doc, ops.createCharacter("Carol"));
		Document tagged = editor.addTag(withCarol, first, TextRange.of(18, 23), "hi", Map.of("rend", "carol"));
		Entity carol = tagged.entities().findByXmlId("carol").orElseThrow();

		assertDoesNotThrow(() -> validator.validate(tagged, teiAll, new ChangeEntities(ops.delete(carol))));
	}

	@Test
	void pointerToMarkupId_accepted() throws Exception {
		Document withAnchor = parse(NOVEL.replace("<body>", "<body xml:id=\"story\">"));
		Identifier passage = withAnchor.passages().get(0).id();
		assertDoesNotThrow(() -> validator.validate(withAnchor, teiAll,
			new AddTag(passage, TextRange.of(27, 30), "persName", Map.of("ref", "#story"))));
		assertEquals(ErrorCode.UNRESOLVED_IDREF, assertThrows(ValidationException.class, () -> validator.validate(withAnchor, teiAll,
			new AddTag(passage, TextRange.of(27, 30), "persName", Map.of("ref", "#plot")))).error().code());
	}

	@Test
	void restore_neverRejected() {
		assertDoesNotThrow(() -> validator.validate(doc, teiAll, new RestoreEntities(EntityCollection.empty(), "undo")));
	}

	ValidationError rejected(Mutation mutation) {
		return assertThrows(ValidationException.class, () -> validator.validate(doc, teiAll, mutation)).error();
	}
}
