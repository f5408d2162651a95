package works.quill.mutation;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import works.quill.Identifier;
import works.quill.document.DialogueSpan;
import works.quill.document.Document;
import works.quill.document.Passage;
import works.quill.document.Tag;
import works.quill.document.TextRange;
import works.quill.entities.Character;
import works.quill.entities.Entity;
import works.quill.entities.EntityCollection;
import works.quill.entities.EntityOperations;
import works.quill.exceptions.ValidationException;
import works.quill.validation.ErrorCode;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.quill.QuillTestUtils.novel;
import static works.quill.QuillTestUtils.parse;
import static works.quill.QuillTestUtils.strictEditor;

class DocumentEditorTest {
	final EntityOperations ops = new EntityOperations(Clock.systemUTC());
	DocumentEditor editor;
	Document doc;
	Identifier first;

	@BeforeEach
	void setupEditor() throws Exception {
		editor = strictEditor();
		doc = novel();
		first = doc.passages().get(0).id();
	}

	@Test
	void addTag_newRevisionWithTagAndMarkup() throws Exception {
		Document result = editor.addTag(doc, first, TextRange.of(27, 30), "persName", Map.of("ref", "#bob"));

		assertEquals(doc.revision() + 1, result.revision());
		Passage passage = result.passage(first).orElseThrow();
		assertEquals(2, passage.tags().size());
		Tag added = passage.tags().get(1);
		assertEquals("persName", added.type());
		assertEquals("Bob", passage.textOf(added.range()));
		assertTrue(result.rawText().contains("<persName ref=\"#bob\">Bob</persName>"), result.rawText());
		assertEquals(result.passages(), parse(result.rawText()).passages());
	}

	@Test
	void rejectedMutation_inputUntouched() throws Exception {
		String before = doc.rawText();
		List<Passage> passagesBefore = doc.passages();
		ValidationException e = assertThrows(ValidationException.class, () ->
			editor.addTag(doc, first, TextRange.of(0, 0), "said", Map.of()));
		assertEquals(ErrorCode.MISSING_REQUIRED_ATTR, e.error().code());
		assertSame(before, doc.rawText());
		assertSame(passagesBefore, doc.passages());
		assertEquals(0, doc.revision());
	}

	@Test
	void addSpeech_dialogueRederived() throws Exception {
		Identifier second = doc.passages().get(1).id();
		Document result = editor.addTag(doc, second, TextRange.of(0, 4), "said", Map.of("who", "#bob", "toWhom", "#alice"));

		assertEquals(2, result.dialogue().size());
		DialogueSpan span = result.dialogue().get(1);
		assertEquals("They", span.content());
		assertEquals("bob", span.speaker().orElseThrow());
		assertEquals("alice", span.addressee().orElseThrow());
		assertEquals(result.passage(second).orElseThrow().tags().get(0).id(), span.id());
	}

	@Test
	void removeTag_keepsTextAndDropsDialogue() throws Exception {
		Tag said = doc.passages().get(0).tags().get(0);
		Document result = editor.removeTag(doc, first, said.id());

		assertTrue(result.passage(first).orElseThrow().tags().isEmpty());
		assertTrue(result.dialogue().isEmpty());
		assertEquals(doc.passages().get(0).content(), result.passages().get(0).content());
		assertFalse(result.rawText().contains("<said"));
	}

	@Test
	void changeTagAttributes_updatesMarkup() throws Exception {
		Tag said = doc.passages().get(0).tags().get(0);
		Document result = editor.changeTagAttributes(doc, first, said.id(), Map.of("who", "#bob"));

		assertEquals("bob", result.dialogue().get(0).speaker().orElseThrow());
		assertTrue(result.rawText().contains("<said who=\"#bob\">Hello there</said>"), result.rawText());
	}

	@Test
	void entityDelta_renderedIntoStandOff() throws Exception {
		Character carol = Character.named("Carol").withOccupation("gardener");
		Document result = editor.applyEntityDelta(doc, ops.create(carol));

		assertEquals(carol, result.characters().get(carol.id()));
		assertTrue(result.rawText().contains("xml:id=\"carol\""), result.rawText());
		assertEquals(result.entities(), parse(result.rawText()).entities());
	}

	@Test
	void deleteReferencedEntity_rejected() {
		Entity london = doc.entities().findByXmlId("london").orElseThrow();
		ValidationException e = assertThrows(ValidationException.class, () ->
			editor.applyEntityDelta(doc, ops.delete(london)));
		assertEquals(ErrorCode.ENTITY_REFERENCED, e.error().code());
	}

	@Test
	void restoreEntities_replacesCollection() throws Exception {
		Document result = editor.restoreEntities(doc, EntityCollection.empty(), "undo");
		assertEquals(EntityCollection.empty(), result.entities());
		assertEquals(1, result.revision());
		assertFalse(result.rawText().contains("<person"));
	}

	@Test
	void successiveEdits_revisionsIncrease() throws Exception {
		Document one = editor.addTag(doc, first, TextRange.of(18, 23), "persName", Map.of("ref", "#alice"));
		Document two = editor.addTag(one, first, TextRange.of(27, 30), "persName", Map.of("ref", "#bob"));
		assertEquals(2, two.revision());
		assertEquals(3, two.passage(first).orElseThrow().tags().size());
		assertEquals(0, doc.revision());
	}
}
