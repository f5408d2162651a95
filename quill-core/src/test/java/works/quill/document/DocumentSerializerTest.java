package works.quill.document;

import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import works.quill.entities.Character;
import works.quill.entities.EntityCollection;
import works.quill.entities.EntityOperations;
import works.quill.exceptions.ParseException;
import works.quill.markup.Element;
import works.quill.markup.MarkupWriter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.quill.QuillTestUtils.id;
import static works.quill.QuillTestUtils.novel;
import static works.quill.QuillTestUtils.parse;

class DocumentSerializerTest {
	static final EntityOperations OPERATIONS = EntityOperations.withSystemClock();
	final DocumentSerializer serializer = new DocumentSerializer(ParserConfiguration.defaultConfiguration());

	@Test
	void reparse_sameIndices() throws ParseException {
		Document doc = novel();
		Document reparsed = parse(serializer.serialize(doc));
		assertEquals(doc.metadata(), reparsed.metadata());
		assertEquals(doc.passages(), reparsed.passages());
		assertEquals(doc.dialogue(), reparsed.dialogue());
		assertEquals(doc.entities(), reparsed.entities());
	}

	@ParameterizedTest(name = "{0}")
	@MethodSource("shapes")
	void reparseShape_sameIndices(String description, String text) throws ParseException {
		Document doc = parse(text);
		String serialized = serializer.serialize(doc);
		Document reparsed = parse(serialized);
		assertEquals(doc.passages(), reparsed.passages(), serialized);
		assertEquals(doc.dialogue(), reparsed.dialogue(), serialized);
		assertEquals(doc.entities(), reparsed.entities(), serialized);
		assertEquals(serialized, serializer.serialize(reparsed));
	}

	static Stream<Arguments> shapes() {
		return Stream.of(
			Arguments.of("directed relation whose id looks reciprocal", tei(
				"<p><persName ref=\"#a\">Ann</persName> raised <persName ref=\"#b\">Ben</persName>.</p>",
				PEOPLE + "<listRelation><relation xml:id=\"r-reciprocal\" name=\"parent\" active=\"#a\" passive=\"#b\"/></listRelation>")),
			Arguments.of("mutual and directed relations with explicit ids", tei(
				"<p>Ann and Ben work at Acme.</p>",
				PEOPLE + "<listOrg><org xml:id=\"acme\"><orgName>Acme</orgName></org></listOrg>"
					+ "<listRelation>"
					+ "<relation xml:id=\"friends\" name=\"friend\" mutual=\"#a #b\"/>"
					+ "<relation xml:id=\"job\" name=\"employer\" active=\"#acme\" passive=\"#a\"/>"
					+ "</listRelation>")),
			Arguments.of("empty element where a tag starts", tei(
				"<p><lb/><persName ref=\"#a\">Ann</persName> left.</p>", PEOPLE)),
			Arguments.of("empty element where a tag ends", tei(
				"<p><persName ref=\"#a\">Ann</persName><lb/> left.</p>", PEOPLE)),
			Arguments.of("identical ranges nest in document order", tei(
				"<p><said who=\"#a\"><persName ref=\"#a\">Ann</persName></said> spoke.</p>", PEOPLE))
		);
	}

	private static final String PEOPLE = "<listPerson>"
		+ "<person xml:id=\"a\"><persName>Ann</persName></person>"
		+ "<person xml:id=\"b\"><persName>Ben</persName></person>"
		+ "</listPerson>";

	private static String tei(String body, String standOff) {
		return "<TEI><text><body>" + body + "</body></text><standOff>" + standOff + "</standOff></TEI>";
	}

	@Test
	void directedRelationWithReciprocalLookingId_kept() throws ParseException {
		Document doc = parse(tei("<p>Ann raised Ben.</p>",
			PEOPLE + "<listRelation><relation xml:id=\"r-reciprocal\" name=\"parent\" active=\"#a\" passive=\"#b\"/></listRelation>"));
		String text = serializer.serialize(doc);
		assertTrue(text.contains("xml:id=\"r-reciprocal\""), text);
		assertEquals(List.of(id("r-reciprocal")), parse(text).relationships().ids());
	}

	@Test
	void blockRootWithRelationships_wrapped() throws Exception {
		Document doc = parse("<p><said who=\"#jane\">Hello</said>, <persName ref=\"#tom\">Tom</persName>.</p>");
		Character jane = Character.named("Jane");
		Character tom = Character.named("Tom");
		EntityCollection entities = doc.entities().with(jane).with(tom);
		entities = EntityOperations.applyEntityDelta(entities, OPERATIONS.relate(jane.id(), tom.id(), "sibling", true));
		entities = EntityOperations.applyEntityDelta(entities, OPERATIONS.relate(tom.id(), jane.id(), "mentor", false));
		assertEquals(3, entities.relationships().size());

		String text = serializer.serialize(withEntities(doc, entities));
		Document reparsed = parse(text);
		assertEquals(doc.passages(), reparsed.passages());
		assertEquals(doc.dialogue(), reparsed.dialogue());
		assertEquals(entities, reparsed.entities());
	}

	@Test
	void serializeTwice_sameText() throws ParseException {
		String once = serializer.serialize(novel());
		String twice = serializer.serialize(parse(once));
		assertEquals(once, twice);
	}

	@Test
	void blockRootWithoutEntities_unchanged() throws ParseException {
		String text = "<p>Hi <hi>there</hi>, <said who=\"#jane\">friend</said></p>";
		assertEquals(text, serializer.serialize(parse(text)));
	}

	@Test
	void blockRootWithEntities_wrapped() throws ParseException {
		Document doc = parse("<p><said who=\"#jane\">Hello</said></p>");
		Document withJane = withEntities(doc, doc.entities().with(Character.named("Jane")));
		String text = serializer.serialize(withJane);
		assertTrue(text.startsWith("<TEI><p>"), text);

		Document reparsed = parse(text);
		assertEquals(doc.passages(), reparsed.passages());
		assertEquals(List.of(id("char-jane")), reparsed.characters().ids());
	}

	@Test
	void entityChanges_rendered() throws ParseException {
		Document doc = novel();
		Character alice = doc.characters().get(id("char-alice"));
		EntityCollection changed = doc.entities()
			.with(alice.withArchived(true))
			.without(doc.places().get(id("place-london")));
		String text = serializer.serialize(withEntities(doc, changed));
		assertTrue(text.contains("<person xml:id=\"alice\" status=\"archived\">"), text);
		assertFalse(text.contains("listPlace"), text);
		assertEquals(changed, parse(text).entities());
	}

	@Test
	void renderPassage_nestsByRange() {
		Passage passage = Passage.create(0, "p", "Hello there", List.of(
			Tag.unplaced("said", Map.of("who", "#a"), TextRange.of(0, 11)),
			Tag.unplaced("persName", Map.of(), TextRange.of(0, 5))));
		assertEquals("<p><said who=\"#a\"><persName>Hello</persName> there</said></p>", render(passage));
	}

	@Test
	void renderPassage_emptyTagsStaySiblings() {
		Passage passage = Passage.create(0, "p", "ab", List.of(
			Tag.unplaced("lb", Map.of(), TextRange.of(1, 1)),
			Tag.unplaced("pb", Map.of(), TextRange.of(1, 1))));
		assertEquals("<p>a<lb/><pb/>b</p>", render(passage));
	}

	@Test
	void passageCountMismatch_throws() throws ParseException {
		Document doc = novel();
		Document missingPassage = new Document(doc.rawText(), doc.tree(), doc.revision(), doc.metadata(),
			doc.passages().subList(0, 1), List.of(), doc.entities());
		assertThrows(IllegalStateException.class, () -> serializer.serialize(missingPassage));
	}

	private static Document withEntities(Document doc, EntityCollection entities) {
		return new Document(doc.rawText(), doc.tree(), doc.revision(), doc.metadata(), doc.passages(), doc.dialogue(), entities);
	}

	private static String render(Passage passage) {
		return MarkupWriter.write(new Element(passage.element(), Map.of(), DocumentSerializer.renderPassage(passage)));
	}
}
