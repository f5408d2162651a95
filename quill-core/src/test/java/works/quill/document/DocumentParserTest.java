package works.quill.document;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;
import works.quill.entities.Character;
import works.quill.entities.Relationship;
import works.quill.exceptions.ParseException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.quill.QuillTestUtils.FIRST_PASSAGE_TEXT;
import static works.quill.QuillTestUtils.NOVEL;
import static works.quill.QuillTestUtils.SECOND_PASSAGE_TEXT;
import static works.quill.QuillTestUtils.id;
import static works.quill.QuillTestUtils.parse;

class DocumentParserTest {

	@Test
	void loneParagraph_oneDialogueSpan() throws ParseException {
		Document doc = parse("<p><said who=\"#jane\">Hello</said></p>");
		assertEquals(0, doc.revision());
		assertEquals(1, doc.passages().size());
		assertEquals(1, doc.dialogue().size());
		DialogueSpan span = doc.dialogue().get(0);
		assertEquals(Optional.of("jane"), span.speaker());
		assertEquals(Optional.empty(), span.addressee());
		assertEquals("Hello", span.content());
		assertEquals(TextRange.of(0, 5), span.range());
		assertEquals(DocumentMetadata.defaults(), doc.metadata());
	}

	@Test
	void novel_indicesBuilt() throws ParseException {
		Document doc = parse(NOVEL);
		assertEquals(new DocumentMetadata("The Garden", "A. Writer"), doc.metadata());

		assertEquals(2, doc.passages().size());
		Passage first = doc.passages().get(0);
		Passage second = doc.passages().get(1);
		assertEquals(FIRST_PASSAGE_TEXT, first.content());
		assertEquals(SECOND_PASSAGE_TEXT, second.content());
		assertEquals("p", first.element());
		assertEquals(0, first.index());
		assertEquals(1, second.index());

		assertEquals(1, first.tags().size());
		Tag said = first.tags().get(0);
		assertEquals("said", said.type());
		assertEquals(TextRange.of(0, 11), said.range());
		assertEquals(Map.of("who", "#alice"), said.attributes());

		Tag placeName = second.tags().get(0);
		assertEquals("placeName", placeName.type());
		assertEquals("London", second.textOf(placeName.range()));

		assertEquals(1, doc.dialogue().size());
		assertEquals(said.id(), doc.dialogue().get(0).id());
		assertEquals(first.id(), doc.dialogue().get(0).passageId());
	}

	@Test
	void novel_entitiesRead() throws ParseException {
		Document doc = parse(NOVEL);
		assertEquals(List.of(id("char-alice"), id("char-bob")), doc.characters().ids());
		Character alice = doc.characters().get(id("char-alice"));
		assertEquals("alice", alice.xmlId());
		assertEquals("Alice", alice.name());
		assertEquals(Optional.of("F"), alice.sex());
		assertEquals(Optional.of(30), alice.age());
		assertFalse(alice.archived());

		assertEquals(Optional.of("England"), doc.places().get(id("place-london")).country());

		List<Relationship> relationships = doc.relationships().asList();
		assertEquals(2, relationships.size());
		Relationship primary = relationships.get(0);
		assertEquals(id("rel-friend-alice-bob"), primary.id());
		assertEquals(id("char-alice"), primary.from());
		assertEquals(id("char-bob"), primary.to());
		assertTrue(primary.mutual());
		assertEquals(primary.reciprocal(), relationships.get(1));
	}

	@Test
	void sameText_equalDocuments() throws ParseException {
		assertEquals(parse(NOVEL), parse(NOVEL));
	}

	@Test
	void passageIds_dependOnTextAndPosition() throws ParseException {
		Document doc = parse("<body><p>Same</p><p>Same</p><p>Other</p></body>");
		List<Passage> passages = doc.passages();
		assertNotEquals(passages.get(0).id(), passages.get(1).id());
		assertNotEquals(passages.get(1).id(), passages.get(2).id());
		assertEquals(passages.get(0).id(), parse("<body><p>Same</p></body>").passages().get(0).id());
	}

	@Test
	void headerParagraphs_notPassages() throws ParseException {
		Document doc = parse("""
			<TEI>
			  <teiHeader><fileDesc><publicationStmt><p>Published somewhere</p></publicationStmt></fileDesc></teiHeader>
			  <text><body><p>Story</p></body></text>
			</TEI>
			""");
		assertEquals(1, doc.passages().size());
		assertEquals("Story", doc.passages().get(0).content());
	}

	@Test
	void nestedBlock_isTagOfOuterBlock() throws ParseException {
		Document doc = parse("<body><ab>one <l>two</l></ab></body>");
		assertEquals(1, doc.passages().size());
		Passage passage = doc.passages().get(0);
		assertEquals("one two", passage.content());
		assertEquals("l", passage.tags().get(0).type());
		assertEquals(TextRange.of(4, 7), passage.tags().get(0).range());
	}

	@Test
	void identicalRanges_outerTagFirst() throws ParseException {
		Document doc = parse("<p><said who=\"#jo\"><persName>Jo</persName></said> left.</p>");
		List<Tag> tags = doc.passages().get(0).tags();
		assertEquals(List.of("said", "persName"), tags.stream().map(Tag::type).toList());
		assertEquals(tags.get(0).range(), tags.get(1).range());
		assertNotEquals(tags.get(0).id(), tags.get(1).id());
	}

	@Test
	void tagsInCanonicalOrder() throws ParseException {
		Document doc = parse("<p><hi>a</hi> <said who=\"#x\">b <emph>c</emph></said></p>");
		List<Tag> tags = doc.passages().get(0).tags();
		assertEquals(List.of("hi", "said", "emph"), tags.stream().map(Tag::type).toList());
		assertEquals(TextRange.of(2, 5), tags.get(1).range());
		assertEquals(TextRange.of(4, 5), tags.get(2).range());
	}

	@Test
	void addressee_andMultipleSpeakers() throws ParseException {
		Document doc = parse("<p><said who=\"#a #b\" toWhom=\"#c\">Hi</said></p>");
		DialogueSpan span = doc.dialogue().get(0);
		assertEquals(Optional.of("a b"), span.speaker());
		assertEquals(Optional.of("c"), span.addressee());
	}

	@Test
	void customSpeechElements_used() throws ParseException {
		ParserConfiguration config = ParserConfiguration.defaultConfiguration().withSpeechElements(Set.of("q"));
		Document doc = new DocumentParser(config).parse("<p><q who=\"#a\">One</q> <said who=\"#b\">Two</said></p>");
		assertEquals(1, doc.dialogue().size());
		assertEquals("One", doc.dialogue().get(0).content());
	}

	@Test
	void stripReferences_removesHashes() {
		assertEquals(Optional.of("a b"), DocumentParser.stripReferences("  #a   #b "));
		assertEquals(Optional.of("plain"), DocumentParser.stripReferences("plain"));
		assertEquals(Optional.empty(), DocumentParser.stripReferences(" # "));
	}

	@Test
	void entityWithoutXmlId_sluggedFromName() throws ParseException {
		Document doc = parse("""
			<TEI><text><body><p>x</p></body></text>
			<standOff><listPerson><person><persName>Sherlock Holmes</persName></person></listPerson></standOff></TEI>
			""");
		assertEquals("sherlock-holmes", doc.characters().asList().get(0).xmlId());
	}

	@Test
	void archivedStatus_read() throws ParseException {
		Document doc = parse("""
			<TEI><text><body><p>x</p></body></text>
			<standOff><listOrg><org xml:id="guild" status="archived" type="trade"><orgName>The Guild</orgName></org></listOrg></standOff></TEI>
			""");
		var guild = doc.organizations().get(id("org-guild"));
		assertTrue(guild.archived());
		assertEquals(Optional.of("trade"), guild.orgType());
	}

	@Test
	void directedRelation_oneRecord() throws ParseException {
		Document doc = parse("""
			<TEI><text><body><p>x</p></body></text>
			<standOff>
			  <listPerson><person xml:id="a"><persName>A</persName></person><person xml:id="b"><persName>B</persName></person></listPerson>
			  <listRelation><relation name="parent" active="#a" passive="#b"/></listRelation>
			</standOff></TEI>
			""");
		assertEquals(1, doc.relationships().size());
		Relationship r = doc.relationships().asList().get(0);
		assertFalse(r.mutual());
		assertEquals(id("char-a"), r.from());
		assertEquals(id("char-b"), r.to());
	}

	@Test
	void relationWithUnknownEndpoint_skipped() throws ParseException {
		Document doc = parse("""
			<TEI><text><body><p>x</p></body></text>
			<standOff>
			  <listPerson><person xml:id="a"><persName>A</persName></person></listPerson>
			  <listRelation><relation name="friend" mutual="#a #ghost"/></listRelation>
			</standOff></TEI>
			""");
		assertTrue(doc.relationships().isEmpty());
	}

	@Test
	void duplicateXmlId_throws() {
		assertThrows(ParseException.class, () -> parse("""
			<TEI><text><body><p>x</p></body></text>
			<standOff>
			  <listPerson><person xml:id="a"><persName>A</persName></person></listPerson>
			  <listPlace><place xml:id="a"><placeName>A</placeName></place></listPlace>
			</standOff></TEI>
			"""));
	}

	@Test
	void malformedMarkup_throws() {
		assertThrows(ParseException.class, () -> parse("<p><said>unclosed</p>"));
	}
}
