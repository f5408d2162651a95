package works.quill.validation;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import works.quill.document.Document;
import works.quill.exceptions.ParseException;
import works.quill.schema.ConstraintTable;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static works.quill.QuillTestUtils.constraints;
import static works.quill.QuillTestUtils.novel;
import static works.quill.QuillTestUtils.parse;

class DocumentValidatorTest {
	final DocumentValidator validator = new DocumentValidator();
	ConstraintTable teiAll;

	@BeforeEach
	void setupSchema() throws Exception {
		teiAll = constraints("tei-all");
	}

	@Test
	void novel_noIssues() throws ParseException {
		assertEquals(List.of(), validator.validate(novel(), teiAll));
	}

	@Test
	void unknownElement_criticalWithPath() throws ParseException {
		List<ValidationIssue> issues = validator.validate(body("<p>a</p><p><blink>b</blink></p>"), teiAll);
		assertEquals(List.of(
			new ValidationIssue(Severity.CRITICAL, IssueCode.CONTENT_MODEL_VIOLATION,
				"<blink> is not allowed inside <p>", "/TEI/text[1]/body[1]/p[2]"),
			new ValidationIssue(Severity.CRITICAL, IssueCode.UNKNOWN_ELEMENT,
				"<blink> is not declared by the schema", "/TEI/text[1]/body[1]/p[2]/blink[1]")), issues);
	}

	@Test
	void missingSpeaker_critical() throws ParseException {
		assertEquals(List.of(IssueCode.MISSING_REQUIRED_ATTR), codes(body("<p><said>Hi</said></p>")));
	}

	@Test
	void unresolvedPointer_critical() throws ParseException {
		assertEquals(List.of(IssueCode.UNRESOLVED_IDREF), codes(body("<p><persName ref=\"#nobody\">X</persName></p>")));
	}

	@Test
	void pointerToMarkupId_resolves() throws ParseException {
		assertEquals(List.of(), codes(body("<p xml:id=\"p1\">a</p><p><q who=\"#p1\">b</q></p>")));
	}

	@Test
	void badEnumeratedValue_critical() throws ParseException {
		assertEquals(List.of(IssueCode.INVALID_ATTR_VALUE), codes(body("<p><rs type=\"ship\">X</rs></p>")));
	}

	@Test
	void disallowedChild_critical() throws ParseException {
		assertEquals(List.of(IssueCode.CONTENT_MODEL_VIOLATION), codes(body("<p><persName><said who=\"\">X</said></persName></p>")));
	}

	@Test
	void undeclaredAttribute_warning() throws ParseException {
		List<ValidationIssue> issues = validator.validate(body("<p foo=\"x\">a</p>"), teiAll);
		assertEquals(1, issues.size());
		assertEquals(Severity.WARNING, issues.get(0).severity());
		assertEquals(IssueCode.UNDECLARED_ATTRIBUTE, issues.get(0).code());
	}

	@Test
	void strayText_warning() throws ParseException {
		List<ValidationIssue> issues = validator.validate(body("loose<p>a</p>"), teiAll);
		assertEquals(List.of(new ValidationIssue(Severity.WARNING, IssueCode.UNEXPECTED_TEXT,
			"<body> should not contain text", "/TEI/text[1]/body[1]")), issues);
	}

	@Test
	void archivedReference_info() throws ParseException {
		Document doc = parse("""
			<TEI>
			  <text><body><p><persName ref="#carol">Carol</persName></p></body></text>
			  <standOff>
			    <listPerson><person xml:id="carol" status="archived"><persName>Carol</persName></person></listPerson>
			  </standOff>
			</TEI>
			""");
		List<ValidationIssue> issues = validator.validate(doc, teiAll);
		assertEquals(1, issues.size());
		assertEquals(Severity.INFO, issues.get(0).severity());
		assertEquals(IssueCode.ARCHIVED_REFERENCE, issues.get(0).code());
	}

	List<IssueCode> codes(Document document) {
		return validator.validate(document, teiAll).stream().map(ValidationIssue::code).toList();
	}

	static Document body(String content) throws ParseException {
		return parse("<TEI><text><body>" + content + "</body></text></TEI>");
	}
}
