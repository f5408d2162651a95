package works.quill.markup;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.w3c.dom.Document;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.quill.exceptions.ParseException;

/**
 * Turns markup text into an {@link Element} tree.
 * <p>
 * Element and attribute names are kept exactly as written, prefixes included
 * (so <code>xml:id</code> is just an attribute named <code>xml:id</code>).
 * Whitespace-only text is preserved, CDATA sections become ordinary text,
 * and comments and processing instructions are dropped.
 * External entities and DTDs are never fetched.
 */
public final class MarkupReader {
	private MarkupReader() { }

	public static Element read(String markup) throws ParseException {
		if (markup == null || markup.isBlank()) {
			throw new ParseException("Markup is empty; no root element");
		}
		Document dom;
		try {
			dom = newBuilder().parse(new InputSource(new StringReader(markup)));
		} catch (SAXParseException e) {
			throw new ParseException("Malformed markup at line " + e.getLineNumber() + ", column " + e.getColumnNumber() + ": " + e.getMessage(), e);
		} catch (SAXException | IOException e) {
			throw new ParseException("Unable to read markup: " + e.getMessage(), e);
		}
		org.w3c.dom.Element root = dom.getDocumentElement();
		if (root == null) {
			throw new ParseException("Markup has no root element");
		}
		Element result = convert(root);
		LOGGER.trace("Read <{}> with {} children", result.name(), result.children().size());
		return result;
	}

	private static DocumentBuilder newBuilder() throws ParseException {
		DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
		dbf.setNamespaceAware(false);
		dbf.setValidating(false);
		dbf.setXIncludeAware(false);
		dbf.setCoalescing(true);
		dbf.setIgnoringComments(true);
		try {
			dbf.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
			dbf.setFeature("http://xml.org/sax/features/external-general-entities", false);
			dbf.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
			dbf.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
			DocumentBuilder builder = dbf.newDocumentBuilder();
			builder.setEntityResolver((publicId, systemId) -> new InputSource(new StringReader("")));
			builder.setErrorHandler(THROWING_HANDLER);
			return builder;
		} catch (ParserConfigurationException e) {
			throw new ParseException("XML parser is not configurable", e);
		}
	}

	private static Element convert(org.w3c.dom.Element domElement) {
		Map<String, String> attributes = new LinkedHashMap<>();
		NamedNodeMap domAttributes = domElement.getAttributes();
		for (int i = 0; i < domAttributes.getLength(); i++) {
			org.w3c.dom.Node attribute = domAttributes.item(i);
			attributes.put(attribute.getNodeName(), attribute.getNodeValue());
		}
		List<Node> children = new ArrayList<>();
		NodeList childNodes = domElement.getChildNodes();
		StringBuilder pendingText = new StringBuilder();
		for (int i = 0; i < childNodes.getLength(); i++) {
			org.w3c.dom.Node child = childNodes.item(i);
			switch (child.getNodeType()) {
				case org.w3c.dom.Node.ELEMENT_NODE -> {
					flushText(pendingText, children);
					children.add(convert((org.w3c.dom.Element) child));
				}
				case org.w3c.dom.Node.TEXT_NODE, org.w3c.dom.Node.CDATA_SECTION_NODE ->
					pendingText.append(child.getNodeValue());
				case org.w3c.dom.Node.ENTITY_REFERENCE_NODE ->
					pendingText.append(child.getTextContent());
				default -> {
					// Comments and processing instructions carry no document content
				}
			}
		}
		flushText(pendingText, children);
		return new Element(domElement.getNodeName(), attributes, children);
	}

	private static void flushText(StringBuilder pendingText, List<Node> children) {
		if (pendingText.length() > 0) {
			children.add(new Text(pendingText.toString()));
			pendingText.setLength(0);
		}
	}

	private static final ErrorHandler THROWING_HANDLER = new ErrorHandler() {
		@Override
		public void warning(SAXParseException exception) {
			LOGGER.debug("XML parser warning: {}", exception.getMessage());
		}

		@Override
		public void error(SAXParseException exception) throws SAXException {
			throw exception;
		}

		@Override
		public void fatalError(SAXParseException exception) throws SAXException {
			throw exception;
		}
	};

	private static final Logger LOGGER = LoggerFactory.getLogger(MarkupReader.class);
}
