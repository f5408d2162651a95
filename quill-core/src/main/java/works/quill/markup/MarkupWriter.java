package works.quill.markup;

import java.util.Map;

/**
 * Renders an {@link Element} tree back to markup text with no XML declaration.
 * Text is written exactly as held in the tree, apart from escaping.
 */
public final class MarkupWriter {
	private MarkupWriter() { }

	public static String write(Element root) {
		StringBuilder sb = new StringBuilder();
		new Renderer(sb).visit(root);
		return sb.toString();
	}

	private record Renderer(StringBuilder out) implements NodeVisitor<Void> {
		@Override
		public Void visitElement(Element element) {
			out.append('<').append(element.name());
			for (Map.Entry<String, String> attribute: element.attributes().entrySet()) {
				out.append(' ').append(attribute.getKey()).append("=\"");
				escapeAttribute(attribute.getValue(), out);
				out.append('"');
			}
			if (element.children().isEmpty()) {
				out.append("/>");
			} else {
				out.append('>');
				element.children().forEach(this::visit);
				out.append("</").append(element.name()).append('>');
			}
			return null;
		}

		@Override
		public Void visitText(Text text) {
			escapeText(text.value(), out);
			return null;
		}
	}

	static void escapeText(String text, StringBuilder out) {
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			switch (c) {
				case '&' -> out.append("&amp;");
				case '<' -> out.append("&lt;");
				case '>' -> out.append("&gt;");
				default -> out.append(c);
			}
		}
	}

	static void escapeAttribute(String value, StringBuilder out) {
		for (int i = 0; i < value.length(); i++) {
			char c = value.charAt(i);
			switch (c) {
				case '&' -> out.append("&amp;");
				case '<' -> out.append("&lt;");
				case '"' -> out.append("&quot;");
				case '\n' -> out.append("&#10;");
				case '\t' -> out.append("&#9;");
				default -> out.append(c);
			}
		}
	}
}
