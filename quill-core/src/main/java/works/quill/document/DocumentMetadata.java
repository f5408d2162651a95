package works.quill.document;

public record DocumentMetadata(String title, String author) {
	public static final String DEFAULT_TITLE = "Untitled";
	public static final String DEFAULT_AUTHOR = "Unknown";

	public static DocumentMetadata defaults() {
		return new DocumentMetadata(DEFAULT_TITLE, DEFAULT_AUTHOR);
	}
}
