package works.quill.validation;

/**
 * Identifies one validation result. The revision alone would be ambiguous,
 * because every freshly loaded document is revision 0.
 *
 * @param fingerprint a digest of the document's rendered text
 */
public record ValidationCacheKey(String schemaId, long revision, String fingerprint) { }
