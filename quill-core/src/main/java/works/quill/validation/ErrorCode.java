package works.quill.validation;

/**
 * Why a mutation was rejected.
 */
public enum ErrorCode {
	// Tags
	PASSAGE_NOT_FOUND,
	TAG_NOT_FOUND,
	RANGE_OUT_OF_BOUNDS,
	UNKNOWN_TAG_TYPE,
	MISSING_REQUIRED_ATTR,
	INVALID_ATTR_VALUE,
	UNRESOLVED_IDREF,
	DUPLICATE_TAG,
	SPLITS_EXISTING_TAG,
	CONTENT_MODEL_VIOLATION,

	// Entities
	MISSING_NAME,
	DUPLICATE_ID,
	DUPLICATE_XML_ID,
	ENTITY_NOT_FOUND,
	XML_ID_CHANGED,
	ENTITY_REFERENCED,
	DUPLICATE_RELATIONSHIP,
}
