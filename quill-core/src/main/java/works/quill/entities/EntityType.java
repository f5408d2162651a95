package works.quill.entities;

/**
 * The kinds of things an {@link EntityCollection} holds, with the names
 * each is known by in markup and in persisted form.
 */
public enum EntityType {
	CHARACTER("char", "character", "person", "listPerson"),
	PLACE("place", "place", "place", "listPlace"),
	ORGANIZATION("org", "organization", "org", "listOrg"),
	RELATIONSHIP("rel", "relationship", "relation", "listRelation");

	private final String idPrefix;
	private final String externalName;
	private final String elementName;
	private final String listElementName;

	EntityType(String idPrefix, String externalName, String elementName, String listElementName) {
		this.idPrefix = idPrefix;
		this.externalName = externalName;
		this.elementName = elementName;
		this.listElementName = listElementName;
	}

	public String idPrefix() { return idPrefix; }

	/**
	 * The name used to tag persisted records of this type.
	 */
	public String externalName() { return externalName; }

	public String elementName() { return elementName; }

	public String listElementName() { return listElementName; }

	public static EntityType fromExternalName(String name) {
		for (EntityType type: values()) {
			if (type.externalName.equals(name)) {
				return type;
			}
		}
		throw new IllegalArgumentException("Unknown entity type: \"" + name + "\"");
	}
}
