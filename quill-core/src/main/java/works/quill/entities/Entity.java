package works.quill.entities;

import works.quill.Identified;

/**
 * Something a document's text refers to: a {@link Character}, {@link Place} or {@link Organization}.
 * <p>
 * Every entity has two keys. The {@link #xmlId} is what markup uses to refer to it
 * (as <code>#xmlId</code>), and the {@link #id} is the engine's own key,
 * formed from the entity type's prefix and the xmlId. Neither ever changes:
 * updates that would alter the xmlId are rejected.
 */
public sealed interface Entity extends Identified permits Character, Place, Organization {
	String xmlId();
	String name();

	/**
	 * Archived entities stay in the collection, so references to them still resolve,
	 * but they no longer block deletion of the entities they're related to.
	 */
	boolean archived();

	EntityType entityType();

	Entity withArchived(boolean archived);

	/**
	 * @return the attribute value markup uses to point at this entity
	 */
	default String reference() {
		return "#" + xmlId();
	}

	default <R> R accept(EntityVisitor<R> visitor) {
		return visitor.visit(this);
	}
}
