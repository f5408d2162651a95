package works.quill.entities;

/**
 * Lets Java 17 code handle each kind of {@link Entity} without a chain of instanceof checks.
 */
public interface EntityVisitor<R> {
	R visitCharacter(Character character);
	R visitPlace(Place place);
	R visitOrganization(Organization organization);

	default R visit(Entity entity) {
		if (entity instanceof Character c) {
			return visitCharacter(c);
		} else if (entity instanceof Place p) {
			return visitPlace(p);
		} else if (entity instanceof Organization o) {
			return visitOrganization(o);
		} else {
			throw new AssertionError("Unexpected entity type: " + entity.getClass().getSimpleName());
		}
	}
}
