package works.bosk.docnode.exceptions;

/**
 * A type matched more than one conversion category.
 * The categories are supposed to partition the supported types,
 * so this indicates a defect in the category definitions
 * or a user type that implements the interfaces of two categories at once.
 */
public final class AmbiguousTypeException extends NodeException {
	public AmbiguousTypeException(String message) {
		super(message);
	}
}
