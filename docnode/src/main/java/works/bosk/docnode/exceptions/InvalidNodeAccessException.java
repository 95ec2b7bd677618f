package works.bosk.docnode.exceptions;

/**
 * A {@link works.bosk.docnode.Node Node} accessor was used on a node with the wrong tag,
 * or with an index that the node doesn't have.
 */
public final class InvalidNodeAccessException extends NodeException {
	public InvalidNodeAccessException(String message) {
		super(message);
	}
}
