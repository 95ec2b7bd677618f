package works.bosk.docnode.exceptions;

/**
 * The requested type falls in no conversion category,
 * or the category it falls in doesn't support the requested direction.
 * <p>
 * This is a programming error rather than a problem with any particular node:
 * it's thrown when the converter is requested, before any node is read.
 */
public final class UnsupportedTypeException extends NodeException {
	public UnsupportedTypeException(String message) {
		super(message);
	}

	public UnsupportedTypeException(String message, Throwable cause) {
		super(message, cause);
	}
}
