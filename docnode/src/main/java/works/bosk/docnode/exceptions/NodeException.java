package works.bosk.docnode.exceptions;

/**
 * Root of the exceptions thrown by this library.
 * <p>
 * Decoding itself never throws these for problems with a node's content;
 * a node that doesn't match the requested type is reported as an
 * unsuccessful result. These exceptions come from the exception-style
 * conveniences, from misuse of the {@link works.bosk.docnode.Node Node} API,
 * and from requests for types that can't be converted at all.
 */
public sealed abstract class NodeException extends RuntimeException permits
	AmbiguousTypeException,
	BadConversionException,
	InvalidNodeAccessException,
	UnsupportedTypeException
{
	protected NodeException(String message) {
		super(message);
	}

	protected NodeException(String message, Throwable cause) {
		super(message, cause);
	}
}
