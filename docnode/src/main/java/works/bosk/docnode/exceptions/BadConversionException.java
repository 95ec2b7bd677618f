package works.bosk.docnode.exceptions;

import works.bosk.docnode.Node;
import works.bosk.docnode.types.DataType;

/**
 * A node could not be decoded as the requested type.
 * <p>
 * Thrown only by {@link works.bosk.docnode.convert.ConversionRegistry#as as};
 * the decode operations themselves report failure without throwing.
 */
public final class BadConversionException extends NodeException {
	private static final int MAX_NODE_TEXT = 80;

	private final transient Node node;
	private final DataType targetType;

	public BadConversionException(Node node, DataType targetType) {
		super("Bad conversion: can't decode " + describe(node) + " as " + targetType);
		this.node = node;
		this.targetType = targetType;
	}

	public Node node() {
		return node;
	}

	public DataType targetType() {
		return targetType;
	}

	private static String describe(Node node) {
		String text = node.toString();
		if (text.length() > MAX_NODE_TEXT) {
			text = text.substring(0, MAX_NODE_TEXT) + "...";
		}
		return node.type() + " node " + text;
	}
}
