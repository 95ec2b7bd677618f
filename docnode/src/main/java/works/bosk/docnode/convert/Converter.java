package works.bosk.docnode.convert;

import java.util.Optional;
import works.bosk.docnode.Node;

/**
 * Converts in both directions between a {@link Node} and values of type {@code T}.
 * <p>
 * {@link #decode} reports a node that doesn't fit by returning an empty result;
 * it doesn't throw, and it never modifies the node.
 * For every value {@code v}, {@code decode(encode(v))} yields a value equal to {@code v}.
 */
public interface Converter<T> extends Encoder<T> {
	/**
	 * @return the decoded value, or empty if the node's tag, text, range,
	 * or shape doesn't match {@code T}
	 */
	Optional<T> decode(Node node);
}
