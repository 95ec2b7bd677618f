package works.bosk.docnode.convert;

import works.bosk.docnode.Node;

/**
 * Produces a {@link Node} from an in-memory value.
 * Encoding is total: any non-null value of type {@code T} has a node.
 */
@FunctionalInterface
public interface Encoder<T> {
	/**
	 * @param value not null; see {@link #encodeNullable}
	 */
	Node encode(T value);

	/**
	 * Java nulls have no category of their own; they always encode as a null node.
	 */
	static <T> Node encodeNullable(Encoder<? super T> encoder, T value) {
		if (value == null) {
			return Node.nullNode();
		} else {
			return encoder.encode(value);
		}
	}
}
