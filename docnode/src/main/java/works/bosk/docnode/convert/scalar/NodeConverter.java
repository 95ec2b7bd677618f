package works.bosk.docnode.convert.scalar;

import java.util.Optional;
import works.bosk.docnode.Node;
import works.bosk.docnode.convert.Converter;

/**
 * The identity conversion.
 * Decoding doesn't copy: the result is the very same node,
 * so changes made through one reference are visible through the other.
 */
public record NodeConverter() implements Converter<Node> {
	@Override
	public Node encode(Node value) {
		return value;
	}

	@Override
	public Optional<Node> decode(Node node) {
		return Optional.of(node);
	}

	@Override
	public String toString() {
		return "Node";
	}
}
