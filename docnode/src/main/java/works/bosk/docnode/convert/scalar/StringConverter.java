package works.bosk.docnode.convert.scalar;

import java.util.Optional;
import works.bosk.docnode.Node;
import works.bosk.docnode.convert.Converter;

/**
 * Represents a {@link String} as scalar text, verbatim.
 * Quoting and escaping are the business of whatever reads and writes the document text.
 */
public record StringConverter() implements Converter<String> {
	@Override
	public Node encode(String value) {
		return Node.scalar(value);
	}

	@Override
	public Optional<String> decode(Node node) {
		if (!node.isScalar()) {
			return Optional.empty();
		}
		return Optional.of(node.scalar());
	}

	@Override
	public String toString() {
		return "String";
	}
}
