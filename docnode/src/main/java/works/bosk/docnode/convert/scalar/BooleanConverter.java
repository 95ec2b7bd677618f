package works.bosk.docnode.convert.scalar;

import java.util.Optional;
import works.bosk.docnode.Node;
import works.bosk.docnode.convert.Converter;

import static works.bosk.docnode.convert.scalar.ScalarGrammar.FALSE;
import static works.bosk.docnode.convert.scalar.ScalarGrammar.TRUE;
import static works.bosk.docnode.convert.scalar.ScalarGrammar.matches;

/**
 * Represents a {@code boolean} as the scalar {@code true} or {@code false}.
 * Decoding also accepts the capitalized and upper-case spellings, and nothing else.
 */
public record BooleanConverter() implements Converter<Boolean> {
	@Override
	public Node encode(Boolean value) {
		return Node.scalar(value ? "true" : "false");
	}

	@Override
	public Optional<Boolean> decode(Node node) {
		if (!node.isScalar()) {
			return Optional.empty();
		}
		String text = node.scalar();
		if (matches(TRUE, text)) {
			return Optional.of(true);
		} else if (matches(FALSE, text)) {
			return Optional.of(false);
		} else {
			return Optional.empty();
		}
	}

	@Override
	public String toString() {
		return "boolean";
	}
}
