package works.bosk.docnode.convert.scalar;

import java.util.Optional;
import works.bosk.docnode.Node;
import works.bosk.docnode.convert.Converter;

/**
 * Represents a {@code char} as a scalar exactly one UTF-16 code unit long.
 */
public record CharacterConverter() implements Converter<Character> {
	@Override
	public Node encode(Character value) {
		return Node.scalar(String.valueOf(value.charValue()));
	}

	@Override
	public Optional<Character> decode(Node node) {
		if (!node.isScalar()) {
			return Optional.empty();
		}
		String text = node.scalar();
		if (text.length() != 1) {
			return Optional.empty();
		}
		return Optional.of(text.charAt(0));
	}

	@Override
	public String toString() {
		return "char";
	}
}
