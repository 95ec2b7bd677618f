package works.bosk.docnode.convert.scalar;

import works.bosk.docnode.Node;
import works.bosk.docnode.convert.Encoder;

/**
 * Encodes any {@link CharSequence} as scalar text.
 * There's no way to decode into an arbitrary {@link CharSequence},
 * so this is only an {@link Encoder}; decode to {@link String} instead.
 */
public record TextEncoder() implements Encoder<CharSequence> {
	@Override
	public Node encode(CharSequence value) {
		return Node.scalar(value.toString());
	}

	@Override
	public String toString() {
		return "Text";
	}
}
