package works.bosk.docnode.convert.binary;

import java.util.Optional;
import works.bosk.docnode.Binary;
import works.bosk.docnode.Node;
import works.bosk.docnode.convert.Converter;

/**
 * Represents {@link Binary} data as base64 scalar text.
 * <p>
 * Non-empty text that decodes to no bytes at all is taken to be corrupt
 * and fails to decode. That catches text the codec rejects outright,
 * but it is not a complete validity check; how much more is caught
 * depends on the {@link Base64Codec}.
 */
public record BinaryConverter(Base64Codec codec) implements Converter<Binary> {
	@Override
	public Node encode(Binary value) {
		return Node.scalar(codec.encode(value.data()));
	}

	@Override
	public Optional<Binary> decode(Node node) {
		if (!node.isScalar()) {
			return Optional.empty();
		}
		String text = node.scalar();
		byte[] data = codec.decode(text);
		if (data.length == 0 && !text.isEmpty()) {
			return Optional.empty();
		}
		return Optional.of(Binary.of(data));
	}

	@Override
	public String toString() {
		return "Binary";
	}
}
