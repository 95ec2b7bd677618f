package works.bosk.docnode.convert.binary;

import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import works.bosk.docnode.Binary;
import works.bosk.docnode.Node;

import static java.nio.charset.StandardCharsets.US_ASCII;
import static org.junit.jupiter.api.Assertions.assertEquals;

class BinaryConverterTest {
	final BinaryConverter converter = new BinaryConverter(new GuavaBase64Codec());

	@Test
	void emptyBuffer_isEmptyText() {
		assertEquals(Node.scalar(""), converter.encode(Binary.empty()));
		assertEquals(Optional.of(Binary.empty()), converter.decode(Node.scalar("")));
	}

	@Test
	void encode() {
		assertEquals(Node.scalar("SGVsbG8="), converter.encode(Binary.of("Hello".getBytes(US_ASCII))));
	}

	@Test
	void decode() {
		assertEquals(Optional.of(Binary.of("Hello".getBytes(US_ASCII))), converter.decode(Node.scalar("SGVsbG8=")));
		assertEquals(Optional.of(Binary.of(new byte[] { (byte) 0xFF, 0, 1 })), converter.decode(Node.scalar("/wAB")));
	}

	@Test
	void roundTrip() {
		byte[] bytes = new byte[256];
		for (int i = 0; i < bytes.length; i++) {
			bytes[i] = (byte) i;
		}
		Binary value = Binary.of(bytes);
		assertEquals(Optional.of(value), converter.decode(converter.encode(value)));
	}

	@ParameterizedTest
	@ValueSource(strings = { "!!!!", "====", "SGVsbG8=!", "é" })
	void nonEmptyTextWithNoBytes_fails(String text) {
		assertEquals(Optional.empty(), converter.decode(Node.scalar(text)));
	}

	@Test
	void wrongTag_fails() {
		assertEquals(Optional.empty(), converter.decode(Node.nullNode()));
		assertEquals(Optional.empty(), converter.decode(Node.sequenceOf(Node.scalar("SGVsbG8="))));
	}

	@Test
	void customCodec() {
		Base64Codec reversing = new Base64Codec() {
			@Override
			public String encode(byte[] data) {
				return new StringBuilder(new GuavaBase64Codec().encode(data)).reverse().toString();
			}

			@Override
			public byte[] decode(String text) {
				return new GuavaBase64Codec().decode(new StringBuilder(text).reverse().toString());
			}
		};
		BinaryConverter custom = new BinaryConverter(reversing);
		Binary value = Binary.of(new byte[] { 1, 2, 3 });
		assertEquals(Node.scalar("DIQA"), custom.encode(value));
		assertEquals(Optional.of(value), custom.decode(Node.scalar("DIQA")));
	}
}
