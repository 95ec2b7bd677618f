package works.bosk.docnode.convert.scalar;

import com.google.common.primitives.UnsignedInteger;
import com.google.common.primitives.UnsignedLong;
import java.util.Optional;
import java.util.OptionalLong;
import works.bosk.docnode.Node;
import works.bosk.docnode.convert.Converter;

/**
 * Represents Guava's {@link UnsignedInteger} and {@link UnsignedLong} as decimal text.
 * Accepts the same forms as {@link SignedIntegerConverter},
 * parsed as an unsigned 64-bit value; negative numbers other than zero fail.
 */
public record UnsignedIntegerConverter(
	Class<? extends Number> valueClass,
	long maxValue
) implements Converter<Number> {
	public static final UnsignedIntegerConverter UNSIGNED_INTEGER = new UnsignedIntegerConverter(UnsignedInteger.class, 0xFFFF_FFFFL);
	public static final UnsignedIntegerConverter UNSIGNED_LONG = new UnsignedIntegerConverter(UnsignedLong.class, -1L);

	public static UnsignedIntegerConverter forClass(Class<?> type) {
		if (type == UnsignedInteger.class) {
			return UNSIGNED_INTEGER;
		} else if (type == UnsignedLong.class) {
			return UNSIGNED_LONG;
		} else {
			throw new IllegalArgumentException("Not an unsigned integer type: " + type);
		}
	}

	@Override
	public Node encode(Number value) {
		return Node.scalar(value.toString());
	}

	@Override
	public Optional<Number> decode(Node node) {
		if (!node.isScalar()) {
			return Optional.empty();
		}
		OptionalLong parsed = ScalarGrammar.parseUnsigned(node.scalar());
		if (parsed.isEmpty()) {
			return Optional.empty();
		}
		long bits = parsed.getAsLong();
		if (Long.compareUnsigned(bits, maxValue) > 0) {
			return Optional.empty();
		}
		if (valueClass == UnsignedInteger.class) {
			return Optional.of(UnsignedInteger.fromIntBits((int) bits));
		} else {
			return Optional.of(UnsignedLong.fromLongBits(bits));
		}
	}

	@Override
	public String toString() {
		return "Unsigned:" + valueClass.getSimpleName();
	}
}
