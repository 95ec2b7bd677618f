package works.bosk.docnode.convert.scalar;

import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import works.bosk.docnode.Node;
import works.bosk.docnode.convert.Converter;

/**
 * Represents a signed integer as decimal text.
 * <p>
 * Decoding also accepts {@code 0o} octal and {@code 0x} hexadecimal,
 * so the radix of the original text is not preserved.
 * Values outside the range of {@link #boxedClass} fail to decode.
 */
public record SignedIntegerConverter(
	Class<? extends Number> boxedClass,
	long minValue,
	long maxValue
) implements Converter<Number> {
	public static final SignedIntegerConverter BYTE = new SignedIntegerConverter(Byte.class, Byte.MIN_VALUE, Byte.MAX_VALUE);
	public static final SignedIntegerConverter SHORT = new SignedIntegerConverter(Short.class, Short.MIN_VALUE, Short.MAX_VALUE);
	public static final SignedIntegerConverter INT = new SignedIntegerConverter(Integer.class, Integer.MIN_VALUE, Integer.MAX_VALUE);
	public static final SignedIntegerConverter LONG = new SignedIntegerConverter(Long.class, Long.MIN_VALUE, Long.MAX_VALUE);

	private static final Map<Class<?>, SignedIntegerConverter> BY_CLASS = Map.of(
		byte.class, BYTE, Byte.class, BYTE,
		short.class, SHORT, Short.class, SHORT,
		int.class, INT, Integer.class, INT,
		long.class, LONG, Long.class, LONG);

	public SignedIntegerConverter {
		assert minValue < 0 && maxValue > 0;
	}

	/**
	 * @param type a primitive integer class or its box
	 */
	public static SignedIntegerConverter forClass(Class<?> type) {
		SignedIntegerConverter result = BY_CLASS.get(type);
		if (result == null) {
			throw new IllegalArgumentException("Not a signed integer type: " + type);
		}
		return result;
	}

	@Override
	public Node encode(Number value) {
		return Node.scalar(Long.toString(value.longValue()));
	}

	@Override
	public Optional<Number> decode(Node node) {
		if (!node.isScalar()) {
			return Optional.empty();
		}
		OptionalLong parsed = ScalarGrammar.parseSigned(node.scalar());
		if (parsed.isEmpty()) {
			return Optional.empty();
		}
		long value = parsed.getAsLong();
		if (value < minValue || value > maxValue) {
			return Optional.empty();
		}
		return Optional.of(box(value));
	}

	private Number box(long value) {
		if (boxedClass == Byte.class) {
			return (byte) value;
		} else if (boxedClass == Short.class) {
			return (short) value;
		} else if (boxedClass == Integer.class) {
			return (int) value;
		} else {
			return value;
		}
	}

	@Override
	public String toString() {
		return "Signed:" + boxedClass.getSimpleName();
	}
}
