package works.bosk.docnode.convert.scalar;

import java.math.BigDecimal;
import java.util.Optional;
import works.bosk.docnode.Node;
import works.bosk.docnode.convert.Converter;

import static works.bosk.docnode.convert.scalar.ScalarGrammar.FLOAT;
import static works.bosk.docnode.convert.scalar.ScalarGrammar.INF;
import static works.bosk.docnode.convert.scalar.ScalarGrammar.NAN;
import static works.bosk.docnode.convert.scalar.ScalarGrammar.matches;

/**
 * Represents {@code float} and {@code double} as decimal text,
 * plus {@code .inf}, {@code -.inf} and {@code .nan}.
 * <p>
 * Decoding parses the text exactly as a {@link BigDecimal}
 * and then rounds once to the target precision.
 * A value too large for the target fails rather than becoming infinite;
 * one too small underflows to zero.
 *
 * @param boxedClass {@link Float} or {@link Double}
 */
public record FloatingPointConverter(
	Class<? extends Number> boxedClass,
	FloatFormat format
) implements Converter<Number> {
	public FloatingPointConverter {
		assert boxedClass == Float.class || boxedClass == Double.class;
	}

	public static FloatingPointConverter forClass(Class<?> type, FloatFormat format) {
		if (type == float.class || type == Float.class) {
			return new FloatingPointConverter(Float.class, format);
		} else if (type == double.class || type == Double.class) {
			return new FloatingPointConverter(Double.class, format);
		} else {
			throw new IllegalArgumentException("Not a floating-point type: " + type);
		}
	}

	@Override
	public Node encode(Number value) {
		if (boxedClass == Float.class) {
			return Node.scalar(FloatFormatter.format(value.floatValue(), format));
		} else {
			return Node.scalar(FloatFormatter.format(value.doubleValue(), format));
		}
	}

	@Override
	public Optional<Number> decode(Node node) {
		if (!node.isScalar()) {
			return Optional.empty();
		}
		String text = node.scalar();
		if (matches(FLOAT, text)) {
			BigDecimal wide;
			try {
				wide = new BigDecimal(text);
			} catch (NumberFormatException e) {
				// Exponent beyond what BigDecimal can represent
				return Optional.empty();
			}
			return narrow(wide, text.charAt(0) == '-');
		} else if (matches(INF, text)) {
			boolean negative = text.charAt(0) == '-';
			return Optional.of(box(negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY));
		} else if (matches(NAN, text)) {
			return Optional.of(box(Double.NaN));
		} else {
			return Optional.empty();
		}
	}

	private Optional<Number> narrow(BigDecimal wide, boolean negative) {
		if (boxedClass == Float.class) {
			float result = wide.floatValue();
			if (Float.isInfinite(result)) {
				return Optional.empty();
			}
			if (result == 0.0f && negative) {
				result = -0.0f;
			}
			return Optional.of(result);
		} else {
			double result = wide.doubleValue();
			if (Double.isInfinite(result)) {
				return Optional.empty();
			}
			if (result == 0.0 && negative) {
				result = -0.0;
			}
			return Optional.of(result);
		}
	}

	private Number box(double value) {
		if (boxedClass == Float.class) {
			return (float) value;
		} else {
			return value;
		}
	}

	@Override
	public String toString() {
		return "Floating:" + boxedClass.getSimpleName();
	}
}
