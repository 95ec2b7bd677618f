package works.bosk.docnode.convert.scalar;

import java.math.BigDecimal;
import java.math.MathContext;

import static works.bosk.docnode.convert.scalar.ScalarGrammar.DECIMAL;
import static works.bosk.docnode.convert.scalar.ScalarGrammar.matches;

/**
 * Writes floating-point values as scalar text that round-trips exactly.
 * <p>
 * The layout follows C's {@code %g}: plain notation unless the decimal exponent
 * is below -4 or at least the digit count, in which case it's {@code 1.5e+20};
 * trailing zeros are dropped.
 * If the result would read as an integer, a trailing {@code .} is appended,
 * because a node records only text and the text must still say "float".
 */
public final class FloatFormatter {
	static final int DOUBLE_DIGITS = 17;
	static final int FLOAT_DIGITS = 9;

	private FloatFormatter() {}

	public static String format(double value, FloatFormat format) {
		if (Double.isNaN(value)) {
			return ".nan";
		} else if (Double.isInfinite(value)) {
			return (value > 0) ? ".inf" : "-.inf";
		} else if (value == 0.0) {
			return zero(value);
		}
		BigDecimal digits = switch (format) {
			case MAX_DIGITS -> new BigDecimal(value).round(new MathContext(DOUBLE_DIGITS));
			case SHORTEST -> new BigDecimal(Double.toString(value));
		};
		return disambiguate(layout(digits, DOUBLE_DIGITS));
	}

	public static String format(float value, FloatFormat format) {
		if (Float.isNaN(value)) {
			return ".nan";
		} else if (Float.isInfinite(value)) {
			return (value > 0) ? ".inf" : "-.inf";
		} else if (value == 0.0f) {
			return zero(value);
		}
		BigDecimal digits = switch (format) {
			case MAX_DIGITS -> new BigDecimal((double) value).round(new MathContext(FLOAT_DIGITS));
			case SHORTEST -> new BigDecimal(Float.toString(value));
		};
		return disambiguate(layout(digits, FLOAT_DIGITS));
	}

	private static String zero(double value) {
		// BigDecimal has no negative zero
		return (Math.copySign(1.0, value) < 0) ? "-0." : "0.";
	}

	/**
	 * @param value nonzero
	 */
	static String layout(BigDecimal value, int precision) {
		BigDecimal stripped = value.stripTrailingZeros();
		int exponent = stripped.precision() - stripped.scale() - 1;
		if (exponent >= -4 && exponent < precision) {
			return stripped.toPlainString();
		}
		String digits = stripped.unscaledValue().abs().toString();
		StringBuilder sb = new StringBuilder();
		if (stripped.signum() < 0) {
			sb.append('-');
		}
		sb.append(digits.charAt(0));
		if (digits.length() > 1) {
			sb.append('.').append(digits, 1, digits.length());
		}
		sb.append('e').append(exponent < 0 ? '-' : '+');
		int magnitude = Math.abs(exponent);
		if (magnitude < 10) {
			sb.append('0');
		}
		sb.append(magnitude);
		return sb.toString();
	}

	static String disambiguate(String text) {
		if (matches(DECIMAL, text)) {
			return text + ".";
		} else {
			return text;
		}
	}
}
