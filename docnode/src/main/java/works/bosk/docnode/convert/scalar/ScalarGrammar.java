package works.bosk.docnode.convert.scalar;

import java.util.OptionalLong;
import java.util.regex.Pattern;

/**
 * The lexical forms recognized for scalar text.
 * All patterns must match the entire text.
 * <p>
 * The patterns are compiled once and are safe to share between threads.
 */
public final class ScalarGrammar {
	public static final Pattern TRUE = Pattern.compile("true|True|TRUE");
	public static final Pattern FALSE = Pattern.compile("false|False|FALSE");
	public static final Pattern DECIMAL = Pattern.compile("[-+]?[0-9]+");
	public static final Pattern OCTAL = Pattern.compile("0o[0-7]+");
	public static final Pattern HEX = Pattern.compile("0x[0-9a-fA-F]+");
	public static final Pattern FLOAT = Pattern.compile("[-+]?(\\.[0-9]+|[0-9]+(\\.[0-9]*)?)([eE][-+]?[0-9]+)?");
	public static final Pattern INF = Pattern.compile("[-+]?(\\.inf|\\.Inf|\\.INF)");
	public static final Pattern NAN = Pattern.compile("\\.nan|\\.NaN|\\.NAN");

	private static final String RADIX_PREFIX = "0x";

	private ScalarGrammar() {}

	public static boolean matches(Pattern pattern, String text) {
		return pattern.matcher(text).matches();
	}

	/**
	 * Tries decimal, then octal, then hexadecimal.
	 *
	 * @return the value, or empty if {@code text} is in none of those forms
	 * or doesn't fit in a {@code long}
	 */
	public static OptionalLong parseSigned(String text) {
		try {
			if (matches(DECIMAL, text)) {
				return OptionalLong.of(Long.parseLong(text));
			} else if (matches(OCTAL, text)) {
				return OptionalLong.of(Long.parseLong(digitsAfterPrefix(text), 8));
			} else if (matches(HEX, text)) {
				return OptionalLong.of(Long.parseLong(digitsAfterPrefix(text), 16));
			} else {
				return OptionalLong.empty();
			}
		} catch (NumberFormatException e) {
			// The grammar already matched, so the only possible problem is overflow
			return OptionalLong.empty();
		}
	}

	/**
	 * Like {@link #parseSigned}, but the result is an unsigned 64-bit value
	 * (compare it with {@link Long#compareUnsigned}).
	 * A minus sign is accepted only on zero.
	 */
	public static OptionalLong parseUnsigned(String text) {
		try {
			if (matches(DECIMAL, text)) {
				if (text.charAt(0) == '-') {
					long magnitude = Long.parseUnsignedLong(text.substring(1));
					return (magnitude == 0) ? OptionalLong.of(0) : OptionalLong.empty();
				}
				return OptionalLong.of(Long.parseUnsignedLong(text));
			} else if (matches(OCTAL, text)) {
				return OptionalLong.of(Long.parseUnsignedLong(digitsAfterPrefix(text), 8));
			} else if (matches(HEX, text)) {
				return OptionalLong.of(Long.parseUnsignedLong(digitsAfterPrefix(text), 16));
			} else {
				return OptionalLong.empty();
			}
		} catch (NumberFormatException e) {
			// Overflow
			return OptionalLong.empty();
		}
	}

	private static String digitsAfterPrefix(String text) {
		return text.substring(RADIX_PREFIX.length());
	}
}
