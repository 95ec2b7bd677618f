package works.bosk.docnode.convert.scalar;

/**
 * How many significant digits {@link FloatFormatter} uses.
 * Both styles round-trip exactly.
 */
public enum FloatFormat {
	/**
	 * The maximum number of digits that could ever be needed:
	 * 17 for {@code double} and 9 for {@code float}.
	 * {@code 0.1} is written as {@code 0.10000000000000001}.
	 */
	MAX_DIGITS,

	/**
	 * Only as many digits as needed to identify the value.
	 * {@code 0.1} is written as {@code 0.1}.
	 */
	SHORTEST
}
