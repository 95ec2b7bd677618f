package works.bosk.docnode;

/**
 * A two-element tuple, represented in a document as a two-element sequence.
 * Either component may be null, which is represented as a null node.
 */
public record Pair<F, S>(F first, S second) {
	public static <F, S> Pair<F, S> of(F first, S second) {
		return new Pair<>(first, second);
	}

	@Override
	public String toString() {
		return "(" + first + ", " + second + ")";
	}
}
