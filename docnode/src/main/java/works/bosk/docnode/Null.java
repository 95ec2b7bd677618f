package works.bosk.docnode;

/**
 * The in-memory counterpart of a {@link NodeType#NULL NULL} node.
 * Use this, rather than a Java {@code null}, when you want to request
 * or produce a null node explicitly.
 */
public enum Null {
	NULL;

	@Override
	public String toString() {
		return "~";
	}
}
