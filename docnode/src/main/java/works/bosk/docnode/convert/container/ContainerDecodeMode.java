package works.bosk.docnode.convert.container;

/**
 * What a caller-supplied destination container holds after a decode
 * that fails partway through.
 */
public enum ContainerDecodeMode {
	/**
	 * Elements decoded before the failure stay in the destination.
	 * Sequences and maps are cleared first, so they end up holding
	 * a prefix of the node's contents; arrays have their leading slots overwritten.
	 * A node of the wrong tag or size leaves the destination untouched.
	 */
	KEEP_PARTIAL,

	/**
	 * Decoding goes into a staging container that replaces the destination's
	 * contents only on success, so a failed decode leaves the destination untouched.
	 */
	ALL_OR_NOTHING
}
