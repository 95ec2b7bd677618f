package works.bosk.docnode;

/**
 * The tag carried by every {@link Node}.
 * A node carries no numeric or boolean kind: all scalars are text.
 */
public enum NodeType {
	NULL,
	SCALAR,
	SEQUENCE,
	MAP
}
