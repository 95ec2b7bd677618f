package works.bosk.docnode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import works.bosk.docnode.exceptions.InvalidNodeAccessException;

import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * A weakly-typed document value: null, scalar text, an ordered sequence of nodes,
 * or an ordered map from key nodes to value nodes.
 * <p>
 * Null and scalar nodes are immutable. Sequence and map nodes can grow
 * via {@link #pushBack}, {@link #insert} and {@link #forceInsert},
 * and are shared by reference: two variables referring to the same
 * container node see each other's changes.
 * <p>
 * Equality is structural.
 * Nodes are not thread-safe; callers that share a tree across threads
 * must synchronize access themselves.
 */
public final class Node {
	private static final Node NULL_NODE = new Node(NodeType.NULL, null, null, null);

	private final NodeType type;
	private final String scalar;
	private final List<Node> elements;
	private final List<Entry> entries;

	/**
	 * One key-value pair of a {@link NodeType#MAP MAP} node.
	 */
	public record Entry(Node key, Node value) {
		public Entry {
			requireNonNull(key);
			requireNonNull(value);
		}

		@Override
		public String toString() {
			return key + ": " + value;
		}
	}

	private Node(NodeType type, String scalar, List<Node> elements, List<Entry> entries) {
		this.type = type;
		this.scalar = scalar;
		this.elements = elements;
		this.entries = entries;
	}

	public static Node nullNode() {
		return NULL_NODE;
	}

	public static Node scalar(String text) {
		return new Node(NodeType.SCALAR, requireNonNull(text), null, null);
	}

	/**
	 * @return a new empty node of the given type.
	 * For {@link NodeType#SCALAR SCALAR}, that's the empty string.
	 */
	public static Node of(NodeType type) {
		return switch (type) {
			case NULL -> NULL_NODE;
			case SCALAR -> scalar("");
			case SEQUENCE -> new Node(NodeType.SEQUENCE, null, new ArrayList<>(), null);
			case MAP -> new Node(NodeType.MAP, null, null, new ArrayList<>());
		};
	}

	public static Node sequenceOf(Node... elements) {
		Node result = of(NodeType.SEQUENCE);
		for (Node element: elements) {
			result.pushBack(element);
		}
		return result;
	}

	public NodeType type() {
		return type;
	}

	public boolean isNull() {
		return type == NodeType.NULL;
	}

	public boolean isScalar() {
		return type == NodeType.SCALAR;
	}

	public boolean isSequence() {
		return type == NodeType.SEQUENCE;
	}

	public boolean isMap() {
		return type == NodeType.MAP;
	}

	/**
	 * @throws InvalidNodeAccessException if this is not a {@link NodeType#SCALAR SCALAR} node
	 */
	public String scalar() {
		if (type != NodeType.SCALAR) {
			throw new InvalidNodeAccessException("Not a scalar: " + type);
		}
		return scalar;
	}

	/**
	 * @return the number of elements of a sequence or entries of a map; zero otherwise
	 */
	public int size() {
		return switch (type) {
			case SEQUENCE -> elements.size();
			case MAP -> entries.size();
			case NULL, SCALAR -> 0;
		};
	}

	/**
	 * @throws InvalidNodeAccessException if this is not a sequence
	 * or {@code index} is out of range
	 */
	public Node get(int index) {
		requireSequence("get");
		if (index < 0 || index >= elements.size()) {
			throw new InvalidNodeAccessException("Index " + index + " out of range for sequence of size " + elements.size());
		}
		return elements.get(index);
	}

	/**
	 * @return the value of the first entry whose key equals {@code key}
	 * @throws InvalidNodeAccessException if this is not a map
	 */
	public Optional<Node> get(Node key) {
		requireMap("get");
		for (Entry entry: entries) {
			if (entry.key().equals(key)) {
				return Optional.of(entry.value());
			}
		}
		return Optional.empty();
	}

	public Optional<Node> get(String key) {
		return get(scalar(key));
	}

	/**
	 * @return an unmodifiable view of this sequence's elements
	 */
	public List<Node> elements() {
		requireSequence("elements");
		return Collections.unmodifiableList(elements);
	}

	/**
	 * @return an unmodifiable view of this map's entries, in stored order
	 */
	public List<Entry> entries() {
		requireMap("entries");
		return Collections.unmodifiableList(entries);
	}

	public Node pushBack(Node child) {
		requireSequence("pushBack");
		elements.add(requireNonNull(child));
		return this;
	}

	/**
	 * Replaces the value of an existing entry whose key equals {@code key},
	 * or appends a new entry if there is none.
	 */
	public Node insert(Node key, Node value) {
		requireMap("insert");
		for (int i = 0; i < entries.size(); i++) {
			if (entries.get(i).key().equals(key)) {
				entries.set(i, new Entry(key, value));
				return this;
			}
		}
		entries.add(new Entry(key, value));
		return this;
	}

	/**
	 * Appends a new entry without checking for an existing one with the same key.
	 */
	public Node forceInsert(Node key, Node value) {
		requireMap("forceInsert");
		entries.add(new Entry(key, value));
		return this;
	}

	private void requireSequence(String operation) {
		if (type != NodeType.SEQUENCE) {
			throw new InvalidNodeAccessException("Can't " + operation + " on " + type + " node; sequence required");
		}
	}

	private void requireMap(String operation) {
		if (type != NodeType.MAP) {
			throw new InvalidNodeAccessException("Can't " + operation + " on " + type + " node; map required");
		}
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		Node that = (Node) o;
		return type == that.type
			&& Objects.equals(scalar, that.scalar)
			&& Objects.equals(elements, that.elements)
			&& Objects.equals(entries, that.entries);
	}

	@Override
	public int hashCode() {
		return Objects.hash(type, scalar, elements, entries);
	}

	/**
	 * A compact, flow-style rendering for log messages and debugging.
	 * Not an emitter: scalars are not quoted or escaped.
	 */
	@Override
	public String toString() {
		return switch (type) {
			case NULL -> "~";
			case SCALAR -> scalar.isEmpty() ? "\"\"" : scalar;
			case SEQUENCE -> elements.stream()
				.map(Node::toString)
				.collect(joining(", ", "[", "]"));
			case MAP -> entries.stream()
				.map(Entry::toString)
				.collect(joining(", ", "{", "}"));
		};
	}
}
