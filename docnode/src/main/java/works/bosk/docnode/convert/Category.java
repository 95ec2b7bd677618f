package works.bosk.docnode.convert;

import com.google.common.primitives.UnsignedInteger;
import com.google.common.primitives.UnsignedLong;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Predicate;
import works.bosk.docnode.Binary;
import works.bosk.docnode.Node;
import works.bosk.docnode.Null;
import works.bosk.docnode.Pair;
import works.bosk.docnode.exceptions.AmbiguousTypeException;
import works.bosk.docnode.exceptions.UnsupportedTypeException;
import works.bosk.docnode.types.ArrayType;
import works.bosk.docnode.types.BoundType;
import works.bosk.docnode.types.DataType;

import static java.util.stream.Collectors.toList;

/**
 * The kinds of conversion, each determining the node shape a type has.
 * Every supported {@link DataType} belongs to exactly one category.
 */
public enum Category {
	BOOLEAN(t -> isOneOf(t, boolean.class, Boolean.class)),
	SIGNED_INTEGER(t -> isOneOf(t,
		byte.class, Byte.class,
		short.class, Short.class,
		int.class, Integer.class,
		long.class, Long.class)),
	UNSIGNED_INTEGER(t -> isOneOf(t, UnsignedInteger.class, UnsignedLong.class)),
	FLOATING_POINT(t -> isOneOf(t, float.class, Float.class, double.class, Double.class)),

	/**
	 * A single UTF-16 code unit.
	 */
	CHARACTER_UNIT(t -> isOneOf(t, char.class, Character.class)),

	STRING(t -> isOneOf(t, String.class)),
	NULL(t -> isOneOf(t, Null.class)),
	NODE(t -> isOneOf(t, Node.class)),
	SEQUENCE(t -> isBoundSubtypeOf(t, List.class)),
	FIXED_ARRAY(t -> t instanceof ArrayType),
	PAIR(t -> isOneOf(t, Pair.class)),
	MAP(t -> isBoundSubtypeOf(t, Map.class)),
	BINARY(t -> isOneOf(t, Binary.class)),

	/**
	 * Text types other than {@link String}.
	 * These can be encoded, but there's no way to construct one when decoding.
	 */
	ENCODE_ONLY_TEXT(t -> isBoundSubtypeOf(t, CharSequence.class) && t.rawClass() != String.class),
	;

	private static final List<Category> VALUES = List.of(values());

	private final Predicate<DataType> membership;

	Category(Predicate<DataType> membership) {
		this.membership = membership;
	}

	public boolean contains(DataType type) {
		return membership.test(type);
	}

	public boolean supportsDecode() {
		return this != ENCODE_ONLY_TEXT;
	}

	public boolean isContainer() {
		return this == SEQUENCE || this == FIXED_ARRAY || this == MAP;
	}

	/**
	 * @throws UnsupportedTypeException if no category contains {@code type}
	 * @throws AmbiguousTypeException if more than one does
	 */
	public static Category of(DataType type) {
		List<Category> matches = matching(type);
		if (matches.isEmpty()) {
			throw new UnsupportedTypeException("No conversion category for type " + type);
		} else if (matches.size() >= 2) {
			throw new AmbiguousTypeException("Type " + type + " matches multiple categories: " + matches);
		}
		return matches.get(0);
	}

	static List<Category> matching(DataType type) {
		return VALUES.stream()
			.filter(c -> c.contains(type))
			.collect(toList());
	}

	/**
	 * Representative types, at least one from each category,
	 * including the borderline ones most likely to be claimed twice.
	 */
	public static final List<DataType> PROBE_TYPES = List.of(
		DataType.BOOLEAN, DataType.of(Boolean.class),
		DataType.BYTE, DataType.SHORT, DataType.INT, DataType.LONG, DataType.of(Long.class),
		DataType.of(UnsignedInteger.class), DataType.of(UnsignedLong.class),
		DataType.FLOAT, DataType.DOUBLE, DataType.of(Float.class),
		DataType.CHAR, DataType.of(Character.class),
		DataType.STRING,
		DataType.of(Null.class),
		DataType.of(Node.class),
		new BoundType(List.class, DataType.STRING),
		new BoundType(ArrayList.class, DataType.of(Integer.class)),
		new BoundType(LinkedList.class, new BoundType(List.class, DataType.STRING)),
		new ArrayType(DataType.INT),
		new ArrayType(DataType.BYTE),
		new ArrayType(DataType.STRING),
		new ArrayType(DataType.of(Node.class)),
		new BoundType(Pair.class, DataType.STRING, DataType.of(Integer.class)),
		new BoundType(Map.class, DataType.STRING, DataType.of(Integer.class)),
		new BoundType(HashMap.class, DataType.of(Integer.class), DataType.STRING),
		new BoundType(SortedMap.class, DataType.STRING, DataType.of(Node.class)),
		new BoundType(TreeMap.class, DataType.STRING, DataType.STRING),
		DataType.of(Binary.class),
		DataType.of(StringBuilder.class),
		DataType.of(CharSequence.class)
	);

	/**
	 * Checks that every {@link #PROBE_TYPES probe type} falls in exactly one category,
	 * and that the probes cover every category.
	 *
	 * @throws IllegalStateException if not
	 */
	public static void verifyPartition() {
		List<Category> covered = new ArrayList<>();
		for (DataType probe: PROBE_TYPES) {
			List<Category> matches = matching(probe);
			if (matches.size() != 1) {
				throw new IllegalStateException("Probe type " + probe + " matches " + matches.size() + " categories: " + matches);
			}
			covered.add(matches.get(0));
		}
		for (Category category: VALUES) {
			if (!covered.contains(category)) {
				throw new IllegalStateException("No probe type for category " + category);
			}
		}
	}

	private static boolean isOneOf(DataType type, Class<?>... classes) {
		for (Class<?> c: classes) {
			if (type.rawClass() == c) {
				return true;
			}
		}
		return false;
	}

	private static boolean isBoundSubtypeOf(DataType type, Class<?> supertype) {
		return type instanceof BoundType && supertype.isAssignableFrom(type.rawClass());
	}
}
