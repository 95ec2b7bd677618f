package works.bosk.docnode.convert.container;

import java.lang.reflect.Array;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.bosk.docnode.Node;
import works.bosk.docnode.NodeType;
import works.bosk.docnode.convert.ContainerConverter;
import works.bosk.docnode.convert.Converter;
import works.bosk.docnode.convert.Encoder;

import static works.bosk.docnode.convert.container.ContainerDecodeMode.ALL_OR_NOTHING;

/**
 * Represents a Java array, primitive or not, as a sequence node of exactly the array's length.
 * <p>
 * {@link #decodeInto} takes its required length from the destination array.
 * {@link #decode} has no destination, so it uses {@link #length} if one has been set
 * with {@link #withLength}, and otherwise accepts a sequence of any length.
 * Either way, the length is checked before anything is written.
 *
 * @param componentType the array's component class, which may be primitive
 * @param length the required length, or {@link #ANY_LENGTH}
 */
public record ArrayConverter(
	Class<?> componentType,
	Converter<?> elementConverter,
	int length,
	ContainerDecodeMode decodeMode
) implements ContainerConverter<Object> {
	public static final int ANY_LENGTH = -1;

	public ArrayConverter {
		assert length >= ANY_LENGTH;
	}

	public ArrayConverter withLength(int length) {
		if (length < 0) {
			throw new IllegalArgumentException("Negative array length: " + length);
		}
		return new ArrayConverter(componentType, elementConverter, length, decodeMode);
	}

	@Override
	@SuppressWarnings("unchecked")
	public Node encode(Object value) {
		Encoder<Object> elements = (Encoder<Object>) elementConverter;
		Node result = Node.of(NodeType.SEQUENCE);
		int n = Array.getLength(value);
		for (int i = 0; i < n; i++) {
			result.pushBack(Encoder.encodeNullable(elements, Array.get(value, i)));
		}
		return result;
	}

	@Override
	public Optional<Object> decode(Node node) {
		if (!node.isSequence() || (length != ANY_LENGTH && node.size() != length)) {
			return Optional.empty();
		}
		Object result = Array.newInstance(componentType, node.size());
		if (decodeSlots(node, result)) {
			return Optional.of(result);
		} else {
			return Optional.empty();
		}
	}

	/**
	 * In {@link ContainerDecodeMode#KEEP_PARTIAL KEEP_PARTIAL} mode,
	 * if an element fails to decode, the slots before it have already been overwritten.
	 */
	@Override
	public boolean decodeInto(Node node, Object destination) {
		int destinationLength = Array.getLength(destination);
		if (!node.isSequence() || node.size() != destinationLength) {
			return false;
		}
		if (decodeMode == ALL_OR_NOTHING) {
			Object staged = Array.newInstance(componentType, destinationLength);
			if (!decodeSlots(node, staged)) {
				return false;
			}
			System.arraycopy(staged, 0, destination, 0, destinationLength);
			return true;
		} else {
			return decodeSlots(node, destination);
		}
	}

	private boolean decodeSlots(Node node, Object destination) {
		for (int i = 0; i < node.size(); i++) {
			Optional<?> element = elementConverter.decode(node.get(i));
			if (element.isEmpty()) {
				LOGGER.trace("Array element {} is not a valid {}: {}", i, elementConverter, node.get(i));
				return false;
			}
			Array.set(destination, i, element.get());
		}
		return true;
	}

	@Override
	public String toString() {
		String size = (length == ANY_LENGTH) ? "" : Integer.toString(length);
		return elementConverter + "[" + size + "]";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ArrayConverter.class);
}
