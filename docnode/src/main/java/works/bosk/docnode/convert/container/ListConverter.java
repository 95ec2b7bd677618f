package works.bosk.docnode.convert.container;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.bosk.docnode.Node;
import works.bosk.docnode.NodeType;
import works.bosk.docnode.convert.ContainerConverter;
import works.bosk.docnode.convert.Converter;
import works.bosk.docnode.convert.Encoder;

import static works.bosk.docnode.convert.container.ContainerDecodeMode.ALL_OR_NOTHING;

/**
 * Represents a {@link List} as a sequence node, one element per list entry, in order.
 *
 * @param factory supplies the list returned by {@link #decode}
 */
public record ListConverter<E>(
	Converter<E> elementConverter,
	Supplier<? extends List<E>> factory,
	ContainerDecodeMode decodeMode
) implements ContainerConverter<List<E>> {
	private static final Logger LOGGER = LoggerFactory.getLogger(ListConverter.class);

	@Override
	public Node encode(List<E> value) {
		Node result = Node.of(NodeType.SEQUENCE);
		for (E element: value) {
			result.pushBack(Encoder.encodeNullable(elementConverter, element));
		}
		return result;
	}

	@Override
	public Optional<List<E>> decode(Node node) {
		List<E> result = factory.get();
		if (decodeElements(node, result)) {
			return Optional.of(result);
		} else {
			return Optional.empty();
		}
	}

	/**
	 * In {@link ContainerDecodeMode#KEEP_PARTIAL KEEP_PARTIAL} mode,
	 * a sequence node clears {@code destination} immediately,
	 * and if an element fails to decode, the elements before it remain.
	 */
	@Override
	public boolean decodeInto(Node node, List<E> destination) {
		if (decodeMode == ALL_OR_NOTHING) {
			List<E> staged = new ArrayList<>();
			if (!decodeElements(node, staged)) {
				return false;
			}
			destination.clear();
			destination.addAll(staged);
			return true;
		} else {
			return decodeElements(node, destination);
		}
	}

	private boolean decodeElements(Node node, List<E> destination) {
		if (!node.isSequence()) {
			return false;
		}
		destination.clear();
		for (int i = 0; i < node.size(); i++) {
			Optional<E> element = elementConverter.decode(node.get(i));
			if (element.isEmpty()) {
				LOGGER.trace("Sequence element {} is not a valid {}: {}", i, elementConverter, node.get(i));
				return false;
			}
			destination.add(element.get());
		}
		return true;
	}

	@Override
	public String toString() {
		return "List<" + elementConverter + ">";
	}
}
