package works.bosk.docnode.convert.container;

import java.util.LinkedHashMap;
import java.util.Map;
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
 * Represents a {@link Map} as a map node.
 * <p>
 * Keys go through a {@link Converter} just like values,
 * so any convertible type can be a key, not just strings.
 * When decoding, entries are visited in the node's order,
 * and if two keys decode to equal values, the later entry wins.
 */
public record MapConverter<K, V>(
	Converter<K> keyConverter,
	Converter<V> valueConverter,
	Supplier<? extends Map<K, V>> factory,
	ContainerDecodeMode decodeMode
) implements ContainerConverter<Map<K, V>> {
	private static final Logger LOGGER = LoggerFactory.getLogger(MapConverter.class);

	@Override
	public Node encode(Map<K, V> value) {
		Node result = Node.of(NodeType.MAP);
		value.forEach((k, v) -> result.forceInsert(
			Encoder.encodeNullable(keyConverter, k),
			Encoder.encodeNullable(valueConverter, v)));
		return result;
	}

	@Override
	public Optional<Map<K, V>> decode(Node node) {
		Map<K, V> result = factory.get();
		if (decodeEntries(node, result)) {
			return Optional.of(result);
		} else {
			return Optional.empty();
		}
	}

	/**
	 * In {@link ContainerDecodeMode#KEEP_PARTIAL KEEP_PARTIAL} mode,
	 * a map node clears {@code destination} immediately,
	 * and if an entry fails to decode, the entries before it remain.
	 */
	@Override
	public boolean decodeInto(Node node, Map<K, V> destination) {
		if (decodeMode == ALL_OR_NOTHING) {
			Map<K, V> staged = new LinkedHashMap<>();
			if (!decodeEntries(node, staged)) {
				return false;
			}
			destination.clear();
			destination.putAll(staged);
			return true;
		} else {
			return decodeEntries(node, destination);
		}
	}

	private boolean decodeEntries(Node node, Map<K, V> destination) {
		if (!node.isMap()) {
			return false;
		}
		destination.clear();
		for (Node.Entry entry: node.entries()) {
			Optional<K> key = keyConverter.decode(entry.key());
			Optional<V> value = valueConverter.decode(entry.value());
			if (key.isEmpty() || value.isEmpty()) {
				LOGGER.trace("Map entry is not a valid {} -> {}: {}", keyConverter, valueConverter, entry);
				return false;
			}
			destination.put(key.get(), value.get());
		}
		return true;
	}

	@Override
	public String toString() {
		return "Map<" + keyConverter + "," + valueConverter + ">";
	}
}
