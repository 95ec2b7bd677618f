package works.bosk.docnode.convert.container;

import java.util.Optional;
import works.bosk.docnode.Node;
import works.bosk.docnode.NodeType;
import works.bosk.docnode.Pair;
import works.bosk.docnode.convert.Converter;
import works.bosk.docnode.convert.Encoder;

/**
 * Represents a {@link Pair} as the two-element sequence {@code [first, second]}.
 * <p>
 * Since {@link Pair} is immutable, decoding is all-or-nothing:
 * a pair is produced only if both components decode.
 */
public record PairConverter<F, S>(
	Converter<F> firstConverter,
	Converter<S> secondConverter
) implements Converter<Pair<F, S>> {
	@Override
	public Node encode(Pair<F, S> value) {
		Node result = Node.of(NodeType.SEQUENCE);
		result.pushBack(Encoder.encodeNullable(firstConverter, value.first()));
		result.pushBack(Encoder.encodeNullable(secondConverter, value.second()));
		return result;
	}

	@Override
	public Optional<Pair<F, S>> decode(Node node) {
		if (!node.isSequence() || node.size() != 2) {
			return Optional.empty();
		}
		Optional<F> first = firstConverter.decode(node.get(0));
		Optional<S> second = secondConverter.decode(node.get(1));
		if (first.isPresent() && second.isPresent()) {
			return Optional.of(new Pair<>(first.get(), second.get()));
		} else {
			return Optional.empty();
		}
	}

	@Override
	public String toString() {
		return "Pair<" + firstConverter + "," + secondConverter + ">";
	}
}
