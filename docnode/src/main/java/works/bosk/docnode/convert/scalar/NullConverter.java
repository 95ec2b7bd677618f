package works.bosk.docnode.convert.scalar;

import java.util.Optional;
import works.bosk.docnode.Node;
import works.bosk.docnode.Null;
import works.bosk.docnode.convert.Converter;

public record NullConverter() implements Converter<Null> {
	@Override
	public Node encode(Null value) {
		return Node.nullNode();
	}

	@Override
	public Optional<Null> decode(Node node) {
		if (node.isNull()) {
			return Optional.of(Null.NULL);
		} else {
			return Optional.empty();
		}
	}

	@Override
	public String toString() {
		return "Null";
	}
}
