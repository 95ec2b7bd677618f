package works.bosk.docnode.jackson;

import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.core.JsonParser;
import tools.jackson.core.JsonToken;
import tools.jackson.core.exc.StreamReadException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.NullNode;
import tools.jackson.databind.node.ObjectNode;
import tools.jackson.databind.node.StringNode;
import works.bosk.docnode.Node;
import works.bosk.docnode.NodeType;

import static tools.jackson.core.JsonToken.END_ARRAY;
import static tools.jackson.core.JsonToken.END_OBJECT;
import static tools.jackson.core.JsonToken.START_ARRAY;
import static tools.jackson.core.JsonToken.START_OBJECT;
import static tools.jackson.core.JsonToken.VALUE_NULL;

/**
 * Converts between Jackson {@link JsonNode} trees and {@link Node} trees.
 * <p>
 * A {@link Node} scalar records only text, so JSON numbers and booleans
 * become scalars holding their JSON text, and it's up to the
 * {@link works.bosk.docnode.convert.Converter Converter} to interpret them.
 * Going the other way, every scalar becomes a JSON string.
 */
public final class JacksonNodes {
	private static final ObjectMapper MAPPER = JsonMapper.builder().build();

	private JacksonNodes() {}

	/**
	 * Reads the tokens directly rather than going through a {@link JsonNode} tree,
	 * so each number becomes a scalar holding exactly the text it had in {@code json}:
	 * {@code 1E3} stays {@code 1E3}, and no digits are lost to {@code double} precision.
	 *
	 * @throws JacksonException if {@code json} is not well-formed
	 */
	public static Node parse(String json) {
		LOGGER.debug("Parsing {} characters of JSON", json.length());
		try (JsonParser p = MAPPER.createParser(json)) {
			if (p.nextToken() == null) {
				return Node.nullNode();
			}
			Node result = readNode(p);
			if (p.nextToken() != null) {
				throw new StreamReadException(p, "Unexpected content after JSON value: " + p.currentToken());
			}
			return result;
		}
	}

	/**
	 * Expects the parser to be sitting on the first token of a value,
	 * and leaves it on the last token of that value.
	 */
	private static Node readNode(JsonParser p) {
		JsonToken token = p.currentToken();
		if (token == VALUE_NULL) {
			return Node.nullNode();
		} else if (token == START_ARRAY) {
			Node result = Node.of(NodeType.SEQUENCE);
			while (p.nextToken() != END_ARRAY) {
				result.pushBack(readNode(p));
			}
			return result;
		} else if (token == START_OBJECT) {
			Node result = Node.of(NodeType.MAP);
			while (p.nextToken() != END_OBJECT) {
				String name = p.currentName();
				p.nextToken();
				result.forceInsert(Node.scalar(name), readNode(p));
			}
			return result;
		} else if (token.isScalarValue()) {
			return Node.scalar(p.getString());
		} else {
			throw new StreamReadException(p, "Unexpected token " + token);
		}
	}

	/**
	 * Numbers in {@code json} become scalars holding the text Jackson renders for them,
	 * which depends on how the tree was built: a tree read with the default settings
	 * holds floating-point numbers as {@code double}, so {@code 1E3} comes out as
	 * {@code 1000.0}. Use {@link #parse} to keep the original text.
	 */
	public static Node toNode(JsonNode json) {
		if (json.isNull() || json.isMissingNode()) {
			return Node.nullNode();
		} else if (json.isArray()) {
			Node result = Node.of(NodeType.SEQUENCE);
			for (JsonNode element: json) {
				result.pushBack(toNode(element));
			}
			return result;
		} else if (json.isObject()) {
			Node result = Node.of(NodeType.MAP);
			for (Map.Entry<String, JsonNode> property: json.properties()) {
				result.forceInsert(Node.scalar(property.getKey()), toNode(property.getValue()));
			}
			return result;
		} else {
			return Node.scalar(json.asString());
		}
	}

	/**
	 * @throws IllegalArgumentException if a map node has a key that isn't a scalar,
	 * since JSON property names must be strings
	 */
	public static JsonNode toJsonNode(Node node) {
		return switch (node.type()) {
			case NULL -> NullNode.getInstance();
			case SCALAR -> StringNode.valueOf(node.scalar());
			case SEQUENCE -> arrayNode(node);
			case MAP -> objectNode(node);
		};
	}

	private static ArrayNode arrayNode(Node sequence) {
		ArrayNode result = MAPPER.createArrayNode();
		for (Node element: sequence.elements()) {
			result.add(toJsonNode(element));
		}
		return result;
	}

	private static ObjectNode objectNode(Node map) {
		ObjectNode result = MAPPER.createObjectNode();
		for (Node.Entry entry: map.entries()) {
			Node key = entry.key();
			if (!key.isScalar()) {
				throw new IllegalArgumentException("JSON property name must be a scalar; got " + key.type() + " node " + key);
			}
			result.set(key.scalar(), toJsonNode(entry.value()));
		}
		return result;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(JacksonNodes.class);
}
