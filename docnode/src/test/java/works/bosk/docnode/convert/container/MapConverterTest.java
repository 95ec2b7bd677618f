package works.bosk.docnode.convert.container;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.Parameter;
import org.junit.jupiter.params.ParameterizedClass;
import org.junit.jupiter.params.provider.EnumSource;
import works.bosk.docnode.Node;
import works.bosk.docnode.NodeType;
import works.bosk.docnode.convert.scalar.BooleanConverter;
import works.bosk.docnode.convert.scalar.StringConverter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.bosk.docnode.Node.scalar;
import static works.bosk.docnode.convert.container.ContainerDecodeMode.ALL_OR_NOTHING;

@ParameterizedClass
@EnumSource(ContainerDecodeMode.class)
class MapConverterTest {
	@Parameter
	ContainerDecodeMode mode;

	MapConverter<String, Boolean> converter() {
		return new MapConverter<>(new StringConverter(), new BooleanConverter(), LinkedHashMap::new, mode);
	}

	@Test
	void encode_keepsIterationOrder() {
		Map<String, Boolean> map = new LinkedHashMap<>();
		map.put("z", true);
		map.put("a", false);
		Node node = converter().encode(map);
		assertEquals(List.of(scalar("z"), scalar("a")),
			node.entries().stream().map(Node.Entry::key).toList());
		assertEquals(Optional.of(scalar("false")), node.get("a"));
	}

	@Test
	void decode() {
		Node node = Node.of(NodeType.MAP)
			.insert(scalar("b"), scalar("true"))
			.insert(scalar("a"), scalar("False"));
		Map<String, Boolean> result = converter().decode(node).orElseThrow();
		assertEquals(Map.of("a", false, "b", true), result);
		assertEquals(List.of("b", "a"), List.copyOf(result.keySet()));
	}

	@Test
	void duplicateKeys_lastWins() {
		Node node = Node.of(NodeType.MAP)
			.forceInsert(scalar("k"), scalar("true"))
			.forceInsert(scalar("k"), scalar("false"));
		assertEquals(Optional.of(Map.of("k", false)), converter().decode(node));
	}

	@Test
	void nonStringKeys() {
		var byFlag = new MapConverter<>(new BooleanConverter(), new StringConverter(), TreeMap::new, mode);
		Node node = Node.of(NodeType.MAP)
			.insert(scalar("true"), scalar("yes"))
			.insert(scalar("false"), scalar("no"));
		Map<Boolean, String> result = byFlag.decode(node).orElseThrow();
		assertInstanceOf(TreeMap.class, result);
		assertEquals(List.of(false, true), List.copyOf(result.keySet()));
		assertEquals(Optional.empty(), byFlag.decode(Node.of(NodeType.MAP).insert(scalar("maybe"), scalar("?"))));
	}

	@Test
	void decodeInto_replacesContents() {
		Map<String, Boolean> destination = new LinkedHashMap<>(Map.of("old", true));
		assertTrue(converter().decodeInto(Node.of(NodeType.MAP).insert(scalar("new"), scalar("false")), destination));
		assertEquals(Map.of("new", false), destination);
	}

	@Test
	void wrongTag_leavesDestinationUntouched() {
		Map<String, Boolean> destination = new LinkedHashMap<>(Map.of("old", true));
		assertFalse(converter().decodeInto(Node.sequenceOf(scalar("a")), destination));
		assertEquals(Map.of("old", true), destination);
	}

	@Test
	void entryFailure() {
		Node node = Node.of(NodeType.MAP)
			.insert(scalar("a"), scalar("true"))
			.insert(scalar("b"), scalar("nope"))
			.insert(scalar("c"), scalar("false"));
		Map<String, Boolean> destination = new LinkedHashMap<>(Map.of("old", true));
		assertFalse(converter().decodeInto(node, destination));
		if (mode == ALL_OR_NOTHING) {
			assertEquals(Map.of("old", true), destination);
		} else {
			assertEquals(Map.of("a", true), destination, "Entries before the failure remain");
		}
	}
}
