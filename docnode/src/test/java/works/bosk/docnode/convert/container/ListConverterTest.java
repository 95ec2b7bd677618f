package works.bosk.docnode.convert.container;

import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.Parameter;
import org.junit.jupiter.params.ParameterizedClass;
import org.junit.jupiter.params.provider.EnumSource;
import works.bosk.docnode.Node;
import works.bosk.docnode.NodeType;
import works.bosk.docnode.convert.scalar.BooleanConverter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.bosk.docnode.Node.scalar;
import static works.bosk.docnode.convert.container.ContainerDecodeMode.ALL_OR_NOTHING;

@ParameterizedClass
@EnumSource(ContainerDecodeMode.class)
class ListConverterTest {
	@Parameter
	ContainerDecodeMode mode;

	ListConverter<Boolean> converter() {
		return new ListConverter<>(new BooleanConverter(), ArrayList::new, mode);
	}

	@Test
	void encode_inOrder() {
		assertEquals(Node.sequenceOf(scalar("true"), scalar("false"), scalar("true")),
			converter().encode(List.of(true, false, true)));
		assertEquals(Node.of(NodeType.SEQUENCE), converter().encode(List.of()));
	}

	@Test
	void encode_javaNullElement_isNullNode() {
		List<Boolean> list = new ArrayList<>();
		list.add(null);
		assertEquals(Node.sequenceOf(Node.nullNode()), converter().encode(list));
	}

	@Test
	void decode() {
		assertEquals(Optional.of(List.of(false, true)),
			converter().decode(Node.sequenceOf(scalar("False"), scalar("TRUE"))));
		assertEquals(Optional.of(List.of()), converter().decode(Node.of(NodeType.SEQUENCE)));
	}

	@Test
	void decode_usesFactory() {
		var linked = new ListConverter<>(new BooleanConverter(), LinkedList::new, mode);
		assertInstanceOf(LinkedList.class, linked.decode(Node.sequenceOf(scalar("true"))).orElseThrow());
	}

	@Test
	void decodeInto_replacesContents() {
		List<Boolean> destination = new ArrayList<>(List.of(true, true, true));
		assertTrue(converter().decodeInto(Node.sequenceOf(scalar("false")), destination));
		assertEquals(List.of(false), destination);
	}

	@Test
	void wrongTag_leavesDestinationUntouched() {
		List<Boolean> destination = new ArrayList<>(List.of(true));
		assertFalse(converter().decodeInto(Node.of(NodeType.MAP), destination));
		assertFalse(converter().decodeInto(scalar("true"), destination));
		assertEquals(List.of(true), destination);
		assertEquals(Optional.empty(), converter().decode(Node.nullNode()));
	}

	@Test
	void elementFailure() {
		Node node = Node.sequenceOf(scalar("false"), scalar("false"), scalar("maybe"), scalar("false"));
		List<Boolean> destination = new ArrayList<>(List.of(true));
		assertFalse(converter().decodeInto(node, destination));
		if (mode == ALL_OR_NOTHING) {
			assertEquals(List.of(true), destination);
		} else {
			assertEquals(List.of(false, false), destination, "Elements before the failure remain");
		}
		assertEquals(Optional.empty(), converter().decode(node));
	}

	@Test
	void decode_leavesNodeUnchanged() {
		Node node = Node.sequenceOf(scalar("true"), scalar("nope"));
		Node copy = Node.sequenceOf(scalar("true"), scalar("nope"));
		converter().decode(node);
		assertEquals(copy, node);
	}
}
