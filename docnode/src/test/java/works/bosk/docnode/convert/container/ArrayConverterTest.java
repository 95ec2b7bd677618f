package works.bosk.docnode.convert.container;

import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.Parameter;
import org.junit.jupiter.params.ParameterizedClass;
import org.junit.jupiter.params.provider.EnumSource;
import works.bosk.docnode.Node;
import works.bosk.docnode.NodeType;
import works.bosk.docnode.convert.scalar.SignedIntegerConverter;
import works.bosk.docnode.convert.scalar.StringConverter;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.bosk.docnode.Node.scalar;
import static works.bosk.docnode.convert.container.ArrayConverter.ANY_LENGTH;
import static works.bosk.docnode.convert.container.ContainerDecodeMode.ALL_OR_NOTHING;

@ParameterizedClass
@EnumSource(ContainerDecodeMode.class)
class ArrayConverterTest {
	@Parameter
	ContainerDecodeMode mode;

	ArrayConverter ints() {
		return new ArrayConverter(int.class, SignedIntegerConverter.INT, ANY_LENGTH, mode);
	}

	static Node sequence(String... texts) {
		Node result = Node.of(NodeType.SEQUENCE);
		for (String text: texts) {
			result.pushBack(scalar(text));
		}
		return result;
	}

	@Test
	void encode_primitiveArray() {
		assertEquals(sequence("1", "-2", "3"), ints().encode(new int[] { 1, -2, 3 }));
	}

	@Test
	void encode_referenceArray_withNull() {
		ArrayConverter strings = new ArrayConverter(String.class, new StringConverter(), ANY_LENGTH, mode);
		assertEquals(Node.sequenceOf(scalar("a"), Node.nullNode()), strings.encode(new String[] { "a", null }));
	}

	@Test
	void decode_sizedToNode() {
		int[] result = (int[]) ints().decode(sequence("0x10", "0o10", "10")).orElseThrow();
		assertArrayEquals(new int[] { 16, 8, 10 }, result);
	}

	@Test
	void decode_withLength_enforced() {
		ArrayConverter pairOfInts = ints().withLength(2);
		assertArrayEquals(new int[] { 1, 2 }, (int[]) pairOfInts.decode(sequence("1", "2")).orElseThrow());
		assertEquals(Optional.empty(), pairOfInts.decode(sequence("1", "2", "3")));
		assertThrows(IllegalArgumentException.class, () -> ints().withLength(-1));
	}

	@Test
	void decodeInto() {
		int[] destination = new int[3];
		assertTrue(ints().decodeInto(sequence("7", "8", "9"), destination));
		assertArrayEquals(new int[] { 7, 8, 9 }, destination);
	}

	@Test
	void wrongLength_leavesEverySlotUntouched() {
		int[] destination = { 1, 2, 3, 4 };
		assertFalse(ints().decodeInto(sequence("5", "6", "7"), destination));
		assertArrayEquals(new int[] { 1, 2, 3, 4 }, destination);
		assertFalse(ints().decodeInto(sequence("5", "6", "7", "8", "9"), destination));
		assertArrayEquals(new int[] { 1, 2, 3, 4 }, destination);
	}

	@Test
	void wrongTag_fails() {
		int[] destination = new int[0];
		assertFalse(ints().decodeInto(Node.of(NodeType.MAP), destination));
		assertEquals(Optional.empty(), ints().decode(scalar("1")));
	}

	@Test
	void elementFailure() {
		int[] destination = { 1, 2, 3, 4 };
		assertFalse(ints().decodeInto(sequence("5", "6", "99999999999", "8"), destination));
		if (mode == ALL_OR_NOTHING) {
			assertArrayEquals(new int[] { 1, 2, 3, 4 }, destination);
		} else {
			assertArrayEquals(new int[] { 5, 6, 3, 4 }, destination, "Slots before the failure were overwritten");
		}
	}

	@Test
	void nestedArrays() {
		ArrayConverter rows = new ArrayConverter(int[].class, ints(), ANY_LENGTH, mode);
		int[][] matrix = { { 1, 2 }, { 3 } };
		Node node = rows.encode(matrix);
		assertEquals(Node.sequenceOf(sequence("1", "2"), sequence("3")), node);
		assertArrayEquals(matrix, (int[][]) rows.decode(node).orElseThrow());
	}
}
