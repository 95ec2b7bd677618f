package works.bosk.docnode.convert.scalar;

import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.Parameter;
import org.junit.jupiter.params.ParameterizedClass;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;
import works.bosk.docnode.Node;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.bosk.docnode.convert.scalar.ScalarGrammar.DECIMAL;
import static works.bosk.docnode.convert.scalar.ScalarGrammar.matches;

@ParameterizedClass
@EnumSource(FloatFormat.class)
class FloatingPointConverterTest {
	@Parameter
	FloatFormat format;

	FloatingPointConverter doubles() {
		return FloatingPointConverter.forClass(double.class, format);
	}

	FloatingPointConverter floats() {
		return FloatingPointConverter.forClass(float.class, format);
	}

	static Stream<Double> doubleValues() {
		return Stream.of(
			0.0, -0.0, 1.0, -1.0, 1.5, 0.1, 1.0 / 3, 100.0, 1e16, 1e17, 1e20, 1e-5, 1.25e-7,
			123456789.125, Math.PI, -Math.E,
			Double.MAX_VALUE, -Double.MAX_VALUE, Double.MIN_VALUE, Double.MIN_NORMAL,
			Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY, Double.NaN);
	}

	static Stream<Float> floatValues() {
		return Stream.of(
			0.0f, -0.0f, 1.0f, 0.1f, 1.0f / 3, 16777216.0f, 3e20f, 1e-5f,
			Float.MAX_VALUE, Float.MIN_VALUE, Float.MIN_NORMAL,
			Float.POSITIVE_INFINITY, Float.NaN);
	}

	@ParameterizedTest
	@MethodSource("doubleValues")
	void doubleRoundTrip(Double value) {
		Node node = doubles().encode(value);
		assertEquals(Optional.of(value), doubles().decode(node), () -> "Encoded as " + node);
	}

	@ParameterizedTest
	@MethodSource("floatValues")
	void floatRoundTrip(Float value) {
		Node node = floats().encode(value);
		assertEquals(Optional.of(value), floats().decode(node), () -> "Encoded as " + node);
	}

	@ParameterizedTest
	@MethodSource("doubleValues")
	void encoding_neverLooksLikeAnInteger(Double value) {
		String text = doubles().encode(value).scalar();
		assertFalse(matches(DECIMAL, text), text);
	}

	@Test
	void wholeNumbers_getTrailingDot() {
		assertEquals(Node.scalar("1."), doubles().encode(1.0));
		assertEquals(Node.scalar("-3."), doubles().encode(-3.0));
		assertEquals(Node.scalar("100."), doubles().encode(100.0));
		assertEquals(Node.scalar("100."), floats().encode(100.0f));
		assertEquals(Node.scalar("0."), doubles().encode(0.0));
		assertEquals(Node.scalar("-0."), doubles().encode(-0.0));
	}

	@Test
	void specialValues() {
		assertEquals(Node.scalar(".nan"), doubles().encode(Double.NaN));
		assertEquals(Node.scalar(".inf"), doubles().encode(Double.POSITIVE_INFINITY));
		assertEquals(Node.scalar("-.inf"), floats().encode(Float.NEGATIVE_INFINITY));
	}

	@Test
	void exponentForm() {
		assertEquals(Node.scalar("1e+20"), doubles().encode(1e20));
		assertEquals(Node.scalar("1.5"), doubles().encode(1.5));
		assertEquals(Node.scalar("-2.5"), floats().encode(-2.5f));
	}

	@ParameterizedTest
	@ValueSource(strings = { ".inf", ".Inf", ".INF", "+.inf" })
	void positiveInfinity(String text) {
		assertEquals(Optional.of(Double.POSITIVE_INFINITY), doubles().decode(Node.scalar(text)));
		assertEquals(Optional.of(Float.POSITIVE_INFINITY), floats().decode(Node.scalar(text)));
	}

	@Test
	void negativeInfinity() {
		assertEquals(Optional.of(Double.NEGATIVE_INFINITY), doubles().decode(Node.scalar("-.inf")));
		assertEquals(Optional.of(Double.NEGATIVE_INFINITY), doubles().decode(Node.scalar("-.INF")));
	}

	@ParameterizedTest
	@ValueSource(strings = { ".nan", ".NaN", ".NAN" })
	void notANumber(String text) {
		double result = doubles().decode(Node.scalar(text)).orElseThrow().doubleValue();
		assertTrue(Double.isNaN(result));
		assertTrue(result != result);
		assertTrue(Float.isNaN(floats().decode(Node.scalar(text)).orElseThrow().floatValue()));
	}

	@Test
	void decimalForms() {
		assertEquals(Optional.of(1.0), doubles().decode(Node.scalar("1.")));
		assertEquals(Optional.of(1.0), doubles().decode(Node.scalar("1")));
		assertEquals(Optional.of(0.5), doubles().decode(Node.scalar(".5")));
		assertEquals(Optional.of(1500.0), doubles().decode(Node.scalar("+1.5e3")));
		assertEquals(Optional.of(1000.0), doubles().decode(Node.scalar("1E3")));
		assertEquals(Optional.of(0.25f), floats().decode(Node.scalar("25e-2")));
	}

	@Test
	void negativeZero_keepsSign() {
		double d = doubles().decode(Node.scalar("-0.0")).orElseThrow().doubleValue();
		assertEquals(-0.0, d);
		float f = floats().decode(Node.scalar("-0")).orElseThrow().floatValue();
		assertEquals(-0.0f, f);
	}

	@Test
	void overflow_fails() {
		assertEquals(Optional.empty(), doubles().decode(Node.scalar("1e400")));
		assertEquals(Optional.empty(), doubles().decode(Node.scalar("-1e400")));
		assertEquals(Optional.empty(), floats().decode(Node.scalar("3.5e38")));
		assertEquals(Optional.empty(), doubles().decode(Node.scalar("1e99999999999")));
	}

	@Test
	void underflow_isZero() {
		assertEquals(Optional.of(0.0), doubles().decode(Node.scalar("1e-400")));
		assertEquals(Optional.of(0.0f), floats().decode(Node.scalar("1e-50")));
	}

	@ParameterizedTest
	@ValueSource(strings = { "", ".", "e5", "1.2.3", "0x10", "nan", "inf", "-.nan", "1e", "1,5", " 1.5" })
	void lexicalMismatch_fails(String text) {
		assertEquals(Optional.empty(), doubles().decode(Node.scalar(text)));
	}

	@Test
	void wrongTag_fails() {
		for (Node node: List.of(Node.nullNode(), Node.sequenceOf(Node.scalar("1.5")))) {
			assertEquals(Optional.empty(), doubles().decode(node));
		}
	}
}
