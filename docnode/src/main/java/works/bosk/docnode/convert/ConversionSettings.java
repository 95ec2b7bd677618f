package works.bosk.docnode.convert;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;
import works.bosk.docnode.convert.binary.Base64Codec;
import works.bosk.docnode.convert.binary.GuavaBase64Codec;
import works.bosk.docnode.convert.container.ContainerDecodeMode;
import works.bosk.docnode.convert.scalar.FloatFormat;

import static works.bosk.docnode.convert.container.ContainerDecodeMode.KEEP_PARTIAL;
import static works.bosk.docnode.convert.scalar.FloatFormat.MAX_DIGITS;

@Value
@Builder(toBuilder = true)
public class ConversionSettings {
	public static final ConversionSettings DEFAULT = ConversionSettings.builder().build();

	/**
	 * How {@code float} and {@code double} values are written.
	 * Either way, the text decodes back to the same value.
	 */
	@Default FloatFormat floatFormat = MAX_DIGITS;

	/**
	 * What's left in a caller-supplied container when decoding into it fails partway.
	 * Default is {@link ContainerDecodeMode#KEEP_PARTIAL KEEP_PARTIAL},
	 * which does no extra copying.
	 */
	@Default ContainerDecodeMode containerDecodeMode = KEEP_PARTIAL;

	@Default Base64Codec base64Codec = new GuavaBase64Codec();
}
