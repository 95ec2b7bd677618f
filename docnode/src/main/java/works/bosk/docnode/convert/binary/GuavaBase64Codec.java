package works.bosk.docnode.convert.binary;

import com.google.common.base.CharMatcher;
import com.google.common.io.BaseEncoding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Standard padded base64 using Guava's {@link BaseEncoding}.
 * Whitespace in the input is ignored, so line-wrapped text decodes normally.
 */
public record GuavaBase64Codec() implements Base64Codec {
	private static final BaseEncoding BASE64 = BaseEncoding.base64();
	private static final byte[] NOTHING = new byte[0];

	@Override
	public String encode(byte[] data) {
		return BASE64.encode(data);
	}

	@Override
	public byte[] decode(String text) {
		String compact = CharMatcher.whitespace().removeFrom(text);
		try {
			return BASE64.decode(compact);
		} catch (IllegalArgumentException e) {
			LOGGER.debug("Undecodable base64 text of length {}", text.length(), e);
			return NOTHING;
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(GuavaBase64Codec.class);
}
