package works.bosk.docnode.convert.binary;

/**
 * The base64 encoding used by {@link BinaryConverter}.
 */
public interface Base64Codec {
	String encode(byte[] data);

	/**
	 * @return the decoded bytes; text that can't be decoded yields an empty array
	 * rather than an exception
	 */
	byte[] decode(String text);
}
