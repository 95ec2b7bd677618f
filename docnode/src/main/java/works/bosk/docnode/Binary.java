package works.bosk.docnode;

import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * An immutable buffer of raw bytes, represented in a document as base64 scalar text.
 * <p>
 * A plain {@code byte[]} is a fixed-size array of small integers as far as
 * conversion is concerned; wrap it in a {@code Binary} to get the base64 form.
 */
public final class Binary {
	private static final Binary EMPTY = new Binary(new byte[0]);

	private final byte[] data;

	private Binary(byte[] data) {
		this.data = data;
	}

	public static Binary empty() {
		return EMPTY;
	}

	/**
	 * @param data copied; later changes to the array don't affect the result
	 */
	public static Binary of(byte[] data) {
		return data.length == 0 ? EMPTY : new Binary(data.clone());
	}

	public int size() {
		return data.length;
	}

	public boolean isEmpty() {
		return data.length == 0;
	}

	/**
	 * @return a copy of the bytes
	 */
	public byte[] data() {
		return data.clone();
	}

	public ByteBuffer asByteBuffer() {
		return ByteBuffer.wrap(data).asReadOnlyBuffer();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		return Arrays.equals(data, ((Binary) o).data);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(data);
	}

	@Override
	public String toString() {
		return "Binary[" + data.length + " bytes]";
	}
}
