package works.quill.document;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Content hashes used to derive stable identifiers and cache keys.
 */
public final class Fingerprints {
	private Fingerprints() { }

	private static final long FNV_OFFSET_BASIS = 0xcbf29ce484222325L;
	private static final long FNV_PRIME = 0x100000001b3L;

	/**
	 * 64-bit FNV-1a over the UTF-16 code units of the given parts,
	 * with a separator between parts so that ("ab","c") and ("a","bc") differ.
	 *
	 * @return the hash as 16 lowercase hex digits
	 */
	public static String shortHash(Object... parts) {
		long hash = FNV_OFFSET_BASIS;
		for (Object part: parts) {
			String s = String.valueOf(part);
			for (int i = 0; i < s.length(); i++) {
				char c = s.charAt(i);
				hash ^= (c & 0xff);
				hash *= FNV_PRIME;
				hash ^= (c >>> 8);
				hash *= FNV_PRIME;
			}
			hash ^= 0x1f;
			hash *= FNV_PRIME;
		}
		return String.format("%016x", hash);
	}

	/**
	 * @return the hex SHA-256 digest of the UTF-8 encoding of <code>text</code>
	 */
	public static String sha256(String text) {
		MessageDigest digest;
		try {
			digest = MessageDigest.getInstance("SHA-256");
		} catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("Every JVM is required to support SHA-256", e);
		}
		byte[] bytes = digest.digest(text.getBytes(StandardCharsets.UTF_8));
		StringBuilder sb = new StringBuilder(bytes.length * 2);
		for (byte b: bytes) {
			sb.append(String.format("%02x", b));
		}
		return sb.toString();
	}
}
