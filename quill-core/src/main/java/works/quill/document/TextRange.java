package works.quill.document;

/**
 * A half-open range <code>[start, end)</code> of character offsets into a passage's plain text.
 * Whether the range fits a particular passage is checked by whoever pairs the two.
 */
public record TextRange(int start, int end) {
	public TextRange {
		if (start < 0) {
			throw new IllegalArgumentException("Range start must not be negative: " + start);
		} else if (end < start) {
			throw new IllegalArgumentException("Range end " + end + " precedes start " + start);
		}
	}

	public static TextRange of(int start, int end) {
		return new TextRange(start, end);
	}

	public int length() {
		return end - start;
	}

	public boolean isEmpty() {
		return start == end;
	}

	public boolean fitsWithin(int textLength) {
		return end <= textLength;
	}

	/**
	 * Non-strict: a range encloses itself.
	 */
	public boolean encloses(TextRange other) {
		return start <= other.start && other.end <= end;
	}

	/**
	 * @return true if the two ranges share some characters but neither encloses the other.
	 * Such ranges can't both be represented as elements of one tree.
	 */
	public boolean crosses(TextRange other) {
		return start < other.end && other.start < end
			&& !encloses(other) && !other.encloses(this);
	}

	public TextRange union(TextRange other) {
		return new TextRange(Math.min(start, other.start), Math.max(end, other.end));
	}

	/**
	 * @return the nearest range that fits within <code>[0, textLength]</code>
	 */
	public TextRange clampedTo(int textLength) {
		int newEnd = Math.min(end, textLength);
		return new TextRange(Math.min(start, newEnd), newEnd);
	}

	public String of(String text) {
		return text.substring(start, end);
	}

	@Override
	public String toString() {
		return "[" + start + "," + end + ")";
	}
}
