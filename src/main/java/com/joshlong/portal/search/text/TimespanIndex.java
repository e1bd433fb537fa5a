package com.joshlong.portal.search.text;

/**
 * read-only view of an encoded timespan index. The encoding is a three character header
 * followed by one fixed-width record per slot:
 *
 * <pre>
 * header: offsetDigits-1, startDigits-1, durationDigits-1   (each '0' + n)
 * record: byte offset into texts | start | duration          (radix-64, LSB first)
 * </pre>
 *
 * records are sorted by byte offset, which is what makes {@link #lookup(long)} a binary
 * search.
 */
final class TimespanIndex {

	static final int HEADER_LENGTH = 3;

	private final String data;

	private final int offsetDigits;

	private final int startDigits;

	private final int durationDigits;

	private final int recordLength;

	private final int size;

	TimespanIndex(String data) {
		if (data.length() < HEADER_LENGTH)
			throw new IllegalStateException("timespan index is too short to hold a header");
		this.data = data;
		this.offsetDigits = headerDigits(data.charAt(0));
		this.startDigits = headerDigits(data.charAt(1));
		this.durationDigits = headerDigits(data.charAt(2));
		this.recordLength = this.offsetDigits + this.startDigits + this.durationDigits;
		var body = data.length() - HEADER_LENGTH;
		if (body % this.recordLength != 0)
			throw new IllegalStateException(
					"timespan index body of length " + body + " isn't a multiple of record length " + recordLength);
		this.size = body / this.recordLength;
	}

	static void writeHeader(int offsetDigits, int startDigits, int durationDigits, StringBuilder out) {
		out.append((char) ('0' + offsetDigits - 1))
			.append((char) ('0' + startDigits - 1))
			.append((char) ('0' + durationDigits - 1));
	}

	private static int headerDigits(char c) {
		var digits = c - '0' + 1;
		if (digits < 1 || digits > TimespanIndexDigits.MAX_DIGITS)
			throw new IllegalStateException("corrupt timespan index header: '" + c + "'");
		return digits;
	}

	int size() {
		return this.size;
	}

	long offset(int slot) {
		return TimespanIndexDigits.decode(this.data, this.recordStart(slot), this.offsetDigits);
	}

	long start(int slot) {
		return TimespanIndexDigits.decode(this.data, this.recordStart(slot) + this.offsetDigits, this.startDigits);
	}

	long duration(int slot) {
		return TimespanIndexDigits.decode(this.data, this.recordStart(slot) + this.offsetDigits + this.startDigits,
				this.durationDigits);
	}

	SearchTimespan timespan(int slot) {
		return new SearchTimespan(this.start(slot), this.duration(slot));
	}

	/**
	 * finds the slot whose text contains the given byte offset into {@code texts}: the
	 * last record whose offset is less than or equal to the needle.
	 */
	int lookup(long byteOffset) {
		if (this.size == 0)
			throw new IllegalStateException("can't look up offsets in an empty timespan index");
		var low = 0;
		var high = this.size - 1;
		while (low < high) {
			var mid = (low + high + 1) >>> 1;
			var offset = this.offset(mid);
			if (offset == byteOffset)
				return mid;
			if (offset < byteOffset)
				low = mid;
			else
				high = mid - 1;
		}
		return low;
	}

	private int recordStart(int slot) {
		if (slot < 0 || slot >= this.size)
			throw new IndexOutOfBoundsException("slot " + slot + " is out of bounds for " + this.size + " slots");
		return HEADER_LENGTH + slot * this.recordLength;
	}

}
