package com.joshlong.portal.search.text;

import java.util.Arrays;

/**
 * fixed-width, radix-64 integers as they're stored in a timespan index. every number is
 * written least-significant digit first using the standard base64 alphabet.
 */
abstract class TimespanIndexDigits {

	static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789+/";

	static final int RADIX = 64;

	// enough for any non-negative long
	static final int MAX_DIGITS = 11;

	private static final int[] VALUES = new int[128];

	static {
		Arrays.fill(VALUES, -1);
		for (var i = 0; i < ALPHABET.length(); i++)
			VALUES[ALPHABET.charAt(i)] = i;
	}

	/**
	 * the smallest number of digits (at least one) needed to represent {@code max}.
	 */
	static int digitsFor(long max) {
		if (max < 0)
			throw new IllegalArgumentException("negative values can't be encoded: " + max);
		var digits = 1;
		var remaining = max >>> 6;
		while (remaining > 0) {
			digits += 1;
			remaining >>>= 6;
		}
		return digits;
	}

	static void encode(long value, int digits, StringBuilder out) {
		if (value < 0)
			throw new IllegalArgumentException("negative values can't be encoded: " + value);
		var remaining = value;
		for (var i = 0; i < digits; i++) {
			out.append(ALPHABET.charAt((int) (remaining & (RADIX - 1))));
			remaining >>>= 6;
		}
		if (remaining != 0)
			throw new IllegalArgumentException(value + " does not fit into " + digits + " digits");
	}

	static long decode(CharSequence source, int from, int digits) {
		var value = 0L;
		for (var i = digits - 1; i >= 0; i--)
			value = value * RADIX + valueOf(source.charAt(from + i));
		return value;
	}

	private static int valueOf(char c) {
		var value = c < VALUES.length ? VALUES[c] : -1;
		if (value < 0)
			throw new IllegalStateException("invalid digit '" + c + "' in timespan index");
		return value;
	}

}
