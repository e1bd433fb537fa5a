package com.joshlong.portal.search.text;

/**
 * a range of UTF-8 bytes.
 */
public record ByteSpan(int start, int len) {

	public int end() {
		return this.start + this.len;
	}

}
