package com.joshlong.portal.search.text;

import org.jspecify.annotations.Nullable;

import java.util.Comparator;

/**
 * a span of time in a video, quantized to 100ms. both {@code start} and
 * {@code duration} are counted in units of 100ms.
 */
public record SearchTimespan(long start, long duration) implements Comparable<SearchTimespan> {

	static final long PRECISION_MILLIS = 100;

	private static final Comparator<SearchTimespan> ORDER = Comparator.comparingLong(SearchTimespan::start)
		.thenComparingLong(SearchTimespan::duration);

	/**
	 * returns {@code null} for spans that don't make sense (negative start, end before
	 * start) or that are shorter than the precision once quantized.
	 */
	static @Nullable SearchTimespan quantize(long startMillis, long endMillis) {
		if (startMillis < 0 || endMillis < startMillis)
			return null;
		var duration = (endMillis - startMillis) / PRECISION_MILLIS;
		if (duration == 0)
			return null;
		return new SearchTimespan(startMillis / PRECISION_MILLIS, duration);
	}

	public long startMillis() {
		return this.start * PRECISION_MILLIS;
	}

	public long durationMillis() {
		return this.duration * PRECISION_MILLIS;
	}

	@Override
	public int compareTo(SearchTimespan other) {
		return ORDER.compare(this, other);
	}

}
