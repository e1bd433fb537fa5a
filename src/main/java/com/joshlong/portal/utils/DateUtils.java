package com.joshlong.portal.utils;

import org.jspecify.annotations.Nullable;

import java.time.OffsetDateTime;

public abstract class DateUtils {

	/**
	 * seconds since the epoch, which is what the search index filters and sorts on.
	 */
	public static @Nullable Long epochSeconds(@Nullable OffsetDateTime dateTime) {
		if (dateTime == null) {
			return null;
		}
		return dateTime.toEpochSecond();
	}

}
