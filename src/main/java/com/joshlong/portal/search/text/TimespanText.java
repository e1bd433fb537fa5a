package com.joshlong.portal.search.text;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * a piece of text (a caption cue, or the text on a slide) and the span of the video in
 * which it's visible. {@code spanStart} and {@code spanEnd} are in milliseconds from the
 * start of the video. The property names mirror the database's {@code timespan_text}
 * composite type.
 */
public record TimespanText(@JsonProperty("span_start") long spanStart, @JsonProperty("span_end") long spanEnd,
		@JsonProperty("t") String text) {
}
