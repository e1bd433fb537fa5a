package com.joshlong.portal.search.text;

import java.util.List;

/**
 * a snippet of text matching a query, where it occurs in the video ({@code start} and
 * {@code duration} in milliseconds), and which parts of the snippet should be highlighted
 * (byte ranges relative to the start of {@code text}).
 */
public record TextMatch(long start, long duration, String text, TextAssetType assetType,
		List<ByteSpan> highlights) {
}
