package com.joshlong.portal.search.text;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeMap;

/**
 * turns the byte ranges a search engine reports for matches inside
 * {@link TextSearchIndex#texts()} into {@link TextMatch snippets} carrying the timespan
 * of the slot they were found in.
 */
final class TextMatchResolver {

	static final int MAX_MATCHES_PER_SLOT = 10;

	// bytes of context on either side of the matches
	static final int CONTEXT_MARGIN = 80;

	private final TimespanIndex timespans;

	private final byte[] texts;

	TextMatchResolver(TextSearchIndex index) {
		this.timespans = new TimespanIndex(index.timespanIndex());
		this.texts = index.texts().getBytes(StandardCharsets.UTF_8);
	}

	void resolve(Collection<ByteSpan> matches, List<TextMatch> out, TextAssetType assetType) {
		var matchesBySlot = new TreeMap<Integer, List<ByteSpan>>();
		for (var match : matches) {
			if (match.len() <= 1 || match.start() < 0 || match.start() >= this.texts.length)
				continue;
			var slot = this.timespans.lookup(match.start());
			var slotMatches = matchesBySlot.computeIfAbsent(slot, s -> new ArrayList<>());
			if (slotMatches.size() < MAX_MATCHES_PER_SLOT)
				slotMatches.add(match);
		}
		for (var entry : matchesBySlot.entrySet())
			out.add(this.snippet(entry.getKey(), entry.getValue(), assetType));
	}

	private TextMatch snippet(int slot, List<ByteSpan> matches, TextAssetType assetType) {
		var rangeStart = Integer.MAX_VALUE;
		var rangeEnd = 0;
		for (var match : matches) {
			rangeStart = Math.min(rangeStart, this.ceilCharBoundary(match.start()));
			rangeEnd = Math.max(rangeEnd, this.ceilCharBoundary(Math.min(match.end(), this.texts.length)));
		}

		var lowerLimit = Math.max(0, rangeStart - CONTEXT_MARGIN);
		var snippetStart = rangeStart;
		while (snippetStart > lowerLimit && !isBreak(this.texts[snippetStart - 1]))
			snippetStart -= 1;
		snippetStart = this.ceilCharBoundary(snippetStart);

		var upperLimit = Math.min(this.texts.length, rangeEnd + CONTEXT_MARGIN);
		var snippetEnd = rangeEnd;
		while (snippetEnd < upperLimit && !isBreak(this.texts[snippetEnd]))
			snippetEnd += 1;
		snippetEnd = this.ceilCharBoundary(snippetEnd);

		var highlights = new ArrayList<ByteSpan>(matches.size());
		for (var match : matches) {
			var start = this.ceilCharBoundary(match.start());
			var end = Math.min(this.ceilCharBoundary(Math.min(match.end(), this.texts.length)), snippetEnd);
			if (end > start)
				highlights.add(new ByteSpan(start - snippetStart, end - start));
		}

		var text = new String(this.texts, snippetStart, snippetEnd - snippetStart, StandardCharsets.UTF_8);
		var timespan = this.timespans.timespan(slot);
		return new TextMatch(timespan.startMillis(), timespan.durationMillis(), text, assetType,
				List.copyOf(highlights));
	}

	/**
	 * the search engine might report ranges that cut a multi-byte character in half, so
	 * we move forward to the next character boundary.
	 */
	private int ceilCharBoundary(int index) {
		var i = index;
		while (i < this.texts.length && (this.texts[i] & 0xC0) == 0x80)
			i += 1;
		return i;
	}

	private static boolean isBreak(byte b) {
		return b == '\n' || b == TextSearchIndex.SEPARATOR;
	}

}
