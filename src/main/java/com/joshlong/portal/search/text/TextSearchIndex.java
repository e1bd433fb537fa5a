package com.joshlong.portal.search.text;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collection;
import java.util.List;

/**
 * all the timestamped texts of one event (its captions, say, or the text on its slides)
 * in a form that a search engine can search as a single field, while still letting us
 * find out <em>when</em> in the video a match occurred.
 * <p>
 * {@code texts} holds every distinct text, ordered by timespan and separated by
 * {@link #SEPARATOR}. {@code timespanIndex} maps byte offsets in {@code texts} back to
 * timespans. See {@link TimespanIndex} for the encoding. The two are only ever produced
 * and consumed together.
 */
public record TextSearchIndex(@JsonProperty("texts") String texts,
		@JsonProperty("timespan_index") String timespanIndex) {

	/**
	 * separates the texts of different slots. It's a control character that the engine's
	 * tokenizer treats as whitespace, so no match can span two slots.
	 */
	public static final char SEPARATOR = '\u001F';

	public static final TextSearchIndex EMPTY = new TextSearchIndex("", "");

	public static TextSearchIndex of(Collection<TimespanText> fragments) {
		var builder = new TextSearchIndexBuilder();
		if (fragments != null)
			for (var fragment : fragments)
				builder.add(fragment);
		return builder.build();
	}

	@JsonIgnore
	public boolean isEmpty() {
		return this.texts == null || this.texts.isEmpty();
	}

	/**
	 * the slot whose text contains the given byte offset into {@link #texts()}, or
	 * {@code -1} if this index is empty.
	 */
	public int lookup(long byteOffset) {
		if (this.isEmpty())
			return -1;
		return new TimespanIndex(this.timespanIndex).lookup(byteOffset);
	}

	/**
	 * the timespan of the given slot.
	 */
	public SearchTimespan timespan(int slot) {
		return new TimespanIndex(this.timespanIndex).timespan(slot);
	}

	/**
	 * resolves the byte ranges of matches inside {@link #texts()} to highlighted,
	 * timestamped snippets, adding one {@link TextMatch} per slot that has matches.
	 */
	public void resolveMatches(Collection<ByteSpan> matches, List<TextMatch> out, TextAssetType assetType) {
		if (this.isEmpty() || matches == null || matches.isEmpty())
			return;
		new TextMatchResolver(this).resolve(matches, out, assetType);
	}

}
