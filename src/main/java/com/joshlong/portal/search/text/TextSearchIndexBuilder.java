package com.joshlong.portal.search.text;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * collects the timestamped texts of one event and encodes them into a
 * {@link TextSearchIndex}. Texts with the same (quantized) timespan end up in the same
 * slot, joined with a newline.
 */
final class TextSearchIndexBuilder {

	// only the beginning of a slot is checked for duplicates, otherwise slides with lots
	// of repeated text become quadratic
	static final int CONTAINMENT_CHECK_LIMIT = 4096;

	private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

	private final SortedMap<SearchTimespan, StringBuilder> slots = new TreeMap<>();

	TextSearchIndexBuilder add(TimespanText fragment) {
		if (fragment == null || fragment.text() == null)
			return this;

		var text = fragment.text().strip().replace(TextSearchIndex.SEPARATOR, ' ');
		if (!hasSearchableWord(text))
			return this;

		var timespan = SearchTimespan.quantize(fragment.spanStart(), fragment.spanEnd());
		if (timespan == null)
			return this;

		var existing = this.slots.get(timespan);
		if (existing == null) {
			this.slots.put(timespan, new StringBuilder(text));
		} //
		else if (!existing.substring(0, Math.min(CONTAINMENT_CHECK_LIMIT, existing.length())).contains(text)) {
			existing.append('\n').append(text);
		}
		return this;
	}

	TextSearchIndex build() {
		if (this.slots.isEmpty())
			return TextSearchIndex.EMPTY;

		var texts = new StringBuilder();
		var offsets = new ArrayList<Long>(this.slots.size());
		var byteOffset = 0L;
		var maxStart = 0L;
		var maxDuration = 0L;
		for (var entry : this.slots.entrySet()) {
			if (!offsets.isEmpty()) {
				texts.append(TextSearchIndex.SEPARATOR);
				byteOffset += 1;
			}
			offsets.add(byteOffset);
			var text = entry.getValue().toString();
			texts.append(text);
			byteOffset += text.getBytes(StandardCharsets.UTF_8).length;
			maxStart = Math.max(maxStart, entry.getKey().start());
			maxDuration = Math.max(maxDuration, entry.getKey().duration());
		}

		var offsetDigits = TimespanIndexDigits.digitsFor(offsets.get(offsets.size() - 1));
		var startDigits = TimespanIndexDigits.digitsFor(maxStart);
		var durationDigits = TimespanIndexDigits.digitsFor(maxDuration);
		var index = new StringBuilder(TimespanIndex.HEADER_LENGTH
				+ this.slots.size() * (offsetDigits + startDigits + durationDigits));
		TimespanIndex.writeHeader(offsetDigits, startDigits, durationDigits, index);
		var slot = 0;
		for (var timespan : this.slots.keySet()) {
			TimespanIndexDigits.encode(offsets.get(slot++), offsetDigits, index);
			TimespanIndexDigits.encode(timespan.start(), startDigits, index);
			TimespanIndexDigits.encode(timespan.duration(), durationDigits, index);
		}
		return new TextSearchIndex(texts.toString(), index.toString());
	}

	/**
	 * texts made up only of single-byte "words" (stray letters, punctuation) are noise as
	 * far as search is concerned. Words are separated by any Unicode whitespace, including
	 * non-breaking spaces.
	 */
	static boolean hasSearchableWord(String text) {
		for (var word : WHITESPACE.split(text))
			if (word.getBytes(StandardCharsets.UTF_8).length > 1)
				return true;
		return false;
	}

}
