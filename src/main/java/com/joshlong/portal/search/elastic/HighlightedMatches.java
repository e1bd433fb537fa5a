package com.joshlong.portal.search.elastic;

import com.joshlong.portal.search.text.ByteSpan;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Elasticsearch reports matches by wrapping them in tags inside the highlighted field
 * value. We ask for the whole field as a single fragment and for tags from the unicode
 * private use area, so we can strip the tags again and work out where the matches are in
 * the original text, in UTF-8 bytes.
 */
abstract class HighlightedMatches {

	static final String PRE_TAG = "\uE000";

	static final String POST_TAG = "\uE001";

	private static final int PRE = PRE_TAG.codePointAt(0);

	private static final int POST = POST_TAG.codePointAt(0);

	static List<ByteSpan> parse(Collection<String> fragments) {
		var spans = new ArrayList<ByteSpan>();
		for (var fragment : fragments)
			spans.addAll(parse(fragment));
		return spans;
	}

	/**
	 * unbalanced tags are dropped: a closing tag without an opening one is ignored, and an
	 * opening tag that is never closed doesn't produce a match.
	 */
	static List<ByteSpan> parse(String highlighted) {
		var spans = new ArrayList<ByteSpan>();
		var offset = 0;
		var start = -1;
		var i = 0;
		while (i < highlighted.length()) {
			var cp = highlighted.codePointAt(i);
			i += Character.charCount(cp);
			if (cp == PRE) {
				start = offset;
			} //
			else if (cp == POST) {
				if (start >= 0 && offset > start)
					spans.add(new ByteSpan(start, offset - start));
				start = -1;
			} //
			else {
				offset += utf8Length(cp);
			}
		}
		return spans;
	}

	private static int utf8Length(int cp) {
		if (cp < 0x80)
			return 1;
		if (cp < 0x800)
			return 2;
		if (cp < 0x10000)
			return 3;
		return 4;
	}

}
