package com.joshlong.portal.search;

import com.joshlong.portal.search.items.EventItem;
import com.joshlong.portal.search.text.ByteSpan;

import java.util.Collection;
import java.util.List;

/**
 * everything we need from the external search engine. Each {@link IndexItemKind kind}
 * maps to its own index; there's an additional index holding the {@link IndexMeta}.
 * <p>
 * The write methods should only ever be called through a {@link SearchIndexWriter}.
 */
public interface SearchIndexClient {

	/**
	 * whether a write should return as soon as the engine has accepted it, or only once
	 * its effects are visible to searches.
	 */
	enum Completion {

		FIRE_AND_FORGET,

		WAIT_FOR_COMPLETION

	}

	/**
	 * the handle for a write the engine has accepted.
	 */
	record IndexTask(String index, int documents, Completion completion) {
	}

	record ServerInfo(String version, String health) {
	}

	/**
	 * an event matching a query, plus the byte ranges of the matches inside its caption
	 * and slide {@link com.joshlong.portal.search.text.TextSearchIndex#texts() texts}.
	 */
	record EventHit(EventItem event, List<ByteSpan> captionMatches, List<ByteSpan> slideMatches) {
	}

	/**
	 * creates the indexes if they don't exist yet and makes sure their mappings are up to
	 * date. Safe to call repeatedly.
	 */
	void prepare();

	IndexTask upsert(IndexItemKind kind, Collection<? extends IndexItem> items, Completion completion);

	IndexTask delete(IndexItemKind kind, Collection<Long> ids, Completion completion);

	/**
	 * deletes all indexes, including the meta index.
	 */
	void clear();

	/**
	 * the number of documents in the index for {@code kind}, or {@code -1} if the index
	 * doesn't exist.
	 */
	long documentCount(IndexItemKind kind);

	ServerInfo serverInfo();

	IndexState readState();

	IndexTask writeMeta(IndexMeta meta, Completion completion);

	List<EventHit> searchEvents(String query, int limit);

}
