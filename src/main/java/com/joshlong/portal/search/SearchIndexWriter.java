package com.joshlong.portal.search;

import com.joshlong.portal.search.SearchIndexClient.Completion;
import com.joshlong.portal.search.SearchIndexClient.IndexTask;

import java.util.Collection;

/**
 * the permission to write to the search index. Instances are handed out by
 * {@link WriteCoordinator#withWriteLock(SearchIndexWriteCallback)} while the write lock
 * is held. This is semantic typing: nothing stops anybody from calling the
 * {@link SearchIndexClient} directly, but doing it through this type makes the intent
 * explicit.
 */
public final class SearchIndexWriter {

	private final SearchIndexClient client;

	SearchIndexWriter(SearchIndexClient client) {
		this.client = client;
	}

	/**
	 * creates a writer without acquiring the write lock first. Only use this if
	 * concurrent writes to the index are irrelevant or not expected for what you're
	 * doing.
	 */
	public static SearchIndexWriter withoutLock(SearchIndexClient client) {
		return new SearchIndexWriter(client);
	}

	public IndexTask upsert(IndexItemKind kind, Collection<? extends IndexItem> items, Completion completion) {
		return this.client.upsert(kind, items, completion);
	}

	public IndexTask delete(IndexItemKind kind, Collection<Long> ids, Completion completion) {
		return this.client.delete(kind, ids, completion);
	}

	public IndexTask writeMeta(IndexMeta meta, Completion completion) {
		return this.client.writeMeta(meta, completion);
	}

	public void prepare() {
		this.client.prepare();
	}

	public void clear() {
		this.client.clear();
	}

}
