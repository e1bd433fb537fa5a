package com.joshlong.portal.search;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * the durable queue of changed items, filled by database triggers. All methods are meant
 * to be called inside the transaction opened by {@link WriteCoordinator}.
 */
public interface SearchIndexQueue {

	/**
	 * takes the cross-process lock that grants permission to write to the search index.
	 * Blocks until the lock is available; it's released when the transaction ends.
	 */
	void lock();

	/**
	 * the oldest {@code limit} entries, in insertion order.
	 */
	List<QueueEntry> peek(int limit);

	/**
	 * removes all entries for the given items, including duplicates that have been queued
	 * in the meantime.
	 * @return the number of rows removed
	 */
	int remove(Map<IndexItemKind, ? extends Collection<Long>> itemIdsByKind);

	int clear();

	long size();

}
