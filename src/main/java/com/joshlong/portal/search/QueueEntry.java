package com.joshlong.portal.search;

/**
 * a row in the {@code search_index_queue}: the item with {@code itemId} of the given
 * {@code kind} changed and needs to be sent to the search index again.
 */
public record QueueEntry(long id, long itemId, IndexItemKind kind) {
}
