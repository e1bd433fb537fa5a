package com.joshlong.portal.search;

import java.util.Map;

/**
 * @param documentCounts the number of documents per index, {@code -1} for indexes that
 * don't exist
 */
public record SearchIndexStatus(SearchIndexClient.ServerInfo server, IndexState state,
		Map<IndexItemKind, Long> documentCounts, long queueSize) {
}
