package com.joshlong.portal.search;

import com.joshlong.portal.search.SearchIndexClient.Completion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * drains the {@code search_index_queue} into the search index, in chunks.
 */
public class IndexUpdater {

	private final Logger log = LoggerFactory.getLogger(getClass());

	private final WriteCoordinator writeCoordinator;

	private final SearchIndexQueue queue;

	private final Map<IndexItemKind, IndexItemLoader<?>> loaders = new EnumMap<>(IndexItemKind.class);

	private final int chunkSize;

	public IndexUpdater(WriteCoordinator writeCoordinator, SearchIndexQueue queue,
			Collection<? extends IndexItemLoader<?>> loaders, int chunkSize) {
		Assert.state(chunkSize > 0, "the chunk size must be positive");
		this.writeCoordinator = writeCoordinator;
		this.queue = queue;
		this.chunkSize = chunkSize;
		for (var loader : loaders)
			this.loaders.put(loader.kind(), loader);
		for (var kind : IndexItemKind.values())
			Assert.state(this.loaders.containsKey(kind), () -> "there's no loader for " + kind.pluralName() + "!");
	}

	/**
	 * processes the queue until it's empty.
	 * @return the number of chunks it took
	 */
	public int updateIndex() {
		var chunks = 0;
		var done = false;
		while (!done) {
			chunks += 1;
			done = this.writeCoordinator.withWriteLock((status, writer) -> this.processChunk(writer));
		}
		return chunks;
	}

	/**
	 * sends one chunk of queued items to the index and removes them from the queue.
	 * @return whether the queue is (most likely) drained
	 */
	boolean processChunk(SearchIndexWriter writer) {
		var entries = this.queue.peek(this.chunkSize);
		if (entries.isEmpty()) {
			this.log.trace("no index update queued, doing nothing");
			return true;
		}
		this.log.trace("loaded {} ids from the search index queue", entries.size());

		var idsByKind = new EnumMap<IndexItemKind, List<Long>>(IndexItemKind.class);
		for (var entry : entries)
			idsByKind.computeIfAbsent(entry.kind(), k -> new ArrayList<>()).add(entry.itemId());

		for (var entry : idsByKind.entrySet())
			this.updateKind(entry.getKey(), entry.getValue(), writer);

		var removed = this.queue.remove(idsByKind);
		this.log.debug("removed {} items from the search index queue", removed);
		if (removed != entries.size())
			this.log.warn("wanted to delete {} items from the search index queue, but deleted {}", entries.size(),
					removed);

		return entries.size() < this.chunkSize;
	}

	/**
	 * loads the items with the given ids and sends them to the index. Ids that aren't in
	 * the database anymore are deleted from the index.
	 */
	public void updateKind(IndexItemKind kind, Collection<Long> ids, SearchIndexWriter writer) {
		if (ids.isEmpty()) {
			this.log.trace("no {} in need of a search index update", kind.pluralName());
			return;
		}

		var items = this.loaders.get(kind).loadByIds(ids);
		this.log.debug("loaded {} {} from the database to be added to the search index", items.size(),
				kind.pluralName());

		var existing = items.stream().map(IndexItem::id).collect(Collectors.toSet());
		var deleted = new ArrayList<Long>();
		for (var id : new LinkedHashSet<>(ids))
			if (!existing.contains(id))
				deleted.add(id);

		if (!deleted.isEmpty()) {
			writer.delete(kind, deleted, Completion.FIRE_AND_FORGET);
			this.log.debug("started deletion of {} {} in the search index", deleted.size(), kind.pluralName());
		}

		if (!items.isEmpty()) {
			writer.upsert(kind, items, Completion.FIRE_AND_FORGET);
			this.log.debug("sent {} {} to the search index", items.size(), kind.pluralName());
		}
	}

}
