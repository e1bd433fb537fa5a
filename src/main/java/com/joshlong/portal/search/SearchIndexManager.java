package com.joshlong.portal.search;

import com.joshlong.portal.search.SearchIndexClient.Completion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * the operations on the search index as a whole: preparing, rebuilding, clearing and
 * inspecting it.
 */
public class SearchIndexManager {

	/**
	 * bump this whenever the index changes in a way that requires a rebuild.
	 */
	public static final int VERSION = 1;

	private final Logger log = LoggerFactory.getLogger(getClass());

	private final SearchIndexClient client;

	private final WriteCoordinator writeCoordinator;

	private final SearchIndexQueue queue;

	private final Map<IndexItemKind, IndexItemLoader<?>> loaders = new EnumMap<>(IndexItemKind.class);

	public SearchIndexManager(SearchIndexClient client, WriteCoordinator writeCoordinator, SearchIndexQueue queue,
			Collection<? extends IndexItemLoader<?>> loaders) {
		this.client = client;
		this.writeCoordinator = writeCoordinator;
		this.queue = queue;
		for (var loader : loaders)
			this.loaders.put(loader.kind(), loader);
	}

	public void prepare() {
		SearchIndexWriter.withoutLock(this.client).prepare();
		this.log.debug("prepared all search indexes");
	}

	/**
	 * prepares the indexes and rebuilds them if the meta index says they're outdated.
	 * @return whether a rebuild was necessary
	 */
	public boolean prepareAndRebuildIfNecessary() {
		this.prepare();
		var state = this.client.readState();
		if (!state.needsRebuild(VERSION)) {
			this.log.debug("search index is up to date ({})", state);
			return false;
		}
		this.log.info("search index needs to be rebuilt ({}, current version is {})", state, VERSION);
		this.rebuild();
		return true;
	}

	/**
	 * loads everything from the database and sends it to the index. This doesn't remove
	 * documents that don't exist in the database anymore, so {@link #clear()} first if you
	 * want a clean index. It doesn't touch the queue either.
	 */
	public void rebuild() {
		this.prepare();
		this.writeCoordinator.withWriteLock((status, writer) -> {
			writer.writeMeta(IndexMeta.current(true), Completion.WAIT_FOR_COMPLETION);
			for (var entry : this.loaders.entrySet()) {
				var kind = entry.getKey();
				var items = entry.getValue().loadAll();
				this.log.debug("loaded {} {} from the database", items.size(), kind.pluralName());
				writer.upsert(kind, items, Completion.WAIT_FOR_COMPLETION);
				this.log.info("sent {} {} to the search index", items.size(), kind.pluralName());
			}
			writer.writeMeta(IndexMeta.current(false), Completion.WAIT_FOR_COMPLETION);
			return null;
		});
		this.log.info("finished rebuilding the search index");
	}

	/**
	 * removes everything from the search index. Search is broken until the next
	 * {@link #rebuild()}.
	 */
	public void clear() {
		this.writeCoordinator.withWriteLock((status, writer) -> {
			writer.clear();
			return null;
		});
		this.log.info("cleared the search index");
	}

	/**
	 * removes all entries from the {@code search_index_queue}.
	 * @return the number of entries that were deleted in the write-locked transaction. If
	 * committing that transaction fails, which {@link WriteCoordinator} only logs, none of
	 * them are actually gone.
	 */
	public int clearQueue() {
		var requested = this.writeCoordinator.withWriteLock((status, writer) -> this.queue.clear());
		this.log.info("requested removal of {} entries from the search index queue", requested);
		return requested;
	}

	public SearchIndexStatus status() {
		var documentCounts = new EnumMap<IndexItemKind, Long>(IndexItemKind.class);
		for (var kind : IndexItemKind.values())
			documentCounts.put(kind, this.client.documentCount(kind));
		return new SearchIndexStatus(this.client.serverInfo(), this.client.readState(), documentCounts,
				this.queue.size());
	}

}
