package com.joshlong.portal.search;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.stream.LongStream;

class IndexUpdaterTest {

	private final FakeTransactionManager transactionManager = new FakeTransactionManager();

	private final InMemorySearchIndexQueue queue = new InMemorySearchIndexQueue();

	private final RecordingSearchIndexClient client = new RecordingSearchIndexClient();

	private final Map<IndexItemKind, MapIndexItemLoader> loaders = new EnumMap<>(IndexItemKind.class);

	private ScheduledExecutorService scheduler;

	private WriteCoordinator writeCoordinator;

	@BeforeEach
	void setUp() {
		this.scheduler = Executors.newSingleThreadScheduledExecutor();
		this.writeCoordinator = new WriteCoordinator(this.transactionManager, this.queue, this.client, this.scheduler,
				Duration.ofMinutes(1));
		for (var loader : MapIndexItemLoader.forAllKinds())
			this.loaders.put(loader.kind(), loader);
	}

	@AfterEach
	void tearDown() {
		this.scheduler.shutdownNow();
	}

	private IndexUpdater updater(int chunkSize) {
		return new IndexUpdater(this.writeCoordinator, this.queue, this.loaders.values(), chunkSize);
	}

	@Test
	void drainsTheQueueInChunks() {
		var users = this.loaders.get(IndexItemKind.USER);
		LongStream.rangeClosed(1, 12000).forEach(id -> users.put(id, "user #" + id));
		this.queue.enqueue(IndexItemKind.USER, LongStream.rangeClosed(1, 12000).toArray());

		var chunks = this.updater(5000).updateIndex();

		Assertions.assertEquals(3, chunks);
		Assertions.assertEquals(0, this.queue.size());
		Assertions.assertEquals(12000, this.client.documentCount(IndexItemKind.USER));
		Assertions.assertEquals(3, this.transactionManager.commits);
		Assertions.assertEquals(3, this.queue.locks, "every chunk is written while holding the lock");
	}

	@Test
	void anEmptyQueueTakesOneCycle() {
		Assertions.assertEquals(1, this.updater(10).updateIndex());
		Assertions.assertTrue(this.client.writes.isEmpty());
		Assertions.assertEquals(1, this.transactionManager.commits);
	}

	@Test
	void itemsMissingFromTheDatabaseAreDeleted() {
		this.loaders.get(IndexItemKind.REALM).put(1, "lectures").put(3, "conferences");
		this.client.upsert(IndexItemKind.REALM, List.of(new MapIndexItemLoader.Row(2, IndexItemKind.REALM, "old")),
				SearchIndexClient.Completion.WAIT_FOR_COMPLETION);
		this.client.writes.clear();
		this.queue.enqueue(IndexItemKind.REALM, 1, 2, 3);

		this.updater(100).updateIndex();

		Assertions.assertEquals(List.of("delete realms [2]", "upsert realms 2"), this.client.writes);
		Assertions.assertEquals(2, this.client.documentCount(IndexItemKind.REALM));
		Assertions.assertFalse(this.client.documents.get(IndexItemKind.REALM).containsKey(2L));
		Assertions.assertEquals(0, this.queue.size());
	}

	@Test
	void duplicateQueueEntriesAreSentOnceAndRemovedTogether() {
		this.loaders.get(IndexItemKind.EVENT).put(5, "a talk");
		this.queue.enqueue(IndexItemKind.EVENT, 5, 5);

		this.updater(100).updateIndex();

		Assertions.assertEquals(List.of("upsert events 1"), this.client.writes);
		Assertions.assertEquals(0, this.queue.size());
	}

	@Test
	void failedWritesLeaveTheQueueUntouched() {
		this.loaders.get(IndexItemKind.SERIES).put(1, "a series").put(2, "another series");
		this.queue.enqueue(IndexItemKind.SERIES, 1, 2);
		this.client.failUpserts = true;

		var updater = this.updater(100);
		Assertions.assertThrows(SearchIndexException.class, updater::updateIndex);
		Assertions.assertEquals(2, this.queue.size(), "nothing may be dequeued that wasn't sent");
		Assertions.assertEquals(1, this.transactionManager.rollbacks);
		Assertions.assertEquals(0, this.transactionManager.commits);

		this.client.failUpserts = false;
		updater.updateIndex();
		Assertions.assertEquals(0, this.queue.size());
		Assertions.assertEquals(2, this.client.documentCount(IndexItemKind.SERIES));
	}

	@Test
	void failedCommitsMeanTheItemsAreSentAgain() {
		this.loaders.get(IndexItemKind.PLAYLIST).put(7, "favorites");
		this.queue.enqueue(IndexItemKind.PLAYLIST, 7);
		this.transactionManager.failNextCommit = true;

		var updater = this.updater(100);
		Assertions.assertEquals(1, updater.updateIndex(), "a failed commit is not an error");
		Assertions.assertEquals(1, this.queue.size());
		Assertions.assertEquals(1, this.client.documentCount(IndexItemKind.PLAYLIST));

		updater.updateIndex();
		Assertions.assertEquals(0, this.queue.size());
		Assertions.assertEquals(List.of("upsert playlists 1", "upsert playlists 1"), this.client.writes);
		Assertions.assertEquals(1, this.client.documentCount(IndexItemKind.PLAYLIST));
	}

	@Test
	void processingTheSameEntriesTwiceGivesTheSameIndex() {
		this.loaders.get(IndexItemKind.USER).put(1, "alice").put(2, "bob");
		this.loaders.get(IndexItemKind.REALM).put(10, "lectures");
		this.queue.enqueue(IndexItemKind.USER, 1, 2, 3);
		this.queue.enqueue(IndexItemKind.REALM, 10);
		var updater = this.updater(100);

		updater.updateIndex();
		var afterFirst = Map.copyOf(this.client.documents);
		var usersAfterFirst = Map.copyOf(this.client.documents.get(IndexItemKind.USER));

		this.queue.enqueue(IndexItemKind.USER, 1, 2, 3);
		this.queue.enqueue(IndexItemKind.REALM, 10);
		updater.updateIndex();

		Assertions.assertEquals(afterFirst.keySet(), this.client.documents.keySet());
		Assertions.assertEquals(usersAfterFirst, this.client.documents.get(IndexItemKind.USER));
		Assertions.assertEquals(1, this.client.documentCount(IndexItemKind.REALM));
	}

	@Test
	void everyKindNeedsALoader() {
		var realmsOnly = List.of(new MapIndexItemLoader(IndexItemKind.REALM));
		Assertions.assertThrows(IllegalStateException.class,
				() -> new IndexUpdater(this.writeCoordinator, this.queue, realmsOnly, 10));
	}

}
