package com.joshlong.portal.search;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

class SearchIndexManagerTest {

	private final FakeTransactionManager transactionManager = new FakeTransactionManager();

	private final InMemorySearchIndexQueue queue = new InMemorySearchIndexQueue();

	private final RecordingSearchIndexClient client = new RecordingSearchIndexClient();

	private final List<MapIndexItemLoader> loaders = MapIndexItemLoader.forAllKinds();

	private ScheduledExecutorService scheduler;

	private SearchIndexManager manager;

	@BeforeEach
	void setUp() {
		this.scheduler = Executors.newSingleThreadScheduledExecutor();
		var writeCoordinator = new WriteCoordinator(this.transactionManager, this.queue, this.client, this.scheduler,
				Duration.ofMinutes(1));
		this.manager = new SearchIndexManager(this.client, writeCoordinator, this.queue, this.loaders);
		for (var loader : this.loaders)
			loader.put(1, loader.kind().pluralName() + " #1").put(2, loader.kind().pluralName() + " #2");
	}

	@AfterEach
	void tearDown() {
		this.scheduler.shutdownNow();
	}

	@Test
	void anIndexWithoutVersionInfoIsTheFirstVersion() {
		this.client.state = IndexState.noVersionInfo();
		Assertions.assertFalse(this.manager.prepareAndRebuildIfNecessary());
		Assertions.assertEquals(1, this.client.prepares);
		Assertions.assertTrue(this.client.metaWrites.isEmpty());
	}

	@Test
	void aBrokenIndexIsRebuilt() {
		this.client.state = IndexState.brokenVersionInfo();
		Assertions.assertTrue(this.manager.prepareAndRebuildIfNecessary());
		for (var kind : IndexItemKind.values())
			Assertions.assertEquals(2, this.client.documentCount(kind), kind.pluralName());
		Assertions.assertEquals(List.of(IndexMeta.current(true), IndexMeta.current(false)), this.client.metaWrites);
		Assertions.assertEquals(IndexState.info(SearchIndexManager.VERSION, false), this.client.readState());
		Assertions.assertFalse(this.manager.prepareAndRebuildIfNecessary(), "once is enough");
	}

	@Test
	void anInterruptedRebuildIsRepeated() {
		this.client.state = IndexState.info(SearchIndexManager.VERSION, true);
		Assertions.assertTrue(this.manager.prepareAndRebuildIfNecessary());
	}

	@Test
	void rebuildingLeavesTheQueueAlone() {
		this.queue.enqueue(IndexItemKind.EVENT, 1, 2);
		this.manager.rebuild();
		Assertions.assertEquals(2, this.queue.size());
	}

	@Test
	void clear() {
		this.manager.rebuild();
		this.manager.clear();
		Assertions.assertEquals(-1, this.client.documentCount(IndexItemKind.EVENT));
		Assertions.assertEquals(IndexState.noVersionInfo(), this.client.readState());
	}

	@Test
	void clearQueue() {
		this.queue.enqueue(IndexItemKind.USER, 1, 2, 3);
		Assertions.assertEquals(3, this.manager.clearQueue());
		Assertions.assertEquals(0, this.queue.size());
	}

	@Test
	void clearQueueWhenTheCommitFails() {
		this.queue.enqueue(IndexItemKind.USER, 1, 2, 3);
		this.transactionManager.failNextCommit = true;
		Assertions.assertEquals(3, this.manager.clearQueue());
		Assertions.assertEquals(3, this.queue.size(), "nothing is removed without a commit");
	}

	@Test
	void status() {
		this.client.prepare();
		this.client.upsert(IndexItemKind.REALM, this.loaders.get(0).loadAll(),
				SearchIndexClient.Completion.FIRE_AND_FORGET);
		this.queue.enqueue(IndexItemKind.REALM, 1);
		var status = this.manager.status();
		Assertions.assertEquals("green", status.server().health());
		Assertions.assertEquals(2L, status.documentCounts().get(IndexItemKind.REALM));
		Assertions.assertEquals(0L, status.documentCounts().get(IndexItemKind.USER));
		Assertions.assertEquals(1, status.queueSize());
		Assertions.assertEquals(IndexState.noVersionInfo(), status.state());
	}

}
