package com.joshlong.portal.search;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.transaction.TransactionDefinition;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class WriteCoordinatorTest {

	private final FakeTransactionManager transactionManager = new FakeTransactionManager();

	private final InMemorySearchIndexQueue queue = new InMemorySearchIndexQueue();

	private final RecordingSearchIndexClient client = new RecordingSearchIndexClient();

	private final ScheduledExecutorService scheduler = mock(ScheduledExecutorService.class);

	private final ScheduledFuture<?> notice = mock(ScheduledFuture.class);

	private WriteCoordinator writeCoordinator() {
		Mockito
			.<ScheduledFuture<?>>when(this.scheduler.schedule(any(Runnable.class), anyLong(), eq(TimeUnit.MILLISECONDS)))
			.thenReturn(this.notice);
		return new WriteCoordinator(this.transactionManager, this.queue, this.client, this.scheduler,
				Duration.ofSeconds(3));
	}

	@Test
	void runsTheCallbackWhileHoldingTheLock() {
		var result = this.writeCoordinator().withWriteLock((status, writer) -> {
			Assertions.assertEquals(1, this.queue.locks);
			Assertions.assertTrue(status.isNewTransaction());
			return "done";
		});
		Assertions.assertEquals("done", result);
		Assertions.assertEquals(1, this.transactionManager.commits);
		Assertions.assertEquals(TransactionDefinition.ISOLATION_SERIALIZABLE,
				this.transactionManager.begun.get(0).getIsolationLevel());
		verify(this.scheduler).schedule(any(Runnable.class), eq(3000L), eq(TimeUnit.MILLISECONDS));
		verify(this.notice).cancel(false);
	}

	@Test
	void rollsBackAndRethrowsWhenTheCallbackFails() {
		var coordinator = this.writeCoordinator();
		var thrown = Assertions.assertThrows(SearchIndexException.class,
				() -> coordinator.withWriteLock((status, writer) -> {
					throw new SearchIndexException("bulk request failed");
				}));
		Assertions.assertEquals("bulk request failed", thrown.getMessage());
		Assertions.assertEquals(1, this.transactionManager.rollbacks);
		Assertions.assertEquals(0, this.transactionManager.commits);
	}

	@Test
	void commitFailuresAreNotPropagated() {
		this.transactionManager.failNextCommit = true;
		var result = this.writeCoordinator().withWriteLock((status, writer) -> 42);
		Assertions.assertEquals(42, result);
		Assertions.assertEquals(0, this.transactionManager.commits);
	}

	@Test
	void theNoticeIsCancelledEvenIfLockingFails() {
		var failingQueue = mock(SearchIndexQueue.class);
		Mockito.doThrow(new IllegalStateException("connection reset")).when(failingQueue).lock();
		Mockito.<ScheduledFuture<?>>when(this.scheduler.schedule(any(Runnable.class), anyLong(), any(TimeUnit.class)))
			.thenReturn(this.notice);
		var coordinator = new WriteCoordinator(this.transactionManager, failingQueue, this.client, this.scheduler,
				Duration.ofSeconds(3));
		Assertions.assertThrows(IllegalStateException.class,
				() -> coordinator.withWriteLock((status, writer) -> Assertions.fail("never called")));
		verify(this.notice).cancel(false);
		Assertions.assertEquals(1, this.transactionManager.rollbacks);
	}

	@Test
	void theWriterTalksToTheClient() {
		this.writeCoordinator().withWriteLock((status, writer) -> {
			writer.writeMeta(IndexMeta.current(false), SearchIndexClient.Completion.WAIT_FOR_COMPLETION);
			return null;
		});
		Assertions.assertEquals(IndexState.info(SearchIndexManager.VERSION, false), this.client.readState());
	}

}
