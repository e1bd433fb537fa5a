package com.joshlong.portal.search;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.DefaultTransactionDefinition;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * the only sanctioned way to modify the search index. It makes sure that only one
 * process at a time writes to the index, and that the search index never gets ahead of
 * the database.
 */
public class WriteCoordinator {

	private final Logger log = LoggerFactory.getLogger(getClass());

	private final PlatformTransactionManager transactionManager;

	private final SearchIndexQueue queue;

	private final SearchIndexClient client;

	private final ScheduledExecutorService scheduler;

	private final Duration lockNoticeDelay;

	public WriteCoordinator(PlatformTransactionManager transactionManager, SearchIndexQueue queue,
			SearchIndexClient client, ScheduledExecutorService scheduler, Duration lockNoticeDelay) {
		this.transactionManager = transactionManager;
		this.queue = queue;
		this.client = client;
		this.scheduler = scheduler;
		this.lockNoticeDelay = lockNoticeDelay;
	}

	/**
	 * runs {@code callback} in a serializable transaction while holding the write lock.
	 * <p>
	 * If {@code callback} fails, the transaction is rolled back and the exception is
	 * rethrown: anything {@code callback} marked as "sent to the index" is unmarked, so
	 * it'll be sent again next time. If {@code callback} succeeds but the commit fails,
	 * that's logged and otherwise ignored. The index already has the right data, all we
	 * lose is bookkeeping, and sending the same data again later changes nothing.
	 */
	public <T> T withWriteLock(SearchIndexWriteCallback<T> callback) {
		var definition = new DefaultTransactionDefinition();
		definition.setName("search-index-write");
		definition.setIsolationLevel(TransactionDefinition.ISOLATION_SERIALIZABLE);
		var status = this.transactionManager.getTransaction(definition);

		T result;
		try {
			this.lock();
			result = callback.doWithWriteLock(status, new SearchIndexWriter(this.client));
		} //
		catch (RuntimeException | Error ex) {
			this.rollbackOnException(status, ex);
			throw ex;
		}

		this.log.trace("attempting to commit index writing transaction (and release the table lock)...");
		try {
			this.transactionManager.commit(status);
		} //
		catch (TransactionException | DataAccessException ex) {
			this.log.warn("failed to commit transaction for search index update: {}", ex.getMessage());
		}
		return result;
	}

	private void lock() {
		var notice = this.scheduler.schedule(
				() -> this.log.warn("could not acquire write access to the search index immediately, waiting for lock..."),
				this.lockNoticeDelay.toMillis(), TimeUnit.MILLISECONDS);
		this.log.trace("attempting to lock table 'search_index_queue'...");
		try {
			this.queue.lock();
		} //
		finally {
			notice.cancel(false);
		}
		this.log.trace("locked table 'search_index_queue'");
	}

	private void rollbackOnException(TransactionStatus status, Throwable ex) {
		this.log.debug("search index write failed, rolling back transaction", ex);
		try {
			this.transactionManager.rollback(status);
		} //
		catch (TransactionException | DataAccessException rollbackException) {
			this.log.error("search index write exception overridden by rollback exception", ex);
			rollbackException.addSuppressed(ex);
			throw rollbackException;
		}
	}

}
