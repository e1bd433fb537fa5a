package com.joshlong.portal.search;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * keeps the search index up to date by draining the queue roughly every
 * {@code updateInterval}. Failures aren't retried here: they propagate and whatever
 * supervises the process restarts it.
 */
public class SearchIndexDaemon {

	private final Logger log = LoggerFactory.getLogger(getClass());

	private final SearchIndexManager manager;

	private final IndexUpdater updater;

	private final Duration updateInterval;

	public SearchIndexDaemon(SearchIndexManager manager, IndexUpdater updater, Duration updateInterval) {
		this.manager = manager;
		this.updater = updater;
		this.updateInterval = updateInterval;
	}

	static Duration nextUpdateIn(Duration updateInterval, Duration elapsed) {
		var remaining = updateInterval.minus(elapsed);
		return remaining.isNegative() ? Duration.ZERO : remaining;
	}

	/**
	 * never returns, unless the thread is interrupted.
	 */
	public void run() throws InterruptedException {
		this.manager.prepareAndRebuildIfNecessary();
		this.log.info("starting to update the search index every {}", this.updateInterval);
		while (!Thread.currentThread().isInterrupted()) {
			var startedAt = System.nanoTime();
			this.updater.updateIndex();
			var nextUpdateIn = nextUpdateIn(this.updateInterval, Duration.ofNanos(System.nanoTime() - startedAt));
			this.log.trace("cleared search index queue, waiting for {}", nextUpdateIn);
			Thread.sleep(nextUpdateIn.toMillis());
		}
	}

}
