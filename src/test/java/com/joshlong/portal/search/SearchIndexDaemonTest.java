package com.joshlong.portal.search;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class SearchIndexDaemonTest {

	@Test
	void nextUpdateIn() {
		var interval = Duration.ofSeconds(5);
		Assertions.assertEquals(Duration.ofSeconds(4), SearchIndexDaemon.nextUpdateIn(interval, Duration.ofSeconds(1)));
		Assertions.assertEquals(Duration.ZERO, SearchIndexDaemon.nextUpdateIn(interval, Duration.ofSeconds(5)));
		Assertions.assertEquals(Duration.ZERO, SearchIndexDaemon.nextUpdateIn(interval, Duration.ofMinutes(2)),
				"an update that took longer than the interval is followed by another one right away");
	}

	@Test
	void updatesTheIndexUntilInterrupted() {
		var manager = mock(SearchIndexManager.class);
		var updater = mock(IndexUpdater.class);
		when(updater.updateIndex()).thenAnswer(invocation -> {
			Thread.currentThread().interrupt();
			return 1;
		});
		var daemon = new SearchIndexDaemon(manager, updater, Duration.ofMinutes(1));
		try {
			Assertions.assertThrows(InterruptedException.class, daemon::run,
					"the wait for the next round is interrupted");
			verify(manager).prepareAndRebuildIfNecessary();
			verify(updater, times(1)).updateIndex();
		} //
		finally {
			Thread.interrupted();
		}
	}

	@Test
	void stopsWhenInterrupted() {
		var manager = mock(SearchIndexManager.class);
		var updater = mock(IndexUpdater.class);
		var daemon = new SearchIndexDaemon(manager, updater, Duration.ofMillis(10));
		Thread.currentThread().interrupt();
		try {
			Assertions.assertDoesNotThrow(daemon::run);
			verify(manager).prepareAndRebuildIfNecessary();
			verifyNoInteractions(updater);
		} //
		finally {
			Thread.interrupted();
		}
	}

}
