package com.joshlong.portal.search;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.HashSet;

/**
 * runs the {@code search-index} command given on the command line. Without one, the
 * application runs the update daemon.
 */
class SearchIndexCommandRunner implements ApplicationRunner {

	private final Logger log = LoggerFactory.getLogger(getClass());

	private final SearchIndexManager manager;

	private final IndexUpdater updater;

	private final SearchIndexDaemon daemon;

	private final BufferedReader in;

	private final PrintStream out;

	SearchIndexCommandRunner(SearchIndexManager manager, IndexUpdater updater, SearchIndexDaemon daemon,
			BufferedReader in, PrintStream out) {
		this.manager = manager;
		this.updater = updater;
		this.daemon = daemon;
		this.in = in;
		this.out = out;
	}

	@Override
	public void run(ApplicationArguments args) throws Exception {
		var nonOptionArgs = args.getNonOptionArgs();
		if (nonOptionArgs.isEmpty()) {
			this.daemon.run();
			return;
		}
		if (!SearchIndexCommand.NAME.equals(nonOptionArgs.get(0)) || nonOptionArgs.size() != 2)
			throw new IllegalArgumentException(
					"usage: " + SearchIndexCommand.NAME + " <status|clear|rebuild|update|clear-queue> [options]");
		var command = SearchIndexCommand.parse(nonOptionArgs.get(1), new HashSet<>(args.getOptionNames()));
		this.run(command);
	}

	void run(SearchIndexCommand command) throws InterruptedException {
		this.log.debug("running {}", command);
		switch (command.type()) {
			case STATUS -> this.status();
			case CLEAR -> this.clear(command.yes());
			case REBUILD -> {
				if (!command.withoutClear() && !this.clear(command.yes()))
					return;
				this.manager.rebuild();
			}
			case UPDATE -> {
				if (command.daemon()) {
					this.daemon.run();
				} //
				else {
					this.manager.prepare();
					var chunks = this.updater.updateIndex();
					this.log.info("done updating the search index after {} chunk(s), no more items queued", chunks);
				}
			}
			case CLEAR_QUEUE -> this.manager.clearQueue();
		}
	}

	private boolean clear(boolean yes) {
		if (!yes) {
			this.out.println("Are you sure you want to clear the search index? The search will be disabled "
					+ "until you rebuild the index! Type 'yes' to proceed to delete the data.");
			if (!this.confirmed()) {
				this.out.println("Answer was not 'yes'. Aborting.");
				return false;
			}
		}
		this.manager.clear();
		return true;
	}

	private boolean confirmed() {
		try {
			var line = this.in.readLine();
			return line != null && line.trim().equals("yes");
		} //
		catch (IOException e) {
			throw new UncheckedIOException("could not read confirmation", e);
		}
	}

	private void status() {
		var status = this.manager.status();
		this.out.println();
		this.out.println("# Server info:");
		this.out.println("Version: " + status.server().version());
		this.out.println("Health: " + status.server().health());
		this.out.println("Index state: " + status.state());
		this.out.println("Queued items: " + status.queueSize());
		this.out.println();
		for (var entry : status.documentCounts().entrySet()) {
			this.out.println("# Index `" + entry.getKey().pluralName() + "`:");
			var count = entry.getValue();
			this.out.println(count < 0 ? "Does not exist!" : "Number of documents: " + count);
			this.out.println();
		}
	}

}
