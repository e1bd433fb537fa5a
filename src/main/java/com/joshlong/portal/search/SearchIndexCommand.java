package com.joshlong.portal.search;

import java.util.Set;

/**
 * the {@code search-index} sub-commands, parsed from the command line, e.g.
 * {@code search-index update --daemon}.
 */
record SearchIndexCommand(Type type, boolean daemon, boolean withoutClear, boolean yes) {

	static final String NAME = "search-index";

	enum Type {

		/** shows information about the search index */
		STATUS,

		/** removes all data from the search index */
		CLEAR,

		/** clears (optionally) and rebuilds the search index from the database */
		REBUILD,

		/** pushes queued updates to the search index, once or forever */
		UPDATE,

		/** removes all entries from the queue */
		CLEAR_QUEUE

	}

	static SearchIndexCommand parse(String subCommand, Set<String> options) {
		var type = switch (subCommand) {
			case "status" -> Type.STATUS;
			case "clear" -> Type.CLEAR;
			case "rebuild" -> Type.REBUILD;
			case "update" -> Type.UPDATE;
			case "clear-queue" -> Type.CLEAR_QUEUE;
			default -> throw new IllegalArgumentException("unknown " + NAME + " command '" + subCommand + "'");
		};
		return new SearchIndexCommand(type, options.contains("daemon"), options.contains("without-clear"),
				options.contains("yes-absolutely-clear-index"));
	}

}
