package com.joshlong.portal.search;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Set;

class SearchIndexCommandTest {

	@Test
	void parse() {
		Assertions.assertEquals(new SearchIndexCommand(SearchIndexCommand.Type.STATUS, false, false, false),
				SearchIndexCommand.parse("status", Set.of()));
		Assertions.assertEquals(new SearchIndexCommand(SearchIndexCommand.Type.UPDATE, true, false, false),
				SearchIndexCommand.parse("update", Set.of("daemon")));
		Assertions.assertEquals(new SearchIndexCommand(SearchIndexCommand.Type.REBUILD, false, true, false),
				SearchIndexCommand.parse("rebuild", Set.of("without-clear")));
		Assertions.assertEquals(new SearchIndexCommand(SearchIndexCommand.Type.CLEAR, false, false, true),
				SearchIndexCommand.parse("clear", Set.of("yes-absolutely-clear-index")));
		Assertions.assertEquals(SearchIndexCommand.Type.CLEAR_QUEUE,
				SearchIndexCommand.parse("clear-queue", Set.of()).type());
	}

	@Test
	void unknownCommands() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> SearchIndexCommand.parse("reindex", Set.of()));
	}

}
