package com.joshlong.portal.search;

import java.util.Collection;
import java.util.List;

/**
 * loads the current state of one {@link IndexItemKind kind} of item from the database.
 * Ids that no longer exist are simply missing from the result.
 */
public interface IndexItemLoader<T extends IndexItem> {

	IndexItemKind kind();

	List<T> loadByIds(Collection<Long> ids);

	List<T> loadAll();

}
