package com.joshlong.portal.search;

import org.springframework.transaction.TransactionStatus;

/**
 * work that modifies the search index.
 * <p>
 * Implementations must not send anything to the search index that wasn't already in the
 * database before they were called. They may modify the database, but only data that is
 * not reflected in the search index at all (deleting processed rows from the
 * {@code search_index_queue}, that is). All database writes can still be rolled back,
 * and the search index must never know things the database doesn't.
 */
@FunctionalInterface
public interface SearchIndexWriteCallback<T> {

	T doWithWriteLock(TransactionStatus status, SearchIndexWriter writer);

}
