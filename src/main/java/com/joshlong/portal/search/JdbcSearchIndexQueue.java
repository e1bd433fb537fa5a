package com.joshlong.portal.search;

import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Component;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link SearchIndexQueue} backed by the {@code search_index_queue} table in PostgreSQL.
 */
@Component
class JdbcSearchIndexQueue implements SearchIndexQueue {

	private final JdbcClient db;

	private final QueueEntryRowMapper queueEntryRowMapper = new QueueEntryRowMapper();

	JdbcSearchIndexQueue(JdbcClient db) {
		this.db = db;
	}

	/*
	 * the table lock is a cross-process mutex for writing to the search index, nothing
	 * inside PostgreSQL needs it. 'share update exclusive' conflicts with itself, so only
	 * one process can hold it, but it does not conflict with 'row exclusive', so the
	 * triggers can keep inserting rows while we hold it.
	 */
	@Override
	public void lock() {
		this.db //
			.sql("lock table search_index_queue in share update exclusive mode") //
			.update();
	}

	@Override
	public List<QueueEntry> peek(int limit) {
		return this.db //
			.sql("select id, item_id, kind from search_index_queue order by id limit ?") //
			.params(limit) //
			.query(this.queueEntryRowMapper) //
			.list();
	}

	@Override
	public int remove(Map<IndexItemKind, ? extends Collection<Long>> itemIdsByKind) {
		var clauses = new ArrayList<String>();
		var params = new ArrayList<Object>();
		for (var entry : itemIdsByKind.entrySet()) {
			if (entry.getValue().isEmpty())
				continue;
			clauses.add("(item_id = any(?) and kind = ?::search_index_item_kind)");
			params.add(entry.getValue().toArray(new Long[0]));
			params.add(entry.getKey().dbName());
		}
		if (clauses.isEmpty())
			return 0;
		return this.db //
			.sql("delete from search_index_queue where " + String.join(" or ", clauses)) //
			.params(params) //
			.update();
	}

	@Override
	public int clear() {
		return this.db.sql("delete from search_index_queue").update();
	}

	@Override
	public long size() {
		var count = this.db //
			.sql("select count(*) from search_index_queue") //
			.query(Long.class) //
			.single();
		return Objects.requireNonNull(count);
	}

}

class QueueEntryRowMapper implements RowMapper<QueueEntry> {

	@Override
	public QueueEntry mapRow(ResultSet rs, int rowNum) throws SQLException {
		return new QueueEntry(rs.getLong("id"), rs.getLong("item_id"), IndexItemKind.fromDbName(rs.getString("kind")));
	}

}
