package com.joshlong.portal.search.items;

import com.joshlong.portal.search.IndexItem;
import com.joshlong.portal.search.IndexItemKind;
import com.joshlong.portal.search.IndexItemLoader;
import org.jspecify.annotations.Nullable;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;

import java.util.Collection;
import java.util.List;

/**
 * loads items from one of the {@code search_*} views. Runs inside whatever transaction is
 * active, which during index updates is the one holding the write lock.
 */
abstract class AbstractJdbcIndexItemLoader<T extends IndexItem> implements IndexItemLoader<T> {

	private final JdbcClient db;

	private final IndexItemKind kind;

	private final RowMapper<T> rowMapper;

	private final String loadAllSql;

	private final String loadByIdsSql;

	AbstractJdbcIndexItemLoader(JdbcClient db, IndexItemKind kind, RowMapper<T> rowMapper, String select,
			@Nullable String filter) {
		this.db = db;
		this.kind = kind;
		this.rowMapper = rowMapper;
		this.loadAllSql = filter == null ? select : select + " where " + filter;
		this.loadByIdsSql = select + " where id = any(?)" + (filter == null ? "" : " and " + filter);
	}

	@Override
	public IndexItemKind kind() {
		return this.kind;
	}

	@Override
	public List<T> loadByIds(Collection<Long> ids) {
		if (ids.isEmpty())
			return List.of();
		return this.db //
			.sql(this.loadByIdsSql) //
			.param(ids.toArray(new Long[0])) //
			.query(this.rowMapper) //
			.list();
	}

	@Override
	public List<T> loadAll() {
		return this.db //
			.sql(this.loadAllSql) //
			.query(this.rowMapper) //
			.list();
	}

}
