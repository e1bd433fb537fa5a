package com.joshlong.portal.search.items;

import com.fasterxml.jackson.core.type.TypeReference;
import com.joshlong.portal.search.IndexItemKind;
import com.joshlong.portal.utils.DateUtils;
import com.joshlong.portal.utils.JdbcUtils;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Component;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;

/**
 * series that are still waiting for their metadata from Opencast don't go into the index.
 */
@Component
class SeriesItemLoader extends AbstractJdbcIndexItemLoader<SeriesItem> {

	static final String SELECT = """
			select id, opencast_id, title, description, read_roles, write_roles, created, updated,
				to_jsonb(host_realms)::text as host_realms,
				to_jsonb(thumbnails)::text as thumbnails
			from search_series
			""";

	SeriesItemLoader(JdbcClient db) {
		super(db, IndexItemKind.SERIES, new SeriesRowMapper(), SELECT, "state <> 'waiting'");
	}

}

class SeriesRowMapper implements RowMapper<SeriesItem> {

	private static final TypeReference<List<RealmItem>> REALMS = new TypeReference<>() {
	};

	private static final TypeReference<List<ThumbnailInfo>> THUMBNAILS = new TypeReference<>() {
	};

	@Override
	public SeriesItem mapRow(ResultSet rs, int rowNum) throws SQLException {
		var hostRealms = JdbcUtils.json(rs, "host_realms", REALMS);
		var updated = Objects.requireNonNull(JdbcUtils.offsetDateTime(rs, "updated"), "updated");
		var created = JdbcUtils.offsetDateTime(rs, "created");
		return new SeriesItem(rs.getLong("id"), rs.getString("opencast_id"), rs.getString("title"),
				rs.getString("description"), updated, updated.toEpochSecond(), created,
				DateUtils.epochSeconds(created), Acls.encode(JdbcUtils.strings(rs, "read_roles")),
				Acls.encode(JdbcUtils.strings(rs, "write_roles")), RealmItem.listed(hostRealms), hostRealms,
				JdbcUtils.json(rs, "thumbnails", THUMBNAILS));
	}

}
