package com.joshlong.portal.search.items;

import com.fasterxml.jackson.core.type.TypeReference;
import com.joshlong.portal.search.IndexItemKind;
import com.joshlong.portal.utils.JdbcUtils;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Component;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;

@Component
class PlaylistItemLoader extends AbstractJdbcIndexItemLoader<PlaylistItem> {

	static final String SELECT = """
			select id, opencast_id, title, description, creator, read_roles, write_roles, updated,
				to_jsonb(host_realms)::text as host_realms
			from search_playlists
			""";

	PlaylistItemLoader(JdbcClient db) {
		super(db, IndexItemKind.PLAYLIST, new PlaylistRowMapper(), SELECT, null);
	}

}

class PlaylistRowMapper implements RowMapper<PlaylistItem> {

	private static final TypeReference<List<RealmItem>> REALMS = new TypeReference<>() {
	};

	@Override
	public PlaylistItem mapRow(ResultSet rs, int rowNum) throws SQLException {
		var hostRealms = JdbcUtils.json(rs, "host_realms", REALMS);
		var updated = Objects.requireNonNull(JdbcUtils.offsetDateTime(rs, "updated"), "updated");
		return new PlaylistItem(rs.getLong("id"), rs.getString("opencast_id"), rs.getString("title"),
				rs.getString("description"), rs.getString("creator"), updated, updated.toEpochSecond(),
				Acls.encode(JdbcUtils.strings(rs, "read_roles")), Acls.encode(JdbcUtils.strings(rs, "write_roles")),
				RealmItem.listed(hostRealms), hostRealms);
	}

}
