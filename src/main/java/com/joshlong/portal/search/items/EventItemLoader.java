package com.joshlong.portal.search.items;

import com.fasterxml.jackson.core.type.TypeReference;
import com.joshlong.portal.search.IndexItemKind;
import com.joshlong.portal.search.text.TextSearchIndex;
import com.joshlong.portal.search.text.TimespanText;
import com.joshlong.portal.utils.DateUtils;
import com.joshlong.portal.utils.JdbcUtils;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Component;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;

@Component
class EventItemLoader extends AbstractJdbcIndexItemLoader<EventItem> {

	// composite arrays come back as json, which is a lot easier to read than pgobjects
	static final String SELECT = """
			select id, series, series_title, title, description, creators, thumbnail, duration,
				is_live, audio_only, has_password, created, updated, start_time, end_time,
				read_roles, write_roles, preview_roles,
				to_jsonb(host_realms)::text as host_realms,
				to_jsonb(slide_texts)::text as slide_texts,
				to_jsonb(caption_texts)::text as caption_texts
			from search_events
			""";

	EventItemLoader(JdbcClient db) {
		super(db, IndexItemKind.EVENT, new EventRowMapper(), SELECT, "state <> 'waiting'");
	}

}

class EventRowMapper implements RowMapper<EventItem> {

	private static final TypeReference<List<RealmItem>> REALMS = new TypeReference<>() {
	};

	private static final TypeReference<List<TimespanText>> TEXTS = new TypeReference<>() {
	};

	@Override
	public EventItem mapRow(ResultSet rs, int rowNum) throws SQLException {
		var hostRealms = JdbcUtils.json(rs, "host_realms", REALMS);
		var created = Objects.requireNonNull(JdbcUtils.offsetDateTime(rs, "created"), "created");
		var updated = Objects.requireNonNull(JdbcUtils.offsetDateTime(rs, "updated"), "updated");
		var startTime = JdbcUtils.offsetDateTime(rs, "start_time");
		var endTime = JdbcUtils.offsetDateTime(rs, "end_time");
		return new EventItem(rs.getLong("id"), //
				JdbcUtils.nullableLong(rs, "series"), //
				rs.getString("series_title"), //
				rs.getString("title"), //
				rs.getString("description"), //
				JdbcUtils.strings(rs, "creators"), //
				rs.getString("thumbnail"), //
				rs.getLong("duration"), //
				created, //
				created.toEpochSecond(), //
				updated, //
				updated.toEpochSecond(), //
				startTime, //
				DateUtils.epochSeconds(startTime), //
				endTime, //
				DateUtils.epochSeconds(endTime), //
				rs.getBoolean("is_live"), //
				rs.getBoolean("audio_only"), //
				rs.getBoolean("has_password"), //
				Acls.encode(JdbcUtils.strings(rs, "read_roles")), //
				Acls.encode(JdbcUtils.strings(rs, "write_roles")), //
				Acls.encode(JdbcUtils.strings(rs, "preview_roles")), //
				RealmItem.listed(hostRealms), //
				hostRealms, //
				TextSearchIndex.of(JdbcUtils.json(rs, "slide_texts", TEXTS)), //
				TextSearchIndex.of(JdbcUtils.json(rs, "caption_texts", TEXTS)));
	}

}
