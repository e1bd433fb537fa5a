package com.joshlong.portal.search.items;

import com.joshlong.portal.search.IndexItemKind;
import com.joshlong.portal.utils.JdbcUtils;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Component;

@Component
class RealmItemLoader extends AbstractJdbcIndexItemLoader<RealmItem> {

	RealmItemLoader(JdbcClient db) {
		super(db, IndexItemKind.REALM,
				(rs, rowNum) -> new RealmItem(rs.getLong("id"), rs.getString("name"), rs.getString("full_path"),
						JdbcUtils.strings(rs, "ancestor_names")),
				"select id, name, full_path, ancestor_names from search_realms", null);
	}

}
