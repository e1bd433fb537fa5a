package com.joshlong.portal.search.items;

import com.joshlong.portal.search.IndexItemKind;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Component;

@Component
class UserItemLoader extends AbstractJdbcIndexItemLoader<UserItem> {

	UserItemLoader(JdbcClient db) {
		super(db, IndexItemKind.USER,
				(rs, rowNum) -> new UserItem(rs.getLong("id"), rs.getString("username"), rs.getString("user_role"),
						rs.getString("display_name"), rs.getString("email")),
				"select id, username, user_role, display_name, email from users", null);
	}

}
