package com.joshlong.portal.search.items;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.joshlong.portal.search.IndexItem;
import com.joshlong.portal.search.IndexItemKind;
import org.jspecify.annotations.Nullable;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record UserItem(long id, String username, String userRole, String displayName, @Nullable String email)
		implements IndexItem {

	@Override
	public IndexItemKind kind() {
		return IndexItemKind.USER;
	}

}
