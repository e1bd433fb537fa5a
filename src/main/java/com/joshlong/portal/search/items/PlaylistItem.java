package com.joshlong.portal.search.items;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.joshlong.portal.search.IndexItem;
import com.joshlong.portal.search.IndexItemKind;
import org.jspecify.annotations.Nullable;

import java.time.OffsetDateTime;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record PlaylistItem(long id, String opencastId, String title, @Nullable String description,
		@Nullable String creator, OffsetDateTime updated, long updatedTimestamp, List<String> readRoles,
		List<String> writeRoles, boolean listed, List<RealmItem> hostRealms) implements IndexItem {

	@Override
	public IndexItemKind kind() {
		return IndexItemKind.PLAYLIST;
	}

}
