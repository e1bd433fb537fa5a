package com.joshlong.portal.search.items;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.joshlong.portal.search.IndexItem;
import com.joshlong.portal.search.IndexItemKind;
import org.jspecify.annotations.Nullable;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * a series in the search index. See {@link EventItem} for notes on roles, timestamps and
 * {@code listed} that apply here as well.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record SeriesItem(long id, String opencastId, String title, @Nullable String description,
		OffsetDateTime updated, long updatedTimestamp, @Nullable OffsetDateTime created,
		@Nullable Long createdTimestamp, List<String> readRoles, List<String> writeRoles, boolean listed,
		List<RealmItem> hostRealms, List<ThumbnailInfo> thumbnails) implements IndexItem {

	@Override
	public IndexItemKind kind() {
		return IndexItemKind.SERIES;
	}

}
