package com.joshlong.portal.search.items;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.joshlong.portal.search.IndexItem;
import com.joshlong.portal.search.IndexItemKind;
import com.joshlong.portal.search.text.TextSearchIndex;
import org.jspecify.annotations.Nullable;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * an event (a video) in the search index. Timestamps are stored twice: human-readable,
 * and as seconds since the epoch ({@code *_timestamp}) for range filters and sorting.
 * All roles are {@link Acls#encode(java.util.Collection) encoded}. {@code listed} is
 * derived from {@code hostRealms}, but we need it as a field to filter on it.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record EventItem(long id, @Nullable Long seriesId, @Nullable String seriesTitle, String title,
		@Nullable String description, List<String> creators, @Nullable String thumbnail, long duration,
		OffsetDateTime created, long createdTimestamp, OffsetDateTime updated, long updatedTimestamp,
		@Nullable OffsetDateTime startTime, @Nullable Long startTimestamp, @Nullable OffsetDateTime endTime,
		@Nullable Long endTimestamp, @JsonProperty("is_live") boolean live, boolean audioOnly, boolean hasPassword,
		List<String> readRoles, List<String> writeRoles, List<String> previewRoles, boolean listed,
		List<RealmItem> hostRealms, TextSearchIndex slideTexts, TextSearchIndex captionTexts) implements IndexItem {

	@Override
	public IndexItemKind kind() {
		return IndexItemKind.EVENT;
	}

}
