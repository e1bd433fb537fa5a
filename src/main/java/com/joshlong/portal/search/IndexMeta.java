package com.joshlong.portal.search;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * the single document stored in the meta index.
 *
 * @param version counts up whenever the search index changes in a way that requires a
 * rebuild
 * @param dirty set while transitioning to a new version. If that transition fails or is
 * interrupted, the flag stays set and the next start rebuilds again.
 */
public record IndexMeta(@JsonProperty(value = "id", required = true) String id,
		@JsonProperty(value = "version", required = true) int version,
		@JsonProperty(value = "dirty", required = true) boolean dirty) {

	public static final String ID = "meta";

	public static IndexMeta current(boolean dirty) {
		return new IndexMeta(ID, SearchIndexManager.VERSION, dirty);
	}

}
