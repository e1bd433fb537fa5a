package com.joshlong.portal.search.items;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.joshlong.portal.search.IndexItem;
import com.joshlong.portal.search.IndexItemKind;

import java.util.List;

/**
 * a realm in the search index. The same shape is embedded in events, series and
 * playlists as their host realms.
 *
 * @param ancestorNames the names of all ancestors, excluding the root and this realm
 * itself, starting with a direct child of the root
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record RealmItem(long id, String name, String fullPath, List<String> ancestorNames) implements IndexItem {

	static final String USER_REALM_PREFIX = "/@";

	@Override
	public IndexItemKind kind() {
		return IndexItemKind.REALM;
	}

	@JsonIgnore
	public boolean isUserRealm() {
		return this.fullPath != null && this.fullPath.startsWith(USER_REALM_PREFIX);
	}

	/**
	 * items are listed if they're included in at least one realm that isn't a user realm.
	 */
	static boolean listed(List<RealmItem> hostRealms) {
		return hostRealms.stream().anyMatch(realm -> !realm.isUserRealm());
	}

}
