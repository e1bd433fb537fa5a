package com.joshlong.portal.search;

/**
 * the kinds of things we keep in the search index. Every kind lives in its own index, and
 * the {@link #dbName() database name} is what's stored in the {@code kind} column of the
 * {@code search_index_queue} table.
 */
public enum IndexItemKind {

	REALM("realm", "realms"),

	EVENT("event", "events"),

	SERIES("series", "series"),

	USER("user", "users"),

	PLAYLIST("playlist", "playlists");

	private final String dbName;

	private final String pluralName;

	IndexItemKind(String dbName, String pluralName) {
		this.dbName = dbName;
		this.pluralName = pluralName;
	}

	public static IndexItemKind fromDbName(String dbName) {
		for (var kind : values())
			if (kind.dbName.equals(dbName))
				return kind;
		throw new IllegalArgumentException("unknown search index item kind '" + dbName + "'");
	}

	public String dbName() {
		return this.dbName;
	}

	public String pluralName() {
		return this.pluralName;
	}

}
