package com.joshlong.portal.search;

/**
 * a flat, search engine friendly projection of something in the database.
 */
public interface IndexItem {

	/**
	 * the database key, which doubles as the document's primary key in the search index.
	 */
	long id();

	IndexItemKind kind();

}
