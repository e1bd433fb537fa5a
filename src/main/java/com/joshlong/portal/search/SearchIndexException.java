package com.joshlong.portal.search;

/**
 * something went wrong talking to the search engine.
 */
public class SearchIndexException extends RuntimeException {

	public SearchIndexException(String message) {
		super(message);
	}

	public SearchIndexException(String message, Throwable cause) {
		super(message, cause);
	}

}
