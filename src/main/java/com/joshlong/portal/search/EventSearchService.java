package com.joshlong.portal.search;

import com.joshlong.portal.search.items.EventItem;
import com.joshlong.portal.search.text.TextAssetType;
import com.joshlong.portal.search.text.TextMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * searches events and resolves matches inside their captions and slide texts to
 * timestamped snippets.
 */
public class EventSearchService {

	private final Logger log = LoggerFactory.getLogger(getClass());

	private final SearchIndexClient client;

	public EventSearchService(SearchIndexClient client) {
		this.client = client;
	}

	public record SearchEvent(EventItem event, List<TextMatch> textMatches) {
	}

	public List<SearchEvent> search(String query, int limit) {
		Assert.state(limit > 0, "the limit must be positive");
		if (!StringUtils.hasText(query))
			return List.of();
		this.log.debug("searching events for '{}'", query);
		var results = new ArrayList<SearchEvent>();
		for (var hit : this.client.searchEvents(query, limit)) {
			var event = hit.event();
			var textMatches = new ArrayList<TextMatch>();
			if (event.slideTexts() != null)
				event.slideTexts().resolveMatches(hit.slideMatches(), textMatches, TextAssetType.SLIDE_TEXT);
			if (event.captionTexts() != null)
				event.captionTexts().resolveMatches(hit.captionMatches(), textMatches, TextAssetType.CAPTION);
			results.add(new SearchEvent(event, List.copyOf(textMatches)));
		}
		return results;
	}

}
