package com.joshlong.portal;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

@ConfigurationProperties(prefix = "portal")
public record PortalProperties(@DefaultValue Search search) {

	/**
	 * @param indexPrefix prepended to the name of every index we manage, so that several
	 * installations can share one search engine
	 * @param updateInterval how often the daemon drains the queue
	 * @param chunkSize how many queue entries are handled in one write-locked transaction
	 * @param bulkSize how many documents go into one bulk request
	 * @param lockNoticeDelay after how long of waiting for the write lock we say something
	 */
	public record Search(@DefaultValue("portal_") String indexPrefix, @DefaultValue("5s") Duration updateInterval,
			@DefaultValue("5000") int chunkSize, @DefaultValue("1000") int bulkSize,
			@DefaultValue("500ms") Duration lockNoticeDelay) {
	}

}
