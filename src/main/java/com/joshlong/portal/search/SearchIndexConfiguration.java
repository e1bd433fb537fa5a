package com.joshlong.portal.search;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.joshlong.portal.PortalProperties;
import com.joshlong.portal.search.elastic.ElasticsearchSearchIndexClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

@Configuration
class SearchIndexConfiguration {

	/**
	 * the auto-configured mapper doesn't know about {@code java.time} or our naming
	 * conventions, so we hand it (a copy of) the one Spring Boot configures.
	 */
	@Bean
	JacksonJsonpMapper jacksonJsonpMapper(ObjectMapper objectMapper) {
		return new JacksonJsonpMapper(objectMapper.copy());
	}

	@Bean
	ElasticsearchSearchIndexClient elasticsearchSearchIndexClient(ElasticsearchClient elasticsearchClient,
			ObjectMapper objectMapper, PortalProperties properties) {
		var search = properties.search();
		return new ElasticsearchSearchIndexClient(elasticsearchClient, objectMapper, search.indexPrefix(),
				search.bulkSize());
	}

	@Bean(destroyMethod = "shutdownNow")
	ScheduledExecutorService searchIndexLockNoticeScheduler() {
		return Executors.newSingleThreadScheduledExecutor(runnable -> {
			var thread = new Thread(runnable, "search-index-lock-notice");
			thread.setDaemon(true);
			return thread;
		});
	}

	@Bean
	WriteCoordinator writeCoordinator(PlatformTransactionManager transactionManager, SearchIndexQueue queue,
			SearchIndexClient client, ScheduledExecutorService searchIndexLockNoticeScheduler,
			PortalProperties properties) {
		return new WriteCoordinator(transactionManager, queue, client, searchIndexLockNoticeScheduler,
				properties.search().lockNoticeDelay());
	}

	@Bean
	IndexUpdater indexUpdater(WriteCoordinator writeCoordinator, SearchIndexQueue queue,
			List<IndexItemLoader<?>> loaders, PortalProperties properties) {
		return new IndexUpdater(writeCoordinator, queue, loaders, properties.search().chunkSize());
	}

	@Bean
	SearchIndexManager searchIndexManager(SearchIndexClient client, WriteCoordinator writeCoordinator,
			SearchIndexQueue queue, List<IndexItemLoader<?>> loaders) {
		return new SearchIndexManager(client, writeCoordinator, queue, loaders);
	}

	@Bean
	SearchIndexDaemon searchIndexDaemon(SearchIndexManager manager, IndexUpdater updater,
			PortalProperties properties) {
		return new SearchIndexDaemon(manager, updater, properties.search().updateInterval());
	}

	@Bean
	EventSearchService eventSearchService(SearchIndexClient client) {
		return new EventSearchService(client);
	}

	@Bean
	SearchIndexCommandRunner searchIndexCommandRunner(SearchIndexManager manager, IndexUpdater updater,
			SearchIndexDaemon daemon) {
		var in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
		return new SearchIndexCommandRunner(manager, updater, daemon, in, System.out);
	}

}
