package com.joshlong.portal.search.elastic;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.Refresh;
import co.elastic.clients.elasticsearch._types.mapping.TypeMapping;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkOperation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.joshlong.portal.search.IndexItem;
import com.joshlong.portal.search.IndexItemKind;
import com.joshlong.portal.search.IndexMeta;
import com.joshlong.portal.search.IndexState;
import com.joshlong.portal.search.SearchIndexClient;
import com.joshlong.portal.search.SearchIndexException;
import com.joshlong.portal.search.items.EventItem;
import com.joshlong.portal.search.text.ByteSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * {@link SearchIndexClient} backed by Elasticsearch.
 */
public class ElasticsearchSearchIndexClient implements SearchIndexClient {

	static final String META_INDEX = "meta";

	static final String SLIDE_TEXTS_FIELD = "slide_texts.texts";

	static final String CAPTION_TEXTS_FIELD = "caption_texts.texts";

	// the default of index.highlight.max_analyzed_offset. Passing it explicitly makes
	// longer texts highlight up to there instead of failing the whole search
	static final int MAX_ANALYZED_OFFSET = 1_000_000;

	private final Logger log = LoggerFactory.getLogger(getClass());

	private final ElasticsearchClient client;

	private final ObjectMapper objectMapper;

	private final String indexPrefix;

	private final int bulkSize;

	public ElasticsearchSearchIndexClient(ElasticsearchClient client, ObjectMapper objectMapper, String indexPrefix,
			int bulkSize) {
		Assert.isTrue(bulkSize > 0, "the bulk size must be positive");
		this.client = client;
		this.objectMapper = objectMapper;
		this.indexPrefix = indexPrefix;
		this.bulkSize = bulkSize;
	}

	String indexName(IndexItemKind kind) {
		return this.indexPrefix + kind.pluralName();
	}

	String metaIndexName() {
		return this.indexPrefix + META_INDEX;
	}

	private List<String> allIndexNames() {
		var names = new ArrayList<String>();
		for (var kind : IndexItemKind.values())
			names.add(indexName(kind));
		names.add(metaIndexName());
		return names;
	}

	@Override
	public void prepare() {
		for (var kind : IndexItemKind.values())
			this.prepareIndex(indexName(kind), IndexSchema.mapping(kind));
		this.prepareIndex(metaIndexName(), IndexSchema.metaMapping());
	}

	private void prepareIndex(String name, TypeMapping mapping) {
		try {
			var indices = this.client.indices();
			if (indices.exists(e -> e.index(name)).value()) {
				// existing fields can't be remapped, but new fields can be added
				indices.putMapping(p -> p.index(name).properties(mapping.properties()));
				this.log.debug("updated the mapping of search index '{}'", name);
			} //
			else {
				indices.create(c -> c.index(name).mappings(mapping));
				this.log.info("created search index '{}'", name);
			}
		} //
		catch (IOException | ElasticsearchException e) {
			throw new SearchIndexException("could not prepare search index '" + name + "'", e);
		}
	}

	@Override
	public IndexTask upsert(IndexItemKind kind, Collection<? extends IndexItem> items, Completion completion) {
		var operations = new ArrayList<BulkOperation>(items.size());
		for (var item : items) {
			Assert.state(item.kind() == kind, () -> "expected an item of kind " + kind + ", got " + item.kind());
			operations.add(BulkOperation.of(o -> o.index(i -> i.id(Long.toString(item.id())).document(item))));
		}
		return this.bulk(indexName(kind), operations, completion);
	}

	@Override
	public IndexTask delete(IndexItemKind kind, Collection<Long> ids, Completion completion) {
		var operations = new ArrayList<BulkOperation>(ids.size());
		for (var id : ids)
			operations.add(BulkOperation.of(o -> o.delete(d -> d.id(Long.toString(id)))));
		return this.bulk(indexName(kind), operations, completion);
	}

	@Override
	public IndexTask writeMeta(IndexMeta meta, Completion completion) {
		var operation = BulkOperation.of(o -> o.index(i -> i.id(IndexMeta.ID).document(meta)));
		return this.bulk(metaIndexName(), List.of(operation), completion);
	}

	private IndexTask bulk(String index, List<BulkOperation> operations, Completion completion) {
		for (var from = 0; from < operations.size(); from += this.bulkSize) {
			var batch = operations.subList(from, Math.min(operations.size(), from + this.bulkSize));
			var last = from + this.bulkSize >= operations.size();
			// a refresh makes everything sent before it visible, so one at the end is enough
			var refresh = last && completion == Completion.WAIT_FOR_COMPLETION ? Refresh.WaitFor : Refresh.False;
			try {
				var response = this.client.bulk(b -> b.index(index).refresh(refresh).operations(batch));
				if (response.errors())
					throw new SearchIndexException(
							"bulk request against search index '" + index + "' failed: " + this.firstError(response));
			} //
			catch (IOException | ElasticsearchException e) {
				throw new SearchIndexException("could not send bulk request to search index '" + index + "'", e);
			}
		}
		this.log.debug("sent {} operations to search index '{}' ({})", operations.size(), index, completion);
		return new IndexTask(index, operations.size(), completion);
	}

	private String firstError(BulkResponse response) {
		var failed = 0;
		String reason = null;
		for (var item : response.items()) {
			var error = item.error();
			if (error != null) {
				failed += 1;
				if (reason == null)
					reason = "document " + item.id() + ": " + error.type() + ": " + error.reason();
			}
		}
		return failed + " item(s) failed, first one being " + reason;
	}

	@Override
	public void clear() {
		var names = this.allIndexNames();
		try {
			this.client.indices().delete(d -> d.index(names).ignoreUnavailable(true));
			this.log.info("deleted search indexes {}", names);
		} //
		catch (IOException | ElasticsearchException e) {
			throw new SearchIndexException("could not delete search indexes " + names, e);
		}
	}

	@Override
	public long documentCount(IndexItemKind kind) {
		var name = indexName(kind);
		try {
			if (!this.client.indices().exists(e -> e.index(name)).value())
				return -1;
			return this.client.count(c -> c.index(name)).count();
		} //
		catch (IOException | ElasticsearchException e) {
			throw new SearchIndexException("could not count the documents in search index '" + name + "'", e);
		}
	}

	@Override
	public ServerInfo serverInfo() {
		try {
			var version = this.client.info().version().number();
			var health = this.client.cluster().health().status().jsonValue();
			return new ServerInfo(version, health);
		} //
		catch (IOException | ElasticsearchException e) {
			throw new SearchIndexException("could not reach the search engine", e);
		}
	}

	@Override
	public IndexState readState() {
		var index = metaIndexName();
		JsonNode source;
		try {
			var response = this.client.get(g -> g.index(index).id(IndexMeta.ID), JsonNode.class);
			if (!response.found() || response.source() == null)
				return IndexState.noVersionInfo();
			source = response.source();
		} //
		catch (ElasticsearchException e) {
			if (e.status() == 404)
				return IndexState.noVersionInfo();
			throw new SearchIndexException("could not read the meta document from '" + index + "'", e);
		} //
		catch (IOException e) {
			throw new SearchIndexException("could not read the meta document from '" + index + "'", e);
		}
		try {
			var meta = this.objectMapper.treeToValue(source, IndexMeta.class);
			return IndexState.info(meta.version(), meta.dirty());
		} //
		catch (JsonProcessingException | IllegalArgumentException e) {
			this.log.warn("the meta document in '{}' is broken: {}", index, source, e);
			return IndexState.brokenVersionInfo();
		}
	}

	@Override
	public List<EventHit> searchEvents(String query, int limit) {
		var index = indexName(IndexItemKind.EVENT);
		try {
			var response = this.client.search(s -> s //
				.index(index) //
				.size(limit) //
				.query(q -> q.multiMatch(mm -> mm //
					.query(query) //
					.fields("title^2", "series_title", "creators", "description", SLIDE_TEXTS_FIELD,
							CAPTION_TEXTS_FIELD))) //
				.highlight(h -> h //
					.preTags(HighlightedMatches.PRE_TAG) //
					.postTags(HighlightedMatches.POST_TAG) //
					.maxAnalyzedOffset(MAX_ANALYZED_OFFSET) //
					.fields(SLIDE_TEXTS_FIELD, f -> f.numberOfFragments(0)) //
					.fields(CAPTION_TEXTS_FIELD, f -> f.numberOfFragments(0))), //
					EventItem.class);
			var hits = new ArrayList<EventHit>();
			for (var hit : response.hits().hits()) {
				var event = hit.source();
				if (event == null)
					continue;
				var highlights = hit.highlight();
				hits.add(new EventHit(event, matches(highlights, CAPTION_TEXTS_FIELD),
						matches(highlights, SLIDE_TEXTS_FIELD)));
			}
			this.log.debug("found {} events for '{}'", hits.size(), query);
			return hits;
		} //
		catch (IOException | ElasticsearchException e) {
			throw new SearchIndexException("could not search '" + index + "' for '" + query + "'", e);
		}
	}

	private static List<ByteSpan> matches(Map<String, List<String>> highlights, String field) {
		var fragments = highlights.get(field);
		return fragments == null ? List.of() : HighlightedMatches.parse(fragments);
	}

}
