package org.fuzzdex.search;

import com.google.gson.JsonObject;
import org.fuzzdex.core.exception.DuplicateIdentifierException;
import org.fuzzdex.core.exception.MalformedPayloadException;
import org.fuzzdex.core.exception.MissingIdentifierException;
import org.fuzzdex.core.exception.UnknownIdentifierException;
import org.fuzzdex.core.text.FuzzyMatcher;
import org.fuzzdex.core.text.NGramTokenizer;
import org.fuzzdex.core.text.SubsequenceFuzzyMatcher;
import org.fuzzdex.core.text.Tokenizer;
import org.fuzzdex.indexing.DocumentIndex;
import org.fuzzdex.indexing.config.IndexConfig;
import org.fuzzdex.search.model.SearchResult;
import org.fuzzdex.search.service.QueryEngine;
import org.fuzzdex.search.service.SearchService;
import org.fuzzdex.search.stats.QueryTiming;
import org.fuzzdex.search.stats.QueryTimings;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * In-memory full-text index over JSON documents.
 *
 * <p>Documents are registered under the string held in their id field ({@code _id} by default) and
 * found again by free-text query over the configured fields. Queries first narrow candidates by
 * token overlap, then order them by fuzzy alignment of the query against each document's text.</p>
 *
 * <p>Instances are not thread-safe. Writers need exclusive access; concurrent readers are only safe
 * while no write is in progress, which callers must guarantee themselves.</p>
 */
public class FuzzyIndex {
	private final DocumentIndex index;
	private final SearchService searchService;
	private final QueryTimings timings;

	public FuzzyIndex(IndexConfig config) {
		this(config, new NGramTokenizer(config.gramSize()), new SubsequenceFuzzyMatcher());
	}

	public FuzzyIndex(IndexConfig config, Tokenizer tokenizer, FuzzyMatcher fuzzyMatcher) {
		Objects.requireNonNull(config, "config");
		this.index = new DocumentIndex(config, tokenizer);
		this.timings = new QueryTimings(config.search().queryHistory());
		this.searchService = new SearchService(index, new QueryEngine(index, fuzzyMatcher), timings);
	}

	/**
	 * New index over the given fields with default settings
	 */
	public static FuzzyIndex create(List<String> fields) {
		return new FuzzyIndex(IndexConfig.defaults(fields));
	}

	/**
	 * New index configured from {@code fuzzdex.properties} and the environment
	 */
	public static FuzzyIndex fromConfiguration() {
		return new FuzzyIndex(IndexConfig.load());
	}

	public void clear() {
		index.clear();
		timings.clear();
	}

	public int addObject(JsonObject document) throws MissingIdentifierException, DuplicateIdentifierException {
		return index.addObject(document);
	}

	/**
	 * Add documents in order, stopping at the first one that fails
	 * @return number of documents added
	 */
	public int addAll(Iterable<JsonObject> documents) throws MissingIdentifierException, DuplicateIdentifierException {
		int added = 0;
		for (JsonObject document : documents) {
			index.addObject(document);
			added++;
		}
		return added;
	}

	public void update(JsonObject document) throws MissingIdentifierException, UnknownIdentifierException {
		index.update(document);
	}

	public boolean remove(String externalId) {
		return index.remove(externalId);
	}

	public List<JsonObject> search(String query) {
		return searchService.search(query);
	}

	public List<SearchResult> rank(String query) {
		return searchService.rank(query);
	}

	public Optional<JsonObject> get(String externalId) throws MalformedPayloadException {
		return index.get(externalId);
	}

	public boolean contains(String externalId) {
		return index.contains(externalId);
	}

	public int size() {
		return index.size();
	}

	public DocumentIndex.IndexStats getStats() {
		return index.getStats();
	}

	public List<QueryTiming> recentQueries() {
		return timings.recent();
	}

	public double averageQueryMicros() {
		return timings.averageMicros();
	}

	public IndexConfig config() {
		return index.config();
	}
}
