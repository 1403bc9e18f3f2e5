package org.fuzzdex.search.service;

import com.google.gson.JsonObject;
import org.fuzzdex.core.exception.MalformedPayloadException;
import org.fuzzdex.indexing.DocumentIndex;
import org.fuzzdex.search.model.ScoredCandidate;
import org.fuzzdex.search.model.SearchResult;
import org.fuzzdex.search.stats.QueryTimings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

public class SearchService {
	private static final Logger logger = LoggerFactory.getLogger(SearchService.class);

	private final DocumentIndex index;
	private final QueryEngine queryEngine;
	private final QueryTimings timings;

	public SearchService(DocumentIndex index, QueryEngine queryEngine, QueryTimings timings) {
		this.index = index;
		this.queryEngine = queryEngine;
		this.timings = timings;
	}

	/**
	 * Documents matching a query, best first. A blank query returns every stored document, unranked.
	 */
	public List<JsonObject> search(String query) {
		return rank(query).stream()
				.map(SearchResult::document)
				.collect(Collectors.toList());
	}

	/**
	 * Like {@link #search} but keeps ids and scores. Results of a blank query all score 0.
	 */
	public List<SearchResult> rank(String query) {
		String trimmed = query == null ? "" : query.trim();

		if (trimmed.isEmpty()) {
			return allDocuments();
		}

		long startedAt = System.currentTimeMillis();
		long start = System.nanoTime();

		List<ScoredCandidate> ranked = queryEngine.scoreCandidates(trimmed);
		List<SearchResult> results = new ArrayList<>(ranked.size());
		for (ScoredCandidate candidate : ranked) {
			resolve(candidate.internalId(), candidate.score()).ifPresent(results::add);
		}

		long durationMicros = (System.nanoTime() - start) / 1_000;
		timings.record(startedAt, durationMicros, results.size());
		logger.debug("Query '{}' returned {} documents in {} us", trimmed, results.size(), durationMicros);

		return results;
	}

	private List<SearchResult> allDocuments() {
		List<SearchResult> results = new ArrayList<>(index.size());
		for (int internalId : index.internalIds()) {
			resolve(internalId, 0).ifPresent(results::add);
		}
		return results;
	}

	private Optional<SearchResult> resolve(int internalId, int score) {
		Optional<String> externalId = index.externalId(internalId);
		if (externalId.isEmpty()) {
			return Optional.empty();
		}
		try {
			return Optional.of(new SearchResult(internalId, externalId.get(), score, index.document(internalId)));
		} catch (MalformedPayloadException e) {
			logger.warn("Dropping document '{}' from results: {}", externalId.get(), e.getMessage());
			return Optional.empty();
		}
	}
}
