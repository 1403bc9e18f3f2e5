package org.fuzzdex.search.service;

import com.google.gson.JsonObject;
import org.fuzzdex.core.exception.MalformedPayloadException;
import org.fuzzdex.core.model.Posting;
import org.fuzzdex.core.text.FuzzyMatch;
import org.fuzzdex.core.text.FuzzyMatcher;
import org.fuzzdex.core.text.Tokenizer;
import org.fuzzdex.indexing.DocumentIndex;
import org.fuzzdex.indexing.index.PostingsReader;
import org.fuzzdex.search.model.ScoredCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Two-stage ranking of documents against a query.
 *
 * <p>Stage one sums the posting weights of every query token per document and keeps only the
 * documents scoring at least {@code pruneRatio} of the best score. Stage two aligns the raw query
 * against the flattened fields of each surviving document and orders them by alignment score.
 * Documents the query cannot be aligned against are dropped.</p>
 */
public class QueryEngine {
	private static final Logger logger = LoggerFactory.getLogger(QueryEngine.class);

	private static final Comparator<ScoredCandidate> BY_SCORE_DESC =
			Comparator.comparingInt(ScoredCandidate::score).reversed();

	private final DocumentIndex index;
	private final FuzzyMatcher fuzzyMatcher;
	private final double pruneRatio;

	public QueryEngine(DocumentIndex index, FuzzyMatcher fuzzyMatcher) {
		this(index, fuzzyMatcher, index.config().search().pruneRatio());
	}

	public QueryEngine(DocumentIndex index, FuzzyMatcher fuzzyMatcher, double pruneRatio) {
		this.index = index;
		this.fuzzyMatcher = fuzzyMatcher;
		this.pruneRatio = pruneRatio;
	}

	/**
	 * Rank the documents matching a query, best first
	 * @return the reranked candidates, empty when no query token is indexed
	 */
	public List<ScoredCandidate> scoreCandidates(String query) {
		List<ScoredCandidate> candidates = coarseCandidates(query);
		if (candidates.isEmpty()) {
			return Collections.emptyList();
		}
		return rerank(query, candidates);
	}

	/**
	 * Query tokens in tokenizer order, grams first and then words. Duplicates are kept, so a token
	 * repeated in the query counts once per occurrence.
	 */
	public List<String> queryTokens(String query) {
		Tokenizer tokenizer = index.tokenizer();
		List<String> tokens = new ArrayList<>(tokenizer.grams(query));
		tokens.addAll(tokenizer.words(query));
		return tokens;
	}

	/**
	 * Candidates surviving the token-overlap stage, highest overlap first
	 */
	public List<ScoredCandidate> coarseCandidates(String query) {
		return prune(accumulate(queryTokens(query)));
	}

	/**
	 * Sum the posting weights of every token per internal id
	 */
	public Map<Integer, Integer> accumulate(List<String> tokens) {
		PostingsReader postings = index.postings();
		Map<Integer, Integer> scores = new HashMap<>();

		for (String token : tokens) {
			for (Posting posting : postings.postings(token)) {
				scores.merge(posting.internalId(), posting.weight(), Integer::sum);
			}
		}
		return scores;
	}

	/**
	 * Drop every candidate scoring below {@code pruneRatio} of the highest score
	 */
	public List<ScoredCandidate> prune(Map<Integer, Integer> scores) {
		if (scores.isEmpty()) {
			return Collections.emptyList();
		}

		int highest = Collections.max(scores.values());
		double threshold = highest * pruneRatio;

		List<ScoredCandidate> kept = new ArrayList<>();
		for (Map.Entry<Integer, Integer> entry : scores.entrySet()) {
			if (entry.getValue() >= threshold) {
				kept.add(new ScoredCandidate(entry.getKey(), entry.getValue()));
			}
		}
		kept.sort(BY_SCORE_DESC.thenComparingInt(ScoredCandidate::internalId));

		logger.debug("{} of {} candidates kept (highest score {})", kept.size(), scores.size(), highest);
		return kept;
	}

	/**
	 * Replace overlap scores with fuzzy alignment scores against each candidate's field text.
	 * Equal alignment scores keep their incoming order.
	 */
	public List<ScoredCandidate> rerank(String query, List<ScoredCandidate> candidates) {
		List<ScoredCandidate> reranked = new ArrayList<>();

		for (ScoredCandidate candidate : candidates) {
			String text;
			try {
				JsonObject document = index.document(candidate.internalId());
				text = index.fieldExtractor().extract(document, index.config().fields());
			} catch (MalformedPayloadException e) {
				logger.warn("Skipping candidate {}: {}", candidate.internalId(), e.getMessage());
				continue;
			}

			Optional<FuzzyMatch> match = fuzzyMatcher.bestMatch(query, text);
			match.ifPresent(m -> reranked.add(new ScoredCandidate(candidate.internalId(), m.score())));
		}

		reranked.sort(BY_SCORE_DESC);
		return reranked;
	}
}
