package org.fuzzdex.indexing.index;

import org.fuzzdex.core.model.Posting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Heap-resident inverted index.
 *
 * <p>Each token maps to its postings keyed by internal id, which makes insertion idempotent per
 * (token, document). A reverse map from internal id to tokens is kept in step so that removing a
 * document only visits the postings lists it appears in, at the cost of one extra token reference per
 * posting.</p>
 */
public class MemoryInvertedIndex implements InvertedIndex {
	private static final Logger logger = LoggerFactory.getLogger(MemoryInvertedIndex.class);

	private final Map<String, Map<Integer, Posting>> index;
	private final Map<Integer, Set<String>> tokensByDocument;
	private int postingCount;

	public MemoryInvertedIndex() {
		this.index = new HashMap<>();
		this.tokensByDocument = new HashMap<>();
		this.postingCount = 0;
	}

	@Override
	public void put(String token, int internalId, int weight) {
		Posting previous = index.computeIfAbsent(token, k -> new LinkedHashMap<>())
				.put(internalId, new Posting(internalId, weight));
		if (previous == null) {
			postingCount++;
			tokensByDocument.computeIfAbsent(internalId, k -> new HashSet<>()).add(token);
		}
	}

	@Override
	public Collection<Posting> postings(String token) {
		Map<Integer, Posting> postings = index.get(token);
		if (postings == null) {
			return Collections.emptyList();
		}
		return Collections.unmodifiableCollection(postings.values());
	}

	@Override
	public int removeDocument(int internalId) {
		Set<String> tokens = tokensByDocument.remove(internalId);
		if (tokens == null) {
			return 0;
		}

		int removed = 0;
		int droppedTokens = 0;
		for (String token : tokens) {
			Map<Integer, Posting> postings = index.get(token);
			if (postings == null || postings.remove(internalId) == null) {
				continue;
			}
			removed++;
			if (postings.isEmpty()) {
				index.remove(token);
				droppedTokens++;
			}
		}
		postingCount -= removed;

		logger.debug("Removed {} postings of document {} ({} tokens dropped)", removed, internalId, droppedTokens);
		return removed;
	}

	@Override
	public Set<String> tokensOf(int internalId) {
		Set<String> tokens = tokensByDocument.get(internalId);
		return tokens == null ? Collections.emptySet() : Collections.unmodifiableSet(tokens);
	}

	@Override
	public boolean containsToken(String token) {
		return index.containsKey(token);
	}

	@Override
	public int tokenCount() {
		return index.size();
	}

	@Override
	public int postingCount() {
		return postingCount;
	}

	@Override
	public void clear() {
		index.clear();
		tokensByDocument.clear();
		postingCount = 0;
		logger.info("Cleared inverted index");
	}
}
