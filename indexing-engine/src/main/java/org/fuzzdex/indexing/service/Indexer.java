package org.fuzzdex.indexing.service;

import org.fuzzdex.core.text.Tokenizer;
import org.fuzzdex.indexing.config.IndexConfig;
import org.fuzzdex.indexing.index.InvertedIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

public class Indexer {
	private static final Logger logger = LoggerFactory.getLogger(Indexer.class);

	private final InvertedIndex invertedIndex;
	private final Tokenizer tokenizer;
	private final int gramWeight;
	private final int wordWeight;

	public Indexer(InvertedIndex invertedIndex, Tokenizer tokenizer, IndexConfig.Weights weights) {
		this.invertedIndex = invertedIndex;
		this.tokenizer = tokenizer;
		this.gramWeight = weights.gram();
		this.wordWeight = weights.word();
	}

	/**
	 * Index the text of a document that holds no postings yet
	 */
	public void indexDocument(int internalId, String text) {
		Map<String, Integer> weights = tokenWeights(text);

		for (Map.Entry<String, Integer> entry : weights.entrySet()) {
			invertedIndex.put(entry.getKey(), internalId, entry.getValue());
		}

		logger.debug("Indexed document {} with {} unique tokens", internalId, weights.size());
	}

	/**
	 * Replace all postings of a document with those of its new text
	 */
	public void reindexDocument(int internalId, String text) {
		invertedIndex.removeDocument(internalId);
		indexDocument(internalId, text);
	}

	/**
	 * Weight each distinct token of a text carries for one document. A token produced both as a
	 * gram and as a word carries both weights.
	 */
	Map<String, Integer> tokenWeights(String text) {
		Set<String> grams = new LinkedHashSet<>(tokenizer.grams(text));
		Set<String> words = new LinkedHashSet<>(tokenizer.words(text));

		Map<String, Integer> weights = new LinkedHashMap<>();
		for (String gram : grams) {
			weights.merge(gram, gramWeight, Integer::sum);
		}
		for (String word : words) {
			weights.merge(word, wordWeight, Integer::sum);
		}
		return weights;
	}
}
