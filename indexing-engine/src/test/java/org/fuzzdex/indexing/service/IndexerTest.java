package org.fuzzdex.indexing.service;

import org.fuzzdex.core.model.Posting;
import org.fuzzdex.core.text.NGramTokenizer;
import org.fuzzdex.indexing.config.IndexConfig;
import org.fuzzdex.indexing.index.MemoryInvertedIndex;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class IndexerTest {

	private final MemoryInvertedIndex invertedIndex = new MemoryInvertedIndex();
	private final Indexer indexer = new Indexer(invertedIndex, new NGramTokenizer(3), new IndexConfig.Weights(1, 50));

	@Test
	public void testGramsWeighOneAndWordsFifty() {
		Map<String, Integer> weights = indexer.tokenWeights("foxes foxes");

		assertEquals(Map.of("fox", 1, "oxe", 1, "xes", 1, "foxes", 50), weights);
	}

	@Test
	public void testShortWordCarriesBothWeights() {
		Map<String, Integer> weights = indexer.tokenWeights("red fox");

		assertEquals(Map.of("red", 51, "fox", 51), weights);
	}

	@Test
	public void testIndexingTwiceDoesNotDuplicatePostings() {
		indexer.indexDocument(0, "red fox");
		indexer.indexDocument(0, "red fox");

		assertEquals(List.of(new Posting(0, 51)), List.copyOf(invertedIndex.postings("fox")));
		assertEquals(2, invertedIndex.postingCount());
	}

	@Test
	public void testReindexDropsStaleTokens() {
		indexer.indexDocument(0, "red fox");
		indexer.indexDocument(1, "red dog");

		indexer.reindexDocument(0, "blue whale");

		assertFalse(invertedIndex.containsToken("fox"));
		assertEquals(List.of(new Posting(1, 51)), List.copyOf(invertedIndex.postings("red")));
		assertEquals(List.of(new Posting(0, 50)), List.copyOf(invertedIndex.postings("whale")));
	}

	@Test
	public void testEmptyText() {
		indexer.indexDocument(0, "");

		assertEquals(0, invertedIndex.tokenCount());

		System.out.println("✅ Empty text indexing test passed!");
	}
}
