package org.fuzzdex.search.service;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.fuzzdex.core.text.FuzzyMatch;
import org.fuzzdex.core.text.FuzzyMatcher;
import org.fuzzdex.core.text.NGramTokenizer;
import org.fuzzdex.core.text.SubsequenceFuzzyMatcher;
import org.fuzzdex.indexing.DocumentIndex;
import org.fuzzdex.indexing.config.IndexConfig;
import org.fuzzdex.indexing.index.MemoryInvertedIndex;
import org.fuzzdex.search.model.ScoredCandidate;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class QueryEngineTest {

	private static JsonObject json(String text) {
		return JsonParser.parseString(text).getAsJsonObject();
	}

	@Test
	public void testCandidatesBelowHalfOfBestArePrunedBeforeRerank() throws Exception {
		MemoryInvertedIndex postings = new MemoryInvertedIndex();
		DocumentIndex index = new DocumentIndex(IndexConfig.defaults(List.of("title")), new NGramTokenizer(), postings);
		for (String id : List.of("x", "y", "z")) {
			index.add(id, "{\"_id\": \"" + id + "\", \"title\": \"" + id + "\"}", "");
		}
		postings.put("alpha", 0, 50);
		postings.put("beta", 0, 50);
		postings.put("alpha", 1, 40);
		postings.put("alpha", 2, 50);

		AtomicInteger fuzzyCalls = new AtomicInteger();
		FuzzyMatcher counting = (query, haystack) -> {
			fuzzyCalls.incrementAndGet();
			return Optional.empty();
		};
		QueryEngine engine = new QueryEngine(index, counting);

		Map<Integer, Integer> scores = engine.accumulate(List.of("alpha", "beta"));
		assertEquals(Map.of(0, 100, 1, 40, 2, 50), scores);

		List<ScoredCandidate> kept = engine.prune(scores);
		assertEquals(List.of(new ScoredCandidate(0, 100), new ScoredCandidate(2, 50)), kept);

		engine.rerank("alpha beta", kept);
		assertEquals(2, fuzzyCalls.get());
	}

	@Test
	public void testWholeWordOutranksGramOverlap() throws Exception {
		DocumentIndex index = DocumentIndex.create(List.of("title"));
		int wholeWord = index.addObject(json("{\"_id\": \"a\", \"title\": \"fox hunt\"}"));
		int gramsOnly = index.addObject(json("{\"_id\": \"b\", \"title\": \"foxtrot\"}"));
		QueryEngine keepAll = new QueryEngine(index, new SubsequenceFuzzyMatcher(), 0.0);

		Map<Integer, Integer> scores = keepAll.accumulate(keepAll.queryTokens("fox"));
		assertEquals(102, scores.get(wholeWord));
		assertEquals(2, scores.get(gramsOnly));

		List<ScoredCandidate> coarse = keepAll.coarseCandidates("fox");
		assertEquals(List.of(wholeWord, gramsOnly), coarse.stream().map(ScoredCandidate::internalId).toList());

		QueryEngine halving = new QueryEngine(index, new SubsequenceFuzzyMatcher());
		assertEquals(List.of(wholeWord), halving.coarseCandidates("fox").stream().map(ScoredCandidate::internalId).toList());
	}

	@Test
	public void testQueryTokensAreNotDeduplicated() throws Exception {
		DocumentIndex index = DocumentIndex.create(List.of("title"));
		int id = index.addObject(json("{\"_id\": \"a\", \"title\": \"red fox\"}"));
		QueryEngine engine = new QueryEngine(index, new SubsequenceFuzzyMatcher());

		assertEquals(List.of("fox", "fox", "fox", "fox"), engine.queryTokens("fox fox"));
		assertEquals(204, engine.accumulate(engine.queryTokens("fox fox")).get(id));
	}

	@Test
	public void testNoMatchingTokens() throws Exception {
		DocumentIndex index = DocumentIndex.create(List.of("title"));
		index.addObject(json("{\"_id\": \"a\", \"title\": \"red fox\"}"));
		QueryEngine engine = new QueryEngine(index, new SubsequenceFuzzyMatcher());

		assertTrue(engine.scoreCandidates("zebra").isEmpty());
		assertTrue(engine.prune(Map.of()).isEmpty());
	}

	@Test
	public void testCandidatesWithoutFuzzyMatchAreDropped() throws Exception {
		DocumentIndex index = DocumentIndex.create(List.of("title"));
		index.addObject(json("{\"_id\": \"a\", \"title\": \"red fox\"}"));
		QueryEngine engine = new QueryEngine(index, new SubsequenceFuzzyMatcher());

		assertFalse(engine.coarseCandidates("fox red").isEmpty());
		assertTrue(engine.scoreCandidates("fox red").isEmpty());
	}

	@Test
	public void testRerankOrdersByFuzzyScore() throws Exception {
		DocumentIndex index = DocumentIndex.create(List.of("title"));
		int shortTitle = index.addObject(json("{\"_id\": \"a\", \"title\": \"fox\"}"));
		int longTitle = index.addObject(json("{\"_id\": \"b\", \"title\": \"fox in the woods\"}"));
		FuzzyMatcher byLength = (query, haystack) -> Optional.of(new FuzzyMatch(haystack.length(), query.length()));
		QueryEngine engine = new QueryEngine(index, byLength);

		List<ScoredCandidate> ranked = engine.scoreCandidates("fox");

		assertEquals(List.of(longTitle, shortTitle), ranked.stream().map(ScoredCandidate::internalId).toList());
		assertEquals("fox in the woods ".length(), ranked.get(0).score());
	}

	@Test
	public void testMalformedPayloadSkippedDuringRerank() throws Exception {
		DocumentIndex index = DocumentIndex.create(List.of("title"));
		index.add("bad", "{broken", "broken fox");
		int good = index.addObject(json("{\"_id\": \"good\", \"title\": \"fox\"}"));
		QueryEngine engine = new QueryEngine(index, new SubsequenceFuzzyMatcher());

		assertEquals(2, engine.coarseCandidates("fox").size());
		assertEquals(List.of(good), engine.scoreCandidates("fox").stream().map(ScoredCandidate::internalId).toList());
	}
}
