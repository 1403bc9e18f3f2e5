package org.fuzzdex.benchmarks;

import com.google.gson.JsonObject;
import org.fuzzdex.core.exception.DocumentIndexException;
import org.fuzzdex.search.FuzzyIndex;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Benchmarks for query evaluation
 * Tests: single word, multi word, partial word, no match, full listing
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
public class SearchServiceBenchmark {

	private FuzzyIndex index;

	@Param({"100", "1000", "10000"})
	private int datasetSize;

	@Setup(Level.Trial)
	public void setup() throws DocumentIndexException {
		System.out.println("=== Search Benchmark Setup (datasetSize=" + datasetSize + ") ===");

		List<JsonObject> documents = SyntheticDocuments.generate(datasetSize, 42L);
		index = FuzzyIndex.create(SyntheticDocuments.FIELDS);
		index.addAll(documents);

		System.out.println("Index ready: " + index.getStats());
	}

	/**
	 * Benchmark: One whole word
	 */
	@Benchmark
	public void singleWordQuery(Blackhole blackhole) {
		blackhole.consume(index.search("adventure"));
	}

	/**
	 * Benchmark: Several words in document order
	 */
	@Benchmark
	public void multiWordQuery(Blackhole blackhole) {
		blackhole.consume(index.search("river mountain"));
	}

	/**
	 * Benchmark: Word prefix, matched through grams only
	 */
	@Benchmark
	public void partialWordQuery(Blackhole blackhole) {
		blackhole.consume(index.search("glaci"));
	}

	/**
	 * Benchmark: Query without any indexed token
	 */
	@Benchmark
	public void noMatchQuery(Blackhole blackhole) {
		blackhole.consume(index.search("zzzzzz"));
	}

	/**
	 * Benchmark: Blank query listing every document
	 */
	@Benchmark
	public void listAllDocuments(Blackhole blackhole) {
		blackhole.consume(index.search(""));
	}
}
