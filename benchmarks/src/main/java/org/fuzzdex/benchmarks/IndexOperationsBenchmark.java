package org.fuzzdex.benchmarks;

import com.google.gson.JsonObject;
import org.fuzzdex.core.exception.DocumentIndexException;
import org.fuzzdex.search.FuzzyIndex;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Benchmarks for index write operations
 * Tests: bulk add, add single document, update, remove
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
public class IndexOperationsBenchmark {

	private List<JsonObject> documents;
	private FuzzyIndex index;
	private JsonObject extraDocument;
	private JsonObject updatedDocument;

	@Param({"100", "1000", "10000"})
	private int indexSize;

	@Setup(Level.Trial)
	public void loadDocuments() {
		documents = SyntheticDocuments.generate(indexSize, 42L);

		extraDocument = SyntheticDocuments.generate(1, 7L).get(0);
		extraDocument.addProperty("_id", "extra");

		updatedDocument = documents.get(indexSize / 2).deepCopy();
		updatedDocument.addProperty("title", "glacier lantern voyage");
	}

	@Setup(Level.Invocation)
	public void buildIndex() throws DocumentIndexException {
		index = FuzzyIndex.create(SyntheticDocuments.FIELDS);
		index.addAll(documents);
	}

	/**
	 * Benchmark: Index every document from scratch
	 */
	@Benchmark
	public void bulkAdd(Blackhole blackhole) throws DocumentIndexException {
		FuzzyIndex fresh = FuzzyIndex.create(SyntheticDocuments.FIELDS);
		blackhole.consume(fresh.addAll(documents));
	}

	/**
	 * Benchmark: Add one document to a populated index
	 */
	@Benchmark
	public void addDocument(Blackhole blackhole) throws DocumentIndexException {
		blackhole.consume(index.addObject(extraDocument));
	}

	/**
	 * Benchmark: Replace one document's content
	 */
	@Benchmark
	public void updateDocument(Blackhole blackhole) throws DocumentIndexException {
		index.update(updatedDocument);
		blackhole.consume(index.getStats());
	}

	/**
	 * Benchmark: Remove one document and its postings
	 */
	@Benchmark
	public void removeDocument(Blackhole blackhole) {
		blackhole.consume(index.remove("doc-" + (indexSize / 2)));
	}
}
