package org.fuzzdex.search.stats;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded history of the most recent query timings. Once full, the oldest entry is evicted.
 *
 * <p>Not thread-safe; owned by the index it reports on.</p>
 */
public class QueryTimings {

	private final int capacity;
	private final Deque<QueryTiming> history;
	private long totalQueries;

	public QueryTimings(int capacity) {
		if (capacity < 1) {
			throw new IllegalArgumentException("capacity must be positive: " + capacity);
		}
		this.capacity = capacity;
		this.history = new ArrayDeque<>(capacity);
		this.totalQueries = 0;
	}

	public void record(long startedAtMillis, long durationMicros, int results) {
		if (history.size() == capacity) {
			history.removeFirst();
		}
		history.addLast(new QueryTiming(startedAtMillis, durationMicros, results));
		totalQueries++;
	}

	/**
	 * Recorded timings, oldest first
	 */
	public List<QueryTiming> recent() {
		return new ArrayList<>(history);
	}

	/**
	 * Average duration over the retained history, 0 when nothing was recorded
	 */
	public double averageMicros() {
		return history.stream()
				.mapToLong(QueryTiming::durationMicros)
				.average()
				.orElse(0.0);
	}

	/**
	 * Queries recorded since creation or the last {@link #clear()}, including evicted ones
	 */
	public long totalQueries() {
		return totalQueries;
	}

	public int capacity() {
		return capacity;
	}

	public void clear() {
		history.clear();
		totalQueries = 0;
	}
}
