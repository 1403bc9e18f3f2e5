package org.fuzzdex.search.stats;

/**
 * One executed query: when it ran, how long it took and how many documents it returned.
 */
public record QueryTiming(long startedAtMillis, long durationMicros, int results) {
}
