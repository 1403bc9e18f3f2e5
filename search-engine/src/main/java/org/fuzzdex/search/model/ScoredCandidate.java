package org.fuzzdex.search.model;

/**
 * An internal id with the score it holds at one stage of query evaluation.
 */
public record ScoredCandidate(int internalId, int score) {
}
