package org.fuzzdex.core.text;

/**
 * Result of aligning a query against a haystack. Higher scores are better matches;
 * the score may be negative for widely scattered alignments.
 */
public record FuzzyMatch(int score, int matchedChars) {
}
