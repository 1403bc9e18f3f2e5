package org.fuzzdex.core.text;

import java.util.Optional;

/**
 * Scores how well a query aligns against a piece of text.
 */
public interface FuzzyMatcher {
	/**
	 * @return the best alignment of {@code query} inside {@code haystack}, empty when the query
	 *         cannot be aligned at all
	 */
	Optional<FuzzyMatch> bestMatch(String query, String haystack);
}
