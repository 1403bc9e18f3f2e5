package org.fuzzdex.indexing.index;

import org.fuzzdex.core.model.Posting;

import java.util.Collection;
import java.util.Set;

/**
 * Read side of an inverted index.
 */
public interface PostingsReader {
	/**
	 * Get the postings of a token in insertion order
	 * @return postings of the token, empty if the token is not indexed
	 */
	Collection<Posting> postings(String token);

	/**
	 * Get the tokens a document currently holds postings on
	 */
	Set<String> tokensOf(int internalId);

	boolean containsToken(String token);

	/**
	 * Number of distinct tokens
	 */
	int tokenCount();

	/**
	 * Number of postings across all tokens
	 */
	int postingCount();
}
