package org.fuzzdex.indexing.index;

public interface InvertedIndex extends PostingsReader {
	/**
	 * Set the weight of a document's posting on a token. A second put for the same
	 * token and document replaces the weight instead of adding another posting.
	 */
	void put(String token, int internalId, int weight);

	/**
	 * Remove every posting of a document, dropping tokens left without postings
	 * @return number of postings removed
	 */
	int removeDocument(int internalId);

	/**
	 * Clear the index
	 */
	void clear();
}
