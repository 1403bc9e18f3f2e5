package org.fuzzdex.core.model;

import org.jetbrains.annotations.NotNull;

/**
 * One entry of a token's postings list: the internal id of a document holding the token
 * and the weight the token contributes to that document's overlap score.
 */
public record Posting(int internalId, int weight) {

	@NotNull
	@Override
	public String toString() {
		return String.format("Posting{id=%d, weight=%d}", internalId, weight);
	}
}
