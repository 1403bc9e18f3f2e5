package org.fuzzdex.search.model;

import com.google.gson.JsonObject;
import org.jetbrains.annotations.NotNull;

public record SearchResult(
		int internalId,
		String externalId,
		int score,
		JsonObject document
) {

	@NotNull
	@Override
	public String toString() {
		return String.format("SearchResult{id='%s', internal=%d, score=%d}", externalId, internalId, score);
	}
}
