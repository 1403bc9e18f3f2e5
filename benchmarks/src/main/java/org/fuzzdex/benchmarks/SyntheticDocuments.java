package org.fuzzdex.benchmarks;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Reproducible documents for the benchmarks, built from a small vocabulary.
 */
final class SyntheticDocuments {

	static final List<String> FIELDS = List.of("title", "tags", "meta");

	private static final String[] VOCABULARY = {
			"adventure", "river", "mountain", "fox", "whale", "garden", "winter", "harbor",
			"lantern", "orchard", "thunder", "meadow", "castle", "voyage", "silver", "forest",
			"island", "desert", "falcon", "library", "compass", "ember", "glacier", "canyon"
	};

	private SyntheticDocuments() {
	}

	static List<JsonObject> generate(int count, long seed) {
		Random random = new Random(seed);
		List<JsonObject> documents = new ArrayList<>(count);

		for (int i = 0; i < count; i++) {
			JsonObject document = new JsonObject();
			document.addProperty("_id", "doc-" + i);
			document.addProperty("title", phrase(random, 4));

			JsonArray tags = new JsonArray();
			for (int t = 0; t < 3; t++) {
				tags.add(word(random));
			}
			document.add("tags", tags);

			JsonObject meta = new JsonObject();
			meta.addProperty("summary", phrase(random, 12));
			meta.addProperty("rank", random.nextInt(100));
			document.add("meta", meta);

			documents.add(document);
		}
		return documents;
	}

	static String word(Random random) {
		return VOCABULARY[random.nextInt(VOCABULARY.length)];
	}

	private static String phrase(Random random, int words) {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < words; i++) {
			if (i > 0) {
				sb.append(' ');
			}
			sb.append(word(random));
		}
		return sb.toString();
	}
}
