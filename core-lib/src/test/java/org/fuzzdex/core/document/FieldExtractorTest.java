package org.fuzzdex.core.document;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class FieldExtractorTest {

	private final FieldExtractor extractor = new FieldExtractor();

	private static JsonObject json(String text) {
		return JsonParser.parseString(text).getAsJsonObject();
	}

	@Test
	public void testStringArrayAndObjectFields() {
		JsonObject document = json("""
				{
				  "_id": "x",
				  "title": "Red Fox",
				  "tags": ["a", 1, "b", ["nested"], {"k": "v"}],
				  "meta": {"author": "Ann", "year": 2020, "inner": {"k": "deep"}},
				  "missing": null
				}
				""");

		String text = extractor.extract(document, List.of("title", "tags", "meta", "missing", "absent"));

		assertEquals("Red Fox a b Ann ", text);
	}

	@Test
	public void testFieldOrderFollowsConfiguration() {
		JsonObject document = json("{\"title\": \"Red Fox\", \"tags\": [\"a\", \"b\"]}");

		assertEquals("a b Red Fox ", extractor.extract(document, List.of("tags", "title")));
	}

	@Test
	public void testNonStringScalarsContributeNothing() {
		JsonObject document = json("{\"count\": 5, \"flag\": true, \"title\": \"\"}");

		assertEquals("", extractor.extract(document, List.of("count", "flag")));
		assertEquals(" ", extractor.extract(document, List.of("title")));
	}

	@Test
	public void testNoFields() {
		JsonObject document = json("{\"title\": \"Red Fox\"}");

		assertEquals("", extractor.extract(document, List.of()));
	}
}
