package org.fuzzdex.core.document;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import java.util.List;
import java.util.Map;

/**
 * Flattens the configured fields of a document into one searchable text blob.
 *
 * <p>For each field, in order: a string value is appended; for an array every string element is
 * appended; for an object the string value of every direct member is appended. Each appended piece is
 * followed by a single space. Nested arrays and objects are not traversed, and any other value
 * contributes nothing. The result is not trimmed.</p>
 */
public class FieldExtractor {

	public String extract(JsonObject document, List<String> fields) {
		StringBuilder text = new StringBuilder();

		for (String field : fields) {
			JsonElement value = document.get(field);
			if (value == null || value.isJsonNull()) {
				continue;
			}

			if (value.isJsonPrimitive()) {
				appendIfString(text, value);
			} else if (value.isJsonArray()) {
				JsonArray array = value.getAsJsonArray();
				for (JsonElement element : array) {
					appendIfString(text, element);
				}
			} else if (value.isJsonObject()) {
				for (Map.Entry<String, JsonElement> member : value.getAsJsonObject().entrySet()) {
					appendIfString(text, member.getValue());
				}
			}
		}

		return text.toString();
	}

	private static void appendIfString(StringBuilder text, JsonElement element) {
		if (element == null || !element.isJsonPrimitive()) {
			return;
		}
		JsonPrimitive primitive = element.getAsJsonPrimitive();
		if (primitive.isString()) {
			text.append(primitive.getAsString()).append(' ');
		}
	}
}
