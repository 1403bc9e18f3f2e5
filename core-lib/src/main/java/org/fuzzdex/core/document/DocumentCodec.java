package org.fuzzdex.core.document;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.fuzzdex.core.exception.MalformedPayloadException;
import org.fuzzdex.core.exception.MissingIdentifierException;

/**
 * Converts documents to the payload strings kept by the document store and back.
 * Payloads keep every member, null-valued ones included.
 */
public class DocumentCodec {
	private final Gson gson;

	public DocumentCodec() {
		this.gson = new GsonBuilder().serializeNulls().create();
	}

	/**
	 * Serialize a document to its stored payload form
	 */
	public String toPayload(JsonObject document) {
		return gson.toJson(document);
	}

	/**
	 * Parse a stored payload back into a document
	 */
	public JsonObject parse(String payload) throws MalformedPayloadException {
		if (payload == null) {
			throw new MalformedPayloadException("Payload is missing");
		}

		JsonElement parsed;
		try {
			parsed = JsonParser.parseString(payload);
		} catch (JsonParseException e) {
			throw new MalformedPayloadException("Payload is not valid JSON: " + e.getMessage(), e);
		}

		if (!parsed.isJsonObject()) {
			throw new MalformedPayloadException("Payload is not a JSON object");
		}
		return parsed.getAsJsonObject();
	}

	/**
	 * Read the external id of a document
	 */
	public String externalId(JsonObject document, String idField) throws MissingIdentifierException {
		JsonElement id = document.get(idField);
		if (id == null || !id.isJsonPrimitive() || !id.getAsJsonPrimitive().isString()) {
			throw new MissingIdentifierException(idField);
		}
		return id.getAsString();
	}
}
