package org.fuzzdex.core.document;

import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import org.fuzzdex.core.exception.MalformedPayloadException;
import org.fuzzdex.core.exception.MissingIdentifierException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class DocumentCodecTest {

	private final DocumentCodec codec = new DocumentCodec();

	@Test
	public void testPayloadParsesBackToSameDocument() throws Exception {
		JsonObject document = new JsonObject();
		document.addProperty("_id", "a");
		document.addProperty("title", "red fox");

		String payload = codec.toPayload(document);

		assertEquals(document, codec.parse(payload));
	}

	@Test
	public void testNullMembersSurviveStorage() throws Exception {
		JsonObject document = new JsonObject();
		document.addProperty("_id", "a");
		document.addProperty("title", "red fox");
		document.add("subtitle", JsonNull.INSTANCE);

		String payload = codec.toPayload(document);

		assertEquals("{\"_id\":\"a\",\"title\":\"red fox\",\"subtitle\":null}", payload);
		JsonObject parsed = codec.parse(payload);
		assertEquals(document, parsed);
		assertTrue(parsed.has("subtitle"));
		assertTrue(parsed.get("subtitle").isJsonNull());
	}

	@Test
	public void testMalformedPayloads() {
		assertThrows(MalformedPayloadException.class, () -> codec.parse("{broken"));
		assertThrows(MalformedPayloadException.class, () -> codec.parse("[1, 2]"));
		assertThrows(MalformedPayloadException.class, () -> codec.parse(""));
		assertThrows(MalformedPayloadException.class, () -> codec.parse("\"just text\""));
		assertThrows(MalformedPayloadException.class, () -> codec.parse("{} {}"));
		assertThrows(MalformedPayloadException.class, () -> codec.parse(null));
	}

	@Test
	public void testExternalId() throws Exception {
		JsonObject document = new JsonObject();
		document.addProperty("_id", "doc-1");

		assertEquals("doc-1", codec.externalId(document, "_id"));
	}

	@Test
	public void testMissingOrNonStringId() {
		JsonObject noId = new JsonObject();
		noId.addProperty("title", "x");

		JsonObject numericId = new JsonObject();
		numericId.addProperty("_id", 7);

		MissingIdentifierException e = assertThrows(MissingIdentifierException.class,
				() -> codec.externalId(noId, "_id"));
		assertEquals("_id", e.getIdField());
		assertThrows(MissingIdentifierException.class, () -> codec.externalId(numericId, "_id"));
	}
}
