package org.fuzzdex.indexing;

import com.google.gson.JsonObject;
import org.fuzzdex.core.document.DocumentCodec;
import org.fuzzdex.core.document.FieldExtractor;
import org.fuzzdex.core.exception.DuplicateIdentifierException;
import org.fuzzdex.core.exception.MalformedPayloadException;
import org.fuzzdex.core.exception.MissingIdentifierException;
import org.fuzzdex.core.exception.UnknownIdentifierException;
import org.fuzzdex.core.text.NGramTokenizer;
import org.fuzzdex.core.text.Tokenizer;
import org.fuzzdex.indexing.config.IndexConfig;
import org.fuzzdex.indexing.index.InvertedIndex;
import org.fuzzdex.indexing.index.MemoryInvertedIndex;
import org.fuzzdex.indexing.index.PostingsReader;
import org.fuzzdex.indexing.index.ReadOnlyPostings;
import org.fuzzdex.indexing.service.Indexer;
import org.fuzzdex.indexing.store.DocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * One index: the document store, the inverted index over the configured fields, and the write
 * operations that keep both in step.
 *
 * <p>Not thread-safe. A single owner mutates it; callers sharing an instance must serialize access
 * themselves.</p>
 */
public class DocumentIndex {
	private static final Logger logger = LoggerFactory.getLogger(DocumentIndex.class);

	private final IndexConfig config;
	private final DocumentStore store;
	private final InvertedIndex invertedIndex;
	private final PostingsReader postingsView;
	private final Tokenizer tokenizer;
	private final Indexer indexer;
	private final FieldExtractor fieldExtractor;
	private final DocumentCodec codec;

	public DocumentIndex(IndexConfig config) {
		this(config, new NGramTokenizer(config.gramSize()));
	}

	public DocumentIndex(IndexConfig config, Tokenizer tokenizer) {
		this(config, tokenizer, new MemoryInvertedIndex());
	}

	/**
	 * @param invertedIndex an empty index this instance takes ownership of
	 */
	public DocumentIndex(IndexConfig config, Tokenizer tokenizer, InvertedIndex invertedIndex) {
		this.config = Objects.requireNonNull(config, "config");
		this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer");
		this.store = new DocumentStore();
		this.invertedIndex = Objects.requireNonNull(invertedIndex, "invertedIndex");
		this.postingsView = new ReadOnlyPostings(invertedIndex);
		this.indexer = new Indexer(invertedIndex, tokenizer, config.weights());
		this.fieldExtractor = new FieldExtractor();
		this.codec = new DocumentCodec();

		logger.info("Created index over fields {} (id field '{}')", config.fields(), config.idField());
	}

	public static DocumentIndex create(List<String> fields) {
		return new DocumentIndex(IndexConfig.defaults(fields));
	}

	/**
	 * Drop every document and posting and restart internal ids at zero. The field configuration stays.
	 */
	public void clear() {
		store.clear();
		invertedIndex.clear();
		logger.info("Cleared index over fields {}", config.fields());
	}

	/**
	 * Add a document under the external id held in its id field
	 * @return the internal id assigned to the document
	 */
	public int addObject(JsonObject document) throws MissingIdentifierException, DuplicateIdentifierException {
		Objects.requireNonNull(document, "document");
		String externalId = codec.externalId(document, config.idField());
		String text = extractText(document);

		return add(externalId, codec.toPayload(document), text);
	}

	/**
	 * Store a payload under a new external id and index the given text for it
	 * @return the internal id assigned to the document
	 */
	public int add(String externalId, String payload, String text) throws DuplicateIdentifierException {
		int internalId = store.register(externalId, payload);
		indexer.indexDocument(internalId, text);
		return internalId;
	}

	/**
	 * Replace the stored payload of a known document and rebuild its postings
	 */
	public void update(JsonObject document) throws MissingIdentifierException, UnknownIdentifierException {
		Objects.requireNonNull(document, "document");
		String externalId = codec.externalId(document, config.idField());
		OptionalInt internalId = store.internalId(externalId);
		if (internalId.isEmpty()) {
			throw new UnknownIdentifierException(externalId);
		}

		int iid = internalId.getAsInt();
		store.replace(iid, codec.toPayload(document));
		indexer.reindexDocument(iid, extractText(document));
		logger.debug("Updated document '{}' ({})", externalId, iid);
	}

	/**
	 * Remove a document and all its postings
	 * @return false if the external id is unknown, in which case nothing changes
	 */
	public boolean remove(String externalId) {
		OptionalInt internalId = store.remove(externalId);
		if (internalId.isEmpty()) {
			return false;
		}

		int removed = invertedIndex.removeDocument(internalId.getAsInt());
		logger.debug("Removed document '{}' ({}) with {} postings", externalId, internalId.getAsInt(), removed);
		return true;
	}

	public Optional<JsonObject> get(String externalId) throws MalformedPayloadException {
		OptionalInt internalId = store.internalId(externalId);
		if (internalId.isEmpty()) {
			return Optional.empty();
		}
		return Optional.of(document(internalId.getAsInt()));
	}

	/**
	 * Re-materialize the stored document of an internal id
	 */
	public JsonObject document(int internalId) throws MalformedPayloadException {
		String payload = store.payload(internalId)
				.orElseThrow(() -> new MalformedPayloadException("No payload stored for internal id " + internalId));
		return codec.parse(payload);
	}

	/**
	 * Flatten the configured fields of a document and trim the result, ready for tokenization
	 */
	public String extractText(JsonObject document) {
		return fieldExtractor.extract(document, config.fields()).trim();
	}

	public boolean contains(String externalId) {
		return store.contains(externalId);
	}

	public int size() {
		return store.size();
	}

	public IndexStats getStats() {
		return new IndexStats(store.size(), invertedIndex.tokenCount(), invertedIndex.postingCount());
	}

	public IndexConfig config() {
		return config;
	}

	public OptionalInt internalId(String externalId) {
		return store.internalId(externalId);
	}

	public Optional<String> externalId(int internalId) {
		return store.externalId(internalId);
	}

	/**
	 * Internal ids of every stored document, in insertion order
	 */
	public Collection<Integer> internalIds() {
		return store.internalIds();
	}

	/**
	 * Read-only view of the postings; writes go through {@link #add}, {@link #update} and {@link #remove}
	 */
	public PostingsReader postings() {
		return postingsView;
	}

	public Tokenizer tokenizer() {
		return tokenizer;
	}

	public FieldExtractor fieldExtractor() {
		return fieldExtractor;
	}

	public DocumentCodec codec() {
		return codec;
	}

	public record IndexStats(int documents, int uniqueTokens, int postings) {}
}
