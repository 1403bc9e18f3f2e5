package org.fuzzdex.indexing.store;

import org.fuzzdex.core.exception.DuplicateIdentifierException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Identity map and payload storage.
 *
 * <p>External ids map one-to-one onto dense internal ids handed out from a counter that only moves
 * forward, so an id is never reused until {@link #clear()}. Payloads are kept in insertion order.</p>
 */
public class DocumentStore {
	private static final Logger logger = LoggerFactory.getLogger(DocumentStore.class);

	private final Map<String, Integer> internalIds;
	private final Map<Integer, String> externalIds;
	private final Map<Integer, String> payloads;
	private int idCounter;

	public DocumentStore() {
		this.internalIds = new HashMap<>();
		this.externalIds = new HashMap<>();
		this.payloads = new LinkedHashMap<>();
		this.idCounter = 0;
	}

	/**
	 * Assign the next internal id to a new document and store its payload
	 */
	public int register(String externalId, String payload) throws DuplicateIdentifierException {
		if (internalIds.containsKey(externalId)) {
			throw new DuplicateIdentifierException(externalId);
		}

		int internalId = idCounter;
		try {
			idCounter = Math.incrementExact(idCounter);
		} catch (ArithmeticException e) {
			throw new IllegalStateException("Internal id space exhausted", e);
		}

		internalIds.put(externalId, internalId);
		externalIds.put(internalId, externalId);
		payloads.put(internalId, payload);

		logger.debug("Registered document '{}' as {}", externalId, internalId);
		return internalId;
	}

	/**
	 * Replace the payload of an already registered document
	 */
	public void replace(int internalId, String payload) {
		if (!payloads.containsKey(internalId)) {
			throw new IllegalArgumentException("No document stored under internal id " + internalId);
		}
		payloads.put(internalId, payload);
	}

	/**
	 * Forget a document
	 * @return the internal id it was stored under, empty if the external id is unknown
	 */
	public OptionalInt remove(String externalId) {
		Integer internalId = internalIds.remove(externalId);
		if (internalId == null) {
			return OptionalInt.empty();
		}
		externalIds.remove(internalId);
		payloads.remove(internalId);
		return OptionalInt.of(internalId);
	}

	public OptionalInt internalId(String externalId) {
		Integer internalId = internalIds.get(externalId);
		return internalId == null ? OptionalInt.empty() : OptionalInt.of(internalId);
	}

	public Optional<String> externalId(int internalId) {
		return Optional.ofNullable(externalIds.get(internalId));
	}

	public Optional<String> payload(int internalId) {
		return Optional.ofNullable(payloads.get(internalId));
	}

	public boolean contains(String externalId) {
		return internalIds.containsKey(externalId);
	}

	/**
	 * Get every stored payload, in insertion order
	 */
	public Collection<String> payloads() {
		return Collections.unmodifiableCollection(payloads.values());
	}

	/**
	 * Get every internal id currently stored, in insertion order
	 */
	public Collection<Integer> internalIds() {
		return Collections.unmodifiableCollection(payloads.keySet());
	}

	public int size() {
		return payloads.size();
	}

	/**
	 * Next internal id that {@link #register} will hand out
	 */
	public int nextId() {
		return idCounter;
	}

	/**
	 * Drop every document and reset the id counter
	 */
	public void clear() {
		internalIds.clear();
		externalIds.clear();
		payloads.clear();
		idCounter = 0;
		logger.info("Cleared document store");
	}
}
