package org.fuzzdex.core.exception;

/**
 * Thrown when a document is added under an external id that is already indexed.
 */
public class DuplicateIdentifierException extends DocumentIndexException {
	private final String externalId;

	public DuplicateIdentifierException(String externalId) {
		super("Document '" + externalId + "' is already indexed");
		this.externalId = externalId;
	}

	public String getExternalId() {
		return externalId;
	}
}
