package org.fuzzdex.core.exception;

/**
 * Thrown when an update names an external id the index does not know.
 */
public class UnknownIdentifierException extends DocumentIndexException {
	private final String externalId;

	public UnknownIdentifierException(String externalId) {
		super("Document '" + externalId + "' is not indexed");
		this.externalId = externalId;
	}

	public String getExternalId() {
		return externalId;
	}
}
