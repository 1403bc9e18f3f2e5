package org.fuzzdex.core.exception;

/**
 * Base type of the recoverable failures raised while ingesting, updating or reading back documents.
 */
public class DocumentIndexException extends Exception {
	public DocumentIndexException(String message) {
		super(message);
	}

	public DocumentIndexException(String message, Throwable cause) {
		super(message, cause);
	}
}
