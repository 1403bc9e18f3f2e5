package org.fuzzdex.core.exception;

/**
 * Thrown when a stored payload can no longer be parsed back into a JSON object.
 */
public class MalformedPayloadException extends DocumentIndexException {
	public MalformedPayloadException(String message) {
		super(message);
	}

	public MalformedPayloadException(String message, Throwable cause) {
		super(message, cause);
	}
}
