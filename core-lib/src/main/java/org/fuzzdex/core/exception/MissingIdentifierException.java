package org.fuzzdex.core.exception;

/**
 * Thrown when a document has no identifier field, or the field does not hold a string.
 */
public class MissingIdentifierException extends DocumentIndexException {
	private final String idField;

	public MissingIdentifierException(String idField) {
		super("Document has no string identifier in field '" + idField + "'");
		this.idField = idField;
	}

	public String getIdField() {
		return idField;
	}
}
