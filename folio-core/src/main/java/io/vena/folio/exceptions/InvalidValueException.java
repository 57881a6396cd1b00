package io.vena.folio.exceptions;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Thrown when a property value fails validation while building a document
 * for persistence. No command is sent to the document store when this happens.
 */
@Getter
@Accessors(fluent = true)
public class InvalidValueException extends RuntimeException {
	private final Kind kind;
	private final String field;
	private final transient Object value;

	public enum Kind {
		MISSING_REQUIRED,
		PREDICATE_FAILED,
	}

	public InvalidValueException(Kind kind, String field, Object value, String message) {
		super(message);
		this.kind = kind;
		this.field = field;
		this.value = value;
	}

	public static InvalidValueException missingRequired(String field) {
		return new InvalidValueException(Kind.MISSING_REQUIRED, field, null, "Unexpected empty value for property " + field);
	}

	public static InvalidValueException predicateFailed(String field, Object value, String predicate) {
		return new InvalidValueException(Kind.PREDICATE_FAILED, field, value, "Invalid value for " + field + " (" + value + "): failed " + predicate);
	}
}
