package io.vena.folio.exceptions;

import lombok.Getter;

/**
 * A {@link io.vena.folio.DocumentStore} command was rejected by the database,
 * for example because it would violate a unique index.
 */
@Getter
public class CommandFailedException extends RuntimeException {
	/**
	 * The database's error code, or 0 if it gave none.
	 */
	private final int code;

	public CommandFailedException(int code, String message) {
		super(message);
		this.code = code;
	}

	public CommandFailedException(int code, String message, Throwable cause) {
		super(message, cause);
		this.code = code;
	}

	public CommandFailedException(String message) { this(0, message); }
	public CommandFailedException(String message, Throwable cause) { super(message, cause); this.code = 0; }
	public CommandFailedException(Throwable cause) { super(cause); this.code = 0; }
}
