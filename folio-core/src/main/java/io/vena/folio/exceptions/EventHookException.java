package io.vena.folio.exceptions;

/**
 * Wraps a checked exception thrown by a lifecycle hook or observer method.
 * Unchecked exceptions from hooks propagate as-is.
 */
public class EventHookException extends RuntimeException {
	public EventHookException(String message, Throwable cause) { super(message, cause); }
	public EventHookException(Throwable cause) { super(cause); }
}
