package io.vena.folio.exceptions;

/**
 * Indicates that a mapped type, hook, observer, or validator is declared in a way
 * Folio can't use. These are programming errors: they surface immediately and
 * retrying the same operation will fail the same way.
 */
public class ConfigurationException extends RuntimeException {
	public ConfigurationException(String message) { super(message); }
	public ConfigurationException(String message, Throwable cause) { super(message, cause); }
	public ConfigurationException(Throwable cause) { super(cause); }
}
