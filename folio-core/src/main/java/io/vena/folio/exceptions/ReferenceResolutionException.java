package io.vena.folio.exceptions;

/**
 * The document a {@link io.vena.folio.Reference} points to could not be loaded.
 * Raised on the first dereference, never during hydration.
 */
public class ReferenceResolutionException extends RuntimeException {
	public ReferenceResolutionException(String message) { super(message); }
	public ReferenceResolutionException(String message, Throwable cause) { super(message, cause); }
	public ReferenceResolutionException(Throwable cause) { super(cause); }
}
