package io.vena.folio.exceptions;

public class MappingException extends IllegalStateException {
	public MappingException(String message) { super(message); }
	public MappingException(String message, Throwable cause) { super(message, cause); }
	public MappingException(Throwable cause) { super(cause); }
}
