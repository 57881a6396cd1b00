package io.vena.folio.annotations;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * The name to use for this property in stored documents.
 */
@Retention(RUNTIME)
@Target(FIELD)
public @interface Field {
	String value();
}
