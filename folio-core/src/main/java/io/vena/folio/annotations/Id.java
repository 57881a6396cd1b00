package io.vena.folio.annotations;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Marks the identifier property. It is always stored as <code>_id</code>.
 */
@Retention(RUNTIME)
@Target(FIELD)
public @interface Id {
}
