package io.vena.folio.annotations;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.TYPE;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Subclasses of the annotated type are stored in the annotated type's collection,
 * and their documents carry a <code>__type</code> discriminator.
 */
@Retention(RUNTIME)
@Target(TYPE)
public @interface SingleCollection {
}
