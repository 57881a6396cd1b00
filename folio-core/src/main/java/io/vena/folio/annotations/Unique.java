package io.vena.folio.annotations;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Like {@link Index}, but the index enforces uniqueness.
 */
@Retention(RUNTIME)
@Target(FIELD)
public @interface Unique {
	boolean descending() default false;
	boolean sparse() default false;
}
