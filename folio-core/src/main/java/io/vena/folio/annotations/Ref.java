package io.vena.folio.annotations;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Stores the property as a pointer to a document in the target's own collection
 * instead of embedding it. The field must be declared as
 * {@link io.vena.folio.Reference} or {@link Object}.
 */
@Retention(RUNTIME)
@Target(FIELD)
public @interface Ref {
	/**
	 * Target fields to copy into the pointer's <code>__cache</code>
	 * so they can be read without resolving it.
	 */
	String[] with() default {};
}
