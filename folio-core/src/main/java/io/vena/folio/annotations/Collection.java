package io.vena.folio.annotations;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.TYPE;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Names the collection a type is stored in. Without it, the collection
 * name is the lower-cased plural of the class's simple name.
 */
@Retention(RUNTIME)
@Target(TYPE)
public @interface Collection {
	String value();
}
