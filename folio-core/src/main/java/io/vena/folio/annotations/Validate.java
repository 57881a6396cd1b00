package io.vena.folio.annotations;

import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Attaches a named predicate to a property. The name is looked up in the
 * {@link io.vena.folio.validation.ValidatorRegistry}, or may be written as
 * <code>com.example.Checks::isPositive</code> to call a static method.
 */
@Retention(RUNTIME)
@Target(FIELD)
@Repeatable(Validate.List.class)
public @interface Validate {
	String value();

	String[] args() default {};

	@Retention(RUNTIME)
	@Target(FIELD)
	@interface List {
		Validate[] value();
	}
}
