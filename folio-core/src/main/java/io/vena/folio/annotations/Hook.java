package io.vena.folio.annotations;

import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.METHOD;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Registers a method to be called on the object when a lifecycle event fires.
 *
 * <p>
 * The value is any alias from {@link io.vena.folio.events.EventKind},
 * such as <code>"saving"</code>, <code>"before_save"</code> or <code>"beforeSave"</code>.
 * Hook methods must be public. A hook method may take no parameters, or
 * a single <code>List&lt;String&gt;</code> that receives {@link #args()}.
 */
@Retention(RUNTIME)
@Target(METHOD)
@Repeatable(Hook.List.class)
public @interface Hook {
	String value();

	String[] args() default {};

	@Retention(RUNTIME)
	@Target(METHOD)
	@interface List {
		Hook[] value();
	}
}
