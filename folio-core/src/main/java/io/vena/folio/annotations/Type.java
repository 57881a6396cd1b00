package io.vena.folio.annotations;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Overrides the type Folio would otherwise infer from the field's Java type.
 *
 * <p>
 * Scalars are coerced to the declared type when serialized.
 * <code>@Type(value = ARRAY, element = INT)</code> declares the element type of a list;
 * <code>@Type(value = OBJECT, of = Address.class)</code> pins the class of an embedded object,
 * so documents of exactly that class need no <code>__type</code> discriminator.
 */
@Retention(RUNTIME)
@Target(FIELD)
public @interface Type {
	ValueType value();

	ValueType element() default ValueType.NONE;

	Class<?> of() default Object.class;
}
