package io.vena.folio.validation;

import java.util.List;

/**
 * A named predicate applied to non-empty property values before they are persisted.
 */
@FunctionalInterface
public interface Validator {
	/**
	 * @param value the property's Java value; never null
	 * @param args the arguments given in {@link io.vena.folio.annotations.Validate#args()}
	 */
	boolean test(Object value, List<String> args);
}
