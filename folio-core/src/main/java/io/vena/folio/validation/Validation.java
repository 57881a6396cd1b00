package io.vena.folio.validation;

import io.vena.folio.exceptions.InvalidValueException;
import java.lang.reflect.Array;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.bson.BsonNull;
import org.bson.BsonString;
import org.jetbrains.annotations.Nullable;

public final class Validation {
	private Validation() { }

	/**
	 * Predicates are applied only when the value is non-empty,
	 * so an optional property may always be left unset.
	 *
	 * @throws InvalidValueException if a required value is empty or a predicate rejects the value
	 */
	public static void validate(String fieldName, @Nullable Object value, boolean required, List<ValidationRule> rules) {
		if (isEmpty(value)) {
			if (required) {
				throw InvalidValueException.missingRequired(fieldName);
			}
			return;
		}
		for (ValidationRule rule: rules) {
			if (!rule.test(value)) {
				throw InvalidValueException.predicateFailed(fieldName, value, rule.toString());
			}
		}
	}

	public static boolean isEmpty(@Nullable Object value) {
		if (value == null || value instanceof BsonNull) {
			return true;
		} else if (value instanceof CharSequence s) {
			return s.length() == 0;
		} else if (value instanceof BsonString s) {
			return s.getValue().isEmpty();
		} else if (value instanceof Collection<?> c) {
			return c.isEmpty();
		} else if (value instanceof Map<?, ?> m) {
			return m.isEmpty();
		} else if (value instanceof BsonArray a) {
			return a.isEmpty();
		} else if (value instanceof BsonDocument d) {
			return d.isEmpty();
		} else if (value.getClass().isArray()) {
			return Array.getLength(value) == 0;
		} else {
			return false;
		}
	}
}
