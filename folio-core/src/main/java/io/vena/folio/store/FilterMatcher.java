package io.vena.folio.store;

import java.util.List;
import java.util.Map;
import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.bson.BsonValue;
import org.jetbrains.annotations.Nullable;

/**
 * Evaluates query filters against documents, following MongoDB's matching rules
 * for the operators it supports.
 */
final class FilterMatcher {
	private FilterMatcher() { }

	static boolean matches(BsonDocument document, BsonDocument filter) {
		for (Map.Entry<String, BsonValue> entry: filter.entrySet()) {
			String key = entry.getKey();
			BsonValue condition = entry.getValue();
			switch (key) {
				case "$and":
					for (BsonValue clause: condition.asArray()) {
						if (!matches(document, clause.asDocument())) {
							return false;
						}
					}
					break;
				case "$or":
					if (condition.asArray().stream().noneMatch(c -> matches(document, c.asDocument()))) {
						return false;
					}
					break;
				case "$nor":
					if (condition.asArray().stream().anyMatch(c -> matches(document, c.asDocument()))) {
						return false;
					}
					break;
				default:
					if (!matchesField(resolvePath(document, key), condition)) {
						return false;
					}
			}
		}
		return true;
	}

	private static boolean matchesField(@Nullable BsonValue actual, BsonValue condition) {
		if (isOperatorDocument(condition)) {
			for (Map.Entry<String, BsonValue> op: condition.asDocument().entrySet()) {
				if (!matchesOperator(actual, op.getKey(), op.getValue())) {
					return false;
				}
			}
			return true;
		}
		return equalsOrContains(actual, condition);
	}

	private static boolean matchesOperator(@Nullable BsonValue actual, String operator, BsonValue operand) {
		switch (operator) {
			case "$eq":
				return equalsOrContains(actual, operand);
			case "$ne":
				return !equalsOrContains(actual, operand);
			case "$gt":
				return compares(actual, operand, c -> c > 0);
			case "$gte":
				return compares(actual, operand, c -> c >= 0);
			case "$lt":
				return compares(actual, operand, c -> c < 0);
			case "$lte":
				return compares(actual, operand, c -> c <= 0);
			case "$in":
				return operand.asArray().stream().anyMatch(v -> equalsOrContains(actual, v));
			case "$nin":
				return operand.asArray().stream().noneMatch(v -> equalsOrContains(actual, v));
			case "$exists":
				return (actual != null) == isTruthy(operand);
			case "$not":
				return !matchesField(actual, operand);
			default:
				throw new IllegalArgumentException("Unsupported query operator " + operator);
		}
	}

	private static boolean isOperatorDocument(BsonValue condition) {
		return condition.isDocument()
			&& !condition.asDocument().isEmpty()
			&& condition.asDocument().getFirstKey().startsWith("$");
	}

	/**
	 * A missing field equals null, and an array field matches any of its elements.
	 */
	private static boolean equalsOrContains(@Nullable BsonValue actual, BsonValue expected) {
		if (actual == null) {
			return expected.isNull();
		}
		if (valuesEqual(actual, expected)) {
			return true;
		}
		return actual.isArray() && actual.asArray().stream().anyMatch(v -> valuesEqual(v, expected));
	}

	private static boolean valuesEqual(BsonValue a, BsonValue b) {
		if (a.isNumber() && b.isNumber()) {
			return a.asNumber().doubleValue() == b.asNumber().doubleValue();
		}
		return a.equals(b);
	}

	private interface ComparisonTest {
		boolean test(int comparison);
	}

	private static boolean compares(@Nullable BsonValue actual, BsonValue operand, ComparisonTest test) {
		if (actual == null) {
			return false;
		}
		if (actual.isArray()) {
			return actual.asArray().stream().anyMatch(v -> compares(v, operand, test));
		}
		Integer comparison = compare(actual, operand);
		return comparison != null && test.test(comparison);
	}

	/**
	 * @return null if the values are of types that don't compare
	 */
	static @Nullable Integer compare(BsonValue a, BsonValue b) {
		if (a.isNumber() && b.isNumber()) {
			return Double.compare(a.asNumber().doubleValue(), b.asNumber().doubleValue());
		} else if (a.isString() && b.isString()) {
			return a.asString().getValue().compareTo(b.asString().getValue());
		} else if (a.isDateTime() && b.isDateTime()) {
			return Long.compare(a.asDateTime().getValue(), b.asDateTime().getValue());
		} else if (a.isObjectId() && b.isObjectId()) {
			return a.asObjectId().getValue().compareTo(b.asObjectId().getValue());
		} else if (a.isBoolean() && b.isBoolean()) {
			return Boolean.compare(a.asBoolean().getValue(), b.asBoolean().getValue());
		} else {
			return null;
		}
	}

	private static boolean isTruthy(BsonValue value) {
		if (value.isBoolean()) {
			return value.asBoolean().getValue();
		} else if (value.isNumber()) {
			return value.asNumber().doubleValue() != 0;
		} else {
			return !value.isNull();
		}
	}

	static @Nullable BsonValue resolvePath(BsonDocument document, String path) {
		BsonValue current = document;
		for (String segment: path.split("\\.")) {
			if (current == null) {
				return null;
			} else if (current.isDocument()) {
				current = current.asDocument().get(segment);
			} else if (current.isArray() && isIndex(segment)) {
				BsonArray array = current.asArray();
				int index = Integer.parseInt(segment);
				current = index < array.size() ? array.get(index) : null;
			} else {
				return null;
			}
		}
		return current;
	}

	static void setPath(BsonDocument document, String path, BsonValue value) {
		List<String> segments = List.of(path.split("\\."));
		BsonDocument current = document;
		for (String segment: segments.subList(0, segments.size() - 1)) {
			BsonValue next = current.get(segment);
			if (next == null || !next.isDocument()) {
				next = new BsonDocument();
				current.put(segment, next);
			}
			current = next.asDocument();
		}
		current.put(segments.get(segments.size() - 1), value);
	}

	static void removePath(BsonDocument document, String path) {
		List<String> segments = List.of(path.split("\\."));
		BsonValue current = document;
		for (String segment: segments.subList(0, segments.size() - 1)) {
			if (current == null || !current.isDocument()) {
				return;
			}
			current = current.asDocument().get(segment);
		}
		if (current != null && current.isDocument()) {
			current.asDocument().remove(segments.get(segments.size() - 1));
		}
	}

	private static boolean isIndex(String segment) {
		return !segment.isEmpty() && segment.chars().allMatch(Character::isDigit);
	}
}
