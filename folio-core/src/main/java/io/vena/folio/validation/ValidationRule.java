package io.vena.folio.validation;

import java.util.List;

public record ValidationRule(
	String predicate,
	List<String> args,
	Validator validator
) {
	public boolean test(Object value) {
		return validator.test(value, args);
	}

	@Override
	public String toString() {
		return args.isEmpty() ? predicate : predicate + args;
	}
}
