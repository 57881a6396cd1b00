package io.vena.folio.validation;

import io.vena.folio.exceptions.ConfigurationException;
import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

final class BuiltInValidators {
	private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");
	private static final Pattern INTEGER = Pattern.compile("^[-+]?\\d+$");

	private BuiltInValidators() { }

	static void registerAll(ValidatorRegistry registry) {
		Validator email = (value, args) -> value instanceof CharSequence s && EMAIL.matcher(s).matches();
		Validator integer = (value, args) -> isInteger(value);
		registry
			.register("email", email)
			.register("is_email", email)
			.register("integer", integer)
			.register("is_integer", integer)
			.register("between", BuiltInValidators::between)
			.register("length", BuiltInValidators::length)
			.register("matches", (value, args) -> Pattern.compile(arg(args, 0, "matches")).matcher(value.toString()).find())
			.register("one_of", (value, args) -> args.contains(value instanceof Enum<?> e ? e.name() : value.toString()));
	}

	private static boolean isInteger(Object value) {
		if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
			return true;
		}
		return value instanceof CharSequence s && INTEGER.matcher(s).matches();
	}

	private static boolean between(Object value, List<String> args) {
		BigDecimal min = new BigDecimal(arg(args, 0, "between"));
		BigDecimal max = new BigDecimal(arg(args, 1, "between"));
		BigDecimal number;
		if (value instanceof Number n) {
			number = new BigDecimal(n.toString());
		} else {
			try {
				number = new BigDecimal(value.toString().trim());
			} catch (NumberFormatException e) {
				return false;
			}
		}
		return number.compareTo(min) >= 0 && number.compareTo(max) <= 0;
	}

	private static boolean length(Object value, List<String> args) {
		int min = Integer.parseInt(arg(args, 0, "length"));
		int max = args.size() > 1 ? Integer.parseInt(args.get(1)) : Integer.MAX_VALUE;
		int length;
		if (value instanceof CharSequence s) {
			length = s.length();
		} else if (value instanceof Collection<?> c) {
			length = c.size();
		} else if (value instanceof Map<?, ?> m) {
			length = m.size();
		} else if (value.getClass().isArray()) {
			length = Array.getLength(value);
		} else {
			return false;
		}
		return min <= length && length <= max;
	}

	private static String arg(List<String> args, int index, String validator) {
		if (args.size() <= index) {
			throw new ConfigurationException("Validator \"" + validator + "\" requires at least " + (index + 1) + " argument" + (index == 0 ? "" : "s"));
		}
		return args.get(index);
	}
}
