package io.vena.folio.validation;

import io.vena.folio.exceptions.ConfigurationException;
import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.vena.folio.util.ReflectionHelpers.setAccessible;

/**
 * Resolves the predicate names used in {@link io.vena.folio.annotations.Validate}.
 *
 * <p>
 * Names are looked up among registered validators first. A name of the form
 * <code>com.example.Checks::isPositive</code> refers to a public static method
 * returning <code>boolean</code> and taking either the value alone, or the value
 * and a <code>List&lt;String&gt;</code> of arguments.
 */
public final class ValidatorRegistry {
	private final Map<String, Validator> validators = new ConcurrentHashMap<>();

	private ValidatorRegistry() { }

	public static ValidatorRegistry empty() {
		return new ValidatorRegistry();
	}

	public static ValidatorRegistry withBuiltIns() {
		ValidatorRegistry result = new ValidatorRegistry();
		BuiltInValidators.registerAll(result);
		return result;
	}

	public ValidatorRegistry register(String name, Validator validator) {
		Validator previous = validators.put(name, validator);
		if (previous != null) {
			LOGGER.debug("Validator \"{}\" replaced", name);
		}
		return this;
	}

	public ValidationRule rule(String name, List<String> args) {
		return new ValidationRule(name, List.copyOf(args), resolve(name));
	}

	/**
	 * @throws ConfigurationException if <code>name</code> can't be resolved
	 */
	public Validator resolve(String name) {
		Validator registered = validators.get(name);
		if (registered != null) {
			return registered;
		}
		int separator = name.indexOf("::");
		if (separator > 0) {
			return staticMethodValidator(name.substring(0, separator), name.substring(separator + 2));
		}
		throw new ConfigurationException("Unknown validator \"" + name + "\"");
	}

	private static Validator staticMethodValidator(String className, String methodName) {
		Class<?> owner;
		try {
			owner = Class.forName(className);
		} catch (ClassNotFoundException e) {
			throw new ConfigurationException("Unknown validator class " + className, e);
		}
		for (Method method: owner.getDeclaredMethods()) {
			if (!method.getName().equals(methodName)) {
				continue;
			}
			int modifiers = method.getModifiers();
			if (!Modifier.isStatic(modifiers) || !Modifier.isPublic(modifiers)) {
				throw new ConfigurationException("Validator method " + className + "::" + methodName + " must be public and static");
			}
			if (method.getReturnType() != boolean.class && method.getReturnType() != Boolean.class) {
				throw new ConfigurationException("Validator method " + className + "::" + methodName + " must return boolean");
			}
			MethodHandle handle;
			try {
				handle = MethodHandles.lookup().unreflect(setAccessible(method));
			} catch (IllegalAccessException e) {
				throw new ConfigurationException("Validator method " + className + "::" + methodName + " is not accessible", e);
			}
			switch (method.getParameterCount()) {
				case 1:
					return (value, args) -> invoke(handle, value);
				case 2:
					return (value, args) -> invoke(handle, value, args);
				default:
					throw new ConfigurationException("Validator method " + className + "::" + methodName + " must take one or two parameters");
			}
		}
		throw new ConfigurationException("No method " + methodName + " in validator class " + className);
	}

	private static boolean invoke(MethodHandle handle, Object... args) {
		try {
			return (Boolean) handle.invokeWithArguments(args);
		} catch (RuntimeException | Error e) {
			throw e;
		} catch (Throwable e) {
			throw new IllegalStateException("Validator " + handle + " failed", e);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ValidatorRegistry.class);
}
