package io.vena.folio.util;

import io.vena.folio.exceptions.MappingException;
import java.lang.reflect.AccessibleObject;
import java.lang.reflect.Field;
import java.lang.reflect.InaccessibleObjectException;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.List;
import org.objenesis.Objenesis;
import org.objenesis.ObjenesisStd;

import static java.lang.reflect.Modifier.isStatic;
import static java.lang.reflect.Modifier.isTransient;

public final class ReflectionHelpers {
	private static final Objenesis OBJENESIS = new ObjenesisStd(true);

	private ReflectionHelpers() { }

	public static <T extends AccessibleObject> T setAccessible(T object) {
		try {
			object.setAccessible(true);
		} catch (InaccessibleObjectException | SecurityException e) {
			throw new MappingException("Unable to access " + object, e);
		}
		return object;
	}

	/**
	 * Creates an instance without running any constructor or field initializer.
	 */
	public static <T> T instantiateWithoutConstructor(Class<T> type) {
		if (type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
			throw new MappingException("Cannot instantiate abstract type " + type.getName());
		}
		return type.cast(OBJENESIS.newInstance(type));
	}

	/**
	 * @return true for fields that hold per-instance state worth persisting:
	 * not static, not transient, not compiler-generated.
	 */
	public static boolean isInstanceState(Field field) {
		int modifiers = field.getModifiers();
		return !isStatic(modifiers) && !isTransient(modifiers) && !field.isSynthetic();
	}

	/**
	 * @return instance-state fields of <code>type</code> and its superclasses, superclass fields first.
	 */
	public static List<Field> instanceFields(Class<?> type) {
		List<Field> result = new ArrayList<>();
		if (type.getSuperclass() != null && type.getSuperclass() != Object.class) {
			result.addAll(instanceFields(type.getSuperclass()));
		}
		for (Field field: type.getDeclaredFields()) {
			if (isInstanceState(field)) {
				result.add(field);
			}
		}
		return result;
	}

	public static Object getField(Field field, Object receiver) {
		try {
			return setAccessible(field).get(receiver);
		} catch (IllegalAccessException e) {
			throw new MappingException("Unable to read " + field, e);
		}
	}

	public static void setField(Field field, Object receiver, Object value) {
		try {
			setAccessible(field).set(receiver, value);
		} catch (IllegalAccessException | IllegalArgumentException e) {
			throw new MappingException("Unable to assign " + field + " = " + value, e);
		}
	}

}
