package io.vena.folio.util;

import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.util.Collection;
import java.util.Map;

public final class Types {
	private Types() { }

	public static Class<?> rawClass(Type sourceType) {
		if (sourceType instanceof Class<?> c) {
			return c;
		} else if (sourceType instanceof ParameterizedType p) {
			return (Class<?>) p.getRawType();
		} else if (sourceType instanceof GenericArrayType g) {
			return java.lang.reflect.Array.newInstance(rawClass(g.getGenericComponentType()), 0).getClass();
		} else if (sourceType instanceof WildcardType w) {
			return rawClass(w.getUpperBounds()[0]);
		} else if (sourceType instanceof TypeVariable<?> v) {
			return rawClass(v.getBounds()[0]);
		} else {
			return Object.class;
		}
	}

	/**
	 * @return the element type of an array or {@link Collection} type,
	 * or {@link Object} if it can't be determined.
	 */
	public static Type elementType(Type containerType) {
		if (containerType instanceof GenericArrayType g) {
			return g.getGenericComponentType();
		}
		Class<?> raw = rawClass(containerType);
		if (raw.isArray()) {
			return raw.getComponentType();
		} else if (Collection.class.isAssignableFrom(raw)) {
			return typeArgument(containerType, 0);
		} else {
			return Object.class;
		}
	}

	/**
	 * @return the value type of a {@link Map} type, or {@link Object} if it can't be determined.
	 */
	public static Type mapValueType(Type mapType) {
		return typeArgument(mapType, 1);
	}

	public static Type typeArgument(Type type, int index) {
		if (type instanceof ParameterizedType p && p.getActualTypeArguments().length > index) {
			Type result = p.getActualTypeArguments()[index];
			return (result instanceof Class<?> || result instanceof ParameterizedType || result instanceof GenericArrayType)
				? result
				: rawClass(result);
		}
		return Object.class;
	}

	public static Class<?> boxed(Class<?> type) {
		if (!type.isPrimitive()) {
			return type;
		} else if (type == int.class) {
			return Integer.class;
		} else if (type == long.class) {
			return Long.class;
		} else if (type == double.class) {
			return Double.class;
		} else if (type == float.class) {
			return Float.class;
		} else if (type == boolean.class) {
			return Boolean.class;
		} else if (type == short.class) {
			return Short.class;
		} else if (type == byte.class) {
			return Byte.class;
		} else if (type == char.class) {
			return Character.class;
		} else {
			return Void.class;
		}
	}
}
