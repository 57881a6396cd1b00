package io.vena.folio.metadata;

import io.vena.folio.Reference;
import io.vena.folio.annotations.Type;
import io.vena.folio.annotations.ValueType;
import java.time.temporal.Temporal;
import java.util.Collection;
import java.util.Date;
import java.util.Map;
import org.bson.BsonValue;
import org.bson.types.ObjectId;

import static io.vena.folio.util.Types.boxed;
import static io.vena.folio.util.Types.elementType;
import static io.vena.folio.util.Types.rawClass;

/**
 * What Folio knows about the type of a property's values.
 */
public interface TypeDescriptor {
	TypeDescriptor ID = new IdType();
	TypeDescriptor UNTYPED = new Untyped();

	/**
	 * A scalar whose values are coerced to {@link #kind} when serialized.
	 */
	record Scalar(ValueType kind) implements TypeDescriptor { }

	record ArrayOf(TypeDescriptor element) implements TypeDescriptor { }

	/**
	 * An embedded object of a known class. Values of exactly this class
	 * are stored without a <code>__type</code> discriminator.
	 */
	record ClassType(Class<?> type) implements TypeDescriptor { }

	record IdType() implements TypeDescriptor { }

	record Untyped() implements TypeDescriptor { }

	static TypeDescriptor fromAnnotation(Type annotation) {
		ValueType kind = annotation.value().canonical();
		switch (kind) {
			case ID:
				return ID;
			case ARRAY:
				return new ArrayOf(elementFromAnnotation(annotation));
			case OBJECT:
				return annotation.of() == Object.class ? UNTYPED : new ClassType(annotation.of());
			case NONE:
				return UNTYPED;
			default:
				return new Scalar(kind);
		}
	}

	private static TypeDescriptor elementFromAnnotation(Type annotation) {
		ValueType element = annotation.element().canonical();
		switch (element) {
			case NONE:
			case OBJECT:
				return annotation.of() == Object.class ? UNTYPED : new ClassType(annotation.of());
			case ID:
				return ID;
			case ARRAY:
				return new ArrayOf(UNTYPED);
			default:
				return new Scalar(element);
		}
	}

	/**
	 * Derives a descriptor from a field's declared Java type.
	 */
	static TypeDescriptor infer(java.lang.reflect.Type javaType) {
		Class<?> raw = boxed(rawClass(javaType));
		if (raw == String.class || raw == Character.class) {
			return new Scalar(ValueType.STRING);
		} else if (raw == Integer.class || raw == Short.class || raw == Byte.class) {
			return new Scalar(ValueType.INT);
		} else if (raw == Long.class) {
			return new Scalar(ValueType.LONG);
		} else if (raw == Double.class || raw == Float.class) {
			return new Scalar(ValueType.DOUBLE);
		} else if (raw == Boolean.class) {
			return new Scalar(ValueType.BOOLEAN);
		} else if (Date.class.isAssignableFrom(raw) || Temporal.class.isAssignableFrom(raw)) {
			return new Scalar(ValueType.DATE);
		} else if (raw == ObjectId.class) {
			return ID;
		} else if (raw == byte[].class) {
			return UNTYPED;
		} else if (raw.isArray() || Collection.class.isAssignableFrom(raw)) {
			return new ArrayOf(infer(elementType(javaType)));
		} else if (isEmbeddable(raw)) {
			return new ClassType(raw);
		} else {
			return UNTYPED;
		}
	}

	/**
	 * Application classes that Folio serializes through their own {@link SchemaDefinition}.
	 */
	private static boolean isEmbeddable(Class<?> raw) {
		if (raw == Object.class || raw.isEnum() || raw.isPrimitive()
			|| Number.class.isAssignableFrom(raw)
			|| Map.class.isAssignableFrom(raw)
			|| BsonValue.class.isAssignableFrom(raw)
			|| Reference.class.isAssignableFrom(raw)) {
			return false;
		}
		String name = raw.getName();
		return !name.startsWith("java.") && !name.startsWith("javax.") && !name.startsWith("org.bson.");
	}
}
