package io.vena.folio.mapping;

import io.vena.folio.exceptions.ConfigurationException;
import io.vena.folio.exceptions.MappingException;
import io.vena.folio.metadata.PropertyDef;
import io.vena.folio.metadata.SchemaDefinition;
import java.lang.reflect.Field;
import lombok.RequiredArgsConstructor;
import org.bson.BsonObjectId;
import org.bson.BsonValue;
import org.bson.types.ObjectId;
import org.jetbrains.annotations.Nullable;

import static io.vena.folio.util.ReflectionHelpers.getField;
import static io.vena.folio.util.ReflectionHelpers.setField;

/**
 * Reads and writes property values, whether they live in a field
 * (of any visibility) or, for a synthesized identifier, in the {@link SnapshotStore}.
 */
@RequiredArgsConstructor
public final class PropertyAccess {
	private final SnapshotStore snapshots;

	public @Nullable Object read(PropertyDef property, Object object) {
		Field field = property.field();
		if (field == null) {
			return snapshots.generatedId(object);
		}
		return getField(field, object);
	}

	public void write(PropertyDef property, Object object, @Nullable Object value) {
		Field field = property.field();
		if (field == null) {
			if (value != null) {
				snapshots.rememberId(object, BsonConversions.scalarToBson(value));
			}
			return;
		}
		setField(field, object, value);
	}

	/**
	 * @throws MappingException if the definition has no property with that field name
	 */
	public @Nullable Object read(SchemaDefinition definition, Object object, String fieldName) {
		PropertyDef property = definition.property(fieldName).orElseThrow(() ->
			new MappingException("No property " + fieldName + " in " + definition.typeName()));
		return read(property, object);
	}

	public @Nullable Object readId(SchemaDefinition definition, Object object) {
		return read(definition.idProperty(), object);
	}

	/**
	 * Assigns a generated identifier, converted to the identifier field's type.
	 *
	 * @throws ConfigurationException if the identifier field can't hold an {@link ObjectId}
	 */
	public void writeGeneratedId(SchemaDefinition definition, Object object, ObjectId id) {
		PropertyDef property = definition.idProperty();
		Field field = property.field();
		if (field == null) {
			snapshots.rememberId(object, new BsonObjectId(id));
			return;
		}
		Class<?> type = field.getType();
		Object value;
		if (type == ObjectId.class || type == Object.class) {
			value = id;
		} else if (type == String.class) {
			value = id.toHexString();
		} else if (type.isAssignableFrom(BsonObjectId.class)) {
			value = new BsonObjectId(id);
		} else {
			throw new ConfigurationException("Cannot generate an identifier for " + definition.type().getSimpleName()
				+ "." + field.getName() + " of type " + type.getSimpleName() + "; assign one before saving");
		}
		setField(field, object, value);
	}

	public static boolean hasValue(@Nullable Object id) {
		return id != null && !(id instanceof BsonValue b && b.isNull());
	}
}
