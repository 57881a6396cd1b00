package io.vena.folio.mapping;

import io.vena.folio.FolioSettings;
import io.vena.folio.Reference;
import io.vena.folio.Saveable;
import io.vena.folio.exceptions.ConfigurationException;
import io.vena.folio.metadata.MetadataRegistry;
import io.vena.folio.metadata.PropertyDef;
import io.vena.folio.metadata.SchemaDefinition;
import io.vena.folio.metadata.TypeDescriptor;
import io.vena.folio.metadata.TypeDescriptor.ArrayOf;
import io.vena.folio.metadata.TypeDescriptor.ClassType;
import io.vena.folio.metadata.TypeDescriptor.Scalar;
import io.vena.folio.validation.Validation;
import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.bson.BsonNull;
import org.bson.BsonObjectId;
import org.bson.BsonString;
import org.bson.BsonValue;
import org.bson.types.ObjectId;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.vena.folio.metadata.SchemaDefinition.ID_KEY;
import static io.vena.folio.metadata.SchemaDefinition.TYPE_CLASS_KEY;
import static io.vena.folio.metadata.SchemaDefinition.TYPE_KEY;
import static io.vena.folio.util.ReflectionHelpers.getField;
import static io.vena.folio.util.ReflectionHelpers.instanceFields;

/**
 * Turns objects into {@link BsonDocument}s according to their {@link SchemaDefinition}.
 *
 * <p>
 * Embedded objects are serialized through their own definitions. An embedded
 * object whose class differs from the declared one carries a <code>__type</code>
 * discriminator so it can be hydrated as the right class. Referenced objects are
 * stored as pointers instead of being embedded.
 */
public final class Serializer {
	private final MetadataRegistry registry;
	private final PropertyAccess access;
	private final String reservedPrefix;
	private final boolean cascadeReferenceSaves;

	public Serializer(MetadataRegistry registry, PropertyAccess access, FolioSettings settings) {
		this.registry = registry;
		this.access = access;
		this.reservedPrefix = settings.reservedPrefix();
		this.cascadeReferenceSaves = settings.cascadeReferenceSaves();
	}

	/**
	 * @param validate check each property's value, and save referenced {@link Saveable}s first
	 * @param generateId assign a new {@link ObjectId} if the object has no identifier yet
	 * @throws io.vena.folio.exceptions.InvalidValueException if <code>validate</code> is set and a value is rejected
	 * @throws ConfigurationException if the object graph has a cycle
	 */
	public BsonDocument toDocument(Object object, boolean validate, boolean generateId) {
		return toDocument(registry.of(object.getClass()), object, validate, generateId);
	}

	public BsonDocument toDocument(SchemaDefinition definition, Object object, boolean validate, boolean generateId) {
		return toDocument(definition, object, validate, generateId, Collections.newSetFromMap(new IdentityHashMap<>()));
	}

	private BsonDocument toDocument(SchemaDefinition definition, Object object, boolean validate, boolean generateId, Set<Object> inProgress) {
		if (!inProgress.add(object)) {
			throw new ConfigurationException("Cycle detected: " + definition.typeName()
				+ " object is reachable from itself; use @Ref to store one side as a reference");
		}
		try {
			BsonDocument result = new BsonDocument();
			for (PropertyDef property: definition.properties()) {
				if (isReserved(property.fieldName())) {
					continue;
				}
				Object value = access.read(property, object);
				if (validate) {
					Validation.validate(property.fieldName(), value, property.required(), property.validations());
				}
				if (property.storedName().equals(ID_KEY) && !PropertyAccess.hasValue(value)) {
					continue;
				}
				Class<?> declaredClass = property.field() == null ? Object.class : property.field().getType();
				Optional<BsonValue> serialized = property.isReference()
					? serializeReference(value, property.reference().with(), validate)
					: serializeValue(property.typeDescriptor(), declaredClass, value, validate, inProgress);
				serialized.ifPresent(v -> result.put(property.storedName(), v));
			}

			for (Field field: instanceFields(object.getClass())) {
				String name = field.getName();
				if (definition.property(name).isPresent() || isReserved(name) || result.containsKey(name)) {
					continue;
				}
				serializeValue(TypeDescriptor.UNTYPED, Object.class, getField(field, object), validate, inProgress)
					.ifPresent(v -> result.put(name, v));
			}

			if (generateId && !PropertyAccess.hasValue(result.get(ID_KEY))) {
				ObjectId id = new ObjectId();
				access.writeGeneratedId(definition, object, id);
				result.put(ID_KEY, new BsonObjectId(id));
				LOGGER.debug("| Generated id {} for {}", id, definition.type().getSimpleName());
			}

			if (!definition.hasOwnCollection()) {
				result.put(TYPE_KEY, typeTag(object.getClass()));
			}
			return result;
		} finally {
			inProgress.remove(object);
		}
	}

	/**
	 * Serializes a value with no declared type, as it would be stored in an untyped property.
	 */
	public BsonValue serializeValue(@Nullable Object value) {
		return serializeValue(TypeDescriptor.UNTYPED, Object.class, value, false, Collections.newSetFromMap(new IdentityHashMap<>()))
			.orElse(BsonNull.VALUE);
	}

	/**
	 * @return empty if the value shouldn't be stored at all
	 */
	private Optional<BsonValue> serializeValue(TypeDescriptor descriptor, Class<?> declaredClass, @Nullable Object value, boolean validate, Set<Object> inProgress) {
		if (value == null) {
			return Optional.of(BsonNull.VALUE);
		}
		if (value instanceof AutoCloseable || value instanceof Thread) {
			LOGGER.trace("| Skipping runtime resource {}", value.getClass().getSimpleName());
			return Optional.empty();
		}
		if (value instanceof Reference<?> reference) {
			return serializeReference(reference, List.of(), validate);
		}
		if (value instanceof BsonValue b) {
			return Optional.of(b);
		}
		if (descriptor instanceof Scalar s) {
			value = BsonConversions.coerce(value, s.kind());
		} else if (descriptor instanceof TypeDescriptor.IdType && value instanceof String s && ObjectId.isValid(s)) {
			value = new ObjectId(s);
		}
		BsonValue scalar = BsonConversions.scalarToBson(value);
		if (scalar != null) {
			return Optional.of(scalar);
		}

		if (value.getClass().isArray()) {
			BsonArray result = new BsonArray();
			TypeDescriptor element = elementDescriptor(descriptor);
			Class<?> elementClass = elementClass(element, value.getClass().getComponentType());
			for (int i = 0; i < Array.getLength(value); i++) {
				serializeValue(element, elementClass, Array.get(value, i), validate, inProgress).ifPresent(result::add);
			}
			return Optional.of(result);
		} else if (value instanceof Collection<?> collection) {
			BsonArray result = new BsonArray();
			TypeDescriptor element = elementDescriptor(descriptor);
			Class<?> elementClass = elementClass(element, Object.class);
			for (Object item: collection) {
				serializeValue(element, elementClass, item, validate, inProgress).ifPresent(result::add);
			}
			return Optional.of(result);
		} else if (value instanceof Map<?, ?> map) {
			BsonDocument result = new BsonDocument();
			for (Map.Entry<?, ?> entry: map.entrySet()) {
				String key = String.valueOf(entry.getKey());
				serializeValue(TypeDescriptor.UNTYPED, Object.class, entry.getValue(), validate, inProgress)
					.ifPresent(v -> result.put(key, v));
			}
			return Optional.of(result);
		}

		SchemaDefinition nested = registry.of(value.getClass());
		BsonDocument document = toDocument(nested, value, validate, false, inProgress);
		if (value.getClass() != declaredClass) {
			document.put(TYPE_KEY, typeTag(value.getClass()));
		}
		return Optional.of(document);
	}

	private static TypeDescriptor elementDescriptor(TypeDescriptor descriptor) {
		return descriptor instanceof ArrayOf a ? a.element() : TypeDescriptor.UNTYPED;
	}

	private static Class<?> elementClass(TypeDescriptor element, Class<?> fallback) {
		return element instanceof ClassType c ? c.type() : fallback;
	}

	private Optional<BsonValue> serializeReference(@Nullable Object value, List<String> with, boolean validate) {
		if (value == null) {
			return Optional.of(BsonNull.VALUE);
		}
		return Optional.of(makeReference(value, with, validate));
	}

	/**
	 * Builds the stored pointer to <code>target</code>: its collection, its identifier,
	 * and a copy of the fields named in <code>with</code>.
	 *
	 * @param save whether to save the target first, if it is {@link Saveable}
	 */
	public BsonDocument makeReference(Object target, List<String> with, boolean save) {
		if (target instanceof Reference<?> reference) {
			if (!reference.isResolved()) {
				return reference.toBson();
			}
			target = reference.get();
		}
		if (save && cascadeReferenceSaves && target instanceof Saveable saveable) {
			LOGGER.debug("| Saving referenced {}", target.getClass().getSimpleName());
			saveable.save();
		}
		SchemaDefinition definition = registry.of(target.getClass());
		Object id = access.readId(definition, target);
		BsonDocument result = new BsonDocument(Reference.REF_KEY, new BsonString(definition.collectionName()))
			.append(Reference.ID_KEY, serializeValue(id));
		if (!with.isEmpty()) {
			BsonDocument cache = new BsonDocument();
			for (String fieldName: with) {
				cache.put(fieldName, serializeValue(access.read(definition, target, fieldName)));
			}
			result.append(Reference.CACHE_KEY, cache);
		}
		return result;
	}

	static BsonDocument typeTag(Class<?> type) {
		return new BsonDocument(TYPE_CLASS_KEY, new BsonString(type.getName()));
	}

	private boolean isReserved(String fieldName) {
		return fieldName.startsWith(reservedPrefix);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Serializer.class);
}
