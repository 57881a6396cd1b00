package io.vena.folio.mapping;

import io.vena.folio.Reference;
import io.vena.folio.ReferenceResolver;
import io.vena.folio.events.EventDispatcher;
import io.vena.folio.events.EventKind;
import io.vena.folio.exceptions.ConfigurationException;
import io.vena.folio.exceptions.MappingException;
import io.vena.folio.metadata.MetadataRegistry;
import io.vena.folio.metadata.PropertyDef;
import io.vena.folio.metadata.SchemaDefinition;
import io.vena.folio.metadata.TypeDescriptor;
import io.vena.folio.metadata.TypeDescriptor.ArrayOf;
import io.vena.folio.metadata.TypeDescriptor.ClassType;
import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import lombok.RequiredArgsConstructor;
import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.bson.BsonValue;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.vena.folio.metadata.SchemaDefinition.TYPE_CLASS_KEY;
import static io.vena.folio.metadata.SchemaDefinition.TYPE_KEY;
import static io.vena.folio.util.ReflectionHelpers.instanceFields;
import static io.vena.folio.util.ReflectionHelpers.instantiateWithoutConstructor;
import static io.vena.folio.util.ReflectionHelpers.setField;
import static io.vena.folio.util.Types.elementType;
import static io.vena.folio.util.Types.mapValueType;
import static io.vena.folio.util.Types.rawClass;

/**
 * Rebuilds objects from stored documents without running their constructors.
 *
 * <p>
 * Pointers become unresolved {@link Reference}s; nothing is loaded from the
 * database until one is dereferenced.
 */
@RequiredArgsConstructor
public final class Hydrator {
	private final MetadataRegistry registry;
	private final PropertyAccess access;
	private final DiffEngine diffEngine;
	private final EventDispatcher events;
	private final ReferenceResolver resolver;

	/**
	 * @param isNested true for embedded documents, which are neither snapshotted
	 *                 nor announced with {@link EventKind#RETRIEVED}
	 * @throws ConfigurationException if the document's <code>__type</code> names a class
	 * that isn't a subtype of the definition's type
	 */
	public Object newInstance(SchemaDefinition definition, BsonDocument document, boolean isNested) {
		SchemaDefinition concrete = concreteDefinition(definition, document);
		Object result = instantiate(concrete.type());
		for (Map.Entry<String, BsonValue> entry: document.entrySet()) {
			String key = entry.getKey();
			if (key.equals(TYPE_KEY)) {
				continue;
			}
			Optional<PropertyDef> property = concrete.propertyByStoredName(key)
				.or(() -> concrete.property(key));
			if (property.isPresent()) {
				PropertyDef p = property.get();
				Field field = p.field();
				Type targetType = field == null ? Object.class : field.getGenericType();
				Object value = hydrateValue(p.typeDescriptor(), targetType, entry.getValue());
				access.write(p, result, value);
				LOGGER.trace("| Set field {}: {}", p.fieldName(), value);
			} else {
				Field raw = rawField(concrete.type(), key);
				if (raw == null) {
					LOGGER.debug("| Skipping key \"{}\" with no matching field in {}", key, concrete.type().getSimpleName());
				} else {
					setField(raw, result, hydrateValue(TypeDescriptor.UNTYPED, raw.getGenericType(), entry.getValue()));
				}
			}
		}
		if (!isNested) {
			diffEngine.snapshot(result);
			events.triggerEvent(concrete, result, EventKind.RETRIEVED);
		}
		return result;
	}

	private SchemaDefinition concreteDefinition(SchemaDefinition definition, BsonDocument document) {
		Class<?> concreteType = discriminatedType(document, definition.type());
		return concreteType == null || concreteType == definition.type()
			? definition
			: registry.of(concreteType);
	}

	/**
	 * @return the class named by the document's <code>__type</code>, or null if it has none
	 */
	private static @Nullable Class<?> discriminatedType(BsonDocument document, Class<?> expected) {
		BsonValue tag = document.get(TYPE_KEY);
		if (tag == null || !tag.isDocument() || !tag.asDocument().isString(TYPE_CLASS_KEY)) {
			return null;
		}
		String className = tag.asDocument().getString(TYPE_CLASS_KEY).getValue();
		Class<?> type;
		try {
			ClassLoader loader = expected.getClassLoader() == null ? Thread.currentThread().getContextClassLoader() : expected.getClassLoader();
			type = Class.forName(className, true, loader);
		} catch (ClassNotFoundException e) {
			throw new ConfigurationException("Unknown type " + className + " in " + TYPE_KEY, e);
		}
		if (!expected.isAssignableFrom(type)) {
			throw new ConfigurationException("Stored type " + className + " is not a subtype of " + expected.getName());
		}
		return type;
	}

	private static Object instantiate(Class<?> type) {
		try {
			return instantiateWithoutConstructor(type);
		} catch (MappingException e) {
			throw new ConfigurationException("Unable to instantiate " + type.getName() + "; documents of abstract types need a " + TYPE_KEY, e);
		}
	}

	private static @Nullable Field rawField(Class<?> type, String name) {
		for (Field field: instanceFields(type)) {
			if (field.getName().equals(name)) {
				return field;
			}
		}
		return null;
	}

	private @Nullable Object hydrateValue(TypeDescriptor descriptor, Type targetType, BsonValue value) {
		Class<?> target = rawClass(targetType);
		if (value.isNull()) {
			return BsonConversions.scalarFromBson(value, target);
		}
		if (BsonValue.class.isAssignableFrom(target) && target.isInstance(value)) {
			return value;
		}
		if (Reference.isPointer(value)) {
			return Reference.fromBson(value.asDocument(), resolver);
		}
		if (value.isArray()) {
			return hydrateArray(descriptor, targetType, value.asArray());
		}
		if (value.isDocument()) {
			return hydrateDocument(descriptor, targetType, value.asDocument());
		}
		return BsonConversions.scalarFromBson(value, target);
	}

	private Object hydrateDocument(TypeDescriptor descriptor, Type targetType, BsonDocument document) {
		Class<?> target = rawClass(targetType);
		Class<?> declared = descriptor instanceof ClassType c ? c.type() : null;
		if (document.containsKey(TYPE_KEY)) {
			Class<?> expected = declared != null ? declared : target;
			Class<?> concrete = discriminatedType(document, Map.class.isAssignableFrom(expected) ? Object.class : expected);
			return newInstance(registry.of(concrete), document, true);
		}
		if (declared != null) {
			return newInstance(registry.of(declared), document, true);
		}
		if (target == Object.class || Map.class.isAssignableFrom(target)) {
			Type valueType = mapValueType(targetType);
			Map<String, Object> result = new LinkedHashMap<>();
			document.forEach((k, v) -> result.put(k, hydrateValue(TypeDescriptor.UNTYPED, valueType, v)));
			return result;
		}
		return newInstance(registry.of(target), document, true);
	}

	@SuppressWarnings({"unchecked", "rawtypes"})
	private Object hydrateArray(TypeDescriptor descriptor, Type targetType, BsonArray array) {
		Class<?> target = rawClass(targetType);
		TypeDescriptor element = descriptor instanceof ArrayOf a ? a.element() : TypeDescriptor.UNTYPED;
		Type elementType = elementType(targetType);
		List<Object> items = new ArrayList<>(array.size());
		for (BsonValue item: array) {
			items.add(hydrateValue(element, elementType, item));
		}
		if (target.isArray()) {
			Object result = Array.newInstance(target.getComponentType(), items.size());
			for (int i = 0; i < items.size(); i++) {
				Array.set(result, i, items.get(i));
			}
			return result;
		} else if (EnumSet.class.isAssignableFrom(target)) {
			EnumSet result = EnumSet.noneOf((Class<Enum>) rawClass(elementType));
			result.addAll(items);
			return result;
		} else if (SortedSet.class.isAssignableFrom(target)) {
			return new TreeSet<>(items);
		} else if (Set.class.isAssignableFrom(target)) {
			return new LinkedHashSet<>(items);
		} else if (target == Object.class || target.isAssignableFrom(ArrayList.class)) {
			return items;
		} else if (Collection.class.isAssignableFrom(target)) {
			Collection<Object> result;
			try {
				result = (Collection<Object>) target.getDeclaredConstructor().newInstance();
			} catch (ReflectiveOperationException | RuntimeException e) {
				throw new MappingException("Unable to instantiate collection " + target.getName(), e);
			}
			result.addAll(items);
			return result;
		}
		throw new MappingException("Cannot hydrate an array into " + target.getSimpleName());
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Hydrator.class);
}
