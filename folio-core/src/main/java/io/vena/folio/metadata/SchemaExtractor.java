package io.vena.folio.metadata;

import io.vena.folio.Reference;
import io.vena.folio.annotations.Collection;
import io.vena.folio.annotations.Hook;
import io.vena.folio.annotations.Id;
import io.vena.folio.annotations.Index;
import io.vena.folio.annotations.Ref;
import io.vena.folio.annotations.Required;
import io.vena.folio.annotations.SingleCollection;
import io.vena.folio.annotations.Type;
import io.vena.folio.annotations.Unique;
import io.vena.folio.annotations.Validate;
import io.vena.folio.events.EventKind;
import io.vena.folio.exceptions.ConfigurationException;
import io.vena.folio.exceptions.MappingException;
import io.vena.folio.metadata.PropertyDef.ReferenceSpec;
import io.vena.folio.metadata.PropertyDef.Visibility;
import io.vena.folio.validation.ValidationRule;
import io.vena.folio.validation.ValidatorRegistry;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.net.URL;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.atteo.evo.inflector.English;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.vena.folio.metadata.SchemaDefinition.ID_KEY;
import static io.vena.folio.util.DeclarationOrder.declaredMethods;
import static io.vena.folio.util.ReflectionHelpers.instantiateWithoutConstructor;
import static io.vena.folio.util.ReflectionHelpers.isInstanceState;
import static java.util.Arrays.asList;

/**
 * Turns one class's fields, methods and annotations into a {@link SchemaDefinition}.
 *
 * <p>
 * Ancestors are obtained through the {@link MetadataRegistry}, so each
 * superclass is extracted once no matter how many subclasses it has.
 *
 * <p>
 * A class's own hooks are taken in declaration order, read from its class file.
 * Inherited hooks run first.
 */
@RequiredArgsConstructor
final class SchemaExtractor {
	private final MetadataRegistry registry;
	private final ValidatorRegistry validators;
	private final String reservedPrefix;

	private static final Pattern SCOPE_METHOD = Pattern.compile("^scope(\\p{Upper}.*)$");
	private static final String IMPLICIT_ID_FIELD = "id";

	SchemaDefinition extract(Class<?> type) {
		if (type.isPrimitive() || type.isArray() || type.isEnum() || type.isInterface()) {
			throw new ConfigurationException("Type " + type.getName() + " can't be mapped to documents");
		}
		LOGGER.debug("Extracting schema of {}", type.getName());

		@Nullable SchemaDefinition parent = parentDefinition(type);
		boolean singleCollectionRoot = type.isAnnotationPresent(SingleCollection.class);
		String collectionName;
		boolean hasOwnCollection;
		if (parent != null && (parent.singleCollectionRoot() || !parent.hasOwnCollection())) {
			collectionName = parent.collectionName();
			hasOwnCollection = false;
			if (singleCollectionRoot) {
				LOGGER.warn("{} is already stored in the single collection {}; ignoring @SingleCollection", type.getName(), collectionName);
				singleCollectionRoot = false;
			}
		} else {
			collectionName = defaultCollectionName(type);
			hasOwnCollection = true;
		}

		Set<String> watchedSources = new LinkedHashSet<>();
		watchedSources.add(sourceOf(type));

		Map<String, PropertyDef> byFieldName = new LinkedHashMap<>();
		@Nullable String idKey = null;
		List<IndexDef> indexes = new ArrayList<>();
		Map<EventKind, List<EventHook>> events = new EnumMap<>(EventKind.class);
		Map<String, ScopeRef> scopes = new LinkedHashMap<>();

		if (parent != null) {
			watchedSources.addAll(parent.watchedSources());
			parent.properties().stream()
				.filter(p -> !p.isSynthesized())
				.forEach(p -> byFieldName.put(p.fieldName(), p));
			if (!parent.idProperty().isSynthesized()) {
				idKey = parent.idPropertyKey();
			}
			indexes.addAll(parent.indexes());
			parent.events().forEach((kind, hooks) -> events.put(kind, new ArrayList<>(hooks)));
			scopes.putAll(parent.scopes());
		}

		List<Field> ownFields = new ArrayList<>();
		for (Field field: type.getDeclaredFields()) {
			if (!isInstanceState(field)) {
				continue;
			}
			if (field.getName().startsWith(reservedPrefix) && !Modifier.isPublic(field.getModifiers())) {
				LOGGER.trace("| Skipping internal field {}", field.getName());
				continue;
			}
			ownFields.add(field);
			boolean isId = false;
			if (field.isAnnotationPresent(Id.class)) {
				if (idKey == null || idKey.equals(field.getName())) {
					idKey = field.getName();
					isId = true;
				} else {
					LOGGER.warn("{}.{} is annotated @Id but {} is already the identifier; treating it as an ordinary property",
						type.getSimpleName(), field.getName(), idKey);
				}
			}
			byFieldName.put(field.getName(), propertyOf(type, field, isId));
		}

		if (idKey == null) {
			idKey = implicitIdKey(byFieldName);
		}
		if (idKey == null) {
			idKey = IMPLICIT_ID_FIELD;
			byFieldName.put(IMPLICIT_ID_FIELD, PropertyDef.synthesizedId());
			LOGGER.debug("| Synthesized identifier for {}", type.getSimpleName());
		} else {
			PropertyDef id = byFieldName.get(idKey);
			if (!id.storedName().equals(ID_KEY)) {
				id = id.withStoredName(ID_KEY);
			}
			if (holdsIdentifierText(id)) {
				id = id.withTypeDescriptor(TypeDescriptor.ID);
			}
			byFieldName.put(idKey, id);
		}

		Map<String, PropertyDef> byStoredName = new LinkedHashMap<>();
		for (PropertyDef property: byFieldName.values()) {
			PropertyDef existing = byStoredName.put(property.storedName(), property);
			if (existing != null) {
				throw new ConfigurationException("Fields " + existing.fieldName() + " and " + property.fieldName()
					+ " of " + type.getName() + " are both stored as \"" + property.storedName() + "\"");
			}
		}

		for (Field field: ownFields) {
			indexOf(field, byFieldName.get(field.getName()).storedName()).ifPresent(indexes::add);
		}

		for (Method method: declaredMethods(type)) {
			if (method.isSynthetic() || method.isBridge()) {
				continue;
			}
			registerScope(method, scopes);
			registerHooks(type, method, events);
		}

		Object prototype = Modifier.isAbstract(type.getModifiers()) ? null : prototypeOf(type);

		SchemaDefinition result = new SchemaDefinition(
			type,
			collectionName,
			hasOwnCollection,
			singleCollectionRoot,
			idKey,
			byFieldName,
			byStoredName,
			indexes,
			events,
			scopes,
			prototype,
			watchedSources);
		LOGGER.debug("Extracted {}: {} propert{}, {} index{}, {} scope{}",
			result, byFieldName.size(), byFieldName.size() == 1 ? "y" : "ies",
			indexes.size(), indexes.size() == 1 ? "" : "es",
			scopes.size(), scopes.size() == 1 ? "" : "s");
		return result;
	}

	private @Nullable SchemaDefinition parentDefinition(Class<?> type) {
		Class<?> superclass = type.getSuperclass();
		if (superclass == null || superclass == Object.class) {
			return null;
		}
		return registry.of(superclass);
	}

	static String defaultCollectionName(Class<?> type) {
		Collection explicit = type.getAnnotation(Collection.class);
		if (explicit != null) {
			return explicit.value();
		}
		return English.plural(type.getSimpleName()).toLowerCase(Locale.ROOT);
	}

	private PropertyDef propertyOf(Class<?> owner, Field field, boolean isId) {
		io.vena.folio.annotations.Field alias = field.getAnnotation(io.vena.folio.annotations.Field.class);
		String storedName = isId ? ID_KEY : alias == null ? field.getName() : alias.value();

		ReferenceSpec reference = null;
		Ref ref = field.getAnnotation(Ref.class);
		if (ref != null) {
			Class<?> fieldType = field.getType();
			if (fieldType != Object.class && !Reference.class.isAssignableFrom(fieldType)) {
				throw new ConfigurationException("@Ref field " + owner.getSimpleName() + "." + field.getName()
					+ " must be declared as Reference or Object, not " + fieldType.getSimpleName());
			}
			reference = new ReferenceSpec(List.of(ref.with()));
		}

		TypeDescriptor descriptor;
		Type declared = field.getAnnotation(Type.class);
		if (declared != null) {
			descriptor = TypeDescriptor.fromAnnotation(declared);
		} else if (reference != null) {
			descriptor = TypeDescriptor.UNTYPED;
		} else {
			descriptor = TypeDescriptor.infer(field.getGenericType());
		}

		List<ValidationRule> validations = new ArrayList<>();
		for (Validate validate: field.getAnnotationsByType(Validate.class)) {
			validations.add(validators.rule(validate.value(), asList(validate.args())));
		}

		return new PropertyDef(
			storedName,
			field.getName(),
			descriptor,
			field.isAnnotationPresent(Required.class),
			List.copyOf(validations),
			Modifier.isPublic(field.getModifiers()) ? Visibility.PUBLIC : Visibility.PRIVATE,
			reference,
			List.of(field.getAnnotations()),
			field);
	}

	/**
	 * A <code>String</code> identifier receives generated ids as hex text, which must
	 * be stored as an ObjectId again or the update selector won't match.
	 */
	private static boolean holdsIdentifierText(PropertyDef id) {
		Field field = id.field();
		return field != null
			&& field.getType() == String.class
			&& !field.isAnnotationPresent(Type.class)
			&& !id.isReference();
	}

	/**
	 * A field named <code>id</code>, or one explicitly stored as <code>_id</code>,
	 * serves as the identifier when none is annotated.
	 */
	private static @Nullable String implicitIdKey(Map<String, PropertyDef> byFieldName) {
		for (PropertyDef property: byFieldName.values()) {
			if (property.storedName().equals(ID_KEY)) {
				return property.fieldName();
			}
		}
		return byFieldName.containsKey(IMPLICIT_ID_FIELD) ? IMPLICIT_ID_FIELD : null;
	}

	private static Optional<IndexDef> indexOf(Field field, String storedName) {
		Unique unique = field.getAnnotation(Unique.class);
		if (unique != null) {
			return Optional.of(IndexDef.of(List.of(key(storedName, unique.descending())), true, unique.sparse()));
		}
		Index index = field.getAnnotation(Index.class);
		if (index != null) {
			return Optional.of(IndexDef.of(List.of(key(storedName, index.descending())), false, index.sparse()));
		}
		return Optional.empty();
	}

	private static IndexDef.Key key(String storedName, boolean descending) {
		return new IndexDef.Key(storedName, descending ? IndexDef.Direction.DESC : IndexDef.Direction.ASC);
	}

	private static void registerScope(Method method, Map<String, ScopeRef> scopes) {
		Matcher matcher = SCOPE_METHOD.matcher(method.getName());
		if (!matcher.matches() || method.getParameterCount() == 0 || Modifier.isStatic(method.getModifiers())) {
			return;
		}
		String name = matcher.group(1).toLowerCase(Locale.ROOT);
		scopes.put(name, new ScopeRef(name, method.getName(), method.getParameterCount() - 1, method));
	}

	private static void registerHooks(Class<?> type, Method method, Map<EventKind, List<EventHook>> events) {
		Hook[] hooks = method.getAnnotationsByType(Hook.class);
		if (hooks.length == 0) {
			return;
		}
		if (Modifier.isStatic(method.getModifiers())) {
			throw new ConfigurationException("Hook method " + type.getSimpleName() + "." + method.getName() + " must not be static");
		}
		boolean isPublic = Modifier.isPublic(method.getModifiers());
		for (Hook hook: hooks) {
			EventKind kind = EventKind.fromAlias(hook.value()).orElseThrow(() ->
				new ConfigurationException("Unknown event \"" + hook.value() + "\" on hook " + type.getSimpleName() + "." + method.getName()));
			List<EventHook> registered = events.computeIfAbsent(kind, k -> new ArrayList<>());
			EventHook entry = new EventHook(kind, method.getName(), isPublic, List.of(hook.args()), method);
			int overridden = indexOfOverridden(type, method, registered);
			if (overridden >= 0) {
				registered.set(overridden, entry);
				LOGGER.debug("| Hook {}.{} on {} replaces inherited hook", type.getSimpleName(), method.getName(), kind.canonicalName());
			} else {
				registered.add(entry);
				LOGGER.debug("| Hook {}.{} on {}", type.getSimpleName(), method.getName(), kind.canonicalName());
			}
		}
	}

	/**
	 * Invoking an inherited hook's method dispatches to the override anyway,
	 * so an override that is annotated again takes the inherited hook's place.
	 *
	 * @return the position of the inherited hook that <code>method</code> overrides, or -1
	 */
	private static int indexOfOverridden(Class<?> type, Method method, List<EventHook> registered) {
		for (int i = 0; i < registered.size(); i++) {
			Method inherited = registered.get(i).method();
			if (inherited.getDeclaringClass() != type
				&& !Modifier.isPrivate(inherited.getModifiers())
				&& inherited.getName().equals(method.getName())
				&& Arrays.equals(inherited.getParameterTypes(), method.getParameterTypes())) {
				return i;
			}
		}
		return -1;
	}

	private static Object prototypeOf(Class<?> type) {
		try {
			return instantiateWithoutConstructor(type);
		} catch (MappingException | IllegalArgumentException e) {
			throw new ConfigurationException("Unable to instantiate " + type.getName(), e);
		}
	}

	/**
	 * @return the location of the class file, as a URL string where the class loader can say
	 */
	static String sourceOf(Class<?> type) {
		String name = type.getName();
		URL resource = type.getResource(name.substring(name.lastIndexOf('.') + 1) + ".class");
		return resource == null ? "class:" + name : resource.toExternalForm();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(SchemaExtractor.class);
}
