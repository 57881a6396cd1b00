package io.vena.folio.metadata;

import io.vena.folio.events.EventKind;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.jetbrains.annotations.Nullable;

import static java.util.Collections.unmodifiableList;
import static java.util.Collections.unmodifiableMap;
import static java.util.Collections.unmodifiableSet;

/**
 * Everything Folio knows about how one Java class maps to stored documents.
 *
 * <p>
 * Produced by the {@link MetadataRegistry} and shared by every thread that maps
 * the class. Immutable except for the observer list, which grows through
 * {@link #addObserver}.
 */
@Getter
@Accessors(fluent = true)
public final class SchemaDefinition {
	public static final String ID_KEY = "_id";
	public static final String TYPE_KEY = "__type";
	public static final String TYPE_CLASS_KEY = "class";

	private final Class<?> type;
	private final String collectionName;

	/**
	 * False for subclasses stored in an ancestor's {@link io.vena.folio.annotations.SingleCollection}.
	 * Documents of such types carry a <code>__type</code> discriminator.
	 */
	private final boolean hasOwnCollection;
	private final boolean singleCollectionRoot;

	/**
	 * The Java field name of the identifier property.
	 */
	private final String idPropertyKey;
	private final List<IndexDef> indexes;

	/**
	 * An instance built without running constructors, used as the receiver for scope methods.
	 * Null for abstract types.
	 */
	private final @Nullable Object prototype;

	/**
	 * Class files whose modification invalidates a cached copy of this definition.
	 */
	private final Set<String> watchedSources;

	@Getter(lombok.AccessLevel.NONE) private final Map<String, PropertyDef> propertiesByFieldName;
	@Getter(lombok.AccessLevel.NONE) private final Map<String, PropertyDef> propertiesByStoredName;
	@Getter(lombok.AccessLevel.NONE) private final Map<EventKind, List<EventHook>> events;
	@Getter(lombok.AccessLevel.NONE) private final Map<String, ScopeRef> scopes;
	@Getter(lombok.AccessLevel.NONE) private final List<Object> observers = new CopyOnWriteArrayList<>();

	SchemaDefinition(
		Class<?> type,
		String collectionName,
		boolean hasOwnCollection,
		boolean singleCollectionRoot,
		String idPropertyKey,
		Map<String, PropertyDef> propertiesByFieldName,
		Map<String, PropertyDef> propertiesByStoredName,
		List<IndexDef> indexes,
		Map<EventKind, List<EventHook>> events,
		Map<String, ScopeRef> scopes,
		@Nullable Object prototype,
		Set<String> watchedSources
	) {
		this.type = type;
		this.collectionName = collectionName;
		this.hasOwnCollection = hasOwnCollection;
		this.singleCollectionRoot = singleCollectionRoot;
		this.idPropertyKey = idPropertyKey;
		this.propertiesByFieldName = unmodifiableMap(propertiesByFieldName);
		this.propertiesByStoredName = unmodifiableMap(propertiesByStoredName);
		this.indexes = unmodifiableList(indexes);
		Map<EventKind, List<EventHook>> eventCopy = new EnumMap<>(EventKind.class);
		events.forEach((kind, hooks) -> eventCopy.put(kind, List.copyOf(hooks)));
		this.events = unmodifiableMap(eventCopy);
		this.scopes = unmodifiableMap(scopes);
		this.prototype = prototype;
		this.watchedSources = unmodifiableSet(watchedSources);
	}

	public String typeName() {
		return type.getName();
	}

	/**
	 * @return properties in field declaration order, superclass properties first
	 */
	public Collection<PropertyDef> properties() {
		return propertiesByFieldName.values();
	}

	public Optional<PropertyDef> property(String fieldName) {
		return Optional.ofNullable(propertiesByFieldName.get(fieldName));
	}

	public Optional<PropertyDef> propertyByStoredName(String storedName) {
		return Optional.ofNullable(propertiesByStoredName.get(storedName));
	}

	public Map<String, PropertyDef> propertiesByFieldName() {
		return propertiesByFieldName;
	}

	public Map<String, PropertyDef> propertiesByStoredName() {
		return propertiesByStoredName;
	}

	public PropertyDef idProperty() {
		return propertiesByFieldName.get(idPropertyKey);
	}

	/**
	 * @return the stored name of the property with the given Java field name,
	 * or the name itself if there is no such property
	 */
	public String storedNameOf(String fieldName) {
		PropertyDef property = propertiesByFieldName.get(fieldName);
		return property == null ? fieldName : property.storedName();
	}

	public List<EventHook> hooks(EventKind kind) {
		return events.getOrDefault(kind, List.of());
	}

	public Map<EventKind, List<EventHook>> events() {
		return events;
	}

	/**
	 * @param name case-insensitive
	 */
	public Optional<ScopeRef> scope(String name) {
		return Optional.ofNullable(scopes.get(name.toLowerCase(Locale.ROOT)));
	}

	public Map<String, ScopeRef> scopes() {
		return scopes;
	}

	public List<Object> observers() {
		return unmodifiableList(observers);
	}

	public void addObserver(Object observer) {
		observers.add(observer);
	}

	@Override
	public String toString() {
		return "SchemaDefinition(" + typeName() + " -> " + collectionName + ")";
	}
}
