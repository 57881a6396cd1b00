package io.vena.folio;

import io.vena.folio.events.EventDispatcher;
import io.vena.folio.events.EventKind;
import io.vena.folio.exceptions.MappingException;
import io.vena.folio.exceptions.ReferenceResolutionException;
import io.vena.folio.mapping.DiffEngine;
import io.vena.folio.mapping.Hydrator;
import io.vena.folio.mapping.PropertyAccess;
import io.vena.folio.mapping.SaveCommand;
import io.vena.folio.mapping.Serializer;
import io.vena.folio.mapping.SnapshotStore;
import io.vena.folio.metadata.MetadataRegistry;
import io.vena.folio.metadata.SchemaDefinition;
import io.vena.folio.util.BsonCodecs;
import io.vena.folio.validation.ValidatorRegistry;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import lombok.Getter;
import org.bson.BsonArray;
import org.bson.BsonBoolean;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonString;
import org.bson.BsonValue;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.vena.folio.metadata.SchemaDefinition.ID_KEY;
import static java.util.Arrays.asList;

/**
 * Maps annotated Java objects to documents in a {@link DocumentStore}.
 *
 * <p>
 * Objects are plain Java objects; Folio tracks which ones have been loaded or
 * saved, and what they looked like at the time, so {@link #save} can send only
 * what changed. Access to a given object must not be concurrent, but
 * different objects may be saved from different threads.
 */
public class Folio implements ReferenceResolver {
	@Getter private final DocumentStore store;
	@Getter private final FolioSettings settings;
	@Getter private final MetadataRegistry registry;
	@Getter private final ValidatorRegistry validators;
	private final SnapshotStore snapshots = new SnapshotStore();
	private final PropertyAccess access = new PropertyAccess(snapshots);
	private final Serializer serializer;
	private final EventDispatcher events;
	private final DiffEngine diffEngine;
	private final Hydrator hydrator;
	private final ConcurrentHashMap<Class<?>, Repository<?>> repositories = new ConcurrentHashMap<>();

	public Folio(DocumentStore store) {
		this(store, FolioSettings.defaults(), MetadataCache.none(), ValidatorRegistry.withBuiltIns());
	}

	public Folio(DocumentStore store, FolioSettings settings) {
		this(store, settings, MetadataCache.none(), ValidatorRegistry.withBuiltIns());
	}

	public Folio(DocumentStore store, FolioSettings settings, MetadataCache cache, ValidatorRegistry validators) {
		this.store = store;
		this.settings = settings;
		this.validators = validators;
		this.registry = new MetadataRegistry(store, settings, cache, validators);
		this.serializer = new Serializer(registry, access, settings);
		this.events = new EventDispatcher(registry);
		this.diffEngine = new DiffEngine(registry, serializer, snapshots, events, store.databaseName());
		this.hydrator = new Hydrator(registry, access, diffEngine, events, this);
	}

	public SchemaDefinition metadata(Class<?> type) {
		return registry.of(type);
	}

	public SchemaDefinition metadata(String typeName) {
		return registry.of(typeName);
	}

	@SuppressWarnings("unchecked")
	public <T> Repository<T> repository(Class<T> type) {
		return (Repository<T>) repositories.computeIfAbsent(type, t -> new Repository<>(this, type));
	}

	/**
	 * @return the object's document, validated, as it would be saved now
	 */
	public BsonDocument toDocument(Object object) {
		return serializer.toDocument(object, true, false);
	}

	public BsonDocument toDocument(Object object, boolean validate, boolean generateId) {
		return serializer.toDocument(object, validate, generateId);
	}

	public <T> T newInstance(Class<T> type, BsonDocument document) {
		return type.cast(hydrator.newInstance(registry.of(type), document, false));
	}

	Object newInstance(SchemaDefinition definition, BsonDocument document) {
		return hydrator.newInstance(definition, document, false);
	}

	/**
	 * Fires the pre-save events and returns the command {@link #save} would send, without sending it.
	 */
	public SaveCommand saveCommand(Object object) {
		return diffEngine.getSaveCommand(object);
	}

	/**
	 * Inserts the object if it has never been loaded or saved; otherwise updates
	 * the fields that changed since. An update with no changes sends nothing,
	 * but still fires the post-save events.
	 *
	 * @throws io.vena.folio.exceptions.InvalidValueException before anything is sent, if a value is rejected
	 */
	public void save(Object object) {
		SchemaDefinition definition = registry.of(object.getClass());
		SaveCommand command = diffEngine.getSaveCommand(object);
		if (command.isEmpty()) {
			LOGGER.debug("No changes to save in {}", command.namespace());
		} else {
			LOGGER.debug("Save {} in {}", command.kind(), command.namespace());
			store.execute(command.toCommand());
		}
		events.triggerEvent(definition, object, command.kind() == SaveCommand.Kind.CREATE ? EventKind.CREATED : EventKind.UPDATED);
		events.triggerEvent(definition, object, EventKind.SAVED);
		diffEngine.snapshot(object);
	}

	/**
	 * Deletes the object's document and forgets its persisted state,
	 * so saving it again inserts a new document.
	 */
	public void delete(Object object) {
		SchemaDefinition definition = registry.of(object.getClass());
		events.triggerEvent(definition, object, EventKind.DELETING);
		BsonValue id = idOf(object);
		if (id == null) {
			throw new MappingException("Cannot delete " + definition.type().getSimpleName() + " with no identifier");
		}
		BsonDocument statement = new BsonDocument("q", new BsonDocument(ID_KEY, id))
			.append("limit", new BsonInt32(1));
		LOGGER.debug("Delete {} from {}", id, definition.collectionName());
		store.execute(new BsonDocument("delete", new BsonString(definition.collectionName()))
			.append("deletes", new BsonArray(List.of(statement)))
			.append("ordered", BsonBoolean.TRUE));
		events.triggerEvent(definition, object, EventKind.DELETED);
		snapshots.clear(object);
	}

	/**
	 * Records the object's current state as persisted.
	 */
	public void snapshot(Object object) {
		diffEngine.snapshot(object);
	}

	/**
	 * @return true if the object has never been persisted, or has changed since it last was
	 */
	public boolean isDirty(Object object) {
		return diffEngine.isDirty(object);
	}

	public boolean isPersisted(Object object) {
		return snapshots.lastPersistedDocument(object) != null;
	}

	public String toJson(Object object) {
		return serializer.toDocument(object, false, false).toJson(BsonCodecs.JSON_SETTINGS);
	}

	/**
	 * @param with target fields to copy into the pointer
	 * @return the stored form of a reference to <code>target</code>
	 */
	public BsonDocument makeReference(Object target, String... with) {
		return serializer.makeReference(target, asList(with), false);
	}

	/**
	 * @return the object's identifier in stored form, or null if it has none yet
	 */
	public @Nullable BsonValue idOf(Object object) {
		Object id = access.readId(registry.of(object.getClass()), object);
		return PropertyAccess.hasValue(id) ? serializer.serializeValue(id) : null;
	}

	public @Nullable Object propertyValue(Object object, String fieldName) {
		return access.read(registry.of(object.getClass()), object, fieldName);
	}

	void setPropertyValue(Object object, String fieldName, @Nullable Object value) {
		SchemaDefinition definition = registry.of(object.getClass());
		access.write(definition.property(fieldName).orElseThrow(() ->
			new MappingException("No property " + fieldName + " in " + definition.typeName())), object, value);
	}

	BsonValue serializeValue(@Nullable Object value) {
		return serializer.serializeValue(value);
	}

	public Object registerObserver(Class<?> type, Class<?> observerClass) {
		return events.registerObserver(registry.of(type), observerClass);
	}

	public void triggerEvent(Object object, EventKind kind) {
		events.triggerEvent(object, kind);
	}

	@Override
	public @Nullable Object resolve(String collection, BsonValue id) {
		SchemaDefinition definition = registry.ofCollectionName(collection);
		if (definition == null) {
			throw new ReferenceResolutionException("No type is mapped to collection " + collection);
		}
		LOGGER.debug("Resolving {} in {}", id, collection);
		try (DocumentCursor cursor = store.find(collection, new BsonDocument(ID_KEY, id))) {
			return cursor.hasNext() ? hydrator.newInstance(definition, cursor.next(), false) : null;
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Folio.class);
}
