package io.vena.folio.mapping;

import io.vena.folio.events.EventDispatcher;
import io.vena.folio.events.EventKind;
import io.vena.folio.exceptions.MappingException;
import io.vena.folio.metadata.MetadataRegistry;
import io.vena.folio.metadata.SchemaDefinition;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.bson.BsonDocument;
import org.bson.BsonNull;
import org.bson.BsonValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.vena.folio.metadata.SchemaDefinition.ID_KEY;

/**
 * Works out what a save has to send, by comparing an object's current document
 * with the one recorded the last time it was loaded or saved.
 *
 * <p>
 * Comparison is per top-level key: embedded documents and arrays that differ
 * at all are replaced as a whole. Nothing prevents another writer from changing
 * the stored document between the comparison and the update.
 */
@RequiredArgsConstructor
public final class DiffEngine {
	private final MetadataRegistry registry;
	private final Serializer serializer;
	private final SnapshotStore snapshots;
	private final EventDispatcher events;
	private final String databaseName;

	/**
	 * Records the object's current state as its persisted baseline. Never validates.
	 */
	public void snapshot(Object object) {
		snapshots.store(object, serializer.toDocument(object, false, false));
	}

	/**
	 * Fires the pre-save events and builds the command that would persist the object.
	 * Objects never loaded or saved produce an insert; others produce an update of
	 * just the changed keys.
	 */
	public SaveCommand getSaveCommand(Object object) {
		SchemaDefinition definition = registry.of(object.getClass());
		BsonDocument previous = snapshots.lastPersistedDocument(object);
		if (previous == null) {
			events.triggerEvent(definition, object, EventKind.SAVING);
			events.triggerEvent(definition, object, EventKind.CREATING);
			BsonDocument document = serializer.toDocument(definition, object, true, true);
			return SaveCommand.create(databaseName, definition.collectionName(), document);
		}
		events.triggerEvent(definition, object, EventKind.SAVING);
		events.triggerEvent(definition, object, EventKind.UPDATING);
		BsonValue id = previous.get(ID_KEY);
		if (id == null) {
			throw new MappingException("Cannot update " + definition.typeName() + ": its last persisted document has no " + ID_KEY);
		}
		BsonDocument current = serializer.toDocument(definition, object, true, false);
		return SaveCommand.update(databaseName, definition.collectionName(), new BsonDocument(ID_KEY, id), diff(current, previous));
	}

	public boolean isDirty(Object object) {
		BsonDocument previous = snapshots.lastPersistedDocument(object);
		return previous == null || !diff(serializer.toDocument(object, false, false), previous).isEmpty();
	}

	/**
	 * @return an update document with <code>$set</code> for keys that are new or changed
	 * in <code>current</code> and <code>$unset</code> for keys only in <code>previous</code>;
	 * empty if the two are equal
	 */
	public static BsonDocument diff(BsonDocument current, BsonDocument previous) {
		BsonDocument set = new BsonDocument();
		BsonDocument unset = new BsonDocument();
		for (Map.Entry<String, BsonValue> entry: current.entrySet()) {
			String key = entry.getKey();
			BsonValue value = entry.getValue();
			if (!value.equals(previous.get(key))) {
				LOGGER.debug("| Set field {}: {}", key, value);
				set.put(key, value);
			}
		}
		for (String key: previous.keySet()) {
			if (!current.containsKey(key)) {
				LOGGER.debug("| Unset field {}", key);
				unset.put(key, BsonNull.VALUE); // Value is ignored
			}
		}
		BsonDocument result = new BsonDocument();
		if (!set.isEmpty()) {
			result.append("$set", set);
		}
		if (!unset.isEmpty()) {
			result.append("$unset", unset);
		}
		return result;
	}

	/**
	 * Applies a top-level <code>$set</code>/<code>$unset</code> update to a copy of <code>previous</code>.
	 */
	public static BsonDocument apply(BsonDocument previous, BsonDocument update) {
		BsonDocument result = previous.clone();
		BsonValue set = update.get("$set");
		if (set != null) {
			set.asDocument().forEach(result::put);
		}
		BsonValue unset = update.get("$unset");
		if (unset != null) {
			unset.asDocument().keySet().forEach(result::remove);
		}
		return result;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(DiffEngine.class);
}
