package io.vena.folio.store;

import io.vena.folio.DocumentCursor;
import io.vena.folio.DocumentStore;
import io.vena.folio.exceptions.CommandFailedException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.bson.BsonArray;
import org.bson.BsonBoolean;
import org.bson.BsonDocument;
import org.bson.BsonDouble;
import org.bson.BsonInt32;
import org.bson.BsonNull;
import org.bson.BsonObjectId;
import org.bson.BsonValue;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.vena.folio.metadata.SchemaDefinition.ID_KEY;

/**
 * A {@link DocumentStore} that keeps collections in memory.
 *
 * <p>
 * Understands the commands Folio sends: <code>insert</code>, <code>update</code>
 * (with <code>$set</code>, <code>$unset</code> or a replacement document),
 * <code>delete</code>, <code>count</code>, <code>createIndexes</code> and <code>drop</code>.
 * Filters support equality on dotted paths, <code>$and</code>, <code>$or</code>, <code>$nor</code>
 * and the common comparison operators. Unique indexes are enforced.
 *
 * <p>
 * Every command is recorded and can be inspected with {@link #commands()}.
 */
public final class InMemoryDocumentStore implements DocumentStore {
	private static final int DUPLICATE_KEY = 11000;

	private final String databaseName;
	private final Map<String, List<BsonDocument>> collections = new LinkedHashMap<>();
	private final Map<String, List<BsonDocument>> indexes = new LinkedHashMap<>();
	private final List<BsonDocument> commands = new ArrayList<>();

	public InMemoryDocumentStore() {
		this("test");
	}

	public InMemoryDocumentStore(String databaseName) {
		this.databaseName = databaseName;
	}

	@Override
	public String databaseName() {
		return databaseName;
	}

	@Override
	public synchronized BsonDocument execute(BsonDocument command) {
		commands.add(command.clone());
		String name = command.getFirstKey();
		LOGGER.debug("Execute {}: {}", name, command);
		switch (name) {
			case "insert":
				return insert(collectionName(command), command.getArray("documents"));
			case "update":
				return update(collectionName(command), command.getArray("updates"));
			case "delete":
				return delete(collectionName(command), command.getArray("deletes"));
			case "count":
				return count(collectionName(command), command.getDocument("query", new BsonDocument()));
			case "createIndexes":
				return createIndexes(collectionName(command), command.getArray("indexes"));
			case "drop":
				collections.remove(collectionName(command));
				indexes.remove(collectionName(command));
				return ok();
			default:
				throw new CommandFailedException(59, "no such command: '" + name + "'");
		}
	}

	@Override
	public synchronized DocumentCursor find(String collection, BsonDocument filter) {
		List<BsonDocument> result = new ArrayList<>();
		for (BsonDocument document: collection(collection)) {
			if (FilterMatcher.matches(document, filter)) {
				result.add(document.clone());
			}
		}
		Iterator<BsonDocument> iterator = result.iterator();
		return new DocumentCursor() {
			@Override
			public boolean hasNext() {
				return iterator.hasNext();
			}

			@Override
			public BsonDocument next() {
				return iterator.next();
			}

			@Override
			public void close() { }
		};
	}

	/**
	 * @return copies of the commands executed so far, oldest first
	 */
	public synchronized List<BsonDocument> commands() {
		List<BsonDocument> result = new ArrayList<>();
		commands.forEach(c -> result.add(c.clone()));
		return result;
	}

	public synchronized void clearCommands() {
		commands.clear();
	}

	/**
	 * @return copies of the documents currently stored in <code>collection</code>
	 */
	public synchronized List<BsonDocument> documents(String collection) {
		List<BsonDocument> result = new ArrayList<>();
		collection(collection).forEach(d -> result.add(d.clone()));
		return result;
	}

	public synchronized List<BsonDocument> indexes(String collection) {
		return List.copyOf(indexes.getOrDefault(collection, List.of()));
	}

	private BsonDocument insert(String collection, BsonArray documents) {
		List<BsonDocument> target = collection(collection);
		int n = 0;
		for (BsonValue value: documents) {
			BsonDocument document = value.asDocument().clone();
			if (!document.containsKey(ID_KEY)) {
				document.put(ID_KEY, new BsonObjectId(new ObjectId()));
			}
			checkUnique(collection, document, null);
			target.add(document);
			n++;
		}
		return ok().append("n", new BsonInt32(n));
	}

	private BsonDocument update(String collection, BsonArray updates) {
		List<BsonDocument> target = collection(collection);
		int matched = 0;
		int modified = 0;
		for (BsonValue value: updates) {
			BsonDocument statement = value.asDocument();
			BsonDocument query = statement.getDocument("q");
			BsonDocument update = statement.getDocument("u");
			boolean multi = statement.getBoolean("multi", BsonBoolean.FALSE).getValue();
			for (int i = 0; i < target.size(); i++) {
				BsonDocument existing = target.get(i);
				if (!FilterMatcher.matches(existing, query)) {
					continue;
				}
				matched++;
				BsonDocument updated = applyUpdate(existing, update);
				if (!updated.equals(existing)) {
					checkUnique(collection, updated, existing);
					target.set(i, updated);
					modified++;
				}
				if (!multi) {
					break;
				}
			}
		}
		return ok()
			.append("n", new BsonInt32(matched))
			.append("nModified", new BsonInt32(modified));
	}

	private static BsonDocument applyUpdate(BsonDocument existing, BsonDocument update) {
		boolean operators = !update.isEmpty() && update.getFirstKey().startsWith("$");
		if (!operators) {
			BsonDocument replacement = update.clone();
			if (existing.containsKey(ID_KEY)) {
				replacement.put(ID_KEY, existing.get(ID_KEY));
			}
			return replacement;
		}
		BsonDocument result = existing.clone();
		for (Map.Entry<String, BsonValue> entry: update.entrySet()) {
			BsonDocument fields = entry.getValue().asDocument();
			switch (entry.getKey()) {
				case "$set":
					fields.forEach((path, v) -> FilterMatcher.setPath(result, path, v));
					break;
				case "$unset":
					fields.keySet().forEach(path -> FilterMatcher.removePath(result, path));
					break;
				default:
					throw new CommandFailedException(9, "Unknown modifier: " + entry.getKey());
			}
		}
		return result;
	}

	private BsonDocument delete(String collection, BsonArray deletes) {
		List<BsonDocument> target = collection(collection);
		int n = 0;
		for (BsonValue value: deletes) {
			BsonDocument statement = value.asDocument();
			BsonDocument query = statement.getDocument("q");
			int limit = statement.getNumber("limit", new BsonInt32(0)).intValue();
			Iterator<BsonDocument> iterator = target.iterator();
			int deleted = 0;
			while (iterator.hasNext()) {
				if (FilterMatcher.matches(iterator.next(), query)) {
					iterator.remove();
					deleted++;
					if (limit == 1) {
						break;
					}
				}
			}
			n += deleted;
		}
		return ok().append("n", new BsonInt32(n));
	}

	private BsonDocument count(String collection, BsonDocument query) {
		int n = 0;
		for (BsonDocument document: collection(collection)) {
			if (FilterMatcher.matches(document, query)) {
				n++;
			}
		}
		return ok().append("n", new BsonInt32(n));
	}

	private BsonDocument createIndexes(String collection, BsonArray requested) {
		List<BsonDocument> existing = indexes.computeIfAbsent(collection, c -> new ArrayList<>());
		int before = existing.size() + 1;
		for (BsonValue index: requested) {
			String name = index.asDocument().getString("name").getValue();
			if (existing.stream().noneMatch(i -> i.getString("name").getValue().equals(name))) {
				existing.add(index.asDocument().clone());
			}
		}
		collection(collection);
		return ok()
			.append("numIndexesBefore", new BsonInt32(before))
			.append("numIndexesAfter", new BsonInt32(existing.size() + 1));
	}

	/**
	 * Missing fields count as null, so without <code>sparse</code> two documents
	 * lacking an indexed field collide, as they do in MongoDB.
	 */
	private void checkUnique(String collection, BsonDocument candidate, BsonDocument replacing) {
		List<List<String>> keySets = new ArrayList<>();
		List<Boolean> sparse = new ArrayList<>();
		keySets.add(List.of(ID_KEY));
		sparse.add(false);
		for (BsonDocument index: indexes.getOrDefault(collection, List.of())) {
			if (index.getBoolean("unique", BsonBoolean.FALSE).getValue()) {
				keySets.add(new ArrayList<>(index.getDocument("key").keySet()));
				sparse.add(index.getBoolean("sparse", BsonBoolean.FALSE).getValue());
			}
		}
		for (int k = 0; k < keySets.size(); k++) {
			List<BsonValue> values = keyValues(candidate, keySets.get(k));
			if (sparse.get(k) && values.stream().allMatch(Objects::isNull)) {
				continue;
			}
			for (BsonDocument other: collection(collection)) {
				if (other == replacing) {
					continue;
				}
				if (normalized(values).equals(normalized(keyValues(other, keySets.get(k))))) {
					throw new CommandFailedException(DUPLICATE_KEY, "E11000 duplicate key error collection: "
						+ databaseName + "." + collection + " dup key: " + keySets.get(k) + " = " + values);
				}
			}
		}
	}

	private static List<BsonValue> keyValues(BsonDocument document, List<String> keys) {
		List<BsonValue> result = new ArrayList<>();
		for (String key: keys) {
			result.add(FilterMatcher.resolvePath(document, key));
		}
		return result;
	}

	private static List<BsonValue> normalized(List<BsonValue> values) {
		List<BsonValue> result = new ArrayList<>();
		for (BsonValue value: values) {
			result.add(value == null ? BsonNull.VALUE : value);
		}
		return result;
	}

	private List<BsonDocument> collection(String name) {
		return collections.computeIfAbsent(name, n -> new ArrayList<>());
	}

	private static String collectionName(BsonDocument command) {
		return command.getString(command.getFirstKey()).getValue();
	}

	private static BsonDocument ok() {
		return new BsonDocument("ok", new BsonDouble(1.0));
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryDocumentStore.class);
}
