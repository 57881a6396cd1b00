package io.vena.folio;

import io.vena.folio.exceptions.ReferenceResolutionException;
import org.bson.BsonDocument;
import org.bson.BsonString;
import org.bson.BsonValue;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * A pointer to a document in another collection, stored as
 * <code>{"$ref": collection, "$id": id, "__cache": {...}}</code>.
 *
 * <p>
 * A reference read from the database is resolved the first time {@link #get()}
 * is called, and keeps the resolved object from then on. A reference created
 * with {@link #to} already holds its target; the pointer is computed when the
 * owning object is serialized.
 *
 * <p>
 * Not thread-safe, like the objects that hold it.
 */
public final class Reference<T> {
	public static final String REF_KEY = "$ref";
	public static final String ID_KEY = "$id";
	public static final String CACHE_KEY = "__cache";

	private final @Nullable String collection;
	private final @Nullable BsonValue id;
	private final BsonDocument cachedFields;
	private final @Nullable ReferenceResolver resolver;
	private @Nullable T target;

	private Reference(@Nullable String collection, @Nullable BsonValue id, BsonDocument cachedFields, @Nullable ReferenceResolver resolver, @Nullable T target) {
		this.collection = collection;
		this.id = id;
		this.cachedFields = cachedFields;
		this.resolver = resolver;
		this.target = target;
	}

	public static <T> Reference<T> to(T target) {
		return new Reference<>(null, null, new BsonDocument(), null, requireNonNull(target));
	}

	public static <T> Reference<T> pointer(String collection, BsonValue id, @Nullable BsonDocument cachedFields, @Nullable ReferenceResolver resolver) {
		return new Reference<>(requireNonNull(collection), requireNonNull(id), cachedFields == null ? new BsonDocument() : cachedFields, resolver, null);
	}

	/**
	 * Recognizes the stored shape of a reference.
	 */
	public static boolean isPointer(BsonValue value) {
		return value.isDocument()
			&& value.asDocument().get(REF_KEY) instanceof BsonString
			&& value.asDocument().containsKey(ID_KEY);
	}

	public static <T> Reference<T> fromBson(BsonDocument pointer, @Nullable ReferenceResolver resolver) {
		BsonValue cache = pointer.get(CACHE_KEY);
		return pointer(
			pointer.getString(REF_KEY).getValue(),
			pointer.get(ID_KEY),
			cache != null && cache.isDocument() ? cache.asDocument() : null,
			resolver);
	}

	/**
	 * @throws ReferenceResolutionException if the target document doesn't exist
	 */
	@SuppressWarnings("unchecked")
	public T get() {
		if (target == null) {
			if (resolver == null) {
				throw new ReferenceResolutionException("Reference to " + id + " in " + collection + " is not bound to a resolver");
			}
			Object resolved = resolver.resolve(collection, id);
			if (resolved == null) {
				throw new ReferenceResolutionException("Cannot find object " + id + " in collection " + collection);
			}
			target = (T) resolved;
		}
		return target;
	}

	public boolean isResolved() {
		return target != null;
	}

	/**
	 * @return the collection named by the stored pointer, or null for a reference built with {@link #to}
	 */
	public @Nullable String collection() {
		return collection;
	}

	public @Nullable BsonValue id() {
		return id;
	}

	public BsonDocument cachedFields() {
		return cachedFields;
	}

	/**
	 * Reads a field copied into the pointer, without resolving it.
	 */
	public @Nullable BsonValue cachedField(String name) {
		return cachedFields.get(name);
	}

	/**
	 * Saves the target if it has been resolved and knows how to save itself.
	 */
	public void save() {
		if (target instanceof Saveable s) {
			s.save();
		}
	}

	/**
	 * @return the stored pointer this reference was read from
	 * @throws IllegalStateException for a reference built with {@link #to}, which has no pointer until serialized
	 */
	public BsonDocument toBson() {
		if (collection == null) {
			throw new IllegalStateException("Reference to " + target + " has not been stored yet");
		}
		BsonDocument result = new BsonDocument(REF_KEY, new BsonString(collection))
			.append(ID_KEY, id);
		if (!cachedFields.isEmpty()) {
			result.append(CACHE_KEY, cachedFields);
		}
		return result;
	}

	@Override
	public String toString() {
		if (collection == null) {
			return "Reference.to(" + target + ")";
		}
		return "Reference(" + collection + ":" + id + (isResolved() ? ", resolved" : "") + ")";
	}
}
