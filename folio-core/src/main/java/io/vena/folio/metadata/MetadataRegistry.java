package io.vena.folio.metadata;

import io.vena.folio.DocumentStore;
import io.vena.folio.FolioSettings;
import io.vena.folio.MetadataCache;
import io.vena.folio.exceptions.ConfigurationException;
import io.vena.folio.validation.ValidatorRegistry;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import org.bson.BsonDocument;
import org.bson.BsonString;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide source of {@link SchemaDefinition}s.
 *
 * <p>
 * Each type is built at most once at a time: concurrent first requests for
 * the same type wait for a single build. A build that fails is forgotten,
 * so the next request tries again.
 */
public final class MetadataRegistry {
	private final ConcurrentHashMap<String, CompletableFuture<SchemaDefinition>> definitions = new ConcurrentHashMap<>();
	private final ConcurrentHashMap<String, Class<?>> typesByCollection = new ConcurrentHashMap<>();
	private final DocumentStore store;
	private final FolioSettings settings;
	private final MetadataCache cache;
	private final SchemaExtractor extractor;

	public MetadataRegistry(DocumentStore store, FolioSettings settings, MetadataCache cache, ValidatorRegistry validators) {
		settings.validate();
		this.store = store;
		this.settings = settings;
		this.cache = cache;
		this.extractor = new SchemaExtractor(this, validators, settings.reservedPrefix());
	}

	public SchemaDefinition of(Class<?> type) {
		String key = type.getName();
		CompletableFuture<SchemaDefinition> future = definitions.get(key);
		if (future == null) {
			CompletableFuture<SchemaDefinition> mine = new CompletableFuture<>();
			future = definitions.putIfAbsent(key, mine);
			if (future == null) {
				build(type, mine);
				future = mine;
			}
		}
		return await(future);
	}

	/**
	 * @throws ConfigurationException if no such class can be loaded
	 */
	public SchemaDefinition of(String typeName) {
		try {
			return of(Class.forName(typeName, true, Thread.currentThread().getContextClassLoader()));
		} catch (ClassNotFoundException | LinkageError e) {
			throw new ConfigurationException("Unknown type " + typeName, e);
		}
	}

	/**
	 * @return the definition of the type stored in <code>collectionName</code>, or null
	 * if no type with its own collection of that name has been mapped yet
	 */
	public @Nullable SchemaDefinition ofCollectionName(String collectionName) {
		Class<?> type = typesByCollection.get(collectionName);
		return type == null ? null : of(type);
	}

	/**
	 * Makes a collection resolvable through {@link #ofCollectionName} before its type has been used.
	 */
	public void mapCollection(String collectionName, Class<?> type) {
		Class<?> previous = typesByCollection.put(collectionName, type);
		if (previous != null && previous != type) {
			LOGGER.warn("Collection {} remapped from {} to {}", collectionName, previous.getName(), type.getName());
		}
	}

	public void invalidate(Class<?> type) {
		definitions.remove(type.getName());
		cache.invalidate(type.getName());
	}

	public void invalidateAll() {
		definitions.clear();
		cache.invalidateAll();
	}

	/**
	 * Sends <code>createIndexes</code> for the definition's indexes, if it has any.
	 *
	 * @return the store's reply, or null if there was nothing to send
	 */
	public @Nullable BsonDocument createIndexes(SchemaDefinition definition) {
		if (definition.indexes().isEmpty()) {
			return null;
		}
		BsonDocument command = new BsonDocument("createIndexes", new BsonString(definition.collectionName()))
			.append("indexes", IndexDef.toBson(definition.indexes()));
		BsonDocument result = store.execute(command);
		LOGGER.info("Created {} index{} on {}",
			definition.indexes().size(),
			definition.indexes().size() == 1 ? "" : "es",
			definition.collectionName());
		return result;
	}

	private void build(Class<?> type, CompletableFuture<SchemaDefinition> future) {
		SchemaDefinition result;
		try {
			result = cache.cached(type.getName(), watchList -> {
				SchemaDefinition built = extractor.extract(type);
				if (settings.createIndexes()) {
					createIndexes(built);
				}
				built.watchedSources().forEach(watchList::watch);
				return built;
			});
		} catch (RuntimeException | Error e) {
			definitions.remove(type.getName(), future);
			future.completeExceptionally(e);
			throw e;
		}
		if (result.hasOwnCollection()) {
			typesByCollection.putIfAbsent(result.collectionName(), type);
		}
		future.complete(result);
	}

	private static SchemaDefinition await(CompletableFuture<SchemaDefinition> future) {
		try {
			return future.join();
		} catch (CompletionException e) {
			if (e.getCause() instanceof RuntimeException r) {
				throw r;
			} else if (e.getCause() instanceof Error err) {
				throw err;
			}
			throw e;
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(MetadataRegistry.class);
}
