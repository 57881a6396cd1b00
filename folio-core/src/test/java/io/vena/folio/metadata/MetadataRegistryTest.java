package io.vena.folio.metadata;

import io.vena.folio.AbstractFolioCoreTest;
import io.vena.folio.FolioSettings;
import io.vena.folio.MetadataCache;
import io.vena.folio.store.InMemoryDocumentStore;
import io.vena.folio.validation.ValidatorRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import org.bson.BsonArray;
import org.bson.BsonBoolean;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonString;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MetadataRegistryTest extends AbstractFolioCoreTest {
	InMemoryDocumentStore indexStore;
	CountingCache cache;
	MetadataRegistry registry;

	/**
	 * Counts how often each key is built, and can be told to stall or fail.
	 */
	static class CountingCache implements MetadataCache {
		final ConcurrentHashMap<String, AtomicInteger> builds = new ConcurrentHashMap<>();
		volatile long stallMS = 0;
		volatile int failuresRemaining = 0;

		@Override
		public <T> T cached(String key, Function<WatchList, T> producer) {
			builds.computeIfAbsent(key, k -> new AtomicInteger()).incrementAndGet();
			if (failuresRemaining > 0) {
				failuresRemaining--;
				throw new IllegalStateException("Simulated cache failure");
			}
			if (stallMS > 0) {
				try {
					Thread.sleep(stallMS);
				} catch (InterruptedException e) {
					Thread.currentThread().interrupt();
					throw new IllegalStateException(e);
				}
			}
			return producer.apply(source -> { });
		}

		@Override
		public void invalidate(String key) { }

		@Override
		public void invalidateAll() { }

		int buildsOf(Class<?> type) {
			AtomicInteger count = builds.get(type.getName());
			return count == null ? 0 : count.get();
		}
	}

	@BeforeEach
	void setUpRegistry() {
		indexStore = new InMemoryDocumentStore();
		cache = new CountingCache();
		registry = new MetadataRegistry(indexStore, FolioSettings.defaults(), cache, ValidatorRegistry.withBuiltIns());
	}

	@Test
	void of_isCached() {
		SchemaDefinition first = registry.of(User.class);
		assertSame(first, registry.of(User.class));
		assertEquals(1, cache.buildsOf(User.class));
	}

	@Test
	void of_concurrentFirstAccessBuildsOnce() throws Exception {
		cache.stallMS = 100;
		int threads = 8;
		ExecutorService executor = Executors.newFixedThreadPool(threads);
		try {
			CountDownLatch start = new CountDownLatch(1);
			List<Future<SchemaDefinition>> results = new ArrayList<>();
			for (int i = 0; i < threads; i++) {
				Callable<SchemaDefinition> task = () -> {
					start.await();
					return registry.of(Tag.class);
				};
				results.add(executor.submit(task));
			}
			start.countDown();
			SchemaDefinition expected = results.get(0).get(10, SECONDS);
			for (Future<SchemaDefinition> result: results) {
				assertSame(expected, result.get(10, SECONDS));
			}
		} finally {
			executor.shutdownNow();
		}
		assertEquals(1, cache.buildsOf(Tag.class), "Concurrent requests must share one build");
	}

	@Test
	void of_failedBuildIsRetried() {
		cache.failuresRemaining = 1;
		assertThrows(IllegalStateException.class, () -> registry.of(Tag.class));
		SchemaDefinition definition = registry.of(Tag.class);
		assertEquals("tags", definition.collectionName());
		assertEquals(2, cache.buildsOf(Tag.class));
	}

	@Test
	void of_ancestorsBuiltOnce() {
		registry.of(Dog.class);
		registry.of(Cat.class);
		assertEquals(1, cache.buildsOf(Animal.class));
	}

	@Test
	void createIndexes_sentOnFirstBuild() {
		registry.of(User.class);
		registry.of(User.class);
		List<BsonDocument> commands = indexStore.commands();
		assertEquals(1, commands.size(), "One createIndexes command per type");
		BsonDocument command = commands.get(0);
		assertEquals(new BsonString("users"), command.get("createIndexes"));
		BsonArray indexes = command.getArray("indexes");
		assertEquals(2, indexes.size());
		BsonDocument expected = new BsonDocument("key", new BsonDocument("email", new BsonInt32(1)))
			.append("name", new BsonString("unique_email_asc"))
			.append("unique", BsonBoolean.TRUE)
			.append("sparse", BsonBoolean.FALSE)
			.append("background", BsonBoolean.TRUE);
		assertTrue(indexes.contains(expected), "Expected " + expected + " in " + indexes);
	}

	@Test
	void createIndexes_skippedWhenNoIndexes() {
		registry.of(Tag.class);
		assertEquals(List.of(), indexStore.commands());
	}

	@Test
	void createIndexes_canBeDisabled() {
		MetadataRegistry quiet = new MetadataRegistry(indexStore,
			FolioSettings.builder().createIndexes(false).build(),
			MetadataCache.none(),
			ValidatorRegistry.withBuiltIns());
		quiet.of(User.class);
		assertEquals(List.of(), indexStore.commands());
	}

	@Test
	void ofCollectionName_findsBuiltTypes() {
		assertNull(registry.ofCollectionName("users"), "Not mapped until built");
		SchemaDefinition user = registry.of(User.class);
		assertSame(user, registry.ofCollectionName("users"));
		assertNull(registry.ofCollectionName("nothing"));
	}

	@Test
	void ofCollectionName_subclassesDoNotClaimTheSharedCollection() {
		registry.of(Dog.class);
		assertSame(registry.of(Animal.class), registry.ofCollectionName("animals"));
	}

	@Test
	void mapCollection_registersAheadOfUse() {
		registry.mapCollection("people", Member.class);
		assertSame(registry.of(Member.class), registry.ofCollectionName("people"));
	}

	@Test
	void invalidate_rebuilds() {
		SchemaDefinition first = registry.of(Tag.class);
		registry.invalidate(Tag.class);
		SchemaDefinition second = registry.of(Tag.class);
		assertEquals(2, cache.buildsOf(Tag.class));
		assertEquals(first.collectionName(), second.collectionName());
		registry.invalidateAll();
		registry.of(Tag.class);
		assertEquals(3, cache.buildsOf(Tag.class));
	}
}
