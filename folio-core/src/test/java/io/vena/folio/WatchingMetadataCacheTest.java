package io.vena.folio;

import io.vena.folio.store.InMemoryDocumentStore;
import io.vena.folio.validation.ValidatorRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

public class WatchingMetadataCacheTest {
	@TempDir Path dir;

	@Test
	void cached_rebuildsWhenSourceChanges() throws IOException {
		Path source = Files.writeString(dir.resolve("Thing.class"), "v1");
		Files.setLastModifiedTime(source, FileTime.fromMillis(1_000_000));
		String url = source.toUri().toString();

		WatchingMetadataCache cache = new WatchingMetadataCache();
		AtomicInteger builds = new AtomicInteger();
		assertEquals(1, (int) cache.cached("Thing", watch -> {
			watch.watch(url);
			return builds.incrementAndGet();
		}));
		assertEquals(1, (int) cache.cached("Thing", watch -> builds.incrementAndGet()), "Unchanged source is a cache hit");

		Files.setLastModifiedTime(source, FileTime.fromMillis(2_000_000));
		assertEquals(2, (int) cache.cached("Thing", watch -> {
			watch.watch(url);
			return builds.incrementAndGet();
		}));
		assertEquals(2, builds.get());
	}

	@Test
	void cached_nonFileSourcesNeverChange() {
		WatchingMetadataCache cache = new WatchingMetadataCache();
		AtomicInteger builds = new AtomicInteger();
		cache.cached("Thing", watch -> {
			watch.watch("class:com.example.Thing");
			return builds.incrementAndGet();
		});
		cache.cached("Thing", watch -> builds.incrementAndGet());
		assertEquals(1, builds.get());
	}

	@Test
	void invalidate_forcesRebuild() {
		WatchingMetadataCache cache = new WatchingMetadataCache();
		AtomicInteger builds = new AtomicInteger();
		cache.cached("A", watch -> builds.incrementAndGet());
		cache.cached("B", watch -> builds.incrementAndGet());
		cache.invalidate("A");
		cache.cached("A", watch -> builds.incrementAndGet());
		cache.cached("B", watch -> builds.incrementAndGet());
		assertEquals(3, builds.get());

		cache.invalidateAll();
		cache.cached("B", watch -> builds.incrementAndGet());
		assertEquals(4, builds.get());
	}

	@Test
	void modificationTime_ofJarUrlUsesJar() throws IOException {
		Path jar = Files.writeString(dir.resolve("lib.jar"), "not really a jar");
		Files.setLastModifiedTime(jar, FileTime.fromMillis(3_000_000));
		assertEquals(3_000_000, WatchingMetadataCache.modificationTime("jar:" + jar.toUri() + "!/com/example/Thing.class"));
		assertEquals(-1, WatchingMetadataCache.modificationTime(dir.resolve("missing.class").toUri().toString()));
		assertEquals(-1, WatchingMetadataCache.modificationTime("class:com.example.Thing"));
	}

	@Test
	void folio_usesCacheAcrossInstances() {
		WatchingMetadataCache cache = new WatchingMetadataCache();
		Folio first = new Folio(new InMemoryDocumentStore(), FolioSettings.defaults(), cache, ValidatorRegistry.withBuiltIns());
		Folio second = new Folio(new InMemoryDocumentStore(), FolioSettings.defaults(), cache, ValidatorRegistry.withBuiltIns());
		assertSame(first.metadata(AbstractFolioCoreTest.Tag.class), second.metadata(AbstractFolioCoreTest.Tag.class));
	}
}
