package io.vena.folio;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link MetadataCache} that rebuilds an entry when the modification time of
 * any of its watched sources changes. Sources are class-file URLs;
 * <code>jar:</code> URLs are tracked by the modification time of the jar.
 * Sources that aren't files are assumed never to change.
 */
public final class WatchingMetadataCache implements MetadataCache {
	private final Map<String, Entry> entries = new ConcurrentHashMap<>();

	private record Entry(Object value, Map<String, Long> stamps) { }

	@Override
	@SuppressWarnings("unchecked")
	public <T> T cached(String key, Function<WatchList, T> producer) {
		Entry existing = entries.get(key);
		if (existing != null) {
			if (isFresh(existing)) {
				LOGGER.trace("Cache hit for {}", key);
				return (T) existing.value();
			}
			LOGGER.debug("Sources of {} changed; rebuilding", key);
		}
		Map<String, Long> stamps = new LinkedHashMap<>();
		T value = producer.apply(source -> stamps.put(source, modificationTime(source)));
		entries.put(key, new Entry(value, stamps));
		return value;
	}

	@Override
	public void invalidate(String key) {
		if (entries.remove(key) != null) {
			LOGGER.debug("Invalidated {}", key);
		}
	}

	@Override
	public void invalidateAll() {
		entries.clear();
	}

	private static boolean isFresh(Entry entry) {
		for (Map.Entry<String, Long> stamp: entry.stamps().entrySet()) {
			if (modificationTime(stamp.getKey()) != stamp.getValue()) {
				return false;
			}
		}
		return true;
	}

	static long modificationTime(String source) {
		Path path = pathOf(source);
		if (path == null) {
			return -1;
		}
		try {
			return Files.getLastModifiedTime(path).toMillis();
		} catch (IOException e) {
			LOGGER.debug("Unable to read modification time of {}", path, e);
			return -1;
		}
	}

	private static Path pathOf(String source) {
		String location = source;
		if (location.startsWith("jar:")) {
			int separator = location.indexOf("!/");
			location = location.substring("jar:".length(), separator < 0 ? location.length() : separator);
		}
		if (!location.startsWith("file:")) {
			return null;
		}
		try {
			return Paths.get(new URI(location));
		} catch (URISyntaxException | IllegalArgumentException e) {
			LOGGER.debug("Unable to interpret {} as a file", source, e);
			return null;
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(WatchingMetadataCache.class);
}
