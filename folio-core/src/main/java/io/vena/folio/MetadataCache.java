package io.vena.folio;

import java.util.function.Function;

/**
 * Stores built metadata outside the process-wide registry, along with the
 * sources it was built from, so stale entries can be detected and rebuilt.
 */
public interface MetadataCache {
	/**
	 * @return the cached value for <code>key</code> if it is present and none of its
	 * watched sources have changed; otherwise the result of running <code>producer</code>,
	 * which is cached for next time
	 */
	<T> T cached(String key, Function<WatchList, T> producer);

	void invalidate(String key);

	void invalidateAll();

	/**
	 * Collects the sources a cached value depends on while it is being produced.
	 */
	interface WatchList {
		void watch(String source);
	}

	/**
	 * @return a cache that caches nothing
	 */
	static MetadataCache none() {
		return NoMetadataCache.INSTANCE;
	}

	enum NoMetadataCache implements MetadataCache {
		INSTANCE;

		@Override
		public <T> T cached(String key, Function<WatchList, T> producer) {
			return producer.apply(source -> { });
		}

		@Override
		public void invalidate(String key) { }

		@Override
		public void invalidateAll() { }
	}
}
