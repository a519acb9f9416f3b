package org.scriptonbasestar.filecache.core.strategy;

/**
 * Strategy interface for cache eviction decisions.
 * <p>
 * Implementations track per-key usage and pick the key to evict when the cache
 * has no room for a new entry. They are pure in-memory bookkeeping: no I/O, no
 * failures. The cache engine calls them only while holding its index lock, so
 * implementations need not be thread-safe.
 * </p>
 *
 * @param <K> the type of cache keys
 * @author archmagece
 * @since 2026-10
 */
public interface EvictionStrategy<K> {

	/**
	 * Called when an entry is committed or successfully read.
	 * <p>
	 * A new key starts being tracked, a known key has its usage refreshed
	 * (e.g. LFU increments its counter).
	 * </p>
	 *
	 * @param key the key that was accessed
	 */
	void recordAccess(K key);

	/**
	 * Called when an entry is removed (explicitly, evicted, or dropped as dangling).
	 *
	 * @param key the key that was removed
	 */
	void onRemove(K key);

	/**
	 * Select a key to evict.
	 *
	 * @return the key to evict, or null only if no key is tracked
	 */
	K selectEvictionCandidate();

	/**
	 * @return number of tracked keys
	 */
	int size();

	/**
	 * Clear all tracking data.
	 */
	void clear();
}
