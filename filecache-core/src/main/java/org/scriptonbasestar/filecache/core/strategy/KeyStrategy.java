package org.scriptonbasestar.filecache.core.strategy;

/**
 * How keys are produced for cached entries.
 * <p>
 * Chosen once at construction; the two strategies are mutually exclusive.
 * </p>
 *
 * <h3>Usage Examples:</h3>
 * <pre>{@code
 * // RANDOM (default) - put(value) hands out a fresh UUID
 * SBFileCache cache = SBFileCache.builder()
 *     .rootDirectory(dir)
 *     .maxEntries(1000)
 *     .keyStrategy(KeyStrategy.RANDOM)
 *     .build();
 * String key = cache.put(bytes).join();
 *
 * // STRUCTURED - caller picks path-like keys
 * SBFileCache assets = SBFileCache.builder()
 *     .rootDirectory(dir)
 *     .maxBytes(64L * 1024 * 1024)
 *     .keyStrategy(KeyStrategy.STRUCTURED)
 *     .build();
 * assets.put("images/logo.png", bytes).join();
 * }</pre>
 *
 * @author archmagece
 * @since 2026-10
 */
public enum KeyStrategy {
	/**
	 * Fresh UUIDv4 per insertion.
	 * <p>
	 * The 122-bit identifier space makes collisions practically impossible;
	 * a candidate that happens to be live is re-rolled anyway.
	 * Caller-supplied keys are still accepted after validation.
	 * </p>
	 */
	RANDOM,

	/**
	 * Caller data is the key, validated for filesystem safety.
	 * <p>
	 * Keys are {@code /}-separated relative paths such as {@code images/logo.png}.
	 * A key without caller data is rejected. Collisions with live keys surface as
	 * {@link org.scriptonbasestar.filecache.core.exception.KeyCollisionException}.
	 * </p>
	 */
	STRUCTURED
}
