/**
 * Micrometer integration for SB file cache metrics.
 *
 * <pre>{@code
 * SBFileCache cache = SBFileCache.builder()
 *     .rootDirectory(root)
 *     .maxEntries(10_000)
 *     .enableMetrics(true)
 *     .build();
 * FileCacheMeterBinder.monitor(registry, cache, "thumbnails", "region", "eu");
 * }</pre>
 *
 * Without {@code enableMetrics(true)} only the size, weight and capacity gauges are registered.
 *
 * @author archmagece
 * @since 2026-10
 */
package org.scriptonbasestar.filecache.metrics.micrometer;
