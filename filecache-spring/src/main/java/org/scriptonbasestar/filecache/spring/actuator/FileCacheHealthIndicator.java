package org.scriptonbasestar.filecache.spring.actuator;

import org.scriptonbasestar.filecache.engine.SBFileCache;
import org.scriptonbasestar.filecache.engine.metrics.CacheHealthCheck;
import org.scriptonbasestar.filecache.engine.metrics.CacheMetrics;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.nio.file.Files;
import java.util.Locale;

/**
 * Spring Boot Actuator HealthIndicator for an SBFileCache.
 * <p>
 * Reports DOWN when the cache is closed, when its root directory is no longer a writable
 * directory, or when the metrics-based health check finds errors. Without metrics only the
 * capacity details are reported.
 * </p>
 *
 * <h3>Response Format:</h3>
 * <pre>{@code
 * {
 *   "status": "UP",
 *   "details": {
 *     "cacheName": "thumbnails",
 *     "rootDirectory": "/var/cache/thumbnails",
 *     "size": 1200,
 *     "weight": 210763776,
 *     "capacity": 536870912,
 *     "capacityMode": "TOTAL_BYTES",
 *     "hitRate": "85.00%",
 *     "storageFailureCount": 0,
 *     "selfHealCount": 0
 *   }
 * }
 * }</pre>
 *
 * @author archmagece
 * @since 2026-10
 */
public class FileCacheHealthIndicator implements HealthIndicator {

	private final String cacheName;
	private final SBFileCache cache;
	private final CacheHealthCheck healthCheck;  // null이면 메트릭 비활성화

	public FileCacheHealthIndicator(String cacheName, SBFileCache cache) {
		this(cacheName, cache, CacheHealthCheck.HealthThresholds.DEFAULT);
	}

	/**
	 * Creates a new FileCacheHealthIndicator with custom health thresholds.
	 *
	 * @param cacheName  the cache name for identification
	 * @param cache      the cache to monitor
	 * @param thresholds custom health thresholds
	 */
	public FileCacheHealthIndicator(String cacheName, SBFileCache cache,
									CacheHealthCheck.HealthThresholds thresholds) {
		if (cacheName == null || cacheName.trim().isEmpty()) {
			throw new IllegalArgumentException("cacheName must not be null or empty");
		}
		if (cache == null) {
			throw new IllegalArgumentException("cache must not be null");
		}
		if (thresholds == null) {
			throw new IllegalArgumentException("thresholds must not be null");
		}
		this.cacheName = cacheName;
		this.cache = cache;
		this.healthCheck = cache.metrics() == null ? null : new CacheHealthCheck(cache.metrics(), thresholds);
	}

	@Override
	public Health health() {
		Health.Builder builder = Health.up();
		builder.withDetail("cacheName", cacheName);
		builder.withDetail("rootDirectory", cache.rootDirectory().toString());

		if (cache.isClosed()) {
			return builder.down().withDetail("error", "cache is closed").build();
		}
		if (!Files.isDirectory(cache.rootDirectory()) || !Files.isWritable(cache.rootDirectory())) {
			builder.down().withDetail("error", "root directory is missing or not writable");
		}

		builder.withDetail("size", cache.size());
		builder.withDetail("weight", cache.weight());
		builder.withDetail("capacity", cache.capacity());
		builder.withDetail("capacityMode", cache.capacityMode().name());

		if (healthCheck == null) {
			builder.withDetail("metrics", "disabled");
			return builder.build();
		}

		CacheMetrics metrics = cache.metrics();
		builder.withDetail("requestCount", metrics.requestCount());
		builder.withDetail("hitRate", String.format(Locale.ROOT, "%.2f%%", metrics.hitRate() * 100));
		builder.withDetail("evictionCount", metrics.evictionCount());
		builder.withDetail("storageFailureCount", metrics.storageFailureCount());
		builder.withDetail("selfHealCount", metrics.selfHealCount());
		builder.withDetail("averageReadTime", String.format(Locale.ROOT, "%.2fms", metrics.averageReadTime() / 1_000_000.0));

		CacheHealthCheck.HealthStatus status = healthCheck.check();
		if (!status.isHealthy()) {
			builder.down();
		}
		if (status.warnings().length > 0) {
			builder.withDetail("warnings", status.warnings());
		}
		if (status.errors().length > 0) {
			builder.withDetail("errors", status.errors());
		}
		return builder.build();
	}
}
