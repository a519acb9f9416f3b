package org.scriptonbasestar.filecache.metrics.micrometer;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.binder.BaseUnits;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.scriptonbasestar.filecache.engine.SBFileCache;
import org.scriptonbasestar.filecache.engine.metrics.CacheMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.function.ToDoubleFunction;

/**
 * SBFileCache를 Micrometer MeterRegistry에 연결하는 바인더
 *
 * 크기/용량 게이지는 항상 등록되고, 요청/저장소 카운터는 캐시의 메트릭이 활성화된 경우에만 등록됩니다.
 * 카운터는 {@link CacheMetrics}의 누적 값을 그대로 읽는 {@link FunctionCounter}라서 별도 동기화가 필요 없습니다.
 *
 * <p>사용 예시:</p>
 * <pre>{@code
 * SBFileCache cache = SBFileCache.builder()
 *     .rootDirectory(root)
 *     .maxEntries(10_000)
 *     .enableMetrics(true)
 *     .build();
 *
 * FileCacheMeterBinder.monitor(registry, cache, "thumbnails");
 * }</pre>
 *
 * @author archmagece
 * @since 2026-10
 */
public class FileCacheMeterBinder implements MeterBinder {

	private static final Logger log = LoggerFactory.getLogger(FileCacheMeterBinder.class);

	private final SBFileCache cache;
	private final String cacheName;
	private final Iterable<Tag> tags;

	/**
	 * @param cache 대상 캐시
	 * @param cacheName 캐시 이름 ("cache" 태그로 사용)
	 * @param tags 추가 태그
	 */
	public FileCacheMeterBinder(SBFileCache cache, String cacheName, Iterable<Tag> tags) {
		if (cache == null) {
			throw new IllegalArgumentException("SBFileCache must not be null");
		}
		if (cacheName == null || cacheName.trim().isEmpty()) {
			throw new IllegalArgumentException("Cache name must not be null or empty");
		}
		this.cache = cache;
		this.cacheName = cacheName;
		this.tags = Tags.concat(tags, "cache", cacheName);
	}

	/**
	 * 캐시를 레지스트리에 등록합니다.
	 *
	 * @param registry Micrometer 레지스트리
	 * @param cache 대상 캐시
	 * @param cacheName 캐시 이름
	 * @param tags 추가 태그 (key, value 쌍)
	 * @return 등록된 캐시
	 */
	public static SBFileCache monitor(MeterRegistry registry, SBFileCache cache, String cacheName, String... tags) {
		new FileCacheMeterBinder(cache, cacheName, Tags.of(tags)).bindTo(registry);
		return cache;
	}

	@Override
	public void bindTo(MeterRegistry registry) {
		Gauge.builder("filecache.size", cache, SBFileCache::size)
			.tags(tags)
			.description("Number of committed entries")
			.register(registry);
		Gauge.builder("filecache.weight", cache, SBFileCache::weight)
			.tags(tags)
			.description("Capacity used by committed entries, in entries or bytes depending on the capacity mode")
			.register(registry);
		Gauge.builder("filecache.capacity", cache, SBFileCache::capacity)
			.tags(tags)
			.tag("mode", cache.capacityMode().name().toLowerCase(Locale.ROOT))
			.description("Configured capacity")
			.register(registry);

		CacheMetrics metrics = cache.metrics();
		if (metrics == null) {
			log.debug("Metrics disabled for cache {}, only gauges registered", cacheName);
			return;
		}

		counter(registry, "filecache.gets", metrics, CacheMetrics::hitCount, "result", "hit",
			"Reads served from a cache file");
		counter(registry, "filecache.gets", metrics, CacheMetrics::missCount, "result", "miss",
			"Reads of keys not in the cache");
		counter(registry, "filecache.puts", metrics, CacheMetrics::writeCount, "result", "success",
			"Values written into the cache");
		counter(registry, "filecache.puts", metrics, CacheMetrics::writeFailureCount, "result", "failure",
			"Puts that failed on storage");
		counter(registry, "filecache.removals", metrics, CacheMetrics::deleteCount, "result", "success",
			"Entries removed explicitly");
		counter(registry, "filecache.storage.failures", metrics, CacheMetrics::readFailureCount, "operation", "read",
			"Failed storage reads");
		counter(registry, "filecache.storage.failures", metrics, CacheMetrics::deleteFailureCount, "operation", "delete",
			"Failed storage deletes");
		counter(registry, "filecache.evictions", metrics, CacheMetrics::evictionCount, null, null,
			"Entries evicted to make room");
		counter(registry, "filecache.self.heals", metrics, CacheMetrics::selfHealCount, null, null,
			"Entries dropped after their file could not be read");

		FunctionCounter.builder("filecache.written", metrics, CacheMetrics::writtenBytes)
			.tags(tags)
			.baseUnit(BaseUnits.BYTES)
			.description("Bytes written into the cache")
			.register(registry);
		Gauge.builder("filecache.hit.ratio", metrics, CacheMetrics::hitRate)
			.tags(tags)
			.description("Share of reads served from the cache")
			.register(registry);
	}

	private void counter(MeterRegistry registry, String name, CacheMetrics metrics, ToDoubleFunction<CacheMetrics> f,
						 String tagKey, String tagValue, String description) {
		FunctionCounter.Builder<CacheMetrics> builder = FunctionCounter.builder(name, metrics, f)
			.tags(tags)
			.description(description);
		if (tagKey != null) {
			builder.tag(tagKey, tagValue);
		}
		builder.register(registry);
	}
}
