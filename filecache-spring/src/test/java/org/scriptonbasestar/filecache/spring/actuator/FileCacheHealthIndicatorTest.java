package org.scriptonbasestar.filecache.spring.actuator;

import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.scriptonbasestar.filecache.engine.SBFileCache;
import org.scriptonbasestar.filecache.engine.metrics.CacheMetrics;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.io.IOException;

import static org.junit.Assert.*;

/**
 * FileCacheHealthIndicator 테스트
 *
 * @author archmagece
 * @since 2026-10
 */
public class FileCacheHealthIndicatorTest {

	@Rule
	public TemporaryFolder temp = new TemporaryFolder();

	private SBFileCache cache;

	@After
	public void tearDown() {
		if (cache != null) {
			cache.close();
		}
	}

	private SBFileCache newCache(boolean metrics) throws IOException {
		cache = SBFileCache.builder()
			.rootDirectory(temp.newFolder("cache").toPath())
			.maxEntries(10)
			.enableMetrics(metrics)
			.build();
		return cache;
	}

	@Test
	public void testHealthyCache() throws IOException {
		// Given - 70% 히트율
		CacheMetrics metrics = newCache(true).metrics();
		for (int i = 0; i < 70; i++) {
			metrics.recordHit(1_000_000L);
		}
		for (int i = 0; i < 30; i++) {
			metrics.recordMiss();
		}
		FileCacheHealthIndicator indicator = new FileCacheHealthIndicator("files", cache);

		// When
		Health health = indicator.health();

		// Then
		assertEquals(Status.UP, health.getStatus());
		assertEquals("files", health.getDetails().get("cacheName"));
		assertEquals(100L, health.getDetails().get("requestCount"));
		assertEquals("70.00%", health.getDetails().get("hitRate"));
		assertEquals(0, health.getDetails().get("size"));
		assertEquals(10L, health.getDetails().get("capacity"));
		assertEquals("ENTRY_COUNT", health.getDetails().get("capacityMode"));
	}

	@Test
	public void testHighStorageFailureRateIsDown() throws IOException {
		// Given - 읽기 실패가 많은 캐시
		CacheMetrics metrics = newCache(true).metrics();
		for (int i = 0; i < 20; i++) {
			metrics.recordHit(1_000L);
		}
		for (int i = 0; i < 5; i++) {
			metrics.recordReadFailure();
		}
		FileCacheHealthIndicator indicator = new FileCacheHealthIndicator("files", cache);

		// When
		Health health = indicator.health();

		// Then
		assertEquals(Status.DOWN, health.getStatus());
		assertNotNull(health.getDetails().get("errors"));
		assertEquals(5L, health.getDetails().get("storageFailureCount"));
	}

	@Test
	public void testMetricsDisabled() throws IOException {
		// Given
		FileCacheHealthIndicator indicator = new FileCacheHealthIndicator("files", newCache(false));

		// When
		Health health = indicator.health();

		// Then
		assertEquals(Status.UP, health.getStatus());
		assertEquals("disabled", health.getDetails().get("metrics"));
		assertNull(health.getDetails().get("hitRate"));
	}

	@Test
	public void testClosedCacheIsDown() throws IOException {
		// Given
		FileCacheHealthIndicator indicator = new FileCacheHealthIndicator("files", newCache(false));
		cache.close();

		// When
		Health health = indicator.health();

		// Then
		assertEquals(Status.DOWN, health.getStatus());
		assertEquals("cache is closed", health.getDetails().get("error"));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testBlankNameRejected() throws IOException {
		new FileCacheHealthIndicator(" ", newCache(false));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNullCacheRejected() {
		new FileCacheHealthIndicator("files", null);
	}
}
