package org.scriptonbasestar.filecache.metrics.micrometer;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.scriptonbasestar.filecache.core.exception.KeyNotFoundException;
import org.scriptonbasestar.filecache.engine.SBFileCache;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

/**
 * FileCacheMeterBinder 테스트
 *
 * @author archmagece
 * @since 2026-10
 */
public class FileCacheMeterBinderTest {

	@Rule
	public TemporaryFolder tempFolder = new TemporaryFolder();

	private MeterRegistry meterRegistry;
	private SBFileCache cache;

	@Before
	public void setUp() throws Exception {
		meterRegistry = new SimpleMeterRegistry();
		cache = SBFileCache.builder()
			.rootDirectory(tempFolder.newFolder("metered").toPath())
			.maxBytes(1024)
			.enableMetrics(true)
			.ioThreads(1)
			.build();
	}

	@After
	public void tearDown() {
		cache.close();
	}

	@Test
	public void testGaugesFollowCache() throws Exception {
		// Given
		FileCacheMeterBinder.monitor(meterRegistry, cache, "thumbnails", "region", "kr");

		// When
		cache.put(new byte[100]).get(5, TimeUnit.SECONDS);
		cache.put(new byte[50]).get(5, TimeUnit.SECONDS);

		// Then
		assertEquals(2.0, meterRegistry.get("filecache.size").tag("cache", "thumbnails").gauge().value(), 0.001);
		assertEquals(150.0, meterRegistry.get("filecache.weight").tag("region", "kr").gauge().value(), 0.001);
		assertEquals(1024.0, meterRegistry.get("filecache.capacity").tag("mode", "total_bytes").gauge().value(), 0.001);
	}

	@Test
	public void testCountersReadCacheMetrics() throws Exception {
		// Given
		new FileCacheMeterBinder(cache, "thumbnails", Tags.empty()).bindTo(meterRegistry);
		String key = cache.put(new byte[10]).get(5, TimeUnit.SECONDS);

		// When
		cache.get(key).get(5, TimeUnit.SECONDS);
		cache.get(key).get(5, TimeUnit.SECONDS);
		try {
			cache.get("missing").get(5, TimeUnit.SECONDS);
			fail("Expected KeyNotFoundException");
		} catch (ExecutionException e) {
			assertTrue(e.getCause() instanceof KeyNotFoundException);
		}

		// Then
		assertEquals(2.0, meterRegistry.get("filecache.gets").tag("result", "hit").functionCounter().count(), 0.001);
		assertEquals(1.0, meterRegistry.get("filecache.gets").tag("result", "miss").functionCounter().count(), 0.001);
		assertEquals(1.0, meterRegistry.get("filecache.puts").tag("result", "success").functionCounter().count(), 0.001);
		assertEquals(10.0, meterRegistry.get("filecache.written").functionCounter().count(), 0.001);
		assertEquals(2.0 / 3.0, meterRegistry.get("filecache.hit.ratio").gauge().value(), 0.001);
	}

	@Test
	public void testEvictionsAreCounted() throws Exception {
		new FileCacheMeterBinder(cache, "thumbnails", Tags.empty()).bindTo(meterRegistry);

		cache.put(new byte[600]).get(5, TimeUnit.SECONDS);
		cache.put(new byte[600]).get(5, TimeUnit.SECONDS);

		assertEquals(1.0, meterRegistry.get("filecache.evictions").functionCounter().count(), 0.001);
		assertEquals(1.0, meterRegistry.get("filecache.size").gauge().value(), 0.001);
	}

	@Test
	public void testOnlyGaugesWithoutMetrics() throws Exception {
		try (SBFileCache plain = SBFileCache.builder()
				.rootDirectory(tempFolder.newFolder("plain").toPath())
				.maxEntries(5)
				.ioThreads(1)
				.build()) {
			new FileCacheMeterBinder(plain, "plain", Tags.empty()).bindTo(meterRegistry);

			assertNotNull(meterRegistry.find("filecache.size").tag("cache", "plain").gauge());
			assertNull(meterRegistry.find("filecache.gets").tag("cache", "plain").functionCounter());
		}
	}

	@Test(expected = IllegalArgumentException.class)
	public void testRequiresName() {
		new FileCacheMeterBinder(cache, " ", Tags.empty());
	}
}
