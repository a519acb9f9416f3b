package org.scriptonbasestar.filecache.engine.metrics;

import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

/**
 * CacheMetrics 테스트
 *
 * @author archmagece
 * @since 2026-10
 */
public class CacheMetricsTest {

	private CacheMetrics metrics;

	@Before
	public void setUp() {
		metrics = new CacheMetrics();
	}

	@Test
	public void testInitialState() {
		assertEquals(0, metrics.requestCount());
		assertEquals(0.0, metrics.hitRate(), 0.001);
		assertEquals(0.0, metrics.storageFailureRate(), 0.001);
		assertEquals(0.0, metrics.averageReadTime(), 0.001);
	}

	@Test
	public void testHitAndMissRates() {
		// Given
		for (int i = 0; i < 3; i++) {
			metrics.recordHit(1_000);
		}
		metrics.recordMiss();

		// Then
		assertEquals(4, metrics.requestCount());
		assertEquals(0.75, metrics.hitRate(), 0.001);
		assertEquals(0.25, metrics.missRate(), 0.001);
		assertEquals(1_000.0, metrics.averageReadTime(), 0.001);
	}

	@Test
	public void testStorageFailureRate() {
		// Given - 저장소 작업 10회 중 2회 실패
		for (int i = 0; i < 4; i++) {
			metrics.recordWrite(100);
		}
		for (int i = 0; i < 4; i++) {
			metrics.recordHit(10);
		}
		metrics.recordWriteFailure();
		metrics.recordDeleteFailure();

		// Then
		assertEquals(2, metrics.storageFailureCount());
		assertEquals(0.2, metrics.storageFailureRate(), 0.001);
		assertEquals(400, metrics.writtenBytes());
	}

	@Test
	public void testReset() {
		metrics.recordHit(5);
		metrics.recordEviction(3);
		metrics.recordSelfHeal();

		metrics.reset();

		assertEquals(0, metrics.hitCount());
		assertEquals(0, metrics.evictionCount());
		assertEquals(0, metrics.selfHealCount());
	}

	@Test
	public void testToString() {
		metrics.recordHit(2_000);
		metrics.recordMiss();

		String text = metrics.toString();

		assertTrue(text.contains("hits=1"));
		assertTrue(text.contains("misses=1"));
		assertTrue(text.contains("hitRate=50.00%"));
	}
}
