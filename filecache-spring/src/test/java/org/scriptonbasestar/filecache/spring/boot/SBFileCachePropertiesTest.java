package org.scriptonbasestar.filecache.spring.boot;

import org.junit.Test;
import org.scriptonbasestar.filecache.core.strategy.CapacityMode;
import org.scriptonbasestar.filecache.core.strategy.KeyStrategy;

import static org.junit.Assert.*;

/**
 * SBFileCacheProperties 테스트
 *
 * @author archmagece
 * @since 2026-10
 */
public class SBFileCachePropertiesTest {

	@Test
	public void testDefaultValues() {
		// Given & When
		SBFileCacheProperties properties = new SBFileCacheProperties();

		// Then
		assertEquals("default", properties.getName());
		assertNull(properties.getRootDirectory());
		assertEquals(CapacityMode.ENTRY_COUNT, properties.getCapacityMode());
		assertEquals(10_000L, properties.getCapacity());
		assertEquals(KeyStrategy.RANDOM, properties.getKeyStrategy());
		assertEquals(4, properties.getIoThreads());
		assertFalse(properties.isEnableMetrics());
		assertFalse(properties.isCreateDirectory());
	}

	@Test
	public void testSetters() {
		// Given
		SBFileCacheProperties properties = new SBFileCacheProperties();

		// When
		properties.setName("thumbnails");
		properties.setRootDirectory("/var/cache/thumbnails");
		properties.setCapacityMode(CapacityMode.TOTAL_BYTES);
		properties.setCapacity(1024L);
		properties.setKeyStrategy(KeyStrategy.STRUCTURED);
		properties.setIoThreads(8);
		properties.setEnableMetrics(true);
		properties.setCreateDirectory(true);

		// Then
		assertEquals("thumbnails", properties.getName());
		assertEquals("/var/cache/thumbnails", properties.getRootDirectory());
		assertEquals(CapacityMode.TOTAL_BYTES, properties.getCapacityMode());
		assertEquals(1024L, properties.getCapacity());
		assertEquals(KeyStrategy.STRUCTURED, properties.getKeyStrategy());
		assertEquals(8, properties.getIoThreads());
		assertTrue(properties.isEnableMetrics());
		assertTrue(properties.isCreateDirectory());
	}
}
