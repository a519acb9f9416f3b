package org.scriptonbasestar.filecache.spring.boot;

import org.scriptonbasestar.filecache.core.strategy.CapacityMode;
import org.scriptonbasestar.filecache.core.strategy.KeyStrategy;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the SB file cache.
 * <p>
 * Bind to {@code sb-file-cache.*} properties in application.yml/properties.
 * The cache bean is only created when {@code root-directory} is set.
 * </p>
 *
 * <h3>Example Configuration:</h3>
 * <pre>{@code
 * # application.yml
 * sb-file-cache:
 *   name: thumbnails
 *   root-directory: /var/cache/thumbnails
 *   capacity-mode: total-bytes
 *   capacity: 536870912
 *   key-strategy: structured
 *   io-threads: 8
 *   enable-metrics: true
 *   create-directory: true
 * }</pre>
 *
 * @author archmagece
 * @since 2026-10
 */
@ConfigurationProperties(prefix = "sb-file-cache")
public class SBFileCacheProperties {

	/**
	 * Cache name used as the metrics tag and in health details.
	 */
	private String name = "default";

	/**
	 * Directory that holds the cache files. Must be empty at startup.
	 */
	private String rootDirectory;

	/**
	 * Whether capacity counts entries or stored bytes.
	 */
	private CapacityMode capacityMode = CapacityMode.ENTRY_COUNT;

	/**
	 * Maximum number of entries, or of bytes in TOTAL_BYTES mode.
	 */
	private long capacity = 10_000;

	/**
	 * RANDOM generates UUID keys, STRUCTURED requires caller keys.
	 */
	private KeyStrategy keyStrategy = KeyStrategy.RANDOM;

	/**
	 * Size of the file I/O thread pool.
	 */
	private int ioThreads = 4;

	/**
	 * Enable metrics collection.
	 */
	private boolean enableMetrics = false;

	/**
	 * Create the root directory if it is missing.
	 */
	private boolean createDirectory = false;

	public String getName() {
		return name;
	}

	public void setName(String name) {
		this.name = name;
	}

	public String getRootDirectory() {
		return rootDirectory;
	}

	public void setRootDirectory(String rootDirectory) {
		this.rootDirectory = rootDirectory;
	}

	public CapacityMode getCapacityMode() {
		return capacityMode;
	}

	public void setCapacityMode(CapacityMode capacityMode) {
		this.capacityMode = capacityMode;
	}

	public long getCapacity() {
		return capacity;
	}

	public void setCapacity(long capacity) {
		this.capacity = capacity;
	}

	public KeyStrategy getKeyStrategy() {
		return keyStrategy;
	}

	public void setKeyStrategy(KeyStrategy keyStrategy) {
		this.keyStrategy = keyStrategy;
	}

	public int getIoThreads() {
		return ioThreads;
	}

	public void setIoThreads(int ioThreads) {
		this.ioThreads = ioThreads;
	}

	public boolean isEnableMetrics() {
		return enableMetrics;
	}

	public void setEnableMetrics(boolean enableMetrics) {
		this.enableMetrics = enableMetrics;
	}

	public boolean isCreateDirectory() {
		return createDirectory;
	}

	public void setCreateDirectory(boolean createDirectory) {
		this.createDirectory = createDirectory;
	}
}
