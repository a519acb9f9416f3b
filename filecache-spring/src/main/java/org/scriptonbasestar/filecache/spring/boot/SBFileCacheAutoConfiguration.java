package org.scriptonbasestar.filecache.spring.boot;

import org.scriptonbasestar.filecache.engine.SBFileCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;

/**
 * Spring Boot Auto-Configuration for the SB file cache.
 * <p>
 * This auto-configuration will be triggered when:
 * <ul>
 *   <li>SBFileCache class is on the classpath</li>
 *   <li>{@code sb-file-cache.root-directory} is set</li>
 *   <li>No SBFileCache bean is already defined</li>
 * </ul>
 * The bean is closed with the application context, which stops its I/O threads.
 * Files stay on disk.
 * </p>
 *
 * @author archmagece
 * @since 2026-10
 */
@Configuration(proxyBeanMethods = false)
@ConditionalOnClass(SBFileCache.class)
@EnableConfigurationProperties(SBFileCacheProperties.class)
public class SBFileCacheAutoConfiguration {

	private static final Logger log = LoggerFactory.getLogger(SBFileCacheAutoConfiguration.class);

	@Bean(destroyMethod = "close")
	@ConditionalOnMissingBean
	@ConditionalOnProperty(prefix = "sb-file-cache", name = "root-directory")
	public SBFileCache sbFileCache(SBFileCacheProperties properties) {
		log.info("Creating SBFileCache '{}' at {} ({} {})", properties.getName(), properties.getRootDirectory(),
			properties.getCapacity(), properties.getCapacityMode());
		return SBFileCache.builder()
			.rootDirectory(Paths.get(properties.getRootDirectory()))
			.capacity(properties.getCapacityMode(), properties.getCapacity())
			.keyStrategy(properties.getKeyStrategy())
			.ioThreads(properties.getIoThreads())
			.enableMetrics(properties.isEnableMetrics())
			.createDirectory(properties.isCreateDirectory())
			.build();
	}
}
