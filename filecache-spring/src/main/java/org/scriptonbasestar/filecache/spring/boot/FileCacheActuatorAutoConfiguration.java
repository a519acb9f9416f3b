package org.scriptonbasestar.filecache.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import org.scriptonbasestar.filecache.engine.SBFileCache;
import org.scriptonbasestar.filecache.metrics.micrometer.FileCacheMeterBinder;
import org.scriptonbasestar.filecache.spring.actuator.FileCacheHealthIndicator;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfigureAfter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Health indicator and Micrometer binding for the SBFileCache bean.
 * <p>
 * Each part is only activated when its library (Spring Boot Actuator, Micrometer with
 * {@code filecache-metrics}) is on the classpath. The {@link FileCacheMeterBinder} bean is picked up
 * by every {@link MeterRegistry} that Spring Boot manages.
 * </p>
 *
 * @author archmagece
 * @since 2026-10
 */
@Configuration(proxyBeanMethods = false)
@AutoConfigureAfter(SBFileCacheAutoConfiguration.class)
@ConditionalOnBean(SBFileCache.class)
public class FileCacheActuatorAutoConfiguration {

	@Configuration(proxyBeanMethods = false)
	@ConditionalOnClass(HealthIndicator.class)
	static class HealthConfiguration {

		@Bean
		@ConditionalOnMissingBean(name = "sbFileCacheHealthIndicator")
		public FileCacheHealthIndicator sbFileCacheHealthIndicator(SBFileCache cache, SBFileCacheProperties properties) {
			return new FileCacheHealthIndicator(properties.getName(), cache);
		}
	}

	@Configuration(proxyBeanMethods = false)
	@ConditionalOnClass({MeterRegistry.class, FileCacheMeterBinder.class})
	static class MetricsConfiguration {

		@Bean
		@ConditionalOnMissingBean
		public FileCacheMeterBinder sbFileCacheMeterBinder(SBFileCache cache, SBFileCacheProperties properties) {
			return new FileCacheMeterBinder(cache, properties.getName(), Tags.empty());
		}
	}
}
