package org.scriptonbasestar.filecache.spring.boot;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.scriptonbasestar.filecache.core.strategy.CapacityMode;
import org.scriptonbasestar.filecache.core.strategy.KeyStrategy;
import org.scriptonbasestar.filecache.engine.SBFileCache;
import org.scriptonbasestar.filecache.metrics.micrometer.FileCacheMeterBinder;
import org.scriptonbasestar.filecache.spring.actuator.FileCacheHealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.io.File;
import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * SBFileCacheAutoConfiguration 테스트
 *
 * @author archmagece
 * @since 2026-10
 */
public class SBFileCacheAutoConfigurationTest {

	@Rule
	public TemporaryFolder temp = new TemporaryFolder();

	private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
		.withConfiguration(AutoConfigurations.of(
			SBFileCacheAutoConfiguration.class, FileCacheActuatorAutoConfiguration.class));

	@Test
	public void testCacheCreatedFromProperties() throws IOException {
		// Given
		File root = temp.newFolder("cache");

		// When & Then
		contextRunner
			.withPropertyValues(
				"sb-file-cache.root-directory=" + root.getAbsolutePath(),
				"sb-file-cache.capacity-mode=total-bytes",
				"sb-file-cache.capacity=4096",
				"sb-file-cache.key-strategy=structured",
				"sb-file-cache.io-threads=2")
			.run(context -> {
				assertThat(context).hasSingleBean(SBFileCache.class);
				SBFileCache cache = context.getBean(SBFileCache.class);
				assertThat(cache.capacityMode()).isEqualTo(CapacityMode.TOTAL_BYTES);
				assertThat(cache.capacity()).isEqualTo(4096L);
				assertThat(cache.keyStrategy()).isEqualTo(KeyStrategy.STRUCTURED);
				assertThat(cache.metrics()).isNull();
			});
	}

	@Test
	public void testCacheClosedWithContext() throws IOException {
		// Given
		File root = temp.newFolder("cache");
		SBFileCache[] holder = new SBFileCache[1];

		// When
		contextRunner
			.withPropertyValues("sb-file-cache.root-directory=" + root.getAbsolutePath())
			.run(context -> holder[0] = context.getBean(SBFileCache.class));

		// Then - 컨텍스트 종료 시 close 호출
		assertThat(holder[0].isClosed()).isTrue();
	}

	@Test
	public void testCreateDirectory() throws IOException {
		// Given - 존재하지 않는 루트
		File root = new File(temp.getRoot(), "missing/cache");

		// When & Then
		contextRunner
			.withPropertyValues(
				"sb-file-cache.root-directory=" + root.getAbsolutePath(),
				"sb-file-cache.create-directory=true")
			.run(context -> {
				assertThat(context).hasSingleBean(SBFileCache.class);
				assertThat(root).isDirectory();
			});
	}

	@Test
	public void testMissingDirectoryFailsStartup() {
		// Given
		File root = new File(temp.getRoot(), "missing");

		// When & Then
		contextRunner
			.withPropertyValues("sb-file-cache.root-directory=" + root.getAbsolutePath())
			.run(context -> assertThat(context).hasFailed());
	}

	@Test
	public void testBacksOffWithoutRootDirectory() {
		contextRunner.run(context -> {
			assertThat(context).doesNotHaveBean(SBFileCache.class);
			assertThat(context).doesNotHaveBean(FileCacheHealthIndicator.class);
			assertThat(context).doesNotHaveBean(FileCacheMeterBinder.class);
		});
	}

	@Test
	public void testBacksOffWithUserDefinedCache() throws IOException {
		// Given
		File root = temp.newFolder("user");
		File other = temp.newFolder("auto");

		// When & Then
		contextRunner
			.withUserConfiguration(UserCacheConfiguration.class)
			.withPropertyValues(
				"user.root=" + root.getAbsolutePath(),
				"sb-file-cache.root-directory=" + other.getAbsolutePath())
			.run(context -> {
				assertThat(context).hasSingleBean(SBFileCache.class);
				assertThat(context.getBean(SBFileCache.class).capacity()).isEqualTo(7L);
				assertThat(context).hasSingleBean(FileCacheHealthIndicator.class);
			});
	}

	@Test
	public void testHealthIndicatorAndMeterBinder() throws IOException {
		// Given
		File root = temp.newFolder("cache");

		// When & Then
		contextRunner
			.withPropertyValues(
				"sb-file-cache.name=thumbnails",
				"sb-file-cache.root-directory=" + root.getAbsolutePath(),
				"sb-file-cache.enable-metrics=true")
			.run(context -> {
				assertThat(context).hasSingleBean(FileCacheHealthIndicator.class);
				assertThat(context).hasSingleBean(FileCacheMeterBinder.class);
				assertThat(context.getBean(FileCacheHealthIndicator.class).health().getDetails())
					.containsEntry("cacheName", "thumbnails");
			});
	}

	@Configuration(proxyBeanMethods = false)
	static class UserCacheConfiguration {

		@Bean(destroyMethod = "close")
		public SBFileCache userCache(Environment environment) {
			return SBFileCache.builder()
				.rootDirectory(new File(environment.getProperty("user.root")).toPath())
				.maxEntries(7)
				.build();
		}
	}
}
