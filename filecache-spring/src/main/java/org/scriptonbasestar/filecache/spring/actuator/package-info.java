/**
 * Spring Boot Actuator integration for SB file cache health monitoring.
 * <p>
 * {@link org.scriptonbasestar.filecache.spring.actuator.FileCacheHealthIndicator} is registered
 * automatically by {@code FileCacheActuatorAutoConfiguration} and shows up under
 * {@code /actuator/health/sbFileCache}.
 * </p>
 *
 * <h2>Manual registration for a second cache:</h2>
 * <pre>{@code
 * @Bean
 * public FileCacheHealthIndicator thumbnailCacheHealthIndicator(SBFileCache thumbnailCache) {
 *     return new FileCacheHealthIndicator("thumbnails", thumbnailCache,
 *         CacheHealthCheck.HealthThresholds.RELAXED);
 * }
 * }</pre>
 *
 * <h2>Configuration:</h2>
 * <pre>
 * # application.yml
 * management:
 *   endpoint:
 *     health:
 *       show-details: always
 * </pre>
 *
 * @author archmagece
 * @since 2026-10
 */
package org.scriptonbasestar.filecache.spring.actuator;
