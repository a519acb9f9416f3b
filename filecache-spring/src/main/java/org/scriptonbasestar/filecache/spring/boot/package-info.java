/**
 * Spring Boot auto-configuration for the SB file cache.
 * <p>
 * Setting {@code sb-file-cache.root-directory} is enough to get an {@code SBFileCache} bean.
 * See {@link org.scriptonbasestar.filecache.spring.boot.SBFileCacheProperties} for all properties.
 * </p>
 *
 * @author archmagece
 * @since 2026-10
 */
package org.scriptonbasestar.filecache.spring.boot;
