package org.scriptonbasestar.filecache.core.exception;

import java.nio.file.Path;

/**
 * 주어진 경로를 캐시 저장 디렉토리로 초기화할 수 없을 때 발생합니다.
 *
 * @author archmagece
 * @since 2026-10
 */
public class CacheInitException extends SBFileCacheException {

	private final Path path;

	public CacheInitException(Path path, String reason) {
		super("Cannot initialise " + path + " as a backing directory: " + reason);
		this.path = path;
	}

	public CacheInitException(Path path, String reason, Throwable cause) {
		super("Cannot initialise " + path + " as a backing directory: " + reason, cause);
		this.path = path;
	}

	public Path getPath() {
		return path;
	}
}
