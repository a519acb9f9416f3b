package org.scriptonbasestar.filecache.core.exception;

/**
 * 파일 캐시 예외의 최상위 타입.
 *
 * 비동기 연산은 이 타입의 하위 예외로 {@link java.util.concurrent.CompletableFuture}를 실패 처리합니다.
 *
 * @author archmagece
 * @since 2026-10
 */
public class SBFileCacheException extends RuntimeException {

	public SBFileCacheException() {
		super();
	}

	public SBFileCacheException(String message) {
		super(message);
	}

	public SBFileCacheException(String message, Throwable cause) {
		super(message, cause);
	}

	public SBFileCacheException(Throwable cause) {
		super(cause);
	}
}
