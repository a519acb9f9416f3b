package org.scriptonbasestar.filecache.core.exception;

/**
 * 값 직렬화/역직렬화 실패.
 *
 * @author archmagece
 * @since 2026-10
 */
public class CodecException extends SBFileCacheException {

	public CodecException(String message) {
		super(message);
	}

	public CodecException(String message, Throwable cause) {
		super(message, cause);
	}
}
