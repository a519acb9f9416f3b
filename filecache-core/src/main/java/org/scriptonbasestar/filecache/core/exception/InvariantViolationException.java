package org.scriptonbasestar.filecache.core.exception;

/**
 * 인덱스와 축출 전략의 상태가 어긋났을 때 발생합니다.
 * 복구 대상이 아니며 내부 버그를 의미합니다.
 *
 * @author archmagece
 * @since 2026-10
 */
public class InvariantViolationException extends SBFileCacheException {

	public InvariantViolationException(String message) {
		super(message);
	}
}
