package org.scriptonbasestar.filecache.core.exception;

/**
 * 이미 사용 중인(저장 완료 또는 처리 중) 키로 put을 시도했을 때 발생합니다.
 *
 * @author archmagece
 * @since 2026-10
 */
public class KeyCollisionException extends SBFileCacheException {

	private final String key;

	public KeyCollisionException(String key) {
		super("An item with key " + key + " already exists or is in use");
		this.key = key;
	}

	public String getKey() {
		return key;
	}
}
