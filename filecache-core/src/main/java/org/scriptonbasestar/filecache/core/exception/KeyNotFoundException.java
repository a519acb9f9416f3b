package org.scriptonbasestar.filecache.core.exception;

/**
 * 캐시에 없는 키로 조회/삭제를 시도했을 때 발생합니다.
 *
 * @author archmagece
 * @since 2026-10
 */
public class KeyNotFoundException extends SBFileCacheException {

	private final String key;

	public KeyNotFoundException(String key) {
		super("Cannot find an item with key " + key + " in cache");
		this.key = key;
	}

	public String getKey() {
		return key;
	}
}
