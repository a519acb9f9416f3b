package org.scriptonbasestar.filecache.core.exception;

import java.io.IOException;

/**
 * 저장소(파일시스템) 입출력 실패.
 * <p>
 * 실패한 키와 원인 {@link IOException}을 함께 전달합니다.
 * 캐시는 재시도하지 않으며 재시도 정책은 호출자의 몫입니다.
 * </p>
 *
 * @author archmagece
 * @since 2026-10
 */
public class StorageFailureException extends SBFileCacheException {

	private final String key;

	public StorageFailureException(String key, IOException cause) {
		super("An error occurred while performing IO for key " + key + ": " + cause.getMessage(), cause);
		this.key = key;
	}

	public String getKey() {
		return key;
	}

	@Override
	public synchronized IOException getCause() {
		return (IOException) super.getCause();
	}
}
