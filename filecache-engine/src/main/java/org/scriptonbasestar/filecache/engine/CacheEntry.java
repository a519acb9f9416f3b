package org.scriptonbasestar.filecache.engine;

import java.nio.file.Path;
import java.util.Objects;

/**
 * 캐시 항목 하나: 키, 저장 파일 경로, 용량 계산용 무게.
 * 접근 빈도는 축출 전략이 소유하므로 여기에 두지 않습니다.
 *
 * @author archmagece
 * @since 2026-10
 */
public final class CacheEntry {

	private final String key;
	private final Path path;
	private final long size;
	private final long weight;

	CacheEntry(String key, Path path, long size, long weight) {
		this.key = key;
		this.path = path;
		this.size = size;
		this.weight = weight;
	}

	public String getKey() {
		return key;
	}

	public Path getPath() {
		return path;
	}

	/**
	 * @return 값의 바이트 길이
	 */
	public long getSize() {
		return size;
	}

	/**
	 * @return 용량 계산에 쓰이는 무게 (항목 수 모드 1, 바이트 모드 바이트 길이)
	 */
	public long getWeight() {
		return weight;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof CacheEntry)) {
			return false;
		}
		CacheEntry that = (CacheEntry) o;
		return size == that.size && weight == that.weight && key.equals(that.key) && path.equals(that.path);
	}

	@Override
	public int hashCode() {
		return Objects.hash(key, path, size, weight);
	}

	@Override
	public String toString() {
		return "CacheEntry{key=" + key + ", path=" + path + ", size=" + size + "}";
	}
}
