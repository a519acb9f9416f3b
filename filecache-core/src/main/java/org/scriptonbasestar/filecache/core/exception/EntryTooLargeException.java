package org.scriptonbasestar.filecache.core.exception;

/**
 * 바이트 용량 모드에서 값 하나가 전체 용량보다 클 때 발생합니다.
 *
 * @author archmagece
 * @since 2026-10
 */
public class EntryTooLargeException extends SBFileCacheException {

	private final long size;
	private final long capacity;

	public EntryTooLargeException(long size, long capacity) {
		super("Entry of " + size + " bytes can never fit into a cache of " + capacity + " bytes");
		this.size = size;
		this.capacity = capacity;
	}

	public long getSize() {
		return size;
	}

	public long getCapacity() {
		return capacity;
	}
}
