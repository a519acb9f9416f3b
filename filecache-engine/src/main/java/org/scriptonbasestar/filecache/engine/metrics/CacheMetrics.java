package org.scriptonbasestar.filecache.engine.metrics;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 파일 캐시 통계 및 메트릭 정보를 제공합니다.
 *
 * 스레드 안전하며 오버헤드가 거의 없도록 AtomicLong을 사용합니다.
 * 저장소 실패(쓰기/읽기/삭제)는 요청 성공/실패와 별도로 집계됩니다.
 *
 * @author archmagece
 * @since 2026-10
 */
public class CacheMetrics {

	private final AtomicLong hitCount = new AtomicLong(0);
	private final AtomicLong missCount = new AtomicLong(0);
	private final AtomicLong writeCount = new AtomicLong(0);
	private final AtomicLong writtenBytes = new AtomicLong(0);
	private final AtomicLong writeFailureCount = new AtomicLong(0);
	private final AtomicLong readFailureCount = new AtomicLong(0);
	private final AtomicLong deleteCount = new AtomicLong(0);
	private final AtomicLong deleteFailureCount = new AtomicLong(0);
	private final AtomicLong evictionCount = new AtomicLong(0);
	private final AtomicLong selfHealCount = new AtomicLong(0);
	private final AtomicLong totalReadTime = new AtomicLong(0);  // 나노초

	/**
	 * 캐시 히트를 기록합니다.
	 *
	 * @param readTimeNanos 파일 읽기에 걸린 시간 (나노초)
	 */
	public void recordHit(long readTimeNanos) {
		hitCount.incrementAndGet();
		totalReadTime.addAndGet(readTimeNanos);
	}

	/**
	 * 캐시 미스(키 없음)를 기록합니다.
	 */
	public void recordMiss() {
		missCount.incrementAndGet();
	}

	/**
	 * 값 쓰기 성공을 기록합니다.
	 *
	 * @param bytes 기록된 바이트 수
	 */
	public void recordWrite(long bytes) {
		writeCount.incrementAndGet();
		writtenBytes.addAndGet(bytes);
	}

	public void recordWriteFailure() {
		writeFailureCount.incrementAndGet();
	}

	public void recordReadFailure() {
		readFailureCount.incrementAndGet();
	}

	public void recordDelete() {
		deleteCount.incrementAndGet();
	}

	public void recordDeleteFailure() {
		deleteFailureCount.incrementAndGet();
	}

	/**
	 * 용량 확보를 위한 축출을 기록합니다.
	 *
	 * @param count 축출된 항목 수
	 */
	public void recordEviction(int count) {
		evictionCount.addAndGet(count);
	}

	/**
	 * 읽기 실패로 인덱스에서 떨어져 나간 항목을 기록합니다.
	 */
	public void recordSelfHeal() {
		selfHealCount.incrementAndGet();
	}

	public long hitCount() {
		return hitCount.get();
	}

	public long missCount() {
		return missCount.get();
	}

	/**
	 * 총 조회 요청 횟수를 반환합니다 (히트 + 미스 + 읽기 실패).
	 *
	 * @return 총 조회 횟수
	 */
	public long requestCount() {
		return hitCount.get() + missCount.get() + readFailureCount.get();
	}

	/**
	 * 캐시 히트율을 계산합니다.
	 *
	 * @return 히트율 (0.0 ~ 1.0), 요청이 없으면 0.0
	 */
	public double hitRate() {
		long requests = requestCount();
		return requests == 0 ? 0.0 : (double) hitCount.get() / requests;
	}

	/**
	 * 캐시 미스율을 계산합니다.
	 *
	 * @return 미스율 (0.0 ~ 1.0), 요청이 없으면 0.0
	 */
	public double missRate() {
		long requests = requestCount();
		return requests == 0 ? 0.0 : (double) missCount.get() / requests;
	}

	public long writeCount() {
		return writeCount.get();
	}

	public long writtenBytes() {
		return writtenBytes.get();
	}

	public long writeFailureCount() {
		return writeFailureCount.get();
	}

	public long readFailureCount() {
		return readFailureCount.get();
	}

	public long deleteCount() {
		return deleteCount.get();
	}

	public long deleteFailureCount() {
		return deleteFailureCount.get();
	}

	public long evictionCount() {
		return evictionCount.get();
	}

	public long selfHealCount() {
		return selfHealCount.get();
	}

	/**
	 * 저장소 실패 횟수를 반환합니다 (쓰기 + 읽기 + 삭제).
	 *
	 * @return 저장소 실패 횟수
	 */
	public long storageFailureCount() {
		return writeFailureCount.get() + readFailureCount.get() + deleteFailureCount.get();
	}

	/**
	 * 저장소 작업 중 실패한 비율을 계산합니다.
	 *
	 * @return 실패율 (0.0 ~ 1.0), 저장소 작업이 없으면 0.0
	 */
	public double storageFailureRate() {
		long failures = storageFailureCount();
		long operations = writeCount.get() + hitCount.get() + deleteCount.get() + failures;
		return operations == 0 ? 0.0 : (double) failures / operations;
	}

	/**
	 * 평균 읽기 시간을 계산합니다.
	 *
	 * @return 평균 읽기 시간 (나노초), 히트가 없으면 0.0
	 */
	public double averageReadTime() {
		long hits = hitCount.get();
		return hits == 0 ? 0.0 : (double) totalReadTime.get() / hits;
	}

	/**
	 * 모든 통계를 초기화합니다.
	 */
	public void reset() {
		hitCount.set(0);
		missCount.set(0);
		writeCount.set(0);
		writtenBytes.set(0);
		writeFailureCount.set(0);
		readFailureCount.set(0);
		deleteCount.set(0);
		deleteFailureCount.set(0);
		evictionCount.set(0);
		selfHealCount.set(0);
		totalReadTime.set(0);
	}

	@Override
	public String toString() {
		return String.format(
			"CacheMetrics{requests=%d, hits=%d, misses=%d, hitRate=%.2f%%, writes=%d, " +
			"storageFailures=%d, evictions=%d, selfHeals=%d, avgReadTime=%.2fμs}",
			requestCount(),
			hitCount(),
			missCount(),
			hitRate() * 100,
			writeCount(),
			storageFailureCount(),
			evictionCount(),
			selfHealCount(),
			averageReadTime() / 1000  // 나노초 → 마이크로초
		);
	}
}
