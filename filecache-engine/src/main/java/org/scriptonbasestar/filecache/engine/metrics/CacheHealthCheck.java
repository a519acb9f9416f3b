package org.scriptonbasestar.filecache.engine.metrics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * 파일 캐시 헬스체크 유틸리티
 *
 * 메트릭을 임계값과 비교해 저장소 문제와 용량 부족을 감지합니다.
 * 	- ERROR: 저장소 실패율이 임계값 초과 (디스크 문제)
 * 	- WARNING: 낮은 히트율, 과도한 축출, 읽을 수 없는 파일로 인한 자가 복구
 * 	- INFO: 판단하기에 요청 수가 부족
 *
 * @author archmagece
 * @since 2026-10
 */
public class CacheHealthCheck {

	private final CacheMetrics metrics;
	private final HealthThresholds thresholds;

	public CacheHealthCheck(CacheMetrics metrics) {
		this(metrics, HealthThresholds.DEFAULT);
	}

	/**
	 * @param metrics 캐시 메트릭
	 * @param thresholds 임계값
	 */
	public CacheHealthCheck(CacheMetrics metrics, HealthThresholds thresholds) {
		if (metrics == null) {
			throw new IllegalArgumentException("Metrics must not be null");
		}
		if (thresholds == null) {
			throw new IllegalArgumentException("Thresholds must not be null");
		}
		this.metrics = metrics;
		this.thresholds = thresholds;
	}

	/**
	 * 현재 메트릭 스냅샷을 평가합니다.
	 *
	 * @return 평가 결과
	 */
	public HealthStatus check() {
		List<Finding> findings = new ArrayList<>();

		double failureRate = metrics.storageFailureRate();
		if (failureRate > thresholds.maxStorageFailureRate) {
			findings.add(new Finding(Severity.ERROR, "High storage failure rate: %s (%d failures, threshold: %s)",
				percent(failureRate), metrics.storageFailureCount(), percent(thresholds.maxStorageFailureRate)));
		}

		long requests = metrics.requestCount();
		if (requests < thresholds.minRequests) {
			findings.add(new Finding(Severity.INFO, "Low request count: %d (threshold: %d)",
				requests, thresholds.minRequests));
		} else if (metrics.hitRate() < thresholds.minHitRate) {
			findings.add(new Finding(Severity.WARNING, "Low hit rate: %s (threshold: %s)",
				percent(metrics.hitRate()), percent(thresholds.minHitRate)));
		}

		long writes = metrics.writeCount();
		long evictions = metrics.evictionCount();
		if (writes >= thresholds.minRequests && evictions > writes * thresholds.maxEvictionsPerWrite) {
			findings.add(new Finding(Severity.WARNING, "Capacity pressure: %d evictions for %d writes",
				evictions, writes));
		}

		long selfHeals = metrics.selfHealCount();
		if (selfHeals > 0) {
			findings.add(new Finding(Severity.WARNING, "%d entr%s dropped after unreadable files",
				selfHeals, selfHeals == 1 ? "y" : "ies"));
		}

		return new HealthStatus(findings);
	}

	public boolean isHealthy() {
		return check().isHealthy();
	}

	private static String percent(double ratio) {
		return String.format(Locale.ROOT, "%.2f%%", ratio * 100);
	}

	public enum Severity {
		ERROR, WARNING, INFO
	}

	/**
	 * 헬스체크 항목 하나
	 */
	public static final class Finding {
		private final Severity severity;
		private final String message;

		Finding(Severity severity, String format, Object... args) {
			this.severity = severity;
			this.message = String.format(Locale.ROOT, format, args);
		}

		public Severity severity() {
			return severity;
		}

		public String message() {
			return message;
		}

		@Override
		public String toString() {
			return severity + ": " + message;
		}
	}

	/**
	 * 건강 임계값 설정
	 */
	public static class HealthThresholds {

		public static final HealthThresholds DEFAULT = new HealthThresholds(0.5, 0.01, 10, 0.9);

		public static final HealthThresholds STRICT = new HealthThresholds(0.8, 0.0, 100, 0.5);

		public static final HealthThresholds RELAXED = new HealthThresholds(0.3, 0.05, 5, 2.0);

		public final double minHitRate;
		public final double maxStorageFailureRate;
		public final long minRequests;
		/**
		 * 쓰기 한 번당 허용하는 평균 축출 수. 바이트 모드에서는 1을 넘을 수 있습니다.
		 */
		public final double maxEvictionsPerWrite;

		public HealthThresholds(double minHitRate, double maxStorageFailureRate, long minRequests,
								double maxEvictionsPerWrite) {
			this.minHitRate = minHitRate;
			this.maxStorageFailureRate = maxStorageFailureRate;
			this.minRequests = minRequests;
			this.maxEvictionsPerWrite = maxEvictionsPerWrite;
		}
	}

	/**
	 * 평가 결과. ERROR 항목이 하나라도 있으면 건강하지 않습니다.
	 */
	public static class HealthStatus {

		private final List<Finding> findings;

		private HealthStatus(List<Finding> findings) {
			this.findings = Collections.unmodifiableList(findings);
		}

		public boolean isHealthy() {
			return errors().length == 0;
		}

		public List<Finding> findings() {
			return findings;
		}

		public String[] errors() {
			return messages(Severity.ERROR);
		}

		public String[] warnings() {
			return messages(Severity.WARNING);
		}

		public String[] info() {
			return messages(Severity.INFO);
		}

		private String[] messages(Severity severity) {
			return findings.stream()
				.filter(f -> f.severity == severity)
				.map(Finding::message)
				.toArray(String[]::new);
		}

		@Override
		public String toString() {
			return "HealthStatus{healthy=" + isHealthy() + ", findings=" + findings + "}";
		}
	}
}
