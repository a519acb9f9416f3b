package org.scriptonbasestar.filecache.core.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * clear() 도중 일부 항목 삭제에 실패했을 때 발생합니다.
 * <p>
 * 삭제되지 못하고 캐시에 남은 키(survivor)와 각각의 실패 원인을 담습니다.
 * </p>
 *
 * @author archmagece
 * @since 2026-10
 */
public class PartialFailureException extends SBFileCacheException {

	private final Map<String, Throwable> failures;

	public PartialFailureException(Map<String, ? extends Throwable> failures) {
		super(failures.size() + " item(s) could not be removed: " + failures.keySet());
		this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
		for (Throwable failure : failures.values()) {
			addSuppressed(failure);
		}
	}

	/**
	 * @return 남은 키 → 실패 원인
	 */
	public Map<String, Throwable> failures() {
		return failures;
	}

	/**
	 * @return 삭제되지 못한 키 목록
	 */
	public Set<String> survivors() {
		return failures.keySet();
	}
}
