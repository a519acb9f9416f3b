package org.scriptonbasestar.filecache.engine.key;

import org.scriptonbasestar.filecache.core.exception.InvalidKeyException;
import org.scriptonbasestar.filecache.core.exception.InvariantViolationException;
import org.scriptonbasestar.filecache.core.strategy.KeyStrategy;
import org.scriptonbasestar.filecache.core.util.KeyPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;
import java.util.function.Predicate;

/**
 * 키 생성기
 *
 * {@link KeyStrategy}에 따라 새 키를 발급하거나 호출자가 준 키를 검증합니다.
 *
 * @author archmagece
 * @since 2026-10
 */
public final class KeyGenerator {

	private static final Logger log = LoggerFactory.getLogger(KeyGenerator.class);

	// UUIDv4 충돌은 사실상 불가능하므로 이 횟수를 넘기면 내부 오류로 본다
	private static final int MAX_ATTEMPTS = 16;

	private final KeyStrategy strategy;

	private KeyGenerator(KeyStrategy strategy) {
		this.strategy = strategy;
	}

	public static KeyGenerator of(KeyStrategy strategy) {
		if (strategy == null) {
			throw new IllegalArgumentException("KeyStrategy must not be null");
		}
		return new KeyGenerator(strategy);
	}

	/**
	 * 새 키를 발급합니다. 사용 중인 키와 겹치면 다시 뽑습니다.
	 *
	 * @param inUse 사용 중인 키 판별 함수
	 * @return 새 키
	 * @throws InvalidKeyException STRUCTURED 전략은 키를 발급하지 않음
	 */
	public String generate(Predicate<String> inUse) {
		if (strategy == KeyStrategy.STRUCTURED) {
			throw new InvalidKeyException("(none)", "structured key strategy requires a caller-supplied key");
		}
		for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
			String candidate = UUID.randomUUID().toString();
			if (!inUse.test(candidate)) {
				return candidate;
			}
			log.debug("Generated key already in use, re-rolling: {}", candidate);
		}
		throw new InvariantViolationException("Could not generate an unused key after " + MAX_ATTEMPTS + " attempts");
	}

	/**
	 * 호출자가 준 키를 검증합니다. 사용 중인지 여부는 캐시 엔진이 확인합니다.
	 *
	 * @param key 호출자 키
	 * @return 검증된 키
	 * @throws InvalidKeyException 파일시스템에 안전하지 않은 키
	 */
	public String accept(String key) {
		return KeyPaths.validate(key);
	}

	public KeyStrategy strategy() {
		return strategy;
	}
}
