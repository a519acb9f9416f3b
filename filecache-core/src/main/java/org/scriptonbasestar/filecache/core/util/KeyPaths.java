package org.scriptonbasestar.filecache.core.util;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.scriptonbasestar.filecache.core.exception.InvalidKeyException;

import java.nio.file.Path;

/**
 * 캐시 키 ↔ 파일 경로 변환 및 검증 유틸리티
 *
 * 키는 {@code /}로 구분된 상대 경로입니다. 각 세그먼트는 파일 이름으로 안전해야 합니다.
 *
 * @author archmagece
 * @since 2026-10
 */
@Slf4j
@UtilityClass
public class KeyPaths {

	/**
	 * 저장소가 임시 파일 이름에 쓰는 접두어. 키 세그먼트로는 사용할 수 없습니다.
	 */
	public static final String RESERVED_PREFIX = ".sbfc-";

	public static final int MAX_SEGMENT_LENGTH = 255;

	private static final String RESERVED_CHARS = "\\:*?\"<>|";

	/**
	 * 키가 파일시스템에 안전한지 검증합니다.
	 *
	 * @param key 검증할 키
	 * @return 검증된 키 (그대로)
	 * @throws InvalidKeyException 빈 키, 절대 경로, 빈/"."/".." 세그먼트, 예약 문자 또는 제어 문자를 포함한 경우
	 */
	public static String validate(String key) {
		if (key == null || key.isEmpty()) {
			throw new InvalidKeyException(String.valueOf(key), "key must not be empty");
		}
		if (key.startsWith("/")) {
			throw new InvalidKeyException(key, "absolute keys are not allowed");
		}
		for (String segment : key.split("/", -1)) {
			validateSegment(key, segment);
		}
		return key;
	}

	private static void validateSegment(String key, String segment) {
		if (segment.isEmpty()) {
			throw new InvalidKeyException(key, "empty path segment");
		}
		if (segment.equals(".") || segment.equals("..")) {
			throw new InvalidKeyException(key, "traversal segment '" + segment + "'");
		}
		if (segment.length() > MAX_SEGMENT_LENGTH) {
			throw new InvalidKeyException(key, "segment longer than " + MAX_SEGMENT_LENGTH + " characters");
		}
		if (segment.startsWith(RESERVED_PREFIX)) {
			throw new InvalidKeyException(key, "segment uses reserved prefix " + RESERVED_PREFIX);
		}
		for (int i = 0; i < segment.length(); i++) {
			char c = segment.charAt(i);
			if (Character.isISOControl(c)) {
				throw new InvalidKeyException(key, "control character at index " + i);
			}
			if (RESERVED_CHARS.indexOf(c) >= 0) {
				throw new InvalidKeyException(key, "reserved character '" + c + "'");
			}
		}
	}

	/**
	 * 검증된 키를 루트 디렉토리 아래의 파일 경로로 변환합니다.
	 *
	 * @param root 캐시 루트 디렉토리 (절대 경로, 정규화됨)
	 * @param key 검증된 키
	 * @return 키에 대응하는 파일 경로
	 * @throws InvalidKeyException 경로가 루트를 벗어나는 경우
	 */
	public static Path resolve(Path root, String key) {
		Path path = root.resolve(key).normalize();
		if (!path.startsWith(root) || path.equals(root)) {
			throw new InvalidKeyException(key, "resolves outside of " + root);
		}
		if (log.isTraceEnabled()) {
			log.trace("resolve - key : {}, path : {}", key, path);
		}
		return path;
	}
}
