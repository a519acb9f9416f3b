package org.scriptonbasestar.filecache.core.codec;

import org.scriptonbasestar.filecache.core.exception.CodecException;

import java.nio.charset.StandardCharsets;

/**
 * 값 객체와 파일 바이트 사이의 변환기.
 *
 * <p>사용 예시:</p>
 * <pre>{@code
 * TypedFileCache<String> texts = new TypedFileCache<>(cache, ValueCodec.utf8());
 * String key = texts.put("hello").join();
 * }</pre>
 *
 * @param <V> 값 타입
 * @author archmagece
 * @since 2026-10
 */
public interface ValueCodec<V> {

	/**
	 * @param value 저장할 값
	 * @return 파일에 기록할 바이트
	 * @throws CodecException 직렬화 실패 시
	 */
	byte[] encode(V value) throws CodecException;

	/**
	 * @param bytes 파일에서 읽은 바이트
	 * @return 복원한 값
	 * @throws CodecException 역직렬화 실패 시
	 */
	V decode(byte[] bytes) throws CodecException;

	/**
	 * 바이트를 그대로 저장하는 코덱
	 */
	static ValueCodec<byte[]> identity() {
		return new ValueCodec<byte[]>() {
			@Override
			public byte[] encode(byte[] value) {
				return value;
			}

			@Override
			public byte[] decode(byte[] bytes) {
				return bytes;
			}
		};
	}

	/**
	 * UTF-8 문자열 코덱
	 */
	static ValueCodec<String> utf8() {
		return new ValueCodec<String>() {
			@Override
			public byte[] encode(String value) {
				if (value == null) {
					throw new CodecException("Cannot encode null string");
				}
				return value.getBytes(StandardCharsets.UTF_8);
			}

			@Override
			public String decode(byte[] bytes) {
				return new String(bytes, StandardCharsets.UTF_8);
			}
		};
	}
}
