package org.scriptonbasestar.filecache.codec.jackson;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.scriptonbasestar.filecache.core.codec.ValueCodec;
import org.scriptonbasestar.filecache.core.exception.CodecException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Jackson 기반 JSON 값 코덱
 * 객체를 JSON 파일로 저장하고 다시 읽습니다.
 *
 * <p>사용 예시:</p>
 * <pre>{@code
 * TypedFileCache<User> users = new TypedFileCache<>(cache, new JacksonValueCodec<>(User.class));
 * String key = users.put("user/1.json", new User("Alice", 30)).join();
 *
 * TypedFileCache<Map<String, List<Long>>> indexes = new TypedFileCache<>(cache,
 *     new JacksonValueCodec<>(new TypeReference<Map<String, List<Long>>>() {}));
 * }</pre>
 *
 * @param <V> 값 타입
 * @author archmagece
 * @since 2026-10
 */
public class JacksonValueCodec<V> implements ValueCodec<V> {

	private static final Logger log = LoggerFactory.getLogger(JacksonValueCodec.class);

	private final JavaType type;
	private final ObjectMapper objectMapper;

	public JacksonValueCodec(Class<V> type) {
		this(type, new ObjectMapper());
	}

	/**
	 * JacksonValueCodec 생성자 (커스텀 ObjectMapper)
	 *
	 * @param type 값 클래스
	 * @param objectMapper Jackson ObjectMapper
	 */
	public JacksonValueCodec(Class<V> type, ObjectMapper objectMapper) {
		if (type == null) {
			throw new IllegalArgumentException("Type must not be null");
		}
		if (objectMapper == null) {
			throw new IllegalArgumentException("ObjectMapper must not be null");
		}
		this.type = objectMapper.constructType(type);
		this.objectMapper = objectMapper;
	}

	public JacksonValueCodec(TypeReference<V> typeReference) {
		this(typeReference, new ObjectMapper());
	}

	/**
	 * 제네릭 타입용 생성자
	 *
	 * @param typeReference 값 타입 정보
	 * @param objectMapper Jackson ObjectMapper
	 */
	public JacksonValueCodec(TypeReference<V> typeReference, ObjectMapper objectMapper) {
		if (typeReference == null) {
			throw new IllegalArgumentException("TypeReference must not be null");
		}
		if (objectMapper == null) {
			throw new IllegalArgumentException("ObjectMapper must not be null");
		}
		this.type = objectMapper.getTypeFactory().constructType(typeReference);
		this.objectMapper = objectMapper;
	}

	@Override
	public byte[] encode(V value) throws CodecException {
		try {
			return objectMapper.writeValueAsBytes(value);
		} catch (IOException e) {
			log.debug("Failed to encode value as {}", type, e);
			throw new CodecException("Failed to encode value as " + type, e);
		}
	}

	@Override
	public V decode(byte[] bytes) throws CodecException {
		try {
			return objectMapper.readValue(bytes, type);
		} catch (IOException e) {
			log.debug("Failed to decode {} bytes as {}", bytes.length, type, e);
			throw new CodecException("Failed to decode JSON as " + type, e);
		}
	}

	public JavaType type() {
		return type;
	}
}
