package org.scriptonbasestar.filecache.engine;

import org.scriptonbasestar.filecache.core.codec.ValueCodec;
import org.scriptonbasestar.filecache.core.exception.CodecException;

import java.util.concurrent.CompletableFuture;

/**
 * {@link SBFileCache} 위에 값 직렬화를 얹은 타입 지정 뷰
 *
 * <pre>
 *		TypedFileCache&lt;String&gt; notes = new TypedFileCache&lt;&gt;(cache, ValueCodec.utf8());
 *		String key = notes.put("hello").join();
 *		String value = notes.get(key).join();
 * </pre>
 *
 * 인코딩 실패는 캐시에 아무것도 쓰지 않고, 디코딩 실패는 저장된 항목을 건드리지 않습니다.
 * 두 경우 모두 {@link CodecException}으로 완료됩니다.
 *
 * @param <V> 값 타입
 * @author archmagece
 * @since 2026-10
 */
public class TypedFileCache<V> {

	private final SBFileCache cache;
	private final ValueCodec<V> codec;

	public TypedFileCache(SBFileCache cache, ValueCodec<V> codec) {
		if (cache == null) {
			throw new IllegalArgumentException("SBFileCache must not be null");
		}
		if (codec == null) {
			throw new IllegalArgumentException("ValueCodec must not be null");
		}
		this.cache = cache;
		this.codec = codec;
	}

	public CompletableFuture<String> put(V value) {
		return put(null, value);
	}

	public CompletableFuture<String> put(String key, V value) {
		byte[] bytes;
		try {
			bytes = codec.encode(value);
		} catch (CodecException e) {
			return CompletableFuture.failedFuture(e);
		}
		return cache.put(key, bytes);
	}

	public CompletableFuture<V> get(String key) {
		return cache.get(key).thenApply(codec::decode);
	}

	public CompletableFuture<Void> remove(String key) {
		return cache.remove(key);
	}

	public SBFileCache cache() {
		return cache;
	}
}
