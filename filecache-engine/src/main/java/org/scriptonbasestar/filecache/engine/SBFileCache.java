package org.scriptonbasestar.filecache.engine;

import org.scriptonbasestar.filecache.core.exception.CacheInitException;
import org.scriptonbasestar.filecache.core.exception.EntryTooLargeException;
import org.scriptonbasestar.filecache.core.exception.InvariantViolationException;
import org.scriptonbasestar.filecache.core.exception.KeyCollisionException;
import org.scriptonbasestar.filecache.core.exception.KeyNotFoundException;
import org.scriptonbasestar.filecache.core.exception.PartialFailureException;
import org.scriptonbasestar.filecache.core.exception.SBFileCacheException;
import org.scriptonbasestar.filecache.core.exception.StorageFailureException;
import org.scriptonbasestar.filecache.core.storage.StorageBackend;
import org.scriptonbasestar.filecache.core.strategy.CapacityMode;
import org.scriptonbasestar.filecache.core.strategy.EvictionStrategy;
import org.scriptonbasestar.filecache.core.strategy.KeyStrategy;
import org.scriptonbasestar.filecache.core.util.KeyPaths;
import org.scriptonbasestar.filecache.engine.eviction.LfuEvictionStrategy;
import org.scriptonbasestar.filecache.engine.key.KeyGenerator;
import org.scriptonbasestar.filecache.engine.metrics.CacheMetrics;
import org.scriptonbasestar.filecache.engine.storage.AsyncFileStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * 용량 제한이 있는 디스크 기반 LFU 파일 캐시
 *
 * 값은 루트 디렉토리 아래의 파일로 저장되고, 메모리에는 키 → {@link CacheEntry} 인덱스만 유지합니다.
 * 모든 연산은 {@link CompletableFuture}를 반환하며 실패는 {@link SBFileCacheException} 하위 타입으로 전달됩니다.
 *
 * <pre>
 *		try (SBFileCache cache = SBFileCache.builder()
 *				.rootDirectory(Paths.get("/var/cache/thumbnails"))
 *				.maxBytes(512L * 1024 * 1024)
 *				.keyStrategy(KeyStrategy.STRUCTURED)
 *				.enableMetrics(true)
 *				.build()) {
 *			cache.put("user/42/avatar.png", bytes).join();
 *			byte[] avatar = cache.get("user/42/avatar.png").join();
 *		}
 * </pre>
 *
 * 	동작 방식:
 * 	- 인덱스와 축출 전략 변경은 짧은 synchronized 구간에서만 일어나고, 파일 I/O는 락 밖에서 진행
 * 	- 같은 키에 대한 연산은 키 단위 시퀀서로 순서대로 실행, 다른 키의 I/O는 자유롭게 겹침
 * 	- put은 먼저 용량을 예약한 뒤 쓰기가 성공해야 인덱스에 반영 (커밋 무게 + 예약 무게 ≤ capacity)
 * 	- 용량이 모두 진행 중인 put에 예약되어 있으면 put은 FIFO 순서로 대기
 * 	- 축출 대상은 즉시 인덱스에서 빠지고, 새 값을 쓰기 전에 파일이 삭제됨
 * 	- 반환된 future를 취소해도 내부 작업은 중단되지 않음
 *
 * @author archmagece
 * @since 2026-10
 */
public class SBFileCache implements AutoCloseable {

	private static final Logger log = LoggerFactory.getLogger(SBFileCache.class);

	private final Path rootDirectory;
	private final long capacity;
	private final CapacityMode capacityMode;
	private final KeyGenerator keyGenerator;
	private final EvictionStrategy<String> evictionStrategy;  // lock 안에서만 접근
	private final StorageBackend storage;
	private final boolean ownsStorage;  // true면 close()에서 저장소도 닫음
	private final CacheMetrics metrics;  // 통계 (null이면 비활성화)
	private final KeySequencer sequencer = new KeySequencer();
	private final AtomicBoolean closed = new AtomicBoolean(false);

	private final Object lock = new Object();
	private final Map<String, CacheEntry> index = new HashMap<>();
	private final Set<String> writing = new HashSet<>();  // 쓰기 중인 put의 키
	private final Map<String, CacheEntry> evicting = new HashMap<>();  // 파일 삭제 대기 중인 축출/자가 복구 대상
	private final Deque<PendingPut> admissionQueue = new ArrayDeque<>();  // 용량 대기 중인 put (FIFO)
	private long committedWeight;
	private long reservedWeight;

	private SBFileCache(Builder builder, Path rootDirectory, StorageBackend storage, boolean ownsStorage) {
		this.rootDirectory = rootDirectory;
		this.capacity = builder.capacity;
		this.capacityMode = builder.capacityMode;
		this.keyGenerator = KeyGenerator.of(builder.keyStrategy);
		this.evictionStrategy = builder.evictionStrategy != null ? builder.evictionStrategy : new LfuEvictionStrategy<>();
		this.storage = storage;
		this.ownsStorage = ownsStorage;
		this.metrics = builder.enableMetrics ? new CacheMetrics() : null;
		log.debug("SBFileCache created - root : {}, capacity : {} ({}), keyStrategy : {}",
			rootDirectory, capacity, capacityMode, keyGenerator.strategy());
	}

	/**
	 * Builder 패턴을 사용하여 SBFileCache를 생성합니다.
	 *
	 * @return Builder 인스턴스
	 */
	public static Builder builder() {
		return new Builder();
	}

	/**
	 * 키 생성기가 만든 키로 값을 저장합니다.
	 *
	 * @param value 저장할 값
	 * @return 사용된 키. {@link KeyStrategy#STRUCTURED}이면 {@link org.scriptonbasestar.filecache.core.exception.InvalidKeyException}으로 실패
	 */
	public CompletableFuture<String> put(byte[] value) {
		return put(null, value);
	}

	/**
	 * 값을 저장합니다.
	 *
	 * 용량이 부족하면 축출 전략이 고른 항목을 하나씩 축출합니다. 쓰기가 성공한 뒤에만 인덱스에 반영되며,
	 * 실패하면 인덱스는 변경되지 않고 {@link StorageFailureException}으로 완료됩니다.
	 *
	 * @param key 저장할 키, null이면 키 생성기가 생성
	 * @param value 저장할 값
	 * @return 사용된 키
	 */
	public CompletableFuture<String> put(String key, byte[] value) {
		ensureOpen();
		Objects.requireNonNull(value, "value must not be null");

		PendingPut put;
		synchronized (lock) {
			try {
				String resolvedKey = key == null ? keyGenerator.generate(this::isInUseLocked) : keyGenerator.accept(key);
				if (isInUseLocked(resolvedKey)) {
					return CompletableFuture.failedFuture(new KeyCollisionException(resolvedKey));
				}
				long weight = capacityMode.weigh(value.length);
				if (weight > capacity) {
					return CompletableFuture.failedFuture(new EntryTooLargeException(value.length, capacity));
				}
				// 쓰기는 나중에 일어나므로 호출자의 배열을 복사해 둔다
				put = new PendingPut(resolvedKey, KeyPaths.resolve(rootDirectory, resolvedKey), value.clone(), weight);
				if (!admissionQueue.isEmpty() || !tryAdmitLocked(put)) {
					log.trace("put waiting for capacity - key : {}, weight : {}", resolvedKey, weight);
					admissionQueue.addLast(put);
				} else {
					put.admitted = true;
				}
				writing.add(resolvedKey);
			} catch (SBFileCacheException e) {
				return CompletableFuture.failedFuture(e);
			}
		}
		if (put.admitted) {
			start(put);
		}
		return put.result.copy();
	}

	/**
	 * 값을 읽습니다. 읽기에 성공하면 접근 빈도가 증가합니다.
	 *
	 * 인덱스에 있지만 파일을 읽을 수 없는 항목은 인덱스에서 제거한 뒤 {@link StorageFailureException}으로 실패합니다.
	 *
	 * @param key 키
	 * @return 저장된 값, 없으면 {@link KeyNotFoundException}으로 실패
	 */
	public CompletableFuture<byte[]> get(String key) {
		ensureOpen();
		Objects.requireNonNull(key, "key must not be null");
		return sequencer.submit(key, () -> read(key)).copy();
	}

	/**
	 * 항목을 제거합니다. 파일 삭제가 실패하면 항목은 그대로 남습니다.
	 *
	 * @param key 키
	 * @return 완료 future, 없으면 {@link KeyNotFoundException}으로 실패
	 */
	public CompletableFuture<Void> remove(String key) {
		ensureOpen();
		Objects.requireNonNull(key, "key must not be null");
		return removeSequenced(key).copy();
	}

	/**
	 * 현재 커밋된 모든 항목을 제거합니다.
	 *
	 * 일부 키의 삭제가 실패해도 나머지는 계속 제거하며, 실패한 키와 원인은
	 * {@link PartialFailureException}으로 전달됩니다. 그 사이에 이미 제거된 키는 실패로 보지 않습니다.
	 *
	 * @return 완료 future
	 */
	public CompletableFuture<Void> clear() {
		ensureOpen();
		List<String> keys;
		synchronized (lock) {
			keys = new ArrayList<>(index.keySet());
		}
		log.debug("clear - {} entries", keys.size());

		List<CompletableFuture<Throwable>> outcomes = new ArrayList<>(keys.size());
		for (String key : keys) {
			outcomes.add(removeSequenced(key).handle((ignored, error) -> error == null ? null : KeySequencer.unwrap(error)));
		}
		CompletableFuture<Void> cleared = CompletableFuture.allOf(outcomes.toArray(new CompletableFuture[0]))
			.thenApply(ignored -> {
				Map<String, Throwable> failures = new LinkedHashMap<>();
				for (int i = 0; i < keys.size(); i++) {
					Throwable error = outcomes.get(i).join();
					if (error != null && !(error instanceof KeyNotFoundException)) {
						failures.put(keys.get(i), error);
					}
				}
				if (!failures.isEmpty()) {
					log.warn("clear left {} entries behind: {}", failures.size(), failures.keySet());
					throw new PartialFailureException(failures);
				}
				return null;
			});
		return cleared.copy();
	}

	/**
	 * @return 커밋된 항목 수
	 */
	public int size() {
		synchronized (lock) {
			return index.size();
		}
	}

	public long capacity() {
		return capacity;
	}

	public CapacityMode capacityMode() {
		return capacityMode;
	}

	/**
	 * 커밋된 항목이 차지하는 용량을 반환합니다.
	 * 항목 수 모드에서는 {@link #size()}와 같고, 바이트 모드에서는 저장된 바이트 합계입니다.
	 *
	 * @return 사용 중인 용량
	 */
	public long weight() {
		synchronized (lock) {
			return committedWeight;
		}
	}

	public boolean containsKey(String key) {
		synchronized (lock) {
			return index.containsKey(key);
		}
	}

	/**
	 * @return 커밋된 키의 스냅샷
	 */
	public Set<String> keySet() {
		synchronized (lock) {
			return Collections.unmodifiableSet(new LinkedHashSet<>(index.keySet()));
		}
	}

	public Path rootDirectory() {
		return rootDirectory;
	}

	public KeyStrategy keyStrategy() {
		return keyGenerator.strategy();
	}

	/**
	 * 캐시 통계를 반환합니다.
	 *
	 * @return CacheMetrics 인스턴스, 메트릭이 비활성화되어 있으면 null
	 */
	public CacheMetrics metrics() {
		return metrics;
	}

	public boolean isClosed() {
		return closed.get();
	}

	/**
	 * 캐시가 생성한 저장소(I/O 스레드 풀)를 정리합니다. 파일과 디렉토리는 삭제하지 않습니다.
	 * 이후의 연산은 {@link IllegalStateException}을 던집니다.
	 */
	@Override
	public void close() {
		if (!closed.compareAndSet(false, true)) {
			return;
		}
		log.debug("Closing SBFileCache - root : {}", rootDirectory);
		if (ownsStorage) {
			storage.close();
		}
	}

	// ----------------------------------------------------------------- put

	private boolean isInUseLocked(String key) {
		return index.containsKey(key) || writing.contains(key) || evicting.containsKey(key);
	}

	/**
	 * 용량을 예약합니다. 여유 공간이 모자라면 커밋된 항목을 축출해서 채웁니다.
	 * 축출해도 모자라면 (나머지가 진행 중인 put의 예약이면) false를 반환하고 아무것도 바꾸지 않습니다.
	 */
	private boolean tryAdmitLocked(PendingPut put) {
		long free = capacity - committedWeight - reservedWeight;
		if (free >= put.weight) {
			put.reserved = put.weight;
			reservedWeight += put.reserved;
			return true;
		}
		if (free + committedWeight < put.weight) {
			return false;
		}

		long freed = 0;
		while (free + freed < put.weight) {
			String candidate = evictionStrategy.selectEvictionCandidate();
			CacheEntry victim = candidate == null ? null : index.remove(candidate);
			if (victim == null) {
				InvariantViolationException e = new InvariantViolationException(
					"Eviction strategy offered " + candidate + " while the index holds " + index.size() + " entries");
				log.error("Cache state is inconsistent - root : {}", rootDirectory, e);
				throw e;
			}
			evictionStrategy.onRemove(candidate);
			committedWeight -= victim.getWeight();
			evicting.put(candidate, victim);
			put.victims.add(victim);
			freed += victim.getWeight();
			log.trace("evict - key : {}, weight : {}", candidate, victim.getWeight());
		}
		if (metrics != null) {
			metrics.recordEviction(put.victims.size());
		}
		// 축출 대상의 무게까지 예약해 두어야 삭제 실패 시 되돌려도 capacity를 넘지 않는다
		put.reserved = free + freed;
		reservedWeight += put.reserved;
		return true;
	}

	/**
	 * 대기 중인 put을 FIFO 순서로 승인합니다. 반환된 put은 락 밖에서 {@link #start(PendingPut)} 해야 합니다.
	 */
	private List<PendingPut> drainLocked() {
		if (admissionQueue.isEmpty()) {
			return Collections.emptyList();
		}
		List<PendingPut> ready = new ArrayList<>();
		while (!admissionQueue.isEmpty()) {
			PendingPut head = admissionQueue.peekFirst();
			try {
				if (!tryAdmitLocked(head)) {
					break;
				}
			} catch (InvariantViolationException e) {
				writing.remove(head.key);
				head.admissionError = e;
			}
			admissionQueue.pollFirst();
			head.admitted = true;
			ready.add(head);
		}
		return ready;
	}

	private void startAll(List<PendingPut> ready) {
		for (PendingPut put : ready) {
			start(put);
		}
	}

	private void start(PendingPut put) {
		if (put.admissionError != null) {
			put.result.completeExceptionally(put.admissionError);
			return;
		}
		if (put.victims.isEmpty()) {
			write(put);
			return;
		}

		List<CompletableFuture<Throwable>> deletions = new ArrayList<>(put.victims.size());
		for (CacheEntry victim : put.victims) {
			deletions.add(sequencer.submit(victim.getKey(),
					() -> storage.delete(victim.getPath()).thenCompose(ignored -> pruneParents(victim.getPath())))
				.handle((ignored, error) -> {
					Throwable cause = error == null ? null : KeySequencer.unwrap(error);
					// 동시에 remove()가 먼저 지웠으면 이미 목적을 이룬 것
					return cause instanceof NoSuchFileException ? null : cause;
				}));
		}
		CompletableFuture.allOf(deletions.toArray(new CompletableFuture[0]))
			.whenComplete((ignored, unexpected) -> afterEviction(put, deletions));
	}

	private void afterEviction(PendingPut put, List<CompletableFuture<Throwable>> deletions) {
		CacheEntry failedVictim = null;
		Throwable failure = null;
		List<PendingPut> ready;
		synchronized (lock) {
			for (int i = 0; i < put.victims.size(); i++) {
				CacheEntry victim = put.victims.get(i);
				Throwable error = deletions.get(i).join();
				evicting.remove(victim.getKey());
				if (error != null) {
					// 파일이 남아 있으므로 항목을 되돌린다. 빈도는 1부터 다시 센다.
					index.put(victim.getKey(), victim);
					committedWeight += victim.getWeight();
					evictionStrategy.recordAccess(victim.getKey());
					if (failure == null) {
						failedVictim = victim;
						failure = error;
					} else {
						failure.addSuppressed(error);
					}
				}
			}
			if (failure == null) {
				ready = Collections.emptyList();
			} else {
				writing.remove(put.key);
				reservedWeight -= put.reserved;
				ready = drainLocked();
			}
		}
		startAll(ready);

		if (failure == null) {
			write(put);
			return;
		}
		if (metrics != null) {
			metrics.recordDeleteFailure();
		}
		log.warn("put {} aborted, could not delete evicted entry {}", put.key, failedVictim.getKey(), failure);
		put.result.completeExceptionally(toCacheException(failedVictim.getKey(), failure));
	}

	private void write(PendingPut put) {
		sequencer.submit(put.key, () -> storage.write(put.path, put.value))
			.whenComplete((ignored, error) -> {
				SBFileCacheException inconsistency = null;
				List<PendingPut> ready;
				synchronized (lock) {
					writing.remove(put.key);
					reservedWeight -= put.reserved;
					if (error == null) {
						index.put(put.key, new CacheEntry(put.key, put.path, put.value.length, put.weight));
						committedWeight += put.weight;
						evictionStrategy.recordAccess(put.key);
						inconsistency = checkConsistencyLocked();
					}
					ready = drainLocked();
				}
				startAll(ready);

				if (error != null) {
					if (metrics != null) {
						metrics.recordWriteFailure();
					}
					log.debug("put failed - key : {}", put.key, error);
					SBFileCacheException failure = toCacheException(put.key, error);
					pruneParents(put.path).thenRun(() -> put.result.completeExceptionally(failure));
				} else if (inconsistency != null) {
					put.result.completeExceptionally(inconsistency);
				} else {
					if (metrics != null) {
						metrics.recordWrite(put.value.length);
					}
					log.trace("put - key : {}, bytes : {}", put.key, put.value.length);
					put.result.complete(put.key);
				}
			});
	}

	private SBFileCacheException checkConsistencyLocked() {
		if (evictionStrategy.size() == index.size()) {
			return null;
		}
		InvariantViolationException e = new InvariantViolationException(
			"Eviction strategy tracks " + evictionStrategy.size() + " keys but the index holds " + index.size());
		log.error("Cache state is inconsistent - root : {}", rootDirectory, e);
		return e;
	}

	// ----------------------------------------------------------------- get / remove

	private CompletableFuture<byte[]> read(String key) {
		CacheEntry entry;
		synchronized (lock) {
			entry = index.get(key);
		}
		if (entry == null) {
			if (metrics != null) {
				metrics.recordMiss();
			}
			return CompletableFuture.failedFuture(new KeyNotFoundException(key));
		}

		long start = System.nanoTime();
		return storage.read(entry.getPath())
			.handle((bytes, error) -> {
				if (error != null) {
					return dropUnreadable(entry, KeySequencer.unwrap(error));
				}
				synchronized (lock) {
					// 읽는 동안 축출된 항목은 빈도를 다시 만들지 않는다
					if (index.get(key) == entry) {
						evictionStrategy.recordAccess(key);
					}
				}
				if (metrics != null) {
					metrics.recordHit(System.nanoTime() - start);
				}
				log.trace("get - key : {}, bytes : {}", key, bytes.length);
				return CompletableFuture.completedFuture(bytes);
			})
			.thenCompose(Function.identity());
	}

	/**
	 * 읽을 수 없는 항목을 인덱스에서 떼어내고 남은 파일 삭제를 시도합니다.
	 */
	private CompletableFuture<byte[]> dropUnreadable(CacheEntry entry, Throwable error) {
		String key = entry.getKey();
		boolean dropped;
		List<PendingPut> ready = Collections.emptyList();
		synchronized (lock) {
			dropped = index.remove(key, entry);
			if (dropped) {
				evictionStrategy.onRemove(key);
				committedWeight -= entry.getWeight();
				evicting.put(key, entry);
				ready = drainLocked();
			}
		}
		startAll(ready);

		SBFileCacheException failure = toCacheException(key, error);
		if (metrics != null) {
			metrics.recordReadFailure();
		}
		if (!dropped) {
			return CompletableFuture.failedFuture(failure);
		}
		if (metrics != null) {
			metrics.recordSelfHeal();
		}
		log.warn("Dropping entry {} after read failure", key, error);

		return call(() -> storage.delete(entry.getPath()))
			.thenCompose(ignored -> pruneParents(entry.getPath()))
			.handle((ignored, cleanupError) -> {
				synchronized (lock) {
					evicting.remove(key);
				}
				Throwable cause = cleanupError == null ? null : KeySequencer.unwrap(cleanupError);
				if (cause != null && !(cause instanceof NoSuchFileException)) {
					log.warn("Failed to delete unreadable file {}", entry.getPath(), cause);
					failure.addSuppressed(cause);
				}
				throw failure;
			});
	}

	private CompletableFuture<Void> removeSequenced(String key) {
		return sequencer.<Void>submit(key, () -> {
			CacheEntry entry;
			synchronized (lock) {
				entry = index.get(key);
			}
			if (entry == null) {
				return CompletableFuture.failedFuture(new KeyNotFoundException(key));
			}
			return storage.delete(entry.getPath())
				.handle((ignored, error) -> {
					Throwable cause = error == null ? null : KeySequencer.unwrap(error);
					if (cause != null && !(cause instanceof NoSuchFileException)) {
						if (metrics != null) {
							metrics.recordDeleteFailure();
						}
						log.debug("remove failed, entry kept - key : {}", key, cause);
						throw toCacheException(key, cause);
					}
					List<PendingPut> ready;
					synchronized (lock) {
						if (index.remove(key, entry)) {
							evictionStrategy.onRemove(key);
							committedWeight -= entry.getWeight();
						}
						ready = drainLocked();
					}
					startAll(ready);
					if (metrics != null) {
						metrics.recordDelete();
					}
					log.trace("remove - key : {}", key);
					return null;
				})
				.thenCompose(ignored -> pruneParents(entry.getPath()));
		});
	}

	// ----------------------------------------------------------------- helpers

	private void ensureOpen() {
		if (closed.get()) {
			throw new IllegalStateException("SBFileCache is closed: " + rootDirectory);
		}
	}

	/**
	 * 구조화된 키가 남긴 빈 상위 디렉토리를 루트 아래까지 정리합니다.
	 * 남은 디렉토리는 같은 이름의 키를 막으므로 정리하지만, 실패해도 연산 결과는 바꾸지 않습니다.
	 */
	private CompletableFuture<Void> pruneParents(Path path) {
		if (rootDirectory.equals(path.getParent())) {
			return CompletableFuture.completedFuture(null);
		}
		return call(() -> storage.pruneEmptyParents(path, rootDirectory))
			.exceptionally(error -> {
				log.warn("Failed to remove empty directories above {}", path, KeySequencer.unwrap(error));
				return null;
			});
	}

	/**
	 * 저장소가 future 대신 예외를 바로 던져도 실패한 future로 받습니다.
	 */
	private static <T> CompletableFuture<T> call(Supplier<CompletableFuture<T>> io) {
		try {
			return io.get();
		} catch (RuntimeException e) {
			return CompletableFuture.failedFuture(e);
		}
	}

	static SBFileCacheException toCacheException(String key, Throwable error) {
		Throwable cause = KeySequencer.unwrap(error);
		if (cause instanceof SBFileCacheException) {
			return (SBFileCacheException) cause;
		}
		if (cause instanceof IOException) {
			return new StorageFailureException(key, (IOException) cause);
		}
		return new StorageFailureException(key, new IOException(cause));
	}

	/**
	 * 승인 전후의 put 하나. 필드는 lock 안에서만 바뀐다.
	 */
	private static final class PendingPut {
		private final String key;
		private final Path path;
		private final byte[] value;
		private final long weight;
		private final List<CacheEntry> victims = new ArrayList<>();
		private final CompletableFuture<String> result = new CompletableFuture<>();
		private long reserved;
		private boolean admitted;
		private SBFileCacheException admissionError;

		private PendingPut(String key, Path path, byte[] value, long weight) {
			this.key = key;
			this.path = path;
			this.value = value;
			this.weight = weight;
		}
	}

	/**
	 * SBFileCache Builder 클래스
	 */
	public static class Builder {
		private Path rootDirectory;
		private CapacityMode capacityMode = CapacityMode.ENTRY_COUNT; // 기본값: 항목 수
		private long capacity = 0;
		private boolean capacitySet = false;
		private KeyStrategy keyStrategy = KeyStrategy.RANDOM; // 기본값: UUID
		private EvictionStrategy<String> evictionStrategy = null; // null이면 LFU
		private StorageBackend storage = null; // null이면 AsyncFileStorage 생성
		private int ioThreads = 4;
		private boolean enableMetrics = false;
		private boolean createDirectory = false;

		/**
		 * 캐시 파일을 둘 루트 디렉토리. 존재하고, 쓰기 가능하고, 비어 있어야 합니다.
		 *
		 * @param rootDirectory 루트 디렉토리
		 * @return Builder 인스턴스
		 */
		public Builder rootDirectory(Path rootDirectory) {
			this.rootDirectory = rootDirectory;
			return this;
		}

		/**
		 * 최대 항목 수를 설정합니다. {@link #maxBytes(long)}와 함께 쓸 수 없습니다.
		 *
		 * @param maxEntries 최대 항목 수
		 * @return Builder 인스턴스
		 */
		public Builder maxEntries(long maxEntries) {
			return capacity(CapacityMode.ENTRY_COUNT, maxEntries);
		}

		/**
		 * 저장된 값의 최대 바이트 합계를 설정합니다. {@link #maxEntries(long)}와 함께 쓸 수 없습니다.
		 *
		 * @param maxBytes 최대 바이트 수
		 * @return Builder 인스턴스
		 */
		public Builder maxBytes(long maxBytes) {
			return capacity(CapacityMode.TOTAL_BYTES, maxBytes);
		}

		public Builder capacity(CapacityMode mode, long capacity) {
			if (mode == null) {
				throw new IllegalArgumentException("CapacityMode must not be null");
			}
			if (capacitySet) {
				throw new IllegalStateException("capacity already set to " + this.capacity + " (" + capacityMode + ")");
			}
			this.capacityMode = mode;
			this.capacity = capacity;
			this.capacitySet = true;
			return this;
		}

		public Builder keyStrategy(KeyStrategy keyStrategy) {
			this.keyStrategy = keyStrategy;
			return this;
		}

		/**
		 * 축출 전략을 교체합니다. 전략 인스턴스는 이 캐시 전용이어야 합니다.
		 *
		 * @param evictionStrategy 축출 전략
		 * @return Builder 인스턴스
		 */
		public Builder evictionStrategy(EvictionStrategy<String> evictionStrategy) {
			this.evictionStrategy = evictionStrategy;
			return this;
		}

		/**
		 * 저장소를 교체합니다. 외부에서 주입한 저장소는 {@link SBFileCache#close()}가 닫지 않습니다.
		 *
		 * @param storage 저장소
		 * @return Builder 인스턴스
		 */
		public Builder storage(StorageBackend storage) {
			this.storage = storage;
			return this;
		}

		public Builder ioThreads(int ioThreads) {
			this.ioThreads = ioThreads;
			return this;
		}

		public Builder enableMetrics(boolean enable) {
			this.enableMetrics = enable;
			return this;
		}

		/**
		 * 루트 디렉토리가 없으면 생성합니다.
		 *
		 * @param create true면 생성
		 * @return Builder 인스턴스
		 */
		public Builder createDirectory(boolean create) {
			this.createDirectory = create;
			return this;
		}

		public SBFileCache build() {
			if (rootDirectory == null) {
				throw new IllegalStateException("rootDirectory must be set");
			}
			if (keyStrategy == null) {
				throw new IllegalStateException("keyStrategy must not be null");
			}
			Path root = rootDirectory.toAbsolutePath().normalize();
			if (capacity <= 0) {
				throw new CacheInitException(root, "capacity must be positive: " + capacity);
			}
			prepareRoot(root);

			if (storage != null) {
				return new SBFileCache(this, root, storage, false);
			}
			if (ioThreads <= 0) {
				throw new IllegalStateException("ioThreads must be positive: " + ioThreads);
			}
			return new SBFileCache(this, root, new AsyncFileStorage(ioThreads), true);
		}

		private void prepareRoot(Path root) {
			if (Files.notExists(root)) {
				if (!createDirectory) {
					throw new CacheInitException(root, "directory does not exist");
				}
				try {
					Files.createDirectories(root);
				} catch (IOException e) {
					throw new CacheInitException(root, "directory could not be created", e);
				}
			}
			if (!Files.isDirectory(root)) {
				throw new CacheInitException(root, "not a directory");
			}
			if (!Files.isWritable(root)) {
				throw new CacheInitException(root, "directory is not writable");
			}
			try (Stream<Path> children = Files.list(root)) {
				if (children.findAny().isPresent()) {
					throw new CacheInitException(root, "directory is not empty");
				}
			} catch (IOException e) {
				throw new CacheInitException(root, "directory could not be listed", e);
			}
		}
	}
}
