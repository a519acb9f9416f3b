package org.scriptonbasestar.filecache.engine;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * 키 단위 비동기 직렬화기.
 *
 * 같은 키에 대한 작업은 제출 순서대로 하나씩 실행되고, 다른 키의 작업은 서로 기다리지 않습니다.
 * 작업이 끝난 키는 맵에서 제거되므로 살아 있는 키 수만큼만 메모리를 씁니다.
 *
 * @author archmagece
 * @since 2026-10
 */
final class KeySequencer {

	private final Map<String, CompletableFuture<?>> tails = new HashMap<>();

	<T> CompletableFuture<T> submit(String key, Supplier<CompletableFuture<T>> task) {
		CompletableFuture<T> result = new CompletableFuture<>();
		CompletableFuture<?> previous;
		synchronized (tails) {
			previous = tails.put(key, result);
		}
		if (previous == null) {
			run(key, task, result);
		} else {
			previous.whenComplete((ignored, error) -> run(key, task, result));
		}
		return result;
	}

	private <T> void run(String key, Supplier<CompletableFuture<T>> task, CompletableFuture<T> result) {
		CompletableFuture<T> stage;
		try {
			stage = task.get();
		} catch (RuntimeException e) {
			stage = CompletableFuture.failedFuture(e);
		}
		stage.whenComplete((value, error) -> {
			synchronized (tails) {
				tails.remove(key, result);
			}
			if (error != null) {
				result.completeExceptionally(unwrap(error));
			} else {
				result.complete(value);
			}
		});
	}

	/**
	 * @return 현재 작업이 대기 중이거나 실행 중인 키 수
	 */
	int pendingKeys() {
		synchronized (tails) {
			return tails.size();
		}
	}

	static Throwable unwrap(Throwable error) {
		Throwable current = error;
		while ((current instanceof CompletionException || current instanceof ExecutionException)
			&& current.getCause() != null) {
			current = current.getCause();
		}
		return current;
	}
}
