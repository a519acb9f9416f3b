package org.scriptonbasestar.filecache.engine;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.Assert.fail;

/**
 * 테스트용 future 대기 헬퍼
 */
final class Futures {

	private Futures() {
	}

	static <T> T await(CompletableFuture<T> future) throws Exception {
		return future.get(5, TimeUnit.SECONDS);
	}

	/**
	 * future가 실패하기를 기다리고 원인 예외를 반환합니다.
	 */
	static Throwable failureOf(CompletableFuture<?> future) throws Exception {
		try {
			Object value = future.get(5, TimeUnit.SECONDS);
			fail("Expected failure but completed with " + value);
			return null;
		} catch (ExecutionException e) {
			return e.getCause();
		}
	}

	/**
	 * 반환된 future를 기다릴 수 없을 때(취소된 경우 등) 내부 작업이 끝나기를 기다립니다.
	 */
	static void eventually(BooleanSupplier condition) throws InterruptedException {
		long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
		while (!condition.getAsBoolean()) {
			if (System.nanoTime() > deadline) {
				fail("Condition not met within 5 seconds");
			}
			Thread.sleep(10);
		}
	}
}
