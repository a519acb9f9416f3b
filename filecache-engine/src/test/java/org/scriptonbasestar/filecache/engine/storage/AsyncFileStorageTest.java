package org.scriptonbasestar.filecache.engine.storage;

import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.junit.Assert.*;

/**
 * AsyncFileStorage 테스트
 *
 * @author archmagece
 * @since 2026-10
 */
public class AsyncFileStorageTest {

	@Rule
	public TemporaryFolder tempFolder = new TemporaryFolder();

	private Path root;
	private AsyncFileStorage storage;

	@Before
	public void setUp() throws Exception {
		root = tempFolder.newFolder("storage").toPath();
		storage = new AsyncFileStorage(2);
	}

	@After
	public void tearDown() {
		storage.close();
	}

	@Test
	public void testWriteThenRead() throws Exception {
		// Given
		byte[] value = new byte[256 * 1024];
		new Random(42).nextBytes(value);
		Path path = root.resolve("value.bin");

		// When
		storage.write(path, value).get(5, TimeUnit.SECONDS);

		// Then
		assertArrayEquals(value, storage.read(path).get(5, TimeUnit.SECONDS));
		assertArrayEquals(value, Files.readAllBytes(path));
	}

	@Test
	public void testEmptyValue() throws Exception {
		Path path = root.resolve("empty");

		storage.write(path, new byte[0]).get(5, TimeUnit.SECONDS);

		assertEquals(0, storage.read(path).get(5, TimeUnit.SECONDS).length);
	}

	@Test
	public void testWriteCreatesParentDirectoriesAndLeavesNoTempFile() throws Exception {
		Path path = root.resolve("a").resolve("b").resolve("c.txt");

		storage.write(path, new byte[]{1, 2, 3}).get(5, TimeUnit.SECONDS);

		assertTrue(Files.isRegularFile(path));
		try (Stream<Path> files = Files.list(path.getParent())) {
			assertEquals(1, files.count());
		}
	}

	@Test
	public void testWriteReplacesExistingFile() throws Exception {
		Path path = root.resolve("replace");
		storage.write(path, new byte[]{1, 1, 1, 1}).get(5, TimeUnit.SECONDS);

		storage.write(path, new byte[]{2}).get(5, TimeUnit.SECONDS);

		assertArrayEquals(new byte[]{2}, storage.read(path).get(5, TimeUnit.SECONDS));
	}

	@Test
	public void testReadOfMissingFileFailsWithIoCause() throws Exception {
		try {
			storage.read(root.resolve("missing")).get(5, TimeUnit.SECONDS);
			fail("Expected failure");
		} catch (ExecutionException e) {
			assertTrue(e.getCause() instanceof NoSuchFileException);
		}
	}

	@Test
	public void testDelete() throws Exception {
		Path path = root.resolve("gone");
		storage.write(path, new byte[]{9}).get(5, TimeUnit.SECONDS);

		storage.delete(path).get(5, TimeUnit.SECONDS);

		assertFalse(Files.exists(path));
		try {
			storage.delete(path).get(5, TimeUnit.SECONDS);
			fail("Expected failure");
		} catch (ExecutionException e) {
			assertTrue(e.getCause() instanceof NoSuchFileException);
		}
	}

	@Test
	public void testPruneRemovesEmptyParentsUpToRoot() throws Exception {
		// Given
		Path path = root.resolve("a").resolve("b").resolve("c.bin");
		storage.write(path, new byte[]{1}).get(5, TimeUnit.SECONDS);
		storage.delete(path).get(5, TimeUnit.SECONDS);

		// When
		storage.pruneEmptyParents(path, root).get(5, TimeUnit.SECONDS);

		// Then - 루트는 남는다
		assertFalse(Files.exists(root.resolve("a")));
		assertTrue(Files.isDirectory(root));
	}

	@Test
	public void testPruneStopsAtNonEmptyDirectory() throws Exception {
		// Given
		Path removed = root.resolve("a").resolve("b").resolve("c.bin");
		Path kept = root.resolve("a").resolve("d.bin");
		storage.write(removed, new byte[]{1}).get(5, TimeUnit.SECONDS);
		storage.write(kept, new byte[]{2}).get(5, TimeUnit.SECONDS);
		storage.delete(removed).get(5, TimeUnit.SECONDS);

		// When
		storage.pruneEmptyParents(removed, root).get(5, TimeUnit.SECONDS);

		// Then
		assertFalse(Files.exists(root.resolve("a").resolve("b")));
		assertTrue(Files.isRegularFile(kept));
	}

	@Test
	public void testPruneNeverDeletesFiles() throws Exception {
		// Given - 부모 경로 자리에 다른 키의 파일이 있음
		Path file = root.resolve("a");
		storage.write(file, new byte[]{1}).get(5, TimeUnit.SECONDS);

		// When
		storage.pruneEmptyParents(file.resolve("b"), root).get(5, TimeUnit.SECONDS);

		// Then
		assertTrue(Files.isRegularFile(file));
	}

	@Test
	public void testFailedWriteLeavesNoTempFile() throws Exception {
		// Given - 대상 위치가 비어 있지 않은 디렉토리라서 이동이 실패
		Path target = root.resolve("occupied");
		Files.createDirectories(target.resolve("child"));

		// When
		try {
			storage.write(target, new byte[]{1}).get(5, TimeUnit.SECONDS);
			fail("Expected failure");
		} catch (ExecutionException e) {
			// Then
			assertTrue(e.getCause() instanceof IOException);
		}
		try (Stream<Path> files = Files.list(root)) {
			assertEquals(1, files.count());
		}
	}

	@Test
	public void testConcurrentWritesToDistinctPaths() throws Exception {
		List<CompletableFuture<Void>> writes = new ArrayList<>();
		for (int i = 0; i < 64; i++) {
			writes.add(storage.write(root.resolve("f" + i), ("value-" + i).getBytes()));
		}
		CompletableFuture.allOf(writes.toArray(new CompletableFuture[0])).get(10, TimeUnit.SECONDS);

		for (int i = 0; i < 64; i++) {
			assertEquals("value-" + i, new String(storage.read(root.resolve("f" + i)).get(5, TimeUnit.SECONDS)));
		}
	}

	@Test
	public void testExternalExecutorIsNotShutDown() throws Exception {
		ExecutorService executor = Executors.newFixedThreadPool(2);
		try {
			AsyncFileStorage external = new AsyncFileStorage(executor);
			external.write(root.resolve("x"), new byte[]{1}).get(5, TimeUnit.SECONDS);

			external.close();

			assertFalse(executor.isShutdown());
		} finally {
			executor.shutdownNow();
		}
	}

	@Test(expected = IllegalArgumentException.class)
	public void testRejectsNonPositiveThreadCount() {
		new AsyncFileStorage(0);
	}
}
