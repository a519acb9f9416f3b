package org.scriptonbasestar.filecache.engine.storage;

import org.scriptonbasestar.filecache.core.storage.StorageBackend;
import org.scriptonbasestar.filecache.core.util.KeyPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.AsynchronousFileChannel;
import java.nio.channels.CompletionHandler;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.OpenOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link StorageBackend} on top of {@link AsynchronousFileChannel}.
 * <p>
 * Writes go to a temporary sibling file (named with {@link KeyPaths#RESERVED_PREFIX}) that is
 * moved over the target only after every byte is on disk, so a failed write never leaves a
 * readable partial value behind. Channel callbacks and blocking filesystem calls (open, move,
 * delete) run on one executor, either owned by this instance or supplied by the caller.
 * </p>
 *
 * @author archmagece
 * @since 2026-10
 */
public class AsyncFileStorage implements StorageBackend {

	private static final Logger log = LoggerFactory.getLogger(AsyncFileStorage.class);

	private static final Set<OpenOption> WRITE_OPTIONS = Collections.unmodifiableSet(
		EnumSet.of(StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING));
	private static final Set<OpenOption> READ_OPTIONS = Collections.singleton(StandardOpenOption.READ);

	private static final int MAX_FILE_SIZE = Integer.MAX_VALUE - 8;
	private static final int MAX_TEMP_ATTEMPTS = 3;

	private final ExecutorService executor;
	private final boolean ownsExecutor;
	private final AtomicBoolean closed = new AtomicBoolean(false);

	/**
	 * Creates a storage with its own daemon I/O pool.
	 *
	 * @param ioThreads pool size
	 */
	public AsyncFileStorage(int ioThreads) {
		if (ioThreads <= 0) {
			throw new IllegalArgumentException("ioThreads must be positive: " + ioThreads);
		}
		AtomicInteger counter = new AtomicInteger();
		this.executor = Executors.newFixedThreadPool(ioThreads, r -> {
			Thread t = new Thread(r, "SBFileCache-IO-" + counter.incrementAndGet());
			t.setDaemon(true);
			return t;
		});
		this.ownsExecutor = true;
		log.debug("Async file storage started with {} I/O threads", ioThreads);
	}

	/**
	 * Creates a storage on a caller-managed executor. {@link #close()} leaves it running.
	 *
	 * @param executor executor for channel callbacks and blocking calls
	 */
	public AsyncFileStorage(ExecutorService executor) {
		if (executor == null) {
			throw new IllegalArgumentException("ExecutorService must not be null");
		}
		this.executor = executor;
		this.ownsExecutor = false;
	}

	@Override
	public CompletableFuture<Void> write(Path path, byte[] bytes) {
		return CompletableFuture.supplyAsync(() -> createTempSibling(path), executor)
			.thenCompose(temp -> writeFully(temp, bytes)
				.thenRunAsync(() -> moveIntoPlace(temp, path), executor)
				.whenComplete((ignored, error) -> {
					if (error != null) {
						discardTemp(temp);
					}
				}));
	}

	@Override
	public CompletableFuture<byte[]> read(Path path) {
		return CompletableFuture.supplyAsync(() -> open(path, READ_OPTIONS), executor)
			.thenCompose(channel -> {
				CompletableFuture<byte[]> done = new CompletableFuture<>();
				try {
					long size = channel.size();
					if (size > MAX_FILE_SIZE) {
						throw new IOException("File too large to read into memory: " + path + " (" + size + " bytes)");
					}
					ByteBuffer buffer = ByteBuffer.allocate((int) size);
					readLoop(channel, buffer, 0L, path, done);
				} catch (IOException e) {
					done.completeExceptionally(e);
				}
				return done.whenComplete((ignored, error) -> closeQuietly(channel, path));
			});
	}

	@Override
	public CompletableFuture<Void> delete(Path path) {
		return CompletableFuture.runAsync(() -> {
			try {
				Files.delete(path);
				log.trace("delete - path : {}", path);
			} catch (IOException e) {
				throw new CompletionException(e);
			}
		}, executor);
	}

	/**
	 * Removes empty directories from the parent of {@code path} up to (not including) {@code root}.
	 * A directory that is not empty ends the walk; one that is already gone is skipped.
	 */
	@Override
	public CompletableFuture<Void> pruneEmptyParents(Path path, Path root) {
		return CompletableFuture.runAsync(() -> {
			Path dir = path.getParent();
			while (dir != null && dir.startsWith(root) && !dir.equals(root)) {
				// anything but a directory here belongs to another key
				if (Files.exists(dir, LinkOption.NOFOLLOW_LINKS) && !Files.isDirectory(dir, LinkOption.NOFOLLOW_LINKS)) {
					return;
				}
				try {
					Files.delete(dir);
					log.trace("prune - dir : {}", dir);
				} catch (DirectoryNotEmptyException e) {
					return;
				} catch (NoSuchFileException e) {
					log.trace("prune - already gone : {}", dir);
				} catch (IOException e) {
					throw new CompletionException(e);
				}
				dir = dir.getParent();
			}
		}, executor);
	}

	private Path createTempSibling(Path path) {
		Path parent = path.getParent();
		try {
			for (int attempt = 1; ; attempt++) {
				Files.createDirectories(parent);
				try {
					return Files.createTempFile(parent, KeyPaths.RESERVED_PREFIX, ".tmp");
				} catch (NoSuchFileException e) {
					// the parent was pruned between the two calls
					if (attempt >= MAX_TEMP_ATTEMPTS) {
						throw e;
					}
					log.trace("write - parent removed concurrently, retrying : {}", parent);
				}
			}
		} catch (IOException e) {
			throw new CompletionException(e);
		}
	}

	private CompletableFuture<Void> writeFully(Path temp, byte[] bytes) {
		AsynchronousFileChannel channel;
		try {
			channel = AsynchronousFileChannel.open(temp, WRITE_OPTIONS, executor);
		} catch (IOException e) {
			return CompletableFuture.failedFuture(e);
		}
		CompletableFuture<Void> done = new CompletableFuture<>();
		writeLoop(channel, ByteBuffer.wrap(bytes), 0L, done);
		return done.thenRun(() -> {
				try {
					channel.force(false);
				} catch (IOException e) {
					throw new CompletionException(e);
				}
			})
			.whenComplete((ignored, error) -> closeQuietly(channel, temp));
	}

	private void moveIntoPlace(Path temp, Path path) {
		try {
			try {
				Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE);
			} catch (AtomicMoveNotSupportedException e) {
				Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
			}
			log.trace("write - path : {}", path);
		} catch (IOException e) {
			throw new CompletionException(e);
		}
	}

	private void discardTemp(Path temp) {
		try {
			Files.deleteIfExists(temp);
		} catch (IOException e) {
			log.warn("Failed to remove temporary file after failed write: {}", temp, e);
		}
	}

	private AsynchronousFileChannel open(Path path, Set<OpenOption> options) {
		try {
			return AsynchronousFileChannel.open(path, options, executor);
		} catch (IOException e) {
			throw new CompletionException(e);
		}
	}

	private static void writeLoop(AsynchronousFileChannel channel, ByteBuffer buffer, long position,
								  CompletableFuture<Void> done) {
		channel.write(buffer, position, null, new CompletionHandler<Integer, Void>() {
			@Override
			public void completed(Integer written, Void attachment) {
				if (buffer.hasRemaining()) {
					writeLoop(channel, buffer, position + written, done);
				} else {
					done.complete(null);
				}
			}

			@Override
			public void failed(Throwable exc, Void attachment) {
				done.completeExceptionally(exc);
			}
		});
	}

	private static void readLoop(AsynchronousFileChannel channel, ByteBuffer buffer, long position, Path path,
								 CompletableFuture<byte[]> done) {
		if (!buffer.hasRemaining()) {
			done.complete(buffer.array());
			return;
		}
		channel.read(buffer, position, null, new CompletionHandler<Integer, Void>() {
			@Override
			public void completed(Integer read, Void attachment) {
				if (read < 0) {
					done.completeExceptionally(new EOFException("File truncated while reading: " + path));
				} else {
					readLoop(channel, buffer, position + read, path, done);
				}
			}

			@Override
			public void failed(Throwable exc, Void attachment) {
				done.completeExceptionally(exc);
			}
		});
	}

	private static void closeQuietly(AsynchronousFileChannel channel, Path path) {
		try {
			channel.close();
		} catch (IOException e) {
			log.warn("Failed to close channel for {}", path, e);
		}
	}

	/**
	 * Shuts down the I/O pool if this instance created it.
	 */
	@Override
	public void close() {
		if (!ownsExecutor || !closed.compareAndSet(false, true)) {
			return;
		}
		log.debug("Shutting down AsyncFileStorage I/O executor");
		executor.shutdown();
		try {
			if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
				log.warn("I/O executor did not terminate in time, forcing shutdown");
				executor.shutdownNow();
			}
		} catch (InterruptedException e) {
			log.warn("Interrupted while waiting for I/O executor termination", e);
			executor.shutdownNow();
			Thread.currentThread().interrupt();
		}
	}
}
