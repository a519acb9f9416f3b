package org.scriptonbasestar.filecache.core.storage;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous byte storage addressed by file path.
 * <p>
 * Every future fails with the causing {@link java.io.IOException} (possibly wrapped in a
 * {@link java.util.concurrent.CompletionException}). Operations on distinct paths must not
 * interfere with each other.
 * </p>
 * <p>
 * A failed {@link #write} must not leave behind a file that a later {@link #read} would
 * accept as the value for that path. Implementations are not required to be crash-atomic.
 * </p>
 *
 * @author archmagece
 * @since 2026-10
 */
public interface StorageBackend extends AutoCloseable {

	/**
	 * Persist {@code bytes} at {@code path}, creating parent directories if needed.
	 *
	 * @param path  target file
	 * @param bytes value
	 * @return future completing once the file is in place
	 */
	CompletableFuture<Void> write(Path path, byte[] bytes);

	/**
	 * @param path file to read
	 * @return future with the whole file content
	 */
	CompletableFuture<byte[]> read(Path path);

	/**
	 * @param path file to delete
	 * @return future completing once the file is gone
	 */
	CompletableFuture<Void> delete(Path path);

	/**
	 * Removes the empty directories between {@code path} and {@code root}, walking upwards and
	 * stopping at the first non-empty directory. {@code root} itself is never removed.
	 * Default does nothing, for backends that do not create directories.
	 *
	 * @param path a file under {@code root} that was deleted or never written
	 * @param root the directory to stop at
	 * @return future completing once pruning is done
	 */
	default CompletableFuture<Void> pruneEmptyParents(Path path, Path root) {
		return CompletableFuture.completedFuture(null);
	}

	/**
	 * Releases resources (thread pools, channels). Default does nothing.
	 */
	@Override
	default void close() {
	}
}
