package org.scriptonbasestar.filecache.core.exception;

/**
 * @author archmagece
 * @since 2026-10
 */
public class InvalidKeyException extends SBFileCacheException {

	private final String key;

	public InvalidKeyException(String key, String reason) {
		super("Invalid cache key " + key + ": " + reason);
		this.key = key;
	}

	public String getKey() {
		return key;
	}
}
