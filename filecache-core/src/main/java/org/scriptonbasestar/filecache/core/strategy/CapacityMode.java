package org.scriptonbasestar.filecache.core.strategy;

/**
 * Unit in which cache capacity is measured.
 *
 * @author archmagece
 * @since 2026-10
 */
public enum CapacityMode {
	/**
	 * Capacity is a maximum number of entries. Every entry weighs 1.
	 */
	ENTRY_COUNT,

	/**
	 * Capacity is a maximum total of value bytes. Every entry weighs its byte length.
	 */
	TOTAL_BYTES;

	/**
	 * @param valueLength byte length of a value
	 * @return weight the value occupies under this mode
	 */
	public long weigh(long valueLength) {
		return this == ENTRY_COUNT ? 1L : valueLength;
	}
}
