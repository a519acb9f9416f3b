package org.scriptonbasestar.filecache.engine.eviction;

import org.scriptonbasestar.filecache.core.strategy.EvictionStrategy;

import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeSet;

/**
 * Least Frequently Used (LFU) eviction strategy.
 * <p>
 * Evicts the entry with the lowest access count. Among equally used entries the one
 * inserted earliest goes first. Keeps an ordered set of (count, insertion sequence)
 * so every operation is O(log n) instead of scanning all counters.
 * </p>
 * <p>
 * Not thread-safe; the cache engine only calls it under its index lock.
 * </p>
 *
 * @param <K> the type of cache keys
 * @author archmagece
 * @since 2026-10
 */
public class LfuEvictionStrategy<K> implements EvictionStrategy<K> {

	private final Map<K, Node<K>> nodes;
	private final TreeSet<Node<K>> order;
	private long nextSequence;

	public LfuEvictionStrategy() {
		this.nodes = new HashMap<>();
		this.order = new TreeSet<>(Comparator.<Node<K>>comparingLong(n -> n.frequency)
			.thenComparingLong(n -> n.sequence));
	}

	@Override
	public void recordAccess(K key) {
		Node<K> node = nodes.get(key);
		if (node == null) {
			node = new Node<>(key, nextSequence++);
			nodes.put(key, node);
		} else {
			// must leave the set before its sort key changes
			order.remove(node);
			node.frequency++;
		}
		order.add(node);
	}

	@Override
	public void onRemove(K key) {
		Node<K> node = nodes.remove(key);
		if (node != null) {
			order.remove(node);
		}
	}

	@Override
	public K selectEvictionCandidate() {
		if (order.isEmpty()) {
			return null;
		}
		return order.first().key;
	}

	@Override
	public int size() {
		return nodes.size();
	}

	/**
	 * @param key a cache key
	 * @return current access count, 0 if the key is not tracked
	 */
	public long frequencyOf(K key) {
		Node<K> node = nodes.get(key);
		return node == null ? 0 : node.frequency;
	}

	@Override
	public void clear() {
		nodes.clear();
		order.clear();
	}

	private static final class Node<K> {
		private final K key;
		private final long sequence;
		private long frequency = 1; // Start with count 1

		private Node(K key, long sequence) {
			this.key = key;
			this.sequence = sequence;
		}
	}
}
