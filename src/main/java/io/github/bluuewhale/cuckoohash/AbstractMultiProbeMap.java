package io.github.bluuewhale.cuckoohash;

import java.util.AbstractMap;
import java.util.Optional;

import org.jspecify.annotations.Nullable;

/**
 * Shared boilerplate for maps that place keys at the candidate positions of a
 * {@link HashFamily}. Null keys and null values are rejected, so a {@code null} lookup
 * result always means "absent".
 */
abstract class AbstractMultiProbeMap<K, V> extends AbstractMap<K, V> {

	protected final HashFamily family;
	protected int capacity;
	protected int size;

	protected AbstractMultiProbeMap(@Nullable HashFamily family, int minFunctions) {
		this.family = Utils.validateFamily(family, minFunctions, getClass().getSimpleName());
	}

	@Override
	public int size() {
		return size;
	}

	@Override
	public boolean isEmpty() {
		return size == 0;
	}

	@Override
	public boolean containsKey(@Nullable Object key) {
		return lookup(requireKey(key)) != null;
	}

	@Override
	public @Nullable V get(@Nullable Object key) {
		return lookup(requireKey(key));
	}

	@Override
	public boolean containsValue(@Nullable Object value) {
		return super.containsValue(requireValue(value));
	}

	@Override
	public @Nullable V putIfAbsent(K key, V value) {
		requireKey(key);
		requireValue(value);
		V cur = lookup(key);
		if (cur == null) insert(key, value);
		return cur;
	}

	/**
	 * Inserts or updates a mapping.
	 *
	 * @return {@code true} if the key was new, {@code false} if an existing value was replaced
	 */
	public abstract boolean insert(K key, V value);

	/**
	 * Removes the mapping for {@code key}.
	 *
	 * @return whether a mapping was removed
	 */
	public abstract boolean erase(Object key);

	public Optional<V> find(Object key) {
		return Optional.ofNullable(get(key));
	}

	public boolean contains(Object key) {
		return containsKey(key);
	}

	public HashFamily family() {
		return family;
	}

	/** Number of slots (or buckets) currently allocated. */
	public int capacity() {
		return capacity;
	}

	/** {@code size / capacity}. */
	public double loadFactor() {
		return capacity == 0 ? 0.0d : (double) size / (double) capacity;
	}

	/**
	 * Candidate positions of {@code key} for the current capacity, one per hash function.
	 * Positions may repeat when two functions collide.
	 */
	public int[] candidates(Object key) {
		requireKey(key);
		int k = family.k();
		int[] out = new int[k];
		for (int i = 0; i < k; i++) out[i] = position(i, key);
		return out;
	}

	/** Diagnostic rendering including every slot. */
	public String dump() {
		return dump(true);
	}

	public String dump(boolean detailed) {
		StringBuilder sb = new StringBuilder();
		dumpTo(sb, detailed);
		return sb.toString();
	}

	/* Hooks for subclasses */
	protected abstract @Nullable V lookup(Object key);
	protected abstract void dumpTo(StringBuilder sb, boolean detailed);

	/* Common utilities */
	protected int position(int fn, Object key) {
		return Hashing.reduce(family.hash(fn, key), capacity);
	}

	protected static Object requireKey(@Nullable Object key) {
		if (key == null) throw new NullPointerException("Null keys not supported");
		return key;
	}

	protected static Object requireValue(@Nullable Object value) {
		if (value == null) throw new NullPointerException("Null values not supported");
		return value;
	}
}
