package io.github.bluuewhale.cuckoohash;

import java.util.AbstractCollection;
import java.util.AbstractSet;
import java.util.Arrays;
import java.util.Collection;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cuckoo hashing map (null keys and null values NOT allowed).
 *
 * <p>Every key lives in one of its {@code k} candidate slots, so lookups and removals
 * probe at most {@code k} slots regardless of load. Inserts that find all candidates
 * taken run a bounded eviction walk; when the walk is exhausted the table doubles and
 * re-places everything. The table also doubles ahead of an insert once more than half
 * of the slots are occupied.
 *
 * <p>Not thread-safe. The {@link HashFamily} may be shared with other tables.
 */
public class CuckooMap<K, V> extends AbstractMultiProbeMap<K, V> {

	private static final Logger log = LoggerFactory.getLogger(CuckooMap.class);

	/* Defaults */
	private static final int DEFAULT_INITIAL_CAPACITY = 16;
	private static final int DEFAULT_MAX_DISPLACEMENTS = 500;
	private static final int MIN_CAPACITY = 2;
	private static final int MIN_FUNCTIONS = 2;

	/* Grow before an insert once size / capacity exceeds this */
	static final double MAX_LOAD_FACTOR = 0.5d;

	/* Rebuild attempts (requested capacity, then doublings) one operation may make */
	static final int MAX_REBUILD_ATTEMPTS = 8;

	/* Walk buffer length before it first has to grow */
	private static final int INITIAL_WALK_LENGTH = 64;

	/* Storage: parallel slot arrays, a null key marks an empty slot */
	private Object[] keys;
	private Object[] vals;

	private final int maxDisplacements;
	private int[] walk; // slots swapped by the running eviction walk, grown on demand

	public CuckooMap() {
		this(new HashFamily());
	}

	public CuckooMap(int initialCapacity) {
		this(new HashFamily(), initialCapacity, DEFAULT_MAX_DISPLACEMENTS);
	}

	public CuckooMap(@Nullable HashFamily family) {
		this(family, DEFAULT_INITIAL_CAPACITY, DEFAULT_MAX_DISPLACEMENTS);
	}

	public CuckooMap(@Nullable HashFamily family, int initialCapacity) {
		this(family, initialCapacity, DEFAULT_MAX_DISPLACEMENTS);
	}

	/**
	 * @param family shared hash family, must have at least two functions
	 * @param initialCapacity slot count, raised to 2 if smaller
	 * @param maxDisplacements eviction walk length before the table grows
	 * @throws IllegalArgumentException if {@code family} is null, has fewer than two
	 *         functions, or {@code maxDisplacements} is negative
	 */
	public CuckooMap(@Nullable HashFamily family, int initialCapacity, int maxDisplacements) {
		super(family, MIN_FUNCTIONS);
		if (maxDisplacements < 0) {
			throw new IllegalArgumentException("maxDisplacements must be >= 0: " + maxDisplacements);
		}
		this.maxDisplacements = maxDisplacements;
		this.walk = new int[Math.min(maxDisplacements, INITIAL_WALK_LENGTH)];
		allocate(Utils.clampCapacity(initialCapacity, MIN_CAPACITY));
	}

	public int maxDisplacements() {
		return maxDisplacements;
	}

	@Override
	public boolean insert(K key, V value) {
		requireKey(key);
		requireValue(value);
		if (loadFactor() > MAX_LOAD_FACTOR) {
			int grown = Utils.doubled(capacity);
			if (grown > 0) rebuild(grown, null, null);
		}

		int idx = findIndex(key);
		if (idx >= 0) {
			vals[idx] = value;
			return false;
		}
		if (!place(key, value)) {
			log.debug("Eviction walk exhausted after {} displacements at capacity {}, growing",
				maxDisplacements, capacity);
			rebuild(Utils.doubled(capacity), key, value);
		}
		return true;
	}

	@Override
	public @Nullable V put(K key, V value) {
		requireKey(key);
		requireValue(value);
		V old = lookup(key);
		insert(key, value);
		return old;
	}

	@Override
	public @Nullable V remove(@Nullable Object key) {
		int idx = findIndex(requireKey(key));
		if (idx < 0) return null;
		V old = valueAt(idx);
		clearSlot(idx);
		size--;
		return old;
	}

	@Override
	public boolean erase(Object key) {
		return remove(key) != null;
	}

	@Override
	public boolean containsValue(@Nullable Object value) {
		Object v = requireValue(value);
		for (int i = 0; i < capacity; i++) {
			if (keys[i] != null && v.equals(vals[i])) return true;
		}
		return false;
	}

	@Override
	public void clear() {
		Arrays.fill(keys, null);
		Arrays.fill(vals, null);
		size = 0;
	}

	/**
	 * Rebuilds the table with at least {@code newCapacity} slots and re-places every entry.
	 * Requests below the current capacity rebuild at the current capacity; capacity never
	 * shrinks.
	 *
	 * @throws IllegalStateException if the entries cannot be placed within the rebuild bound;
	 *         the table is left unchanged
	 */
	public void resize(int newCapacity) {
		rebuild(Math.max(capacity, Utils.clampCapacity(newCapacity, MIN_CAPACITY)), null, null);
	}

	/**
	 * Key stored in {@code slot}, or {@code null} if the slot is empty.
	 */
	public @Nullable K keyAt(int slot) {
		Objects.checkIndex(slot, capacity);
		return castKey(keys[slot]);
	}

	@Override
	public Set<K> keySet() {
		return new KeyView();
	}

	@Override
	public Collection<V> values() {
		return new ValuesView();
	}

	@Override
	public Set<Entry<K, V>> entrySet() {
		return new EntryView();
	}

	/* Placement */
	private void allocate(int cap) {
		this.capacity = cap;
		this.keys = new Object[cap];
		this.vals = new Object[cap];
		this.size = 0;
	}

	private int findIndex(Object key) {
		int k = family.k();
		for (int i = 0; i < k; i++) {
			int idx = position(i, key);
			Object cur = keys[idx];
			if (cur == key || (cur != null && cur.equals(key))) return idx;
		}
		return -1;
	}

	private int emptyCandidate(Object key) {
		int k = family.k();
		for (int i = 0; i < k; i++) {
			int idx = position(i, key);
			if (keys[idx] == null) return idx;
		}
		return -1;
	}

	/*
	 * Places a key known to be absent. Returns false, with the table untouched, when the
	 * eviction walk runs out of displacements.
	 */
	private boolean place(Object key, Object value) {
		int free = emptyCandidate(key);
		if (free >= 0) {
			setSlot(free, key, value);
			size++;
			return true;
		}
		return displace(key, value);
	}

	private boolean displace(Object key, Object value) {
		int k = family.k();
		Object curKey = key;
		Object curVal = value;
		int which = 0;
		for (int d = 0; d < maxDisplacements; d++) {
			which = (which + 1) % k;
			int idx = position(which, curKey);
			if (d == walk.length) {
				walk = Arrays.copyOf(walk, (int) Math.min(maxDisplacements, 2L * walk.length));
			}
			walk[d] = idx;

			// swap the homeless entry in, the occupant becomes homeless
			Object swapKey = keys[idx];
			Object swapVal = vals[idx];
			setSlot(idx, curKey, curVal);
			curKey = swapKey;
			curVal = swapVal;

			int free = emptyCandidate(curKey);
			if (free >= 0) {
				setSlot(free, curKey, curVal);
				size++;
				return true;
			}
		}

		// Replay the swaps backwards; afterwards curKey is the original key again.
		for (int d = maxDisplacements - 1; d >= 0; d--) {
			int idx = walk[d];
			Object swapKey = keys[idx];
			Object swapVal = vals[idx];
			setSlot(idx, curKey, curVal);
			curKey = swapKey;
			curVal = swapVal;
		}
		return false;
	}

	/*
	 * Re-places the current entries (plus an optional pending one) into a fresh slot array,
	 * doubling until everything fits. The old arrays are only read, so giving up restores
	 * them as they were.
	 */
	private void rebuild(int newCapacity, @Nullable Object pendingKey, @Nullable Object pendingVal) {
		Object[] oldKeys = this.keys;
		Object[] oldVals = this.vals;
		int oldCapacity = this.capacity;
		int oldSize = this.size;
		int expected = oldSize + (pendingKey == null ? 0 : 1);

		int target = newCapacity;
		for (int attempt = 0; ; attempt++) {
			if (target < 0 || attempt >= MAX_REBUILD_ATTEMPTS) {
				this.keys = oldKeys;
				this.vals = oldVals;
				this.capacity = oldCapacity;
				this.size = oldSize;
				throw new IllegalStateException("Unable to place " + expected + " entries after "
					+ attempt + " rebuilds starting from capacity " + oldCapacity
					+ "; too many keys share candidate slots");
			}
			allocate(target);
			if (placeAll(oldKeys, oldVals, pendingKey, pendingVal)) break;
			log.debug("Rebuild at capacity {} could not place all {} entries", target, expected);
			target = Utils.doubled(target);
		}

		if (size != expected) {
			throw new IllegalStateException("Rebuild placed " + size + " entries, expected " + expected);
		}
		log.debug("Rebuilt {} entries: capacity {} -> {}", size, oldCapacity, capacity);
	}

	private boolean placeAll(Object[] srcKeys, Object[] srcVals,
							 @Nullable Object pendingKey, @Nullable Object pendingVal) {
		for (int i = 0; i < srcKeys.length; i++) {
			Object k = srcKeys[i];
			if (k == null) continue;
			if (!place(k, srcVals[i])) return false;
		}
		return pendingKey == null || place(pendingKey, requireValue(pendingVal));
	}

	/* Slot helpers */
	private void setSlot(int idx, Object key, Object value) {
		keys[idx] = key;
		vals[idx] = value;
	}

	private void clearSlot(int idx) {
		keys[idx] = null;
		vals[idx] = null;
	}

	@Override
	protected @Nullable V lookup(Object key) {
		int idx = findIndex(key);
		return (idx >= 0) ? valueAt(idx) : null;
	}

	private V valueAt(int idx) {
		return castValue(vals[idx]);
	}

	@SuppressWarnings("unchecked")
	private V castValue(Object v) {
		return (V) v;
	}

	@SuppressWarnings("unchecked")
	private K castKey(Object k) {
		return (K) k;
	}

	@Override
	protected void dumpTo(StringBuilder sb, boolean detailed) {
		String nl = System.lineSeparator();
		sb.append("CuckooMap Structure:").append(nl);
		sb.append("---------------------").append(nl);
		sb.append("Capacity: ").append(capacity).append(nl);
		sb.append("Element count: ").append(size).append(nl);
		sb.append("Load factor: ").append(loadFactor()).append(nl);
		sb.append("Number of hash functions: ").append(family.k()).append(nl);
		sb.append("Max displacements: ").append(maxDisplacements).append(nl);
		if (detailed) {
			sb.append("Table entries:").append(nl);
			for (int i = 0; i < capacity; i++) {
				sb.append("  Index ").append(i).append(": ");
				Object k = keys[i];
				if (k == null) {
					sb.append("empty");
				} else {
					sb.append('{').append(k).append(": ").append(vals[i]).append('}');
					sb.append(" (possible positions: ");
					int[] cands = candidates(k);
					for (int h = 0; h < cands.length; h++) {
						if (h > 0) sb.append(", ");
						sb.append(cands[h]);
					}
					sb.append(')');
				}
				sb.append(nl);
			}
		}
		sb.append("---------------------").append(nl);
	}

	/* iterator base: slots are never shifted by removals, so a linear scan is stable */
	private abstract class BaseIter<T> implements Iterator<T> {
		private int next = -1;
		private int last = -1;

		BaseIter() {
			advance(0);
		}

		private void advance(int from) {
			next = -1;
			for (int i = from; i < capacity; i++) {
				if (keys[i] != null) {
					next = i;
					return;
				}
			}
		}

		@Override
		public boolean hasNext() {
			return next >= 0;
		}

		int nextIndex() {
			if (!hasNext()) throw new NoSuchElementException();
			int i = next;
			last = i;
			advance(i + 1);
			return i;
		}

		@Override
		public void remove() {
			if (last < 0) throw new IllegalStateException();
			if (keys[last] != null) {
				clearSlot(last);
				size--;
			}
			last = -1;
		}
	}

	private class KeyIter extends BaseIter<K> {
		@Override
		public K next() {
			return castKey(keys[nextIndex()]);
		}
	}

	private class ValueIter extends BaseIter<V> {
		@Override
		public V next() {
			return castValue(vals[nextIndex()]);
		}
	}

	private class EntryIter extends BaseIter<Entry<K, V>> {
		@Override
		public Entry<K, V> next() {
			return new EntryRef(nextIndex());
		}
	}

	private class EntryRef implements Entry<K, V> {
		private final int idx;
		private final K key;
		private V value; // last value seen, kept for entries whose key was removed

		EntryRef(int idx) {
			this.idx = idx;
			this.key = castKey(keys[idx]);
			this.value = castValue(vals[idx]);
		}

		@Override
		public K getKey() {
			return key;
		}

		@Override
		public V getValue() {
			// the entry may have been relocated by a later insert, or removed
			V live = (keys[idx] == key) ? castValue(vals[idx]) : lookup(key);
			if (live != null) value = live;
			return value;
		}

		@Override
		public V setValue(V value) {
			requireValue(value);
			V old = getValue();
			if (keys[idx] == key) {
				vals[idx] = value;
			} else {
				CuckooMap.this.put(key, value);
			}
			this.value = value;
			return old;
		}

		@Override
		public boolean equals(@Nullable Object o) {
			if (!(o instanceof Entry<?, ?> e)) return false;
			return Objects.equals(getKey(), e.getKey()) && Objects.equals(getValue(), e.getValue());
		}

		@Override
		public int hashCode() {
			return Objects.hashCode(getKey()) ^ Objects.hashCode(getValue());
		}

		@Override
		public String toString() {
			return key + "=" + getValue();
		}
	}

	private final class KeyView extends AbstractSet<K> {
		@Override
		public Iterator<K> iterator() {
			return new KeyIter();
		}

		@Override
		public int size() { return CuckooMap.this.size(); }

		@Override
		public void clear() { CuckooMap.this.clear(); }
	}

	private final class ValuesView extends AbstractCollection<V> {
		@Override
		public Iterator<V> iterator() {
			return new ValueIter();
		}

		@Override
		public int size() { return CuckooMap.this.size(); }

		@Override
		public void clear() { CuckooMap.this.clear(); }
	}

	private final class EntryView extends AbstractSet<Entry<K, V>> {
		@Override
		public Iterator<Entry<K, V>> iterator() {
			return new EntryIter();
		}

		@Override
		public int size() { return CuckooMap.this.size(); }

		@Override
		public void clear() { CuckooMap.this.clear(); }
	}
}
