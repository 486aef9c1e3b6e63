package io.github.bluuewhale.cuckoohash;

import java.util.AbstractSet;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chained hash map that stores every key in each of its candidate buckets
 * (null keys and null values NOT allowed).
 *
 * <p>Where {@link CuckooMap} keeps exactly one copy per key, this map keeps one copy per
 * distinct candidate bucket, so any single bucket can be enumerated on its own and will
 * contain every key that could hash there. Both maps can share one {@link HashFamily},
 * which gives two parties the same bucket layout. Requires {@code k >= 3}.
 *
 * <p>{@link #size()} counts logical keys; {@link #storedCopies()} counts physical copies.
 */
public class ReplicatedHashMap<K, V> extends AbstractMultiProbeMap<K, V> {

	private static final Logger log = LoggerFactory.getLogger(ReplicatedHashMap.class);

	/* Defaults */
	private static final int DEFAULT_INITIAL_CAPACITY = 16;
	private static final double DEFAULT_LOAD_FACTOR = 0.75d;
	private static final int MIN_FUNCTIONS = 3;

	private final double maxLoadFactor;
	private ArrayList<Node<K, V>>[] buckets; // null until a bucket receives its first key

	public ReplicatedHashMap() {
		this(new HashFamily());
	}

	public ReplicatedHashMap(int initialCapacity) {
		this(new HashFamily(), initialCapacity, DEFAULT_LOAD_FACTOR);
	}

	public ReplicatedHashMap(@Nullable HashFamily family) {
		this(family, DEFAULT_INITIAL_CAPACITY, DEFAULT_LOAD_FACTOR);
	}

	public ReplicatedHashMap(@Nullable HashFamily family, int initialCapacity) {
		this(family, initialCapacity, DEFAULT_LOAD_FACTOR);
	}

	/**
	 * @param family shared hash family, must have at least three functions
	 * @param initialCapacity bucket count, raised to 1 if smaller
	 * @param loadFactor logical keys per bucket above which the bucket count doubles
	 */
	public ReplicatedHashMap(@Nullable HashFamily family, int initialCapacity, double loadFactor) {
		super(family, MIN_FUNCTIONS);
		Utils.validateLoadFactor(loadFactor);
		this.maxLoadFactor = loadFactor;
		allocate(Utils.clampCapacity(initialCapacity, 1));
	}

	@Override
	public boolean insert(K key, V value) {
		requireKey(key);
		requireValue(value);
		if (loadFactor() > maxLoadFactor) {
			int grown = Utils.doubled(capacity);
			if (grown > 0) rehash(grown);
		}

		Node<K, V> node = findNode(key);
		if (node != null) {
			node.value = value;
			return false;
		}
		link(new Node<>(key, value));
		size++;
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
		Node<K, V> node = findNode(requireKey(key));
		if (node == null) return null;
		unlink(node);
		size--;
		return node.value;
	}

	@Override
	public boolean erase(Object key) {
		return remove(key) != null;
	}

	@Override
	public void clear() {
		Arrays.fill(buckets, null);
		size = 0;
	}

	/**
	 * Redistributes every key over at least {@code newCapacity} buckets. The bucket count
	 * never shrinks.
	 */
	public void rehash(int newCapacity) {
		int target = Math.max(capacity, Utils.clampCapacity(newCapacity, 1));
		List<Node<K, V>> nodes = new ArrayList<>(size);
		for (int b = 0; b < capacity; b++) {
			ArrayList<Node<K, V>> chain = buckets[b];
			if (chain == null) continue;
			for (Node<K, V> n : chain) {
				if (primaryBucket(n.key) == b) nodes.add(n);
			}
		}
		if (nodes.size() != size) {
			throw new IllegalStateException("Found " + nodes.size() + " keys, expected " + size);
		}

		int oldCapacity = capacity;
		allocate(target);
		for (Node<K, V> n : nodes) link(n);
		size = nodes.size();
		log.debug("Rehashed {} keys: buckets {} -> {}", size, oldCapacity, capacity);
	}

	/**
	 * Keys stored in one bucket, in insertion order.
	 */
	public List<K> bucketKeys(int bucket) {
		Objects.checkIndex(bucket, capacity);
		ArrayList<Node<K, V>> chain = buckets[bucket];
		if (chain == null) return List.of();
		List<K> out = new ArrayList<>(chain.size());
		for (Node<K, V> n : chain) out.add(n.key);
		return Collections.unmodifiableList(out);
	}

	/** Total number of stored copies over all buckets. */
	public long storedCopies() {
		long copies = 0;
		for (ArrayList<Node<K, V>> chain : buckets) {
			if (chain != null) copies += chain.size();
		}
		return copies;
	}

	@Override
	public Set<Entry<K, V>> entrySet() {
		return new EntryView();
	}

	/* Storage helpers */
	@SuppressWarnings("unchecked")
	private void allocate(int cap) {
		this.capacity = cap;
		this.buckets = (ArrayList<Node<K, V>>[]) new ArrayList[cap];
		this.size = 0;
	}

	private int primaryBucket(Object key) {
		return position(0, key);
	}

	/* Candidate buckets with duplicates dropped, so each bucket holds at most one copy. */
	private int[] distinctBuckets(Object key) {
		int[] cands = candidates(key);
		int n = 0;
		outer:
		for (int i = 0; i < cands.length; i++) {
			for (int j = 0; j < n; j++) {
				if (cands[j] == cands[i]) continue outer;
			}
			cands[n++] = cands[i];
		}
		return (n == cands.length) ? cands : Arrays.copyOf(cands, n);
	}

	private @Nullable Node<K, V> findNode(Object key) {
		int k = family.k();
		for (int i = 0; i < k; i++) {
			ArrayList<Node<K, V>> chain = buckets[position(i, key)];
			if (chain == null) continue;
			for (Node<K, V> n : chain) {
				if (n.key == key || n.key.equals(key)) return n;
			}
		}
		return null;
	}

	private void link(Node<K, V> node) {
		for (int b : distinctBuckets(node.key)) {
			ArrayList<Node<K, V>> chain = buckets[b];
			if (chain == null) {
				chain = new ArrayList<>(2);
				buckets[b] = chain;
			}
			chain.add(node);
		}
	}

	private void unlink(Node<K, V> node) {
		for (int b : distinctBuckets(node.key)) {
			ArrayList<Node<K, V>> chain = buckets[b];
			int at = (chain == null) ? -1 : indexOf(chain, node);
			if (at >= 0) chain.remove(at);
		}
	}

	private static <K, V> int indexOf(List<Node<K, V>> chain, Node<K, V> node) {
		for (int i = 0; i < chain.size(); i++) {
			if (chain.get(i) == node) return i;
		}
		return -1;
	}

	@Override
	protected @Nullable V lookup(Object key) {
		Node<K, V> n = findNode(key);
		return (n == null) ? null : n.value;
	}

	@Override
	protected void dumpTo(StringBuilder sb, boolean detailed) {
		String nl = System.lineSeparator();
		int k = family.k();
		sb.append("ReplicatedHashMap Structure (").append(k).append(" hash functions, ")
			.append(k).append(" storage positions):").append(nl);
		sb.append("------------------------------------------------------------").append(nl);
		sb.append("Bucket count: ").append(capacity).append(nl);
		sb.append("Element count (logical): ").append(size).append(nl);
		sb.append("Physical storage count: ").append(storedCopies())
			.append(" (1 element = up to ").append(k).append(" copies)").append(nl);
		sb.append("Load factor (logical): ").append(loadFactor()).append(nl);
		if (detailed) {
			sb.append("Buckets:").append(nl);
			for (int b = 0; b < capacity; b++) {
				ArrayList<Node<K, V>> chain = buckets[b];
				int n = (chain == null) ? 0 : chain.size();
				sb.append("  Bucket ").append(b).append(" (").append(n).append(" elements): ");
				if (n == 0) {
					sb.append("empty");
				} else {
					for (int i = 0; i < n; i++) {
						if (i > 0) sb.append(" -> ");
						Node<K, V> node = chain.get(i);
						sb.append('{').append(node.key).append(": ").append(node.value).append('}');
					}
				}
				sb.append(nl);
			}
		}
		sb.append("------------------------------------------------------------").append(nl);
	}

	/* One logical entry, referenced from each of its buckets */
	private static final class Node<K, V> {
		final K key;
		V value;

		Node(K key, V value) {
			this.key = key;
			this.value = value;
		}
	}

	/* ------------ EntrySet / Iterator ------------ */

	private final class EntryView extends AbstractSet<Entry<K, V>> {
		@Override
		public int size() {
			return ReplicatedHashMap.this.size;
		}

		@Override
		public void clear() {
			ReplicatedHashMap.this.clear();
		}

		@Override
		public Iterator<Entry<K, V>> iterator() {
			return new EntryIterator();
		}
	}

	/*
	 * Walks buckets in order and yields each node only from its primary bucket. The cursor
	 * (bucket, pos) always points at the next chain element to examine.
	 */
	private final class EntryIterator implements Iterator<Entry<K, V>> {
		private int bucket = 0;
		private int pos = 0;
		private @Nullable Node<K, V> last;

		@Override
		public boolean hasNext() {
			while (bucket < capacity) {
				ArrayList<Node<K, V>> chain = buckets[bucket];
				if (chain != null) {
					while (pos < chain.size()) {
						if (primaryBucket(chain.get(pos).key) == bucket) return true;
						pos++;
					}
				}
				bucket++;
				pos = 0;
			}
			return false;
		}

		@Override
		public Entry<K, V> next() {
			if (!hasNext()) throw new NoSuchElementException();
			Node<K, V> n = buckets[bucket].get(pos++);
			last = n;
			return new EntryRef(n);
		}

		@Override
		public void remove() {
			Node<K, V> n = last;
			if (n == null) throw new IllegalStateException();
			last = null;
			if (findNode(n.key) != n) return;

			// unlinking shifts the cursor's chain if the node sits before the cursor in it
			if (bucket < capacity) {
				ArrayList<Node<K, V>> chain = buckets[bucket];
				if (chain != null) {
					int at = indexOf(chain, n);
					if (at >= 0 && at < pos) pos--;
				}
			}
			unlink(n);
			size--;
		}
	}

	private final class EntryRef implements Entry<K, V> {
		private final Node<K, V> node;

		EntryRef(Node<K, V> node) {
			this.node = node;
		}

		@Override
		public K getKey() {
			return node.key;
		}

		@Override
		public V getValue() {
			return node.value;
		}

		@Override
		public V setValue(V value) {
			requireValue(value);
			V old = node.value;
			node.value = value;
			return old;
		}

		@Override
		public int hashCode() {
			return node.key.hashCode() ^ node.value.hashCode();
		}

		@Override
		public boolean equals(@Nullable Object obj) {
			if (!(obj instanceof Entry<?, ?> e)) return false;
			return Objects.equals(node.key, e.getKey()) && Objects.equals(node.value, e.getValue());
		}

		@Override
		public String toString() {
			return node.key + "=" + node.value;
		}
	}
}
