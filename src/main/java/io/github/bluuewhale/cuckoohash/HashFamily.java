package io.github.bluuewhale.cuckoohash;

import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

import org.jspecify.annotations.Nullable;

/**
 * A family of {@code k} seeded hash functions derived from a single master seed.
 *
 * <p>Seeds are produced by chaining SplitMix64 over the master seed and the function
 * index, so every function index yields an independent-looking hash stream even though
 * all of them start from the same {@link Object#hashCode()}. The functions are for slot
 * distribution only; they make no cryptographic claims.
 *
 * <p>Instances are immutable and may be shared freely between tables and threads.
 */
public final class HashFamily {

	/* Defaults */
	private static final int DEFAULT_FUNCTION_COUNT = 3;

	private final long[] seeds;

	/**
	 * Creates a family of three functions seeded from {@link ThreadLocalRandom}.
	 */
	public HashFamily() {
		this(DEFAULT_FUNCTION_COUNT);
	}

	public HashFamily(int k) {
		this(k, ThreadLocalRandom.current().nextLong());
	}

	/**
	 * @param k number of functions, at least 1
	 * @param masterSeed seed from which every per-function seed is derived
	 * @throws IllegalArgumentException if {@code k < 1}
	 */
	public HashFamily(int k, long masterSeed) {
		if (k < 1) throw new IllegalArgumentException("function count must be >= 1: " + k);
		this.seeds = new long[k];
		long x = masterSeed;
		for (int i = 0; i < k; i++) {
			x = Hashing.splitmix64(x + i);
			seeds[i] = x;
		}
	}

	/** Number of functions in this family. */
	public int k() {
		return seeds.length;
	}

	public long seed(int i) {
		Objects.checkIndex(i, seeds.length);
		return seeds[i];
	}

	public long[] seeds() {
		return seeds.clone();
	}

	/**
	 * Applies function {@code i} to {@code key}. The result should be read as an unsigned
	 * 64-bit value.
	 *
	 * @throws IndexOutOfBoundsException if {@code i} is not in {@code [0, k)}
	 * @throws NullPointerException if {@code key} is null
	 */
	public long hash(int i, Object key) {
		Objects.checkIndex(i, seeds.length);
		if (key == null) throw new NullPointerException("Null keys not supported");
		return Hashing.mix(Hashing.baseHash(key), seeds[i]);
	}

	/**
	 * Candidate position of {@code key} under function {@code i} for a table of
	 * {@code capacity} slots.
	 */
	public int position(int i, Object key, int capacity) {
		if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0: " + capacity);
		return Hashing.reduce(hash(i, key), capacity);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("HashFamily{k=").append(seeds.length).append(", seeds=[");
		for (int i = 0; i < seeds.length; i++) {
			if (i > 0) sb.append(", ");
			sb.append("0x").append(Long.toHexString(seeds[i]));
		}
		return sb.append("]}").toString();
	}

	@Override
	public boolean equals(@Nullable Object o) {
		if (this == o) return true;
		if (!(o instanceof HashFamily other)) return false;
		return Arrays.equals(seeds, other.seeds);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(seeds);
	}
}
