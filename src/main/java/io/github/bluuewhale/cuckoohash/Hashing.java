package io.github.bluuewhale.cuckoohash;

/**
 * Static 64-bit mixing helpers shared by {@link HashFamily} and the tables.
 * Based on Sebastiano Vigna's SplitMix64 finalizer (public domain), combined with
 * the Boost-style {@code hash_combine} step.
 */
final class Hashing {

	private Hashing() {}

	/* 2^64 / golden ratio, odd */
	static final long GOLDEN_GAMMA = 0x9e3779b97f4a7c15L;

	private static final long MIX_1 = 0xbf58476d1ce4e5b9L;
	private static final long MIX_2 = 0x94d049bb133111ebL;

	static long splitmix64(long x) {
		x += GOLDEN_GAMMA;
		x = (x ^ (x >>> 30)) * MIX_1;
		x = (x ^ (x >>> 27)) * MIX_2;
		return x ^ (x >>> 31);
	}

	/*
	 * Folds a base hash and a per-function seed into one avalanche-mixed value.
	 */
	static long mix(long base, long seed) {
		return splitmix64(base ^ (seed + GOLDEN_GAMMA + (base << 6) + (base >>> 2)));
	}

	/* Widens hashCode() without sign extension. */
	static long baseHash(Object key) {
		return Integer.toUnsignedLong(key.hashCode());
	}

	/* Maps an unsigned 64-bit hash onto [0, capacity). */
	static int reduce(long hash, int capacity) {
		return (int) Long.remainderUnsigned(hash, capacity);
	}
}
