package io.github.bluuewhale.cuckoohash;

import org.jspecify.annotations.Nullable;

/**
 * Shared validation and sizing helpers for the multi-probe tables.
 */
final class Utils {
	private Utils() {}

	/* Largest slot or bucket count a table may grow to. */
	static final int MAX_CAPACITY = 1 << 30;

	static HashFamily validateFamily(@Nullable HashFamily family, int minFunctions, String tableName) {
		if (family == null || family.k() < minFunctions) {
			throw new IllegalArgumentException(
				"HashFamily must be non-null and k>=" + minFunctions + " for " + tableName
					+ (family == null ? "" : ": k=" + family.k()));
		}
		return family;
	}

	static void validateLoadFactor(double lf) {
		if (!(lf > 0.0d && lf < 1.0d)) {
			throw new IllegalArgumentException("loadFactor must be in (0,1): " + lf);
		}
	}

	static int clampCapacity(int requested, int min) {
		return Math.min(MAX_CAPACITY, Math.max(min, requested));
	}

	/**
	 * Doubles {@code cap}, or returns -1 once {@link #MAX_CAPACITY} has been reached.
	 */
	static int doubled(int cap) {
		if (cap >= MAX_CAPACITY) return -1;
		return Math.min(MAX_CAPACITY, cap << 1);
	}
}
