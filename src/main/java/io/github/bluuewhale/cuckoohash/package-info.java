/**
 * Multi-probe hashing: a seeded {@link io.github.bluuewhale.cuckoohash.HashFamily} and the
 * tables that place keys at the candidate positions it produces.
 */
@NullMarked
package io.github.bluuewhale.cuckoohash;

import org.jspecify.annotations.NullMarked;
