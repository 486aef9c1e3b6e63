package io.github.bluuewhale.cuckoohash;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;
import org.eclipse.collections.impl.map.mutable.UnifiedMap;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

@Fork(
    value=1,
    jvmArgsAppend = {
        "-Xms1g",
        "-Xmx1g",
//        "-XX:+UnlockDiagnosticVMOptions",
//        "-XX:+DebugNonSafepoints",
    }
)
@Warmup(iterations = 5)
@Measurement(iterations = 5)
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
public class MapBenchmark {

	private static String randomUuidString(Random rnd) {
		return new UUID(rnd.nextLong(), rnd.nextLong()).toString();
	}

	/**
	 * Fills {@code keys} and {@code misses} with distinct UUID strings; no miss is also a key.
	 */
	private static void generateKeysAndMisses(Random rnd, String[] keys, String[] misses) {
		if (keys.length != misses.length) throw new IllegalArgumentException("keys and misses must have same length");
		int size = keys.length;
		var set = new HashSet<String>(size * 2);
		for (int i = 0; i < size; i++) {
			String k;
			do { k = randomUuidString(rnd); } while (!set.add(k));
			keys[i] = k;
		}
		for (int i = 0; i < size; i++) {
			String miss;
			do { miss = randomUuidString(rnd); } while (!set.add(miss));
			misses[i] = miss;
		}
	}

	/* One instance of every map under test, all holding the same keys. */
	static final class Maps {
		final CuckooMap<String, Object> cuckoo2 = new CuckooMap<>(new HashFamily(2, 1L));
		final CuckooMap<String, Object> cuckoo3 = new CuckooMap<>(new HashFamily(3, 1L));
		final ReplicatedHashMap<String, Object> replicated = new ReplicatedHashMap<>(new HashFamily(3, 1L));
		final Object2ObjectOpenHashMap<String, Object> fastutil = new Object2ObjectOpenHashMap<>();
		final UnifiedMap<String, Object> unified = new UnifiedMap<>();
		final HashMap<String, Object> jdk = new HashMap<>();

		Maps(String[] keys) {
			for (String k : keys) {
				cuckoo2.put(k, "dummy");
				cuckoo3.put(k, "dummy");
				replicated.put(k, "dummy");
				fastutil.put(k, "dummy");
				unified.put(k, "dummy");
				jdk.put(k, "dummy");
			}
		}

		void remove(String key) {
			cuckoo2.remove(key);
			cuckoo3.remove(key);
			replicated.remove(key);
			fastutil.remove(key);
			unified.remove(key);
			jdk.remove(key);
		}
	}

	@State(Scope.Benchmark)
	public static class ReadState {
		@Param({ "8000", "64000", "512000" }) // a bit under half of a power-of-two capacity
		int size;

		Maps maps;
		String[] keys;
		String[] misses;
		int nextKeyIndex;
		int nextMissIndex;

		@Setup(Level.Trial)
		public void setup() {
			keys = new String[size];
			misses = new String[size];
			generateKeysAndMisses(new Random(123), keys, misses);
			maps = new Maps(keys);
			nextKeyIndex = 0;
			nextMissIndex = 0;
		}

		String nextHitKey() {
			var k = keys[nextKeyIndex];
			nextKeyIndex = (nextKeyIndex + 1) % keys.length;
			return k;
		}
		String nextMissingKey() {
			var k = misses[nextMissIndex];
			nextMissIndex = (nextMissIndex + 1) % misses.length;
			return k;
		}
	}

	/**
	 * Keeps entry count constant by removing one present key in {@code @Setup(Level.Invocation)},
	 * so the measured region is a single insertion of an absent key.
	 */
	@State(Scope.Thread)
	public static class PutMissState {
		@Param({ "8000", "64000", "512000" })
		int size;

		int idx;
		String[] keys;   // keys currently present in the maps
		String[] misses; // keys currently absent from the maps
		String nextKey;
		Maps maps;

		@Setup(Level.Trial)
		public void initKeys() {
			keys = new String[size];
			misses = new String[size];
			generateKeysAndMisses(new Random(456), keys, misses);
		}

		@Setup(Level.Iteration)
		public void resetMaps() {
			idx = 0;
			maps = new Maps(keys);
		}

		@Setup(Level.Invocation)
		public void beforeInvocation() {
			String evictKey = keys[idx];
			maps.remove(evictKey);
			nextKey = misses[idx];

			// swap so that nextKey becomes a "present" key and evict becomes an "absent" key
			keys[idx] = nextKey;
			misses[idx] = evictKey;

			idx = (idx + 1) % keys.length;
		}

		String nextMissKey() { return nextKey; }
		String nextValue() { return "dummy"; }
	}

	// ------- get hit/miss -------
	@Benchmark
	public void cuckoo2GetHit(ReadState s, Blackhole bh) {
		bh.consume(s.maps.cuckoo2.get(s.nextHitKey()));
	}

	@Benchmark
	public void cuckoo3GetHit(ReadState s, Blackhole bh) {
		bh.consume(s.maps.cuckoo3.get(s.nextHitKey()));
	}

	@Benchmark
	public void replicatedGetHit(ReadState s, Blackhole bh) {
		bh.consume(s.maps.replicated.get(s.nextHitKey()));
	}

	@Benchmark
	public void fastutilGetHit(ReadState s, Blackhole bh) {
		bh.consume(s.maps.fastutil.get(s.nextHitKey()));
	}

	@Benchmark
	public void unifiedGetHit(ReadState s, Blackhole bh) {
		bh.consume(s.maps.unified.get(s.nextHitKey()));
	}

	@Benchmark
	public void jdkGetHit(ReadState s, Blackhole bh) {
		bh.consume(s.maps.jdk.get(s.nextHitKey()));
	}

	@Benchmark
	public void cuckoo2GetMiss(ReadState s, Blackhole bh) {
		bh.consume(s.maps.cuckoo2.get(s.nextMissingKey()));
	}

	@Benchmark
	public void cuckoo3GetMiss(ReadState s, Blackhole bh) {
		bh.consume(s.maps.cuckoo3.get(s.nextMissingKey()));
	}

//	@Benchmark
	public void replicatedGetMiss(ReadState s, Blackhole bh) {
		bh.consume(s.maps.replicated.get(s.nextMissingKey()));
	}

	@Benchmark
	public void jdkGetMiss(ReadState s, Blackhole bh) {
		bh.consume(s.maps.jdk.get(s.nextMissingKey()));
	}

	// ------- mutating: put miss -------
	@Benchmark
	public void cuckoo2PutMiss(PutMissState s, Blackhole bh) {
		bh.consume(s.maps.cuckoo2.put(s.nextMissKey(), s.nextValue()));
	}

	@Benchmark
	public void cuckoo3PutMiss(PutMissState s, Blackhole bh) {
		bh.consume(s.maps.cuckoo3.put(s.nextMissKey(), s.nextValue()));
	}

//	@Benchmark
	public void replicatedPutMiss(PutMissState s, Blackhole bh) {
		bh.consume(s.maps.replicated.put(s.nextMissKey(), s.nextValue()));
	}

	@Benchmark
	public void fastutilPutMiss(PutMissState s, Blackhole bh) {
		bh.consume(s.maps.fastutil.put(s.nextMissKey(), s.nextValue()));
	}

	@Benchmark
	public void jdkPutMiss(PutMissState s, Blackhole bh) {
		bh.consume(s.maps.jdk.put(s.nextMissKey(), s.nextValue()));
	}

	// ------- iteration -------
	@Benchmark
	public void cuckoo3Iterate(ReadState s, Blackhole bh) {
		for (var e : s.maps.cuckoo3.entrySet()) {
			bh.consume(e.getKey());
			bh.consume(e.getValue());
		}
	}

	@Benchmark
	public void jdkIterate(ReadState s, Blackhole bh) {
		for (var e : s.maps.jdk.entrySet()) {
			bh.consume(e.getKey());
			bh.consume(e.getValue());
		}
	}
}
