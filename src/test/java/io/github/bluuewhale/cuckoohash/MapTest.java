package io.github.bluuewhale.cuckoohash;

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.IntFunction;
import java.util.function.Supplier;
import java.util.stream.Stream;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

class MapTest {

	record MapSpec(
		String name,
		Supplier<Map<?, ?>> mapSupplier,
		IntFunction<Map<?, ?>> mapWithCapacitySupplier
	) {
		@Override public String toString() { return name; }
	}

	private static Stream<MapSpec> mapSpecs() {
		return Stream.of(
			new MapSpec(
				"CuckooMap",
				CuckooMap::new,
				CuckooMap::new
			),
			new MapSpec(
				"CuckooMap k=2",
				() -> new CuckooMap<>(new HashFamily(2)),
				cap -> new CuckooMap<>(new HashFamily(2), cap)
			),
			new MapSpec(
				"ReplicatedHashMap",
				ReplicatedHashMap::new,
				ReplicatedHashMap::new
			)
		);
	}

	@SuppressWarnings("unchecked")
	private static <K, V> Map<K, V> newMap(MapSpec spec) {
		return (Map<K, V>) spec.mapSupplier().get();
	}

	@SuppressWarnings("unchecked")
	private static <K, V> Map<K, V> newMap(MapSpec spec, int capacity) {
		return (Map<K, V>) spec.mapWithCapacitySupplier().apply(capacity);
	}

	@ParameterizedTest(name = "{0} isEmpty")
	@MethodSource("mapSpecs")
	void isEmpty(MapSpec spec) {
		var m = newMap(spec);

		assertTrue(m.isEmpty());

		m.put("a", 1);
		assertFalse(m.isEmpty());
	}

	@ParameterizedTest(name = "{0} containsKey")
	@MethodSource("mapSpecs")
	void containsKey(MapSpec spec) {
		var m = newMap(spec);
		m.put("a", 1);

		assertTrue(m.containsKey("a"));
		assertFalse(m.containsKey("b"));
		assertThrows(NullPointerException.class, () -> m.containsKey(null));
	}

	@ParameterizedTest(name = "{0} basicCrud")
	@MethodSource("mapSpecs")
	void basicCrud(MapSpec spec) {
		var m = newMap(spec);

		var first = m.put("a", 1);
		var replaced = m.put("a", 2);
		var removed = m.remove("a");

		assertNull(first);
		assertEquals(1, replaced);
		assertEquals(2, removed);
		assertFalse(m.containsKey("a"));
		assertEquals(0, m.size());
	}

	@ParameterizedTest(name = "{0} nullKeyAndValueRejected")
	@MethodSource("mapSpecs")
	void nullKeyAndValueRejected(MapSpec spec) {
		var m = newMap(spec);

		assertThrows(NullPointerException.class, () -> m.put(null, 10));
		assertThrows(NullPointerException.class, () -> m.put("x", null));
		assertThrows(NullPointerException.class, () -> m.get(null));
		assertThrows(NullPointerException.class, () -> m.remove(null));
		assertThrows(NullPointerException.class, () -> m.putIfAbsent("x", null));
		assertThrows(NullPointerException.class, () -> m.containsValue(null));

		m.put("x", 1);
		assertThrows(NullPointerException.class, () -> m.containsValue(null));
		assertTrue(m.containsValue(1));
		assertEquals(1, m.size());
	}

	@ParameterizedTest(name = "{0} removeThenReinsert")
	@MethodSource("mapSpecs")
	void removeThenReinsert(MapSpec spec) {
		var m = newMap(spec);

		m.put("a", 1);
		m.remove("a");
		m.put("a", 2);

		assertEquals(2, m.get("a"));
		assertEquals(1, m.size());
	}

	@ParameterizedTest(name = "{0} growOnLoad")
	@MethodSource("mapSpecs")
	void growOnLoad(MapSpec spec) {
		var m = newMap(spec, 4);

		for (int i = 0; i < 32; i++) m.put(i, i * 10);
		for (int i = 0; i < 32; i++) assertEquals(i * 10, m.get(i));
	}

	@ParameterizedTest(name = "{0} entrySetRemoveByValue")
	@MethodSource("mapSpecs")
	void entrySetRemoveByValue(MapSpec spec) {
		var m = newMap(spec);

		m.put("a", 1);
		m.put("b", 2);

		assertTrue(m.entrySet().remove(Map.entry("a", 1)));
		assertFalse(m.containsKey("a"));
		assertEquals(1, m.size());

		assertFalse(m.entrySet().remove(Map.entry("b", 999)));
		assertTrue(m.containsKey("b"));
	}

	@ParameterizedTest(name = "{0} iteratorRemove")
	@MethodSource("mapSpecs")
	void iteratorRemove(MapSpec spec) {
		var m = newMap(spec);

		m.put("a", 1);
		m.put("b", 2);

		var it = m.keySet().iterator();
		assertTrue(it.hasNext());

		it.next();
		it.remove();

		assertEquals(1, m.size());
	}

	@ParameterizedTest(name = "{0} clearResetsState")
	@MethodSource("mapSpecs")
	void clearResetsState(MapSpec spec) {
		var m = newMap(spec);

		m.put("a", 1);
		m.clear();

		assertEquals(0, m.size());
		assertFalse(m.containsKey("a"));

		m.put("b", 2);
		assertEquals(2, m.get("b"));
	}

	@ParameterizedTest(name = "{0} entrySetSetValueReflectsInMap")
	@MethodSource("mapSpecs")
	void entrySetSetValueReflectsInMap(MapSpec spec) {
		var m = newMap(spec);
		m.put("k", 1);

		var e = m.entrySet().iterator().next();
		e.setValue(99);

		assertEquals(99, m.get("k"));
		assertThrows(NullPointerException.class, () -> e.setValue(null));
	}

	@ParameterizedTest(name = "{0} iteratorRemovesAll")
	@MethodSource("mapSpecs")
	void iteratorRemovesAll(MapSpec spec) {
		var m = newMap(spec);
		for (int i = 0; i < 10; i++) m.put(i, i);

		var it = m.entrySet().iterator();
		while (it.hasNext()) {
			it.next();
			it.remove();
		}

		assertEquals(0, m.size());
		assertTrue(m.isEmpty());
	}

	@ParameterizedTest(name = "{0} sharedHashCode")
	@MethodSource("mapSpecs")
	void sharedHashCode(MapSpec spec) {
		// two keys with equal hash codes still get separate slots
		record Fixed(int val) {
			@Override public int hashCode() { return 0x1234_5601; }
		}
		var m = newMap(spec);

		m.put(new Fixed(1), 10);
		m.put(new Fixed(2), 20);
		m.remove(new Fixed(1));

		assertNull(m.get(new Fixed(1)));
		assertEquals(20, m.get(new Fixed(2)));
		assertEquals(1, m.size());
	}

	@ParameterizedTest(name = "{0} putAllBulk")
	@MethodSource("mapSpecs")
	void putAllBulk(MapSpec spec) {
		var m = newMap(spec);
		var src = new HashMap<Integer, Integer>();
		for (int i = 0; i < 50; i++) src.put(i, i * 2);

		m.putAll(src);

		assertEquals(src.size(), m.size());
		for (int i = 0; i < 50; i++) assertEquals(i * 2, m.get(i));
	}

	@ParameterizedTest(name = "{0} valuesContainsAndIteratorRemove")
	@MethodSource("mapSpecs")
	void valuesContainsAndIteratorRemove(MapSpec spec) {
		var m = newMap(spec);
		m.put("a", 1);
		m.put("b", 2);

		assertTrue(m.values().contains(1));
		assertFalse(m.values().contains(3));

		var it = m.values().iterator();
		assertTrue(it.hasNext());
		it.next();
		it.remove();

		assertEquals(1, m.size());
	}

	@ParameterizedTest(name = "{0} keySetRemoveAllRetainAll")
	@MethodSource("mapSpecs")
	void keySetRemoveAllRetainAll(MapSpec spec) {
		var m = newMap(spec);
		m.put("a", 1);
		m.put("b", 2);
		m.put("c", 3);

		m.keySet().removeAll(Set.of("a", "x"));
		assertFalse(m.containsKey("a"));
		assertEquals(2, m.size());

		m.keySet().retainAll(Set.of("b"));
		assertTrue(m.containsKey("b"));
		assertEquals(1, m.size());
	}

	@ParameterizedTest(name = "{0} iteratorRemoveIllegalState")
	@MethodSource("mapSpecs")
	void iteratorRemoveIllegalState(MapSpec spec) {
		var m = newMap(spec);

		m.put("a", 1);
		var it = m.entrySet().iterator();

		assertThrows(IllegalStateException.class, it::remove);
	}

	@ParameterizedTest(name = "{0} duplicateRemoveIllegalState")
	@MethodSource("mapSpecs")
	void duplicateRemoveIllegalState(MapSpec spec) {
		var m = newMap(spec);
		m.put("a", 1);
		var it = m.entrySet().iterator();
		it.next();
		it.remove();

		assertThrows(IllegalStateException.class, it::remove);
	}

	@ParameterizedTest(name = "{0} largeDeleteAndReinsert")
	@MethodSource("mapSpecs")
	void largeDeleteAndReinsert(MapSpec spec) {
		var m = newMap(spec);
		for (int i = 0; i < 500; i++) m.put(i, i);

		for (int i = 0; i < 400; i++) m.remove(i);
		for (int i = 0; i < 400; i++) m.put(i, i * 2);

		assertEquals(500, m.size());
		for (int i = 0; i < 500; i++) {
			int expected = (i < 400) ? i * 2 : i;
			assertEquals(expected, m.get(i));
		}
	}

	@ParameterizedTest(name = "{0} entrySetSetValueAcrossAll")
	@MethodSource("mapSpecs")
	void entrySetSetValueAcrossAll(MapSpec spec) {
		var m = newMap(spec);
		m.put("a", 1);
		m.put("b", 2);
		m.put("c", 3);

		for (var e : m.entrySet()) {
			e.setValue(100);
		}

		for (var e : m.entrySet()) assertEquals(100, e.getValue());
	}

	@ParameterizedTest(name = "{0} iteratorCoversAllEntries")
	@MethodSource("mapSpecs")
	void iteratorCoversAllEntries(MapSpec spec) {
		var m = newMap(spec);
		int n = 10000;
		int expectedSum = 0;
		for (int i = 0; i < n; i++) {
			int v = i + 1; // avoid zero to make sum check meaningful
			m.put(i, v);
			expectedSum += v;
		}

		int actualSum = 0;
		int count = 0;
		for (var e : m.entrySet()) {
			actualSum += (Integer) e.getValue();
			count++;
		}

		assertEquals(n, count);
		assertEquals(n, m.size());
		assertEquals(expectedSum, actualSum);
	}

	@ParameterizedTest(name = "{0} equalsAndHashCodeMatchHashMap")
	@MethodSource("mapSpecs")
	void equalsAndHashCodeMatchHashMap(MapSpec spec) {
		Map<String, Integer> m = newMap(spec);
		var ref = new HashMap<String, Integer>();
		for (int i = 0; i < 100; i++) {
			m.put("k" + i, i);
			ref.put("k" + i, i);
		}

		assertEquals(ref, m);
		assertEquals(m, ref);
		assertEquals(ref.hashCode(), m.hashCode());
	}
}
