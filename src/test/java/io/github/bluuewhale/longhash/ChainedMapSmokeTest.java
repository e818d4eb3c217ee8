package io.github.bluuewhale.longhash;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Random;
import java.util.function.Supplier;
import java.util.stream.Stream;

import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import org.eclipse.collections.impl.map.mutable.primitive.LongLongHashMap;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * Randomized upsert/get/remove against Eclipse Collections and fastutil primitive maps.
 */
class ChainedMapSmokeTest {

	record MapSpec(
		String name,
		Supplier<LongLongChainedMap> longMapSupplier,
		Supplier<LongChainedMap<String>> objectMapSupplier
	) {
		@Override public String toString() { return name; }
	}

	private static Stream<MapSpec> mapSpecs() {
		return Stream.of(
			new MapSpec(
				"folding lf=0.75",
				LongLongChainedMap::new,
				LongChainedMap::new
			),
			new MapSpec(
				"folding lf=0.5 cap=3",
				() -> new LongLongChainedMap(3, 0.5),
				() -> new LongChainedMap<>(3, 0.5)
			),
			new MapSpec(
				"mixing lf=0.9",
				() -> new LongLongChainedMap(16, 0.9, LongHashStrategy.MIXING),
				() -> new LongChainedMap<>(16, 0.9, LongHashStrategy.MIXING)
			),
			new MapSpec(
				"single bucket",
				() -> new LongLongChainedMap(16, 0.75, (k, cap) -> 0),
				() -> new LongChainedMap<>(16, 0.75, (k, cap) -> 0)
			)
		);
	}

	@ParameterizedTest(name = "{0} longValuesMatchReference")
	@MethodSource("mapSpecs")
	void longValuesMatchReference(MapSpec spec) {
		var m = spec.longMapSupplier().get();
		var ref = new LongLongHashMap();
		var rnd = new Random(7L);

		for (int op = 0; op < 50_000; op++) {
			long key = rnd.nextInt(1_500) - 750;
			switch (rnd.nextInt(3)) {
				case 0 -> {
					long value = rnd.nextLong();
					boolean absent = !ref.containsKey(key);
					ref.put(key, value);
					assertEquals(absent, m.upsert(key, value), "upsert " + key);
				}
				case 1 -> {
					boolean present = ref.containsKey(key);
					ref.remove(key);
					assertEquals(present, m.remove(key), "remove " + key);
				}
				default -> {
					if (ref.containsKey(key)) assertEquals(ref.get(key), m.get(key).orElseThrow());
					else assertTrue(m.get(key).isEmpty());
				}
			}
			assertEquals(ref.size(), m.size());
		}
	}

	@ParameterizedTest(name = "{0} objectValuesMatchReference")
	@MethodSource("mapSpecs")
	void objectValuesMatchReference(MapSpec spec) {
		var m = spec.objectMapSupplier().get();
		var ref = new Long2ObjectOpenHashMap<String>();
		var rnd = new Random(11L);

		for (int op = 0; op < 50_000; op++) {
			long key = rnd.nextInt(1_500) - 750;
			switch (rnd.nextInt(3)) {
				case 0 -> {
					String value = "v" + op;
					boolean absent = ref.put(key, value) == null;
					assertEquals(absent, m.upsert(key, value), "upsert " + key);
				}
				case 1 -> assertEquals(ref.remove(key), m.remove(key), "remove " + key);
				default -> assertEquals(ref.get(key), m.get(key), "get " + key);
			}
			assertEquals(ref.size(), m.size());
		}
	}

	@ParameterizedTest(name = "{0} largeInsertDeleteReinsert")
	@MethodSource("mapSpecs")
	void largeInsertDeleteReinsert(MapSpec spec) {
		var m = spec.longMapSupplier().get();
		int n = 5_000;

		for (long i = 0; i < n; i++) m.upsert(i, i * 2);
		for (long i = 0; i < n; i++) assertEquals(i * 2, m.get(i).orElseThrow());

		for (long i = 0; i < n; i += 2) m.remove(i);
		for (long i = 0; i < n; i++) {
			if (i % 2 == 0) assertTrue(m.get(i).isEmpty());
			else assertEquals(i * 2, m.get(i).orElseThrow());
		}

		for (long i = 0; i < n; i += 2) m.upsert(i, i * 3);
		for (long i = 0; i < n; i++) {
			long expected = (i % 2 == 0) ? i * 3 : i * 2;
			assertEquals(expected, m.get(i).orElseThrow());
		}
		assertEquals(n, m.size());
	}
}
