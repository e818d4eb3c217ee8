package io.github.bluuewhale.longhash;

import java.util.Random;
import java.util.concurrent.TimeUnit;

import it.unimi.dsi.fastutil.longs.Long2LongOpenHashMap;
import org.eclipse.collections.impl.map.mutable.primitive.LongLongHashMap;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

@Fork(1)
@Warmup(iterations = 5)
@Measurement(iterations = 5)
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
public class MapBenchmark {

	@State(Scope.Benchmark)
	public static class ReadState {
		@Param({ "12000", "48000", "196000", "784000" })
		int size;

		@Param({ "SIGN_FOLDING", "MIXING" })
		String strategy;

		LongLongChainedMap chained;
		Long2LongOpenHashMap fastutil;
		LongLongHashMap eclipse;
		long[] keys;
		long[] misses;
		int nextKeyIndex;
		int nextMissIndex;

		@Setup(Level.Trial)
		public void setup() {
			keys = new long[size];
			misses = new long[size];
			SetBenchmark.generateKeysAndMisses(new Random(123), keys, misses);

			var hash = "MIXING".equals(strategy) ? LongHashStrategy.MIXING : LongHashStrategy.SIGN_FOLDING;
			chained = new LongLongChainedMap(16, 0.75, hash);
			fastutil = new Long2LongOpenHashMap();
			eclipse = new LongLongHashMap();
			for (long k : keys) {
				chained.upsert(k, k);
				fastutil.put(k, k);
				eclipse.put(k, k);
			}
			nextKeyIndex = 0;
			nextMissIndex = 0;
		}

		long nextHitKey() {
			long k = keys[nextKeyIndex];
			nextKeyIndex = (nextKeyIndex + 1) % keys.length;
			return k;
		}

		long nextMissKey() {
			long k = misses[nextMissIndex];
			nextMissIndex = (nextMissIndex + 1) % misses.length;
			return k;
		}
	}

	@State(Scope.Thread)
	public static class FillState {
		@Param({ "12000", "196000" })
		int size;

		long[] keys;

		@Setup(Level.Trial)
		public void setup() {
			keys = new long[size];
			SetBenchmark.generateKeysAndMisses(new Random(456), keys, new long[size]);
		}
	}

	@Benchmark
	public long chainedGetHit(ReadState s) { return s.chained.getOrDefault(s.nextHitKey(), -1L); }

	@Benchmark
	public long fastutilGetHit(ReadState s) { return s.fastutil.get(s.nextHitKey()); }

	@Benchmark
	public long eclipseGetHit(ReadState s) { return s.eclipse.get(s.nextHitKey()); }

	@Benchmark
	public long chainedGetMiss(ReadState s) { return s.chained.getOrDefault(s.nextMissKey(), -1L); }

	@Benchmark
	public long fastutilGetMiss(ReadState s) { return s.fastutil.get(s.nextMissKey()); }

	@Benchmark
	public long eclipseGetMiss(ReadState s) { return s.eclipse.get(s.nextMissKey()); }

	/** Fill from the default capacity, paying for every resize on the way. */
	@Benchmark
	public void chainedFill(FillState s, Blackhole bh) {
		var m = new LongLongChainedMap();
		for (long k : s.keys) m.upsert(k, k);
		bh.consume(m);
	}

	@Benchmark
	public void fastutilFill(FillState s, Blackhole bh) {
		var m = new Long2LongOpenHashMap();
		for (long k : s.keys) m.put(k, k);
		bh.consume(m);
	}

	@Benchmark
	public void eclipseFill(FillState s, Blackhole bh) {
		var m = new LongLongHashMap();
		for (long k : s.keys) m.put(k, k);
		bh.consume(m);
	}
}
