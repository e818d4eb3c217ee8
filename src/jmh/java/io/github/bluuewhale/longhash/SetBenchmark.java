package io.github.bluuewhale.longhash;

import java.util.Random;
import java.util.concurrent.TimeUnit;

import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import org.eclipse.collections.impl.set.mutable.primitive.LongHashSet;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

@Fork(2)
@Warmup(iterations = 3)
@Measurement(iterations = 5, time = 3, timeUnit = TimeUnit.SECONDS)
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
public class SetBenchmark {

	/**
	 * Fills {@code keys} and {@code misses} with distinct random longs, no value appearing in both.
	 */
	static void generateKeysAndMisses(Random rnd, long[] keys, long[] misses) {
		if (keys.length != misses.length) throw new IllegalArgumentException("keys and misses must have same length");
		var seen = new LongOpenHashSet(keys.length * 2);
		for (int i = 0; i < keys.length; i++) {
			long k;
			do { k = rnd.nextLong(); } while (!seen.add(k));
			keys[i] = k;
		}
		for (int i = 0; i < misses.length; i++) {
			long m;
			do { m = rnd.nextLong(); } while (!seen.add(m));
			misses[i] = m;
		}
	}

	@State(Scope.Benchmark)
	public static class ReadState {
		@Param({ "12000", "48000", "196000", "784000" })
		int size;

		LongProbingSet probing;
		LongOpenHashSet fastutil;
		LongHashSet eclipse;
		long[] keys;
		long[] misses;
		int nextKeyIndex;
		int nextMissIndex;

		@Setup(Level.Trial)
		public void setup() {
			keys = new long[size];
			misses = new long[size];
			generateKeysAndMisses(new Random(123), keys, misses);
			probing = new LongProbingSet();
			fastutil = new LongOpenHashSet();
			eclipse = new LongHashSet();
			for (long k : keys) {
				probing.add(k);
				fastutil.add(k);
				eclipse.add(k);
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

	/**
	 * Steady-state churn: every invocation removes one present key and adds one absent key, so the
	 * set size stays constant while tombstones keep being created and reused.
	 */
	@State(Scope.Thread)
	public static class ChurnState {
		@Param({ "12000", "196000" })
		int size;

		long[] keys;   // present
		long[] misses; // absent
		int cursor;

		LongProbingSet probing;
		LongOpenHashSet fastutil;
		LongHashSet eclipse;

		@Setup(Level.Iteration)
		public void reset() {
			keys = new long[size];
			misses = new long[size];
			generateKeysAndMisses(new Random(789), keys, misses);
			probing = new LongProbingSet();
			fastutil = new LongOpenHashSet();
			eclipse = new LongHashSet();
			for (long k : keys) {
				probing.add(k);
				fastutil.add(k);
				eclipse.add(k);
			}
			cursor = 0;
		}

		/** Swaps the next present/absent pair and returns {evict, insert}. */
		long[] nextPair() {
			int i = cursor;
			cursor = (cursor + 1) % keys.length;
			long evict = keys[i];
			long insert = misses[i];
			keys[i] = insert;
			misses[i] = evict;
			return new long[] { evict, insert };
		}
	}

	@Benchmark
	public void probingContainsHit(ReadState s, Blackhole bh) { bh.consume(s.probing.contains(s.nextHitKey())); }

	@Benchmark
	public void fastutilContainsHit(ReadState s, Blackhole bh) { bh.consume(s.fastutil.contains(s.nextHitKey())); }

	@Benchmark
	public void eclipseContainsHit(ReadState s, Blackhole bh) { bh.consume(s.eclipse.contains(s.nextHitKey())); }

	@Benchmark
	public void probingContainsMiss(ReadState s, Blackhole bh) { bh.consume(s.probing.contains(s.nextMissKey())); }

	@Benchmark
	public void fastutilContainsMiss(ReadState s, Blackhole bh) { bh.consume(s.fastutil.contains(s.nextMissKey())); }

	@Benchmark
	public void eclipseContainsMiss(ReadState s, Blackhole bh) { bh.consume(s.eclipse.contains(s.nextMissKey())); }

	@Benchmark
	public void probingChurn(ChurnState s, Blackhole bh) {
		long[] p = s.nextPair();
		bh.consume(s.probing.remove(p[0]));
		bh.consume(s.probing.add(p[1]));
	}

	@Benchmark
	public void fastutilChurn(ChurnState s, Blackhole bh) {
		long[] p = s.nextPair();
		bh.consume(s.fastutil.remove(p[0]));
		bh.consume(s.fastutil.add(p[1]));
	}

	@Benchmark
	public void eclipseChurn(ChurnState s, Blackhole bh) {
		long[] p = s.nextPair();
		bh.consume(s.eclipse.remove(p[0]));
		bh.consume(s.eclipse.add(p[1]));
	}
}
