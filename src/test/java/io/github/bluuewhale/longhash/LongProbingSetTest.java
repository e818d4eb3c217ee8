package io.github.bluuewhale.longhash;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class LongProbingSetTest {

	@Test
	void basicAddRemove() {
		var s = new LongProbingSet();

		assertTrue(s.add(1));
		assertFalse(s.add(1));
		assertTrue(s.contains(1));
		assertEquals(1, s.size());

		assertTrue(s.remove(1));
		assertFalse(s.contains(1));
		assertEquals(0, s.size());
		assertFalse(s.remove(1));
	}

	@Test
	void insertRemoveReinsertScenario() {
		var s = new LongProbingSet(10, 0.75);
		for (int i = 0; i < 20; i++) assertTrue(s.add(i));
		assertEquals(20, s.size());
		assertTrue(s.capacity() > 10);
		assertTrue(s.contains(5));
		assertFalse(s.add(5));
		assertEquals(20, s.size());

		for (int i = 0; i < 20; i += 2) assertTrue(s.remove(i));
		assertEquals(10, s.size());
		assertFalse(s.contains(4));
		assertTrue(s.contains(5));
		for (int i = 0; i < 20; i++) assertEquals(i % 2 == 1, s.contains(i));

		assertTrue(s.add(4));
		assertEquals(11, s.size());
		assertTrue(s.contains(4));

		for (int i = 0; i < 20; i += 2) s.add(i);
		assertEquals(20, s.size());
		for (int i = 0; i < 20; i++) assertTrue(s.contains(i));
	}

	@Test
	void tombstoneReuse() {
		var s = new LongProbingSet();
		assertTrue(s.add(42));
		assertTrue(s.remove(42));
		assertEquals(1, s.tombstones());

		assertTrue(s.add(42));
		assertEquals(1, s.size());
		assertTrue(s.contains(42));
		assertEquals(0, s.tombstones());
	}

	@Test
	void duplicateBehindTombstoneIsDetected() {
		// everything homes to slot 0: 1 -> slot 0, 2 -> slot 1
		var s = new LongProbingSet(16, 0.75, (k, cap) -> 0);
		s.add(1);
		s.add(2);
		assertTrue(s.remove(1));
		assertEquals(SlotState.DELETED, s.stateAt(0));

		assertFalse(s.add(2));
		assertEquals(1, s.size());

		assertTrue(s.add(3));
		assertEquals(SlotState.OCCUPIED, s.stateAt(0));
		assertEquals(0, s.tombstones());
		assertTrue(s.contains(2));
		assertTrue(s.contains(3));
		assertFalse(s.contains(1));
	}

	@Test
	void lookupSkipsTombstones() {
		var s = new LongProbingSet(16, 0.75, (k, cap) -> 3);
		for (long k = 10; k < 15; k++) s.add(k);
		s.remove(10);
		s.remove(12);

		assertTrue(s.contains(11));
		assertTrue(s.contains(13));
		assertTrue(s.contains(14));
		assertFalse(s.contains(10));
		assertFalse(s.contains(12));
		assertTrue(s.remove(14));
		assertEquals(2, s.size());
	}

	@Test
	void resizePreservesMembership() {
		var s = new LongProbingSet(4);
		int n = 20_000;
		for (long i = 0; i < n; i++) assertTrue(s.add(i * 7919));
		for (long i = 0; i < n; i++) assertTrue(s.contains(i * 7919));
		assertFalse(s.contains(1));
		assertEquals(n, s.size());
		assertTrue(s.capacity() * s.loadFactor() >= n);
	}

	@Test
	void negativeAndExtremeKeys() {
		var s = new LongProbingSet(2);
		long[] keys = { -1, 0, 1, Long.MIN_VALUE, Long.MAX_VALUE, -123_456_789_012L };
		for (long k : keys) assertTrue(s.add(k));
		for (long k : keys) assertTrue(s.contains(k));
		for (long k : keys) assertFalse(s.add(k));
		assertEquals(keys.length, s.size());
	}

	@Test
	void wrapsAroundTableEnd() {
		var s = new LongProbingSet(8, 0.75, (k, cap) -> cap - 1);
		s.add(1);
		s.add(2);
		s.add(3);
		assertEquals(SlotState.OCCUPIED, s.stateAt(7));
		assertEquals(SlotState.OCCUPIED, s.stateAt(0));
		assertEquals(SlotState.OCCUPIED, s.stateAt(1));
		assertTrue(s.remove(2));
		assertTrue(s.contains(3));
	}

	@Test
	void clearResetsSlots() {
		var s = new LongProbingSet(8);
		for (long k = 0; k < 5; k++) s.add(k);
		s.remove(0);
		int cap = s.capacity();

		s.clear();
		assertEquals(0, s.size());
		assertEquals(0, s.tombstones());
		assertEquals(cap, s.capacity());
		for (int i = 0; i < cap; i++) assertEquals(SlotState.EMPTY, s.stateAt(i));
		assertTrue(s.add(3));
	}

	@Test
	void invalidConfiguration() {
		assertThrows(InvalidConfigurationException.class, () -> new LongProbingSet(10, 0.0));
		assertThrows(InvalidConfigurationException.class, () -> new LongProbingSet(10, 1.0));
		assertThrows(InvalidConfigurationException.class, () -> new LongProbingSet(10, -0.5));
		assertThrows(InvalidConfigurationException.class, () -> new LongProbingSet(10, Double.NaN));
		assertThrows(InvalidConfigurationException.class, () -> new LongProbingSet(0, 0.5));
	}
}
