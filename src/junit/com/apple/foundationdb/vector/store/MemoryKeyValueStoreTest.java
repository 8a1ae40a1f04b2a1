/*
 * MemoryKeyValueStoreTest.java
 *
 * This source file is part of the FoundationDB open source project
 *
 * Copyright 2013-2026 Apple Inc. and the FoundationDB project authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.apple.foundationdb.vector.store;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import com.apple.foundationdb.KeyValue;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class MemoryKeyValueStoreTest {

	private static byte[] b(String s) {
		return s.getBytes(StandardCharsets.US_ASCII);
	}

	private static List<String> keys(Iterator<KeyValue> it) {
		List<String> out = new ArrayList<>();
		it.forEachRemaining(kv -> out.add(new String(kv.getKey(), StandardCharsets.US_ASCII)));
		return out;
	}

	private static MemoryKeyValueStore storeWith(String... keys) {
		MemoryKeyValueStore store = new MemoryKeyValueStore();
		store.run(tr -> {
			for(String k : keys) {
				tr.set(b(k), b("v" + k));
			}
			return null;
		});
		return store;
	}

	@Test
	void testRangeReads() {
		MemoryKeyValueStore store = storeWith("a", "b", "c", "d");
		try(MemoryKeyValueStore.MemoryTransaction tr = store.createTransaction()) {
			Assertions.assertEquals(List.of("b", "c"), keys(tr.getRange(b("b"), b("d"), 0, false)));
			Assertions.assertEquals(List.of("c", "b"), keys(tr.getRange(b("b"), b("d"), 0, true)));
			Assertions.assertEquals(List.of("d", "c"), keys(tr.getRange(b("a"), b("z"), 2, true)));
			Assertions.assertEquals(List.of("a"), keys(tr.getRange(b("a"), b("z"), 1, false)));
			Assertions.assertTrue(keys(tr.getRange(b("d"), b("a"), 0, false)).isEmpty());
		}
	}

	@Test
	void testGetKeyAtOrBefore() {
		MemoryKeyValueStore store = storeWith("b", "d");
		try(MemoryKeyValueStore.MemoryTransaction tr = store.createTransaction()) {
			Assertions.assertArrayEquals(b("b"), tr.getKeyAtOrBefore(b("c")));
			Assertions.assertArrayEquals(b("d"), tr.getKeyAtOrBefore(b("d")));
			Assertions.assertNull(tr.getKeyAtOrBefore(b("a")));
		}
	}

	@Test
	void testReadYourWrites() {
		MemoryKeyValueStore store = storeWith("a", "b", "c");
		try(MemoryKeyValueStore.MemoryTransaction tr = store.createTransaction()) {
			tr.set(b("bb"), b("x"));
			tr.clear(b("a"));
			Assertions.assertArrayEquals(b("x"), tr.get(b("bb")));
			Assertions.assertNull(tr.get(b("a")));
			tr.clearRange(b("b"), b("c"));
			Assertions.assertEquals(List.of("c"), keys(tr.getRange(b("a"), b("z"), 0, false)));
		}
	}

	@Test
	void testReturnedArraysAreCopies() {
		MemoryKeyValueStore store = storeWith("a", "b");
		try(MemoryKeyValueStore.MemoryTransaction reader = store.createTransaction()) {
			reader.get(b("a"))[0] = 0x7f;
			reader.getKeyAtOrBefore(b("b"))[0] = 0x7f;
			reader.getRange(b("a"), b("z"), 0, false).forEachRemaining(kv -> {
				kv.getKey()[0] = 0x7f;
				kv.getValue()[0] = 0x7f;
			});
			Assertions.assertArrayEquals(b("va"), reader.get(b("a")));
		}
		try(MemoryKeyValueStore.MemoryTransaction tr = store.createTransaction()) {
			Assertions.assertArrayEquals(b("va"), tr.get(b("a")));
			Assertions.assertArrayEquals(b("vb"), tr.get(b("b")));
			Assertions.assertEquals(List.of("a", "b"), keys(tr.getRange(b("a"), b("z"), 0, false)));
		}
	}

	@Test
	void testWrittenArraysAreCopied() {
		MemoryKeyValueStore store = new MemoryKeyValueStore();
		byte[] value = b("v");
		store.run(tr -> {
			tr.set(b("k"), value);
			return null;
		});
		value[0] = 0x7f;
		Assertions.assertArrayEquals(b("v"), store.run(tr -> tr.get(b("k"))));
	}

	@Test
	void testSnapshotIsolation() {
		MemoryKeyValueStore store = storeWith("a");
		try(MemoryKeyValueStore.MemoryTransaction reader = store.createTransaction()) {
			store.run(tr -> {
				tr.set(b("b"), b("new"));
				tr.clear(b("a"));
				return null;
			});
			Assertions.assertArrayEquals(b("va"), reader.get(b("a")));
			Assertions.assertNull(reader.get(b("b")));
		}
		try(MemoryKeyValueStore.MemoryTransaction tr = store.createTransaction()) {
			Assertions.assertEquals(List.of("b"), keys(tr.getRange(b("a"), b("z"), 0, false)));
		}
	}

	@Test
	void testUncommittedWritesAreDiscarded() {
		MemoryKeyValueStore store = storeWith("a");
		long version = store.getVersion();
		try(MemoryKeyValueStore.MemoryTransaction tr = store.createTransaction()) {
			tr.set(b("b"), b("lost"));
		}
		Assertions.assertEquals(version, store.getVersion());
		Assertions.assertNull(store.run(tr -> tr.get(b("b"))));
	}

	@Test
	void testReadWriteConflict() {
		MemoryKeyValueStore store = storeWith("a");
		try(MemoryKeyValueStore.MemoryTransaction tr1 = store.createTransaction();
				MemoryKeyValueStore.MemoryTransaction tr2 = store.createTransaction()) {
			tr1.get(b("a"));
			tr1.set(b("out1"), b("1"));
			tr2.set(b("a"), b("changed"));
			tr2.commit();
			Assertions.assertThrows(TransactionConflictException.class, tr1::commit);
		}
		Assertions.assertNull(store.run(tr -> tr.get(b("out1"))));
	}

	@Test
	void testBlindWritesDoNotConflict() {
		MemoryKeyValueStore store = storeWith("a");
		try(MemoryKeyValueStore.MemoryTransaction tr1 = store.createTransaction();
				MemoryKeyValueStore.MemoryTransaction tr2 = store.createTransaction()) {
			tr1.set(b("a"), b("1"));
			tr2.set(b("a"), b("2"));
			tr2.commit();
			tr1.commit();
		}
		Assertions.assertArrayEquals(b("1"), store.run(tr -> tr.get(b("a"))));
	}

	@Test
	void testLimitedRangeReadOnlyConflictsWithCoveredKeys() {
		MemoryKeyValueStore store = storeWith("b", "m");
		try(MemoryKeyValueStore.MemoryTransaction tr1 = store.createTransaction();
				MemoryKeyValueStore.MemoryTransaction tr2 = store.createTransaction()) {
			Assertions.assertEquals(List.of("b"), keys(tr1.getRange(b("a"), b("z"), 1, false)));
			tr1.set(b("out"), b("1"));
			tr2.set(b("x"), b("2"));
			tr2.commit();
			tr1.commit();
		}
		try(MemoryKeyValueStore.MemoryTransaction tr1 = store.createTransaction();
				MemoryKeyValueStore.MemoryTransaction tr2 = store.createTransaction()) {
			Assertions.assertEquals(List.of("x"), keys(tr1.getRange(b("a"), b("z"), 1, true)));
			tr1.set(b("out"), b("1"));
			tr2.set(b("c"), b("2"));
			tr2.commit();
			tr1.commit();
		}
	}

	@Test
	void testKeyAtOrBeforeConflictsWithNewerLastKey() {
		MemoryKeyValueStore store = storeWith("b");
		try(MemoryKeyValueStore.MemoryTransaction tr1 = store.createTransaction();
				MemoryKeyValueStore.MemoryTransaction tr2 = store.createTransaction()) {
			tr1.getKeyAtOrBefore(b("z"));
			tr1.set(b("out"), b("1"));
			tr2.set(b("c"), b("2"));
			tr2.commit();
			Assertions.assertThrows(TransactionConflictException.class, tr1::commit);
		}
	}

	@Test
	void testReadOnlyTransactionsNeverConflict() {
		MemoryKeyValueStore store = storeWith("a");
		try(MemoryKeyValueStore.MemoryTransaction reader = store.createTransaction()) {
			reader.get(b("a"));
			store.run(tr -> {
				tr.set(b("a"), b("changed"));
				return null;
			});
			reader.commit();
		}
	}

	@Test
	void testRunRetriesAfterConflict() {
		MemoryKeyValueStore store = storeWith("counter");
		AtomicInteger attempts = new AtomicInteger();
		String result = store.run(tr -> {
			tr.get(b("counter"));
			if(attempts.incrementAndGet() == 1) {
				store.run(other -> {
					other.set(b("counter"), b("bumped"));
					return null;
				});
			}
			tr.set(b("result"), b("done"));
			return "ok";
		});
		Assertions.assertEquals("ok", result);
		Assertions.assertEquals(2, attempts.get());
	}

	@Test
	void testRunGivesUpAfterRetryLimit() {
		MemoryKeyValueStore store = new MemoryKeyValueStore(2);
		AtomicInteger attempts = new AtomicInteger();
		Assertions.assertThrows(TransactionConflictException.class, () -> store.run(tr -> {
			attempts.incrementAndGet();
			tr.get(b("k"));
			store.run(other -> {
				other.set(b("k"), b("x"));
				return null;
			});
			tr.set(b("k2"), b("y"));
			return null;
		}));
		Assertions.assertEquals(3, attempts.get());
	}

	@Test
	void testRunPropagatesOtherErrors() {
		MemoryKeyValueStore store = new MemoryKeyValueStore();
		Assertions.assertThrows(IllegalStateException.class, () -> store.run(tr -> {
			tr.set(b("k"), b("v"));
			throw new IllegalStateException("boom");
		}));
		Assertions.assertNull(store.run(tr -> tr.get(b("k"))));
	}

	@Test
	void testFinishedTransactionRejectsUse() {
		MemoryKeyValueStore store = new MemoryKeyValueStore();
		MemoryKeyValueStore.MemoryTransaction tr = store.createTransaction();
		tr.set(b("k"), b("v"));
		tr.commit();
		Assertions.assertThrows(IllegalStateException.class, () -> tr.get(b("k")));
		Assertions.assertThrows(IllegalStateException.class, tr::commit);
		tr.close();
	}

	@Test
	void testNegativeRetryLimitRejected() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> new MemoryKeyValueStore(-1));
	}
}
