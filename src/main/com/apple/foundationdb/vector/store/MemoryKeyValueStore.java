/*
 * MemoryKeyValueStore.java
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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.function.Function;

import com.apple.foundationdb.KeyValue;
import com.apple.foundationdb.Range;
import com.apple.foundationdb.tuple.ByteArrayUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An ordered key-value store held in memory, with transactions that behave like
 *  FoundationDB's: each transaction reads from a snapshot taken when it was created (plus
 *  its own writes), buffers its writes, and at commit fails with a
 *  {@link TransactionConflictException} if anything it read has since been overwritten by
 *  another committed transaction. Writes without reads never conflict.<br>
 * <br>
 * The store is safe to use from several threads; each {@link MemoryTransaction} should be
 *  used by one thread at a time. Stored arrays are never handed out: reads return copies. Snapshots are full copies, so this store suits tests and
 *  small embedded data sets rather than large ones.
 */
public class MemoryKeyValueStore {
	private static final Logger LOGGER = LoggerFactory.getLogger(MemoryKeyValueStore.class);

	public static final int DEFAULT_RETRY_LIMIT = 100;

	private static final byte[] EMPTY_BYTES = new byte[0];

	private final int retryLimit;
	private final TreeMap<byte[], byte[]> data = new TreeMap<>(ByteArrayUtil::compareUnsigned);
	// Write sets of committed transactions that an open transaction may still conflict with.
	private final Deque<CommittedWrites> history = new ArrayDeque<>();
	// Read version -> number of open transactions reading at it.
	private final TreeMap<Long, Integer> openReadVersions = new TreeMap<>();
	private long version = 0L;

	public MemoryKeyValueStore() {
		this(DEFAULT_RETRY_LIMIT);
	}

	/**
	 * @param retryLimit how many times {@link #run(Function)} retries after a conflict
	 *  before giving up
	 */
	public MemoryKeyValueStore(int retryLimit) {
		if(retryLimit < 0) {
			throw new IllegalArgumentException("Retry limit must be non-negative, got " + retryLimit);
		}
		this.retryLimit = retryLimit;
	}

	/**
	 * Starts a new transaction reading at the current version. The caller must commit or
	 *  close it.
	 *
	 * @return a new open transaction
	 */
	public synchronized MemoryTransaction createTransaction() {
		openReadVersions.merge(version, 1, Integer::sum);
		return new MemoryTransaction(version, new TreeMap<>(data));
	}

	/**
	 * Runs {@code retryable} in a new transaction and commits it. On a conflict the work is
	 *  run again in a fresh transaction, up to the retry limit. Other exceptions abort the
	 *  transaction and propagate.
	 *
	 * @param retryable the work to do; may be called more than once
	 * @param <T> the return type of {@code retryable}
	 *
	 * @return the result of the attempt that committed
	 *
	 * @throws TransactionConflictException if every attempt conflicted
	 */
	public <T> T run(Function<? super KeyValueTransaction, T> retryable) {
		for(int attempt = 0; ; attempt++) {
			try(MemoryTransaction tr = createTransaction()) {
				T result = retryable.apply(tr);
				tr.commit();
				return result;
			} catch(TransactionConflictException e) {
				if(attempt >= retryLimit) {
					LOGGER.warn("Giving up on transaction after {} retries", attempt);
					throw e;
				}
				LOGGER.debug("Retrying transaction after conflict (attempt {})", attempt + 1);
			}
		}
	}

	public synchronized long getVersion() {
		return version;
	}

	private synchronized void commit(MemoryTransaction tr) {
		try {
			// As in FoundationDB, a transaction that wrote nothing commits without a conflict check.
			if(tr.mutations.isEmpty()) {
				return;
			}
			for(CommittedWrites committed : history) {
				if(committed.version > tr.readVersion && intersects(committed.ranges, tr.readConflicts)) {
					LOGGER.debug("Transaction reading at version {} conflicts with commit at version {}",
							tr.readVersion, committed.version);
					throw new TransactionConflictException("Transaction not committed due to conflict with another transaction");
				}
			}
			for(Mutation m : tr.mutations) {
				m.apply(data);
			}
			version++;
			history.addLast(new CommittedWrites(version, tr.writeConflicts));
		} finally {
			release(tr.readVersion);
		}
	}

	private synchronized void release(long readVersion) {
		openReadVersions.computeIfPresent(readVersion, (v, count) -> count == 1 ? null : count - 1);
		// Commits at or below the oldest open read version can no longer cause a conflict.
		long oldest = openReadVersions.isEmpty() ? version : openReadVersions.firstKey();
		while(!history.isEmpty() && history.peekFirst().version <= oldest) {
			history.removeFirst();
		}
	}

	private static boolean intersects(List<Range> a, List<Range> b) {
		for(Range x : a) {
			for(Range y : b) {
				if(ByteArrayUtil.compareUnsigned(x.begin, y.end) < 0 && ByteArrayUtil.compareUnsigned(y.begin, x.end) < 0) {
					return true;
				}
			}
		}
		return false;
	}

	private static byte[] keyAfter(byte[] key) {
		return Arrays.copyOf(key, key.length + 1);
	}

	private static final class CommittedWrites {
		final long version;
		final List<Range> ranges;

		CommittedWrites(long version, List<Range> ranges) {
			this.version = version;
			this.ranges = ranges;
		}
	}

	private interface Mutation {
		void apply(NavigableMap<byte[], byte[]> target);
	}

	/**
	 * A transaction against a {@link MemoryKeyValueStore}. Once committed or closed, any
	 *  further use throws {@link IllegalStateException}.
	 */
	public final class MemoryTransaction implements KeyValueTransaction, AutoCloseable {
		private final long readVersion;
		// The snapshot the transaction started from, with its own writes applied.
		private final TreeMap<byte[], byte[]> view;
		private final List<Range> readConflicts = new ArrayList<>();
		private final List<Range> writeConflicts = new ArrayList<>();
		private final List<Mutation> mutations = new ArrayList<>();
		private boolean done = false;

		private MemoryTransaction(long readVersion, TreeMap<byte[], byte[]> view) {
			this.readVersion = readVersion;
			this.view = view;
		}

		public long getReadVersion() {
			return readVersion;
		}

		@Override
		public byte[] getKeyAtOrBefore(byte[] key) {
			checkOpen();
			byte[] found = view.floorKey(key);
			readConflicts.add(new Range(found == null ? EMPTY_BYTES : found, keyAfter(key)));
			return found == null ? null : found.clone();
		}

		@Override
		public byte[] get(byte[] key) {
			checkOpen();
			readConflicts.add(new Range(key.clone(), keyAfter(key)));
			byte[] value = view.get(key);
			return value == null ? null : value.clone();
		}

		@Override
		public void set(byte[] key, byte[] value) {
			checkOpen();
			byte[] k = key.clone();
			byte[] v = value.clone();
			view.put(k, v);
			writeConflicts.add(new Range(k, keyAfter(k)));
			mutations.add(target -> target.put(k, v));
		}

		@Override
		public void clear(byte[] key) {
			checkOpen();
			byte[] k = key.clone();
			view.remove(k);
			writeConflicts.add(new Range(k, keyAfter(k)));
			mutations.add(target -> target.remove(k));
		}

		@Override
		public Iterator<KeyValue> getRange(byte[] begin, byte[] end, int limit, boolean reverse) {
			checkOpen();
			if(limit < 0) {
				throw new IllegalArgumentException("Limit must be non-negative, got " + limit);
			}
			if(ByteArrayUtil.compareUnsigned(begin, end) >= 0) {
				return Collections.emptyIterator();
			}
			NavigableMap<byte[], byte[]> sub = view.subMap(begin, true, end, false);
			if(reverse) {
				sub = sub.descendingMap();
			}
			List<KeyValue> results = new ArrayList<>();
			byte[] last = null;
			for(Map.Entry<byte[], byte[]> entry : sub.entrySet()) {
				if(limit != ROW_LIMIT_UNLIMITED && results.size() == limit) {
					break;
				}
				last = entry.getKey();
				results.add(new KeyValue(last.clone(), entry.getValue().clone()));
			}
			// A limited read only depends on the part of the range it actually covered.
			if(limit != ROW_LIMIT_UNLIMITED && results.size() == limit) {
				readConflicts.add(reverse ? new Range(last, end.clone()) : new Range(begin.clone(), keyAfter(last)));
			}
			else {
				readConflicts.add(new Range(begin.clone(), end.clone()));
			}
			return results.iterator();
		}

		@Override
		public void clearRange(byte[] begin, byte[] end) {
			checkOpen();
			if(ByteArrayUtil.compareUnsigned(begin, end) >= 0) {
				return;
			}
			byte[] b = begin.clone();
			byte[] e = end.clone();
			view.subMap(b, true, e, false).clear();
			writeConflicts.add(new Range(b, e));
			mutations.add(target -> target.subMap(b, true, e, false).clear());
		}

		/**
		 * Applies this transaction's writes to the store.
		 *
		 * @throws TransactionConflictException if another transaction committed a write to
		 *  something this one read after it started; none of this transaction's writes are applied
		 */
		public void commit() {
			checkOpen();
			done = true;
			MemoryKeyValueStore.this.commit(this);
		}

		/**
		 * Discards the transaction if it has not been committed. Safe to call more than once.
		 */
		@Override
		public void close() {
			if(!done) {
				done = true;
				release(readVersion);
			}
		}

		private void checkOpen() {
			if(done) {
				throw new IllegalStateException("Transaction has already been committed or closed");
			}
		}
	}
}
