/*
 * FDBKeyValueTransaction.java
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

import java.util.Iterator;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Function;

import com.apple.foundationdb.Database;
import com.apple.foundationdb.KeySelector;
import com.apple.foundationdb.KeyValue;
import com.apple.foundationdb.Transaction;

/**
 * A {@link KeyValueTransaction} backed by a FoundationDB {@link Transaction}. Each call
 *  waits on the future the FoundationDB client returns. A failed future surfaces as the
 *  {@link com.apple.foundationdb.FDBException FDBException} (or other exception) it failed
 *  with, not wrapped in a {@link CompletionException}, so that {@link Database#run(Function)}
 *  recognizes retryable errors.
 */
public class FDBKeyValueTransaction implements KeyValueTransaction {
	private final Transaction tr;

	public FDBKeyValueTransaction(Transaction tr) {
		this.tr = tr;
	}

	/**
	 * Runs {@code retryable} in a transaction against {@code db}, committing at the end and
	 *  retrying on conflicts and other retryable errors as {@link Database#run(Function)} does.
	 *
	 * @param db the database to run against
	 * @param retryable the work to do; may be called more than once
	 * @param <T> the return type of {@code retryable}
	 *
	 * @return the result of the successful attempt
	 */
	public static <T> T run(Database db, Function<? super KeyValueTransaction, T> retryable) {
		return db.run(tr -> retryable.apply(new FDBKeyValueTransaction(tr)));
	}

	public Transaction getTransaction() {
		return tr;
	}

	@Override
	public byte[] getKeyAtOrBefore(byte[] key) {
		return join(tr.getKey(KeySelector.lastLessOrEqual(key)));
	}

	@Override
	public byte[] get(byte[] key) {
		return join(tr.get(key));
	}

	@Override
	public void set(byte[] key, byte[] value) {
		tr.set(key, value);
	}

	@Override
	public void clear(byte[] key) {
		tr.clear(key);
	}

	@Override
	public Iterator<KeyValue> getRange(byte[] begin, byte[] end, int limit, boolean reverse) {
		return new UnwrappingIterator(tr.getRange(begin, end, limit, reverse).iterator());
	}

	@Override
	public void clearRange(byte[] begin, byte[] end) {
		tr.clear(begin, end);
	}

	static <T> T join(CompletableFuture<T> future) {
		try {
			return future.join();
		} catch(CompletionException e) {
			throw unwrap(e);
		}
	}

	private static RuntimeException unwrap(CompletionException e) {
		Throwable cause = e.getCause();
		if(cause instanceof RuntimeException) {
			return (RuntimeException)cause;
		}
		if(cause instanceof Error) {
			throw (Error)cause;
		}
		return e;
	}

	/**
	 * The range iterator of the FoundationDB client blocks in {@code hasNext()} and reports
	 *  failures there as {@link CompletionException}s.
	 */
	static final class UnwrappingIterator implements Iterator<KeyValue> {
		private final Iterator<KeyValue> delegate;

		UnwrappingIterator(Iterator<KeyValue> delegate) {
			this.delegate = delegate;
		}

		@Override
		public boolean hasNext() {
			try {
				return delegate.hasNext();
			} catch(CompletionException e) {
				throw unwrap(e);
			}
		}

		@Override
		public KeyValue next() {
			try {
				return delegate.next();
			} catch(CompletionException e) {
				throw unwrap(e);
			}
		}
	}
}
