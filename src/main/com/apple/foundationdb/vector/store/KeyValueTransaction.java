/*
 * KeyValueTransaction.java
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

import com.apple.foundationdb.KeyValue;

/**
 * The operations a {@link com.apple.foundationdb.vector.SparseVector SparseVector} needs
 *  from an ordered, transactional key-value store. An instance represents one open
 *  transaction: reads observe a consistent snapshot that includes the transaction's own
 *  writes, and either every write commits or none does. Committing, retrying and
 *  cancelling are left to whoever created the transaction.<br>
 * <br>
 * Keys compare as unsigned byte strings. All calls block until the store answers.
 */
public interface KeyValueTransaction {
	/**
	 * When passed as a {@code limit} to {@link #getRange(byte[], byte[], int, boolean)},
	 *  no limit is applied to the number of returned pairs.
	 */
	int ROW_LIMIT_UNLIMITED = 0;

	/**
	 * Finds the greatest key that is less than or equal to {@code key}.
	 *
	 * @param key the upper bound, inclusive
	 *
	 * @return the key found, or {@code null} or an empty array if no key sorts at or before {@code key}
	 */
	byte[] getKeyAtOrBefore(byte[] key);

	/**
	 * Reads a single key.
	 *
	 * @param key the key to read
	 *
	 * @return the value, or {@code null} if the key is not present
	 */
	byte[] get(byte[] key);

	void set(byte[] key, byte[] value);

	void clear(byte[] key);

	/**
	 * Reads the key-value pairs with keys in {@code [begin, end)}. The returned
	 *  iterator may fetch lazily and is only valid while this transaction is.
	 *
	 * @param begin the first key of the range, inclusive
	 * @param end the end of the range, exclusive
	 * @param limit the maximum number of pairs to return, or {@link #ROW_LIMIT_UNLIMITED}
	 * @param reverse if {@code true}, pairs are returned from {@code end} backwards
	 *
	 * @return the pairs in key order, or in reverse key order if {@code reverse} is set
	 */
	Iterator<KeyValue> getRange(byte[] begin, byte[] end, int limit, boolean reverse);

	/**
	 * Removes every key in {@code [begin, end)}.
	 */
	void clearRange(byte[] begin, byte[] end);
}
