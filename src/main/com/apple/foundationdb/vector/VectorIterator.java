/*
 * VectorIterator.java
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

package com.apple.foundationdb.vector;

import java.util.Iterator;
import java.util.NoSuchElementException;

import com.apple.foundationdb.KeyValue;

/**
 * Iterates over the elements a {@link SparseVector} physically stores within a range of
 *  indexes. Keys and values are decoded as the iterator advances. Indexes with no stored
 *  entry are skipped rather than reported with the default value.<br>
 * <br>
 * The iterator reads through the transaction that created it and must not be used after
 *  that transaction ends.
 */
public final class VectorIterator implements Iterator<IndexedValue> {
	private final Iterator<KeyValue> cursor;
	private final IndexKeyCodec keyCodec;

	VectorIterator(Iterator<KeyValue> cursor, IndexKeyCodec keyCodec) {
		this.cursor = cursor;
		this.keyCodec = keyCodec;
	}

	@Override
	public boolean hasNext() {
		return cursor.hasNext();
	}

	/**
	 * @throws KeyDecodeException if a key in the range does not hold an index
	 * @throws ValueDecodeException if a stored value is malformed
	 */
	@Override
	public IndexedValue next() {
		if(!cursor.hasNext()) {
			throw new NoSuchElementException();
		}
		KeyValue kv = cursor.next();
		return new IndexedValue(keyCodec.decode(kv.getKey()), ValueCodec.decode(kv.getValue()));
	}
}
