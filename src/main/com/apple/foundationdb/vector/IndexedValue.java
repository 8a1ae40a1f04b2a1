/*
 * IndexedValue.java
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

import java.util.Objects;

/**
 * An element of a {@link SparseVector} together with its index, as returned by
 *  {@link SparseVector#getRange(long, long, int, com.apple.foundationdb.vector.store.KeyValueTransaction) getRange()}.
 */
public final class IndexedValue {
	private final long index;
	private final Value value;

	public IndexedValue(long index, Value value) {
		this.index = index;
		this.value = value;
	}

	public long getIndex() {
		return index;
	}

	public Value getValue() {
		return value;
	}

	@Override
	public boolean equals(Object o) {
		if(o == this)
			return true;
		if(!(o instanceof IndexedValue))
			return false;
		IndexedValue other = (IndexedValue)o;
		return index == other.index && value.equals(other.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(index, value);
	}

	@Override
	public String toString() {
		return "(" + index + ", " + value + ")";
	}
}
