/*
 * IndexKeyCodec.java
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

import java.math.BigInteger;

import com.apple.foundationdb.Range;
import com.apple.foundationdb.subspace.Subspace;
import com.apple.foundationdb.tuple.ByteArrayUtil;
import com.apple.foundationdb.tuple.Tuple;

/**
 * Maps vector indexes to keys within a {@link Subspace} and back. The key for index
 *  {@code i} is {@code subspace.pack(Tuple.from(i))}: the subspace prefix followed by
 *  the tuple layer encoding of {@code i} as a single integer element. The tuple integer
 *  encoding sorts in numeric order over the whole {@code long} range, negative values
 *  included.
 */
final class IndexKeyCodec {
	private final Subspace subspace;
	private final Range range;

	IndexKeyCodec(Subspace subspace) {
		this.subspace = subspace;
		this.range = subspace.range();
	}

	/**
	 * The range holding every key this codec can produce. Keys of the vector's
	 *  entries all sort within {@code [range.begin, range.end)}.
	 */
	Range range() {
		return range;
	}

	/**
	 * Encodes an index into a key.
	 *
	 * @param index any {@code long}
	 *
	 * @return the prefixed key
	 */
	byte[] encode(long index) {
		return subspace.pack(Tuple.from(index));
	}

	/**
	 * Decodes the index held in a key produced by {@link #encode(long)}.
	 *
	 * @param key a key from the vector's subspace
	 *
	 * @return the index
	 *
	 * @throws KeyDecodeException if the key is not in the subspace or its
	 *  suffix is not exactly one integer element
	 */
	long decode(byte[] key) {
		if(!subspace.contains(key)) {
			throw new KeyDecodeException("Key " + ByteArrayUtil.printable(key) + " is not in subspace "
					+ ByteArrayUtil.printable(subspace.getKey()));
		}
		Tuple t;
		try {
			t = subspace.unpack(key);
		} catch(RuntimeException e) {
			// Truncated or unknown elements fail inside the tuple layer.
			throw new KeyDecodeException("Key " + ByteArrayUtil.printable(key) + " has a malformed index suffix", e);
		}
		Object element = t.size() == 1 ? t.get(0) : null;
		if(element instanceof Long) {
			return (Long)element;
		}
		// Integers at the edges of the long range may unpack as BigInteger.
		if(element instanceof BigInteger && ((BigInteger)element).bitLength() < Long.SIZE) {
			return ((BigInteger)element).longValue();
		}
		throw new KeyDecodeException("Key " + ByteArrayUtil.printable(key) + " does not end in a single integer index");
	}
}
