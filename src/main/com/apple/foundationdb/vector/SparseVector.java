/*
 * SparseVector.java
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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

import com.apple.foundationdb.KeyValue;
import com.apple.foundationdb.Range;
import com.apple.foundationdb.subspace.Subspace;
import com.apple.foundationdb.tuple.ByteArrayUtil;
import com.apple.foundationdb.vector.store.KeyValueTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A vector of {@link Value}s stored under a {@link Subspace}, one key per element, keyed
 *  by the element's index. Elements equal to the default value need not be stored: an
 *  index below the vector's size that has no key reads as sparse. The size of the vector
 *  is the index of its last key plus one, so the last element is always stored, even
 *  when it holds the default value. No key at or beyond the size is ever left behind.<br>
 * <br>
 * A {@code SparseVector} holds no state of its own. Every operation runs inside the
 *  {@link KeyValueTransaction} it is given and its effects commit or roll back with that
 *  transaction. The subspace must be used by this vector alone.<br>
 * <br>
 * Operations reading the size ({@link #push(Value, KeyValueTransaction) push()} among
 *  them) conflict with each other when run concurrently in separate transactions; the
 *  store rejects all but one at commit and the others must be retried.
 */
public class SparseVector {
	private static final Logger LOGGER = LoggerFactory.getLogger(SparseVector.class);

	private final Subspace subspace;
	private final Value defaultValue;
	private final byte[] encodedDefault;
	private final IndexKeyCodec keyCodec;

	/**
	 * Creates a vector whose default value is the empty string.
	 *
	 * @param subspace the subspace holding the vector's keys
	 */
	public SparseVector(Subspace subspace) {
		this(subspace, Value.of(""));
	}

	/**
	 * @param subspace the subspace holding the vector's keys
	 * @param defaultValue the value of elements that are not stored
	 *
	 * @throws UnsupportedTypeException if {@code defaultValue} is the empty sentinel
	 */
	public SparseVector(Subspace subspace, Value defaultValue) {
		this.subspace = subspace;
		this.defaultValue = defaultValue;
		this.encodedDefault = ValueCodec.encode(defaultValue);
		this.keyCodec = new IndexKeyCodec(subspace);
	}

	public Subspace getSubspace() {
		return subspace;
	}

	public Value getDefaultValue() {
		return defaultValue;
	}

	/**
	 * Gets the number of elements in the vector, counting the sparse ones.
	 *
	 * @param tr the transaction to read in
	 *
	 * @return the size of the vector
	 */
	public long size(KeyValueTransaction tr) {
		Range range = keyCodec.range();
		byte[] lastKey = tr.getKeyAtOrBefore(range.end);
		if(lastKey == null || ByteArrayUtil.compareUnsigned(lastKey, range.begin) < 0) {
			return 0L;
		}
		return keyCodec.decode(lastKey) + 1;
	}

	public boolean empty(KeyValueTransaction tr) {
		return size(tr) == 0L;
	}

	/**
	 * Gets the element at {@code index}. A sparse element is returned as
	 *  {@link Value#empty()}; use {@link #getOrDefault(long, KeyValueTransaction)} to
	 *  get the default value instead.
	 *
	 * @param index the index of the element
	 * @param tr the transaction to read in
	 *
	 * @return the stored value, or the empty sentinel if the element is sparse
	 *
	 * @throws InvalidIndexException if {@code index} is negative
	 * @throws IndexOutOfRangeException if {@code index} is not less than the size
	 */
	public Value get(long index, KeyValueTransaction tr) {
		if(index < 0) {
			throw new InvalidIndexException("Index " + index + " is negative");
		}
		byte[] key = keyCodec.encode(index);
		Iterator<KeyValue> it = tr.getRange(key, keyCodec.range().end, 1, false);
		if(!it.hasNext()) {
			throw new IndexOutOfRangeException("Index " + index + " is out of range");
		}
		KeyValue next = it.next();
		if(Arrays.equals(key, next.getKey())) {
			return ValueCodec.decode(next.getValue());
		}
		// A key further on means the index is below the size but not stored.
		return Value.empty();
	}

	/**
	 * Gets the element at {@code index}, with sparse elements read as the default value.
	 *
	 * @throws InvalidIndexException if {@code index} is negative
	 * @throws IndexOutOfRangeException if {@code index} is not less than the size
	 */
	public Value getOrDefault(long index, KeyValueTransaction tr) {
		return get(index, tr).orElse(defaultValue);
	}

	/**
	 * Gets the first element. Same as {@code get(0, tr)}.
	 *
	 * @throws IndexOutOfRangeException if the vector is empty
	 */
	public Value front(KeyValueTransaction tr) {
		return get(0L, tr);
	}

	/**
	 * Gets the last element.
	 *
	 * @param tr the transaction to read in
	 *
	 * @return the last element, or {@link Value#empty()} if the vector is empty
	 */
	public Value back(KeyValueTransaction tr) {
		Range range = keyCodec.range();
		Iterator<KeyValue> it = tr.getRange(range.begin, range.end, 1, true);
		if(!it.hasNext()) {
			return Value.empty();
		}
		return ValueCodec.decode(it.next().getValue());
	}

	/**
	 * Sets the element at {@code index}. Setting beyond the end grows the vector, with
	 *  the elements in between sparse.
	 *
	 * @param index the index of the element
	 * @param value the new value
	 * @param tr the transaction to write in
	 *
	 * @throws UnsupportedTypeException if {@code value} is the empty sentinel
	 */
	public void set(long index, Value value, KeyValueTransaction tr) {
		byte[] encoded = ValueCodec.encode(value);
		tr.set(keyCodec.encode(index), encoded);
	}

	/**
	 * Appends an element to the end of the vector.
	 *
	 * @param value the value to append
	 * @param tr the transaction to write in
	 *
	 * @throws UnsupportedTypeException if {@code value} is the empty sentinel
	 */
	public void push(Value value, KeyValueTransaction tr) {
		byte[] encoded = ValueCodec.encode(value);
		tr.set(keyCodec.encode(size(tr)), encoded);
	}

	/**
	 * Removes the last element and returns it. If the element before it was sparse, it is
	 *  stored with the default value so that it becomes the stored last element.
	 *
	 * @param tr the transaction to read and write in
	 *
	 * @return the removed element, or {@link Value#empty()} if the vector was already empty
	 */
	public Value pop(KeyValueTransaction tr) {
		Range range = keyCodec.range();
		List<KeyValue> lastTwo = new ArrayList<>(2);
		tr.getRange(range.begin, range.end, 2, true).forEachRemaining(lastTwo::add);
		if(lastTwo.isEmpty()) {
			return Value.empty();
		}

		KeyValue last = lastTwo.get(0);
		long lastIndex = keyCodec.decode(last.getKey());
		Value popped = ValueCodec.decode(last.getValue());
		if(lastIndex > 0) {
			if(lastTwo.size() == 1 || keyCodec.decode(lastTwo.get(1).getKey()) < lastIndex - 1) {
				LOGGER.debug("Storing default at index {} of sparse vector {}", lastIndex - 1, this);
				tr.set(keyCodec.encode(lastIndex - 1), encodedDefault);
			}
		}
		tr.clear(last.getKey());
		return popped;
	}

	/**
	 * Exchanges two elements. Both indexes must be within the vector.
	 *
	 * @throws InvalidIndexException if either index is negative
	 * @throws IndexOutOfRangeException if either index is not less than the size
	 */
	public void swap(long i1, long i2, KeyValueTransaction tr) {
		if(i1 < 0 || i2 < 0) {
			throw new InvalidIndexException("Cannot swap indexes " + i1 + " and " + i2 + ": index is negative");
		}
		long size = size(tr);
		if(i1 >= size || i2 >= size) {
			throw new IndexOutOfRangeException("Cannot swap indexes " + i1 + " and " + i2 + " in vector of size " + size);
		}
		if(i1 == i2) {
			return;
		}
		byte[] k1 = keyCodec.encode(i1);
		byte[] k2 = keyCodec.encode(i2);
		byte[] v1 = tr.get(k1);
		byte[] v2 = tr.get(k2);
		store(k1, i1 == size - 1, v2, tr);
		store(k2, i2 == size - 1, v1, tr);
	}

	private void store(byte[] key, boolean isLast, byte[] value, KeyValueTransaction tr) {
		if(value != null) {
			tr.set(key, value);
		}
		else if(isLast) {
			tr.set(key, encodedDefault);
		}
		else {
			tr.clear(key);
		}
	}

	/**
	 * Grows or shrinks the vector to {@code length} elements. Added elements are sparse;
	 *  removed elements are deleted.
	 *
	 * @param length the new size
	 * @param tr the transaction to read and write in
	 *
	 * @throws InvalidIndexException if {@code length} is negative
	 */
	public void resize(long length, KeyValueTransaction tr) {
		if(length < 0) {
			throw new InvalidIndexException("Length " + length + " is negative");
		}
		long currentSize = size(tr);
		if(length == currentSize) {
			return;
		}
		LOGGER.debug("Resizing sparse vector {} from {} to {}", this, currentSize, length);
		byte[] lastKey = length > 0 ? keyCodec.encode(length - 1) : null;
		if(length > currentSize) {
			tr.set(lastKey, encodedDefault);
			return;
		}
		tr.clearRange(keyCodec.encode(length), keyCodec.range().end);
		if(lastKey != null && tr.get(lastKey) == null) {
			tr.set(lastKey, encodedDefault);
		}
	}

	/**
	 * Removes every element.
	 */
	public void clear(KeyValueTransaction tr) {
		LOGGER.debug("Clearing sparse vector {}", this);
		Range range = keyCodec.range();
		tr.clearRange(range.begin, range.end);
	}

	/**
	 * Iterates over every stored element in ascending index order.
	 *
	 * @see #getRange(long, long, int, KeyValueTransaction)
	 */
	public VectorIterator getRange(KeyValueTransaction tr) {
		Range range = keyCodec.range();
		return new VectorIterator(tr.getRange(range.begin, range.end, KeyValueTransaction.ROW_LIMIT_UNLIMITED, false), keyCodec);
	}

	/**
	 * Iterates over the stored elements in a range of indexes, the way a slice
	 *  {@code [start:stop:step]} would select them. Only the sign of {@code step} is
	 *  used. Sparse elements are skipped, not returned as the default value.
	 * <ul>
	 *   <li>A negative {@code start} or {@code stop} counts back from the size, stopping at 0.</li>
	 *   <li>A {@code stop} of 0 means the size.</li>
	 *   <li>The direction is ascending if {@code start <= stop} and descending otherwise,
	 *    unless {@code step} is non-zero, in which case its sign decides.</li>
	 *   <li>Ascending iteration covers {@code [min, max)}; descending iteration covers
	 *    {@code (min, max]}, starting from {@code max}.</li>
	 * </ul>
	 *
	 * @param start the first index
	 * @param stop the index to stop before
	 * @param step the direction, or 0 to derive it from {@code start} and {@code stop}
	 * @param tr the transaction to read in; the iterator must not outlive it
	 *
	 * @return a lazy iterator over the stored elements in range
	 */
	public VectorIterator getRange(long start, long stop, int step, KeyValueTransaction tr) {
		if(start < 0 || stop <= 0) {
			long size = size(tr);
			if(start < 0) {
				start = Math.max(0L, size + start);
			}
			if(stop == 0) {
				stop = size;
			}
			else if(stop < 0) {
				stop = Math.max(0L, size + stop);
			}
		}
		boolean reverse = (step != 0) ? step < 0 : start > stop;
		long lo = Math.min(start, stop);
		long hi = Math.max(start, stop);

		byte[] begin;
		byte[] end;
		if(reverse) {
			begin = keyAtOrEnd(lo + 1);
			end = keyAtOrEnd(hi + 1);
		}
		else {
			begin = keyCodec.encode(lo);
			end = keyCodec.encode(hi);
		}
		return new VectorIterator(tr.getRange(begin, end, KeyValueTransaction.ROW_LIMIT_UNLIMITED, reverse), keyCodec);
	}

	// Index Long.MAX_VALUE + 1 wraps around; the end of the subspace bounds it instead.
	private byte[] keyAtOrEnd(long index) {
		return index == Long.MIN_VALUE ? keyCodec.range().end : keyCodec.encode(index);
	}

	/**
	 * Gets the key under which the element at {@code index} is stored.
	 *
	 * @param index any index
	 *
	 * @return the key in this vector's subspace
	 */
	public byte[] pack(long index) {
		return keyCodec.encode(index);
	}

	/**
	 * Gets the index an element key stands for.
	 *
	 * @param key a key from this vector's subspace
	 *
	 * @return the index
	 *
	 * @throws KeyDecodeException if the key is not in the subspace or does not end in an index
	 */
	public long unpack(byte[] key) {
		return keyCodec.decode(key);
	}

	@Override
	public String toString() {
		return "SparseVector(" + ByteArrayUtil.printable(subspace.getKey()) + ", default=" + defaultValue + ")";
	}
}
