/*
 * IndexKeyCodecTest.java
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
import java.util.Arrays;

import com.apple.foundationdb.subspace.Subspace;
import com.apple.foundationdb.tuple.ByteArrayUtil;
import com.apple.foundationdb.tuple.Tuple;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

/**
 * Tests for the index to key mapping. The tuple layer is pure Java, so these tests
 * do not require the FDB native library.
 */
class IndexKeyCodecTest {

	private static final byte FF = (byte)0xff;

	private static final long[] INDEXES = {Long.MIN_VALUE, Long.MIN_VALUE + 1, (long)Integer.MIN_VALUE - 1,
			-65537, -65536, -256, -255, -2, -1, 0, 1, 2, 127, 128, 255, 256, 65535, 65536,
			Integer.MAX_VALUE, (long)Integer.MAX_VALUE + 1, Long.MAX_VALUE - 1, Long.MAX_VALUE};

	private final IndexKeyCodec bare = new IndexKeyCodec(new Subspace());

	// -----------------------------------------------------------------------
	// Encoding
	// -----------------------------------------------------------------------

	@Test
	void testEncodeMatchesSubspacePack() {
		Subspace subspace = new Subspace(Tuple.from("tests", "vector"));
		IndexKeyCodec codec = new IndexKeyCodec(subspace);
		for(long i : INDEXES) {
			Assertions.assertArrayEquals(subspace.pack(Tuple.from(i)), codec.encode(i), "Mismatch for index " + i);
		}
	}

	@Test
	void testEncodeUnderEmptySubspaceIsBareTuple() {
		Assertions.assertArrayEquals(new byte[] { 0x14 }, bare.encode(0L));
		Assertions.assertArrayEquals(Tuple.from(-1L).pack(), bare.encode(-1L));
	}

	// -----------------------------------------------------------------------
	// Ordering and round trips
	// -----------------------------------------------------------------------

	@Test
	void testKeysSortInIndexOrder() {
		for(int i = 1; i < INDEXES.length; i++) {
			byte[] lower = bare.encode(INDEXES[i - 1]);
			byte[] upper = bare.encode(INDEXES[i]);
			Assertions.assertTrue(ByteArrayUtil.compareUnsigned(lower, upper) < 0,
					"Key for " + INDEXES[i - 1] + " does not sort before key for " + INDEXES[i]);
		}
	}

	@Test
	void testKeysStayWithinSubspaceRange() {
		Subspace subspace = new Subspace(new byte[] { 0x01, 0x02 });
		IndexKeyCodec codec = new IndexKeyCodec(subspace);
		for(long i : INDEXES) {
			byte[] key = codec.encode(i);
			Assertions.assertTrue(ByteArrayUtil.compareUnsigned(codec.range().begin, key) <= 0);
			Assertions.assertTrue(ByteArrayUtil.compareUnsigned(key, codec.range().end) < 0);
		}
	}

	@Test
	void testDecodeRoundTrip() {
		IndexKeyCodec codec = new IndexKeyCodec(new Subspace(Tuple.from("vec")));
		for(long i : INDEXES) {
			Assertions.assertEquals(i, codec.decode(codec.encode(i)), "Round-trip mismatch for index " + i);
		}
	}

	// -----------------------------------------------------------------------
	// Malformed keys
	// -----------------------------------------------------------------------

	@Test
	void testDecodeRejectsForeignPrefix() {
		IndexKeyCodec codec = new IndexKeyCodec(new Subspace(Tuple.from("a")));
		byte[] foreign = new IndexKeyCodec(new Subspace(Tuple.from("b"))).encode(3L);
		Assertions.assertThrows(KeyDecodeException.class, () -> codec.decode(foreign));
	}

	@Test
	void testDecodeRejectsShortKey() {
		IndexKeyCodec codec = new IndexKeyCodec(new Subspace(new byte[] { 0x05, 0x06 }));
		Assertions.assertThrows(KeyDecodeException.class, () -> codec.decode(new byte[] { 0x05 }));
		Assertions.assertThrows(KeyDecodeException.class, () -> codec.decode(new byte[] { 0x05, 0x06 }));
	}

	@Test
	void testDecodeRejectsNonIntegerCode() {
		byte[] stringKey = Tuple.from("x").pack();
		Assertions.assertThrows(KeyDecodeException.class, () -> bare.decode(stringKey));
		Assertions.assertThrows(KeyDecodeException.class, () -> bare.decode(new byte[] { FF }));
		Assertions.assertThrows(KeyDecodeException.class, () -> bare.decode(new byte[] { 0x0b, 0x00 }));
	}

	@Test
	void testDecodeRejectsTruncatedInteger() {
		Assertions.assertThrows(KeyDecodeException.class, () -> bare.decode(new byte[] { 0x16, 0x01 }));
	}

	@Test
	void testDecodeRejectsTrailingBytes() {
		byte[] key = Arrays.copyOf(bare.encode(1L), 3);
		Assertions.assertThrows(KeyDecodeException.class, () -> bare.decode(key));
	}

	@Test
	void testDecodeRejectsOtherTuples() {
		Subspace subspace = new Subspace(Tuple.from("vec"));
		IndexKeyCodec codec = new IndexKeyCodec(subspace);
		Assertions.assertThrows(KeyDecodeException.class, () -> codec.decode(subspace.pack(Tuple.from(1L, 2L))));
		Assertions.assertThrows(KeyDecodeException.class, () -> codec.decode(subspace.pack(Tuple.from(1.5))));
		Assertions.assertThrows(KeyDecodeException.class,
				() -> codec.decode(subspace.pack(Tuple.from(BigInteger.ONE.shiftLeft(64)))));
	}
}
