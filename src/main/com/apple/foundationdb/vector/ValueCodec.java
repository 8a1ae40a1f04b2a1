/*
 * ValueCodec.java
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

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Encoding and decoding of the values stored by a {@link SparseVector}.
 *
 * <p>An encoded value is a single type tag followed by the payload:
 * <ul>
 *   <li>{@code 0x01} and the eight big-endian bytes of a {@code long}</li>
 *   <li>{@code 0x02} and the eight big-endian bytes of a {@code double}'s raw bits</li>
 *   <li>{@code 0x03} and the UTF-8 bytes of a string, unterminated</li>
 * </ul>
 * A text payload always runs to the end of the array. Unlike the tuple layer encoding,
 * this format is not order preserving; it is only ever used for values, never for keys.
 */
public final class ValueCodec {

	static final int INT_CODE    = 0x01;
	static final int FLOAT_CODE  = 0x02;
	static final int STRING_CODE = 0x03;

	private static final int NUMBER_SIZE = 1 + Long.BYTES;

	private ValueCodec() {}

	/**
	 * Encodes a {@link Value} into a new byte array.
	 *
	 * @param value the value to encode
	 *
	 * @return the encoded bytes
	 *
	 * @throws UnsupportedTypeException if {@code value} is the empty sentinel
	 */
	public static byte[] encode(Value value) {
		switch(value.getKind()) {
			case INTEGER:
				return encodeNumber(INT_CODE, value.getLong());
			case FLOAT:
				return encodeNumber(FLOAT_CODE, Double.doubleToRawLongBits(value.getDouble()));
			case TEXT:
				return encodeString(value.getString());
			default:
				throw new UnsupportedTypeException("Cannot encode value of kind " + value.getKind());
		}
	}

	/**
	 * Encodes an arbitrary object, converting it with {@link Value#fromObject(Object)} first.
	 *
	 * @param o the object to encode
	 *
	 * @return the encoded bytes
	 *
	 * @throws UnsupportedTypeException if {@code o} is not of a supported type
	 */
	public static byte[] encodeObject(Object o) {
		return encode(Value.fromObject(o));
	}

	/**
	 * Decodes a {@link Value} previously produced by {@link #encode(Value)}.
	 *
	 * @param data the encoded bytes
	 *
	 * @return the decoded value, never the empty sentinel
	 *
	 * @throws EmptyInputException if {@code data} has length zero
	 * @throws UnknownTagException if the leading tag is not a known type code
	 * @throws ValueDecodeException if the payload is malformed for its tag
	 */
	public static Value decode(byte[] data) {
		if(data.length == 0) {
			throw new EmptyInputException("No bytes to decode");
		}
		int code = data[0] & 0xFF;
		switch(code) {
			case INT_CODE:
				return Value.of(decodeNumber(data));
			case FLOAT_CODE:
				return Value.of(Double.longBitsToDouble(decodeNumber(data)));
			case STRING_CODE:
				return Value.of(decodeString(data));
			default:
				throw new UnknownTagException(String.format("Unable to decode value with unknown type code 0x%02x", code));
		}
	}

	private static byte[] encodeNumber(int code, long bits) {
		byte[] buf = new byte[NUMBER_SIZE];
		buf[0] = (byte)code;
		putLongBE(buf, 1, bits);
		return buf;
	}

	private static byte[] encodeString(String s) {
		byte[] utf8 = s.getBytes(StandardCharsets.UTF_8);
		byte[] buf = new byte[1 + utf8.length];
		buf[0] = (byte)STRING_CODE;
		System.arraycopy(utf8, 0, buf, 1, utf8.length);
		return buf;
	}

	private static long decodeNumber(byte[] data) {
		if(data.length != NUMBER_SIZE) {
			throw new ValueDecodeException(String.format("Numeric value with type code 0x%02x has %d payload bytes, expected %d",
					data[0] & 0xFF, data.length - 1, Long.BYTES));
		}
		return getLongBE(data, 1);
	}

	// Rejects malformed UTF-8 rather than substituting replacement characters.
	private static String decodeString(byte[] data) {
		try {
			CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
				.onMalformedInput(CodingErrorAction.REPORT)
				.onUnmappableCharacter(CodingErrorAction.REPORT);
			return decoder.decode(ByteBuffer.wrap(data, 1, data.length - 1)).toString();
		} catch(CharacterCodingException e) {
			throw new ValueDecodeException("Malformed UTF-8 string value", e);
		}
	}

	// -----------------------------------------------------------------------
	// Big-endian byte-order helpers
	// -----------------------------------------------------------------------

	private static void putLongBE(byte[] buf, int pos, long value) {
		buf[pos]     = (byte)(value >> 56);
		buf[pos + 1] = (byte)(value >> 48);
		buf[pos + 2] = (byte)(value >> 40);
		buf[pos + 3] = (byte)(value >> 32);
		buf[pos + 4] = (byte)(value >> 24);
		buf[pos + 5] = (byte)(value >> 16);
		buf[pos + 6] = (byte)(value >> 8);
		buf[pos + 7] = (byte)(value);
	}

	private static long getLongBE(byte[] buf, int pos) {
		return ((long)(buf[pos] & 0xFF) << 56) |
			   ((long)(buf[pos + 1] & 0xFF) << 48) |
			   ((long)(buf[pos + 2] & 0xFF) << 40) |
			   ((long)(buf[pos + 3] & 0xFF) << 32) |
			   ((long)(buf[pos + 4] & 0xFF) << 24) |
			   ((long)(buf[pos + 5] & 0xFF) << 16) |
			   ((long)(buf[pos + 6] & 0xFF) << 8) |
			   ((long)(buf[pos + 7] & 0xFF));
	}
}
