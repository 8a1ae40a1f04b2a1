/*
 * Value.java
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

/**
 * A single element of a {@link SparseVector}. A {@code Value} holds exactly one of
 *  an integer ({@code long}), a float ({@code double}), or a text ({@link String})
 *  payload, tagged with its {@link Kind}. The {@link Kind#EMPTY EMPTY} kind is a
 *  sentinel returned for elements that are represented sparsely; it is never
 *  produced by decoding stored bytes and cannot itself be stored.<br>
 * <br>
 * Two {@code Value}s are equal if they have the same kind and the same payload. Floats
 *  compare by their bit pattern, so {@code NaN} equals {@code NaN} and {@code 0.0}
 *  does not equal {@code -0.0}.<br>
 * <br>
 * Instances are immutable.
 */
public final class Value {
	/**
	 * The kind of payload a {@link Value} carries.
	 */
	public enum Kind {
		/** Sparse placeholder; carries no payload. */
		EMPTY,
		/** A 64-bit signed integer. */
		INTEGER,
		/** A 64-bit IEEE-754 floating point number. */
		FLOAT,
		/** A Unicode string. */
		TEXT
	}

	private static final Value EMPTY = new Value(Kind.EMPTY, 0L, null);

	private final Kind kind;
	// Holds the integer value, or the raw bits of the float value.
	private final long bits;
	private final String text;

	private Value(Kind kind, long bits, String text) {
		this.kind = kind;
		this.bits = bits;
		this.text = text;
	}

	/**
	 * Returns the sentinel used for elements that are not physically stored.
	 *
	 * @return the empty {@code Value}
	 */
	public static Value empty() {
		return EMPTY;
	}

	/**
	 * Creates an integer {@code Value}.
	 *
	 * @param l the integer payload
	 *
	 * @return a new {@code Value} of kind {@link Kind#INTEGER INTEGER}
	 */
	public static Value of(long l) {
		return new Value(Kind.INTEGER, l, null);
	}

	/**
	 * Creates a float {@code Value}.
	 *
	 * @param d the float payload
	 *
	 * @return a new {@code Value} of kind {@link Kind#FLOAT FLOAT}
	 */
	public static Value of(double d) {
		return new Value(Kind.FLOAT, Double.doubleToRawLongBits(d), null);
	}

	/**
	 * Creates a text {@code Value}.
	 *
	 * @param s the text payload, which may be empty but not {@code null}
	 *
	 * @return a new {@code Value} of kind {@link Kind#TEXT TEXT}
	 *
	 * @throws NullPointerException if {@code s} is {@code null}
	 */
	public static Value of(String s) {
		if(s == null) {
			throw new NullPointerException("Text values may not be null");
		}
		return new Value(Kind.TEXT, 0L, s);
	}

	/**
	 * Converts a boxed Java object into a {@code Value}. {@link Long}s, {@link Integer}s,
	 *  {@link Short}s and {@link Byte}s become integers, {@link Double}s and {@link Float}s
	 *  become floats, and {@link String}s become text. A {@code Value} is returned as is.
	 *
	 * @param o the object to convert
	 *
	 * @return the {@code Value} holding {@code o}
	 *
	 * @throws UnsupportedTypeException if {@code o} is {@code null} or of any other type
	 */
	public static Value fromObject(Object o) {
		if(o instanceof Value)
			return (Value)o;
		if(o instanceof String)
			return of((String)o);
		if(o instanceof Double || o instanceof Float)
			return of(((Number)o).doubleValue());
		if(o instanceof Long || o instanceof Integer || o instanceof Short || o instanceof Byte)
			return of(((Number)o).longValue());
		throw new UnsupportedTypeException("Unsupported data type: " + (o == null ? "null" : o.getClass().getName()));
	}

	public Kind getKind() {
		return kind;
	}

	public boolean isEmpty() {
		return kind == Kind.EMPTY;
	}

	public boolean isInteger() {
		return kind == Kind.INTEGER;
	}

	public boolean isFloat() {
		return kind == Kind.FLOAT;
	}

	public boolean isText() {
		return kind == Kind.TEXT;
	}

	/**
	 * Gets the integer payload.
	 *
	 * @return the payload as a {@code long}
	 *
	 * @throws IllegalStateException if this is not an integer {@code Value}
	 */
	public long getLong() {
		checkKind(Kind.INTEGER);
		return bits;
	}

	/**
	 * Gets the float payload.
	 *
	 * @return the payload as a {@code double}
	 *
	 * @throws IllegalStateException if this is not a float {@code Value}
	 */
	public double getDouble() {
		checkKind(Kind.FLOAT);
		return Double.longBitsToDouble(bits);
	}

	/**
	 * Gets the text payload.
	 *
	 * @return the payload as a {@link String}
	 *
	 * @throws IllegalStateException if this is not a text {@code Value}
	 */
	public String getString() {
		checkKind(Kind.TEXT);
		return text;
	}

	/**
	 * Returns this {@code Value}, or {@code other} if this is the empty sentinel.
	 *
	 * @param other the replacement for a sparse element
	 *
	 * @return this or {@code other}
	 */
	public Value orElse(Value other) {
		return isEmpty() ? other : this;
	}

	private void checkKind(Kind expected) {
		if(kind != expected) {
			throw new IllegalStateException("Value of kind " + kind + " read as " + expected);
		}
	}

	@Override
	public boolean equals(Object o) {
		if(o == this)
			return true;
		if(!(o instanceof Value))
			return false;
		Value other = (Value)o;
		if(kind != other.kind || bits != other.bits)
			return false;
		return kind != Kind.TEXT || text.equals(other.text);
	}

	@Override
	public int hashCode() {
		int h = kind.hashCode();
		h = 31 * h + Long.hashCode(bits);
		return kind == Kind.TEXT ? 31 * h + text.hashCode() : h;
	}

	@Override
	public String toString() {
		switch(kind) {
			case INTEGER: return Long.toString(bits);
			case FLOAT:   return Double.toString(Double.longBitsToDouble(bits));
			case TEXT:    return "\"" + text + "\"";
			default:      return "<empty>";
		}
	}
}
