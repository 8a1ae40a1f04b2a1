/*
 * VectorBenchmark.java
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

import com.apple.foundationdb.subspace.Subspace;
import com.apple.foundationdb.tuple.Tuple;
import com.apple.foundationdb.vector.store.MemoryKeyValueStore;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * JMH benchmarks for the vector codecs and for vector operations against the in-memory store.
 *
 * <p>Run with {@code -prof gc} to see per-operation allocation rates
 * ({@code gc.alloc.rate.norm}).
 *
 * <h3>Running</h3>
 * <pre>
 *   # Quick throughput run
 *   java -cp &lt;classpath&gt; org.openjdk.jmh.Main VectorBenchmark -f 1 -wi 3 -i 5
 *
 *   # Codec benchmarks only, with GC profiling
 *   java -cp &lt;classpath&gt; org.openjdk.jmh.Main "VectorBenchmark.(encode|decode).*" -prof gc
 * </pre>
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Warmup(iterations = 5, time = 1)
@Measurement(iterations = 10, time = 1)
@Fork(2)
public class VectorBenchmark {

	private static final int BATCH_SIZE = 1_000;

	private static Value randomValue(Random r, String type) {
		switch (type) {
			case "INTEGER":
				return Value.of(r.nextLong() >> r.nextInt(Long.SIZE));
			case "FLOAT":
				return Value.of(r.nextDouble());
			case "TEXT": {
				char[] chars = new char[r.nextInt(32)];
				for (int j = 0; j < chars.length; j++) {
					chars[j] = (char) ('a' + r.nextInt(26));
				}
				return Value.of(new String(chars));
			}
			default:
				throw new IllegalArgumentException("Unknown value type: " + type);
		}
	}

	// -----------------------------------------------------------------------
	// State: encoded values and keys
	// -----------------------------------------------------------------------

	@State(Scope.Thread)
	public static class CodecState {

		@Param({"INTEGER", "FLOAT", "TEXT"})
		String valueType;

		Value[] values;
		byte[][] encodedValues;

		IndexKeyCodec keyCodec;
		long[] indices;
		byte[][] encodedKeys;

		@Setup(Level.Trial)
		public void setup() {
			Random r = new Random(42);
			values = new Value[BATCH_SIZE];
			encodedValues = new byte[BATCH_SIZE][];
			for (int i = 0; i < BATCH_SIZE; i++) {
				values[i] = randomValue(r, valueType);
				encodedValues[i] = ValueCodec.encode(values[i]);
			}

			keyCodec = new IndexKeyCodec(new Subspace(Tuple.from("bench")));
			indices = new long[BATCH_SIZE];
			encodedKeys = new byte[BATCH_SIZE][];
			for (int i = 0; i < BATCH_SIZE; i++) {
				// Mostly small indices, as a densely pushed vector would have.
				indices[i] = r.nextInt(10) == 0 ? Math.abs(r.nextLong() >> 1) : r.nextInt(100_000);
				encodedKeys[i] = keyCodec.encode(indices[i]);
			}
		}
	}

	// -----------------------------------------------------------------------
	// State: a populated vector in the in-memory store
	// -----------------------------------------------------------------------

	@State(Scope.Thread)
	public static class StoreState {

		@Param({"100", "10000"})
		int vectorSize;

		MemoryKeyValueStore store;
		SparseVector vector;

		@Setup(Level.Trial)
		public void setup() {
			store = new MemoryKeyValueStore();
			vector = new SparseVector(new Subspace(Tuple.from("bench", "vector")));
			store.run(tr -> {
				for (long i = 0; i < vectorSize; i++) {
					vector.push(Value.of(i), tr);
				}
				return null;
			});
		}
	}

	// =======================================================================
	// Codec benchmarks
	// =======================================================================

	@Benchmark
	public void encodeValues(CodecState state, Blackhole bh) {
		for (Value v : state.values) {
			bh.consume(ValueCodec.encode(v));
		}
	}

	@Benchmark
	public void decodeValues(CodecState state, Blackhole bh) {
		for (byte[] data : state.encodedValues) {
			bh.consume(ValueCodec.decode(data));
		}
	}

	@Benchmark
	public void encodeKeys(CodecState state, Blackhole bh) {
		for (long index : state.indices) {
			bh.consume(state.keyCodec.encode(index));
		}
	}

	@Benchmark
	public void decodeKeys(CodecState state, Blackhole bh) {
		for (byte[] key : state.encodedKeys) {
			bh.consume(state.keyCodec.decode(key));
		}
	}

	// =======================================================================
	// Vector benchmarks
	// =======================================================================

	/**
	 * Measures: a push followed by a pop in one transaction, leaving the vector unchanged.
	 */
	@Benchmark
	public Value pushPop(StoreState state) {
		return state.store.run(tr -> {
			state.vector.push(Value.of("x"), tr);
			return state.vector.pop(tr);
		});
	}

	@Benchmark
	public long size(StoreState state) {
		return state.store.run(tr -> state.vector.size(tr));
	}

	/**
	 * Measures: iterating the last hundred elements in reverse. Descending bounds are
	 * {@code (start, stop]}, so {@code (size - 101, size - 1]} covers them.
	 */
	@Benchmark
	public void scanTail(StoreState state, Blackhole bh) {
		state.store.run(tr -> {
			VectorIterator it = state.vector.getRange(-101, -1, -1, tr);
			while (it.hasNext()) {
				bh.consume(it.next());
			}
			return null;
		});
	}

	public static void main(String[] args) throws RunnerException {
		Options opt = new OptionsBuilder()
				.include(VectorBenchmark.class.getSimpleName())
				.build();
		new Runner(opt).run();
	}
}
