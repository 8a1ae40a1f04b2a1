/*
 * package-info.java
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

/**
 * The store interface the vector layer runs against, and its implementations.
 *
 * <p>
 * {@link com.apple.foundationdb.vector.store.KeyValueTransaction} is the small set of reads and
 * writes a vector issues. {@link com.apple.foundationdb.vector.store.FDBKeyValueTransaction} runs
 * them against a FoundationDB cluster; {@link com.apple.foundationdb.vector.store.MemoryKeyValueStore}
 * keeps the data in process and detects conflicts the same way, for tests and embedded use.
 * </p>
 */
package com.apple.foundationdb.vector.store;
