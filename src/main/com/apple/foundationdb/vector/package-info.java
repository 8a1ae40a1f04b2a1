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
 * A sparse, dynamically sized vector layer.
 *
 * <p>
 * The main class in this package is {@link com.apple.foundationdb.vector.SparseVector}, which
 * presents get, set, push and pop by index over a subspace of an ordered transactional store.
 * Elements holding the vector's default value are only stored where needed to keep the size
 * derivable from the last key, so a vector with a few values spread across a large index range
 * costs a few keys. Elements are {@link com.apple.foundationdb.vector.Value}s; their keys use the
 * tuple layer integer encoding and their values the format of
 * {@link com.apple.foundationdb.vector.ValueCodec}.
 * </p>
 */
package com.apple.foundationdb.vector;
