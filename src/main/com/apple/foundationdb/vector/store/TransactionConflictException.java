/*
 * TransactionConflictException.java
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

package com.apple.foundationdb.vector.store;

/**
 * Thrown by {@link MemoryKeyValueStore.MemoryTransaction#commit()} when a key the
 *  transaction read was written by another transaction that committed first. Nothing the
 *  failed transaction wrote is applied; the work should be retried in a new transaction.
 *  This is the in-memory counterpart of FoundationDB's {@code not_committed} error.
 */
public class TransactionConflictException extends RuntimeException {
	private static final long serialVersionUID = 1L;

	public TransactionConflictException(String message) {
		super(message);
	}
}
