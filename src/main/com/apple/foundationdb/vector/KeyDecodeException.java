/*
 * KeyDecodeException.java
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
 * Thrown when a key lies outside the vector's subspace or does not end in a
 *  validly encoded index.
 */
public class KeyDecodeException extends VectorException {
	private static final long serialVersionUID = 1L;

	public KeyDecodeException(String message) {
		super(message);
	}

	public KeyDecodeException(String message, Throwable cause) {
		super(message, cause);
	}
}
