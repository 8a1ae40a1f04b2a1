/*
 * VectorException.java
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
 * Base class for errors raised by the vector layer itself. Errors coming from the
 *  backing store, such as transaction conflicts or lost connectivity, are not
 *  wrapped and reach the caller as the store raised them.
 */
public class VectorException extends RuntimeException {
	private static final long serialVersionUID = 1L;

	public VectorException(String message) {
		super(message);
	}

	public VectorException(String message, Throwable cause) {
		super(message, cause);
	}
}
