////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.goxls;

import java.net.URI;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Separates the two ways a request can go wrong. Loading its input (reading
 * the document, parsing it) is fail-soft: the failure is logged and the
 * request is answered as if the document were unknown. Once the input is
 * loaded, a rejection of the request itself, such as a position outside the
 * document, is passed through to the client unchanged.
 */
class LspRequestGuard {
	private static final Logger logger = LoggerFactory.getLogger(LspRequestGuard.class);

	private final String requestName;

	LspRequestGuard(String requestName) {
		this.requestName = requestName;
	}

	/**
	 * Runs {@code loader} and returns its result, or {@code null} if it
	 * failed. Virtual machine errors are not caught.
	 */
	<T> T load(URI uri, Supplier<T> loader) {
		try {
			return loader.get();
		} catch (Exception | LinkageError e) {
			if (logger.isWarnEnabled()) {
				logger.warn("{} could not load {}: {}", requestName, uri, describe(e));
			}
			logger.debug("{} load failure details", requestName, e);
			return null;
		}
	}

	/**
	 * Returns a future completing like {@code result}. A rejected request is
	 * logged at debug level and still reaches the client as an error.
	 */
	<T> CompletableFuture<T> answer(URI uri, CompletableFuture<T> result) {
		return result.whenComplete((value, error) -> {
			if (error != null && logger.isDebugEnabled()) {
				logger.debug("{} rejected for {}: {}", requestName, uri, describe(unwrap(error)));
			}
		});
	}

	private static Throwable unwrap(Throwable throwable) {
		Throwable current = throwable;
		while (current instanceof CompletionException && current.getCause() != null) {
			current = current.getCause();
		}
		return current;
	}

	private static String describe(Throwable throwable) {
		String message = throwable.getMessage();
		if (message == null || message.isBlank()) {
			return throwable.getClass().getSimpleName();
		}
		return throwable.getClass().getSimpleName() + ": " + message;
	}
}
