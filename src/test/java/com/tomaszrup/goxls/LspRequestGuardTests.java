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
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.goxls;

import java.net.URI;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.goxls.ast.NoEnclosingNodeException;

class LspRequestGuardTests {
	private static final URI URI_MAIN = URI.create("file:///workspace/main.go");

	private final LspRequestGuard guard = new LspRequestGuard("documentHighlight");

	@Test
	void testLoadReturnsLoadedValue() {
		Assertions.assertEquals("package main", guard.load(URI_MAIN, () -> "package main"));
	}

	@Test
	void testLoadFailureYieldsNull() {
		String loaded = guard.load(URI_MAIN, () -> {
			throw new IllegalStateException("document closed");
		});
		Assertions.assertNull(loaded);
	}

	@Test
	void testLoadLinkageErrorYieldsNull() {
		String loaded = guard.load(URI_MAIN, () -> {
			throw new NoClassDefFoundError("com/example/Missing");
		});
		Assertions.assertNull(loaded);
	}

	@Test
	void testLoadDoesNotCatchVirtualMachineErrors() {
		Assertions.assertThrows(OutOfMemoryError.class, () -> guard.load(URI_MAIN, () -> {
			throw new OutOfMemoryError("simulated");
		}));
	}

	@Test
	void testAnswerPassesValueThrough() {
		CompletableFuture<String> future = guard.answer(URI_MAIN, CompletableFuture.completedFuture("ok"));
		Assertions.assertEquals("ok", future.join());
	}

	@Test
	void testAnswerPassesRejectionThrough() {
		NoEnclosingNodeException rejection = new NoEnclosingNodeException(120, 100);
		CompletableFuture<String> future = guard.answer(URI_MAIN, CompletableFuture.failedFuture(rejection));
		Assertions.assertTrue(future.isCompletedExceptionally());
		CompletionException e = Assertions.assertThrows(CompletionException.class, future::join);
		Assertions.assertSame(rejection, e.getCause());
	}
}
