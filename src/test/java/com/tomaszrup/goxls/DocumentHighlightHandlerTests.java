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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import org.eclipse.lsp4j.DocumentHighlight;
import org.eclipse.lsp4j.DocumentHighlightParams;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextDocumentIdentifier;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.google.gson.JsonParser;
import com.tomaszrup.goxls.parser.ParseMode;

class DocumentHighlightHandlerTests {
	private static final URI URI_MAIN = URI.create("file:///workspace/main.go");
	private static final String TEXT = "package main\n\nimport \"fmt\"\n\nfunc main() {\n\tfmt.Println(1)\n\tfmt.Println(2)\n}\n";

	private final Map<URI, String> contents = new HashMap<>();

	@BeforeEach
	void setup() {
		contents.clear();
		contents.put(URI_MAIN, TEXT);
	}

	private List<? extends DocumentHighlight> highlight(DocumentHighlightHandler handler, URI uri, int line,
			int character) {
		DocumentHighlightParams params = new DocumentHighlightParams(new TextDocumentIdentifier(uri.toString()),
				new Position(line, character));
		return handler.documentHighlight(params).join();
	}

	@Test
	void testPackageReferencesAreHighlighted() {
		DocumentHighlightHandler handler = DocumentHighlightHandler.fromInitializationOptions(null, contents::get);
		List<? extends DocumentHighlight> highlights = highlight(handler, URI_MAIN, 5, 2);
		Assertions.assertEquals(3, highlights.size());
		Assertions.assertEquals(new Range(new Position(2, 7), new Position(2, 12)), highlights.get(0).getRange());
		Assertions.assertEquals(new Range(new Position(5, 1), new Position(5, 4)), highlights.get(1).getRange());
		Assertions.assertEquals(new Range(new Position(6, 1), new Position(6, 4)), highlights.get(2).getRange());
	}

	@Test
	void testUnknownDocumentHasNoHighlights() {
		DocumentHighlightHandler handler = DocumentHighlightHandler.fromInitializationOptions(null, contents::get);
		Assertions.assertTrue(highlight(handler, URI.create("file:///workspace/other.go"), 0, 0).isEmpty());
	}

	@Test
	void testPositionOutsideDocumentFailsRequest() {
		DocumentHighlightHandler handler = DocumentHighlightHandler.fromInitializationOptions(null, contents::get);
		DocumentHighlightParams params = new DocumentHighlightParams(new TextDocumentIdentifier(URI_MAIN.toString()),
				new Position(99, 0));
		CompletableFuture<List<? extends DocumentHighlight>> future = handler.documentHighlight(params);
		Assertions.assertTrue(future.isCompletedExceptionally());
		CompletionException e = Assertions.assertThrows(CompletionException.class, future::join);
		Assertions.assertTrue(e.getCause() instanceof IllegalArgumentException);
	}

	@Test
	void testColumnPastLineEndFailsRequest() {
		DocumentHighlightHandler handler = DocumentHighlightHandler.fromInitializationOptions(null, contents::get);
		DocumentHighlightParams params = new DocumentHighlightParams(new TextDocumentIdentifier(URI_MAIN.toString()),
				new Position(0, 40));
		Assertions.assertThrows(CompletionException.class, () -> handler.documentHighlight(params).join());
	}

	@Test
	void testFailingContentsProviderAnswersEmpty() {
		DocumentHighlightHandler handler = DocumentHighlightHandler.fromInitializationOptions(null, uri -> {
			throw new IllegalStateException("closed");
		});
		Assertions.assertTrue(highlight(handler, URI_MAIN, 5, 2).isEmpty());
	}

	@Test
	void testHeaderParseModeDisablesHighlighting() {
		DocumentHighlightHandler handler = DocumentHighlightHandler.fromInitializationOptions(
				JsonParser.parseString("{\"parseMode\": \"header\"}"), contents::get);
		Assertions.assertEquals(ParseMode.HEADER_ONLY, handler.getParseConfig().getMode());
		Assertions.assertTrue(highlight(handler, URI_MAIN, 5, 2).isEmpty());
	}

	@Test
	void testWithoutSemanticBindingNamesAreLinked() {
		DocumentHighlightHandler handler = DocumentHighlightHandler.fromInitializationOptions(
				JsonParser.parseString("{\"semanticBinding\": false}"), contents::get);
		Assertions.assertTrue(handler.getParseConfig().isSkipSemanticBinding());
		List<? extends DocumentHighlight> highlights = highlight(handler, URI_MAIN, 5, 2);
		Assertions.assertEquals(2, highlights.size());
		Assertions.assertEquals(new Range(new Position(5, 1), new Position(5, 4)), highlights.get(0).getRange());
		Assertions.assertEquals(new Range(new Position(6, 1), new Position(6, 4)), highlights.get(1).getRange());
	}
}
