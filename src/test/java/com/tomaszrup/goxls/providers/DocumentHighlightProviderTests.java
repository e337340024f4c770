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
package com.tomaszrup.goxls.providers;

import java.net.URI;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import org.eclipse.lsp4j.DocumentHighlight;
import org.eclipse.lsp4j.DocumentHighlightKind;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.tomaszrup.goxls.ParsedDocument;
import com.tomaszrup.goxls.highlight.Highlighter;
import com.tomaszrup.goxls.parser.ParseConfig;

class DocumentHighlightProviderTests {
	private static final URI URI_MAIN = URI.create("file:///workspace/main.go");
	private static final String TEXT = "package main\n\nfunc f() int {\n\tx := 1\n\treturn x\n}\n";

	private DocumentHighlightProvider provider;

	@BeforeEach
	void setup() {
		provider = new DocumentHighlightProvider(new Highlighter());
	}

	@Test
	void testIdentifierHighlightsAreSortedTextRanges() {
		ParsedDocument document = ParsedDocument.parse(URI_MAIN, TEXT, ParseConfig.FULL);
		List<? extends DocumentHighlight> highlights = provider.provideDocumentHighlights(document, new Position(3, 1))
				.join();
		Assertions.assertEquals(2, highlights.size());
		Assertions.assertEquals(new Range(new Position(3, 1), new Position(3, 2)), highlights.get(0).getRange());
		Assertions.assertEquals(new Range(new Position(4, 8), new Position(4, 9)), highlights.get(1).getRange());
		for (DocumentHighlight highlight : highlights) {
			Assertions.assertEquals(DocumentHighlightKind.Text, highlight.getKind());
		}
	}

	@Test
	void testReturnKeywordHighlightsFunctionExits() {
		ParsedDocument document = ParsedDocument.parse(URI_MAIN, TEXT, ParseConfig.FULL);
		List<? extends DocumentHighlight> highlights = provider.provideDocumentHighlights(document, new Position(4, 2))
				.join();
		Assertions.assertEquals(2, highlights.size());
		Assertions.assertEquals(new Range(new Position(2, 0), new Position(2, 4)), highlights.get(0).getRange());
		Assertions.assertEquals(new Range(new Position(4, 1), new Position(4, 9)), highlights.get(1).getRange());
	}

	@Test
	void testWhitespaceHasNoHighlights() {
		ParsedDocument document = ParsedDocument.parse(URI_MAIN, TEXT, ParseConfig.FULL);
		Assertions.assertTrue(provider.provideDocumentHighlights(document, new Position(1, 0)).join().isEmpty());
	}

	@Test
	void testHeaderOnlyDocumentHasNoHighlights() {
		ParsedDocument document = ParsedDocument.parse(URI_MAIN, TEXT, ParseConfig.HEADER_ONLY);
		Assertions.assertFalse(document.isFullyParsed());
		Assertions.assertTrue(provider.provideDocumentHighlights(document, new Position(3, 1)).join().isEmpty());
	}

	@Test
	void testNullDocumentHasNoHighlights() {
		Assertions.assertTrue(provider.provideDocumentHighlights(null, new Position(0, 0)).join().isEmpty());
	}

	@Test
	void testPositionOutsideDocumentFails() {
		ParsedDocument document = ParsedDocument.parse(URI_MAIN, TEXT, ParseConfig.FULL);
		CompletableFuture<List<? extends DocumentHighlight>> future = provider.provideDocumentHighlights(document,
				new Position(40, 0));
		Assertions.assertTrue(future.isCompletedExceptionally());
		CompletionException e = Assertions.assertThrows(CompletionException.class, future::join);
		Assertions.assertTrue(e.getCause() instanceof IllegalArgumentException);
	}
}
