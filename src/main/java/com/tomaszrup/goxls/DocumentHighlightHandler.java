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
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

import org.eclipse.lsp4j.DocumentHighlight;
import org.eclipse.lsp4j.DocumentHighlightParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.goxls.highlight.Highlighter;
import com.tomaszrup.goxls.parser.ParseConfig;
import com.tomaszrup.goxls.providers.DocumentHighlightProvider;

/**
 * Handles LSP {@code textDocument/documentHighlight} requests. Each request
 * parses the current document contents into a fresh snapshot. A document
 * that cannot be read or parsed gets no highlights; a position that lies
 * outside the document fails the request.
 */
public class DocumentHighlightHandler {
	private static final Logger logger = LoggerFactory.getLogger(DocumentHighlightHandler.class);
	private static final String REQUEST_NAME = "documentHighlight";

	private final Function<URI, String> contentsProvider;
	private final ParseConfig parseConfig;
	private final DocumentHighlightProvider provider;
	private final LspRequestGuard requestGuard = new LspRequestGuard(REQUEST_NAME);

	public DocumentHighlightHandler(HighlightOptions options, Function<URI, String> contentsProvider) {
		this.contentsProvider = contentsProvider;
		this.parseConfig = options.toParseConfig();
		this.provider = new DocumentHighlightProvider(new Highlighter(options.isDebugHighlight()));
		logger.info("Document highlighting configured: {}", options);
	}

	/**
	 * Creates a handler from the {@code initializationOptions} of the LSP
	 * {@code initialize} request.
	 */
	public static DocumentHighlightHandler fromInitializationOptions(Object initOptions,
			Function<URI, String> contentsProvider) {
		return new DocumentHighlightHandler(InitializationOptionsParser.parse(initOptions), contentsProvider);
	}

	ParseConfig getParseConfig() {
		return parseConfig;
	}

	@SuppressWarnings("java:S1452")
	public CompletableFuture<List<? extends DocumentHighlight>> documentHighlight(DocumentHighlightParams params) {
		URI uri = URI.create(params.getTextDocument().getUri());
		ParsedDocument document = requestGuard.load(uri, () -> {
			String text = contentsProvider.apply(uri);
			if (text == null) {
				logger.debug("No contents for {}", uri);
				return null;
			}
			return ParsedDocument.parse(uri, text, parseConfig);
		});
		if (document == null) {
			return CompletableFuture.completedFuture(Collections.emptyList());
		}
		return requestGuard.answer(uri, provider.provideDocumentHighlights(document, params.getPosition()));
	}
}
