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
package com.tomaszrup.goxls.providers;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

import org.eclipse.lsp4j.DocumentHighlight;
import org.eclipse.lsp4j.DocumentHighlightKind;
import org.eclipse.lsp4j.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.goxls.ParsedDocument;
import com.tomaszrup.goxls.ast.NoEnclosingNodeException;
import com.tomaszrup.goxls.highlight.HighlightSet;
import com.tomaszrup.goxls.highlight.Highlighter;
import com.tomaszrup.lsp.utils.Positions;
import com.tomaszrup.lsp.utils.Ranges;

public class DocumentHighlightProvider {
    private static final Logger logger = LoggerFactory.getLogger(DocumentHighlightProvider.class);

    private final Highlighter highlighter;

    public DocumentHighlightProvider(Highlighter highlighter) {
        this.highlighter = highlighter;
    }

    public CompletableFuture<List<? extends DocumentHighlight>> provideDocumentHighlights(
            ParsedDocument document, Position position) {
        if (document == null) {
            return CompletableFuture.completedFuture(Collections.emptyList());
        }
        if (!document.isFullyParsed()) {
            logger.debug("Skipping highlight for header-only document {}", document.getUri());
            return CompletableFuture.completedFuture(Collections.emptyList());
        }
        if (!document.getSyntaxErrors().isEmpty()) {
            logger.debug("Highlighting {} despite {} syntax errors", document.getUri(),
                    document.getSyntaxErrors().size());
        }
        String text = document.getText();
        int offset = Positions.getOffset(text, position);
        if (offset < 0) {
            return CompletableFuture.failedFuture(new IllegalArgumentException(
                    "Invalid position " + position.getLine() + ":" + position.getCharacter()
                            + " in " + document.getUri()));
        }

        HighlightSet ranges;
        try {
            ranges = highlighter.highlight(document.getFile(), document.getSemanticInfo(), offset);
        } catch (NoEnclosingNodeException e) {
            return CompletableFuture.failedFuture(e);
        }

        List<DocumentHighlight> highlights = ranges.toSortedList().stream()
                .map(range -> new DocumentHighlight(Ranges.toRange(text, range), DocumentHighlightKind.Text))
                .collect(Collectors.toList());
        return CompletableFuture.completedFuture(highlights);
    }
}
