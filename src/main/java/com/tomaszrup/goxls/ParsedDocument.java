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
import java.util.List;

import com.tomaszrup.goxls.ast.SourceFile;
import com.tomaszrup.goxls.parser.ParseConfig;
import com.tomaszrup.goxls.parser.ParseMode;
import com.tomaszrup.goxls.parser.ParseResult;
import com.tomaszrup.goxls.parser.Parser;
import com.tomaszrup.goxls.parser.SyntaxError;
import com.tomaszrup.goxls.types.Resolver;
import com.tomaszrup.goxls.types.SemanticInfo;

/**
 * Immutable snapshot of one document: its text, syntax tree and binding
 * tables. A snapshot can be shared by any number of concurrent requests.
 */
public final class ParsedDocument {
    private final URI uri;
    private final String text;
    private final ParseResult parseResult;
    private final SemanticInfo semanticInfo;

    private ParsedDocument(URI uri, String text, ParseResult parseResult, SemanticInfo semanticInfo) {
        this.uri = uri;
        this.text = text;
        this.parseResult = parseResult;
        this.semanticInfo = semanticInfo;
    }

    public static ParsedDocument parse(URI uri, String text, ParseConfig config) {
        ParseResult result = Parser.parse(text, config);
        SemanticInfo info = config.isSkipSemanticBinding()
                ? SemanticInfo.EMPTY
                : Resolver.resolve(result.getFile());
        return new ParsedDocument(uri, text, result, info);
    }

    public URI getUri() {
        return uri;
    }

    public String getText() {
        return text;
    }

    public SourceFile getFile() {
        return parseResult.getFile();
    }

    public List<SyntaxError> getSyntaxErrors() {
        return parseResult.getErrors();
    }

    public SemanticInfo getSemanticInfo() {
        return semanticInfo;
    }

    /** Whether statement and expression bodies were parsed. */
    public boolean isFullyParsed() {
        return parseResult.getMode() == ParseMode.FULL;
    }
}
