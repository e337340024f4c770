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

import com.tomaszrup.goxls.parser.ParseConfig;
import com.tomaszrup.goxls.parser.ParseMode;

/** Settings taken from the client's initialization options. */
public final class HighlightOptions {
    public static final HighlightOptions DEFAULTS = new HighlightOptions(null, ParseMode.FULL, true, false);

    private final String logLevel;
    private final ParseMode parseMode;
    private final boolean semanticBinding;
    private final boolean debugHighlight;

    public HighlightOptions(String logLevel, ParseMode parseMode, boolean semanticBinding, boolean debugHighlight) {
        this.logLevel = logLevel;
        this.parseMode = parseMode;
        this.semanticBinding = semanticBinding;
        this.debugHighlight = debugHighlight;
    }

    /** The requested root log level, or {@code null} to keep the configured one. */
    public String getLogLevel() {
        return logLevel;
    }

    public ParseMode getParseMode() {
        return parseMode;
    }

    public boolean isSemanticBinding() {
        return semanticBinding;
    }

    public boolean isDebugHighlight() {
        return debugHighlight;
    }

    public ParseConfig toParseConfig() {
        return new ParseConfig(parseMode, !semanticBinding);
    }

    @Override
    public String toString() {
        return "HighlightOptions[logLevel=" + logLevel + ", parseMode=" + parseMode
                + ", semanticBinding=" + semanticBinding + ", debugHighlight=" + debugHighlight + "]";
    }
}
