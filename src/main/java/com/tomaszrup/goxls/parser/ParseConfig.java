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
package com.tomaszrup.goxls.parser;

/**
 * Parse configuration. Both modes retain comments and report every syntax
 * error rather than only the first.
 */
public final class ParseConfig {
    public static final ParseConfig FULL = new ParseConfig(ParseMode.FULL, false);
    public static final ParseConfig HEADER_ONLY = new ParseConfig(ParseMode.HEADER_ONLY, false);

    private final ParseMode mode;
    private final boolean skipSemanticBinding;

    public ParseConfig(ParseMode mode, boolean skipSemanticBinding) {
        this.mode = mode;
        this.skipSemanticBinding = skipSemanticBinding;
    }

    public ParseMode getMode() {
        return mode;
    }

    /**
     * When set, no definition/use tables are produced for the parsed file and
     * consumers see every identifier as unresolved.
     */
    public boolean isSkipSemanticBinding() {
        return skipSemanticBinding;
    }

    @Override
    public String toString() {
        return "ParseConfig[mode=" + mode + ", skipSemanticBinding=" + skipSemanticBinding + "]";
    }
}
