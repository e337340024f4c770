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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.tomaszrup.goxls.ast.SourceFile;

/** A (possibly partial) syntax tree together with the errors found while building it. */
public final class ParseResult {
    private final SourceFile file;
    private final List<SyntaxError> errors;
    private final ParseMode mode;

    ParseResult(SourceFile file, List<SyntaxError> errors, ParseMode mode) {
        this.file = file;
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
        this.mode = mode;
    }

    public SourceFile getFile() {
        return file;
    }

    public List<SyntaxError> getErrors() {
        return errors;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public ParseMode getMode() {
        return mode;
    }
}
