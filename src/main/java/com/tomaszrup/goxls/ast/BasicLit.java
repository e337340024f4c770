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
package com.tomaszrup.goxls.ast;

import java.util.Collections;
import java.util.List;

/** An int, float, char or string literal, kept in its source spelling. */
public class BasicLit extends Expr {
    private final int start;
    private final Token kind;
    private final String value;

    public BasicLit(int start, Token kind, String value) {
        this.start = start;
        this.kind = kind;
        this.value = value;
    }

    public Token getKind() {
        return kind;
    }

    public String getValue() {
        return value;
    }

    /**
     * Returns the literal's content without quotes. Escape sequences in
     * interpreted strings are left as written.
     */
    public String getUnquotedValue() {
        if (value.length() >= 2 && (kind == Token.STRING || kind == Token.CHAR)) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }

    @Override
    public int getStart() {
        return start;
    }

    @Override
    public int getEnd() {
        return start + value.length();
    }

    @Override
    public List<Node> getChildren() {
        return Collections.emptyList();
    }
}
