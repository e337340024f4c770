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

import java.util.List;

/**
 * An {@code import}, {@code var}, {@code const} or {@code type} declaration,
 * possibly grouped in parentheses.
 */
public class GenDecl extends Node {
    private final int tokPos;
    private final Token tok;
    private final int lparen;
    private final List<Node> specs;
    private final int rparen;

    public GenDecl(int tokPos, Token tok, int lparen, List<Node> specs, int rparen) {
        this.tokPos = tokPos;
        this.tok = tok;
        this.lparen = lparen;
        this.specs = immutable(specs);
        this.rparen = rparen;
    }

    public Token getTok() {
        return tok;
    }

    public boolean isGrouped() {
        return lparen >= 0;
    }

    /** {@link ImportSpec}, {@link ValueSpec} or {@link TypeSpec} nodes. */
    public List<Node> getSpecs() {
        return specs;
    }

    @Override
    public int getStart() {
        return tokPos;
    }

    @Override
    public int getEnd() {
        if (rparen >= 0) {
            return rparen + 1;
        }
        return specs.isEmpty() ? tokPos + tok.getText().length() : specs.get(specs.size() - 1).getEnd();
    }

    @Override
    public List<Node> getChildren() {
        return children(specs);
    }
}
