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
 * {@code for k, v := range x}. Key and value are absent in {@code for range x};
 * {@code tok} is then {@link Token#ILLEGAL}.
 */
public class RangeStmt extends Stmt {
    private final int forPos;
    private final Expr key;
    private final Expr value;
    private final Token tok;
    private final Expr x;
    private final BlockStmt body;

    public RangeStmt(int forPos, Expr key, Expr value, Token tok, Expr x, BlockStmt body) {
        this.forPos = forPos;
        this.key = key;
        this.value = value;
        this.tok = tok;
        this.x = x;
        this.body = body;
    }

    public Expr getKey() {
        return key;
    }

    public Expr getValue() {
        return value;
    }

    public Token getTok() {
        return tok;
    }

    public Expr getX() {
        return x;
    }

    public BlockStmt getBody() {
        return body;
    }

    @Override
    public int getStart() {
        return forPos;
    }

    @Override
    public int getEnd() {
        return body.getEnd();
    }

    @Override
    public List<Node> getChildren() {
        return children(key, value, x, body);
    }
}
