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

/** Assignment ({@code =}, {@code op=}) or short variable declaration ({@code :=}). */
public class AssignStmt extends Stmt {
    private final List<Expr> lhs;
    private final int tokPos;
    private final Token tok;
    private final List<Expr> rhs;

    public AssignStmt(List<Expr> lhs, int tokPos, Token tok, List<Expr> rhs) {
        this.lhs = immutable(lhs);
        this.tokPos = tokPos;
        this.tok = tok;
        this.rhs = immutable(rhs);
    }

    public List<Expr> getLhs() {
        return lhs;
    }

    public Token getTok() {
        return tok;
    }

    public int getTokPos() {
        return tokPos;
    }

    public List<Expr> getRhs() {
        return rhs;
    }

    public boolean isDefine() {
        return tok == Token.DEFINE;
    }

    @Override
    public int getStart() {
        return lhs.isEmpty() ? tokPos : lhs.get(0).getStart();
    }

    @Override
    public int getEnd() {
        return rhs.get(rhs.size() - 1).getEnd();
    }

    @Override
    public List<Node> getChildren() {
        return children(lhs, rhs);
    }
}
