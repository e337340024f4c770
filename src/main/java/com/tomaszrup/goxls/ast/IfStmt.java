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

public class IfStmt extends Stmt {
    private final int ifPos;
    private final Stmt init;
    private final Expr cond;
    private final BlockStmt body;
    private final Stmt elseStmt;

    public IfStmt(int ifPos, Stmt init, Expr cond, BlockStmt body, Stmt elseStmt) {
        this.ifPos = ifPos;
        this.init = init;
        this.cond = cond;
        this.body = body;
        this.elseStmt = elseStmt;
    }

    public Stmt getInit() {
        return init;
    }

    public Expr getCond() {
        return cond;
    }

    public BlockStmt getBody() {
        return body;
    }

    /** An {@link IfStmt}, a {@link BlockStmt} or {@code null}. */
    public Stmt getElse() {
        return elseStmt;
    }

    @Override
    public int getStart() {
        return ifPos;
    }

    @Override
    public int getEnd() {
        return elseStmt != null ? elseStmt.getEnd() : body.getEnd();
    }

    @Override
    public List<Node> getChildren() {
        return children(init, cond, body, elseStmt);
    }
}
