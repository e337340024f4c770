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
 * A braced statement list. Switch and select bodies are blocks whose
 * statements are {@link CaseClause} or {@link CommClause} nodes.
 */
public class BlockStmt extends Stmt {
    private final int lbrace;
    private final List<Stmt> statements;
    private final int rbrace;

    public BlockStmt(int lbrace, List<Stmt> statements, int rbrace) {
        this.lbrace = lbrace;
        this.statements = immutable(statements);
        this.rbrace = rbrace;
    }

    public List<Stmt> getStatements() {
        return statements;
    }

    @Override
    public int getStart() {
        return lbrace;
    }

    @Override
    public int getEnd() {
        return rbrace + 1;
    }

    @Override
    public List<Node> getChildren() {
        return children(statements);
    }
}
