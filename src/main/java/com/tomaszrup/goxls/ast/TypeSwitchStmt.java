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
 * {@code switch x := y.(type) { ... }}. The guard is either an
 * {@link ExprStmt} or a {@code :=} {@link AssignStmt} whose single right-hand
 * side is a {@link TypeAssertExpr} without a type.
 */
public class TypeSwitchStmt extends Stmt {
    private final int switchPos;
    private final Stmt init;
    private final Stmt assign;
    private final BlockStmt body;

    public TypeSwitchStmt(int switchPos, Stmt init, Stmt assign, BlockStmt body) {
        this.switchPos = switchPos;
        this.init = init;
        this.assign = assign;
        this.body = body;
    }

    public Stmt getInit() {
        return init;
    }

    public Stmt getAssign() {
        return assign;
    }

    public BlockStmt getBody() {
        return body;
    }

    @Override
    public int getStart() {
        return switchPos;
    }

    @Override
    public int getEnd() {
        return body.getEnd();
    }

    @Override
    public List<Node> getChildren() {
        return children(init, assign, body);
    }
}
