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

public class UnaryExpr extends Expr {
    private final int opPos;
    private final Token op;
    private final Expr x;

    public UnaryExpr(int opPos, Token op, Expr x) {
        this.opPos = opPos;
        this.op = op;
        this.x = x;
    }

    public Token getOp() {
        return op;
    }

    public Expr getX() {
        return x;
    }

    @Override
    public int getStart() {
        return opPos;
    }

    @Override
    public int getEnd() {
        return x.getEnd();
    }

    @Override
    public List<Node> getChildren() {
        return children(x);
    }
}
