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

public class BinaryExpr extends Expr {
    private final Expr x;
    private final Token op;
    private final Expr y;

    public BinaryExpr(Expr x, Token op, Expr y) {
        this.x = x;
        this.op = op;
        this.y = y;
    }

    public Expr getX() {
        return x;
    }

    public Token getOp() {
        return op;
    }

    public Expr getY() {
        return y;
    }

    @Override
    public int getStart() {
        return x.getStart();
    }

    @Override
    public int getEnd() {
        return y.getEnd();
    }

    @Override
    public List<Node> getChildren() {
        return children(x, y);
    }
}
