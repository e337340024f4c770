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

public class FuncLit extends Expr {
    private final FuncType type;
    private final BlockStmt body;

    public FuncLit(FuncType type, BlockStmt body) {
        this.type = type;
        this.body = body;
    }

    public FuncType getType() {
        return type;
    }

    public BlockStmt getBody() {
        return body;
    }

    @Override
    public int getStart() {
        return type.getStart();
    }

    @Override
    public int getEnd() {
        return body.getEnd();
    }

    @Override
    public List<Node> getChildren() {
        return children(type, body);
    }
}
