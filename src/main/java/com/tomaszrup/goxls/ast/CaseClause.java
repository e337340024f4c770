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

/** A {@code case} of a switch; the expression list is {@code null} for {@code default}. */
public class CaseClause extends Stmt {
    private final int casePos;
    private final List<Expr> list;
    private final int colon;
    private final List<Stmt> body;

    public CaseClause(int casePos, List<Expr> list, int colon, List<Stmt> body) {
        this.casePos = casePos;
        this.list = list != null ? immutable(list) : null;
        this.colon = colon;
        this.body = immutable(body);
    }

    public List<Expr> getList() {
        return list;
    }

    public boolean isDefault() {
        return list == null;
    }

    public List<Stmt> getBody() {
        return body;
    }

    @Override
    public int getStart() {
        return casePos;
    }

    @Override
    public int getEnd() {
        return body.isEmpty() ? colon + 1 : body.get(body.size() - 1).getEnd();
    }

    @Override
    public List<Node> getChildren() {
        return children(list, body);
    }
}
