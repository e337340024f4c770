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

/** A {@code case} of a select; the communication is {@code null} for {@code default}. */
public class CommClause extends Stmt {
    private final int casePos;
    private final Stmt comm;
    private final int colon;
    private final List<Stmt> body;

    public CommClause(int casePos, Stmt comm, int colon, List<Stmt> body) {
        this.casePos = casePos;
        this.comm = comm;
        this.colon = colon;
        this.body = immutable(body);
    }

    public Stmt getComm() {
        return comm;
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
        return children(comm, body);
    }
}
