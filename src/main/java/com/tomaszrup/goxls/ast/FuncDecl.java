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
 * A function or method declaration. The node starts at the {@code func}
 * keyword. Its children skip the {@link FuncType} and list the type
 * parameter, parameter and result lists directly, because the signature's
 * extent would overlap the name; {@link PathResolver} puts the signature back
 * into enclosing paths.
 */
public class FuncDecl extends Node {
    private final FieldList receiver;
    private final Ident name;
    private final FuncType type;
    private final BlockStmt body;

    public FuncDecl(FieldList receiver, Ident name, FuncType type, BlockStmt body) {
        this.receiver = receiver;
        this.name = name;
        this.type = type;
        this.body = body;
    }

    /** May be {@code null} for plain functions. */
    public FieldList getReceiver() {
        return receiver;
    }

    public Ident getName() {
        return name;
    }

    public FuncType getType() {
        return type;
    }

    /** May be {@code null} for external (body-less) declarations. */
    public BlockStmt getBody() {
        return body;
    }

    @Override
    public int getStart() {
        return type.getStart();
    }

    @Override
    public int getEnd() {
        return body != null ? body.getEnd() : type.getEnd();
    }

    @Override
    public List<Node> getChildren() {
        return children(receiver, name, type.getTypeParams(), type.getParams(), type.getResults(), body);
    }
}
