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

/** One entry of a {@link FieldList}: zero or more names sharing a type. */
public class Field extends Node {
    private final List<Ident> names;
    private final Expr type;
    private final BasicLit tag;

    public Field(List<Ident> names, Expr type, BasicLit tag) {
        this.names = immutable(names);
        this.type = type;
        this.tag = tag;
    }

    public List<Ident> getNames() {
        return names;
    }

    public Expr getType() {
        return type;
    }

    public BasicLit getTag() {
        return tag;
    }

    @Override
    public int getStart() {
        return names.isEmpty() ? type.getStart() : names.get(0).getStart();
    }

    @Override
    public int getEnd() {
        return tag != null ? tag.getEnd() : type.getEnd();
    }

    @Override
    public List<Node> getChildren() {
        return children(names, type, tag);
    }
}
