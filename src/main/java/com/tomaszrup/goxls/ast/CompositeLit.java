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

/** {@code T{a, b}} or {@code T{k: v}}; the type is absent for elided inner literals. */
public class CompositeLit extends Expr {
    private final Expr type;
    private final int lbrace;
    private final List<Expr> elements;
    private final int rbrace;

    public CompositeLit(Expr type, int lbrace, List<Expr> elements, int rbrace) {
        this.type = type;
        this.lbrace = lbrace;
        this.elements = immutable(elements);
        this.rbrace = rbrace;
    }

    public Expr getType() {
        return type;
    }

    public List<Expr> getElements() {
        return elements;
    }

    @Override
    public int getStart() {
        return type != null ? type.getStart() : lbrace;
    }

    @Override
    public int getEnd() {
        return rbrace + 1;
    }

    @Override
    public List<Node> getChildren() {
        return children(type, elements);
    }
}
