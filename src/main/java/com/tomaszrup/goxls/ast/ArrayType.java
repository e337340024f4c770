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

/** Slice type when the length is absent, array type otherwise. */
public class ArrayType extends Expr {
    private final int lbrack;
    private final Expr length;
    private final Expr element;

    public ArrayType(int lbrack, Expr length, Expr element) {
        this.lbrack = lbrack;
        this.length = length;
        this.element = element;
    }

    public Expr getLength() {
        return length;
    }

    public Expr getElement() {
        return element;
    }

    @Override
    public int getStart() {
        return lbrack;
    }

    @Override
    public int getEnd() {
        return element.getEnd();
    }

    @Override
    public List<Node> getChildren() {
        return children(length, element);
    }
}
