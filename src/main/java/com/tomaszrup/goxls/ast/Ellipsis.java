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

/** {@code ...T} in a variadic parameter, or {@code [...]} array length. */
public class Ellipsis extends Expr {
    private final int start;
    private final Expr element;

    public Ellipsis(int start, Expr element) {
        this.start = start;
        this.element = element;
    }

    public Expr getElement() {
        return element;
    }

    @Override
    public int getStart() {
        return start;
    }

    @Override
    public int getEnd() {
        return element != null ? element.getEnd() : start + 3;
    }

    @Override
    public List<Node> getChildren() {
        return children(element);
    }
}
