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
 * Interface type. Methods are fields with one name and a {@link FuncType}
 * without a {@code func} keyword; embedded interfaces are unnamed fields.
 */
public class InterfaceType extends Expr {
    private final int start;
    private final FieldList methods;

    public InterfaceType(int start, FieldList methods) {
        this.start = start;
        this.methods = methods;
    }

    public FieldList getMethods() {
        return methods;
    }

    @Override
    public int getStart() {
        return start;
    }

    @Override
    public int getEnd() {
        return methods.getEnd();
    }

    @Override
    public List<Node> getChildren() {
        return children(methods);
    }
}
