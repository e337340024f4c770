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
 * Parameter, type parameter, result, receiver, struct field or interface
 * method list. A single unparenthesized result type has no opening or
 * closing offsets.
 */
public class FieldList extends Node {
    private final int opening;
    private final List<Field> fields;
    private final int closing;

    public FieldList(int opening, List<Field> fields, int closing) {
        this.opening = opening;
        this.fields = immutable(fields);
        this.closing = closing;
    }

    public List<Field> getFields() {
        return fields;
    }

    public boolean isParenthesized() {
        return opening >= 0;
    }

    public int size() {
        return fields.size();
    }

    @Override
    public int getStart() {
        if (opening >= 0 || fields.isEmpty()) {
            return opening;
        }
        return fields.get(0).getStart();
    }

    @Override
    public int getEnd() {
        if (closing >= 0 || fields.isEmpty()) {
            return closing + 1;
        }
        return fields.get(fields.size() - 1).getEnd();
    }

    @Override
    public List<Node> getChildren() {
        return children(fields);
    }
}
