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

public class StructType extends Expr {
    private final int start;
    private final FieldList fields;

    public StructType(int start, FieldList fields) {
        this.start = start;
        this.fields = fields;
    }

    public FieldList getFields() {
        return fields;
    }

    @Override
    public int getStart() {
        return start;
    }

    @Override
    public int getEnd() {
        return fields.getEnd();
    }

    @Override
    public List<Node> getChildren() {
        return children(fields);
    }
}
