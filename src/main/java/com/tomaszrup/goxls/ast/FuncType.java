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
 * A function signature. {@code funcPos} is the offset of the {@code func}
 * keyword, or -1 for interface method signatures that have none. Only
 * function declarations carry type parameters.
 */
public class FuncType extends Expr {
    private final int funcPos;
    private final FieldList typeParams;
    private final FieldList params;
    private final FieldList results;

    public FuncType(int funcPos, FieldList params, FieldList results) {
        this(funcPos, null, params, results);
    }

    public FuncType(int funcPos, FieldList typeParams, FieldList params, FieldList results) {
        this.funcPos = funcPos;
        this.typeParams = typeParams;
        this.params = params;
        this.results = results;
    }

    public int getFuncPos() {
        return funcPos;
    }

    /** May be {@code null} for non-generic functions. */
    public FieldList getTypeParams() {
        return typeParams;
    }

    public FieldList getParams() {
        return params;
    }

    /** May be {@code null} when the function returns nothing. */
    public FieldList getResults() {
        return results;
    }

    @Override
    public int getStart() {
        return funcPos >= 0 ? funcPos : params.getStart();
    }

    @Override
    public int getEnd() {
        return results != null ? results.getEnd() : params.getEnd();
    }

    @Override
    public List<Node> getChildren() {
        return children(typeParams, params, results);
    }
}
