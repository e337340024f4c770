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
package com.tomaszrup.goxls.types;

import java.util.HashMap;
import java.util.Map;

/** A lexical block mapping names to objects, chained to its enclosing block. */
final class Scope {
    private final Scope parent;
    private final String kind;
    private final Map<String, SemanticObject> entries = new HashMap<>();

    Scope(Scope parent, String kind) {
        this.parent = parent;
        this.kind = kind;
    }

    Scope getParent() {
        return parent;
    }

    SemanticObject lookupLocal(String name) {
        return entries.get(name);
    }

    SemanticObject lookup(String name) {
        for (Scope scope = this; scope != null; scope = scope.parent) {
            SemanticObject object = scope.entries.get(name);
            if (object != null) {
                return object;
            }
        }
        return null;
    }

    /**
     * Adds {@code object} unless the name is already declared in this block.
     *
     * @return the existing object on conflict, {@code null} on success
     */
    SemanticObject insert(SemanticObject object) {
        return entries.putIfAbsent(object.getName(), object);
    }

    @Override
    public String toString() {
        return kind + " scope " + entries.keySet();
    }
}
