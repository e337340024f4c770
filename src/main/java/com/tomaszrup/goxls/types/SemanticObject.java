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

/**
 * An entity introduced by a declaration. Objects compare by identity: two
 * identifiers denote the same entity only if they resolve to the same
 * instance, regardless of their spelling.
 */
public final class SemanticObject {

    /**
     * Stands for "no binding". Every unresolved identifier maps to this one
     * instance, so unresolved identifiers with the same name link to each
     * other.
     */
    public static final SemanticObject NO_BINDING = new SemanticObject(ObjectKind.NONE, "", -1, null);

    private final ObjectKind kind;
    private final String name;
    private final int pos;
    private final String packagePath;

    SemanticObject(ObjectKind kind, String name, int pos, String packagePath) {
        this.kind = kind;
        this.name = name;
        this.pos = pos;
        this.packagePath = packagePath;
    }

    public ObjectKind getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    /** Offset of the declaring identifier, or -1 for predeclared and imported entities. */
    public int getPos() {
        return pos;
    }

    /** Import path for package names and package members, {@code null} otherwise. */
    public String getPackagePath() {
        return packagePath;
    }

    public boolean isBound() {
        return this != NO_BINDING;
    }

    @Override
    public String toString() {
        if (this == NO_BINDING) {
            return "<no binding>";
        }
        return kind + " " + name + (pos >= 0 ? "@" + pos : "");
    }
}
