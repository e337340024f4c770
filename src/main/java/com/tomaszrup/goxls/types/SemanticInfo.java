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

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;

import com.tomaszrup.goxls.ast.Ident;
import com.tomaszrup.goxls.ast.ImportSpec;
import com.tomaszrup.goxls.ast.Node;

/**
 * Read-only binding tables for one file, keyed by node identity.
 * <ul>
 * <li>{@code defs}: identifiers that declare an entity</li>
 * <li>{@code uses}: identifiers that refer to an entity</li>
 * <li>{@code implicits}: nodes that declare an entity without an identifier,
 * such as an import without an alias</li>
 * </ul>
 */
public final class SemanticInfo {

    /** Tables with no entries; every identifier is unresolved. */
    public static final SemanticInfo EMPTY = new SemanticInfo(
            new IdentityHashMap<>(), new IdentityHashMap<>(), new IdentityHashMap<>());

    private final Map<Ident, SemanticObject> defs;
    private final Map<Ident, SemanticObject> uses;
    private final Map<Node, SemanticObject> implicits;

    SemanticInfo(Map<Ident, SemanticObject> defs, Map<Ident, SemanticObject> uses,
            Map<Node, SemanticObject> implicits) {
        this.defs = Collections.unmodifiableMap(new IdentityHashMap<>(defs));
        this.uses = Collections.unmodifiableMap(new IdentityHashMap<>(uses));
        this.implicits = Collections.unmodifiableMap(new IdentityHashMap<>(implicits));
    }

    /** The entity declared by {@code id}, or {@code null}. */
    public SemanticObject getDef(Ident id) {
        return defs.get(id);
    }

    /** The entity {@code id} refers to, or {@code null}. */
    public SemanticObject getUse(Ident id) {
        return uses.get(id);
    }

    /** The entity implicitly declared by {@code node}, or {@code null}. */
    public SemanticObject getImplicit(Node node) {
        return implicits.get(node);
    }

    /**
     * The entity {@code id} declares or refers to, or
     * {@link SemanticObject#NO_BINDING} if it is unresolved.
     */
    public SemanticObject objectOf(Ident id) {
        SemanticObject object = defs.get(id);
        if (object == null) {
            object = uses.get(id);
        }
        return object != null ? object : SemanticObject.NO_BINDING;
    }

    /**
     * The package name declared by an import, explicitly through its alias
     * or implicitly. Blank and dot imports declare no usable package name
     * and yield {@code null}.
     */
    public SemanticObject importedPackageName(ImportSpec spec) {
        SemanticObject object = spec.getName() != null ? defs.get(spec.getName()) : implicits.get(spec);
        if (object == null || object.getKind() != ObjectKind.PKG_NAME) {
            return null;
        }
        return object;
    }
}
