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
package com.tomaszrup.goxls.highlight;

import com.tomaszrup.goxls.ast.BranchStmt;
import com.tomaszrup.goxls.ast.EnclosingPath;
import com.tomaszrup.goxls.ast.Ident;
import com.tomaszrup.goxls.ast.LabeledStmt;
import com.tomaszrup.goxls.ast.Node;
import com.tomaszrup.goxls.types.SemanticInfo;
import com.tomaszrup.goxls.types.SemanticObject;

/**
 * Matches branch statements to labels through their bindings. Two labels
 * match only if both are bound to the same object; labels are never
 * compared by name.
 */
public final class LabelResolver {
    private final SemanticInfo info;

    public LabelResolver(SemanticInfo info) {
        this.info = info;
    }

    /** The label of the statement at {@code index} in the path, if that statement is labeled. */
    public static Ident labelFor(EnclosingPath path, int index) {
        if (path.size() > index + 1) {
            Node parent = path.get(index + 1);
            if (parent instanceof LabeledStmt) {
                return ((LabeledStmt) parent).getLabel();
            }
        }
        return null;
    }

    /** The object a branch statement's label refers to, or {@code null}. */
    public SemanticObject target(BranchStmt branch) {
        return branch.getLabel() != null ? info.getUse(branch.getLabel()) : null;
    }

    /** Whether {@code branch} names the label declared by {@code declaration}. */
    public boolean targets(BranchStmt branch, Ident declaration) {
        if (declaration == null) {
            return false;
        }
        SemanticObject use = target(branch);
        return use != null && use == info.getDef(declaration);
    }

    /**
     * Finds the labeled statement on the path that declares the label of
     * {@code branch}. Returns {@code null} when the label is unresolved or
     * does not label an enclosing statement.
     */
    public LabeledStmt findEnclosing(EnclosingPath path, BranchStmt branch) {
        SemanticObject use = target(branch);
        if (use == null) {
            return null;
        }
        for (Node node : path.getNodes()) {
            if (node instanceof LabeledStmt && info.getDef(((LabeledStmt) node).getLabel()) == use) {
                return (LabeledStmt) node;
            }
        }
        return null;
    }
}
