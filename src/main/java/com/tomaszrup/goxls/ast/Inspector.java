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

/**
 * Depth-first, pre-order tree walk driven by a per-node {@link Visit}
 * decision. Boundary-scoped traversals (e.g. "do not enter nested loops")
 * are expressed by returning {@link Visit#SKIP} for the boundary nodes.
 */
public final class Inspector {

    private Inspector() {
    }

    /**
     * Walks {@code root} and its descendants.
     *
     * @return {@code false} if the visitor stopped the walk early
     */
    public static boolean inspect(Node root, NodeVisitor visitor) {
        if (root == null) {
            return true;
        }
        Visit decision = visitor.visit(root);
        if (decision == Visit.STOP) {
            return false;
        }
        if (decision == Visit.SKIP) {
            return true;
        }
        for (Node child : root.getChildren()) {
            if (!inspect(child, visitor)) {
                return false;
            }
        }
        return true;
    }
}
