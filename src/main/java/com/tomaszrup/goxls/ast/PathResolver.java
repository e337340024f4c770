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

import java.util.ArrayList;
import java.util.List;

/**
 * Locates the chain of nodes enclosing a cursor offset.
 */
public final class PathResolver {

    private PathResolver() {
    }

    /**
     * Resolves the path for a cursor at {@code offset}. When the innermost
     * node is not an identifier, the position just before the cursor is tried
     * as well and preferred if it lands on an identifier or a qualified name,
     * so a cursor placed right after a name still resolves to that name.
     *
     * @throws NoEnclosingNodeException if {@code offset} lies outside the file
     */
    public static EnclosingPath resolve(SourceFile file, int offset) throws NoEnclosingNodeException {
        EnclosingPath path = enclosingInterval(file, offset);
        if (!(path.innermost() instanceof Ident) && offset > file.getStart()) {
            EnclosingPath preceding = enclosingInterval(file, offset - 1);
            Node node = preceding.innermost();
            if (node instanceof Ident || node instanceof SelectorExpr) {
                return preceding;
            }
        }
        return path;
    }

    /**
     * Returns the smallest-to-largest chain of nodes whose extents contain
     * the one-character interval starting at {@code offset}. Gaps between
     * children (whitespace, keywords, punctuation) belong to the parent.
     */
    public static EnclosingPath enclosingInterval(SourceFile file, int offset) throws NoEnclosingNodeException {
        if (offset < file.getStart() || offset > file.getEnd()) {
            throw new NoEnclosingNodeException(offset, file.getEnd());
        }
        int start = offset;
        int end = offset + 1;

        List<Node> path = new ArrayList<>();
        Node node = file;
        path.add(node);
        while (true) {
            Node next = null;
            for (Node child : node.getChildren()) {
                if (child.getStart() <= start && end <= child.getEnd()) {
                    next = child;
                    break;
                }
            }
            if (next == null) {
                break;
            }
            if (node instanceof FuncDecl && next instanceof FieldList) {
                FuncDecl decl = (FuncDecl) node;
                if (next != decl.getReceiver()) {
                    path.add(decl.getType());
                }
            }
            path.add(next);
            node = next;
        }
        return EnclosingPath.fromOutermost(path);
    }
}
