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
import java.util.Collections;
import java.util.List;

/**
 * Root of a parsed file. The root spans the whole document text, from
 * offset 0 to its length, so every valid cursor offset lies inside it.
 */
public class SourceFile extends Node {
    private final int length;
    private final Ident packageName;
    private final List<Node> decls;
    private final List<Comment> comments;

    public SourceFile(int length, Ident packageName, List<Node> decls, List<Comment> comments) {
        this.length = length;
        this.packageName = packageName;
        this.decls = immutable(decls);
        this.comments = immutable(comments);
    }

    /** May be {@code null} if the package clause failed to parse. */
    public Ident getPackageName() {
        return packageName;
    }

    /** {@link GenDecl} and {@link FuncDecl} nodes in source order. */
    public List<Node> getDecls() {
        return decls;
    }

    public List<Comment> getComments() {
        return comments;
    }

    public List<ImportSpec> getImports() {
        List<ImportSpec> imports = new ArrayList<>();
        for (Node decl : decls) {
            if (decl instanceof GenDecl && ((GenDecl) decl).getTok() == Token.IMPORT) {
                for (Node spec : ((GenDecl) decl).getSpecs()) {
                    imports.add((ImportSpec) spec);
                }
            }
        }
        return Collections.unmodifiableList(imports);
    }

    @Override
    public int getStart() {
        return 0;
    }

    @Override
    public int getEnd() {
        return length;
    }

    @Override
    public List<Node> getChildren() {
        return children(packageName, decls);
    }
}
