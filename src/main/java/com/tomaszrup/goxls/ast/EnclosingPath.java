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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Chain of syntax nodes enclosing a cursor, innermost first. A path built by
 * {@link PathResolver} always ends with the {@link SourceFile}.
 */
public final class EnclosingPath {
    private final List<Node> nodes;

    private EnclosingPath(List<Node> nodes) {
        this.nodes = nodes;
    }

    /** Creates a path from nodes given innermost first. */
    public static EnclosingPath of(Node... nodes) {
        return new EnclosingPath(Collections.unmodifiableList(new ArrayList<>(Arrays.asList(nodes))));
    }

    static EnclosingPath fromOutermost(List<Node> outermostFirst) {
        List<Node> reversed = new ArrayList<>(outermostFirst);
        Collections.reverse(reversed);
        return new EnclosingPath(Collections.unmodifiableList(reversed));
    }

    public Node innermost() {
        return nodes.get(0);
    }

    public Node get(int index) {
        return nodes.get(index);
    }

    public int size() {
        return nodes.size();
    }

    public List<Node> getNodes() {
        return nodes;
    }

    @Override
    public String toString() {
        return nodes.toString();
    }
}
