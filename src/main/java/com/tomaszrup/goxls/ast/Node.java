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
 * Base class of all syntax tree nodes. A node covers the half-open offset
 * interval {@code [getStart(), getEnd())} of the document text it was parsed
 * from. Nodes are immutable once the parser hands the tree out.
 */
public abstract class Node {

    public abstract int getStart();

    public abstract int getEnd();

    /**
     * Returns the direct children of this node in source order. Tokens
     * (keywords, punctuation) are not nodes and never appear here.
     */
    public abstract List<Node> getChildren();

    public boolean contains(int offset) {
        return getStart() <= offset && offset < getEnd();
    }

    /**
     * Collects the non-null nodes and node lists in {@code parts} into one
     * list, preserving their order.
     */
    protected static List<Node> children(Object... parts) {
        List<Node> result = new ArrayList<>();
        for (Object part : parts) {
            if (part instanceof Node) {
                result.add((Node) part);
            } else if (part instanceof List) {
                for (Object element : (List<?>) part) {
                    if (element != null) {
                        result.add((Node) element);
                    }
                }
            }
        }
        return Collections.unmodifiableList(result);
    }

    protected static <T> List<T> immutable(List<T> list) {
        if (list == null || list.isEmpty()) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(new ArrayList<>(list));
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + getStart() + ", " + getEnd() + ")";
    }
}
