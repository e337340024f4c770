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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.tomaszrup.goxls.ast.Node;

/**
 * The ranges linked to one cursor position. Only membership is meaningful:
 * two sets with the same ranges are equal whatever order they were filled in.
 * The engine fills a set while handling a request; callers only read it.
 */
public final class HighlightSet {
    private final Set<PosRange> ranges = new HashSet<>();

    HighlightSet() {
    }

    void add(PosRange range) {
        ranges.add(range);
    }

    void add(Node node) {
        ranges.add(PosRange.of(node));
    }

    public boolean contains(PosRange range) {
        return ranges.contains(range);
    }

    public int size() {
        return ranges.size();
    }

    public boolean isEmpty() {
        return ranges.isEmpty();
    }

    public Set<PosRange> getRanges() {
        return Collections.unmodifiableSet(ranges);
    }

    /** The ranges ordered by start offset, for presentation. */
    public List<PosRange> toSortedList() {
        List<PosRange> sorted = new ArrayList<>(ranges);
        Collections.sort(sorted);
        return sorted;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof HighlightSet)) {
            return false;
        }
        return ranges.equals(((HighlightSet) obj).ranges);
    }

    @Override
    public int hashCode() {
        return ranges.hashCode();
    }

    @Override
    public String toString() {
        return toSortedList().toString();
    }
}
