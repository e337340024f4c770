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
 * Thrown when a cursor offset lies outside the extent of the file, so no
 * syntax node encloses it. Retrying with the same offset cannot succeed.
 */
public class NoEnclosingNodeException extends Exception {
    private static final long serialVersionUID = 1L;

    private final int offset;

    public NoEnclosingNodeException(int offset, int length) {
        super("no enclosing node found for offset " + offset + " (file length " + length + ")");
        this.offset = offset;
    }

    public int getOffset() {
        return offset;
    }
}
