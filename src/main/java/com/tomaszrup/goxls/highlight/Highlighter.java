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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.goxls.ast.EnclosingPath;
import com.tomaszrup.goxls.ast.NoEnclosingNodeException;
import com.tomaszrup.goxls.ast.PathResolver;
import com.tomaszrup.goxls.ast.SourceFile;
import com.tomaszrup.goxls.types.SemanticInfo;

/**
 * Computes the ranges of a file that are linked to the construct under a
 * cursor. The file and its semantic tables are only read, so one instance
 * may serve concurrent requests.
 */
public class Highlighter {
    private static final Logger logger = LoggerFactory.getLogger(Highlighter.class);

    private final boolean debug;

    public Highlighter() {
        this(false);
    }

    /**
     * @param debug log the innermost node enclosing each requested offset
     */
    public Highlighter(boolean debug) {
        this.debug = debug;
    }

    /**
     * @throws NoEnclosingNodeException if {@code offset} lies outside the file
     */
    public HighlightSet highlight(SourceFile file, SemanticInfo info, int offset) throws NoEnclosingNodeException {
        EnclosingPath path = PathResolver.resolve(file, offset);
        if (debug) {
            logger.info("Highlight at offset {}: innermost node {}", offset, path.innermost());
        }
        HighlightSet result = HighlightDispatcher.dispatch(path, file, info);
        logger.debug("Highlight at offset {} produced {} ranges", offset, result.size());
        return result;
    }
}
