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

import com.tomaszrup.goxls.ast.BasicLit;
import com.tomaszrup.goxls.ast.BranchStmt;
import com.tomaszrup.goxls.ast.EnclosingPath;
import com.tomaszrup.goxls.ast.ForStmt;
import com.tomaszrup.goxls.ast.FuncDecl;
import com.tomaszrup.goxls.ast.FuncType;
import com.tomaszrup.goxls.ast.Ident;
import com.tomaszrup.goxls.ast.ImportSpec;
import com.tomaszrup.goxls.ast.Node;
import com.tomaszrup.goxls.ast.RangeStmt;
import com.tomaszrup.goxls.ast.ReturnStmt;
import com.tomaszrup.goxls.ast.SourceFile;
import com.tomaszrup.goxls.ast.SwitchStmt;
import com.tomaszrup.goxls.ast.Token;
import com.tomaszrup.goxls.types.SemanticInfo;

/**
 * Routes a cursor to the highlighters that apply to the innermost node
 * enclosing it. Positions outside any recognized construct produce an empty
 * set.
 */
public final class HighlightDispatcher {

    private HighlightDispatcher() {
    }

    public static HighlightSet dispatch(EnclosingPath path, SourceFile file, SemanticInfo info) {
        HighlightSet result = new HighlightSet();
        LabelResolver labels = new LabelResolver(info);
        ControlFlowHighlighter controlFlow = new ControlFlowHighlighter(labels);
        IdentifierHighlighter identifiers = new IdentifierHighlighter(info);

        Node node = path.innermost();
        if (node instanceof BasicLit) {
            if (path.size() > 1 && path.get(1) instanceof ImportSpec) {
                identifiers.importSpec((ImportSpec) path.get(1), file, result);
            } else {
                // a literal may be a returned value
                controlFlow.functionExit(path, result);
            }
        } else if (node instanceof ReturnStmt || node instanceof FuncDecl || node instanceof FuncType) {
            controlFlow.functionExit(path, result);
        } else if (node instanceof Ident) {
            controlFlow.functionExit(path, result);
            identifiers.identifier((Ident) node, file, result);
        } else if (node instanceof ForStmt || node instanceof RangeStmt) {
            controlFlow.loop(path, result);
        } else if (node instanceof SwitchStmt) {
            controlFlow.switchFlow(path, result);
        } else if (node instanceof BranchStmt) {
            BranchStmt branch = (BranchStmt) node;
            if (branch.getTok() == Token.BREAK) {
                if (branch.getLabel() != null) {
                    controlFlow.labeled(path, branch, false, result);
                } else {
                    controlFlow.unlabeledBreak(path, result);
                }
            } else if (branch.getTok() == Token.CONTINUE) {
                if (branch.getLabel() != null) {
                    controlFlow.labeled(path, branch, true, result);
                } else {
                    controlFlow.loop(path, result);
                }
            }
        }
        return result;
    }
}
