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

import java.util.Collections;
import java.util.List;

import com.tomaszrup.goxls.ast.BasicLit;
import com.tomaszrup.goxls.ast.BranchStmt;
import com.tomaszrup.goxls.ast.CallExpr;
import com.tomaszrup.goxls.ast.EnclosingPath;
import com.tomaszrup.goxls.ast.Expr;
import com.tomaszrup.goxls.ast.Field;
import com.tomaszrup.goxls.ast.FieldList;
import com.tomaszrup.goxls.ast.ForStmt;
import com.tomaszrup.goxls.ast.FuncDecl;
import com.tomaszrup.goxls.ast.FuncLit;
import com.tomaszrup.goxls.ast.FuncType;
import com.tomaszrup.goxls.ast.Ident;
import com.tomaszrup.goxls.ast.Inspector;
import com.tomaszrup.goxls.ast.KeyValueExpr;
import com.tomaszrup.goxls.ast.LabeledStmt;
import com.tomaszrup.goxls.ast.Node;
import com.tomaszrup.goxls.ast.RangeStmt;
import com.tomaszrup.goxls.ast.ReturnStmt;
import com.tomaszrup.goxls.ast.SelectStmt;
import com.tomaszrup.goxls.ast.Stmt;
import com.tomaszrup.goxls.ast.SwitchStmt;
import com.tomaszrup.goxls.ast.Token;
import com.tomaszrup.goxls.ast.Visit;

/**
 * Highlights the exits of the function, loop or switch enclosing a cursor.
 */
public final class ControlFlowHighlighter {
    private static final int FUNC_KEYWORD_LENGTH = Token.FUNC.getText().length();
    private static final int FOR_KEYWORD_LENGTH = Token.FOR.getText().length();
    private static final int SWITCH_KEYWORD_LENGTH = Token.SWITCH.getText().length();

    private final LabelResolver labels;

    public ControlFlowHighlighter(LabelResolver labels) {
        this.labels = labels;
    }

    // ------------------------------------------------------------------
    // Function exits
    // ------------------------------------------------------------------

    /**
     * Highlights the return statements of the enclosing function. On the
     * {@code return} or {@code func} keyword every return statement and the
     * {@code func} keyword are highlighted; on a result expression or result
     * type only the results at the same position are.
     */
    public void functionExit(EnclosingPath path, HighlightSet result) {
        Node innermost = path.innermost();
        Node enclosingFunc = null;
        FieldList resultsList = null;
        ReturnStmt returnStmt = null;
        boolean inReturnList = false;

        for (int i = 0; i < path.size() && enclosingFunc == null; i++) {
            Node node = path.get(i);
            if (node instanceof KeyValueExpr) {
                return;
            } else if (node instanceof CallExpr) {
                if (i > 0 && isArgument((CallExpr) node, path.get(i - 1))) {
                    return;
                }
            } else if (node instanceof Field) {
                inReturnList = true;
            } else if (node instanceof FuncLit) {
                enclosingFunc = node;
                resultsList = ((FuncLit) node).getType().getResults();
            } else if (node instanceof FuncDecl) {
                enclosingFunc = node;
                resultsList = ((FuncDecl) node).getType().getResults();
            } else if (node instanceof ReturnStmt && returnStmt == null) {
                returnStmt = (ReturnStmt) node;
                inReturnList = inReturnList || innermost != returnStmt;
            }
        }
        if (enclosingFunc == null) {
            return;
        }

        boolean highlightAll = innermost == returnStmt || innermost == enclosingFunc
                || innermost instanceof FuncType;
        if ((innermost instanceof Ident || innermost instanceof BasicLit) && returnStmt == null && !inReturnList) {
            return;
        }

        List<? extends Node> candidates = Collections.emptyList();
        if (returnStmt != null) {
            candidates = returnStmt.getResults();
        } else if (resultsList != null) {
            candidates = resultsList.getFields();
        }
        int index = indexAt(candidates, innermost.getStart());

        if (resultsList != null && index >= 0 && index < resultsList.size()) {
            result.add(resultsList.getFields().get(index));
        }
        if (highlightAll) {
            result.add(PosRange.ofLength(enclosingFunc.getStart(), FUNC_KEYWORD_LENGTH));
        }

        Node boundary = enclosingFunc;
        Inspector.inspect(boundary, node -> {
            if (node instanceof FuncDecl || node instanceof FuncLit) {
                return node == boundary ? Visit.CONTINUE : Visit.SKIP;
            }
            if (!(node instanceof ReturnStmt)) {
                return Visit.CONTINUE;
            }
            ReturnStmt ret = (ReturnStmt) node;
            Node toAdd = highlightAll ? ret : null;
            if (index >= 0 && index < ret.getResults().size()) {
                toAdd = ret.getResults().get(index);
            }
            if (toAdd != null) {
                result.add(toAdd);
            }
            return Visit.SKIP;
        });
    }

    private static boolean isArgument(CallExpr call, Node node) {
        for (Expr arg : call.getArgs()) {
            if (arg == node) {
                return true;
            }
        }
        return false;
    }

    /** Index of the first node whose closed extent contains {@code offset}, or -1. */
    private static int indexAt(List<? extends Node> nodes, int offset) {
        for (int i = 0; i < nodes.size(); i++) {
            Node node = nodes.get(i);
            if (node.getStart() <= offset && offset <= node.getEnd()) {
                return i;
            }
        }
        return -1;
    }

    // ------------------------------------------------------------------
    // Branches
    // ------------------------------------------------------------------

    /**
     * Highlights the innermost loop or switch an unlabeled {@code break}
     * leaves. Type switches are passed over.
     */
    public void unlabeledBreak(EnclosingPath path, HighlightSet result) {
        for (Node node : path.getNodes()) {
            if (isLoop(node)) {
                loop(path, result);
                return;
            }
            if (node instanceof SwitchStmt) {
                switchFlow(path, result);
                return;
            }
            if (node instanceof SelectStmt) {
                // breaking out of a select is not highlighted
                return;
            }
        }
    }

    /**
     * Highlights the statement a labeled {@code break} or {@code continue}
     * leaves. Nothing is highlighted if the label is unresolved.
     *
     * @param loopsOnly whether only loops are valid targets, as for {@code continue}
     */
    public void labeled(EnclosingPath path, BranchStmt branch, boolean loopsOnly, HighlightSet result) {
        LabeledStmt labeled = labels.findEnclosing(path, branch);
        if (labeled == null) {
            return;
        }
        Stmt target = labeled.getStmt();
        EnclosingPath targetPath = EnclosingPath.of(target, labeled);
        if (isLoop(target)) {
            loop(targetPath, result);
        } else if (target instanceof SwitchStmt && !loopsOnly) {
            switchFlow(targetPath, result);
        }
    }

    // ------------------------------------------------------------------
    // Loops
    // ------------------------------------------------------------------

    /**
     * Highlights the {@code for} keyword of the enclosing loop and the
     * {@code break} and {@code continue} statements that leave it.
     */
    public void loop(EnclosingPath path, HighlightSet result) {
        Node loop = null;
        Ident loopLabel = null;
        Ident stmtLabel = LabelResolver.labelFor(path, 0);
        for (int i = 0; i < path.size(); i++) {
            Node node = path.get(i);
            if (isLoop(node)) {
                Ident label = LabelResolver.labelFor(path, i);
                if (stmtLabel == null || label == stmtLabel) {
                    loop = node;
                    loopLabel = label;
                    break;
                }
            }
        }
        if (loop == null) {
            return;
        }
        result.add(PosRange.ofLength(loop.getStart(), FOR_KEYWORD_LENGTH));

        Node target = loop;
        Ident targetLabel = loopLabel;
        // break and continue directly inside this loop; nested loops, switches and selects have their own break
        Inspector.inspect(target, node -> {
            if (isLoop(node)) {
                return node == target ? Visit.CONTINUE : Visit.SKIP;
            }
            if (node instanceof SwitchStmt || node instanceof SelectStmt) {
                return Visit.SKIP;
            }
            if (node instanceof BranchStmt && leavesLoop((BranchStmt) node, targetLabel)) {
                result.add(node);
            }
            return Visit.CONTINUE;
        });

        // continue inside nested switches and selects
        Inspector.inspect(target, node -> {
            if (isLoop(node)) {
                return node == target ? Visit.CONTINUE : Visit.SKIP;
            }
            if (node instanceof BranchStmt && ((BranchStmt) node).getTok() == Token.CONTINUE
                    && leavesLoop((BranchStmt) node, targetLabel)) {
                result.add(node);
            }
            return Visit.CONTINUE;
        });

        if (targetLabel != null) {
            highlightLabeledBranches(target, targetLabel, false, result);
        }
    }

    private boolean leavesLoop(BranchStmt branch, Ident loopLabel) {
        Token tok = branch.getTok();
        if (tok != Token.BREAK && tok != Token.CONTINUE) {
            return false;
        }
        return branch.getLabel() == null || labels.targets(branch, loopLabel);
    }

    private static boolean isLoop(Node node) {
        return node instanceof ForStmt || node instanceof RangeStmt;
    }

    // ------------------------------------------------------------------
    // Switches
    // ------------------------------------------------------------------

    /**
     * Highlights the {@code switch} keyword of the enclosing switch and the
     * {@code break} statements that leave it.
     */
    public void switchFlow(EnclosingPath path, HighlightSet result) {
        Node switchNode = null;
        Ident switchLabel = null;
        Ident stmtLabel = LabelResolver.labelFor(path, 0);
        for (int i = 0; i < path.size(); i++) {
            Node node = path.get(i);
            if (node instanceof SwitchStmt) {
                Ident label = LabelResolver.labelFor(path, i);
                if (stmtLabel == null || label == stmtLabel) {
                    switchNode = node;
                    switchLabel = label;
                    break;
                }
            }
        }
        if (switchNode == null) {
            return;
        }
        result.add(PosRange.ofLength(switchNode.getStart(), SWITCH_KEYWORD_LENGTH));

        Node target = switchNode;
        Ident targetLabel = switchLabel;
        Inspector.inspect(target, node -> {
            if (node instanceof SwitchStmt) {
                return node == target ? Visit.CONTINUE : Visit.SKIP;
            }
            if (isLoop(node) || node instanceof SelectStmt) {
                return Visit.SKIP;
            }
            if (node instanceof BranchStmt) {
                BranchStmt branch = (BranchStmt) node;
                if (branch.getTok() == Token.BREAK
                        && (branch.getLabel() == null || labels.targets(branch, targetLabel))) {
                    result.add(node);
                }
            }
            return Visit.CONTINUE;
        });

        if (targetLabel != null) {
            highlightLabeledBranches(target, targetLabel, true, result);
        }
    }

    /** Finds branches naming {@code label} at any depth below {@code root}. */
    private void highlightLabeledBranches(Node root, Ident label, boolean breakOnly, HighlightSet result) {
        Inspector.inspect(root, node -> {
            if (node instanceof BranchStmt) {
                BranchStmt branch = (BranchStmt) node;
                boolean relevant = breakOnly ? branch.getTok() == Token.BREAK
                        : branch.getTok() == Token.BREAK || branch.getTok() == Token.CONTINUE;
                if (relevant && labels.targets(branch, label)) {
                    result.add(node);
                }
            }
            return Visit.CONTINUE;
        });
    }
}
