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

import java.util.HashMap;
import java.util.Map;

/**
 * Lexical tokens of the source language. Operator precedence follows the
 * Go specification (5 binds tightest, 0 means "not a binary operator").
 */
public enum Token {
    ILLEGAL("ILLEGAL"),
    EOF("EOF"),

    IDENT("IDENT"),
    INT("INT"),
    FLOAT("FLOAT"),
    CHAR("CHAR"),
    STRING("STRING"),

    ADD("+", 4),
    SUB("-", 4),
    MUL("*", 5),
    QUO("/", 5),
    REM("%", 5),
    AND("&", 5),
    OR("|", 4),
    XOR("^", 4),
    SHL("<<", 5),
    SHR(">>", 5),
    AND_NOT("&^", 5),

    ADD_ASSIGN("+="),
    SUB_ASSIGN("-="),
    MUL_ASSIGN("*="),
    QUO_ASSIGN("/="),
    REM_ASSIGN("%="),
    AND_ASSIGN("&="),
    OR_ASSIGN("|="),
    XOR_ASSIGN("^="),
    SHL_ASSIGN("<<="),
    SHR_ASSIGN(">>="),
    AND_NOT_ASSIGN("&^="),

    LAND("&&", 2),
    LOR("||", 1),
    ARROW("<-"),
    TILDE("~"),
    INC("++"),
    DEC("--"),

    EQL("==", 3),
    LSS("<", 3),
    GTR(">", 3),
    ASSIGN("="),
    NOT("!"),
    NEQ("!=", 3),
    LEQ("<=", 3),
    GEQ(">=", 3),
    DEFINE(":="),
    ELLIPSIS("..."),

    LPAREN("("),
    LBRACK("["),
    LBRACE("{"),
    COMMA(","),
    PERIOD("."),
    RPAREN(")"),
    RBRACK("]"),
    RBRACE("}"),
    SEMICOLON(";"),
    COLON(":"),

    BREAK("break"),
    CASE("case"),
    CHAN("chan"),
    CONST("const"),
    CONTINUE("continue"),
    DEFAULT("default"),
    DEFER("defer"),
    ELSE("else"),
    FALLTHROUGH("fallthrough"),
    FOR("for"),
    FUNC("func"),
    GO("go"),
    GOTO("goto"),
    IF("if"),
    IMPORT("import"),
    INTERFACE("interface"),
    MAP("map"),
    PACKAGE("package"),
    RANGE("range"),
    RETURN("return"),
    SELECT("select"),
    STRUCT("struct"),
    SWITCH("switch"),
    TYPE("type"),
    VAR("var");

    private static final Map<String, Token> KEYWORDS = new HashMap<>();

    static {
        for (Token token : values()) {
            if (token.ordinal() >= BREAK.ordinal()) {
                KEYWORDS.put(token.text, token);
            }
        }
    }

    private final String text;
    private final int precedence;

    Token(String text) {
        this(text, 0);
    }

    Token(String text, int precedence) {
        this.text = text;
        this.precedence = precedence;
    }

    public String getText() {
        return text;
    }

    public int getPrecedence() {
        return precedence;
    }

    public boolean isAssignOp() {
        return ordinal() >= ADD_ASSIGN.ordinal() && ordinal() <= AND_NOT_ASSIGN.ordinal();
    }

    /**
     * Returns the keyword token for {@code ident}, or {@link #IDENT} when the
     * identifier is not reserved.
     */
    public static Token lookup(String ident) {
        Token keyword = KEYWORDS.get(ident);
        return keyword != null ? keyword : IDENT;
    }

    @Override
    public String toString() {
        return text;
    }
}
