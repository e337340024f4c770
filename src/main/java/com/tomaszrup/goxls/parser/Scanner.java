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
package com.tomaszrup.goxls.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.tomaszrup.goxls.ast.Comment;
import com.tomaszrup.goxls.ast.Token;

/**
 * Tokenizer with automatic semicolon insertion: a newline (or end of file)
 * after an identifier, literal, {@code break}, {@code continue},
 * {@code fallthrough}, {@code return}, {@code ++}, {@code --}, {@code )},
 * {@code ]} or <code>}</code> yields a {@link Token#SEMICOLON} whose literal is
 * {@code "\n"}.
 */
final class Scanner {

    static final class Lexeme {
        final int pos;
        final Token tok;
        final String lit;

        Lexeme(int pos, Token tok, String lit) {
            this.pos = pos;
            this.tok = tok;
            this.lit = lit;
        }

        @Override
        public String toString() {
            return tok + "@" + pos;
        }
    }

    private final String src;
    private final List<SyntaxError> errors;
    private final List<Comment> comments = new ArrayList<>();
    private int offset;
    private boolean insertSemi;

    Scanner(String src, List<SyntaxError> errors) {
        this.src = src;
        this.errors = errors;
    }

    List<Comment> getComments() {
        return Collections.unmodifiableList(comments);
    }

    Lexeme scan() {
        while (true) {
            skipWhitespace();
            int pos = offset;
            if (offset >= src.length()) {
                if (insertSemi) {
                    insertSemi = false;
                    return new Lexeme(pos, Token.SEMICOLON, "\n");
                }
                return new Lexeme(pos, Token.EOF, "");
            }
            char ch = src.charAt(offset);
            if (ch == '/' && (peek(1) == '/' || peek(1) == '*')) {
                if (insertSemi && peek(1) == '*' && blockCommentSpansLines(pos)) {
                    insertSemi = false;
                    return new Lexeme(pos, Token.SEMICOLON, "\n");
                }
                scanComment(pos);
                continue;
            }

            Lexeme lexeme;
            boolean insert = false;
            if (isLetter(ch)) {
                String ident = scanIdentifier();
                Token tok = Token.lookup(ident);
                insert = tok == Token.IDENT || tok == Token.BREAK || tok == Token.CONTINUE
                        || tok == Token.FALLTHROUGH || tok == Token.RETURN;
                lexeme = new Lexeme(pos, tok, ident);
            } else if (isDigit(ch) || (ch == '.' && isDigit(peek(1)))) {
                lexeme = scanNumber(pos);
                insert = true;
            } else {
                offset++;
                Token tok;
                switch (ch) {
                    case '\n':
                        insertSemi = false;
                        return new Lexeme(pos, Token.SEMICOLON, "\n");
                    case '"':
                        scanQuoted(pos, '"', "string literal not terminated");
                        tok = Token.STRING;
                        insert = true;
                        break;
                    case '\'':
                        scanQuoted(pos, '\'', "rune literal not terminated");
                        tok = Token.CHAR;
                        insert = true;
                        break;
                    case '`':
                        scanRawString(pos);
                        tok = Token.STRING;
                        insert = true;
                        break;
                    case ':':
                        tok = accept('=') ? Token.DEFINE : Token.COLON;
                        break;
                    case '.':
                        if (peek(0) == '.' && peek(1) == '.') {
                            offset += 2;
                            tok = Token.ELLIPSIS;
                        } else {
                            tok = Token.PERIOD;
                        }
                        break;
                    case ',':
                        tok = Token.COMMA;
                        break;
                    case ';':
                        tok = Token.SEMICOLON;
                        break;
                    case '(':
                        tok = Token.LPAREN;
                        break;
                    case ')':
                        tok = Token.RPAREN;
                        insert = true;
                        break;
                    case '[':
                        tok = Token.LBRACK;
                        break;
                    case ']':
                        tok = Token.RBRACK;
                        insert = true;
                        break;
                    case '{':
                        tok = Token.LBRACE;
                        break;
                    case '}':
                        tok = Token.RBRACE;
                        insert = true;
                        break;
                    case '+':
                        if (accept('+')) {
                            tok = Token.INC;
                            insert = true;
                        } else {
                            tok = accept('=') ? Token.ADD_ASSIGN : Token.ADD;
                        }
                        break;
                    case '-':
                        if (accept('-')) {
                            tok = Token.DEC;
                            insert = true;
                        } else {
                            tok = accept('=') ? Token.SUB_ASSIGN : Token.SUB;
                        }
                        break;
                    case '*':
                        tok = accept('=') ? Token.MUL_ASSIGN : Token.MUL;
                        break;
                    case '/':
                        tok = accept('=') ? Token.QUO_ASSIGN : Token.QUO;
                        break;
                    case '%':
                        tok = accept('=') ? Token.REM_ASSIGN : Token.REM;
                        break;
                    case '^':
                        tok = accept('=') ? Token.XOR_ASSIGN : Token.XOR;
                        break;
                    case '~':
                        tok = Token.TILDE;
                        break;
                    case '<':
                        if (accept('-')) {
                            tok = Token.ARROW;
                        } else if (accept('<')) {
                            tok = accept('=') ? Token.SHL_ASSIGN : Token.SHL;
                        } else {
                            tok = accept('=') ? Token.LEQ : Token.LSS;
                        }
                        break;
                    case '>':
                        if (accept('>')) {
                            tok = accept('=') ? Token.SHR_ASSIGN : Token.SHR;
                        } else {
                            tok = accept('=') ? Token.GEQ : Token.GTR;
                        }
                        break;
                    case '=':
                        tok = accept('=') ? Token.EQL : Token.ASSIGN;
                        break;
                    case '!':
                        tok = accept('=') ? Token.NEQ : Token.NOT;
                        break;
                    case '&':
                        if (accept('^')) {
                            tok = accept('=') ? Token.AND_NOT_ASSIGN : Token.AND_NOT;
                        } else if (accept('&')) {
                            tok = Token.LAND;
                        } else {
                            tok = accept('=') ? Token.AND_ASSIGN : Token.AND;
                        }
                        break;
                    case '|':
                        if (accept('|')) {
                            tok = Token.LOR;
                        } else {
                            tok = accept('=') ? Token.OR_ASSIGN : Token.OR;
                        }
                        break;
                    default:
                        errors.add(new SyntaxError(pos, "illegal character '" + ch + "'"));
                        tok = Token.ILLEGAL;
                        insert = insertSemi;
                        break;
                }
                lexeme = new Lexeme(pos, tok, src.substring(pos, offset));
            }
            insertSemi = insert;
            return lexeme;
        }
    }

    private void skipWhitespace() {
        while (offset < src.length()) {
            char ch = src.charAt(offset);
            if (ch == ' ' || ch == '\t' || ch == '\r' || (ch == '\n' && !insertSemi)) {
                offset++;
            } else {
                break;
            }
        }
    }

    private boolean blockCommentSpansLines(int pos) {
        int close = src.indexOf("*/", pos + 2);
        int newline = src.indexOf('\n', pos + 2);
        return newline >= 0 && (close < 0 || newline < close);
    }

    private void scanComment(int pos) {
        if (peek(1) == '/') {
            int newline = src.indexOf('\n', pos);
            offset = newline < 0 ? src.length() : newline;
        } else {
            int close = src.indexOf("*/", pos + 2);
            if (close < 0) {
                errors.add(new SyntaxError(pos, "comment not terminated"));
                offset = src.length();
            } else {
                offset = close + 2;
            }
        }
        comments.add(new Comment(pos, src.substring(pos, offset)));
    }

    private String scanIdentifier() {
        int start = offset;
        while (offset < src.length() && (isLetter(src.charAt(offset)) || isDigit(src.charAt(offset)))) {
            offset++;
        }
        return src.substring(start, offset);
    }

    private Lexeme scanNumber(int pos) {
        boolean isFloat = false;
        if (peek(0) == '0' && (peek(1) == 'x' || peek(1) == 'X')) {
            offset += 2;
            while (isHexDigit(peek(0)) || peek(0) == '_') {
                offset++;
            }
        } else {
            skipDecimals();
            if (peek(0) == '.') {
                isFloat = true;
                offset++;
                skipDecimals();
            }
            if (peek(0) == 'e' || peek(0) == 'E') {
                isFloat = true;
                offset++;
                if (peek(0) == '+' || peek(0) == '-') {
                    offset++;
                }
                skipDecimals();
            }
        }
        return new Lexeme(pos, isFloat ? Token.FLOAT : Token.INT, src.substring(pos, offset));
    }

    private void skipDecimals() {
        while (isDigit(peek(0)) || peek(0) == '_') {
            offset++;
        }
    }

    private void scanQuoted(int pos, char quote, String unterminated) {
        while (true) {
            if (offset >= src.length() || src.charAt(offset) == '\n') {
                errors.add(new SyntaxError(pos, unterminated));
                return;
            }
            char ch = src.charAt(offset++);
            if (ch == quote) {
                return;
            }
            if (ch == '\\' && offset < src.length() && src.charAt(offset) != '\n') {
                offset++;
            }
        }
    }

    private void scanRawString(int pos) {
        int close = src.indexOf('`', offset);
        if (close < 0) {
            errors.add(new SyntaxError(pos, "raw string literal not terminated"));
            offset = src.length();
        } else {
            offset = close + 1;
        }
    }

    private boolean accept(char expected) {
        if (offset < src.length() && src.charAt(offset) == expected) {
            offset++;
            return true;
        }
        return false;
    }

    private char peek(int ahead) {
        int index = offset + ahead;
        return index < src.length() ? src.charAt(index) : '\0';
    }

    private static boolean isLetter(char ch) {
        return ch == '_' || Character.isLetter(ch);
    }

    private static boolean isDigit(char ch) {
        return ch >= '0' && ch <= '9';
    }

    private static boolean isHexDigit(char ch) {
        return isDigit(ch) || (ch >= 'a' && ch <= 'f') || (ch >= 'A' && ch <= 'F');
    }
}
