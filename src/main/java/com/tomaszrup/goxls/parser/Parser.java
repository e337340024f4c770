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
import java.util.Comparator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.goxls.ast.ArrayType;
import com.tomaszrup.goxls.ast.AssignStmt;
import com.tomaszrup.goxls.ast.BasicLit;
import com.tomaszrup.goxls.ast.BinaryExpr;
import com.tomaszrup.goxls.ast.BlockStmt;
import com.tomaszrup.goxls.ast.BranchStmt;
import com.tomaszrup.goxls.ast.CallExpr;
import com.tomaszrup.goxls.ast.CaseClause;
import com.tomaszrup.goxls.ast.ChanType;
import com.tomaszrup.goxls.ast.CommClause;
import com.tomaszrup.goxls.ast.CompositeLit;
import com.tomaszrup.goxls.ast.DeclStmt;
import com.tomaszrup.goxls.ast.DeferStmt;
import com.tomaszrup.goxls.ast.Ellipsis;
import com.tomaszrup.goxls.ast.EmptyStmt;
import com.tomaszrup.goxls.ast.Expr;
import com.tomaszrup.goxls.ast.ExprStmt;
import com.tomaszrup.goxls.ast.Field;
import com.tomaszrup.goxls.ast.FieldList;
import com.tomaszrup.goxls.ast.ForStmt;
import com.tomaszrup.goxls.ast.FuncDecl;
import com.tomaszrup.goxls.ast.FuncLit;
import com.tomaszrup.goxls.ast.FuncType;
import com.tomaszrup.goxls.ast.GenDecl;
import com.tomaszrup.goxls.ast.GoStmt;
import com.tomaszrup.goxls.ast.Ident;
import com.tomaszrup.goxls.ast.IfStmt;
import com.tomaszrup.goxls.ast.ImportSpec;
import com.tomaszrup.goxls.ast.IncDecStmt;
import com.tomaszrup.goxls.ast.IndexExpr;
import com.tomaszrup.goxls.ast.IndexListExpr;
import com.tomaszrup.goxls.ast.InterfaceType;
import com.tomaszrup.goxls.ast.KeyValueExpr;
import com.tomaszrup.goxls.ast.LabeledStmt;
import com.tomaszrup.goxls.ast.MapType;
import com.tomaszrup.goxls.ast.Node;
import com.tomaszrup.goxls.ast.ParenExpr;
import com.tomaszrup.goxls.ast.RangeStmt;
import com.tomaszrup.goxls.ast.ReturnStmt;
import com.tomaszrup.goxls.ast.SelectStmt;
import com.tomaszrup.goxls.ast.SelectorExpr;
import com.tomaszrup.goxls.ast.SendStmt;
import com.tomaszrup.goxls.ast.SliceExpr;
import com.tomaszrup.goxls.ast.SourceFile;
import com.tomaszrup.goxls.ast.StarExpr;
import com.tomaszrup.goxls.ast.Stmt;
import com.tomaszrup.goxls.ast.StructType;
import com.tomaszrup.goxls.ast.SwitchStmt;
import com.tomaszrup.goxls.ast.Token;
import com.tomaszrup.goxls.ast.TypeAssertExpr;
import com.tomaszrup.goxls.ast.TypeSpec;
import com.tomaszrup.goxls.ast.TypeSwitchStmt;
import com.tomaszrup.goxls.ast.UnaryExpr;
import com.tomaszrup.goxls.ast.ValueSpec;

/**
 * Recursive-descent parser producing a {@link SourceFile}. Syntax errors are
 * collected, never thrown: a malformed statement or declaration is dropped
 * and parsing resumes at the next statement or declaration boundary.
 */
public final class Parser {
    private static final Logger logger = LoggerFactory.getLogger(Parser.class);

    /** Unwinds to the nearest statement or declaration boundary. */
    private static final class Bailout extends RuntimeException {
        private static final long serialVersionUID = 1L;

        Bailout() {
            super(null, null, false, false);
        }
    }

    private enum SimpleStmtMode {
        BASIC,
        LABEL_OK,
        RANGE_OK
    }

    private final String src;
    private final ParseConfig config;
    private final List<SyntaxError> errors = new ArrayList<>();
    private final Scanner scanner;

    private int pos;
    private Token tok;
    private String lit;

    // < 0 inside control clauses, where a '{' ends the expression
    private int exprLev;

    // set while parsing a switch header, the only place '.(type)' may appear
    private boolean typeSwitchHeader;

    private Parser(String src, ParseConfig config) {
        this.src = src;
        this.config = config;
        this.scanner = new Scanner(src, errors);
        next();
    }

    public static ParseResult parse(String text, ParseConfig config) {
        Parser parser = new Parser(text, config);
        SourceFile file = parser.parseFile();
        parser.errors.sort(Comparator.comparingInt(SyntaxError::getOffset));
        if (logger.isDebugEnabled()) {
            logger.debug("Parsed {} chars ({}): {} declarations, {} comments, {} syntax errors",
                    text.length(), config.getMode(), file.getDecls().size(), file.getComments().size(),
                    parser.errors.size());
        }
        return new ParseResult(file, parser.errors, config.getMode());
    }

    // ------------------------------------------------------------------
    // Tokens and errors
    // ------------------------------------------------------------------

    private void next() {
        Scanner.Lexeme lexeme;
        do {
            lexeme = scanner.scan();
        } while (lexeme.tok == Token.ILLEGAL);
        pos = lexeme.pos;
        tok = lexeme.tok;
        lit = lexeme.lit;
    }

    private void report(int at, String message) {
        errors.add(new SyntaxError(at, message));
    }

    private Bailout error(int at, String message) {
        report(at, message);
        throw new Bailout();
    }

    private Bailout errorExpected(String what) {
        throw error(pos, "expected " + what + ", found " + describeCurrent());
    }

    private String describeCurrent() {
        if (tok == Token.SEMICOLON && "\n".equals(lit)) {
            return "newline";
        }
        switch (tok) {
            case EOF:
                return "EOF";
            case IDENT:
            case INT:
            case FLOAT:
            case CHAR:
            case STRING:
                return lit;
            default:
                return "'" + tok.getText() + "'";
        }
    }

    private int expect(Token expected) {
        int at = pos;
        if (tok != expected) {
            errorExpected("'" + expected.getText() + "'");
        }
        next();
        return at;
    }

    /** A semicolon is optional before a closing ')' or '}'. */
    private void expectSemi() {
        if (tok == Token.RPAREN || tok == Token.RBRACE) {
            return;
        }
        if (tok != Token.SEMICOLON) {
            errorExpected("';'");
        }
        next();
    }

    private void syncDecl() {
        int depth = 0;
        boolean afterSemi = true;
        while (tok != Token.EOF) {
            if (depth == 0 && afterSemi && isDeclStart(tok)) {
                return;
            }
            if (tok == Token.LBRACE || tok == Token.LPAREN) {
                depth++;
            } else if ((tok == Token.RBRACE || tok == Token.RPAREN) && depth > 0) {
                depth--;
            }
            afterSemi = tok == Token.SEMICOLON;
            next();
        }
    }

    private void syncStmt() {
        int depth = 0;
        while (tok != Token.EOF) {
            switch (tok) {
                case LBRACE:
                case LPAREN:
                case LBRACK:
                    depth++;
                    break;
                case RBRACE:
                    if (depth == 0) {
                        return;
                    }
                    depth--;
                    break;
                case RPAREN:
                case RBRACK:
                    if (depth > 0) {
                        depth--;
                    }
                    break;
                case SEMICOLON:
                    if (depth == 0) {
                        next();
                        return;
                    }
                    break;
                case CASE:
                case DEFAULT:
                    if (depth == 0) {
                        return;
                    }
                    break;
                default:
                    break;
            }
            next();
        }
    }

    private static boolean isDeclStart(Token token) {
        return token == Token.FUNC || token == Token.VAR || token == Token.CONST
                || token == Token.TYPE || token == Token.IMPORT;
    }

    // ------------------------------------------------------------------
    // Declarations
    // ------------------------------------------------------------------

    private SourceFile parseFile() {
        Ident packageName = null;
        List<Node> decls = new ArrayList<>();
        try {
            expect(Token.PACKAGE);
            packageName = parseIdent();
            expectSemi();
        } catch (Bailout e) {
            syncDecl();
        }

        while (tok == Token.IMPORT) {
            int before = pos;
            try {
                decls.add(parseGenDecl(Token.IMPORT));
                expectSemi();
            } catch (Bailout e) {
                recoverDecl(before);
            }
        }

        if (config.getMode() == ParseMode.FULL) {
            while (tok != Token.EOF) {
                int before = pos;
                try {
                    decls.add(parseDecl());
                } catch (Bailout e) {
                    recoverDecl(before);
                }
            }
        }
        return new SourceFile(src.length(), packageName, decls, scanner.getComments());
    }

    private void recoverDecl(int before) {
        syncDecl();
        if (pos == before && tok != Token.EOF) {
            next();
        }
    }

    private Node parseDecl() {
        switch (tok) {
            case FUNC:
                return parseFuncDecl();
            case VAR:
            case CONST:
            case TYPE: {
                GenDecl decl = parseGenDecl(tok);
                expectSemi();
                return decl;
            }
            case IMPORT: {
                report(pos, "imports must appear before other declarations");
                GenDecl decl = parseGenDecl(Token.IMPORT);
                expectSemi();
                return decl;
            }
            default:
                throw errorExpected("declaration");
        }
    }

    private GenDecl parseGenDecl(Token keyword) {
        int tokPos = expect(keyword);
        List<Node> specs = new ArrayList<>();
        if (tok == Token.LPAREN) {
            int lparen = pos;
            next();
            while (tok != Token.RPAREN && tok != Token.EOF) {
                specs.add(parseSpec(keyword));
                expectSemi();
            }
            int rparen = expect(Token.RPAREN);
            return new GenDecl(tokPos, keyword, lparen, specs, rparen);
        }
        specs.add(parseSpec(keyword));
        return new GenDecl(tokPos, keyword, -1, specs, -1);
    }

    private Node parseSpec(Token keyword) {
        switch (keyword) {
            case IMPORT:
                return parseImportSpec();
            case TYPE:
                return parseTypeSpec();
            default:
                return parseValueSpec();
        }
    }

    private ImportSpec parseImportSpec() {
        Ident name = null;
        if (tok == Token.IDENT) {
            name = parseIdent();
        } else if (tok == Token.PERIOD) {
            name = new Ident(pos, ".");
            next();
        }
        if (tok != Token.STRING) {
            errorExpected("import path");
        }
        BasicLit path = new BasicLit(pos, Token.STRING, lit);
        next();
        return new ImportSpec(name, path);
    }

    private ValueSpec parseValueSpec() {
        List<Ident> names = parseIdentList();
        Expr type = null;
        List<Expr> values = Collections.emptyList();
        if (tok != Token.ASSIGN && tok != Token.SEMICOLON && tok != Token.RPAREN) {
            type = parseType();
        }
        if (tok == Token.ASSIGN) {
            next();
            values = parseExprList();
        }
        return new ValueSpec(names, type, values);
    }

    /**
     * After {@code type T [}, an identifier followed by another type-ish token
     * starts a type parameter list; anything else is an array length.
     */
    private TypeSpec parseTypeSpec() {
        Ident name = parseIdent();
        if (tok == Token.LBRACK) {
            int lbrack = pos;
            next();
            if (tok != Token.IDENT) {
                return new TypeSpec(name, null, parseArrayType(lbrack));
            }
            Ident first = parseIdent();
            if (!startsTypeParam(tok)) {
                Expr length;
                exprLev++;
                try {
                    length = parseBinaryTail(parsePrimarySuffix(first), 1);
                } finally {
                    exprLev--;
                }
                expect(Token.RBRACK);
                return new TypeSpec(name, null, new ArrayType(lbrack, length, parseType()));
            }
            FieldList typeParams = parseTypeParams(lbrack, first);
            return new TypeSpec(name, typeParams, parseType());
        }
        if (tok == Token.ASSIGN) {
            next();
        }
        return new TypeSpec(name, null, parseType());
    }

    private static boolean startsTypeParam(Token token) {
        switch (token) {
            case IDENT:
            case COMMA:
            case TILDE:
            case LBRACK:
            case MAP:
            case CHAN:
            case FUNC:
            case STRUCT:
            case INTERFACE:
                return true;
            default:
                return false;
        }
    }

    /** {@code [K comparable, V any]}, with the opening bracket and first name consumed. */
    private FieldList parseTypeParams(int lbrack, Ident first) {
        List<Field> fields = new ArrayList<>();
        List<Ident> names = new ArrayList<>();
        names.add(first);
        while (true) {
            while (tok == Token.COMMA) {
                next();
                names.add(parseIdent());
            }
            fields.add(new Field(names, parseConstraint(), null));
            if (tok != Token.COMMA) {
                break;
            }
            next();
            if (tok == Token.RBRACK) {
                break;
            }
            names = new ArrayList<>();
            names.add(parseIdent());
        }
        int rbrack = expect(Token.RBRACK);
        return new FieldList(lbrack, fields, rbrack);
    }

    /** A union of constraint terms: {@code ~int | ~string | fmt.Stringer}. */
    private Expr parseConstraint() {
        return parseUnionTail(parseConstraintTerm());
    }

    private Expr parseUnionTail(Expr x) {
        while (tok == Token.OR) {
            next();
            x = new BinaryExpr(x, Token.OR, parseConstraintTerm());
        }
        return x;
    }

    private Expr parseConstraintTerm() {
        if (tok == Token.TILDE) {
            int tilde = pos;
            next();
            return new UnaryExpr(tilde, Token.TILDE, parseType());
        }
        return parseType();
    }

    private FuncDecl parseFuncDecl() {
        int funcPos = expect(Token.FUNC);
        FieldList receiver = null;
        if (tok == Token.LPAREN) {
            receiver = parseParameters();
        }
        Ident name = parseIdent();
        FieldList typeParams = null;
        if (tok == Token.LBRACK) {
            int lbrack = pos;
            next();
            typeParams = parseTypeParams(lbrack, parseIdent());
        }
        FieldList params = parseParameters();
        FieldList results = parseResult();
        BlockStmt body = null;
        if (tok == Token.LBRACE) {
            body = parseBlockStmt();
        }
        expectSemi();
        return new FuncDecl(receiver, name, new FuncType(funcPos, typeParams, params, results), body);
    }

    private FieldList parseParameters() {
        int lparen = expect(Token.LPAREN);
        List<Field> fields = Collections.emptyList();
        if (tok != Token.RPAREN) {
            fields = parseParameterList();
        }
        int rparen = expect(Token.RPAREN);
        return new FieldList(lparen, fields, rparen);
    }

    /**
     * Parses {@code (a, b int, c string)} as well as {@code (int, string)}.
     * Each entry is first read as "type" or "name type"; if any entry has a
     * name, the bare entries before it are names sharing its type.
     */
    private List<Field> parseParameterList() {
        List<Ident> names = new ArrayList<>();
        List<Expr> types = new ArrayList<>();
        while (true) {
            Ident name = null;
            Expr type;
            if (tok == Token.IDENT) {
                Ident id = parseIdent();
                if (tok == Token.PERIOD) {
                    next();
                    type = new SelectorExpr(id, parseIdent());
                } else if (startsType(tok) || tok == Token.ELLIPSIS) {
                    name = id;
                    type = parseParamType();
                } else {
                    type = id;
                }
            } else {
                type = parseParamType();
            }
            names.add(name);
            types.add(type);
            if (tok != Token.COMMA) {
                break;
            }
            next();
            if (tok == Token.RPAREN) {
                break;
            }
        }

        List<Field> fields = new ArrayList<>();
        boolean named = false;
        for (Ident name : names) {
            named |= name != null;
        }
        if (!named) {
            for (Expr type : types) {
                fields.add(new Field(Collections.emptyList(), type, null));
            }
            return fields;
        }
        List<Ident> pending = new ArrayList<>();
        for (int i = 0; i < types.size(); i++) {
            if (names.get(i) == null) {
                if (!(types.get(i) instanceof Ident)) {
                    throw error(types.get(i).getStart(), "mixed named and unnamed parameters");
                }
                pending.add((Ident) types.get(i));
            } else {
                pending.add(names.get(i));
                fields.add(new Field(pending, types.get(i), null));
                pending = new ArrayList<>();
            }
        }
        if (!pending.isEmpty()) {
            throw error(pending.get(0).getStart(), "mixed named and unnamed parameters");
        }
        return fields;
    }

    private Expr parseParamType() {
        if (tok == Token.ELLIPSIS) {
            int start = pos;
            next();
            return new Ellipsis(start, parseType());
        }
        return parseType();
    }

    private FieldList parseResult() {
        if (tok == Token.LPAREN) {
            return parseParameters();
        }
        if (startsType(tok) && tok != Token.LPAREN) {
            Expr type = parseType();
            return new FieldList(-1, Collections.singletonList(new Field(Collections.emptyList(), type, null)), -1);
        }
        return null;
    }

    private static boolean startsType(Token token) {
        switch (token) {
            case IDENT:
            case MUL:
            case LBRACK:
            case MAP:
            case CHAN:
            case FUNC:
            case STRUCT:
            case INTERFACE:
            case ARROW:
            case LPAREN:
                return true;
            default:
                return false;
        }
    }

    // ------------------------------------------------------------------
    // Types
    // ------------------------------------------------------------------

    private Expr parseType() {
        int start = pos;
        switch (tok) {
            case IDENT: {
                Ident id = parseIdent();
                Expr type = id;
                if (tok == Token.PERIOD) {
                    next();
                    type = new SelectorExpr(id, parseIdent());
                }
                if (tok == Token.LBRACK) {
                    type = parseTypeArgs(type);
                }
                return type;
            }
            case MUL:
                next();
                return new StarExpr(start, parseType());
            case LBRACK:
                next();
                return parseArrayType(start);
            case MAP: {
                next();
                expect(Token.LBRACK);
                Expr key = parseType();
                expect(Token.RBRACK);
                return new MapType(start, key, parseType());
            }
            case CHAN:
                next();
                if (tok == Token.ARROW) {
                    next();
                }
                return new ChanType(start, parseType());
            case ARROW:
                next();
                expect(Token.CHAN);
                return new ChanType(start, parseType());
            case FUNC: {
                next();
                FieldList params = parseParameters();
                return new FuncType(start, params, parseResult());
            }
            case STRUCT:
                return parseStructType();
            case INTERFACE:
                return parseInterfaceType();
            case LPAREN: {
                next();
                Expr type = parseType();
                int rparen = expect(Token.RPAREN);
                return new ParenExpr(start, type, rparen);
            }
            default:
                throw errorExpected("type");
        }
    }

    /** {@code [N]T}, {@code [...]T} or {@code []T} after the opening bracket. */
    private ArrayType parseArrayType(int lbrack) {
        Expr length = null;
        if (tok == Token.ELLIPSIS) {
            length = new Ellipsis(pos, null);
            next();
        } else if (tok != Token.RBRACK) {
            length = parseExpr();
        }
        expect(Token.RBRACK);
        return new ArrayType(lbrack, length, parseType());
    }

    /** Instantiates a generic type: {@code List[T]}, {@code Map[K, V]}. */
    private Expr parseTypeArgs(Expr type) {
        expect(Token.LBRACK);
        List<Expr> args = new ArrayList<>();
        args.add(parseType());
        while (tok == Token.COMMA) {
            next();
            if (tok == Token.RBRACK) {
                break;
            }
            args.add(parseType());
        }
        int rbrack = expect(Token.RBRACK);
        if (args.size() == 1) {
            return new IndexExpr(type, args.get(0), rbrack);
        }
        return new IndexListExpr(type, args, rbrack);
    }

    private StructType parseStructType() {
        int start = expect(Token.STRUCT);
        int lbrace = expect(Token.LBRACE);
        List<Field> fields = new ArrayList<>();
        while (tok != Token.RBRACE && tok != Token.EOF) {
            fields.add(parseFieldDecl());
            expectSemi();
        }
        int rbrace = expect(Token.RBRACE);
        return new StructType(start, new FieldList(lbrace, fields, rbrace));
    }

    private Field parseFieldDecl() {
        List<Ident> names = new ArrayList<>();
        Expr type;
        if (tok == Token.IDENT) {
            Ident id = parseIdent();
            if (tok == Token.PERIOD) {
                next();
                type = new SelectorExpr(id, parseIdent());
            } else if (tok == Token.SEMICOLON || tok == Token.RBRACE || tok == Token.STRING) {
                type = id;
            } else {
                names.add(id);
                while (tok == Token.COMMA) {
                    next();
                    names.add(parseIdent());
                }
                type = parseType();
            }
        } else if (tok == Token.MUL) {
            int star = pos;
            next();
            type = new StarExpr(star, parseType());
        } else {
            throw errorExpected("field name or embedded type");
        }
        BasicLit tag = null;
        if (tok == Token.STRING) {
            tag = new BasicLit(pos, Token.STRING, lit);
            next();
        }
        return new Field(names, type, tag);
    }

    private InterfaceType parseInterfaceType() {
        int start = expect(Token.INTERFACE);
        int lbrace = expect(Token.LBRACE);
        List<Field> methods = new ArrayList<>();
        while (tok != Token.RBRACE && tok != Token.EOF) {
            if (tok != Token.IDENT) {
                // type set element such as ~int | ~string
                methods.add(new Field(Collections.emptyList(), parseConstraint(), null));
                expectSemi();
                continue;
            }
            Ident id = parseIdent();
            if (tok == Token.LPAREN) {
                FieldList params = parseParameters();
                FuncType signature = new FuncType(-1, params, parseResult());
                methods.add(new Field(Collections.singletonList(id), signature, null));
            } else {
                Expr embedded = id;
                if (tok == Token.PERIOD) {
                    next();
                    embedded = new SelectorExpr(id, parseIdent());
                }
                if (tok == Token.LBRACK) {
                    embedded = parseTypeArgs(embedded);
                }
                methods.add(new Field(Collections.emptyList(), parseUnionTail(embedded), null));
            }
            expectSemi();
        }
        int rbrace = expect(Token.RBRACE);
        return new InterfaceType(start, new FieldList(lbrace, methods, rbrace));
    }

    // ------------------------------------------------------------------
    // Statements
    // ------------------------------------------------------------------

    private List<Stmt> parseStmtList() {
        List<Stmt> list = new ArrayList<>();
        while (tok != Token.CASE && tok != Token.DEFAULT && tok != Token.RBRACE && tok != Token.EOF) {
            if (tok == Token.SEMICOLON) {
                next();
                continue;
            }
            int before = pos;
            try {
                list.add(parseStmt());
                if (tok != Token.RBRACE && tok != Token.CASE && tok != Token.DEFAULT && tok != Token.EOF) {
                    if (tok != Token.SEMICOLON) {
                        errorExpected("';'");
                    }
                    next();
                }
            } catch (Bailout e) {
                syncStmt();
                if (pos == before && tok != Token.EOF && tok != Token.RBRACE
                        && tok != Token.CASE && tok != Token.DEFAULT) {
                    next();
                }
            }
        }
        return list;
    }

    private Stmt parseStmt() {
        switch (tok) {
            case CONST:
            case TYPE:
            case VAR:
                return new DeclStmt(parseGenDecl(tok));
            case IDENT:
            case INT:
            case FLOAT:
            case CHAR:
            case STRING:
            case FUNC:
            case LPAREN:
            case LBRACK:
            case STRUCT:
            case MAP:
            case CHAN:
            case INTERFACE:
            case ADD:
            case SUB:
            case MUL:
            case AND:
            case XOR:
            case ARROW:
            case NOT:
                return parseSimpleStmt(SimpleStmtMode.LABEL_OK);
            case GO: {
                int goPos = pos;
                next();
                return new GoStmt(goPos, parseCallExpr("go"));
            }
            case DEFER: {
                int deferPos = pos;
                next();
                return new DeferStmt(deferPos, parseCallExpr("defer"));
            }
            case RETURN: {
                int returnPos = pos;
                next();
                List<Expr> results = Collections.emptyList();
                if (tok != Token.SEMICOLON && tok != Token.RBRACE) {
                    results = parseExprList();
                }
                return new ReturnStmt(returnPos, results);
            }
            case BREAK:
            case CONTINUE:
            case GOTO:
            case FALLTHROUGH: {
                int tokPos = pos;
                Token branch = tok;
                next();
                Ident label = null;
                if (branch != Token.FALLTHROUGH && tok == Token.IDENT) {
                    label = parseIdent();
                }
                return new BranchStmt(tokPos, branch, label);
            }
            case LBRACE:
                return parseBlockStmt();
            case IF:
                return parseIfStmt();
            case SWITCH:
                return parseSwitchStmt();
            case SELECT:
                return parseSelectStmt();
            case FOR:
                return parseForStmt();
            case RBRACE:
                return new EmptyStmt(pos);
            default:
                throw errorExpected("statement");
        }
    }

    private Stmt parseSimpleStmt(SimpleStmtMode mode) {
        List<Expr> lhs = parseExprList();

        if (tok == Token.DEFINE || tok == Token.ASSIGN || tok.isAssignOp()) {
            int tokPos = pos;
            Token assign = tok;
            next();
            if (mode == SimpleStmtMode.RANGE_OK && tok == Token.RANGE
                    && (assign == Token.DEFINE || assign == Token.ASSIGN)) {
                int rangePos = pos;
                next();
                Expr x = parseExpr();
                return new AssignStmt(lhs, tokPos, assign,
                        Collections.singletonList(new UnaryExpr(rangePos, Token.RANGE, x)));
            }
            return new AssignStmt(lhs, tokPos, assign, parseExprList());
        }

        if (lhs.size() > 1) {
            throw error(lhs.get(0).getStart(), "expected 1 expression");
        }
        Expr x = lhs.get(0);
        switch (tok) {
            case COLON:
                if (mode == SimpleStmtMode.LABEL_OK && x instanceof Ident) {
                    next();
                    return new LabeledStmt((Ident) x, parseStmt());
                }
                break;
            case ARROW: {
                next();
                return new SendStmt(x, parseExpr());
            }
            case INC:
            case DEC: {
                IncDecStmt stmt = new IncDecStmt(x, pos, tok);
                next();
                return stmt;
            }
            default:
                break;
        }
        return new ExprStmt(x);
    }

    private CallExpr parseCallExpr(String keyword) {
        Expr x = parseExpr();
        if (!(x instanceof CallExpr)) {
            throw error(x.getStart(), "expression in " + keyword + " must be function call");
        }
        return (CallExpr) x;
    }

    private BlockStmt parseBlockStmt() {
        int lbrace = expect(Token.LBRACE);
        List<Stmt> list = parseStmtList();
        int rbrace = expect(Token.RBRACE);
        return new BlockStmt(lbrace, list, rbrace);
    }

    private Expr toCondition(Stmt stmt, String keyword) {
        if (stmt == null) {
            throw error(pos, "missing condition in " + keyword + " statement");
        }
        if (!(stmt instanceof ExprStmt)) {
            throw error(stmt.getStart(), "expected expression in " + keyword + " statement");
        }
        return ((ExprStmt) stmt).getX();
    }

    private IfStmt parseIfStmt() {
        int ifPos = expect(Token.IF);
        Stmt init = null;
        Expr cond;
        int outer = exprLev;
        exprLev = -1;
        try {
            Stmt stmt = null;
            if (tok != Token.LBRACE && tok != Token.SEMICOLON) {
                stmt = parseSimpleStmt(SimpleStmtMode.BASIC);
            }
            if (tok == Token.SEMICOLON) {
                next();
                init = stmt;
                stmt = null;
                if (tok != Token.LBRACE) {
                    stmt = parseSimpleStmt(SimpleStmtMode.BASIC);
                }
            }
            cond = toCondition(stmt, "if");
        } finally {
            exprLev = outer;
        }
        BlockStmt body = parseBlockStmt();
        Stmt elseStmt = null;
        if (tok == Token.ELSE) {
            next();
            if (tok == Token.IF) {
                elseStmt = parseIfStmt();
            } else if (tok == Token.LBRACE) {
                elseStmt = parseBlockStmt();
            } else {
                throw errorExpected("if statement or block");
            }
        }
        return new IfStmt(ifPos, init, cond, body, elseStmt);
    }

    private Stmt parseForStmt() {
        int forPos = expect(Token.FOR);
        Stmt init = null;
        Stmt cond = null;
        Stmt post = null;
        Expr bareRange = null;
        boolean isRange = false;

        int outer = exprLev;
        exprLev = -1;
        try {
            if (tok != Token.LBRACE) {
                if (tok != Token.SEMICOLON) {
                    if (tok == Token.RANGE) {
                        next();
                        bareRange = parseExpr();
                        isRange = true;
                    } else {
                        cond = parseSimpleStmt(SimpleStmtMode.RANGE_OK);
                        isRange = isRangeClause(cond);
                    }
                }
                if (!isRange && tok == Token.SEMICOLON) {
                    next();
                    init = cond;
                    cond = null;
                    if (tok != Token.SEMICOLON) {
                        cond = parseSimpleStmt(SimpleStmtMode.BASIC);
                    }
                    expect(Token.SEMICOLON);
                    if (tok != Token.LBRACE) {
                        post = parseSimpleStmt(SimpleStmtMode.BASIC);
                    }
                }
            }
        } finally {
            exprLev = outer;
        }
        BlockStmt body = parseBlockStmt();

        if (bareRange != null) {
            return new RangeStmt(forPos, null, null, Token.ILLEGAL, bareRange, body);
        }
        if (isRange) {
            AssignStmt clause = (AssignStmt) cond;
            List<Expr> lhs = clause.getLhs();
            if (lhs.size() > 2) {
                throw error(lhs.get(2).getStart(), "range clause permits at most two iteration variables");
            }
            Expr key = lhs.get(0);
            Expr value = lhs.size() > 1 ? lhs.get(1) : null;
            Expr x = ((UnaryExpr) clause.getRhs().get(0)).getX();
            return new RangeStmt(forPos, key, value, clause.getTok(), x, body);
        }
        Expr condition = cond != null ? toCondition(cond, "for") : null;
        return new ForStmt(forPos, init, condition, post, body);
    }

    private static boolean isRangeClause(Stmt stmt) {
        if (!(stmt instanceof AssignStmt)) {
            return false;
        }
        List<Expr> rhs = ((AssignStmt) stmt).getRhs();
        return rhs.size() == 1 && rhs.get(0) instanceof UnaryExpr
                && ((UnaryExpr) rhs.get(0)).getOp() == Token.RANGE;
    }

    /** Parses an expression switch or, when the header is a type guard, a type switch. */
    private Stmt parseSwitchStmt() {
        int switchPos = expect(Token.SWITCH);
        Stmt init = null;
        Expr tag = null;
        Stmt guard = null;
        if (tok != Token.LBRACE) {
            int outer = exprLev;
            exprLev = -1;
            typeSwitchHeader = true;
            try {
                Stmt stmt = null;
                if (tok != Token.SEMICOLON) {
                    stmt = parseSimpleStmt(SimpleStmtMode.BASIC);
                }
                if (tok == Token.SEMICOLON) {
                    next();
                    init = stmt;
                    stmt = null;
                    if (tok != Token.LBRACE) {
                        stmt = parseSimpleStmt(SimpleStmtMode.BASIC);
                    }
                }
                if (isTypeSwitchGuard(stmt)) {
                    guard = stmt;
                } else if (stmt != null) {
                    tag = toCondition(stmt, "switch");
                }
            } finally {
                exprLev = outer;
                typeSwitchHeader = false;
            }
        }
        int lbrace = expect(Token.LBRACE);
        List<Stmt> clauses = new ArrayList<>();
        while (tok == Token.CASE || tok == Token.DEFAULT) {
            clauses.add(parseCaseClause());
        }
        int rbrace = expect(Token.RBRACE);
        BlockStmt body = new BlockStmt(lbrace, clauses, rbrace);
        if (guard != null) {
            return new TypeSwitchStmt(switchPos, init, guard, body);
        }
        return new SwitchStmt(switchPos, init, tag, body);
    }

    /** {@code x.(type)} or {@code v := x.(type)}. */
    private static boolean isTypeSwitchGuard(Stmt stmt) {
        Expr x = null;
        if (stmt instanceof ExprStmt) {
            x = ((ExprStmt) stmt).getX();
        } else if (stmt instanceof AssignStmt) {
            AssignStmt assign = (AssignStmt) stmt;
            if (assign.isDefine() && assign.getLhs().size() == 1 && assign.getLhs().get(0) instanceof Ident
                    && assign.getRhs().size() == 1) {
                x = assign.getRhs().get(0);
            }
        }
        return x instanceof TypeAssertExpr && ((TypeAssertExpr) x).getType() == null;
    }

    private CaseClause parseCaseClause() {
        int casePos = pos;
        List<Expr> list = null;
        if (tok == Token.CASE) {
            next();
            list = parseExprList();
        } else {
            expect(Token.DEFAULT);
        }
        int colon = expect(Token.COLON);
        return new CaseClause(casePos, list, colon, parseStmtList());
    }

    private SelectStmt parseSelectStmt() {
        int selectPos = expect(Token.SELECT);
        int lbrace = expect(Token.LBRACE);
        List<Stmt> clauses = new ArrayList<>();
        while (tok == Token.CASE || tok == Token.DEFAULT) {
            int casePos = pos;
            Stmt comm = null;
            if (tok == Token.CASE) {
                next();
                comm = parseSimpleStmt(SimpleStmtMode.BASIC);
            } else {
                expect(Token.DEFAULT);
            }
            int colon = expect(Token.COLON);
            clauses.add(new CommClause(casePos, comm, colon, parseStmtList()));
        }
        int rbrace = expect(Token.RBRACE);
        return new SelectStmt(selectPos, new BlockStmt(lbrace, clauses, rbrace));
    }

    // ------------------------------------------------------------------
    // Expressions
    // ------------------------------------------------------------------

    private Ident parseIdent() {
        if (tok != Token.IDENT) {
            throw errorExpected("identifier");
        }
        Ident id = new Ident(pos, lit);
        next();
        return id;
    }

    private List<Ident> parseIdentList() {
        List<Ident> list = new ArrayList<>();
        list.add(parseIdent());
        while (tok == Token.COMMA) {
            next();
            list.add(parseIdent());
        }
        return list;
    }

    private List<Expr> parseExprList() {
        List<Expr> list = new ArrayList<>();
        list.add(parseExpr());
        while (tok == Token.COMMA) {
            next();
            list.add(parseExpr());
        }
        return list;
    }

    private Expr parseExpr() {
        return parseBinaryExpr(1);
    }

    private Expr parseBinaryExpr(int minPrecedence) {
        return parseBinaryTail(parseUnaryExpr(), minPrecedence);
    }

    /** Continues a binary expression whose left operand is already parsed. */
    private Expr parseBinaryTail(Expr x, int minPrecedence) {
        while (true) {
            int precedence = tok.getPrecedence();
            if (precedence < minPrecedence) {
                return x;
            }
            Token op = tok;
            next();
            Expr y = parseBinaryExpr(precedence + 1);
            x = new BinaryExpr(x, op, y);
        }
    }

    private Expr parseUnaryExpr() {
        int start = pos;
        switch (tok) {
            case ADD:
            case SUB:
            case NOT:
            case XOR:
            case AND:
            case ARROW: {
                Token op = tok;
                next();
                return new UnaryExpr(start, op, parseUnaryExpr());
            }
            case MUL:
                next();
                return new StarExpr(start, parseUnaryExpr());
            default:
                return parsePrimaryExpr();
        }
    }

    private Expr parsePrimaryExpr() {
        return parsePrimarySuffix(parseOperand());
    }

    /** Applies selectors, index, call and literal suffixes to {@code x}. */
    private Expr parsePrimarySuffix(Expr x) {
        while (true) {
            switch (tok) {
                case PERIOD:
                    next();
                    if (tok == Token.IDENT) {
                        x = new SelectorExpr(x, parseIdent());
                    } else if (tok == Token.LPAREN) {
                        next();
                        if (tok == Token.TYPE) {
                            if (!typeSwitchHeader) {
                                throw error(pos, "use of .(type) outside type switch");
                            }
                            next();
                            x = new TypeAssertExpr(x, null, expect(Token.RPAREN));
                            break;
                        }
                        Expr type = parseType();
                        int rparen = expect(Token.RPAREN);
                        x = new TypeAssertExpr(x, type, rparen);
                    } else {
                        throw errorExpected("selector or type assertion");
                    }
                    break;
                case LBRACK:
                    x = parseIndexOrSlice(x);
                    break;
                case LPAREN:
                    x = parseCall(x);
                    break;
                case LBRACE:
                    if (isLiteralType(x) && (exprLev >= 0 || !(isTypeName(x) || isTypeInstance(x)))) {
                        x = parseCompositeLit(x);
                        break;
                    }
                    return x;
                default:
                    return x;
            }
        }
    }

    private Expr parseIndexOrSlice(Expr x) {
        expect(Token.LBRACK);
        Expr low = null;
        Expr high = null;
        List<Expr> typeArgs = null;
        boolean slice = false;
        exprLev++;
        try {
            if (tok != Token.COLON) {
                low = parseExpr();
            }
            if (low != null && tok == Token.COMMA) {
                typeArgs = new ArrayList<>();
                typeArgs.add(low);
                while (tok == Token.COMMA) {
                    next();
                    if (tok == Token.RBRACK) {
                        break;
                    }
                    typeArgs.add(parseType());
                }
            } else if (tok == Token.COLON) {
                slice = true;
                next();
                if (tok != Token.RBRACK) {
                    high = parseExpr();
                }
            }
        } finally {
            exprLev--;
        }
        int rbrack = expect(Token.RBRACK);
        if (typeArgs != null) {
            return new IndexListExpr(x, typeArgs, rbrack);
        }
        if (slice) {
            return new SliceExpr(x, low, high, rbrack);
        }
        return new IndexExpr(x, low, rbrack);
    }

    private CallExpr parseCall(Expr fun) {
        expect(Token.LPAREN);
        List<Expr> args = new ArrayList<>();
        int ellipsis = -1;
        exprLev++;
        try {
            while (tok != Token.RPAREN && tok != Token.EOF) {
                args.add(parseExpr());
                if (tok == Token.ELLIPSIS) {
                    ellipsis = pos;
                    next();
                }
                if (tok != Token.COMMA) {
                    break;
                }
                next();
            }
        } finally {
            exprLev--;
        }
        int rparen = expect(Token.RPAREN);
        return new CallExpr(fun, args, ellipsis, rparen);
    }

    private Expr parseOperand() {
        int start = pos;
        switch (tok) {
            case IDENT:
                return parseIdent();
            case INT:
            case FLOAT:
            case CHAR:
            case STRING: {
                BasicLit literal = new BasicLit(start, tok, lit);
                next();
                return literal;
            }
            case LPAREN: {
                next();
                Expr x;
                exprLev++;
                try {
                    x = parseExpr();
                } finally {
                    exprLev--;
                }
                int rparen = expect(Token.RPAREN);
                return new ParenExpr(start, x, rparen);
            }
            case FUNC:
                return parseFuncTypeOrLit();
            case LBRACK:
            case MAP:
            case CHAN:
            case STRUCT:
            case INTERFACE:
                return parseType();
            default:
                throw errorExpected("operand");
        }
    }

    private Expr parseFuncTypeOrLit() {
        int funcPos = expect(Token.FUNC);
        FieldList params = parseParameters();
        FuncType type = new FuncType(funcPos, params, parseResult());
        if (tok != Token.LBRACE) {
            return type;
        }
        BlockStmt body;
        exprLev++;
        try {
            body = parseBlockStmt();
        } finally {
            exprLev--;
        }
        return new FuncLit(type, body);
    }

    private CompositeLit parseCompositeLit(Expr type) {
        int lbrace = expect(Token.LBRACE);
        List<Expr> elements = new ArrayList<>();
        exprLev++;
        try {
            while (tok != Token.RBRACE && tok != Token.EOF) {
                elements.add(parseElement());
                if (tok != Token.COMMA) {
                    break;
                }
                next();
            }
        } finally {
            exprLev--;
        }
        int rbrace = expect(Token.RBRACE);
        return new CompositeLit(type, lbrace, elements, rbrace);
    }

    private Expr parseElement() {
        Expr x = parseValue();
        if (tok == Token.COLON) {
            next();
            x = new KeyValueExpr(x, parseValue());
        }
        return x;
    }

    private Expr parseValue() {
        if (tok == Token.LBRACE) {
            return parseCompositeLit(null);
        }
        return parseExpr();
    }

    private static boolean isTypeName(Expr x) {
        return x instanceof Ident
                || (x instanceof SelectorExpr && ((SelectorExpr) x).getX() instanceof Ident);
    }

    /** {@code List[int]} or {@code pkg.Pair[K, V]}. */
    private static boolean isTypeInstance(Expr x) {
        Expr base = null;
        if (x instanceof IndexExpr) {
            base = ((IndexExpr) x).getX();
        } else if (x instanceof IndexListExpr) {
            base = ((IndexListExpr) x).getX();
        }
        return base != null && isTypeName(base);
    }

    private static boolean isLiteralType(Expr x) {
        return isTypeName(x) || isTypeInstance(x) || x instanceof ArrayType || x instanceof MapType
                || x instanceof StructType;
    }
}
