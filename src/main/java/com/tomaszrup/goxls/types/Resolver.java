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
package com.tomaszrup.goxls.types;

import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.goxls.ast.ArrayType;
import com.tomaszrup.goxls.ast.AssignStmt;
import com.tomaszrup.goxls.ast.BlockStmt;
import com.tomaszrup.goxls.ast.BranchStmt;
import com.tomaszrup.goxls.ast.CaseClause;
import com.tomaszrup.goxls.ast.CommClause;
import com.tomaszrup.goxls.ast.CompositeLit;
import com.tomaszrup.goxls.ast.DeclStmt;
import com.tomaszrup.goxls.ast.Expr;
import com.tomaszrup.goxls.ast.Field;
import com.tomaszrup.goxls.ast.FieldList;
import com.tomaszrup.goxls.ast.ForStmt;
import com.tomaszrup.goxls.ast.FuncDecl;
import com.tomaszrup.goxls.ast.FuncLit;
import com.tomaszrup.goxls.ast.FuncType;
import com.tomaszrup.goxls.ast.GenDecl;
import com.tomaszrup.goxls.ast.Ident;
import com.tomaszrup.goxls.ast.IfStmt;
import com.tomaszrup.goxls.ast.ImportSpec;
import com.tomaszrup.goxls.ast.Inspector;
import com.tomaszrup.goxls.ast.IndexExpr;
import com.tomaszrup.goxls.ast.IndexListExpr;
import com.tomaszrup.goxls.ast.InterfaceType;
import com.tomaszrup.goxls.ast.KeyValueExpr;
import com.tomaszrup.goxls.ast.LabeledStmt;
import com.tomaszrup.goxls.ast.MapType;
import com.tomaszrup.goxls.ast.Node;
import com.tomaszrup.goxls.ast.ParenExpr;
import com.tomaszrup.goxls.ast.RangeStmt;
import com.tomaszrup.goxls.ast.SelectStmt;
import com.tomaszrup.goxls.ast.SelectorExpr;
import com.tomaszrup.goxls.ast.SourceFile;
import com.tomaszrup.goxls.ast.StarExpr;
import com.tomaszrup.goxls.ast.Stmt;
import com.tomaszrup.goxls.ast.StructType;
import com.tomaszrup.goxls.ast.SwitchStmt;
import com.tomaszrup.goxls.ast.Token;
import com.tomaszrup.goxls.ast.TypeSpec;
import com.tomaszrup.goxls.ast.TypeSwitchStmt;
import com.tomaszrup.goxls.ast.ValueSpec;
import com.tomaszrup.goxls.ast.Visit;

/**
 * Binds the identifiers of a single file to the entities they declare or
 * refer to. Resolution is purely syntactic: without type information,
 * field and method selectors ({@code x.f} where {@code x} is not a package)
 * stay unresolved, and struct literal keys are bound only when the struct
 * type is declared in the same file.
 */
public final class Resolver {
    private static final Logger logger = LoggerFactory.getLogger(Resolver.class);

    private static final String[] UNIVERSE_TYPES = { "any", "bool", "byte", "comparable", "complex64",
            "complex128", "error", "float32", "float64", "int", "int8", "int16", "int32", "int64", "rune",
            "string", "uint", "uint8", "uint16", "uint32", "uint64", "uintptr" };
    private static final String[] UNIVERSE_CONSTS = { "true", "false", "iota" };
    private static final String[] UNIVERSE_FUNCS = { "append", "cap", "clear", "close", "complex", "copy",
            "delete", "imag", "len", "make", "max", "min", "new", "panic", "print", "println", "real",
            "recover" };

    private static final Scope UNIVERSE = createUniverse();

    private final Map<Ident, SemanticObject> defs = new IdentityHashMap<>();
    private final Map<Ident, SemanticObject> uses = new IdentityHashMap<>();
    private final Map<Node, SemanticObject> implicits = new IdentityHashMap<>();
    private final Map<SemanticObject, Map<String, SemanticObject>> packageMembers = new IdentityHashMap<>();
    private final Map<SemanticObject, Expr> namedTypes = new IdentityHashMap<>();
    private final Map<StructType, Map<String, SemanticObject>> structFields = new IdentityHashMap<>();

    private Scope scope;
    private Map<String, SemanticObject> labels = new HashMap<>();

    private Resolver() {
    }

    public static SemanticInfo resolve(SourceFile file) {
        Resolver resolver = new Resolver();
        resolver.resolveFile(file);
        if (logger.isDebugEnabled()) {
            logger.debug("Resolved file: {} definitions, {} uses, {} implicit objects",
                    resolver.defs.size(), resolver.uses.size(), resolver.implicits.size());
        }
        return new SemanticInfo(resolver.defs, resolver.uses, resolver.implicits);
    }

    private static Scope createUniverse() {
        Scope universe = new Scope(null, "universe");
        for (String name : UNIVERSE_TYPES) {
            universe.insert(new SemanticObject(ObjectKind.TYPE, name, -1, null));
        }
        for (String name : UNIVERSE_CONSTS) {
            universe.insert(new SemanticObject(ObjectKind.CONST, name, -1, null));
        }
        for (String name : UNIVERSE_FUNCS) {
            universe.insert(new SemanticObject(ObjectKind.BUILTIN, name, -1, null));
        }
        universe.insert(new SemanticObject(ObjectKind.NIL, "nil", -1, null));
        return universe;
    }

    // ------------------------------------------------------------------
    // File and package level
    // ------------------------------------------------------------------

    private void resolveFile(SourceFile file) {
        Scope packageScope = new Scope(UNIVERSE, "package");
        Scope fileScope = new Scope(packageScope, "file");

        for (ImportSpec spec : file.getImports()) {
            declareImport(spec, fileScope);
        }

        // package-level names are visible regardless of declaration order
        for (Node decl : file.getDecls()) {
            if (decl instanceof FuncDecl) {
                FuncDecl func = (FuncDecl) decl;
                SemanticObject object = declaration(func.getName(), ObjectKind.FUNC);
                if (func.getReceiver() == null && object != null && !"init".equals(func.getName().getName())) {
                    packageScope.insert(object);
                }
            } else if (decl instanceof GenDecl && ((GenDecl) decl).getTok() != Token.IMPORT) {
                GenDecl gen = (GenDecl) decl;
                for (Node spec : gen.getSpecs()) {
                    if (spec instanceof TypeSpec) {
                        insert(packageScope, declareType((TypeSpec) spec));
                    } else {
                        ObjectKind kind = gen.getTok() == Token.CONST ? ObjectKind.CONST : ObjectKind.VAR;
                        for (Ident name : ((ValueSpec) spec).getNames()) {
                            insert(packageScope, declaration(name, kind));
                        }
                    }
                }
            }
        }

        // declarations before function bodies, so literals can see every named type
        scope = fileScope;
        for (Node decl : file.getDecls()) {
            if (!(decl instanceof GenDecl) || ((GenDecl) decl).getTok() == Token.IMPORT) {
                continue;
            }
            for (Node spec : ((GenDecl) decl).getSpecs()) {
                if (spec instanceof TypeSpec) {
                    resolveTypeSpec((TypeSpec) spec);
                } else {
                    ValueSpec value = (ValueSpec) spec;
                    resolveExpr(value.getType());
                    resolveExprs(value.getValues());
                }
            }
        }
        for (Node decl : file.getDecls()) {
            if (decl instanceof FuncDecl) {
                FuncDecl func = (FuncDecl) decl;
                resolveFunction(func.getReceiver(), func.getType(), func.getBody());
            }
        }
    }

    private void declareImport(ImportSpec spec, Scope fileScope) {
        String path = spec.getPath().getUnquotedValue();
        Ident alias = spec.getName();
        if (alias != null && alias.isBlank()) {
            return;
        }
        if (alias != null && ".".equals(alias.getName())) {
            // members of a dot import are not tracked
            implicits.put(spec, new SemanticObject(ObjectKind.PKG_NAME, lastPathElement(path), -1, path));
            return;
        }
        SemanticObject object;
        if (alias != null) {
            object = new SemanticObject(ObjectKind.PKG_NAME, alias.getName(), alias.getStart(), path);
            defs.put(alias, object);
        } else {
            object = new SemanticObject(ObjectKind.PKG_NAME, lastPathElement(path), -1, path);
            implicits.put(spec, object);
        }
        fileScope.insert(object);
    }

    static String lastPathElement(String path) {
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }

    // ------------------------------------------------------------------
    // Declarations
    // ------------------------------------------------------------------

    /** Records a definition; the blank identifier declares nothing. */
    private SemanticObject declaration(Ident name, ObjectKind kind) {
        if (name == null || name.isBlank()) {
            return null;
        }
        SemanticObject object = new SemanticObject(kind, name.getName(), name.getStart(), null);
        defs.put(name, object);
        return object;
    }

    private static void insert(Scope target, SemanticObject object) {
        if (object != null) {
            target.insert(object);
        }
    }

    private void declare(Ident name, ObjectKind kind) {
        insert(scope, declaration(name, kind));
    }

    private void openScope(String kind) {
        scope = new Scope(scope, kind);
    }

    private void closeScope() {
        scope = scope.getParent();
    }

    private SemanticObject declareType(TypeSpec spec) {
        SemanticObject object = declaration(spec.getName(), ObjectKind.TYPE);
        if (object != null) {
            namedTypes.put(object, spec.getType());
        }
        return object;
    }

    /** Type parameters of a generic type are visible only in its declaration. */
    private void resolveTypeSpec(TypeSpec spec) {
        if (spec.getTypeParams() == null) {
            resolveExpr(spec.getType());
            return;
        }
        openScope("type");
        try {
            declareTypeParams(spec.getTypeParams());
            resolveExpr(spec.getType());
        } finally {
            closeScope();
        }
    }

    /** All names first: a constraint may mention a later parameter. */
    private void declareTypeParams(FieldList list) {
        if (list == null) {
            return;
        }
        for (Field field : list.getFields()) {
            for (Ident name : field.getNames()) {
                declare(name, ObjectKind.TYPE);
            }
        }
        for (Field field : list.getFields()) {
            resolveExpr(field.getType());
        }
    }

    private void resolveFunction(FieldList receiver, FuncType type, BlockStmt body) {
        Map<String, SemanticObject> outerLabels = labels;
        labels = new HashMap<>();
        openScope("function");
        try {
            declareTypeParams(type.getTypeParams());
            declareReceiver(receiver);
            declareFields(type.getParams());
            declareFields(type.getResults());
            if (body != null) {
                collectLabels(body);
                resolveStmts(body.getStatements());
            }
        } finally {
            closeScope();
            labels = outerLabels;
        }
    }

    private void declareFields(FieldList list) {
        if (list == null) {
            return;
        }
        for (Field field : list.getFields()) {
            resolveExpr(field.getType());
        }
        for (Field field : list.getFields()) {
            for (Ident name : field.getNames()) {
                declare(name, ObjectKind.VAR);
            }
        }
    }

    /**
     * The receiver {@code (l *List[T])} declares {@code T} as well as {@code l}.
     */
    private void declareReceiver(FieldList receiver) {
        if (receiver == null) {
            return;
        }
        for (Field field : receiver.getFields()) {
            Expr base = field.getType();
            while (base instanceof StarExpr || base instanceof ParenExpr) {
                base = base instanceof StarExpr ? ((StarExpr) base).getX() : ((ParenExpr) base).getX();
            }
            List<Expr> typeParams = Collections.emptyList();
            if (base instanceof IndexExpr) {
                typeParams = Collections.singletonList(((IndexExpr) base).getIndex());
                base = ((IndexExpr) base).getX();
            } else if (base instanceof IndexListExpr) {
                typeParams = ((IndexListExpr) base).getIndices();
                base = ((IndexListExpr) base).getX();
            }
            resolveExpr(base);
            for (Expr typeParam : typeParams) {
                if (typeParam instanceof Ident) {
                    declare((Ident) typeParam, ObjectKind.TYPE);
                } else {
                    resolveExpr(typeParam);
                }
            }
        }
        for (Field field : receiver.getFields()) {
            for (Ident name : field.getNames()) {
                declare(name, ObjectKind.VAR);
            }
        }
    }

    /** Labels are visible in the whole function body, before their declaration too. */
    private void collectLabels(BlockStmt body) {
        Inspector.inspect(body, node -> {
            if (node instanceof FuncLit) {
                return Visit.SKIP;
            }
            if (node instanceof LabeledStmt) {
                Ident label = ((LabeledStmt) node).getLabel();
                SemanticObject object = declaration(label, ObjectKind.LABEL);
                if (object != null) {
                    labels.putIfAbsent(label.getName(), object);
                }
            }
            return Visit.CONTINUE;
        });
    }

    private void resolveGenDecl(GenDecl decl) {
        for (Node spec : decl.getSpecs()) {
            if (spec instanceof TypeSpec) {
                TypeSpec typeSpec = (TypeSpec) spec;
                insert(scope, declareType(typeSpec));
                resolveTypeSpec(typeSpec);
            } else {
                ValueSpec value = (ValueSpec) spec;
                resolveExpr(value.getType());
                resolveExprs(value.getValues());
                ObjectKind kind = decl.getTok() == Token.CONST ? ObjectKind.CONST : ObjectKind.VAR;
                for (Ident name : value.getNames()) {
                    declare(name, kind);
                }
            }
        }
    }

    // ------------------------------------------------------------------
    // Statements
    // ------------------------------------------------------------------

    private void resolveStmts(List<Stmt> statements) {
        for (Stmt stmt : statements) {
            resolveStmt(stmt);
        }
    }

    private void resolveStmt(Stmt stmt) {
        if (stmt == null) {
            return;
        }
        if (stmt instanceof BlockStmt) {
            openScope("block");
            try {
                resolveStmts(((BlockStmt) stmt).getStatements());
            } finally {
                closeScope();
            }
        } else if (stmt instanceof DeclStmt) {
            resolveGenDecl(((DeclStmt) stmt).getDecl());
        } else if (stmt instanceof AssignStmt) {
            resolveAssign((AssignStmt) stmt);
        } else if (stmt instanceof LabeledStmt) {
            resolveStmt(((LabeledStmt) stmt).getStmt());
        } else if (stmt instanceof BranchStmt) {
            Ident label = ((BranchStmt) stmt).getLabel();
            if (label != null) {
                SemanticObject object = labels.get(label.getName());
                if (object != null) {
                    uses.put(label, object);
                }
            }
        } else if (stmt instanceof IfStmt) {
            IfStmt ifStmt = (IfStmt) stmt;
            openScope("if");
            try {
                resolveStmt(ifStmt.getInit());
                resolveExpr(ifStmt.getCond());
                resolveStmt(ifStmt.getBody());
                resolveStmt(ifStmt.getElse());
            } finally {
                closeScope();
            }
        } else if (stmt instanceof ForStmt) {
            ForStmt forStmt = (ForStmt) stmt;
            openScope("for");
            try {
                resolveStmt(forStmt.getInit());
                resolveExpr(forStmt.getCond());
                resolveStmt(forStmt.getPost());
                resolveStmt(forStmt.getBody());
            } finally {
                closeScope();
            }
        } else if (stmt instanceof RangeStmt) {
            resolveRange((RangeStmt) stmt);
        } else if (stmt instanceof SwitchStmt) {
            SwitchStmt switchStmt = (SwitchStmt) stmt;
            openScope("switch");
            try {
                resolveStmt(switchStmt.getInit());
                resolveExpr(switchStmt.getTag());
                resolveClauses(switchStmt.getBody());
            } finally {
                closeScope();
            }
        } else if (stmt instanceof TypeSwitchStmt) {
            resolveTypeSwitch((TypeSwitchStmt) stmt);
        } else if (stmt instanceof SelectStmt) {
            resolveClauses(((SelectStmt) stmt).getBody());
        } else {
            // expression, send, inc/dec, go, defer and return statements
            for (Node child : stmt.getChildren()) {
                resolveExpr((Expr) child);
            }
        }
    }

    /**
     * The variable of {@code switch v := x.(type)} is declared once and shared
     * by all clauses, although each clause has its own typed copy.
     */
    private void resolveTypeSwitch(TypeSwitchStmt stmt) {
        openScope("type switch");
        try {
            resolveStmt(stmt.getInit());
            Stmt guard = stmt.getAssign();
            if (guard instanceof AssignStmt) {
                AssignStmt assign = (AssignStmt) guard;
                resolveExprs(assign.getRhs());
                declare((Ident) assign.getLhs().get(0), ObjectKind.VAR);
            } else {
                resolveStmt(guard);
            }
            resolveClauses(stmt.getBody());
        } finally {
            closeScope();
        }
    }

    private void resolveClauses(BlockStmt body) {
        for (Stmt clause : body.getStatements()) {
            openScope("case");
            try {
                if (clause instanceof CaseClause) {
                    CaseClause caseClause = (CaseClause) clause;
                    if (caseClause.getList() != null) {
                        resolveExprs(caseClause.getList());
                    }
                    resolveStmts(caseClause.getBody());
                } else {
                    CommClause commClause = (CommClause) clause;
                    resolveStmt(commClause.getComm());
                    resolveStmts(commClause.getBody());
                }
            } finally {
                closeScope();
            }
        }
    }

    private void resolveAssign(AssignStmt assign) {
        resolveExprs(assign.getRhs());
        if (!assign.isDefine()) {
            resolveExprs(assign.getLhs());
            return;
        }
        for (Expr lhs : assign.getLhs()) {
            if (!(lhs instanceof Ident)) {
                resolveExpr(lhs);
                continue;
            }
            defineOrReuse((Ident) lhs);
        }
    }

    /** {@code :=} declares only the names that are new to the current block. */
    private void defineOrReuse(Ident id) {
        if (id.isBlank()) {
            return;
        }
        SemanticObject existing = scope.lookupLocal(id.getName());
        if (existing != null) {
            uses.put(id, existing);
        } else {
            declare(id, ObjectKind.VAR);
        }
    }

    private void resolveRange(RangeStmt range) {
        resolveExpr(range.getX());
        openScope("range");
        try {
            if (range.getTok() == Token.DEFINE) {
                for (Expr variable : new Expr[] { range.getKey(), range.getValue() }) {
                    if (variable instanceof Ident) {
                        declare((Ident) variable, ObjectKind.VAR);
                    } else {
                        resolveExpr(variable);
                    }
                }
            } else {
                resolveExpr(range.getKey());
                resolveExpr(range.getValue());
            }
            resolveStmt(range.getBody());
        } finally {
            closeScope();
        }
    }

    // ------------------------------------------------------------------
    // Expressions
    // ------------------------------------------------------------------

    private void resolveExprs(List<Expr> exprs) {
        for (Expr expr : exprs) {
            resolveExpr(expr);
        }
    }

    private void resolveExpr(Expr expr) {
        if (expr == null) {
            return;
        }
        if (expr instanceof Ident) {
            Ident id = (Ident) expr;
            if (id.isBlank()) {
                return;
            }
            SemanticObject object = scope.lookup(id.getName());
            if (object != null) {
                uses.put(id, object);
            }
        } else if (expr instanceof SelectorExpr) {
            resolveSelector((SelectorExpr) expr);
        } else if (expr instanceof CompositeLit) {
            resolveCompositeLit((CompositeLit) expr, null);
        } else if (expr instanceof FuncLit) {
            FuncLit literal = (FuncLit) expr;
            resolveFunction(null, literal.getType(), literal.getBody());
        } else if (expr instanceof FuncType) {
            FuncType type = (FuncType) expr;
            openScope("signature");
            try {
                declareFields(type.getParams());
                declareFields(type.getResults());
            } finally {
                closeScope();
            }
        } else if (expr instanceof StructType) {
            StructType struct = (StructType) expr;
            for (Field field : struct.getFields().getFields()) {
                resolveExpr(field.getType());
            }
            fieldsOf(struct);
        } else if (expr instanceof InterfaceType) {
            for (Field method : ((InterfaceType) expr).getMethods().getFields()) {
                resolveExpr(method.getType());
                for (Ident name : method.getNames()) {
                    declaration(name, ObjectKind.FUNC);
                }
            }
        } else {
            for (Node child : expr.getChildren()) {
                resolveExpr((Expr) child);
            }
        }
    }

    /**
     * Resolves {@code pkg.Name} to a member object shared by every reference
     * to that member of that import. Other selectors need type information
     * and only their operand is resolved.
     */
    private void resolveSelector(SelectorExpr selector) {
        resolveExpr(selector.getX());
        if (!(selector.getX() instanceof Ident)) {
            return;
        }
        SemanticObject operand = uses.get(selector.getX());
        if (operand == null || operand.getKind() != ObjectKind.PKG_NAME) {
            return;
        }
        String member = selector.getSelector().getName();
        SemanticObject object = packageMembers
                .computeIfAbsent(operand, key -> new HashMap<>())
                .computeIfAbsent(member,
                        name -> new SemanticObject(ObjectKind.MEMBER, name, -1, operand.getPackagePath()));
        uses.put(selector.getSelector(), object);
    }

    /**
     * Keys of map, slice and array literals are expressions. Keys of struct
     * literals name fields and are bound when the struct is declared in this
     * file. {@code elidedType} is the type an untyped nested literal takes
     * from the literal around it.
     */
    private void resolveCompositeLit(CompositeLit literal, Expr elidedType) {
        resolveExpr(literal.getType());
        Expr type = underlyingType(literal.getType() != null ? literal.getType() : elidedType);
        boolean keyedByExpr = false;
        Expr keyType = null;
        Expr elementType = null;
        Map<String, SemanticObject> fields = Collections.emptyMap();
        if (type instanceof MapType) {
            keyedByExpr = true;
            keyType = ((MapType) type).getKey();
            elementType = ((MapType) type).getValue();
        } else if (type instanceof ArrayType) {
            keyedByExpr = true;
            elementType = ((ArrayType) type).getElement();
        } else if (type instanceof StructType) {
            fields = fieldsOf((StructType) type);
        }
        for (Expr element : literal.getElements()) {
            if (element instanceof KeyValueExpr) {
                KeyValueExpr pair = (KeyValueExpr) element;
                Expr key = pair.getKey();
                if (!keyedByExpr && key instanceof Ident) {
                    SemanticObject field = fields.get(((Ident) key).getName());
                    if (field != null) {
                        uses.put((Ident) key, field);
                    }
                } else {
                    resolveElement(key, keyType);
                }
                resolveElement(pair.getValue(), elementType);
            } else {
                resolveElement(element, elementType);
            }
        }
    }

    private void resolveElement(Expr element, Expr elidedType) {
        if (element instanceof CompositeLit && ((CompositeLit) element).getType() == null) {
            resolveCompositeLit((CompositeLit) element, elidedType);
        } else {
            resolveExpr(element);
        }
    }

    /**
     * Follows pointers, parentheses, instantiations and names of types declared
     * in this file down to a type literal, or {@code null} if the chain leaves
     * the file.
     */
    private Expr underlyingType(Expr type) {
        Set<Expr> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        while (type != null && seen.add(type)) {
            if (type instanceof StarExpr) {
                type = ((StarExpr) type).getX();
            } else if (type instanceof ParenExpr) {
                type = ((ParenExpr) type).getX();
            } else if (type instanceof IndexExpr) {
                type = ((IndexExpr) type).getX();
            } else if (type instanceof IndexListExpr) {
                type = ((IndexListExpr) type).getX();
            } else if (type instanceof Ident) {
                SemanticObject object = uses.get(type);
                type = object != null ? namedTypes.get(object) : null;
            } else {
                return type;
            }
        }
        return null;
    }

    /** Field objects of a struct type, created on first use. */
    private Map<String, SemanticObject> fieldsOf(StructType struct) {
        Map<String, SemanticObject> fields = structFields.get(struct);
        if (fields == null) {
            fields = new HashMap<>();
            for (Field field : struct.getFields().getFields()) {
                for (Ident name : field.getNames()) {
                    SemanticObject object = declaration(name, ObjectKind.FIELD);
                    if (object != null) {
                        fields.putIfAbsent(name.getName(), object);
                    }
                }
            }
            structFields.put(struct, fields);
        }
        return fields;
    }
}
