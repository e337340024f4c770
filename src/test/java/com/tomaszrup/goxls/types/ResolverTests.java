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
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.goxls.types;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.goxls.ast.Ident;
import com.tomaszrup.goxls.ast.ImportSpec;
import com.tomaszrup.goxls.ast.Inspector;
import com.tomaszrup.goxls.ast.SourceFile;
import com.tomaszrup.goxls.ast.Visit;
import com.tomaszrup.goxls.parser.ParseConfig;
import com.tomaszrup.goxls.parser.ParseResult;
import com.tomaszrup.goxls.parser.Parser;

class ResolverTests {
	private SourceFile file;
	private SemanticInfo info;

	private void resolve(String text) {
		ParseResult result = Parser.parse(text, ParseConfig.FULL);
		Assertions.assertFalse(result.hasErrors(), () -> result.getErrors().toString());
		file = result.getFile();
		info = Resolver.resolve(file);
	}

	private Ident identAt(int offset) {
		Ident[] found = new Ident[1];
		Inspector.inspect(file, node -> {
			if (node instanceof Ident && node.getStart() == offset) {
				found[0] = (Ident) node;
				return Visit.STOP;
			}
			return Visit.CONTINUE;
		});
		Assertions.assertNotNull(found[0], "no identifier at " + offset);
		return found[0];
	}

	private SemanticObject objectAt(int offset) {
		return info.objectOf(identAt(offset));
	}

	@Test
	void testShortVarDeclReusesExistingName() {
		String text = "package main\n\nfunc f() (int, error) {\n\tn, err := 1, error(nil)\n\tm, err := 2, err\n\treturn n + m, err\n}\n";
		resolve(text);
		int first = text.indexOf("err :=");
		int second = text.indexOf("err :=", first + 1);
		Assertions.assertSame(objectAt(first), objectAt(second));
		Assertions.assertNotNull(info.getDef(identAt(first)));
		Assertions.assertNull(info.getDef(identAt(second)));
		Assertions.assertSame(objectAt(first), info.getUse(identAt(second)));
		Assertions.assertEquals(ObjectKind.VAR, objectAt(text.indexOf("m, err")).getKind());
	}

	@Test
	void testInnerBlockShadows() {
		String text = "package main\n\nfunc f() int {\n\tx := 1\n\tif true {\n\t\tx := 2\n\t\t_ = x\n\t}\n\treturn x\n}\n";
		resolve(text);
		SemanticObject outer = objectAt(text.indexOf("x := 1"));
		SemanticObject inner = objectAt(text.indexOf("x := 2"));
		Assertions.assertNotSame(outer, inner);
		Assertions.assertSame(inner, objectAt(text.indexOf("x\n\t}")));
		Assertions.assertSame(outer, objectAt(text.indexOf("return x") + 7));
	}

	@Test
	void testPackageLevelNamesIgnoreDeclarationOrder() {
		String text = "package main\n\nfunc f() T {\n\treturn g()\n}\n\nfunc g() T {\n\treturn T{}\n}\n\ntype T struct{}\n";
		resolve(text);
		SemanticObject type = objectAt(text.indexOf("T struct"));
		Assertions.assertEquals(ObjectKind.TYPE, type.getKind());
		Assertions.assertSame(type, objectAt(text.indexOf("T {")));
		Assertions.assertSame(objectAt(text.indexOf("g() T {")), objectAt(text.indexOf("g()\n")));
	}

	@Test
	void testImports() {
		String text = "package main\n\nimport (\n\t\"path/filepath\"\n\tfs \"io/fs\"\n\t_ \"embed\"\n\t. \"strings\"\n)\n\n"
				+ "var a = filepath.Base\nvar b fs.FileMode\nvar c = filepath.Base\n";
		resolve(text);
		ImportSpec unaliased = file.getImports().get(0);
		SemanticObject filepath = info.importedPackageName(unaliased);
		Assertions.assertEquals(ObjectKind.PKG_NAME, filepath.getKind());
		Assertions.assertEquals("filepath", filepath.getName());
		Assertions.assertEquals("path/filepath", filepath.getPackagePath());
		Assertions.assertSame(filepath, info.getImplicit(unaliased));
		Assertions.assertSame(filepath, objectAt(text.indexOf("filepath.Base")));

		ImportSpec aliased = file.getImports().get(1);
		Assertions.assertSame(info.getDef(aliased.getName()), info.importedPackageName(aliased));
		Assertions.assertSame(info.importedPackageName(aliased), objectAt(text.indexOf("fs.FileMode")));

		Assertions.assertNull(info.importedPackageName(file.getImports().get(2)));
		Assertions.assertNull(info.importedPackageName(file.getImports().get(3)));
	}

	@Test
	void testPackageMembersShareOneObject() {
		String text = "package main\n\nimport \"fmt\"\n\nvar a = fmt.Sprint\nvar b = fmt.Sprint\nvar c = fmt.Sprintf\n";
		resolve(text);
		SemanticObject first = objectAt(text.indexOf("Sprint\n"));
		Assertions.assertEquals(ObjectKind.MEMBER, first.getKind());
		Assertions.assertEquals("fmt", first.getPackagePath());
		Assertions.assertSame(first, objectAt(text.lastIndexOf("Sprint\n")));
		Assertions.assertNotSame(first, objectAt(text.indexOf("Sprintf")));
	}

	@Test
	void testFieldSelectorsStayUnresolved() {
		String text = "package main\n\ntype P struct{ X int }\n\nfunc f(p P) int {\n\treturn p.X\n}\n";
		resolve(text);
		Assertions.assertEquals(ObjectKind.FIELD, objectAt(text.indexOf("X int")).getKind());
		Assertions.assertFalse(objectAt(text.indexOf("X\n")).isBound());
		Assertions.assertEquals(ObjectKind.VAR, objectAt(text.indexOf("p.X")).getKind());
	}

	@Test
	void testStructKeysBindToFieldsMapKeysResolved() {
		String text = "package main\n\ntype P struct{ k int }\n\nvar k = \"key\"\n\n"
				+ "var p = P{k: 1}\nvar q = &P{k: 2}\nvar m = map[string]int{k: 3}\n";
		resolve(text);
		SemanticObject field = objectAt(text.indexOf("k int"));
		Assertions.assertEquals(ObjectKind.FIELD, field.getKind());
		Assertions.assertSame(field, objectAt(text.indexOf("k: 1")));
		Assertions.assertSame(field, objectAt(text.indexOf("k: 2")));
		Assertions.assertNull(info.getDef(identAt(text.indexOf("k: 1"))));
		Assertions.assertSame(objectAt(text.indexOf("k = ")), objectAt(text.indexOf("k: 3")));
	}

	@Test
	void testElidedLiteralsUseElementType() {
		String text = "package main\n\ntype point struct{ x, y int }\n\ntype path []point\n\n"
				+ "var ps = path{{x: 1}, {y: 2}}\nvar byName = map[string]*point{\"a\": {x: 3}}\n";
		resolve(text);
		SemanticObject x = objectAt(text.indexOf("x, y"));
		Assertions.assertSame(x, objectAt(text.indexOf("x: 1")));
		Assertions.assertSame(x, objectAt(text.indexOf("x: 3")));
		Assertions.assertSame(objectAt(text.indexOf("y int")), objectAt(text.indexOf("y: 2")));
	}

	@Test
	void testStructKeysOfForeignTypesStayUnresolved() {
		String text = "package main\n\nimport \"net/http\"\n\nvar c = http.Client{Timeout: 0}\n\nvar d = struct{ n int }{n: 1}\n";
		resolve(text);
		Assertions.assertFalse(objectAt(text.indexOf("Timeout")).isBound());
		Assertions.assertSame(objectAt(text.indexOf("n int")), objectAt(text.indexOf("n: 1")));
	}

	@Test
	void testTypeSwitchVariableSharedByClauses() {
		String text = "package main\n\nfunc f(x any) int {\n\tswitch v := x.(type) {\n\tcase int:\n\t\treturn v\n"
				+ "\tcase string:\n\t\treturn len(v)\n\t}\n\treturn 0\n}\n";
		resolve(text);
		SemanticObject v = objectAt(text.indexOf("v :="));
		Assertions.assertEquals(ObjectKind.VAR, v.getKind());
		Assertions.assertSame(v, objectAt(text.indexOf("v\n")));
		Assertions.assertSame(v, objectAt(text.indexOf("(v)") + 1));
		Assertions.assertSame(objectAt(text.indexOf("x any")), objectAt(text.indexOf("x.(type)")));
	}

	@Test
	void testTypeParameters() {
		String text = "package main\n\ntype Pair[K comparable, V any] struct {\n\tkey K\n\tval V\n}\n\n"
				+ "func (p *Pair[K, V]) Key() K {\n\treturn p.key\n}\n\n"
				+ "func First[T any](xs []T) T {\n\treturn xs[0]\n}\n\n"
				+ "var p = Pair[string, int]{key: \"a\"}\n";
		resolve(text);
		SemanticObject typeK = objectAt(text.indexOf("K comparable"));
		Assertions.assertEquals(ObjectKind.TYPE, typeK.getKind());
		Assertions.assertSame(typeK, objectAt(text.indexOf("K\n")));

		SemanticObject receiverK = objectAt(text.indexOf("K, V]"));
		Assertions.assertNotSame(typeK, receiverK);
		Assertions.assertSame(receiverK, objectAt(text.indexOf("K {")));
		Assertions.assertSame(objectAt(text.indexOf("Pair[K comparable")), objectAt(text.indexOf("Pair[K, V]")));

		SemanticObject t = objectAt(text.indexOf("T any"));
		Assertions.assertSame(t, objectAt(text.indexOf("[]T") + 2));
		Assertions.assertSame(t, objectAt(text.indexOf("T {")));

		Assertions.assertSame(objectAt(text.indexOf("key K")), objectAt(text.indexOf("key: ")));
	}

	@Test
	void testLabelsResolveForward() {
		String text = "package main\n\nfunc f() {\n\tgoto done\ndone:\n\tfor {\n\t\tbreak done\n\t}\n}\n";
		resolve(text);
		SemanticObject label = objectAt(text.indexOf("done:"));
		Assertions.assertEquals(ObjectKind.LABEL, label.getKind());
		Assertions.assertSame(label, objectAt(text.indexOf("done\n")));
		Assertions.assertSame(label, objectAt(text.lastIndexOf("done")));
	}

	@Test
	void testLabelsDoNotCrossFunctionLiterals() {
		String text = "package main\n\nfunc f() {\nL:\n\tfor {\n\t\tg := func() {\n\t\tL:\n\t\t\tfor {\n\t\t\t\tbreak L\n\t\t\t}\n\t\t}\n"
				+ "\t\tg()\n\t\tbreak L\n\t}\n}\n";
		resolve(text);
		SemanticObject outer = objectAt(text.indexOf("L:"));
		SemanticObject inner = objectAt(text.indexOf("L:", text.indexOf("func()")));
		Assertions.assertNotSame(outer, inner);
		Assertions.assertSame(inner, objectAt(text.indexOf("break L") + 6));
		Assertions.assertSame(outer, objectAt(text.lastIndexOf("break L") + 6));
	}

	@Test
	void testUniverse() {
		String text = "package main\n\nfunc f(s string) int {\n\tvar _ = nil == nil\n\treturn len(s)\n}\n";
		resolve(text);
		Assertions.assertEquals(ObjectKind.BUILTIN, objectAt(text.indexOf("len")).getKind());
		Assertions.assertEquals(ObjectKind.TYPE, objectAt(text.indexOf("string")).getKind());
		Assertions.assertEquals(ObjectKind.NIL, objectAt(text.indexOf("nil")).getKind());
		Assertions.assertEquals(-1, objectAt(text.indexOf("len")).getPos());
	}

	@Test
	void testBlankIdentifierIsUnbound() {
		String text = "package main\n\nfunc f() {\n\t_ := 1\n}\n";
		resolve(text);
		Assertions.assertSame(SemanticObject.NO_BINDING, objectAt(text.indexOf("_")));
	}

	@Test
	void testLastPathElement() {
		Assertions.assertEquals("filepath", Resolver.lastPathElement("path/filepath"));
		Assertions.assertEquals("fmt", Resolver.lastPathElement("fmt"));
	}
}
