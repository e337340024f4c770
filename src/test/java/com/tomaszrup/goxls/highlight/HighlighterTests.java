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
package com.tomaszrup.goxls.highlight;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.goxls.ast.NoEnclosingNodeException;
import com.tomaszrup.goxls.ast.SourceFile;
import com.tomaszrup.goxls.parser.ParseConfig;
import com.tomaszrup.goxls.parser.ParseResult;
import com.tomaszrup.goxls.parser.Parser;
import com.tomaszrup.goxls.types.Resolver;
import com.tomaszrup.goxls.types.SemanticInfo;

class HighlighterTests {
	private final Highlighter highlighter = new Highlighter();

	private static SourceFile parse(String text) {
		ParseResult result = Parser.parse(text, ParseConfig.FULL);
		Assertions.assertFalse(result.hasErrors(), () -> "unexpected syntax errors: " + result.getErrors());
		return result.getFile();
	}

	private HighlightSet highlight(String text, int offset) throws NoEnclosingNodeException {
		SourceFile file = parse(text);
		return highlighter.highlight(file, Resolver.resolve(file), offset);
	}

	private static List<Integer> occurrences(String text, String needle) {
		List<Integer> result = new ArrayList<>();
		for (int i = text.indexOf(needle); i >= 0; i = text.indexOf(needle, i + 1)) {
			result.add(i);
		}
		return result;
	}

	private static PosRange at(int start, String token) {
		return PosRange.ofLength(start, token.length());
	}

	private static void assertRanges(HighlightSet actual, PosRange... expected) {
		HighlightSet expectedSet = new HighlightSet();
		for (PosRange range : expected) {
			expectedSet.add(range);
		}
		Assertions.assertEquals(expectedSet, actual);
	}

	// ------------------------------------------------------------------
	// Identifiers
	// ------------------------------------------------------------------

	@Test
	void testIdentifierHighlightsAllUsesOfSameObject() throws Exception {
		String text = "package main\n\nfunc f() int {\n\tx := 1\n\ty := x\n\t_ = y\n\treturn x\n}\n";
		List<Integer> xs = occurrences(text, "x");
		HighlightSet result = highlight(text, xs.get(0));
		assertRanges(result, at(xs.get(0), "x"), at(xs.get(1), "x"), at(xs.get(2), "x"));
		Assertions.assertFalse(result.contains(at(text.indexOf("y :="), "y")));
	}

	@Test
	void testIdentifierInReturnAlsoHighlightsResultPosition() throws Exception {
		String text = "package main\n\nfunc f() int {\n\tx := 1\n\treturn x\n}\n";
		List<Integer> xs = occurrences(text, "x");
		HighlightSet result = highlight(text, xs.get(1));
		assertRanges(result,
				at(xs.get(0), "x"),
				at(xs.get(1), "x"),
				at(text.indexOf("int"), "int"));
	}

	@Test
	void testShadowedVariableIsNotLinked() throws Exception {
		String text = "package main\n\nfunc f(c bool) {\n\tv := 1\n\tif c {\n\t\tv := 2\n\t\tuse(v)\n\t}\n\tuse(v)\n}\n";
		List<Integer> vs = occurrences(text, "v");
		HighlightSet outer = highlight(text, vs.get(0));
		assertRanges(outer, at(vs.get(0), "v"), at(vs.get(3), "v"));
		HighlightSet inner = highlight(text, vs.get(2));
		assertRanges(inner, at(vs.get(1), "v"), at(vs.get(2), "v"));
	}

	@Test
	void testUnresolvedIdentifiersWithSameNameAreLinked() throws Exception {
		String text = "package main\n\nfunc a() {\n\tuse(q)\n}\n\nfunc b() {\n\tq := 1\n\tuse(q)\n}\n";
		List<Integer> qs = occurrences(text, "q");
		assertRanges(highlight(text, qs.get(0)), at(qs.get(0), "q"));

		List<Integer> uses = occurrences(text, "use");
		assertRanges(highlight(text, uses.get(0)), at(uses.get(0), "use"), at(uses.get(1), "use"));
	}

	@Test
	void testStructLiteralKeyHighlightsFieldDeclaration() throws Exception {
		String text = "package main\n\ntype T struct {\n\ta int\n\tb string\n}\n\n"
				+ "func f() T {\n\tt := T{a: 1, b: \"x\"}\n\t_ = T{a: 2}\n\treturn t\n}\n";
		PosRange[] expected = {
				at(text.indexOf("a int"), "a"),
				at(text.indexOf("a: 1"), "a"),
				at(text.indexOf("a: 2"), "a") };
		assertRanges(highlight(text, text.indexOf("a: 1")), expected);
		assertRanges(highlight(text, text.indexOf("a int")), expected);
	}

	@Test
	void testTypeParameterHighlightsItsUses() throws Exception {
		String text = "package main\n\nfunc First[T any](xs []T) T {\n\treturn xs[0]\n}\n";
		assertRanges(highlight(text, text.indexOf("T any")),
				at(text.indexOf("T any"), "T"),
				at(text.indexOf("[]T") + 2, "T"),
				at(text.indexOf("T {"), "T"));
	}

	@Test
	void testTypeSwitchVariableHighlightsAcrossClauses() throws Exception {
		String text = "package main\n\nfunc f(x any) int {\n\tswitch v := x.(type) {\n\tcase int:\n\t\treturn v\n"
				+ "\tcase string:\n\t\treturn len(v)\n\t}\n\treturn 0\n}\n";
		List<Integer> vs = occurrences(text, "v");
		Assertions.assertEquals(3, vs.size());
		assertRanges(highlight(text, vs.get(0)), at(vs.get(0), "v"), at(vs.get(1), "v"), at(vs.get(2), "v"));
	}

	@Test
	void testCallArgumentIsNotAFunctionExit() throws Exception {
		String text = "package main\n\nfunc g(v int) int {\n\treturn v\n}\n\nfunc f(x int) int {\n\treturn g(x)\n}\n";
		List<Integer> xs = occurrences(text, "x");
		HighlightSet result = highlight(text, xs.get(1));
		assertRanges(result, at(xs.get(0), "x"), at(xs.get(1), "x"));
	}

	@Test
	void testCursorAfterIdentifierResolvesToIdentifier() throws Exception {
		String text = "package main\n\nfunc f() {\n\tx := 1\n\ty := x\n\tuse(x, y)\n}\n";
		int x = text.indexOf("y := x") + 5;
		Assertions.assertEquals(highlight(text, x), highlight(text, x + 1));
		Assertions.assertEquals(3, highlight(text, x + 1).size());
	}

	@Test
	void testHighlightIsDeterministic() throws Exception {
		String text = "package main\n\nfunc f() int {\n\tx := 1\n\tfor {\n\t\tbreak\n\t}\n\treturn x\n}\n";
		SourceFile file = parse(text);
		SemanticInfo info = Resolver.resolve(file);
		for (int offset = 0; offset <= text.length(); offset++) {
			Assertions.assertEquals(highlighter.highlight(file, info, offset), highlighter.highlight(file, info, offset));
		}
	}

	@Test
	void testWithoutSemanticBindingSameNamedIdentifiersAreLinked() throws Exception {
		String text = "package main\n\nfunc a() {\n\tx := 1\n\tuse(x)\n}\n\nfunc b() {\n\tx := 2\n\tuse(x)\n}\n";
		SourceFile file = parse(text);
		List<Integer> xs = occurrences(text, "x");
		HighlightSet result = highlighter.highlight(file, SemanticInfo.EMPTY, xs.get(0));
		Assertions.assertEquals(4, result.size());
		for (int x : xs) {
			Assertions.assertTrue(result.contains(at(x, "x")));
		}
	}

	// ------------------------------------------------------------------
	// Imports
	// ------------------------------------------------------------------

	private static final String IMPORTS = "package main\n\nimport (\n\t\"fmt\"\n\tstr \"strings\"\n)\n\n"
			+ "func f() {\n\tfmt.Println(str.ToUpper(\"a\"))\n\tfmt.Println(\"b\")\n}\n";

	@Test
	void testImportPathHighlightsPackageReferences() throws Exception {
		int literal = IMPORTS.indexOf("\"fmt\"");
		List<Integer> fmts = occurrences(IMPORTS, "fmt.");
		HighlightSet result = highlight(IMPORTS, literal + 1);
		assertRanges(result, at(literal, "\"fmt\""), at(fmts.get(0), "fmt"), at(fmts.get(1), "fmt"));
	}

	@Test
	void testPackageReferenceHighlightsImport() throws Exception {
		int literal = IMPORTS.indexOf("\"fmt\"");
		List<Integer> fmts = occurrences(IMPORTS, "fmt.");
		HighlightSet result = highlight(IMPORTS, fmts.get(1));
		assertRanges(result, at(literal, "\"fmt\""), at(fmts.get(0), "fmt"), at(fmts.get(1), "fmt"));
	}

	@Test
	void testImportAliasHighlightsAliasAndUses() throws Exception {
		List<Integer> strs = occurrences(IMPORTS, "str");
		// "str \"strings\"", "strings", "str.ToUpper"
		HighlightSet result = highlight(IMPORTS, strs.get(0));
		assertRanges(result, at(strs.get(0), "str"), at(IMPORTS.indexOf("str.ToUpper"), "str"));
	}

	@Test
	void testPackageMembersAreLinked() throws Exception {
		List<Integer> printlns = occurrences(IMPORTS, "Println");
		assertRanges(highlight(IMPORTS, printlns.get(0) + 2),
				at(printlns.get(0), "Println"), at(printlns.get(1), "Println"));
	}

	// ------------------------------------------------------------------
	// Function exits
	// ------------------------------------------------------------------

	private static final String RETURNS = "package main\n\nfunc f(c bool) int {\n\tif c {\n\t\treturn 1\n\t}\n\treturn 2\n}\n";

	@Test
	void testReturnKeywordHighlightsAllExits() throws Exception {
		int func = RETURNS.indexOf("func");
		int first = RETURNS.indexOf("return 1");
		int second = RETURNS.indexOf("return 2");
		PosRange[] expected = { at(func, "func"), at(first, "return 1"), at(second, "return 2") };
		assertRanges(highlight(RETURNS, first), expected);
		assertRanges(highlight(RETURNS, second + 2), expected);
	}

	@Test
	void testFuncKeywordHighlightsAllExits() throws Exception {
		int func = RETURNS.indexOf("func");
		assertRanges(highlight(RETURNS, func + 1),
				at(func, "func"),
				at(RETURNS.indexOf("return 1"), "return 1"),
				at(RETURNS.indexOf("return 2"), "return 2"));
	}

	@Test
	void testResultExpressionHighlightsSamePositionInEveryReturn() throws Exception {
		int one = RETURNS.indexOf("1\n");
		HighlightSet result = highlight(RETURNS, one);
		assertRanges(result,
				at(one, "1"),
				at(RETURNS.indexOf("2\n"), "2"),
				at(RETURNS.indexOf("int"), "int"));
	}

	@Test
	void testResultTypeHighlightsMatchingResults() throws Exception {
		String text = "package main\n\nfunc f() (int, error) {\n\tif true {\n\t\treturn 0, nil\n\t}\n\treturn 1, nil\n}\n";
		List<Integer> nils = occurrences(text, "nil");
		HighlightSet result = highlight(text, text.indexOf("error"));
		assertRanges(result, at(text.indexOf("error"), "error"), at(nils.get(0), "nil"), at(nils.get(1), "nil"));
	}

	@Test
	void testNestedFunctionLiteralIsSeparateFunction() throws Exception {
		String text = "package main\n\nfunc f() func() int {\n\treturn func() int {\n\t\treturn 1\n\t}\n}\n";
		int outerFunc = text.indexOf("func f");
		int outerReturn = text.indexOf("return func");
		int outerReturnEnd = text.indexOf("\t}\n}") + 2;
		int innerFunc = text.indexOf("func() int {\n\t\t");
		int innerReturn = text.indexOf("return 1");

		assertRanges(highlight(text, outerFunc),
				at(outerFunc, "func"), new PosRange(outerReturn, outerReturnEnd));
		assertRanges(highlight(text, innerFunc),
				at(innerFunc, "func"), at(innerReturn, "return 1"));
	}

	@Test
	void testIdentifierOutsideReturnHasNoFunctionExit() throws Exception {
		String text = "package main\n\nfunc f() int {\n\tn := 1\n\tn++\n\treturn 0\n}\n";
		int def = text.indexOf("n :=");
		int inc = text.indexOf("n++");
		assertRanges(highlight(text, def), at(def, "n"), at(inc, "n"));
	}

	// ------------------------------------------------------------------
	// Loops
	// ------------------------------------------------------------------

	@Test
	void testUnlabeledBreakHighlightsInnermostLoop() throws Exception {
		String text = "package main\n\nfunc f() {\n\tfor {\n\t\tfor {\n\t\t\tbreak\n\t\t}\n\t}\n}\n";
		List<Integer> fors = occurrences(text, "for");
		int brk = text.indexOf("break");
		assertRanges(highlight(text, brk), at(fors.get(1), "for"), at(brk, "break"));
	}

	@Test
	void testLabeledBreakHighlightsLabeledLoop() throws Exception {
		String text = "package main\n\nfunc f() {\nL:\n\tfor {\n\t\tfor {\n\t\t\tbreak L\n\t\t}\n\t}\n}\n";
		List<Integer> fors = occurrences(text, "for");
		int brk = text.indexOf("break L");
		assertRanges(highlight(text, brk), at(fors.get(0), "for"), at(brk, "break L"));
	}

	@Test
	void testForKeywordHighlightsItsBranches() throws Exception {
		String text = "package main\n\nfunc f(x int) {\n\tfor i := 0; i < 10; i++ {\n\t\tswitch x {\n\t\tcase 1:\n"
				+ "\t\t\tcontinue\n\t\tcase 2:\n\t\t\tbreak\n\t\t}\n\t\tif i > 5 {\n\t\t\tbreak\n\t\t}\n\t}\n}\n";
		int loop = text.indexOf("for");
		List<Integer> breaks = occurrences(text, "break");
		int cont = text.indexOf("continue");
		assertRanges(highlight(text, loop), at(loop, "for"), at(cont, "continue"), at(breaks.get(1), "break"));
	}

	@Test
	void testRangeLoopKeyword() throws Exception {
		String text = "package main\n\nfunc f(xs []int) {\n\tfor _, v := range xs {\n\t\tif v > 0 {\n\t\t\tcontinue\n\t\t}\n\t}\n}\n";
		int loop = text.indexOf("for");
		int cont = text.indexOf("continue");
		assertRanges(highlight(text, loop + 1), at(loop, "for"), at(cont, "continue"));
	}

	@Test
	void testLabeledContinueTargetsOuterLoopOnly() throws Exception {
		String text = "package main\n\nfunc f() {\nouter:\n\tfor i := 0; i < 3; i++ {\n\t\tfor j := 0; j < 3; j++ {\n"
				+ "\t\t\tif j == i {\n\t\t\t\tcontinue outer\n\t\t\t}\n\t\t\tcontinue\n\t\t}\n\t}\n}\n";
		List<Integer> fors = occurrences(text, "for");
		int labeled = text.indexOf("continue outer");
		int bare = text.indexOf("continue\n");
		assertRanges(highlight(text, labeled), at(fors.get(0), "for"), at(labeled, "continue outer"));
		assertRanges(highlight(text, bare), at(fors.get(1), "for"), at(bare, "continue"));
	}

	@Test
	void testSameLabelInDifferentFunctionsIsNotLinked() throws Exception {
		String body = "L:\n\tfor {\n\t\tbreak L\n\t}\n}\n";
		String text = "package main\n\nfunc a() {\n" + body + "\nfunc b() {\n" + body;
		List<Integer> fors = occurrences(text, "for");
		List<Integer> breaks = occurrences(text, "break L");
		assertRanges(highlight(text, breaks.get(0)), at(fors.get(0), "for"), at(breaks.get(0), "break L"));

		int label = text.indexOf("L:");
		assertRanges(highlight(text, label), at(label, "L"), at(breaks.get(0) + 6, "L"));
	}

	@Test
	void testUnresolvedLabelHighlightsNothing() throws Exception {
		String text = "package main\n\nfunc f() {\n\tfor {\n\t\tbreak M\n\t}\n}\n";
		Assertions.assertTrue(highlight(text, text.indexOf("break")).isEmpty());
	}

	// ------------------------------------------------------------------
	// Switch and select
	// ------------------------------------------------------------------

	@Test
	void testBreakInSwitchInsideLoopHighlightsSwitch() throws Exception {
		String text = "package main\n\nfunc f(x int) {\n\tfor {\n\t\tswitch x {\n\t\tcase 1:\n\t\t\tbreak\n\t\t}\n\t}\n}\n";
		int sw = text.indexOf("switch");
		int brk = text.indexOf("break");
		assertRanges(highlight(text, brk), at(sw, "switch"), at(brk, "break"));
	}

	@Test
	void testSwitchKeywordSkipsNestedLoops() throws Exception {
		String text = "package main\n\nfunc f(x int) {\n\tswitch x {\n\tcase 1:\n\t\tfor {\n\t\t\tbreak\n\t\t}\n\t\tbreak\n"
				+ "\tcase 2:\n\t\tif x > 0 {\n\t\t\tbreak\n\t\t}\n\t}\n}\n";
		int sw = text.indexOf("switch");
		List<Integer> breaks = occurrences(text, "break");
		assertRanges(highlight(text, sw), at(sw, "switch"), at(breaks.get(1), "break"), at(breaks.get(2), "break"));
	}

	@Test
	void testLabeledBreakOutOfSwitch() throws Exception {
		String text = "package main\n\nfunc f(x int) {\n\tfor {\n\tsw:\n\t\tswitch x {\n\t\tcase 1:\n\t\t\tfor {\n"
				+ "\t\t\t\tbreak sw\n\t\t\t}\n\t\t}\n\t}\n}\n";
		int sw = text.indexOf("switch");
		int brk = text.indexOf("break sw");
		assertRanges(highlight(text, brk), at(sw, "switch"), at(brk, "break sw"));
	}

	@Test
	void testTypeSwitchIsNotABreakTarget() throws Exception {
		String text = "package main\n\nfunc f(xs []any) {\n\tfor _, x := range xs {\n\t\tswitch x.(type) {\n\t\tcase int:\n"
				+ "\t\t\tbreak\n\t\t}\n\t}\n}\n";
		int loop = text.indexOf("for");
		int brk = text.indexOf("break");
		assertRanges(highlight(text, brk), at(loop, "for"), at(brk, "break"));
		Assertions.assertTrue(highlight(text, text.indexOf("switch")).isEmpty());
	}

	@Test
	void testBreakInSelectHighlightsNothing() throws Exception {
		String text = "package main\n\nfunc f(c chan int) {\n\tfor {\n\t\tselect {\n\t\tcase <-c:\n\t\t\tbreak\n\t\t}\n\t}\n}\n";
		Assertions.assertTrue(highlight(text, text.indexOf("break")).isEmpty());
	}

	// ------------------------------------------------------------------
	// Boundaries
	// ------------------------------------------------------------------

	@Test
	void testOffsetPastEndOfFileFails() {
		String text = "package main\n";
		SourceFile file = parse(text);
		SemanticInfo info = Resolver.resolve(file);
		Assertions.assertThrows(NoEnclosingNodeException.class,
				() -> highlighter.highlight(file, info, text.length() + 1));
		Assertions.assertThrows(NoEnclosingNodeException.class,
				() -> highlighter.highlight(file, info, -1));
	}

	@Test
	void testOffsetAtEndOfFileIsEmpty() throws Exception {
		String text = "package main\n\nfunc f() {\n}\n";
		Assertions.assertTrue(highlight(text, text.length()).isEmpty());
	}

	@Test
	void testWhitespaceOutsideConstructsIsEmpty() throws Exception {
		String text = "package main\n\n\nfunc f() {\n}\n";
		Assertions.assertTrue(highlight(text, text.indexOf("\n\n\n") + 1).isEmpty());
	}
}
