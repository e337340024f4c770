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
package com.tomaszrup.goxls.ast;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.goxls.parser.ParseConfig;
import com.tomaszrup.goxls.parser.Parser;

class InspectorTests {
	private static final String TEXT = "package main\n\nfunc f() {\n\tfor {\n\t\tg := func() {\n\t\t\tx := 1\n\t\t\t_ = x\n\t\t}\n"
			+ "\t\tg()\n\t}\n}\n";

	private static List<String> identNames(Node root, NodeVisitor boundary) {
		List<String> names = new ArrayList<>();
		Inspector.inspect(root, node -> {
			Visit decision = boundary.visit(node);
			if (decision == Visit.CONTINUE && node instanceof Ident) {
				names.add(((Ident) node).getName());
			}
			return decision;
		});
		return names;
	}

	@Test
	void testVisitsInSourceOrder() {
		SourceFile file = Parser.parse(TEXT, ParseConfig.FULL).getFile();
		List<String> names = identNames(file, node -> Visit.CONTINUE);
		Assertions.assertEquals(List.of("main", "f", "g", "x", "_", "x", "g"), names);
	}

	@Test
	void testSkipDoesNotEnterSubtree() {
		SourceFile file = Parser.parse(TEXT, ParseConfig.FULL).getFile();
		List<String> names = identNames(file, node -> node instanceof FuncLit ? Visit.SKIP : Visit.CONTINUE);
		Assertions.assertEquals(List.of("main", "f", "g", "g"), names);
	}

	@Test
	void testStopEndsWalk() {
		SourceFile file = Parser.parse(TEXT, ParseConfig.FULL).getFile();
		List<Node> visited = new ArrayList<>();
		boolean completed = Inspector.inspect(file, node -> {
			visited.add(node);
			return node instanceof ForStmt ? Visit.STOP : Visit.CONTINUE;
		});
		Assertions.assertFalse(completed);
		Assertions.assertTrue(visited.get(visited.size() - 1) instanceof ForStmt);
	}

	@Test
	void testNullRootIsNoOp() {
		Assertions.assertTrue(Inspector.inspect(null, node -> Visit.STOP));
	}
}
