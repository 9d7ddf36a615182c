// Copyright 2020 The Whiley Project Developers
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package wyvc.io;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import wyvc.core.Function;
import wyvc.core.Type;
import wyvc.core.VCExpr;
import wyvc.core.VCExpressionGenerator;

public class VCExprPrinterTest {
	private final VCExpressionGenerator gen = new VCExpressionGenerator();

	@Test
	public void test_types() {
		Type.Variable a = new Type.Variable("a");
		Type.Decl c = new Type.Decl("C", 2);
		assertEquals("int", VCExprPrinter.toString(Type.INT));
		assertEquals("bv8", VCExprPrinter.toString(Type.BV(8)));
		assertEquals("C a (C int bool)",
				VCExprPrinter.toString(Type.CONSTRUCTOR(c, a, Type.CONSTRUCTOR(c, Type.INT, Type.BOOL))));
		assertEquals("<a>[int,a]bool",
				VCExprPrinter.toString(Type.MAP(Arrays.asList(a), Arrays.asList(Type.INT, a), Type.BOOL)));
	}

	@Test
	public void test_operators() {
		VCExpr.Variable x = gen.variable("x", Type.INT);
		VCExpr.Variable p = gen.variable("p", Type.BOOL);
		assertEquals("(x + 1) < x", gen.lt(gen.add(x, gen.integer(1)), x).toString());
		assertEquals("!p", gen.not(p).toString());
		assertEquals("(if p then x else 0)", gen.ifThenElse(p, x, gen.integer(0)).toString());
		assertEquals("true", VCExpressionGenerator.TRUE.toString());
	}

	@Test
	public void test_maps() {
		VCExpr.Variable x = gen.variable("x", Type.INT);
		VCExpr.Variable m = gen.variable("m", Type.MAP(Arrays.asList(Type.INT), Type.INT));
		assertEquals("m[x]", gen.select(m, x).toString());
		assertEquals("m[x := 1]", gen.store(m, x, gen.integer(1)).toString());
	}

	@Test
	public void test_binders() {
		VCExpr.Variable x = gen.variable("x", Type.INT);
		Function f = Function.create("f", Type.BOOL, Type.INT);
		VCExpr fx = gen.function(f, x);
		VCExpr q = gen.forall(Arrays.asList(x),
				Arrays.asList(gen.trigger(true, fx), gen.trigger(false, gen.add(x, x))), fx);
		assertEquals("(forall x:int :: {f(x)} {:nopats x + x} f(x))", q.toString());
		VCExpr.Variable y = gen.variable("y", Type.INT);
		VCExpr l = gen.let(gen.lt(y, x), gen.letBinding(y, gen.integer(2)));
		assertEquals("(let y := 2; y < x)", l.toString());
		VCExpr e = gen.exists(Arrays.asList(x), Collections.emptyList(), fx);
		assertEquals("(exists x:int :: f(x))", e.toString());
	}
}
