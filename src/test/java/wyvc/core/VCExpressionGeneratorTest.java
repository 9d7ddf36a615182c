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
package wyvc.core;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import com.google.common.collect.ImmutableList;

public class VCExpressionGeneratorTest {
	private final VCExpressionGenerator gen = new VCExpressionGenerator();

	private final VCExpr.Variable p = gen.variable("p", Type.BOOL);
	private final VCExpr.Variable q = gen.variable("q", Type.BOOL);
	private final VCExpr.Variable x = gen.variable("x", Type.INT);

	@Test
	public void test_andSimp() {
		assertSame(p, gen.andSimp(VCExpressionGenerator.TRUE, p));
		assertSame(p, gen.andSimp(p, VCExpressionGenerator.TRUE));
		assertSame(VCExpressionGenerator.FALSE, gen.andSimp(p, VCExpressionGenerator.FALSE));
		assertEquals(gen.and(p, q), gen.andSimp(p, q));
		assertSame(VCExpressionGenerator.TRUE, gen.andSimp(Collections.emptyList()));
	}

	@Test
	public void test_orSimp() {
		assertSame(p, gen.orSimp(VCExpressionGenerator.FALSE, p));
		assertSame(VCExpressionGenerator.TRUE, gen.orSimp(p, VCExpressionGenerator.TRUE));
		assertSame(VCExpressionGenerator.FALSE, gen.orSimp(Collections.emptyList()));
	}

	@Test
	public void test_notSimp() {
		assertSame(VCExpressionGenerator.FALSE, gen.notSimp(VCExpressionGenerator.TRUE));
		assertSame(p, gen.notSimp(gen.not(p)));
	}

	@Test
	public void test_impliesSimp() {
		assertSame(p, gen.impliesSimp(VCExpressionGenerator.TRUE, p));
		assertSame(VCExpressionGenerator.TRUE, gen.impliesSimp(VCExpressionGenerator.FALSE, p));
		assertSame(VCExpressionGenerator.TRUE, gen.impliesSimp(p, VCExpressionGenerator.TRUE));
		assertEquals(gen.not(p), gen.impliesSimp(p, VCExpressionGenerator.FALSE));
		// nested implications are pulled into the antecedent
		assertEquals(gen.implies(gen.and(p, q), p), gen.impliesSimp(p, gen.implies(q, p)));
	}

	@Test
	public void test_distinct_trivial() {
		assertSame(VCExpressionGenerator.TRUE, gen.distinct(Collections.emptyList()));
		assertSame(VCExpressionGenerator.TRUE, gen.distinct(Arrays.asList(x)));
		VCExpr d = gen.distinct(Arrays.asList(x, gen.integer(1), gen.integer(2)));
		assertEquals(VCExprOp.Kind.DISTINCT, ((VCExpr.NAry) d).getOperator().getKind());
	}

	@Test
	public void test_let_empty() {
		assertSame(p, gen.let(Collections.emptyList(), p));
	}

	@Test
	public void test_labelNeg_true() {
		assertSame(VCExpressionGenerator.TRUE, gen.labelNeg("L", VCExpressionGenerator.TRUE));
		assertEquals(Type.BOOL, gen.labelPos("L", p).getType());
	}

	@Test
	public void test_nary() {
		assertEquals(gen.add(gen.add(x, x), gen.integer(1)),
				gen.nary(VCExprOp.ADD, Arrays.asList(x, x, gen.integer(1))));
		assertEquals(gen.and(p, q), gen.nary(VCExprOp.AND, Arrays.asList(VCExpressionGenerator.TRUE, p, q)));
	}

	@Test
	public void test_andSize() {
		assertEquals(1, VCExpressionGenerator.andSize(p));
		assertEquals(3, VCExpressionGenerator.andSize(gen.and(p, gen.and(q, p))));
	}

	@Test
	public void test_asEquations() {
		VCExpr.LetBinding b = gen.letBinding(gen.variable("y", Type.INT), x);
		assertEquals(gen.eq(b.getVariable(), x), gen.asEquations(Arrays.asList(b)).get(0));
	}

	@Test
	public void test_asImplications() {
		VCExpr.Variable r = gen.variable("r", Type.BOOL);
		VCExpr.LetBinding b = gen.letBinding(r, gen.and(p, q));
		assertEquals(Arrays.asList(gen.implies(gen.and(p, q), r)), gen.asImplications(Arrays.asList(b)));
		assertTrue(gen.asImplications(Collections.emptyList()).isEmpty());
	}

	@Test
	public void test_arity_error() {
		try {
			gen.function(VCExprOp.ADD, x);
			fail("operator applied to too few arguments");
		} catch (IllegalArgumentException e) {
			// expected
		}
	}

	@Test
	public void test_type_error() {
		try {
			gen.and(p, x);
			fail("conjunction of integer accepted");
		} catch (IllegalArgumentException e) {
			// expected
		}
		try {
			gen.eq(p, x);
			fail("equation between incompatible types accepted");
		} catch (IllegalArgumentException e) {
			// expected
		}
	}

	@Test
	public void test_let_binding_type_error() {
		try {
			gen.letBinding(gen.variable("y", Type.BOOL), x);
			fail("ill-typed let binding accepted");
		} catch (IllegalArgumentException e) {
			// expected
		}
	}

	@Test
	public void test_quantifier_without_variables() {
		try {
			gen.forall(Collections.emptyList(), Collections.emptyList(), p);
			fail("quantifier without bound variables accepted");
		} catch (IllegalArgumentException e) {
			// expected
		}
	}

	@Test
	public void test_quantifier_non_boolean_body() {
		try {
			gen.forall(Arrays.asList(x), Collections.emptyList(), x);
			fail("quantifier over integer body accepted");
		} catch (IllegalArgumentException e) {
			// expected
		}
	}

	@Test
	public void test_empty_trigger() {
		try {
			gen.trigger(true, Collections.emptyList());
			fail("empty trigger accepted");
		} catch (IllegalArgumentException e) {
			// expected
		}
	}

	@Test
	public void test_polymorphic_function() {
		Type.Variable a = new Type.Variable("a");
		Function id = new Function("id", ImmutableList.of(a), ImmutableList.of(a), a);
		VCExpr app = gen.function(id, Arrays.asList(x), Arrays.asList(Type.INT));
		assertEquals(Type.INT, app.getType());
		try {
			gen.function(id, Arrays.asList(x), Arrays.asList(Type.BOOL));
			fail("ill-typed instantiation accepted");
		} catch (IllegalArgumentException e) {
			// expected
		}
	}

	@Test
	public void test_select_store() {
		Type.Map mt = Type.MAP(Arrays.asList(Type.INT), Type.BOOL);
		VCExpr.Variable m = gen.variable("m", mt);
		assertEquals(Type.BOOL, gen.select(m, x).getType());
		assertEquals(mt, gen.store(m, x, p).getType());
		try {
			gen.select(m, p);
			fail("ill-typed index accepted");
		} catch (IllegalArgumentException e) {
			// expected
		}
	}

	@Test
	public void test_polymorphic_select() {
		Type.Variable a = new Type.Variable("a");
		Type.Map mt = Type.MAP(Arrays.asList(a), Arrays.asList(Type.INT), a);
		VCExpr.Variable m = gen.variable("m", mt);
		VCExpr sel = gen.select(Arrays.asList(m, x), Arrays.asList(Type.BOOL));
		assertEquals(Type.BOOL, sel.getType());
	}

	@Test
	public void test_bitvectors() {
		VCExpr bv = gen.bitvector(java.math.BigInteger.valueOf(5), 8);
		assertEquals(Type.BV(8), bv.getType());
		assertEquals(Type.BV(4), gen.bvExtract(bv, 8, 0, 4).getType());
		assertEquals(Type.BV(16), gen.bvConcat(bv, bv).getType());
	}
}
