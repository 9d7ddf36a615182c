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
package wyvc.erasure;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.ImmutableList;

import wyvc.core.Function;
import wyvc.core.Type;
import wyvc.core.VCExpr;
import wyvc.core.VCExprOp;
import wyvc.core.VCExpressionGenerator;

public class TypeAxiomBuilderPremissesTest {
	private final VCExpressionGenerator gen = new VCExpressionGenerator();
	private TypeAxiomBuilderPremisses builder;

	@Before
	public void setup() {
		builder = new TypeAxiomBuilderPremisses(gen, new ErasureOptions());
		builder.setup();
	}

	@Test
	public void test_setup_axioms() {
		// two constructor ids, then left inverse, reverse cast and type axiom for each cast
		assertEquals(8, builder.getAllTypeAxioms().size());
		assertEquals("Ctor(intType()) == 0", builder.getAllTypeAxioms().get(0).toString());
		assertEquals("Ctor(boolType()) == 1", builder.getAllTypeAxioms().get(1).toString());
		List<String> qids = qids(builder.getAllTypeAxioms());
		assertTrue(qids.contains("typeInv:U_2_int"));
		assertTrue(qids.contains("cast:U_2_int"));
		assertTrue(qids.contains("funType:int_2_U"));
		assertTrue(qids.contains("cast:U_2_bool"));
	}

	@Test
	public void test_new_axioms_drained() {
		VCExpr axioms = builder.getNewAxioms();
		assertEquals(8, VCExpressionGenerator.andSize(axioms));
		assertSame(VCExpressionGenerator.TRUE, builder.getNewAxioms());
		// the accumulated axioms are kept
		assertEquals(8, builder.getAllTypeAxioms().size());
	}

	@Test
	public void test_no_type_encoding() {
		TypeAxiomBuilderPremisses b = new TypeAxiomBuilderPremisses(gen,
				new ErasureOptions().setTypeEncoding(ErasureOptions.TypeEncoding.NONE));
		b.setup();
		// only left inverses and reverse casts remain
		assertEquals(4, b.getAllTypeAxioms().size());
		assertEquals(Arrays.asList("typeInv:U_2_int", "cast:U_2_int", "typeInv:U_2_bool", "cast:U_2_bool"),
				qids(b.getAllTypeAxioms()));
	}

	@Test
	public void test_reverse_cast_axiom() {
		VCExpr axiom = builder.getAllTypeAxioms().get(3);
		assertEquals("(forall x:U :: {U_2_int(x)} (type(x) == intType()) ==> (int_2_U(U_2_int(x)) == x))",
				axiom.toString());
	}

	@Test
	public void test_basic_representations_shared() {
		assertSame(builder.typeToTerm(Type.INT), builder.typeToTerm(Type.INT));
		assertNotEquals(builder.typeToTerm(Type.INT), builder.typeToTerm(Type.BOOL));
	}

	@Test
	public void test_type_constructor() {
		builder.getNewAxioms();
		Type.Decl list = new Type.Decl("List", 1);
		VCExpr term = builder.typeToTerm(Type.CONSTRUCTOR(list, Type.INT));
		assertEquals("ListType(intType())", term.toString());
		List<String> qids = qids(builder.getAllTypeAxioms());
		assertTrue(qids.contains("ctor:ListType"));
		assertTrue(qids.contains("typeInv:ListTypeInv0"));
		assertEquals(2, VCExpressionGenerator.andSize(builder.getNewAxioms()));
		// registered only once
		builder.typeToTerm(Type.CONSTRUCTOR(list, Type.BOOL));
		assertSame(VCExpressionGenerator.TRUE, builder.getNewAxioms());
		assertSame(builder.getTypeCtorRepr(list), builder.getTypeCtorRepr(list));
		assertEquals("ListTypeInv0", builder.getTypeDtor(list, 0).getName());
	}

	@Test
	public void test_constructor_ids_increase() {
		builder.getNewAxioms();
		builder.typeToTerm(Type.BV(8));
		assertEquals("Ctor(bv8Type()) == 2", builder.getNewAxioms().toString());
	}

	@Test
	public void test_casts() {
		Function toU = builder.castFrom(Type.INT);
		Function fromU = builder.castTo(Type.INT);
		assertEquals("int_2_U", toU.getName());
		assertEquals("U_2_int", fromU.getName());
		assertTrue(builder.isCast(toU));
		assertTrue(builder.isCast(fromU));
		assertFalse(builder.isCast(Function.create("int_2_U", builder.getU(), Type.INT)));
		VCExpr.Variable x = gen.variable("x", Type.INT);
		VCExpr.Variable u = gen.variable("u", builder.getU());
		assertEquals("int_2_U(x)", builder.cast(x, builder.getU()).toString());
		assertEquals("U_2_bool(u)", builder.cast(u, Type.BOOL).toString());
		assertSame(x, builder.cast(x, Type.INT));
	}

	@Test
	public void test_invalid_casts() {
		VCExpr.Variable x = gen.variable("x", Type.INT);
		try {
			builder.cast(x, Type.BOOL);
			fail("cast between native types accepted");
		} catch (IllegalArgumentException e) {
			// expected
		}
		try {
			builder.cast(x, Type.CONSTRUCTOR(new Type.Decl("C", 0)));
			fail("cast to erased type accepted");
		} catch (IllegalArgumentException e) {
			// expected
		}
	}

	@Test
	public void test_type_after_erasure() {
		assertEquals(Type.INT, builder.typeAfterErasure(Type.INT));
		assertEquals(Type.BV(32), builder.typeAfterErasure(Type.BV(32)));
		assertEquals(builder.getU(), builder.typeAfterErasure(new Type.Variable("a")));
		assertEquals(builder.getU(), builder.typeAfterErasure(Type.MAP(Arrays.asList(Type.INT), Type.INT)));
	}

	@Test
	public void test_separate_type_params() {
		Type.Variable a = new Type.Variable("a");
		Type.Variable b = new Type.Variable("b");
		Type.Decl list = new Type.Decl("List", 1);
		TypeAxiomBuilderPremisses.TypeParameterPartition p = TypeAxiomBuilderPremisses
				.separateTypeParams(Arrays.asList(Type.CONSTRUCTOR(list, b)), Arrays.asList(a, b));
		assertEquals(Arrays.asList(b), p.getImplicit());
		assertEquals(Arrays.asList(a), p.getExplicit());
	}

	@Test
	public void test_unchanged_function() {
		Function f = Function.create("f", Type.BOOL, Type.INT);
		TypeAxiomBuilderPremisses.UntypedFunction u = builder.typed2Untyped(f);
		assertSame(f, u.getFunction());
		assertSame(u, builder.typed2Untyped(f));
	}

	@Test
	public void test_implicit_type_parameter() {
		builder.getNewAxioms();
		Type.Variable a = new Type.Variable("a");
		Function g = new Function("g", ImmutableList.of(a), ImmutableList.of(a), a);
		TypeAxiomBuilderPremisses.UntypedFunction u = builder.typed2Untyped(g);
		assertEquals("g", u.getFunction().getName());
		assertEquals(Arrays.asList(builder.getU()), u.getFunction().getParameterTypes());
		assertEquals(builder.getU(), u.getFunction().getReturnType());
		assertEquals(Arrays.asList(a), u.getImplicitTypeParameters());
		assertTrue(u.getExplicitTypeParameters().isEmpty());
		assertEquals("(forall arg0:U :: {g(arg0)} (let a := type(arg0); type(g(arg0)) == a))",
				builder.getNewAxioms().toString());
	}

	@Test
	public void test_explicit_type_parameter() {
		builder.getNewAxioms();
		Type.Variable a = new Type.Variable("a");
		Function h = new Function("h", ImmutableList.of(a), ImmutableList.of(Type.INT), a);
		TypeAxiomBuilderPremisses.UntypedFunction u = builder.typed2Untyped(h);
		assertEquals(Arrays.asList(builder.getT(), Type.INT), u.getFunction().getParameterTypes());
		assertEquals(Arrays.asList(a), u.getExplicitTypeParameters());
		assertEquals("(forall a:T, arg0:int :: {h(a, arg0)} type(h(a, arg0)) == a)",
				builder.getNewAxioms().toString());
	}

	@Test
	public void test_function_axiom_arity_mismatch() {
		Function f = Function.create("f", builder.getU(), builder.getU());
		try {
			builder.genFunctionAxiom(f, Collections.emptyList(), Collections.emptyList(),
					Arrays.asList(Type.INT, Type.INT), Type.INT);
			fail("function axiom with wrong arity accepted");
		} catch (IllegalArgumentException e) {
			// expected
		}
	}

	@Test
	public void test_free_variables() {
		builder.getNewAxioms();
		Type c = Type.CONSTRUCTOR(new Type.Decl("C", 0));
		VCExpr.Variable x = gen.variable("x", Type.INT);
		VCExpr.Variable y = gen.variable("y", c);
		VCExpr.Variable ux = builder.typed2Untyped(x);
		assertEquals(Type.INT, ux.getType());
		assertSame(ux, builder.typed2Untyped(x));
		VCExpr.Variable uy = builder.typed2Untyped(y);
		assertEquals(builder.getU(), uy.getType());
		// the constructor id of C, then the type of y
		VCExpr axioms = builder.getNewAxioms();
		assertEquals("(Ctor(CType()) == 2) && (type(y) == CType())", axioms.toString());
	}

	@Test
	public void test_copy_isolation() {
		TypeAxiomBuilderPremisses copy = builder.copy();
		int before = builder.getAllTypeAxioms().size();
		copy.typeToTerm(Type.CONSTRUCTOR(new Type.Decl("List", 1), Type.INT));
		assertEquals(before, builder.getAllTypeAxioms().size());
		assertEquals(before + 2, copy.getAllTypeAxioms().size());
		// symbols created before copying are shared
		assertSame(builder.castFrom(Type.INT), copy.castFrom(Type.INT));
		assertSame(builder.getTypeFunction(), copy.getTypeFunction());
	}

	/**
	 * Extract the names of all quantified axioms, looking through conjunctions.
	 */
	static List<String> qids(List<VCExpr> axioms) {
		ArrayList<String> result = new ArrayList<>();
		for (VCExpr axiom : axioms) {
			qids(axiom, result);
		}
		return result;
	}

	static void qids(VCExpr axiom, List<String> result) {
		if (axiom instanceof VCExpr.Quantifier) {
			result.add(((VCExpr.Quantifier) axiom).getInfo().getQid());
		} else if (axiom instanceof VCExpr.NAry && ((VCExpr.NAry) axiom).getOperator() == VCExprOp.AND) {
			for (VCExpr e : ((VCExpr.NAry) axiom).getArguments()) {
				qids(e, result);
			}
		}
	}
}
