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
import java.util.List;

import org.junit.Test;

import wyvc.core.Function;
import wyvc.core.Type;
import wyvc.core.VCExpressionGenerator;

public class MapTypeAbstractionBuilderTest {
	private final VCExpressionGenerator gen = new VCExpressionGenerator();

	private TypeAxiomBuilderPremisses builder(ErasureOptions options) {
		TypeAxiomBuilderPremisses builder = new TypeAxiomBuilderPremisses(gen, options);
		builder.setup();
		return builder;
	}

	@Test
	public void test_abstraction() {
		MapTypeAbstractionBuilderPremisses mb = builder(new ErasureOptions()).getMapTypeAbstracter();
		Type.Constructor c1 = mb.abstractMapType(Type.MAP(Arrays.asList(Type.INT), Type.BOOL));
		assertEquals("MapType0 int bool", c1.toString());
		// map types of the same shape share a class
		Type.Constructor c2 = mb.abstractMapType(Type.MAP(Arrays.asList(Type.BOOL), Type.INT));
		assertSame(c1.getDecl(), c2.getDecl());
		assertEquals("MapType0 bool int", c2.toString());
	}

	@Test
	public void test_polymorphic_abstraction() {
		MapTypeAbstractionBuilderPremisses mb = builder(new ErasureOptions()).getMapTypeAbstracter();
		Type.Variable a = new Type.Variable("a");
		Type.Decl list = new Type.Decl("List", 1);
		// <a>[List a, int]a is abstracted to <a>[List a, aVar0]a
		Type.Map m = Type.MAP(Arrays.asList(a), Arrays.asList(Type.CONSTRUCTOR(list, a), Type.INT), a);
		Type.Constructor c = mb.abstractMapType(m);
		assertEquals(1, c.getDecl().getArity());
		assertEquals(Arrays.asList(Type.INT), c.getArguments());
		// renaming the bound parameter does not change the class
		Type.Variable b = new Type.Variable("b");
		Type.Map n = Type.MAP(Arrays.asList(b), Arrays.asList(Type.CONSTRUCTOR(list, b), Type.BOOL), b);
		assertSame(c.getDecl(), mb.abstractMapType(n).getDecl());
	}

	@Test
	public void test_nested_maps() {
		MapTypeAbstractionBuilderPremisses mb = builder(new ErasureOptions()).getMapTypeAbstracter();
		Type.Variable a = new Type.Variable("a");
		Type.Map inner = Type.MAP(Arrays.asList(a), Type.INT);
		Type.Map outer = Type.MAP(Arrays.asList(a), Arrays.asList(a), inner);
		Type.Constructor c = mb.abstractMapType(outer);
		// the inner map mentions the bound a, so only its instantiation int is abstracted
		assertEquals(Arrays.asList(Type.INT), c.getArguments());
	}

	@Test
	public void test_select_store() {
		TypeAxiomBuilderPremisses b = builder(new ErasureOptions());
		MapTypeAbstractionBuilderPremisses mb = b.getMapTypeAbstracter();
		Type.Map m = Type.MAP(Arrays.asList(Type.INT), Type.BOOL);
		List<Type> instantiations = new ArrayList<>();
		Function select = mb.select(m, instantiations);
		assertEquals("MapType0Select", select.getName());
		assertEquals(Arrays.asList(Type.INT, Type.BOOL), instantiations);
		assertEquals(Arrays.asList(b.getU(), b.getU()), select.getParameterTypes());
		assertEquals(b.getU(), select.getReturnType());
		Function store = mb.store(m, new ArrayList<>());
		assertEquals("MapType0Store", store.getName());
		assertEquals(3, store.getArity());
		// the class is generated only once
		assertSame(select, mb.select(Type.MAP(Arrays.asList(Type.INT), Type.BOOL), new ArrayList<>()));
		assertNull(select.getAttribute("builtin"));
	}

	@Test
	public void test_map_axioms() {
		TypeAxiomBuilderPremisses b = builder(new ErasureOptions());
		b.getNewAxioms();
		b.getMapTypeAbstracter().select(Type.MAP(Arrays.asList(Type.INT), Type.BOOL), new ArrayList<>());
		List<String> qids = TypeAxiomBuilderPremissesTest.qids(b.getAllTypeAxioms());
		assertTrue(qids.contains("funType:MapType0Select"));
		assertTrue(qids.contains("funType:MapType0Store"));
		assertTrue(qids.contains("mapAx0:MapType0Select"));
		assertTrue(qids.contains("mapAx1:MapType0Select:0"));
		assertTrue(qids.contains("mapAx2:MapType0Select"));
	}

	@Test
	public void test_array_theory() {
		TypeAxiomBuilderPremisses b = builder(new ErasureOptions().setUseArrayTheory(true));
		Type.Map m = Type.MAP(Arrays.asList(Type.INT), Type.BOOL);
		assertEquals(m, b.typeAfterErasure(m));
		Function select = b.getMapTypeAbstracter().select(m, new ArrayList<>());
		assertEquals("select", select.getAttribute("builtin"));
		Function store = b.getMapTypeAbstracter().store(m, new ArrayList<>());
		assertEquals("store", store.getAttribute("builtin"));
		for (String qid : TypeAxiomBuilderPremissesTest.qids(b.getAllTypeAxioms())) {
			assertFalse(qid.startsWith("mapAx"));
		}
	}

	@Test
	public void test_monomorphize() {
		TypeAxiomBuilderPremisses b = builder(new ErasureOptions().setMonomorphize(true));
		Type.Map m = Type.MAP(Arrays.asList(Type.INT), Type.BOOL);
		Type.Constructor c = b.getMapTypeAbstracter().abstractMapType(m);
		// native types are kept, so there is nothing to instantiate
		assertEquals(0, c.getDecl().getArity());
		Function select = b.getMapTypeAbstracter().select(m, new ArrayList<>());
		assertEquals(Arrays.asList(b.getU(), Type.INT), select.getParameterTypes());
		assertEquals(Type.BOOL, select.getReturnType());
	}

	@Test
	public void test_explicit_select_type_params() {
		MapTypeAbstractionBuilderPremisses mb = builder(new ErasureOptions()).getMapTypeAbstracter();
		Type.Variable a = new Type.Variable("a");
		Type.Variable b = new Type.Variable("b");
		// <a,b>[a]b: b occurs only in the result
		Type.Map m = Type.MAP(Arrays.asList(a, b), Arrays.asList(a), b);
		assertEquals(Arrays.asList(1), mb.explicitSelectTypeParams(m));
		Function select = mb.select(m, new ArrayList<>());
		// one type argument, the map and one index
		assertEquals(3, select.getArity());
	}
}
