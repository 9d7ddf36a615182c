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
import java.util.HashMap;

import org.junit.Test;

public class TypeTest {

	@Test
	public void test_basic_types() {
		assertEquals(Type.BV(8), Type.BV(8));
		assertNotEquals(Type.BV(8), Type.BV(16));
		assertNotEquals(Type.INT, Type.BOOL);
		assertTrue(Type.INT.isBasic());
		assertTrue(Type.BV(1).isBitVector());
	}

	@Test
	public void test_variables() {
		Type.Variable a = new Type.Variable("a");
		Type.Variable b = new Type.Variable("a");
		assertEquals(a, a);
		assertNotEquals(a, b);
		assertEquals(Arrays.asList(a), a.getFreeVariables());
	}

	@Test
	public void test_constructors() {
		Type.Decl list = new Type.Decl("List", 1);
		assertEquals(Type.CONSTRUCTOR(list, Type.INT), Type.CONSTRUCTOR(list, Type.INT));
		assertNotEquals(Type.CONSTRUCTOR(list, Type.INT), Type.CONSTRUCTOR(new Type.Decl("List", 1), Type.INT));
		try {
			Type.CONSTRUCTOR(list);
			fail("constructor with too few arguments accepted");
		} catch (IllegalArgumentException e) {
			// expected
		}
	}

	@Test
	public void test_map_alpha_equivalence() {
		Type.Variable a = new Type.Variable("a");
		Type.Variable b = new Type.Variable("b");
		Type.Map m1 = Type.MAP(Arrays.asList(a), Arrays.asList(a), Type.INT);
		Type.Map m2 = Type.MAP(Arrays.asList(b), Arrays.asList(b), Type.INT);
		assertEquals(m1, m2);
		assertEquals(m1.hashCode(), m2.hashCode());
		assertTrue(m1.getFreeVariables().isEmpty());
		// a free variable is not equivalent to a bound one
		Type.Map m3 = Type.MAP(Arrays.asList(b), Arrays.asList(a), Type.INT);
		assertNotEquals(m1, m3);
		assertEquals(Arrays.asList(a), m3.getFreeVariables());
	}

	@Test
	public void test_map_duplicate_parameters() {
		Type.Variable a = new Type.Variable("a");
		try {
			Type.MAP(Arrays.asList(a, a), Arrays.asList(a), Type.INT);
			fail("map type with duplicate parameters accepted");
		} catch (IllegalArgumentException e) {
			// expected
		}
	}

	@Test
	public void test_substitute() {
		Type.Variable a = new Type.Variable("a");
		Type.Decl list = new Type.Decl("List", 1);
		HashMap<Type.Variable, Type> binding = new HashMap<>();
		binding.put(a, Type.INT);
		assertEquals(Type.CONSTRUCTOR(list, Type.INT), Type.CONSTRUCTOR(list, a).substitute(binding));
		// bound parameters are not substituted
		Type.Map m = Type.MAP(Arrays.asList(a), Arrays.asList(a), a);
		assertEquals(m, m.substitute(binding));
		assertEquals(Type.MAP(Collections.emptyList(), Arrays.asList(Type.INT), Type.BOOL),
				Type.MAP(Arrays.asList(a), Type.BOOL).substitute(binding));
	}

	@Test
	public void test_substitute_avoids_capture() {
		Type.Variable a = new Type.Variable("a");
		Type.Variable b = new Type.Variable("b");
		// <a>[a]b with b := a must not capture a
		Type.Map m = Type.MAP(Arrays.asList(a), Arrays.asList(a), b);
		HashMap<Type.Variable, Type> binding = new HashMap<>();
		binding.put(b, a);
		Type.Map r = (Type.Map) m.substitute(binding);
		assertNotSame(a, r.getTypeParameters().get(0));
		assertEquals(Arrays.asList(a), r.getFreeVariables());
	}
}
