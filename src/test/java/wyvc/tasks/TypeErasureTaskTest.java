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
package wyvc.tasks;

import static org.junit.Assert.*;

import java.util.Arrays;

import org.junit.Test;

import com.google.common.collect.ImmutableList;

import wyvc.core.Function;
import wyvc.core.Type;
import wyvc.core.VCExpr;
import wyvc.core.VCExpressionGenerator;
import wyvc.erasure.ErasureOptions;

public class TypeErasureTaskTest {
	private final VCExpressionGenerator gen = new VCExpressionGenerator();
	private final Type.Variable a = new Type.Variable("a");
	private final Function g = new Function("g", ImmutableList.of(a), ImmutableList.of(a), a);

	@Test
	public void test_drain() {
		TypeErasureTask task = new TypeErasureTask(gen, new ErasureOptions());
		VCExpr setup = task.drainNewAxioms();
		assertNotSame(VCExpressionGenerator.TRUE, setup);
		assertEquals(8, VCExpressionGenerator.andSize(setup));
		assertSame(VCExpressionGenerator.TRUE, task.drainNewAxioms());
		VCExpr.Variable x = gen.variable("x", Type.INT);
		VCExpr r = task.erase(gen.eq(gen.function(g, Arrays.asList(x), Arrays.asList(Type.INT)), x), -1);
		assertEquals("U_2_int(g(int_2_U(x))) == x", r.toString());
		assertEquals(1, VCExpressionGenerator.andSize(task.drainNewAxioms()));
		assertEquals(9, task.getAllAxioms().size());
	}

	@Test
	public void test_fork() {
		TypeErasureTask task = new TypeErasureTask(gen, new ErasureOptions());
		task.drainNewAxioms();
		TypeErasureTask fork = task.fork();
		VCExpr.Variable x = gen.variable("x", Type.CONSTRUCTOR(new Type.Decl("C", 0)));
		fork.erase(gen.eq(x, x), 1);
		// the constructor and the variable are only registered in the fork
		assertEquals(2, VCExpressionGenerator.andSize(fork.drainNewAxioms()));
		assertSame(VCExpressionGenerator.TRUE, task.drainNewAxioms());
		assertEquals(8, task.getAllAxioms().size());
		assertEquals(10, fork.getAllAxioms().size());
		assertSame(task.getGenerator(), fork.getGenerator());
		assertNotSame(task.getAxiomBuilder(), fork.getAxiomBuilder());
	}

	@Test
	public void test_arguments_encoding() {
		try {
			new TypeErasureTask(gen, new ErasureOptions().setTypeEncoding(ErasureOptions.TypeEncoding.ARGUMENTS));
			fail("argument encoding accepted");
		} catch (IllegalArgumentException e) {
			// expected
		}
	}

	@Test
	public void test_options_copied() {
		ErasureOptions options = new ErasureOptions();
		TypeErasureTask task = new TypeErasureTask(gen, options);
		options.setTypeEncoding(ErasureOptions.TypeEncoding.NONE);
		assertEquals(ErasureOptions.TypeEncoding.PREDICATES, task.getAxiomBuilder().getOptions().getTypeEncoding());
	}

	@Test
	public void test_fork_options_isolated() {
		TypeErasureTask task = new TypeErasureTask(gen, new ErasureOptions());
		TypeErasureTask fork = task.fork();
		fork.getAxiomBuilder().getOptions().setTypeEncoding(ErasureOptions.TypeEncoding.NONE);
		assertEquals(ErasureOptions.TypeEncoding.PREDICATES, task.getAxiomBuilder().getOptions().getTypeEncoding());
		assertEquals(ErasureOptions.TypeEncoding.PREDICATES, fork.getAxiomBuilder().getOptions().getTypeEncoding());
	}

	@Test
	public void test_new_axiom_count() {
		TypeErasureTask task = new TypeErasureTask(gen, new ErasureOptions());
		task.drainNewAxioms();
		int before = task.getAllAxioms().size();
		VCExpr.Variable m = gen.variable("m", Type.MAP(Arrays.asList(Type.INT), Type.BOOL));
		task.erase(gen.select(m, gen.integer(0)), 1);
		int count = task.getAxiomBuilder().getNewAxiomCount();
		// the count is of axioms, not of their conjuncts
		assertEquals(task.getAllAxioms().size() - before, count);
		task.drainNewAxioms();
		assertEquals(0, task.getAxiomBuilder().getNewAxiomCount());
	}
}
