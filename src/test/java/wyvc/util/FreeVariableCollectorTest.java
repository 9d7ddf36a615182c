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
package wyvc.util;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import wyvc.core.Function;
import wyvc.core.Type;
import wyvc.core.VCExpr;
import wyvc.core.VCExpressionGenerator;

public class FreeVariableCollectorTest {
    private final VCExpressionGenerator gen = new VCExpressionGenerator();

    @Test
    public void test_order_of_occurrence() {
        VCExpr.Variable x = gen.variable("x", Type.INT);
        VCExpr.Variable y = gen.variable("y", Type.INT);
        VCExpr e = gen.lt(gen.add(y, x), y);
        assertEquals(Arrays.asList(y, x), FreeVariableCollector.freeTermVariables(e));
    }

    @Test
    public void test_bound_variables() {
        VCExpr.Variable x = gen.variable("x", Type.INT);
        VCExpr.Variable y = gen.variable("y", Type.INT);
        VCExpr q = gen.forall(Arrays.asList(x), Collections.emptyList(), gen.lt(x, y));
        assertEquals(Arrays.asList(y), FreeVariableCollector.freeTermVariables(q));
        // x occurs both free and bound
        VCExpr e = gen.and(q, gen.lt(x, gen.integer(0)));
        assertEquals(Arrays.asList(y, x), FreeVariableCollector.freeTermVariables(e));
    }

    @Test
    public void test_let() {
        VCExpr.Variable x = gen.variable("x", Type.INT);
        VCExpr.Variable y = gen.variable("y", Type.INT);
        VCExpr e = gen.let(gen.lt(x, y), gen.letBinding(x, gen.integer(1)));
        assertEquals(Arrays.asList(y), FreeVariableCollector.freeTermVariables(e));
    }

    @Test
    public void test_type_variables() {
        Type.Variable a = new Type.Variable("a");
        Type.Variable b = new Type.Variable("b");
        Function f = new Function("f", Arrays.asList(a), Arrays.asList(a), Type.BOOL);
        VCExpr.Variable x = gen.variable("x", b);
        VCExpr e = gen.function(f, Arrays.asList(x), Arrays.asList(b));
        assertEquals(Arrays.asList(b), FreeVariableCollector.freeTypeVariables(e));
        // type parameters of a quantifier are bound
        VCExpr.Variable z = gen.variable("z", a);
        VCExpr q = gen.forall(Arrays.asList(a), Arrays.asList(z), Collections.emptyList(),
                VCExpr.Quantifier.Info.EMPTY, gen.function(f, Arrays.asList(z), Arrays.asList(a)));
        assertTrue(FreeVariableCollector.freeTypeVariables(q).isEmpty());
    }

    @Test
    public void test_deep_conjunction() {
        VCExpr.Variable x = gen.variable("x", Type.INT);
        VCExpr.Variable b = gen.variable("b", Type.BOOL);
        VCExpr e = gen.lt(x, x);
        for (int i = 0; i != 100000; ++i) {
            e = gen.and(e, b);
        }
        assertEquals(Arrays.asList(x, b), FreeVariableCollector.freeTermVariables(e));
        // one node per conjunction, plus x < x and its arguments, plus each b
        assertEquals(2 * 100000 + 3, SizeComputingVisitor.size(e));
    }
}
