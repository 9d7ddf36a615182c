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
import java.util.HashMap;

import org.junit.Test;

import wyvc.core.Type;
import wyvc.core.VCExpr;
import wyvc.core.VCExpressionGenerator;

public class SubstitutingVCExprVisitorTest {
    private final VCExpressionGenerator gen = new VCExpressionGenerator();
    private final SubstitutingVCExprVisitor substituter = new SubstitutingVCExprVisitor(gen);

    @Test
    public void test_free_occurrences() {
        VCExpr.Variable x = gen.variable("x", Type.INT);
        VCExpr.Variable y = gen.variable("y", Type.INT);
        HashMap<VCExpr.Variable, VCExpr> s = new HashMap<>();
        s.put(x, gen.integer(1));
        assertEquals(gen.add(gen.integer(1), y), substituter.apply(s, gen.add(x, y)));
    }

    @Test
    public void test_unchanged_is_identical() {
        VCExpr.Variable x = gen.variable("x", Type.INT);
        VCExpr.Variable y = gen.variable("y", Type.INT);
        HashMap<VCExpr.Variable, VCExpr> s = new HashMap<>();
        s.put(x, gen.integer(1));
        VCExpr e = gen.add(y, y);
        assertSame(e, substituter.apply(s, e));
        assertSame(e, substituter.apply(Collections.emptyMap(), e));
    }

    @Test
    public void test_shadowing() {
        VCExpr.Variable x = gen.variable("x", Type.INT);
        VCExpr q = gen.forall(Arrays.asList(x), Collections.emptyList(), gen.lt(x, gen.integer(0)));
        HashMap<VCExpr.Variable, VCExpr> s = new HashMap<>();
        s.put(x, gen.integer(1));
        assertSame(q, substituter.apply(s, q));
    }

    @Test
    public void test_capture_avoidance() {
        VCExpr.Variable x = gen.variable("x", Type.INT);
        VCExpr.Variable y = gen.variable("y", Type.INT);
        // forall x :: x < y, with y := x
        VCExpr q = gen.forall(Arrays.asList(x), Collections.emptyList(), gen.lt(x, y));
        HashMap<VCExpr.Variable, VCExpr> s = new HashMap<>();
        s.put(y, x);
        VCExpr.Quantifier r = (VCExpr.Quantifier) substituter.apply(s, q);
        VCExpr.Variable bound = r.getBoundVariables().get(0);
        assertNotSame(x, bound);
        assertEquals(gen.lt(bound, x), r.getBody());
        assertEquals(Arrays.asList(x), FreeVariableCollector.freeTermVariables(r));
    }

    @Test
    public void test_deep_conjunction() {
        VCExpr.Variable p = gen.variable("p", Type.BOOL);
        VCExpr.Variable q = gen.variable("q", Type.BOOL);
        VCExpr e = p;
        VCExpr expected = q;
        for (int i = 0; i != 100000; ++i) {
            e = gen.and(e, p);
            expected = gen.and(expected, q);
        }
        HashMap<VCExpr.Variable, VCExpr> s = new HashMap<>();
        s.put(p, q);
        assertEquals(expected, substituter.apply(s, e));
    }

    @Test
    public void test_size() {
        VCExpr.Variable x = gen.variable("x", Type.INT);
        assertEquals(1, SizeComputingVisitor.size(x));
        assertEquals(3, SizeComputingVisitor.size(gen.add(x, gen.integer(1))));
    }
}
