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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import wyvc.core.VCExpr;
import wyvc.core.VCExpressionGenerator;

/**
 * Replaces free occurrences of term variables by expressions. Variables bound
 * inside the expression shadow the substitution, and bound variables which
 * would capture a free variable of a substituted expression are renamed.
 */
public class SubstitutingVCExprVisitor extends MutatingVCExprVisitor<Map<VCExpr.Variable, VCExpr>> {

    public SubstitutingVCExprVisitor(VCExpressionGenerator gen) {
        super(gen);
    }

    public VCExpr apply(Map<VCExpr.Variable, VCExpr> substitution, VCExpr expr) {
        if (substitution.isEmpty()) {
            return expr;
        }
        return mutate(expr, substitution);
    }

    @Override
    protected VCExpr visitVariable(VCExpr.Variable expr, Map<VCExpr.Variable, VCExpr> substitution) {
        VCExpr e = substitution.get(expr);
        return e == null ? expr : e;
    }

    @Override
    protected VCExpr visitQuantifier(VCExpr.Quantifier expr, Map<VCExpr.Variable, VCExpr> substitution) {
        List<VCExpr.Variable> boundVariables = new ArrayList<>();
        Map<VCExpr.Variable, VCExpr> inner = enterScope(expr.getBoundVariables(), boundVariables, substitution);
        if (inner.isEmpty()) {
            return expr;
        }
        List<VCExpr.Trigger> triggers = mutateTriggers(expr.getTriggers(), inner);
        VCExpr body = mutate(expr.getBody(), inner);
        if (body == expr.getBody() && identical(triggers, expr.getTriggers())
                && identical(boundVariables, expr.getBoundVariables())) {
            return expr;
        }
        return gen.quantify(expr.getKind(), expr.getTypeParameters(), boundVariables, triggers, expr.getInfo(),
                body);
    }

    @Override
    protected VCExpr visitLet(VCExpr.Let expr, Map<VCExpr.Variable, VCExpr> substitution) {
        List<VCExpr.Variable> boundVariables = new ArrayList<>();
        Map<VCExpr.Variable, VCExpr> inner = enterScope(expr.getBoundVariables(), boundVariables, substitution);
        if (inner.isEmpty()) {
            return expr;
        }
        boolean changed = !identical(boundVariables, expr.getBoundVariables());
        ArrayList<VCExpr.LetBinding> bindings = new ArrayList<>();
        for (int i = 0; i != expr.size(); ++i) {
            VCExpr e = mutate(expr.get(i).getExpr(), inner);
            changed |= e != expr.get(i).getExpr();
            bindings.add(gen.letBinding(boundVariables.get(i), e));
        }
        VCExpr body = mutate(expr.getBody(), inner);
        if (!changed && body == expr.getBody()) {
            return expr;
        }
        return gen.let(bindings, body);
    }

    /**
     * Construct the substitution to apply underneath a binder. Bound variables
     * shadow the outer substitution, and any bound variable occurring free in a
     * substituted expression is replaced by a fresh variable.
     *
     * @param bound the variables bound by the binder
     * @param renamed receives the (possibly renamed) bound variables
     * @param substitution the outer substitution
     * @return
     */
    private Map<VCExpr.Variable, VCExpr> enterScope(List<VCExpr.Variable> bound, List<VCExpr.Variable> renamed,
            Map<VCExpr.Variable, VCExpr> substitution) {
        HashMap<VCExpr.Variable, VCExpr> inner = new HashMap<>(substitution);
        for (VCExpr.Variable v : bound) {
            inner.remove(v);
        }
        if (inner.isEmpty()) {
            renamed.addAll(bound);
            return Collections.emptyMap();
        }
        FreeVariableCollector collector = new FreeVariableCollector();
        for (VCExpr e : inner.values()) {
            collector.collect(e);
        }
        Set<VCExpr.Variable> captured = new HashSet<>(collector.getFreeTermVariables());
        for (VCExpr.Variable v : bound) {
            if (captured.contains(v)) {
                VCExpr.Variable fresh = gen.variable(v.getName(), v.getType());
                inner.put(v, fresh);
                renamed.add(fresh);
            } else {
                renamed.add(v);
            }
        }
        return inner;
    }
}
