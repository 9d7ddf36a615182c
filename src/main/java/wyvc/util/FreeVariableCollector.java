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
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import wyvc.core.Type;
import wyvc.core.VCExpr;

/**
 * Collects the free term and type variables of one or more expressions, in
 * order of first occurrence.
 */
public class FreeVariableCollector extends TraversingVCExprVisitor<Void> {
    private final LinkedHashSet<VCExpr.Variable> freeTermVariables = new LinkedHashSet<>();
    private final LinkedHashSet<Type.Variable> freeTypeVariables = new LinkedHashSet<>();
    // bound variables are counted, since binders of the same variable may nest
    private final Map<VCExpr.Variable, Integer> boundTermVariables = new HashMap<>();
    private final Map<Type.Variable, Integer> boundTypeVariables = new HashMap<>();

    public static List<VCExpr.Variable> freeTermVariables(VCExpr expr) {
        FreeVariableCollector collector = new FreeVariableCollector();
        collector.collect(expr);
        return collector.getFreeTermVariables();
    }

    public static List<Type.Variable> freeTypeVariables(VCExpr expr) {
        FreeVariableCollector collector = new FreeVariableCollector();
        collector.collect(expr);
        return collector.getFreeTypeVariables();
    }

    public void collect(VCExpr expr) {
        traverse(expr, null);
    }

    public void collect(List<VCExpr> exprs) {
        traverse(exprs, null);
    }

    public List<VCExpr.Variable> getFreeTermVariables() {
        return new ArrayList<>(freeTermVariables);
    }

    public List<Type.Variable> getFreeTypeVariables() {
        return new ArrayList<>(freeTypeVariables);
    }

    public void reset() {
        freeTermVariables.clear();
        freeTypeVariables.clear();
    }

    @Override
    protected Void visitVariable(VCExpr.Variable expr, Void arg) {
        if (!boundTermVariables.containsKey(expr)) {
            freeTermVariables.add(expr);
            collectTypeVariables(expr.getType());
        }
        return null;
    }

    @Override
    protected List<VCExpr> visitNAryNode(VCExpr.NAry expr, Void arg) {
        for (Type t : expr.getTypeArguments()) {
            collectTypeVariables(t);
        }
        return super.visitNAryNode(expr, arg);
    }

    @Override
    protected Void visitQuantifier(VCExpr.Quantifier expr, Void arg) {
        bind(boundTypeVariables, expr.getTypeParameters());
        bind(boundTermVariables, expr.getBoundVariables());
        for (VCExpr.Variable v : expr.getBoundVariables()) {
            collectTypeVariables(v.getType());
        }
        super.visitQuantifier(expr, arg);
        unbind(boundTermVariables, expr.getBoundVariables());
        unbind(boundTypeVariables, expr.getTypeParameters());
        return null;
    }

    @Override
    protected Void visitLet(VCExpr.Let expr, Void arg) {
        bind(boundTermVariables, expr.getBoundVariables());
        for (VCExpr.Variable v : expr.getBoundVariables()) {
            collectTypeVariables(v.getType());
        }
        super.visitLet(expr, arg);
        unbind(boundTermVariables, expr.getBoundVariables());
        return null;
    }

    private void collectTypeVariables(Type type) {
        for (Type.Variable v : type.getFreeVariables()) {
            if (!boundTypeVariables.containsKey(v)) {
                freeTypeVariables.add(v);
            }
        }
    }

    private static <T> void bind(Map<T, Integer> bound, List<? extends T> vars) {
        for (T v : vars) {
            bound.merge(v, 1, Integer::sum);
        }
    }

    private static <T> void unbind(Map<T, Integer> bound, List<? extends T> vars) {
        for (T v : vars) {
            int count = bound.get(v);
            if (count == 1) {
                bound.remove(v);
            } else {
                bound.put(v, count - 1);
            }
        }
    }
}
