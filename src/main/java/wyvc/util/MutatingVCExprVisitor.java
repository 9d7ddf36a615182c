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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import wyvc.core.VCExpr;
import wyvc.core.VCExpressionGenerator;

/**
 * Rewrites an expression bottom-up. Nodes whose children are unchanged (by
 * identity) are reused rather than rebuilt. Nested operator applications are
 * processed with an explicit stack, so that long chains of conjunctions and
 * disjunctions do not exhaust the call stack.
 *
 * @param <A>
 */
public abstract class MutatingVCExprVisitor<A> extends AbstractVCExprVisitor<VCExpr, A> {
    protected final VCExpressionGenerator gen;

    public MutatingVCExprVisitor(VCExpressionGenerator gen) {
        this.gen = gen;
    }

    public VCExpressionGenerator getGenerator() {
        return gen;
    }

    public VCExpr mutate(VCExpr expr, A arg) {
        return visitExpression(expr, arg);
    }

    public List<VCExpr> mutateSeq(List<? extends VCExpr> exprs, A arg) {
        ArrayList<VCExpr> result = new ArrayList<>();
        for (VCExpr e : exprs) {
            result.add(mutate(e, arg));
        }
        return result;
    }

    public List<VCExpr.Trigger> mutateTriggers(List<VCExpr.Trigger> triggers, A arg) {
        ArrayList<VCExpr.Trigger> result = new ArrayList<>();
        for (VCExpr.Trigger t : triggers) {
            List<VCExpr> exprs = mutateSeq(t.getExprs(), arg);
            result.add(identical(t.getExprs(), exprs) ? t : gen.trigger(t.isPositive(), exprs));
        }
        return result;
    }

    @Override
    protected VCExpr visitLiteral(VCExpr.Literal expr, A arg) {
        return expr;
    }

    @Override
    protected VCExpr visitVariable(VCExpr.Variable expr, A arg) {
        return expr;
    }

    /**
     * Determine whether a nested application should be processed on the
     * explicit stack of {@link #visitNAry(VCExpr.NAry, Object)}. Applications
     * for which this returns false are passed back through
     * {@link #mutate(VCExpr, Object)} instead. Subclasses which override
     * <code>visitNAry()</code> must restrict this to the applications they
     * delegate here.
     *
     * @param expr
     * @return
     */
    protected boolean flatten(VCExpr.NAry expr) {
        return true;
    }

    @Override
    protected VCExpr visitNAry(VCExpr.NAry expr, A arg) {
        ArrayDeque<Object> todo = new ArrayDeque<>();
        ArrayDeque<VCExpr> results = new ArrayDeque<>();
        todo.push(new Frame(expr));
        while (!todo.isEmpty()) {
            Object next = todo.pop();
            if (next instanceof Frame) {
                Frame frame = (Frame) next;
                VCExpr.NAry node = frame.node;
                if (!frame.expanded) {
                    frame.expanded = true;
                    todo.push(frame);
                    for (int i = node.size() - 1; i >= 0; --i) {
                        VCExpr child = node.get(i);
                        if (child instanceof VCExpr.NAry && flatten((VCExpr.NAry) child)) {
                            todo.push(new Frame((VCExpr.NAry) child));
                        } else {
                            todo.push(child);
                        }
                    }
                } else {
                    VCExpr[] children = new VCExpr[node.size()];
                    boolean changed = false;
                    for (int i = children.length - 1; i >= 0; --i) {
                        children[i] = results.pop();
                        changed |= children[i] != node.get(i);
                    }
                    results.push(updateModifiedNode(node, Arrays.asList(children), changed, arg));
                }
            } else {
                results.push(mutate((VCExpr) next, arg));
            }
        }
        return results.pop();
    }

    /**
     * Construct the result for an application whose arguments have been
     * rewritten.
     *
     * @param original the application before rewriting
     * @param arguments the rewritten arguments
     * @param changed whether any argument differs from the original
     * @param arg
     * @return
     */
    protected VCExpr updateModifiedNode(VCExpr.NAry original, List<VCExpr> arguments, boolean changed, A arg) {
        if (!changed) {
            return original;
        }
        return gen.function(original.getOperator(), arguments, original.getTypeArguments());
    }

    @Override
    protected VCExpr visitQuantifier(VCExpr.Quantifier expr, A arg) {
        List<VCExpr.Trigger> triggers = mutateTriggers(expr.getTriggers(), arg);
        VCExpr body = mutate(expr.getBody(), arg);
        if (body == expr.getBody() && identical(expr.getTriggers(), triggers)) {
            return expr;
        }
        return gen.quantify(expr.getKind(), expr.getTypeParameters(), expr.getBoundVariables(), triggers,
                expr.getInfo(), body);
    }

    @Override
    protected VCExpr visitLet(VCExpr.Let expr, A arg) {
        boolean changed = false;
        ArrayList<VCExpr.LetBinding> bindings = new ArrayList<>();
        for (VCExpr.LetBinding b : expr.getBindings()) {
            VCExpr e = mutate(b.getExpr(), arg);
            changed |= e != b.getExpr();
            bindings.add(e == b.getExpr() ? b : gen.letBinding(b.getVariable(), e));
        }
        VCExpr body = mutate(expr.getBody(), arg);
        if (!changed && body == expr.getBody()) {
            return expr;
        }
        return gen.let(bindings, body);
    }

    /**
     * Check whether two lists hold the same objects in the same order.
     */
    protected static boolean identical(List<?> lhs, List<?> rhs) {
        if (lhs.size() != rhs.size()) {
            return false;
        }
        for (int i = 0; i != lhs.size(); ++i) {
            if (lhs.get(i) != rhs.get(i)) {
                return false;
            }
        }
        return true;
    }

    private static final class Frame {
        private final VCExpr.NAry node;
        private boolean expanded;

        private Frame(VCExpr.NAry node) {
            this.node = node;
        }
    }
}
