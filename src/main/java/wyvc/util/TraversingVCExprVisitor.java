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
import java.util.List;

import wyvc.core.VCExpr;

/**
 * Visits every subexpression, including the triggers of quantifiers and the
 * right-hand sides of let bindings. Subclasses override the cases they are
 * interested in and call back into this class to continue the traversal.
 * Nested applications are walked with an explicit stack, so subclasses
 * interested in applications override {@link #visitNAryNode(VCExpr.NAry, Object)}
 * rather than <code>visitNAry()</code>.
 *
 * @param <A>
 */
public abstract class TraversingVCExprVisitor<A> extends AbstractVCExprVisitor<Void, A> {

    public void traverse(VCExpr expr, A arg) {
        visitExpression(expr, arg);
    }

    protected void traverse(List<VCExpr> exprs, A arg) {
        for (VCExpr e : exprs) {
            visitExpression(e, arg);
        }
    }

    @Override
    protected Void visitLiteral(VCExpr.Literal expr, A arg) {
        return null;
    }

    @Override
    protected Void visitNAry(VCExpr.NAry expr, A arg) {
        ArrayDeque<VCExpr> todo = new ArrayDeque<>();
        todo.push(expr);
        while (!todo.isEmpty()) {
            VCExpr next = todo.pop();
            if (next instanceof VCExpr.NAry) {
                List<VCExpr> children = visitNAryNode((VCExpr.NAry) next, arg);
                for (int i = children.size() - 1; i >= 0; --i) {
                    todo.push(children.get(i));
                }
            } else {
                visitExpression(next, arg);
            }
        }
        return null;
    }

    /**
     * Visit a single application reached by {@link #visitNAry(VCExpr.NAry, Object)}.
     * This is called once for every application, nested or not.
     *
     * @param expr
     * @param arg
     * @return the arguments which remain to be traversed
     */
    protected List<VCExpr> visitNAryNode(VCExpr.NAry expr, A arg) {
        return expr.getArguments();
    }

    @Override
    protected Void visitVariable(VCExpr.Variable expr, A arg) {
        return null;
    }

    @Override
    protected Void visitQuantifier(VCExpr.Quantifier expr, A arg) {
        for (VCExpr.Trigger t : expr.getTriggers()) {
            traverse(t.getExprs(), arg);
        }
        visitExpression(expr.getBody(), arg);
        return null;
    }

    @Override
    protected Void visitLet(VCExpr.Let expr, A arg) {
        for (VCExpr.LetBinding b : expr.getBindings()) {
            visitExpression(b.getExpr(), arg);
        }
        visitExpression(expr.getBody(), arg);
        return null;
    }
}
