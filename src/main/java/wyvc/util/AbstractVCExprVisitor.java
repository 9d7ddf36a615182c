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

import wyvc.core.VCExpr;

/**
 * Dispatches over the different kinds of expression, passing an argument of
 * type <code>A</code> down and producing a result of type <code>R</code>.
 *
 * @param <R>
 * @param <A>
 */
public abstract class AbstractVCExprVisitor<R, A> {

    public R visitExpression(VCExpr expr, A arg) {
        if (expr instanceof VCExpr.Literal) {
            return visitLiteral((VCExpr.Literal) expr, arg);
        } else if (expr instanceof VCExpr.NAry) {
            return visitNAry((VCExpr.NAry) expr, arg);
        } else if (expr instanceof VCExpr.Variable) {
            return visitVariable((VCExpr.Variable) expr, arg);
        } else if (expr instanceof VCExpr.Quantifier) {
            return visitQuantifier((VCExpr.Quantifier) expr, arg);
        } else if (expr instanceof VCExpr.Let) {
            return visitLet((VCExpr.Let) expr, arg);
        } else {
            throw new IllegalArgumentException("unknown expression encountered (" + expr.getClass().getName() + ")");
        }
    }

    protected abstract R visitLiteral(VCExpr.Literal expr, A arg);

    protected abstract R visitNAry(VCExpr.NAry expr, A arg);

    protected abstract R visitVariable(VCExpr.Variable expr, A arg);

    protected abstract R visitQuantifier(VCExpr.Quantifier expr, A arg);

    protected abstract R visitLet(VCExpr.Let expr, A arg);
}
