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

import java.util.List;

import wyvc.core.VCExpr;

/**
 * Counts the nodes of an expression. Triggers are not counted.
 */
public class SizeComputingVisitor extends TraversingVCExprVisitor<Void> {
    private int size;

    public static int size(VCExpr expr) {
        SizeComputingVisitor visitor = new SizeComputingVisitor();
        visitor.traverse(expr, null);
        return visitor.size;
    }

    @Override
    public Void visitExpression(VCExpr expr, Void arg) {
        // applications are counted in visitNAryNode()
        if (!(expr instanceof VCExpr.NAry)) {
            size = size + 1;
        }
        return super.visitExpression(expr, arg);
    }

    @Override
    protected List<VCExpr> visitNAryNode(VCExpr.NAry expr, Void arg) {
        size = size + 1;
        return super.visitNAryNode(expr, arg);
    }

    @Override
    protected Void visitQuantifier(VCExpr.Quantifier expr, Void arg) {
        visitExpression(expr.getBody(), arg);
        return null;
    }
}
