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
package wyvc.erasure;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;

import wyvc.core.Function;
import wyvc.core.VCExpr;
import wyvc.core.VCExprOp;
import wyvc.util.TraversingVCExprVisitor;

/**
 * Collects the variables occurring as the direct argument of a cast into
 * <code>U</code> (e.g. <code>int_2_U(x)</code>), and separately those
 * occurring anywhere else.
 *
 * @author David J. Pearce
 *
 */
public class VariableCastCollector extends TraversingVCExprVisitor<Void> {
	private final TypeAxiomBuilderIntBoolU axBuilder;
	private final LinkedHashSet<VCExpr.Variable> varsInCasts = new LinkedHashSet<>();
	private final HashSet<VCExpr.Variable> varsOutsideCasts = new HashSet<>();

	public VariableCastCollector(TypeAxiomBuilderIntBoolU axBuilder) {
		this.axBuilder = axBuilder;
	}

	/**
	 * Determine those bound variables of an original quantifier all of whose
	 * relevant uses are cast in the positive triggers of its erased counterpart
	 * (or in its body, if it has no positive triggers). The first bound
	 * variables of the erased quantifier must correspond, in order, to the given
	 * original variables.
	 *
	 * @param oldVars   The original bound variables
	 * @param newNode   The erased quantifier
	 * @param axBuilder
	 * @return
	 */
	public static List<VCExpr.Variable> findCastVariables(List<VCExpr.Variable> oldVars, VCExpr.Quantifier newNode,
			TypeAxiomBuilderIntBoolU axBuilder) {
		VariableCastCollector collector = new VariableCastCollector(axBuilder);
		boolean hasPositiveTrigger = false;
		for (VCExpr.Trigger trigger : newNode.getTriggers()) {
			if (trigger.isPositive()) {
				hasPositiveTrigger = true;
				for (VCExpr e : trigger.getExprs()) {
					collector.traverse(e, null);
				}
			}
		}
		if (!hasPositiveTrigger) {
			collector.traverse(newNode.getBody(), null);
		}
		ArrayList<VCExpr.Variable> castVariables = new ArrayList<>();
		List<VCExpr.Variable> newVars = newNode.getBoundVariables();
		for (VCExpr.Variable castVar : collector.varsInCasts) {
			int i = newVars.indexOf(castVar);
			if (0 <= i && i < oldVars.size() && !collector.varsOutsideCasts.contains(castVar)) {
				castVariables.add(oldVars.get(i));
			}
		}
		return castVariables;
	}

	@Override
	protected List<VCExpr> visitNAryNode(VCExpr.NAry expr, Void arg) {
		VCExprOp op = expr.getOperator();
		if (op instanceof VCExprOp.FunctionApplication) {
			Function fun = ((VCExprOp.FunctionApplication) op).getFunction();
			if (axBuilder.isCast(fun) && fun.getReturnType().equals(axBuilder.getU())
					&& expr.get(0) instanceof VCExpr.Variable) {
				varsInCasts.add((VCExpr.Variable) expr.get(0));
				return Collections.emptyList();
			}
		} else {
			switch (op.getKind()) {
			case NOT:
			case EQ:
			case NEQ:
			case AND:
			case OR:
			case IMPLIES:
			case LT:
			case LE:
			case GT:
			case GE:
				// these cannot be used in triggers, so direct variable arguments are ignored
				ArrayList<VCExpr> remaining = new ArrayList<>();
				for (VCExpr e : expr.getArguments()) {
					if (!(e instanceof VCExpr.Variable)) {
						remaining.add(e);
					}
				}
				return remaining;
			default:
				break;
			}
		}
		return super.visitNAryNode(expr, arg);
	}

	@Override
	protected Void visitVariable(VCExpr.Variable expr, Void arg) {
		varsOutsideCasts.add(expr);
		return null;
	}
}
