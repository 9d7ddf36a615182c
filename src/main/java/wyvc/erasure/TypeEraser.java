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
import java.util.List;

import wyvc.core.Type;
import wyvc.core.VCExpr;
import wyvc.core.VCExprOp;
import wyvc.core.VCExpressionGenerator;
import wyvc.util.MutatingVCExprVisitor;

/**
 * Turns typed expressions into untyped ones. After erasure, every
 * subexpression has sort <code>U</code>, <code>T</code> or one of the types
 * supported natively by the prover, and casts are inserted wherever an
 * operator expects a different sort from the one its argument has.
 *
 * <p>
 * Erasure tracks the polarity of the current position: <code>1</code> for
 * positive, <code>-1</code> for negative and <code>0</code> for both. This
 * decides whether a quantifier is effectively universal from the prover's
 * point of view.
 * </p>
 *
 * <p>
 * The treatment of quantifiers and of polymorphic operators (function
 * applications, map selects and stores) depends on how types are encoded, and
 * is left to subclasses.
 * </p>
 *
 * @author David J. Pearce
 *
 */
public abstract class TypeEraser extends MutatingVCExprVisitor<VariableBindings> {
	protected final TypeAxiomBuilderIntBoolU axBuilder;

	/**
	 * The polarity of the position currently being erased.
	 */
	private int polarity = 1;

	public TypeEraser(TypeAxiomBuilderIntBoolU axBuilder, VCExpressionGenerator gen) {
		super(gen);
		this.axBuilder = axBuilder;
	}

	/**
	 * Erase the types in a given expression.
	 *
	 * @param expr     The expression to erase
	 * @param polarity The polarity of the expression (<code>1</code>,
	 *                 <code>-1</code> or <code>0</code>)
	 * @return
	 */
	public VCExpr erase(VCExpr expr, int polarity) {
		if (polarity < -1 || polarity > 1) {
			throw new IllegalArgumentException("invalid polarity (" + polarity + ")");
		}
		this.polarity = polarity;
		return mutate(expr, VariableBindings.EMPTY);
	}

	public TypeAxiomBuilderIntBoolU getAxiomBuilder() {
		return axBuilder;
	}

	// =========================================================================
	// Literals and Variables
	// =========================================================================

	@Override
	protected VCExpr visitLiteral(VCExpr.Literal expr, VariableBindings bindings) {
		if (!(expr instanceof VCExpr.Boolean) && !(expr instanceof VCExpr.Integer)) {
			throw new IllegalArgumentException("unknown literal encountered (" + expr + ")");
		}
		return expr;
	}

	@Override
	protected VCExpr visitVariable(VCExpr.Variable expr, VariableBindings bindings) {
		VCExpr.Variable result = bindings.getVariable(expr);
		if (result == null) {
			return axBuilder.typed2Untyped(expr);
		}
		return result;
	}

	// =========================================================================
	// Operator Applications
	// =========================================================================

	@Override
	protected boolean flatten(VCExpr.NAry expr) {
		return isAndOr(expr);
	}

	@Override
	protected VCExpr visitNAry(VCExpr.NAry expr, VariableBindings bindings) {
		if (isAndOr(expr)) {
			// handled iteratively, which matters for large conjunctions
			return super.visitNAry(expr, bindings);
		}
		switch (expr.getOperator().getKind()) {
		case NOT:
			return castArguments(expr, Type.BOOL, bindings, -polarity);
		case EQ:
		case NEQ:
		case DISTINCT:
		case BV:
		case BV_EXTRACT:
			return castArgumentsToOldType(expr, bindings, 0);
		case IMPLIES:
			return visitImplies(expr, bindings);
		case LABEL:
			// the argument of a label is always a formula
			return castArguments(expr, Type.BOOL, bindings, polarity);
		case IF_THEN_ELSE:
			return visitIfThenElse(expr, bindings);
		case CUSTOM:
			return gen.function(expr.getOperator(), mutateSeq(expr, bindings, 0));
		case ADD:
		case SUB:
		case MUL:
		case DIV:
		case MOD:
		case LT:
		case LE:
		case GT:
		case GE:
			return castArguments(expr, Type.INT, bindings, 0);
		case SUBTYPE:
			return castArguments(expr, axBuilder.getU(), bindings, 0);
		case BV_CONCAT:
			return visitBvConcat(expr, bindings);
		case SELECT:
			return visitSelect(expr, bindings);
		case STORE:
			return visitStore(expr, bindings);
		case FUNCTION:
			return visitFunction(expr, bindings);
		default:
			throw new IllegalArgumentException("cannot erase types in expression (" + expr + ")");
		}
	}

	@Override
	protected VCExpr updateModifiedNode(VCExpr.NAry original, List<VCExpr> arguments, boolean changed,
			VariableBindings bindings) {
		return gen.function(original.getOperator(), axBuilder.cast(arguments.get(0), Type.BOOL),
				axBuilder.cast(arguments.get(1), Type.BOOL));
	}

	protected abstract VCExpr visitSelect(VCExpr.NAry expr, VariableBindings bindings);

	protected abstract VCExpr visitStore(VCExpr.NAry expr, VariableBindings bindings);

	protected abstract VCExpr visitFunction(VCExpr.NAry expr, VariableBindings bindings);

	/**
	 * Erase the arguments of an application under a given polarity.
	 */
	protected List<VCExpr> mutateSeq(VCExpr.NAry expr, VariableBindings bindings, int newPolarity) {
		int oldPolarity = polarity;
		polarity = newPolarity;
		try {
			return mutateSeq(expr.getArguments(), bindings);
		} finally {
			polarity = oldPolarity;
		}
	}

	private VCExpr castArguments(VCExpr.NAry expr, Type argType, VariableBindings bindings, int newPolarity) {
		return gen.function(expr.getOperator(), axBuilder.castSeq(mutateSeq(expr, bindings, newPolarity), argType));
	}

	/**
	 * Cast the arguments of an application to their original type, provided
	 * they all had the same type and this type is kept by erasure. Otherwise,
	 * cast them to <code>U</code>.
	 */
	private VCExpr castArgumentsToOldType(VCExpr.NAry expr, VariableBindings bindings, int newPolarity) {
		List<VCExpr> newArgs = mutateSeq(expr, bindings, newPolarity);
		Type oldType = expr.get(0).getType();
		boolean uniform = axBuilder.unchangedType(oldType);
		for (int i = 1; i < expr.size() && uniform; ++i) {
			uniform = expr.get(i).getType().equals(oldType);
		}
		return gen.function(expr.getOperator(), axBuilder.castSeq(newArgs, uniform ? oldType : axBuilder.getU()));
	}

	private VCExpr visitImplies(VCExpr.NAry expr, VariableBindings bindings) {
		ArrayList<VCExpr> newArgs = new ArrayList<>();
		polarity = -polarity;
		try {
			newArgs.add(mutate(expr.get(0), bindings));
		} finally {
			polarity = -polarity;
		}
		newArgs.add(mutate(expr.get(1), bindings));
		return gen.function(expr.getOperator(), axBuilder.castSeq(newArgs, Type.BOOL));
	}

	private VCExpr visitIfThenElse(VCExpr.NAry expr, VariableBindings bindings) {
		List<VCExpr> newArgs = mutateSeq(expr, bindings, 0);
		Type type = axBuilder.typeAfterErasure(expr.getType());
		return gen.ifThenElse(axBuilder.cast(newArgs.get(0), Type.BOOL), axBuilder.cast(newArgs.get(1), type),
				axBuilder.cast(newArgs.get(2), type));
	}

	private VCExpr visitBvConcat(VCExpr.NAry expr, VariableBindings bindings) {
		List<VCExpr> newArgs = mutateSeq(expr, bindings, 0);
		// each argument is cast to its old type
		return gen.function(expr.getOperator(), axBuilder.cast(newArgs.get(0), expr.get(0).getType()),
				axBuilder.cast(newArgs.get(1), expr.get(1).getType()));
	}

	// =========================================================================
	// Binders
	// =========================================================================

	/**
	 * Determine whether a quantifier is universal from the prover's point of
	 * view, given the current polarity.
	 *
	 * @param expr
	 * @return
	 */
	protected boolean isUniversalQuantifier(VCExpr.Quantifier expr) {
		return (polarity == 1 && expr.getKind() == VCExpr.Quantifier.Kind.EX)
				|| (polarity == -1 && expr.getKind() == VCExpr.Quantifier.Kind.ALL);
	}

	/**
	 * Create the untyped counterparts of a list of bound variables.
	 *
	 * @param oldBoundVars
	 * @return
	 */
	protected List<VCExpr.Variable> boundVarsAfterErasure(List<VCExpr.Variable> oldBoundVars) {
		ArrayList<VCExpr.Variable> newBoundVars = new ArrayList<>();
		for (VCExpr.Variable var : oldBoundVars) {
			newBoundVars.add(gen.variable(var.getName(), axBuilder.typeAfterErasure(var.getType())));
		}
		return newBoundVars;
	}

	/**
	 * Check whether an erased quantifier uses some of its bound variables only
	 * in casts <code>int_2_U(x)</code> or <code>bool_2_U(x)</code> within its
	 * triggers. Such variables are better given the sort <code>U</code>, in
	 * which case the quantifier must be erased again.
	 *
	 * @param occurringVars the original bound variables the erased quantifier
	 *                      binds, in order
	 * @param newExpr       the erased quantifier
	 * @return the variables to give sort <code>U</code>, or an empty list if the
	 *         quantifier does not need to be erased again.
	 */
	protected List<VCExpr.Variable> findCastVariables(List<VCExpr.Variable> occurringVars,
			VCExpr.Quantifier newExpr) {
		return VariableCastCollector.findCastVariables(occurringVars, newExpr, axBuilder);
	}

	/**
	 * Create the untyped counterparts of a list of bound variables, giving the
	 * chosen variables sort <code>U</code>.
	 */
	protected List<VCExpr.Variable> retypedBoundVars(List<VCExpr.Variable> oldBoundVars,
			List<VCExpr.Variable> castVariables) {
		ArrayList<VCExpr.Variable> newBoundVars = new ArrayList<>();
		for (VCExpr.Variable var : oldBoundVars) {
			Type newType = castVariables.contains(var) ? axBuilder.getU() : axBuilder.typeAfterErasure(var.getType());
			newBoundVars.add(gen.variable(var.getName(), newType));
		}
		return newBoundVars;
	}

	@Override
	protected VCExpr visitLet(VCExpr.Let expr, VariableBindings bindings) {
		List<VCExpr.Variable> newBoundVars = boundVarsAfterErasure(expr.getBoundVariables());
		VariableBindings newBindings = bindings.bindVariables(expr.getBoundVariables(), newBoundVars);
		ArrayList<VCExpr.LetBinding> newLetBindings = new ArrayList<>();
		for (int i = 0; i < expr.size(); ++i) {
			VCExpr.Variable newVar = newBoundVars.get(i);
			VCExpr newE = axBuilder.cast(mutate(expr.get(i).getExpr(), newBindings), newVar.getType());
			newLetBindings.add(gen.letBinding(newVar, newE));
		}
		VCExpr newBody = mutate(expr.getBody(), newBindings);
		return gen.let(newLetBindings, newBody);
	}

	private static boolean isAndOr(VCExpr.NAry expr) {
		VCExprOp op = expr.getOperator();
		return op == VCExprOp.AND || op == VCExprOp.OR;
	}
}
