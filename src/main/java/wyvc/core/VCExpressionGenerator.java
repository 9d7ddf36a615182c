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
package wyvc.core;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import wyvc.core.VCExpr.Quantifier;

/**
 * Factory for verification-condition expressions. All expressions should be
 * constructed through here, since this is where arities and types are checked.
 * Methods ending in <code>Simp</code> apply the obvious simplifications for
 * <code>true</code> and <code>false</code> on the fly.
 *
 * @author David J. Pearce
 *
 */
public class VCExpressionGenerator {
	public static final VCExpr.Boolean TRUE = VCExpr.TRUE;
	public static final VCExpr.Boolean FALSE = VCExpr.FALSE;

	private static final Function CONTROL_FLOW = Function.create("ControlFlow", Type.INT, Type.INT, Type.INT);

	// =========================================================================
	// Literals and Variables
	// =========================================================================

	public VCExpr.Integer integer(BigInteger value) {
		return new VCExpr.Integer(value);
	}

	public VCExpr.Integer integer(long value) {
		return new VCExpr.Integer(BigInteger.valueOf(value));
	}

	public VCExpr bitvector(BigInteger value, int bits) {
		return function(new VCExprOp.BitVector(bits), integer(value));
	}

	public VCExpr.Variable variable(String name, Type type) {
		return new VCExpr.Variable(name, type);
	}

	/**
	 * Generate a list of fresh variables with the given types, named by a given
	 * prefix followed by their position.
	 */
	public List<VCExpr.Variable> variables(List<? extends Type> types, String prefix) {
		ArrayList<VCExpr.Variable> vars = new ArrayList<>();
		for (int i = 0; i != types.size(); ++i) {
			vars.add(variable(prefix + i, types.get(i)));
		}
		return vars;
	}

	// =========================================================================
	// Operator Applications
	// =========================================================================

	public VCExpr function(VCExprOp op, List<? extends VCExpr> arguments, List<? extends Type> typeArguments) {
		if (op.getArity() != arguments.size()) {
			throw new IllegalArgumentException(
					"operator " + op + " expects " + op.getArity() + " arguments, found " + arguments.size());
		} else if (op.getTypeParamArity() != typeArguments.size()) {
			throw new IllegalArgumentException("operator " + op + " expects " + op.getTypeParamArity()
					+ " type arguments, found " + typeArguments.size());
		}
		return new VCExpr.NAry(op, ImmutableList.copyOf(arguments), ImmutableList.copyOf(typeArguments));
	}

	public VCExpr function(VCExprOp op, List<? extends VCExpr> arguments) {
		return function(op, arguments, Collections.emptyList());
	}

	public VCExpr function(VCExprOp op, VCExpr... arguments) {
		return function(op, Arrays.asList(arguments), Collections.emptyList());
	}

	public VCExpr function(Function f, List<? extends VCExpr> arguments, List<? extends Type> typeArguments) {
		return function(functionOp(f), arguments, typeArguments);
	}

	public VCExpr function(Function f, List<? extends VCExpr> arguments) {
		return function(functionOp(f), arguments, Collections.emptyList());
	}

	public VCExpr function(Function f, VCExpr... arguments) {
		return function(functionOp(f), Arrays.asList(arguments), Collections.emptyList());
	}

	public VCExprOp functionOp(Function f) {
		return new VCExprOp.FunctionApplication(f);
	}

	/**
	 * Combine a list of boolean expressions with a binary operator, folding
	 * from the left. Conjunctions and disjunctions are simplified.
	 */
	public VCExpr nary(VCExprOp op, List<? extends VCExpr> arguments) {
		Preconditions.checkArgument(op.getArity() == 2, "operator " + op + " is not binary");
		switch (op.getKind()) {
		case AND:
			return andSimp(arguments);
		case OR:
			return orSimp(arguments);
		default:
			Preconditions.checkArgument(!arguments.isEmpty(), "no arguments to combine");
			VCExpr result = arguments.get(0);
			for (int i = 1; i < arguments.size(); ++i) {
				result = function(op, result, arguments.get(i));
			}
			return result;
		}
	}

	// =========================================================================
	// Propositional Operators
	// =========================================================================

	public VCExpr not(VCExpr e) {
		return function(VCExprOp.NOT, e);
	}

	public VCExpr eq(VCExpr lhs, VCExpr rhs) {
		return function(VCExprOp.EQ, lhs, rhs);
	}

	public VCExpr neq(VCExpr lhs, VCExpr rhs) {
		return function(VCExprOp.NEQ, lhs, rhs);
	}

	public VCExpr and(VCExpr lhs, VCExpr rhs) {
		return function(VCExprOp.AND, lhs, rhs);
	}

	public VCExpr or(VCExpr lhs, VCExpr rhs) {
		return function(VCExprOp.OR, lhs, rhs);
	}

	public VCExpr implies(VCExpr lhs, VCExpr rhs) {
		return function(VCExprOp.IMPLIES, lhs, rhs);
	}

	public VCExpr distinct(List<? extends VCExpr> arguments) {
		if (arguments.size() <= 1) {
			// trivial case
			return TRUE;
		}
		return function(new VCExprOp.Distinct(arguments.size()), arguments);
	}

	public VCExpr notSimp(VCExpr e) {
		if (e == TRUE) {
			return FALSE;
		} else if (e == FALSE) {
			return TRUE;
		} else if (e instanceof VCExpr.NAry && ((VCExpr.NAry) e).getOperator() == VCExprOp.NOT) {
			return ((VCExpr.NAry) e).get(0);
		}
		return not(e);
	}

	public VCExpr andSimp(VCExpr lhs, VCExpr rhs) {
		if (lhs == TRUE) {
			return rhs;
		} else if (rhs == TRUE) {
			return lhs;
		} else if (lhs == FALSE || rhs == FALSE) {
			return FALSE;
		}
		return and(lhs, rhs);
	}

	public VCExpr andSimp(List<? extends VCExpr> arguments) {
		VCExpr result = TRUE;
		for (VCExpr e : arguments) {
			result = andSimp(result, e);
		}
		return result;
	}

	public VCExpr orSimp(VCExpr lhs, VCExpr rhs) {
		if (lhs == FALSE) {
			return rhs;
		} else if (rhs == FALSE) {
			return lhs;
		} else if (lhs == TRUE || rhs == TRUE) {
			return TRUE;
		}
		return or(lhs, rhs);
	}

	public VCExpr orSimp(List<? extends VCExpr> arguments) {
		VCExpr result = FALSE;
		for (VCExpr e : arguments) {
			result = orSimp(result, e);
		}
		return result;
	}

	/**
	 * Construct a simplified implication. Chains of implications on the
	 * right-hand side are pulled into the antecedent, as long as the antecedent
	 * stays at least as large as the part being pulled in. This keeps chains
	 * from nesting deeply to the right.
	 *
	 * @param lhs
	 * @param rhs
	 * @return
	 */
	public VCExpr impliesSimp(VCExpr lhs, VCExpr rhs) {
		while (isImplication(rhs) && lhs != TRUE && lhs != FALSE) {
			VCExpr.NAry imp = (VCExpr.NAry) rhs;
			if (andSize(imp.get(0)) > andSize(lhs)) {
				break;
			}
			lhs = andSimp(lhs, imp.get(0));
			rhs = imp.get(1);
		}
		if (lhs == TRUE) {
			return rhs;
		} else if (lhs == FALSE || rhs == TRUE) {
			return TRUE;
		} else if (rhs == FALSE) {
			return notSimp(lhs);
		}
		return implies(lhs, rhs);
	}

	/**
	 * Approximate the number of conjuncts in a given expression.
	 */
	public static int andSize(VCExpr e) {
		int size = 0;
		ArrayDeque<VCExpr> worklist = new ArrayDeque<>();
		worklist.push(e);
		while (!worklist.isEmpty()) {
			VCExpr next = worklist.pop();
			if (next instanceof VCExpr.NAry && ((VCExpr.NAry) next).getOperator() == VCExprOp.AND) {
				VCExpr.NAry n = (VCExpr.NAry) next;
				worklist.push(n.get(0));
				worklist.push(n.get(1));
			} else {
				size = size + 1;
			}
		}
		return size;
	}

	private static boolean isImplication(VCExpr e) {
		return e instanceof VCExpr.NAry && ((VCExpr.NAry) e).getOperator() == VCExprOp.IMPLIES;
	}

	// =========================================================================
	// Labels, Conditionals and Custom Operators
	// =========================================================================

	public VCExprOp.Label labelOp(boolean positive, String name) {
		return new VCExprOp.Label(positive, name);
	}

	public VCExpr labelPos(String name, VCExpr e) {
		return function(labelOp(true, name), e);
	}

	public VCExpr labelNeg(String name, VCExpr e) {
		if (e == TRUE) {
			// a negative label can never be triggered by true
			return TRUE;
		}
		return function(labelOp(false, name), e);
	}

	public VCExpr ifThenElse(VCExpr condition, VCExpr trueBranch, VCExpr falseBranch) {
		return function(VCExprOp.IF_THEN_ELSE, condition, trueBranch, falseBranch);
	}

	public VCExpr custom(String name, Type type, VCExpr... arguments) {
		return function(new VCExprOp.Custom(name, arguments.length, type), arguments);
	}

	public VCExpr controlFlowFunctionApplication(VCExpr e0, VCExpr e1) {
		return function(CONTROL_FLOW, e0, e1);
	}

	// =========================================================================
	// Arithmetic
	// =========================================================================

	public VCExpr add(VCExpr lhs, VCExpr rhs) {
		return function(VCExprOp.ADD, lhs, rhs);
	}

	public VCExpr sub(VCExpr lhs, VCExpr rhs) {
		return function(VCExprOp.SUB, lhs, rhs);
	}

	public VCExpr mul(VCExpr lhs, VCExpr rhs) {
		return function(VCExprOp.MUL, lhs, rhs);
	}

	public VCExpr div(VCExpr lhs, VCExpr rhs) {
		return function(VCExprOp.DIV, lhs, rhs);
	}

	public VCExpr mod(VCExpr lhs, VCExpr rhs) {
		return function(VCExprOp.MOD, lhs, rhs);
	}

	public VCExpr lt(VCExpr lhs, VCExpr rhs) {
		return function(VCExprOp.LT, lhs, rhs);
	}

	public VCExpr le(VCExpr lhs, VCExpr rhs) {
		return function(VCExprOp.LE, lhs, rhs);
	}

	public VCExpr gt(VCExpr lhs, VCExpr rhs) {
		return function(VCExprOp.GT, lhs, rhs);
	}

	public VCExpr ge(VCExpr lhs, VCExpr rhs) {
		return function(VCExprOp.GE, lhs, rhs);
	}

	public VCExpr subtype(VCExpr lhs, VCExpr rhs) {
		return function(VCExprOp.SUBTYPE, lhs, rhs);
	}

	// =========================================================================
	// Bitvectors
	// =========================================================================

	public VCExpr bvExtract(VCExpr bv, int total, int start, int end) {
		return function(new VCExprOp.BvExtract(start, end, total), bv);
	}

	public VCExpr bvConcat(VCExpr lhs, VCExpr rhs) {
		int first = ((Type.BitVector) lhs.getType()).getBits();
		int second = ((Type.BitVector) rhs.getType()).getBits();
		return function(new VCExprOp.BvConcat(first, second), lhs, rhs);
	}

	// =========================================================================
	// Maps
	// =========================================================================

	public VCExpr select(List<? extends VCExpr> arguments, List<? extends Type> typeArguments) {
		return function(new VCExprOp.Select(arguments.size(), typeArguments.size()), arguments, typeArguments);
	}

	public VCExpr select(VCExpr... arguments) {
		return select(Arrays.asList(arguments), Collections.emptyList());
	}

	public VCExpr store(List<? extends VCExpr> arguments, List<? extends Type> typeArguments) {
		return function(new VCExprOp.Store(arguments.size()), arguments, typeArguments);
	}

	public VCExpr store(VCExpr... arguments) {
		return store(Arrays.asList(arguments), Collections.emptyList());
	}

	// =========================================================================
	// Let Expressions
	// =========================================================================

	public VCExpr.LetBinding letBinding(VCExpr.Variable variable, VCExpr expr) {
		if (!variable.getType().equals(expr.getType())) {
			throw new IllegalArgumentException("cannot bind " + expr + " of type " + expr.getType() + " to "
					+ variable.getName() + " of type " + variable.getType());
		}
		return new VCExpr.LetBinding(variable, expr);
	}

	public VCExpr let(List<VCExpr.LetBinding> bindings, VCExpr body) {
		if (bindings.isEmpty()) {
			return body;
		}
		return new VCExpr.Let(ImmutableList.copyOf(bindings), body);
	}

	public VCExpr let(VCExpr body, VCExpr.LetBinding... bindings) {
		return let(Arrays.asList(bindings), body);
	}

	/**
	 * Turn boolean let-bindings into implications <code>e ==> v</code>.
	 */
	public List<VCExpr> asImplications(List<VCExpr.LetBinding> bindings) {
		ArrayList<VCExpr> result = new ArrayList<>();
		for (VCExpr.LetBinding b : bindings) {
			result.add(implies(b.getExpr(), b.getVariable()));
		}
		return result;
	}

	/**
	 * Turn let-bindings into equations <code>v == e</code>.
	 */
	public List<VCExpr> asEquations(List<VCExpr.LetBinding> bindings) {
		ArrayList<VCExpr> result = new ArrayList<>();
		for (VCExpr.LetBinding b : bindings) {
			result.add(eq(b.getVariable(), b.getExpr()));
		}
		return result;
	}

	// =========================================================================
	// Quantifiers
	// =========================================================================

	public VCExpr.Trigger trigger(boolean positive, List<? extends VCExpr> exprs) {
		Preconditions.checkArgument(!exprs.isEmpty(), "empty trigger");
		return new VCExpr.Trigger(positive, ImmutableList.copyOf(exprs));
	}

	public VCExpr.Trigger trigger(boolean positive, VCExpr... exprs) {
		return trigger(positive, Arrays.asList(exprs));
	}

	public VCExpr quantify(Quantifier.Kind kind, List<Type.Variable> typeParameters,
			List<VCExpr.Variable> boundVariables, List<VCExpr.Trigger> triggers, Quantifier.Info info,
			VCExpr body) {
		if (typeParameters.isEmpty() && boundVariables.isEmpty()) {
			throw new IllegalArgumentException("quantifier binds no variables");
		} else if (!body.getType().equals(Type.BOOL)) {
			throw new IllegalArgumentException("quantifier body must be boolean (" + body + ")");
		}
		return new Quantifier(kind, ImmutableList.copyOf(typeParameters), ImmutableList.copyOf(boundVariables),
				ImmutableList.copyOf(triggers), info, body);
	}

	public VCExpr forall(List<Type.Variable> typeParameters, List<VCExpr.Variable> boundVariables,
			List<VCExpr.Trigger> triggers, Quantifier.Info info, VCExpr body) {
		return quantify(Quantifier.Kind.ALL, typeParameters, boundVariables, triggers, info, body);
	}

	public VCExpr forall(List<VCExpr.Variable> boundVariables, List<VCExpr.Trigger> triggers, String qid,
			VCExpr body) {
		return forall(Collections.emptyList(), boundVariables, triggers, new Quantifier.Info(qid), body);
	}

	public VCExpr forall(List<VCExpr.Variable> boundVariables, List<VCExpr.Trigger> triggers, VCExpr body) {
		return forall(Collections.emptyList(), boundVariables, triggers, Quantifier.Info.EMPTY, body);
	}

	public VCExpr forall(VCExpr.Variable var, VCExpr.Trigger trigger, VCExpr body) {
		return forall(Collections.singletonList(var), Collections.singletonList(trigger), body);
	}

	public VCExpr exists(List<Type.Variable> typeParameters, List<VCExpr.Variable> boundVariables,
			List<VCExpr.Trigger> triggers, Quantifier.Info info, VCExpr body) {
		return quantify(Quantifier.Kind.EX, typeParameters, boundVariables, triggers, info, body);
	}

	public VCExpr exists(List<VCExpr.Variable> boundVariables, List<VCExpr.Trigger> triggers, VCExpr body) {
		return exists(Collections.emptyList(), boundVariables, triggers, Quantifier.Info.EMPTY, body);
	}
}
