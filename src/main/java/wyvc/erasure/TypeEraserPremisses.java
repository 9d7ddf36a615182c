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
import java.util.HashMap;
import java.util.List;

import org.apache.log4j.Logger;

import wyvc.core.Function;
import wyvc.core.Type;
import wyvc.core.VCExpr;
import wyvc.core.VCExprOp;
import wyvc.core.VCExpressionGenerator;
import wyvc.util.FreeVariableCollector;
import wyvc.util.SubstitutingVCExprVisitor;
import wyvc.util.Util;

/**
 * Erases types using type premisses. Each quantifier is given premisses of
 * the form <code>type(x) == T</code> for its bound variables, and the type
 * parameters of a quantifier are bound by let-expressions which extract them
 * from the types of its bound variables where possible. For example,
 *
 * <pre>
 * forall&lt;a&gt; x:C a :: p(x)
 * </pre>
 *
 * is erased to
 *
 * <pre>
 * forall x:U :: {:nopats type(x)} (let a := CTypeInv0(type(x)); type(x) == CType(a) ==&gt; p(x))
 * </pre>
 *
 * @author David J. Pearce
 *
 */
public class TypeEraserPremisses extends TypeEraser {
	private static final Logger LOGGER = Logger.getLogger(TypeEraserPremisses.class);

	private final TypeAxiomBuilderPremisses axBuilderPremisses;

	public TypeEraserPremisses(TypeAxiomBuilderPremisses axBuilder, VCExpressionGenerator gen) {
		super(axBuilder, gen);
		this.axBuilderPremisses = axBuilder;
	}

	@Override
	public TypeAxiomBuilderPremisses getAxiomBuilder() {
		return axBuilderPremisses;
	}

	// =========================================================================
	// Quantifiers
	// =========================================================================

	@Override
	protected VCExpr visitQuantifier(VCExpr.Quantifier expr, VariableBindings bindings) {
		// Determine the bound variables which actually occur in the body or in a
		// positive trigger. Type parameters occurring only in the types of other
		// variables cannot be extracted.
		FreeVariableCollector collector = new FreeVariableCollector();
		collector.collect(expr.getBody());
		for (VCExpr.Trigger trigger : expr.getTriggers()) {
			if (trigger.isPositive()) {
				collector.collect(trigger.getExprs());
			}
		}
		List<VCExpr.Variable> freeVars = collector.getFreeTermVariables();
		ArrayList<VCExpr.Variable> occurringVars = new ArrayList<>();
		for (VCExpr.Variable var : expr.getBoundVariables()) {
			if (freeVars.contains(var)) {
				occurringVars.add(var);
			}
		}
		List<VCExpr.Variable> newBoundVars = boundVarsAfterErasure(occurringVars);
		VCExpr newNode = handleQuantifier(expr, occurringVars, newBoundVars, bindings);
		if (!(newNode instanceof VCExpr.Quantifier) || !isUniversalQuantifier(expr)) {
			return newNode;
		}
		List<VCExpr.Variable> castVariables = findCastVariables(occurringVars, (VCExpr.Quantifier) newNode);
		if (castVariables.isEmpty()) {
			return newNode;
		}
		// redo everything with a different typing
		if (LOGGER.isDebugEnabled()) {
			LOGGER.debug("retyping bound variables " + castVariables);
		}
		newBoundVars = retypedBoundVars(occurringVars, castVariables);
		VCExpr redone = handleQuantifier(expr, occurringVars, newBoundVars, bindings);
		if (LOGGER.isDebugEnabled() && redone instanceof VCExpr.Quantifier) {
			List<VCExpr.Variable> remaining = findCastVariables(occurringVars, (VCExpr.Quantifier) redone);
			if (!remaining.isEmpty()) {
				LOGGER.debug("retyping did not converge for bound variables " + remaining);
			}
		}
		return redone;
	}

	private VCExpr handleQuantifier(VCExpr.Quantifier node, List<VCExpr.Variable> occurringVars,
			List<VCExpr.Variable> newBoundVars, VariableBindings oldBindings) {
		VariableBindings bindings = oldBindings.bindVariables(occurringVars, newBoundVars);
		bindings = axBuilderPremisses.bindTypeParameters(node.getTypeParameters(), bindings);
		List<VCExpr.LetBinding> typeVarBindings = axBuilderPremisses.genTypeParamBindings(node.getTypeParameters(),
				occurringVars, bindings);
		// type parameters which could not be extracted are quantified explicitly
		ArrayList<VCExpr.Variable> allBoundVars = new ArrayList<>(newBoundVars);
		allBoundVars.addAll(
				axBuilderPremisses.unboundTypeParameters(node.getTypeParameters(), typeVarBindings, bindings));
		ErasureOptions.TypeEncoding encoding = axBuilder.getOptions().getTypeEncoding();
		List<VCExpr.Variable> varsWithTypeSpecs = Collections.emptyList();
		List<VCExpr.Variable> newVarsWithTypeSpecs = Collections.emptyList();
		if (!isUniversalQuantifier(node) || encoding == ErasureOptions.TypeEncoding.PREDICATES) {
			varsWithTypeSpecs = occurringVars;
			newVarsWithTypeSpecs = newBoundVars;
		}
		ArrayList<VCExpr.Trigger> furtherTriggers = new ArrayList<>();
		VCExpr typePremisses = genTypePremisses(varsWithTypeSpecs, newVarsWithTypeSpecs, bindings, typeVarBindings,
				furtherTriggers);
		ArrayList<VCExpr.Trigger> newTriggers = new ArrayList<>(mutateTriggers(node.getTriggers(), bindings));
		newTriggers.addAll(furtherTriggers);
		newTriggers = addLets2Triggers(newTriggers, typeVarBindings);
		VCExpr newBody = mutate(node.getBody(), bindings);
		if (encoding == ErasureOptions.TypeEncoding.NONE) {
			typePremisses = VCExpressionGenerator.TRUE;
		}
		VCExpr bodyWithPremisses = axBuilderPremisses.addTypePremisses(typeVarBindings, typePremisses,
				node.getKind() == VCExpr.Quantifier.Kind.ALL, axBuilder.cast(newBody, Type.BOOL));
		if (allBoundVars.isEmpty()) {
			// no bound variables are left
			return bodyWithPremisses;
		}
		for (VCExpr.Variable v : allBoundVars) {
			if (v.getType().equals(axBuilder.getU())) {
				newTriggers.add(gen.trigger(false, axBuilder.cast(v, Type.INT)));
				newTriggers.add(gen.trigger(false, axBuilder.cast(v, Type.BOOL)));
			}
		}
		return gen.quantify(node.getKind(), Collections.emptyList(), allBoundVars, newTriggers, node.getInfo(),
				bodyWithPremisses);
	}

	/**
	 * Generate the type premisses for the given bound variables, leaving out
	 * those which are trivially true once the extracted type parameters are
	 * substituted. Each remaining premiss gets a negative trigger, so that its
	 * <code>type(x)</code> term is not used as a pattern.
	 */
	private VCExpr genTypePremisses(List<VCExpr.Variable> oldBoundVars, List<VCExpr.Variable> newBoundVars,
			VariableBindings bindings, List<VCExpr.LetBinding> typeVarBindings, List<VCExpr.Trigger> triggers) {
		HashMap<VCExpr.Variable, VCExpr> typeParamSubstitution = new HashMap<>();
		for (VCExpr.LetBinding b : typeVarBindings) {
			typeParamSubstitution.put(b.getVariable(), b.getExpr());
		}
		SubstitutingVCExprVisitor substituter = new SubstitutingVCExprVisitor(gen);
		ArrayList<VCExpr> typePremisses = new ArrayList<>();
		for (int i = 0; i < newBoundVars.size(); ++i) {
			VCExpr.Variable oldVar = oldBoundVars.get(i);
			VCExpr.Variable newVar = newBoundVars.get(i);
			VCExpr typePremiss = axBuilderPremisses.genVarTypeAxiom(newVar, oldVar.getType(),
					bindings.getTypeVariableBindings());
			if (!isTriviallyTrue(substituter.apply(typeParamSubstitution, typePremiss))) {
				typePremisses.add(typePremiss);
				triggers.add(gen.trigger(false, axBuilderPremisses.typeOf(newVar)));
			}
		}
		return gen.andSimp(typePremisses);
	}

	private static boolean isTriviallyTrue(VCExpr expr) {
		if (expr == VCExpressionGenerator.TRUE) {
			return true;
		} else if (expr instanceof VCExpr.NAry) {
			VCExpr.NAry nary = (VCExpr.NAry) expr;
			return nary.getOperator() == VCExprOp.EQ && nary.get(0).equals(nary.get(1));
		}
		return false;
	}

	/**
	 * Wrap trigger expressions mentioning let-bound type parameters in the same
	 * let-bindings, since these variables would otherwise be unbound.
	 */
	private ArrayList<VCExpr.Trigger> addLets2Triggers(List<VCExpr.Trigger> triggers,
			List<VCExpr.LetBinding> typeVarBindings) {
		ArrayList<VCExpr.Trigger> triggersWithLets = new ArrayList<>();
		for (VCExpr.Trigger t : triggers) {
			ArrayList<VCExpr> exprsWithLets = new ArrayList<>();
			boolean changed = false;
			for (VCExpr e : t.getExprs()) {
				List<VCExpr.Variable> freeVars = FreeVariableCollector.freeTermVariables(e);
				if (!Collections.disjoint(freeVars, Util.map(typeVarBindings, VCExpr.LetBinding::getVariable))) {
					exprsWithLets.add(gen.let(typeVarBindings, e));
					changed = true;
				} else {
					exprsWithLets.add(e);
				}
			}
			triggersWithLets.add(changed ? gen.trigger(t.isPositive(), exprsWithLets) : t);
		}
		return triggersWithLets;
	}

	// =========================================================================
	// Functions, Selects and Stores
	// =========================================================================

	private VCExpr handleFunctionOp(Function newFun, List<Type> typeArgs, VCExpr.NAry node,
			VariableBindings bindings) {
		ArrayList<VCExpr> newArgs = new ArrayList<>();
		// explicit type arguments
		for (Type t : typeArgs) {
			newArgs.add(axBuilder.typeToTerm(t, bindings.getTypeVariableBindings()));
		}
		for (VCExpr arg : mutateSeq(node, bindings, 0)) {
			Type newType = newFun.getParameterType(newArgs.size());
			newArgs.add(axBuilder.cast(arg, newType));
		}
		return gen.function(newFun, newArgs);
	}

	@Override
	protected VCExpr visitSelect(VCExpr.NAry node, VariableBindings bindings) {
		Type.Map mapType = (Type.Map) node.get(0).getType();
		Function select = axBuilderPremisses.getMapTypeAbstracter().select(mapType, new ArrayList<>());
		List<Integer> explicitTypeParams = axBuilderPremisses.getMapTypeAbstracter()
				.explicitSelectTypeParams(mapType);
		return handleFunctionOp(select, Util.select(node.getTypeArguments(), explicitTypeParams), node, bindings);
	}

	@Override
	protected VCExpr visitStore(VCExpr.NAry node, VariableBindings bindings) {
		Type.Map mapType = (Type.Map) node.get(0).getType();
		Function store = axBuilderPremisses.getMapTypeAbstracter().store(mapType, new ArrayList<>());
		// store functions never have explicit type parameters
		return handleFunctionOp(store, Collections.emptyList(), node, bindings);
	}

	@Override
	protected VCExpr visitFunction(VCExpr.NAry node, VariableBindings bindings) {
		Function oriFun = ((VCExprOp.FunctionApplication) node.getOperator()).getFunction();
		TypeAxiomBuilderPremisses.UntypedFunction untypedFun = axBuilderPremisses.typed2Untyped(oriFun);
		ArrayList<Type> typeArgs = new ArrayList<>();
		for (Type.Variable var : untypedFun.getExplicitTypeParameters()) {
			typeArgs.add(node.getTypeArguments().get(oriFun.getTypeParameters().indexOf(var)));
		}
		return handleFunctionOp(untypedFun.getFunction(), typeArgs, node, bindings);
	}
}
