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
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import com.google.common.collect.ImmutableList;

import wyvc.core.Function;
import wyvc.core.Type;
import wyvc.core.VCExpr;
import wyvc.core.VCExpressionGenerator;
import wyvc.util.SizeComputingVisitor;
import wyvc.util.Util;

/**
 * Type axiom builder for the erasure using type premisses. Every value of sort
 * <code>U</code> is mapped to the representation of its type by the function
 * <code>type : U -&gt; T</code>, and quantifiers are guarded by premisses of
 * the form <code>type(x) == T</code>.
 *
 * <p>
 * The type parameters of a polymorphic function (or map) fall into two
 * groups. Those occurring in the types of the value parameters are
 * <i>implicit</i>, since they can be recovered from the types of the actual
 * arguments. Those occurring only in the result type are <i>explicit</i>, and
 * become additional arguments of the untyped function.
 * </p>
 *
 * @author David J. Pearce
 *
 */
public class TypeAxiomBuilderPremisses extends TypeAxiomBuilderIntBoolU {
	private static final Logger LOGGER = Logger.getLogger(TypeAxiomBuilderPremisses.class);

	/**
	 * Maps individuals to their types.
	 */
	private final Function typeFunction;

	private final HashMap<Function, UntypedFunction> typed2UntypedFunctions;

	private MapTypeAbstractionBuilderPremisses mapTypeAbstracter;

	public TypeAxiomBuilderPremisses(VCExpressionGenerator gen, ErasureOptions options) {
		super(gen, options);
		this.typeFunction = Function.create("type", getT(), getU());
		this.typed2UntypedFunctions = new HashMap<>();
		this.mapTypeAbstracter = null;
	}

	protected TypeAxiomBuilderPremisses(TypeAxiomBuilderPremisses builder) {
		super(builder);
		this.typeFunction = builder.typeFunction;
		this.typed2UntypedFunctions = new HashMap<>(builder.typed2UntypedFunctions);
		if (builder.mapTypeAbstracter != null) {
			this.mapTypeAbstracter = new MapTypeAbstractionBuilderPremisses(this, gen, builder.mapTypeAbstracter);
		}
	}

	@Override
	public TypeAxiomBuilderPremisses copy() {
		return new TypeAxiomBuilderPremisses(this);
	}

	@Override
	public MapTypeAbstractionBuilderPremisses getMapTypeAbstracter() {
		if (mapTypeAbstracter == null) {
			mapTypeAbstracter = new MapTypeAbstractionBuilderPremisses(this, gen);
		}
		return mapTypeAbstracter;
	}

	public Function getTypeFunction() {
		return typeFunction;
	}

	public VCExpr typeOf(VCExpr expr) {
		return gen.function(typeFunction, expr);
	}

	// =========================================================================
	// Cast Axioms
	// =========================================================================

	/**
	 * Generate axioms of the form
	 * <code>forall x:U :: {U_2_int(x)} type(x) == intType ==&gt; int_2_U(U_2_int(x)) == x</code>.
	 */
	@Override
	protected VCExpr genReverseCastAxiom(Function castToU, Function castFromU) {
		ArrayList<VCExpr.Variable> vars = new ArrayList<>();
		ArrayList<VCExpr.Trigger> triggers = new ArrayList<>();
		VCExpr eq = genReverseCastEq(castToU, castFromU, vars, triggers);
		VCExpr premiss;
		if (options.getTypeEncoding() == ErasureOptions.TypeEncoding.NONE) {
			premiss = VCExpressionGenerator.TRUE;
		} else {
			premiss = genVarTypeAxiom(vars.get(0), castFromU.getReturnType(), Collections.emptyMap());
		}
		return gen.forall(vars, triggers, "cast:" + castFromU.getName(), gen.impliesSimp(premiss, eq));
	}

	@Override
	protected VCExpr genCastTypeAxioms(Function castToU, Function castFromU) {
		Type fromType = castToU.getParameterType(0);
		return genFunctionAxiom(castToU, Collections.emptyList(), Collections.emptyList(),
				ImmutableList.of(fromType), fromType);
	}

	// =========================================================================
	// Type Premisses and Type Parameter Bindings
	// =========================================================================

	/**
	 * Bind each of the given type parameters to a fresh term variable of sort
	 * <code>T</code>.
	 *
	 * @param typeParams
	 * @param bindings
	 * @return
	 */
	public VariableBindings bindTypeParameters(List<Type.Variable> typeParams, VariableBindings bindings) {
		LinkedHashMap<Type.Variable, VCExpr.Variable> tvars = new LinkedHashMap<>();
		for (Type.Variable tvar : typeParams) {
			tvars.put(tvar, gen.variable(tvar.getName(), getT()));
		}
		return bindings.bindTypeVariables(tvars);
	}

	/**
	 * Generate let-bindings which extract the instantiations of type parameters
	 * from the types of the given (typed) variables. The type parameters must
	 * already be bound to term variables, and the typed variables to their
	 * untyped counterparts. Only untyped counterparts of sort <code>U</code> can
	 * serve as sources. Type parameters for which no extractor exists receive no
	 * binding.
	 *
	 * @param typeParams
	 * @param oldBoundVars
	 * @param bindings
	 * @return
	 */
	public List<VCExpr.LetBinding> genTypeParamBindings(List<Type.Variable> typeParams,
			List<VCExpr.Variable> oldBoundVars, VariableBindings bindings) {
		ArrayList<VCExpr.Variable> uTypedVars = new ArrayList<>();
		ArrayList<Type> originalTypes = new ArrayList<>();
		for (VCExpr.Variable var : oldBoundVars) {
			VCExpr.Variable newVar = bindings.getVariable(var);
			if (newVar.getType().equals(getU())) {
				uTypedVars.add(newVar);
				originalTypes.add(var.getType());
			}
		}
		return bestTypeVarExtractors(typeParams, originalTypes, uTypedVars, bindings);
	}

	/**
	 * Combine a body with its type premisses. Universal quantifiers take the
	 * premisses as antecedent, existential ones as conjunct.
	 *
	 * @param typeVarBindings
	 * @param typePremisses
	 * @param universal
	 * @param body
	 * @return
	 */
	public VCExpr addTypePremisses(List<VCExpr.LetBinding> typeVarBindings, VCExpr typePremisses, boolean universal,
			VCExpr body) {
		VCExpr bodyWithPremisses;
		if (universal) {
			bodyWithPremisses = gen.impliesSimp(typePremisses, body);
		} else {
			bodyWithPremisses = gen.andSimp(typePremisses, body);
		}
		return gen.let(typeVarBindings, bodyWithPremisses);
	}

	public List<VCExpr.LetBinding> bestTypeVarExtractors(List<Type.Variable> vars, List<Type> types,
			List<VCExpr.Variable> concreteTypeSources, VariableBindings bindings) {
		ArrayList<VCExpr.LetBinding> typeParamBindings = new ArrayList<>();
		for (Type.Variable var : vars) {
			VCExpr extractor = bestTypeVarExtractor(var, types, concreteTypeSources);
			if (extractor != null) {
				typeParamBindings.add(gen.letBinding((VCExpr.Variable) bindings.getTypeVariable(var), extractor));
			}
		}
		return typeParamBindings;
	}

	private VCExpr bestTypeVarExtractor(Type.Variable var, List<Type> types, List<VCExpr.Variable> sources) {
		ArrayList<VCExpr> extractors = new ArrayList<>();
		for (int i = 0; i < types.size(); ++i) {
			typeVarExtractors(var, types.get(i), typeOf(sources.get(i)), extractors);
		}
		VCExpr best = null;
		int bestSize = Integer.MAX_VALUE;
		for (VCExpr e : extractors) {
			int size = SizeComputingVisitor.size(e);
			if (size < bestSize) {
				best = e;
				bestSize = size;
			}
		}
		return best;
	}

	private void typeVarExtractors(Type.Variable var, Type completeType, VCExpr innerTerm,
			List<VCExpr> extractors) {
		if (completeType instanceof Type.Variable) {
			if (var.equals(completeType)) {
				extractors.add(innerTerm);
			}
		} else if (completeType.isBasic() || completeType.isBitVector()) {
			// nothing to extract
		} else if (completeType instanceof Type.Constructor) {
			Type.Constructor ctype = (Type.Constructor) completeType;
			if (!ctype.getArguments().isEmpty()) {
				TypeCtorRepr repr = getTypeCtorReprStruct(ctype.getDecl());
				for (int i = 0; i < ctype.getArguments().size(); ++i) {
					VCExpr newInnerTerm = gen.function(repr.getDestructor(i), innerTerm);
					typeVarExtractors(var, ctype.getArgument(i), newInnerTerm, extractors);
				}
			}
		} else if (completeType instanceof Type.Map) {
			typeVarExtractors(var, getMapTypeAbstracter().abstractMapType((Type.Map) completeType), innerTerm,
					extractors);
		} else {
			throw new IllegalArgumentException("unknown type encountered (" + completeType + ")");
		}
	}

	// =========================================================================
	// Functions
	// =========================================================================

	/**
	 * Partition type parameters into those occurring in the given value
	 * argument types (implicit) and the rest (explicit). Both keep the order of
	 * the original list.
	 *
	 * @param valueArgumentTypes
	 * @param allTypeParams
	 * @return
	 */
	public static TypeParameterPartition separateTypeParams(List<Type> valueArgumentTypes,
			List<Type.Variable> allTypeParams) {
		LinkedHashSet<Type.Variable> varsInInParamTypes = new LinkedHashSet<>();
		for (Type t : valueArgumentTypes) {
			varsInInParamTypes.addAll(t.getFreeVariables());
		}
		ArrayList<Type.Variable> implicitParams = new ArrayList<>();
		ArrayList<Type.Variable> explicitParams = new ArrayList<>();
		for (Type.Variable var : allTypeParams) {
			if (varsInInParamTypes.contains(var)) {
				implicitParams.add(var);
			} else {
				explicitParams.add(var);
			}
		}
		return new TypeParameterPartition(implicitParams, explicitParams);
	}

	/**
	 * Get the untyped counterpart of a function. Functions whose parameter and
	 * result types are all kept by erasure are left as they are.
	 *
	 * @param fun
	 * @return
	 */
	public UntypedFunction typed2Untyped(Function fun) {
		UntypedFunction result = typed2UntypedFunctions.get(fun);
		if (result == null) {
			boolean unchanged = fun.getTypeParameters().isEmpty() && unchangedType(fun.getReturnType());
			for (Type t : fun.getParameterTypes()) {
				unchanged &= unchangedType(t);
			}
			if (unchanged) {
				result = new UntypedFunction(fun, Collections.emptyList(), Collections.emptyList());
			} else {
				TypeParameterPartition partition = separateTypeParams(fun.getParameterTypes(),
						fun.getTypeParameters());
				ArrayList<Type> types = new ArrayList<>();
				for (int i = 0; i < partition.getExplicit().size(); ++i) {
					types.add(getT());
				}
				for (Type t : fun.getParameterTypes()) {
					types.add(typeAfterErasure(t));
				}
				Type returnType = typeAfterErasure(fun.getReturnType());
				Function untypedFun = new Function(fun.getName(), Collections.emptyList(), types, returnType,
						fun.getAttributes());
				result = new UntypedFunction(untypedFun, partition.getImplicit(), partition.getExplicit());
				if (returnType.equals(getU())) {
					addTypeAxiom(genFunctionAxiom(untypedFun, partition.getImplicit(), partition.getExplicit(),
							fun.getParameterTypes(), fun.getReturnType()));
				}
				if (LOGGER.isDebugEnabled()) {
					LOGGER.debug("registered untyped function " + untypedFun.getName() + " for " + fun.getName());
				}
			}
			typed2UntypedFunctions.put(fun, result);
		}
		return result;
	}

	/**
	 * Generate the axiom stating the type of a function's result, e.g.
	 * <code>forall arg0:U :: {f(arg0)} let a := type(arg0); type(f(arg0)) == C(a)</code>.
	 * The parameter types of the given (untyped) function determine the sorts of
	 * the quantified variables.
	 *
	 * @param fun                The untyped function
	 * @param implicitTypeParams
	 * @param explicitTypeParams
	 * @param originalInTypes    The parameter types before erasure
	 * @param originalResultType The result type before erasure
	 * @return
	 */
	public VCExpr genFunctionAxiom(Function fun, List<Type.Variable> implicitTypeParams,
			List<Type.Variable> explicitTypeParams, List<Type> originalInTypes, Type originalResultType) {
		if (originalInTypes.size() + explicitTypeParams.size() != fun.getArity()) {
			throw new IllegalArgumentException("invalid signature for function " + fun);
		} else if (options.getTypeEncoding() == ErasureOptions.TypeEncoding.NONE) {
			return VCExpressionGenerator.TRUE;
		}
		List<VCExpr.Variable> typedInputVars = gen.variables(originalInTypes, "arg");
		// explicit type parameters become universally quantified variables
		VariableBindings bindings = bindTypeParameters(explicitTypeParams, VariableBindings.EMPTY);
		ArrayList<VCExpr.Variable> boundVars = new ArrayList<>();
		for (Type.Variable var : explicitTypeParams) {
			boundVars.add((VCExpr.Variable) bindings.getTypeVariable(var));
		}
		ArrayList<VCExpr.Variable> untypedInputVars = new ArrayList<>();
		for (int i = 0; i < typedInputVars.size(); ++i) {
			Type newType = fun.getParameterType(explicitTypeParams.size() + i);
			untypedInputVars.add(gen.variable(typedInputVars.get(i).getName(), newType));
		}
		boundVars.addAll(untypedInputVars);
		bindings = bindings.bindVariables(typedInputVars, untypedInputVars);
		bindings = bindTypeParameters(implicitTypeParams, bindings);
		List<VCExpr.LetBinding> typeVarBindings = genTypeParamBindings(implicitTypeParams, typedInputVars, bindings);
		boundVars.addAll(unboundTypeParameters(implicitTypeParams, typeVarBindings, bindings));
		VCExpr funApp = gen.function(fun, boundVars.subList(0, fun.getArity()));
		VCExpr conclusion = gen.eq(typeOf(funApp), typeToTerm(originalResultType, bindings.getTypeVariableBindings()));
		// no type premisses are needed, since any function can be extended to all of U
		VCExpr body = gen.let(typeVarBindings, conclusion);
		if (boundVars.isEmpty()) {
			return body;
		}
		return gen.forall(boundVars, ImmutableList.of(gen.trigger(true, funApp)), "funType:" + fun.getName(), body);
	}

	/**
	 * Determine the term variables of those type parameters which are not bound
	 * by any of the given let-bindings. These must be quantified explicitly.
	 *
	 * @param typeParams
	 * @param typeVarBindings
	 * @param bindings
	 * @return
	 */
	public List<VCExpr.Variable> unboundTypeParameters(List<Type.Variable> typeParams,
			List<VCExpr.LetBinding> typeVarBindings, VariableBindings bindings) {
		List<VCExpr.Variable> letVars = Util.map(typeVarBindings, VCExpr.LetBinding::getVariable);
		ArrayList<VCExpr.Variable> result = new ArrayList<>();
		for (Type.Variable tvar : typeParams) {
			VCExpr.Variable var = (VCExpr.Variable) bindings.getTypeVariable(tvar);
			if (!letVars.contains(var)) {
				result.add(var);
			}
		}
		return result;
	}

	// =========================================================================
	// Variables
	// =========================================================================

	@Override
	protected void addVarTypeAxiom(VCExpr.Variable var, Type originalType) {
		if (options.getTypeEncoding() != ErasureOptions.TypeEncoding.NONE) {
			addTypeAxiom(genVarTypeAxiom(var, originalType, Collections.emptyMap()));
		}
	}

	/**
	 * Generate the premiss <code>type(x) == T</code> for an untyped variable
	 * whose original type is <code>T</code>. This is simply <code>true</code>
	 * if the variable kept its type.
	 *
	 * @param var
	 * @param originalType
	 * @param varMapping
	 * @return
	 */
	public VCExpr genVarTypeAxiom(VCExpr.Variable var, Type originalType, Map<Type.Variable, VCExpr> varMapping) {
		if (!var.getType().equals(originalType)) {
			return gen.eq(typeOf(var), typeToTerm(originalType, varMapping));
		}
		return VCExpressionGenerator.TRUE;
	}

	/**
	 * The untyped version of a typed function, together with its implicit and
	 * explicit type parameters in the order of the original signature.
	 */
	public static final class UntypedFunction {
		private final Function function;
		private final ImmutableList<Type.Variable> implicitTypeParams;
		private final ImmutableList<Type.Variable> explicitTypeParams;

		public UntypedFunction(Function function, List<Type.Variable> implicitTypeParams,
				List<Type.Variable> explicitTypeParams) {
			this.function = function;
			this.implicitTypeParams = ImmutableList.copyOf(implicitTypeParams);
			this.explicitTypeParams = ImmutableList.copyOf(explicitTypeParams);
		}

		public Function getFunction() {
			return function;
		}

		public List<Type.Variable> getImplicitTypeParameters() {
			return implicitTypeParams;
		}

		public List<Type.Variable> getExplicitTypeParameters() {
			return explicitTypeParams;
		}
	}

	public static final class TypeParameterPartition {
		private final ImmutableList<Type.Variable> implicitParams;
		private final ImmutableList<Type.Variable> explicitParams;

		public TypeParameterPartition(List<Type.Variable> implicitParams, List<Type.Variable> explicitParams) {
			this.implicitParams = ImmutableList.copyOf(implicitParams);
			this.explicitParams = ImmutableList.copyOf(explicitParams);
		}

		public List<Type.Variable> getImplicit() {
			return implicitParams;
		}

		public List<Type.Variable> getExplicit() {
			return explicitParams;
		}
	}
}
