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
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import wyvc.core.Function;
import wyvc.core.Type;
import wyvc.core.VCExpr;
import wyvc.core.VCExpressionGenerator;
import wyvc.util.Util;

/**
 * Generates the select and store functions of map type classes for the
 * erasure using type premisses. Select and store are treated much like
 * ordinary functions: their type parameters are split into implicit and
 * explicit ones, and explicit type parameters become additional arguments.
 * Unless the prover's theory of arrays is used, the (non-extensional) array
 * axioms are generated for each class.
 *
 * @author David J. Pearce
 *
 */
public class MapTypeAbstractionBuilderPremisses extends MapTypeAbstractionBuilder {
	private final TypeAxiomBuilderPremisses axBuilderPremisses;

	private final HashMap<Type.Map, List<Integer>> explicitSelectTypeParamsCache;

	public MapTypeAbstractionBuilderPremisses(TypeAxiomBuilderPremisses axBuilder, VCExpressionGenerator gen) {
		super(axBuilder, gen);
		this.axBuilderPremisses = axBuilder;
		this.explicitSelectTypeParamsCache = new HashMap<>();
	}

	public MapTypeAbstractionBuilderPremisses(TypeAxiomBuilderPremisses axBuilder, VCExpressionGenerator gen,
			MapTypeAbstractionBuilderPremisses builder) {
		super(axBuilder, gen, builder);
		this.axBuilderPremisses = axBuilder;
		this.explicitSelectTypeParamsCache = new HashMap<>(builder.explicitSelectTypeParamsCache);
	}

	/**
	 * Determine the type parameters of a map type which have to be given
	 * explicitly to its select function, i.e. those occurring only in the result
	 * type. These are returned as indices into the map's type parameters, in
	 * ascending order.
	 *
	 * @param type
	 * @return
	 */
	public List<Integer> explicitSelectTypeParams(Type.Map type) {
		List<Integer> result = explicitSelectTypeParamsCache.get(type);
		if (result == null) {
			TypeAxiomBuilderPremisses.TypeParameterPartition partition = TypeAxiomBuilderPremisses
					.separateTypeParams(type.getArguments(), type.getTypeParameters());
			ArrayList<Integer> indices = new ArrayList<>();
			for (Type.Variable var : partition.getExplicit()) {
				indices.add(type.getTypeParameters().indexOf(var));
			}
			result = Collections.unmodifiableList(indices);
			explicitSelectTypeParamsCache.put(type, result);
		}
		return result;
	}

	@Override
	protected ClassRepresentation genSelectStoreFunctions(Type.Map abstractedType, Type.Decl synonym) {
		List<Type.Variable> freeVariables = abstractedType.getFreeVariables();
		List<Type.Variable> typeParams = Util.append(abstractedType.getTypeParameters(), freeVariables);
		Type mapTypeSynonym;
		if (axBuilder.getOptions().getUseArrayTheory()) {
			mapTypeSynonym = abstractedType;
		} else {
			mapTypeSynonym = Type.CONSTRUCTOR(synonym, freeVariables);
		}
		List<Type> originalInTypes = Util.append(ImmutableList.of(mapTypeSynonym), abstractedType.getArguments());
		boolean builtin = axBuilder.getOptions().getUseArrayTheory();
		TypeAxiomBuilderPremisses.UntypedFunction select = createAccessFun(typeParams, originalInTypes,
				abstractedType.getResult(), synonym.getName() + "Select",
				builtin ? ImmutableMap.of("builtin", "select") : Collections.<String, String>emptyMap());
		// store receives one further argument, the assigned value
		List<Type> storeInTypes = Util.append(originalInTypes, ImmutableList.of(abstractedType.getResult()));
		TypeAxiomBuilderPremisses.UntypedFunction store = createAccessFun(typeParams, storeInTypes, mapTypeSynonym,
				synonym.getName() + "Store",
				builtin ? ImmutableMap.of("builtin", "store") : Collections.<String, String>emptyMap());
		if (!store.getExplicitTypeParameters().isEmpty()) {
			throw new IllegalStateException("store function with explicit type parameters");
		}
		if (!builtin) {
			axBuilder.addTypeAxiom(genMapAxiom0(select, store.getFunction(), abstractedType.getResult(), storeInTypes));
			axBuilder.addTypeAxiom(genMapAxiom1(select, store.getFunction(), abstractedType.getResult()));
		}
		return new ClassRepresentation(synonym, select.getFunction(), store.getFunction());
	}

	private TypeAxiomBuilderPremisses.UntypedFunction createAccessFun(List<Type.Variable> originalTypeParams,
			List<Type> originalInTypes, Type originalResult, String name, Map<String, String> attributes) {
		TypeAxiomBuilderPremisses.TypeParameterPartition partition = TypeAxiomBuilderPremisses
				.separateTypeParams(originalInTypes, originalTypeParams);
		ArrayList<Type> ioTypes = new ArrayList<>();
		for (int i = 0; i < partition.getExplicit().size(); ++i) {
			ioTypes.add(axBuilder.getT());
		}
		for (Type type : originalInTypes) {
			ioTypes.add(accessType(type));
		}
		Type resultType = accessType(originalResult);
		Function fun = new Function(name, Collections.emptyList(), ioTypes, resultType, attributes);
		// builtin access functions are left to the prover's theory of arrays
		if (resultType.equals(axBuilder.getU()) && attributes.isEmpty()) {
			axBuilder.addTypeAxiom(axBuilderPremisses.genFunctionAxiom(fun, partition.getImplicit(),
					partition.getExplicit(), originalInTypes, originalResult));
		}
		return new TypeAxiomBuilderPremisses.UntypedFunction(fun, partition.getImplicit(), partition.getExplicit());
	}

	private Type accessType(Type type) {
		if (axBuilder.getOptions().getMonomorphize() && axBuilder.unchangedType(type)) {
			return type;
		}
		return axBuilder.getU();
	}

	// =========================================================================
	// Array Axioms
	// =========================================================================

	private VCExpr select(Function select, List<? extends VCExpr> typeParams, VCExpr map,
			List<VCExpr.Variable> indices) {
		ArrayList<VCExpr> args = new ArrayList<>(typeParams);
		args.add(map);
		args.addAll(indices);
		return gen.function(select, args);
	}

	private VCExpr store(Function store, VCExpr map, List<VCExpr.Variable> indices, VCExpr val) {
		ArrayList<VCExpr> args = new ArrayList<>();
		args.add(map);
		args.addAll(indices);
		args.add(val);
		return gen.function(store, args);
	}

	/**
	 * Generate the axiom stating that reading the location just written yields
	 * the written value:
	 * <code>forall m, x0, ..., val :: type(val) == R ==&gt; select(store(m, x0, ..., val), x0, ...) == val</code>,
	 * with let-bindings for the type parameters of <code>R</code> where needed.
	 */
	private VCExpr genMapAxiom0(TypeAxiomBuilderPremisses.UntypedFunction selectFun, Function store, Type mapResult,
			List<Type> originalInTypes) {
		Function select = selectFun.getFunction();
		int arity = store.getArity() - 2;
		ArrayList<VCExpr.Variable> inParams = new ArrayList<>();
		ArrayList<VCExpr.Variable> quantifiedVars = new ArrayList<>();
		// the map
		VCExpr.Variable typedM = gen.variable("m", originalInTypes.get(0));
		VCExpr.Variable m = gen.variable("m", store.getParameterType(0));
		inParams.add(typedM);
		quantifiedVars.add(m);
		// the indices
		ArrayList<Type> origIndexTypes = new ArrayList<>();
		ArrayList<Type> indexTypes = new ArrayList<>();
		for (int i = 1; i <= arity; i++) {
			origIndexTypes.add(originalInTypes.get(i));
			indexTypes.add(store.getParameterType(i));
		}
		List<VCExpr.Variable> typedArgs = gen.variables(origIndexTypes, "arg");
		List<VCExpr.Variable> indices = gen.variables(indexTypes, "x");
		inParams.addAll(typedArgs);
		quantifiedVars.addAll(indices);
		// the value
		VCExpr.Variable typedVal = gen.variable("val", mapResult);
		VCExpr.Variable val = gen.variable("val", select.getReturnType());
		quantifiedVars.add(val);
		VariableBindings bindings = VariableBindings.EMPTY.bindVariable(typedM, m)
				.bindVariables(typedArgs, indices).bindVariable(typedVal, val);
		List<Type.Variable> implicitParams = selectFun.getImplicitTypeParameters();
		List<Type.Variable> explicitParams = selectFun.getExplicitTypeParameters();
		bindings = axBuilderPremisses.bindTypeParameters(implicitParams, bindings);
		bindings = axBuilderPremisses.bindTypeParameters(explicitParams, bindings);
		ArrayList<VCExpr> typeParams = new ArrayList<>();
		for (Type.Variable tp : explicitParams) {
			typeParams.add(bindings.getTypeVariable(tp));
		}
		VCExpr storeExpr = store(store, m, indices, val);
		VCExpr selectExpr = select(select, typeParams, storeExpr, indices);
		// implicit parameters are extracted from the in-parameters, explicit ones from the value
		List<VCExpr.LetBinding> implicitLets = axBuilderPremisses.genTypeParamBindings(implicitParams, inParams,
				bindings);
		List<VCExpr.LetBinding> explicitLets = axBuilderPremisses.genTypeParamBindings(explicitParams,
				ImmutableList.of(typedVal), bindings);
		VCExpr eq = gen.eq(selectExpr, val);
		VCExpr body;
		if (axBuilder.getOptions().getTypeEncoding() == ErasureOptions.TypeEncoding.NONE
				|| !select.getReturnType().equals(axBuilder.getU())) {
			body = gen.let(explicitLets, eq);
			quantifiedVars.addAll(axBuilderPremisses.unboundTypeParameters(explicitParams, explicitLets, bindings));
		} else {
			VCExpr ante = gen.eq(axBuilderPremisses.typeOf(val),
					axBuilder.typeToTerm(mapResult, bindings.getTypeVariableBindings()));
			body = gen.let(implicitLets, gen.let(explicitLets, gen.impliesSimp(ante, eq)));
			quantifiedVars.addAll(axBuilderPremisses.unboundTypeParameters(implicitParams, implicitLets, bindings));
			quantifiedVars.addAll(axBuilderPremisses.unboundTypeParameters(explicitParams, explicitLets, bindings));
		}
		return gen.forall(quantifiedVars, Collections.emptyList(), "mapAx0:" + select.getName(), body);
	}

	/**
	 * Generate the axioms stating that writing a location does not affect
	 * reading another one: one axiom per index position, stating that either
	 * the indices at that position are equal or the read is unaffected, and one
	 * further axiom for the explicit type parameters of the read.
	 */
	private VCExpr genMapAxiom1(TypeAxiomBuilderPremisses.UntypedFunction selectFun, Function store, Type mapResult) {
		Function select = selectFun.getFunction();
		List<Type.Variable> explicitParams = selectFun.getExplicitTypeParameters();
		int arity = store.getArity() - 2;
		ArrayList<Type> indexTypes = new ArrayList<>();
		for (int i = 1; i <= arity; i++) {
			indexTypes.add(store.getParameterType(i));
		}
		List<VCExpr.Variable> indices0 = gen.variables(indexTypes, "x");
		List<VCExpr.Variable> indices1 = gen.variables(indexTypes, "y");
		VCExpr.Variable m = gen.variable("m", store.getParameterType(0));
		VCExpr.Variable val = gen.variable("val", select.getReturnType());
		// the explicit type parameters are extracted from the type of the value
		VCExpr.Variable typedVal = gen.variable("val", mapResult);
		VariableBindings bindings = VariableBindings.EMPTY.bindVariable(typedVal, val);
		bindings = axBuilderPremisses.bindTypeParameters(explicitParams, bindings);
		List<VCExpr.LetBinding> letBindings = axBuilderPremisses.genTypeParamBindings(explicitParams,
				ImmutableList.of(typedVal), bindings);
		ArrayList<VCExpr.Variable> typeParams = new ArrayList<>();
		for (Type.Variable var : explicitParams) {
			typeParams.add((VCExpr.Variable) bindings.getTypeVariable(var));
		}
		VCExpr storeExpr = store(store, m, indices0, val);
		VCExpr selectWithoutStoreExpr = select(select, typeParams, m, indices1);
		VCExpr selectExpr = select(select, typeParams, storeExpr, indices1);
		VCExpr selectEq = gen.eq(selectExpr, selectWithoutStoreExpr);
		ArrayList<VCExpr.Variable> quantifiedVars = new ArrayList<>();
		quantifiedVars.add(val);
		quantifiedVars.add(m);
		quantifiedVars.addAll(indices0);
		quantifiedVars.addAll(indices1);
		quantifiedVars.addAll(typeParams);
		List<VCExpr.Trigger> triggers = Collections.emptyList();
		VCExpr axiom = VCExpressionGenerator.TRUE;
		// the queried location differs from the assigned one
		for (int i = 0; i < arity; ++i) {
			VCExpr matrix = gen.or(gen.eq(indices0.get(i), indices1.get(i)), selectEq);
			axiom = gen.andSimp(axiom,
					gen.forall(quantifiedVars, triggers, "mapAx1:" + select.getName() + ":" + i, matrix));
		}
		// the queried type differs from the assigned one
		VCExpr typesEq = gen.andSimp(gen.asEquations(letBindings));
		VCExpr matrix = gen.or(typesEq, selectEq);
		axiom = gen.andSimp(axiom, gen.forall(quantifiedVars, triggers, "mapAx2:" + select.getName(), matrix));
		return axiom;
	}
}
