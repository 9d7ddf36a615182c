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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import com.google.common.collect.ImmutableList;

import wyvc.core.Function;
import wyvc.core.Type;
import wyvc.core.VCExpr;
import wyvc.core.VCExpressionGenerator;

/**
 * Responsible for representing types as terms and for collecting the axioms
 * which make this representation sound. Types are represented as terms of a
 * dedicated sort <code>T</code>, whilst all values whose type is erased live
 * in a single sort <code>U</code>. Each basic type and each type constructor
 * is given a distinct constructor number, which allows the prover to conclude
 * that different types are different.
 *
 * <p>
 * Representations are created on demand and cached. The axioms generated along
 * the way are accumulated, and those generated since the last call to
 * {@link #getNewAxioms()} can be retrieved incrementally.
 * </p>
 *
 * @author David J. Pearce
 *
 */
public abstract class TypeAxiomBuilder {
	private static final Logger LOGGER = Logger.getLogger(TypeAxiomBuilder.class);

	protected final VCExpressionGenerator gen;
	protected final ErasureOptions options;

	/**
	 * All type axioms generated so far.
	 */
	private final ArrayList<VCExpr> allTypeAxioms;
	/**
	 * Type axioms generated since the last call to getNewAxioms().
	 */
	private final ArrayList<VCExpr> incTypeAxioms;

	/**
	 * The sort of all values whose type is erased.
	 */
	private final Type.Decl uDecl;
	private final Type u;
	/**
	 * The sort of type representations.
	 */
	private final Type.Decl tDecl;
	private final Type t;

	/**
	 * Maps each type representation to its constructor number.
	 */
	private final Function ctor;
	private BigInteger currentCtorNum;

	private final HashMap<Type, VCExpr> basicTypeReprs;
	private final HashMap<Type.Decl, TypeCtorRepr> typeCtorReprs;
	private final HashMap<Type.Variable, VCExpr.Variable> typeVariableMapping;
	private final HashMap<VCExpr.Variable, VCExpr.Variable> typed2UntypedVariables;

	public TypeAxiomBuilder(VCExpressionGenerator gen, ErasureOptions options) {
		this.gen = gen;
		this.options = new ErasureOptions(options);
		this.allTypeAxioms = new ArrayList<>();
		this.incTypeAxioms = new ArrayList<>();
		this.uDecl = new Type.Decl("U", 0);
		this.u = Type.CONSTRUCTOR(uDecl);
		this.tDecl = new Type.Decl("T", 0);
		this.t = Type.CONSTRUCTOR(tDecl);
		this.ctor = Function.create("Ctor", Type.INT, t);
		this.currentCtorNum = BigInteger.ZERO;
		this.basicTypeReprs = new HashMap<>();
		this.typeCtorReprs = new HashMap<>();
		this.typeVariableMapping = new HashMap<>();
		this.typed2UntypedVariables = new HashMap<>();
	}

	/**
	 * Construct a copy of a given builder. The copy shares all symbols created
	 * so far with the original, but subsequently evolves independently.
	 *
	 * @param builder
	 */
	protected TypeAxiomBuilder(TypeAxiomBuilder builder) {
		this.gen = builder.gen;
		this.options = new ErasureOptions(builder.options);
		this.allTypeAxioms = new ArrayList<>(builder.allTypeAxioms);
		this.incTypeAxioms = new ArrayList<>(builder.incTypeAxioms);
		this.uDecl = builder.uDecl;
		this.u = builder.u;
		this.tDecl = builder.tDecl;
		this.t = builder.t;
		this.ctor = builder.ctor;
		this.currentCtorNum = builder.currentCtorNum;
		this.basicTypeReprs = new HashMap<>(builder.basicTypeReprs);
		this.typeCtorReprs = new HashMap<>(builder.typeCtorReprs);
		this.typeVariableMapping = new HashMap<>(builder.typeVariableMapping);
		this.typed2UntypedVariables = new HashMap<>(builder.typed2UntypedVariables);
	}

	/**
	 * Register the representations which every erasure needs. This should be
	 * called once, before erasing anything.
	 */
	public void setup() {
		getBasicTypeRepr(Type.INT);
		getBasicTypeRepr(Type.BOOL);
	}

	/**
	 * Create an independent copy of this builder.
	 *
	 * @return
	 */
	public abstract TypeAxiomBuilder copy();

	public abstract MapTypeAbstractionBuilder getMapTypeAbstracter();

	public VCExpressionGenerator getGenerator() {
		return gen;
	}

	/**
	 * Get the options of this builder. The result is a copy, so changing it
	 * does not affect the builder.
	 *
	 * @return
	 */
	public ErasureOptions getOptions() {
		return new ErasureOptions(options);
	}

	// =========================================================================
	// Type Axioms
	// =========================================================================

	protected void addTypeAxiom(VCExpr axiom) {
		if (axiom != VCExpressionGenerator.TRUE) {
			allTypeAxioms.add(axiom);
			incTypeAxioms.add(axiom);
		}
	}

	/**
	 * Get the number of axioms added since the last call to getNewAxioms().
	 *
	 * @return
	 */
	public int getNewAxiomCount() {
		return incTypeAxioms.size();
	}

	/**
	 * Return the conjunction of all axioms added since the last time this method
	 * was called.
	 *
	 * @return
	 */
	public VCExpr getNewAxioms() {
		VCExpr result = gen.andSimp(incTypeAxioms);
		incTypeAxioms.clear();
		return result;
	}

	public List<VCExpr> getAllTypeAxioms() {
		return Collections.unmodifiableList(allTypeAxioms);
	}

	private VCExpr genCtorAssignment(VCExpr typeRepr) {
		if (options.getTypeEncoding() == ErasureOptions.TypeEncoding.NONE) {
			return VCExpressionGenerator.TRUE;
		}
		VCExpr result = gen.eq(gen.function(ctor, typeRepr), gen.integer(currentCtorNum));
		currentCtorNum = currentCtorNum.add(BigInteger.ONE);
		return result;
	}

	private VCExpr genCtorAssignment(Function typeRepr) {
		if (options.getTypeEncoding() == ErasureOptions.TypeEncoding.NONE) {
			return VCExpressionGenerator.TRUE;
		}
		List<VCExpr.Variable> quantifiedVars = gen.variables(typeRepr.getParameterTypes(), "arg");
		VCExpr app = gen.function(typeRepr, quantifiedVars);
		VCExpr eq = genCtorAssignment(app);
		if (quantifiedVars.isEmpty()) {
			return eq;
		}
		return gen.forall(quantifiedVars, ImmutableList.of(gen.trigger(true, app)), "ctor:" + typeRepr.getName(),
				eq);
	}

	/**
	 * Generate an axiom <code>forall x0, x1, ... :: inv(f(x0, x1, ...)) == xi</code>
	 * for a function <code>f</code> and its <code>i</code>th left inverse.
	 *
	 * @param fun
	 * @param invFun
	 * @param dtorNum
	 * @return
	 */
	protected VCExpr genLeftInverseAxiom(Function fun, Function invFun, int dtorNum) {
		List<VCExpr.Variable> quantifiedVars = gen.variables(fun.getParameterTypes(), "arg");
		VCExpr funApp = gen.function(fun, quantifiedVars);
		VCExpr eq = gen.eq(gen.function(invFun, funApp), quantifiedVars.get(dtorNum));
		return gen.forall(quantifiedVars, ImmutableList.of(gen.trigger(true, funApp)), "typeInv:" + invFun.getName(),
				eq);
	}

	// =========================================================================
	// Sorts
	// =========================================================================

	public Type getU() {
		return u;
	}

	public Type getT() {
		return t;
	}

	/**
	 * Determine the type a value of the given type has after erasure.
	 */
	public abstract Type typeAfterErasure(Type type);

	/**
	 * Determine whether a type is kept by erasure.
	 */
	public abstract boolean unchangedType(Type type);

	// =========================================================================
	// Type Representations
	// =========================================================================

	private VCExpr getBasicTypeRepr(Type type) {
		VCExpr result = basicTypeReprs.get(type);
		if (result == null) {
			result = gen.function(Function.create(type + "Type", t));
			addTypeAxiom(genCtorAssignment(result));
			basicTypeReprs.put(type, result);
			if (LOGGER.isDebugEnabled()) {
				LOGGER.debug("registered type " + type + " as " + result);
			}
		}
		return result;
	}

	protected TypeCtorRepr getTypeCtorReprStruct(Type.Decl decl) {
		TypeCtorRepr result = typeCtorReprs.get(decl);
		if (result == null) {
			Function ctor = Function.uniform(decl.getName() + "Type", decl.getArity(), t, t);
			addTypeAxiom(genCtorAssignment(ctor));
			ArrayList<Function> dtors = new ArrayList<>();
			for (int i = 0; i < decl.getArity(); ++i) {
				Function dtor = Function.uniform(decl.getName() + "TypeInv" + i, 1, t, t);
				dtors.add(dtor);
				addTypeAxiom(genLeftInverseAxiom(ctor, dtor, i));
			}
			result = new TypeCtorRepr(ctor, dtors);
			typeCtorReprs.put(decl, result);
			if (LOGGER.isDebugEnabled()) {
				LOGGER.debug("registered type constructor " + decl + " as " + ctor);
			}
		}
		return result;
	}

	public Function getTypeCtorRepr(Type.Decl decl) {
		return getTypeCtorReprStruct(decl).getConstructor();
	}

	public Function getTypeDtor(Type.Decl decl, int num) {
		return getTypeCtorReprStruct(decl).getDestructor(num);
	}

	/**
	 * Get the term variable standing for a free type variable.
	 *
	 * @param var
	 * @return
	 */
	public VCExpr.Variable typed2Untyped(Type.Variable var) {
		VCExpr.Variable result = typeVariableMapping.get(var);
		if (result == null) {
			result = gen.variable(var.getName(), t);
			typeVariableMapping.put(var, result);
		}
		return result;
	}

	/**
	 * Get the untyped counterpart of a free (i.e. global) term variable. This
	 * must not be used for bound variables.
	 *
	 * @param var
	 * @return
	 */
	public VCExpr.Variable typed2Untyped(VCExpr.Variable var) {
		VCExpr.Variable result = typed2UntypedVariables.get(var);
		if (result == null) {
			result = gen.variable(var.getName(), typeAfterErasure(var.getType()));
			typed2UntypedVariables.put(var, result);
			addVarTypeAxiom(result, var.getType());
		}
		return result;
	}

	protected abstract void addVarTypeAxiom(VCExpr.Variable var, Type originalType);

	/**
	 * Translate a type into the term representing it. Type variables bound in
	 * the given mapping are replaced accordingly, whilst all other type
	 * variables are taken as free.
	 *
	 * @param type
	 * @param varMapping
	 * @return
	 */
	public VCExpr typeToTerm(Type type, Map<Type.Variable, VCExpr> varMapping) {
		if (type.isBasic() || type.isBitVector()) {
			return getBasicTypeRepr(type);
		} else if (type instanceof Type.Constructor) {
			Type.Constructor ctype = (Type.Constructor) type;
			Function repr = getTypeCtorRepr(ctype.getDecl());
			ArrayList<VCExpr> args = new ArrayList<>();
			for (Type arg : ctype.getArguments()) {
				args.add(typeToTerm(arg, varMapping));
			}
			return gen.function(repr, args);
		} else if (type instanceof Type.Variable) {
			VCExpr result = varMapping.get(type);
			if (result == null) {
				// the variable is free, and is bound to a global term variable
				result = typed2Untyped((Type.Variable) type);
			}
			return result;
		} else if (type instanceof Type.Map) {
			return typeToTerm(getMapTypeAbstracter().abstractMapType((Type.Map) type), varMapping);
		} else {
			throw new IllegalArgumentException("unknown type encountered (" + type.getClass().getName() + ")");
		}
	}

	public VCExpr typeToTerm(Type type) {
		return typeToTerm(type, Collections.emptyMap());
	}

	/**
	 * The term representation of a type constructor: a constructor function
	 * from the representations of the arguments, and one destructor per
	 * argument.
	 */
	public static final class TypeCtorRepr {
		private final Function ctor;
		private final ImmutableList<Function> dtors;

		public TypeCtorRepr(Function ctor, List<Function> dtors) {
			this.ctor = ctor;
			this.dtors = ImmutableList.copyOf(dtors);
		}

		public Function getConstructor() {
			return ctor;
		}

		public Function getDestructor(int i) {
			return dtors.get(i);
		}
	}
}
