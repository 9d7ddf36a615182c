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
import java.util.HashMap;
import java.util.List;

import org.apache.log4j.Logger;

import wyvc.core.Function;
import wyvc.core.Type;
import wyvc.core.VCExpressionGenerator;

/**
 * Abstracts map types into a finite number of classes, each of which is
 * represented by a fresh type constructor together with its own select and
 * store functions. A map type is abstracted by replacing every maximal subtype
 * that does not mention the map's own type parameters with a fresh type
 * variable. For example, <code>&lt;a&gt;[C int, a]bool</code> is abstracted to
 * <code>&lt;a&gt;[aVar0, a]aVar1</code> with the instantiations
 * <code>C int</code> and <code>bool</code>. All map types which abstract to
 * the same map type (modulo renaming of type parameters) share one class.
 *
 * @author David J. Pearce
 *
 */
public abstract class MapTypeAbstractionBuilder {
	private static final Logger LOGGER = Logger.getLogger(MapTypeAbstractionBuilder.class);

	protected final TypeAxiomBuilder axBuilder;
	protected final VCExpressionGenerator gen;

	/**
	 * The type variables used in abstractions. The same variables are used in
	 * the same order by all abstractions, so that abstractions can be compared
	 * directly.
	 */
	private final ArrayList<Type.Variable> abstractionVariables;

	private final HashMap<Type.Map, ClassRepresentation> classRepresentations;

	public MapTypeAbstractionBuilder(TypeAxiomBuilder axBuilder, VCExpressionGenerator gen) {
		this.axBuilder = axBuilder;
		this.gen = gen;
		this.abstractionVariables = new ArrayList<>();
		this.classRepresentations = new HashMap<>();
	}

	protected MapTypeAbstractionBuilder(TypeAxiomBuilder axBuilder, VCExpressionGenerator gen,
			MapTypeAbstractionBuilder builder) {
		this.axBuilder = axBuilder;
		this.gen = gen;
		this.abstractionVariables = new ArrayList<>(builder.abstractionVariables);
		this.classRepresentations = new HashMap<>(builder.classRepresentations);
	}

	private Type.Variable abstractionVariable(int num) {
		while (abstractionVariables.size() <= num) {
			abstractionVariables.add(new Type.Variable("aVar" + abstractionVariables.size()));
		}
		return abstractionVariables.get(num);
	}

	// =========================================================================
	// Class Representations
	// =========================================================================

	protected ClassRepresentation getClassRepresentation(Type.Map abstractedType) {
		ClassRepresentation result = classRepresentations.get(abstractedType);
		if (result == null) {
			int num = classRepresentations.size();
			Type.Decl synonym = new Type.Decl("MapType" + num, abstractedType.getFreeVariables().size());
			result = genSelectStoreFunctions(abstractedType, synonym);
			classRepresentations.put(abstractedType, result);
			if (LOGGER.isDebugEnabled()) {
				LOGGER.debug("registered map type class " + abstractedType + " as " + synonym);
			}
		}
		return result;
	}

	/**
	 * Generate the select and store functions for a given class of map types,
	 * along with any axioms they need.
	 *
	 * @param abstractedType The abstracted map type
	 * @param synonym        The type constructor representing the class
	 * @return
	 */
	protected abstract ClassRepresentation genSelectStoreFunctions(Type.Map abstractedType, Type.Decl synonym);

	/**
	 * Get the select function for a given map type.
	 *
	 * @param rawType
	 * @param instantiations receives the instantiations of the abstraction
	 *                       variables
	 * @return
	 */
	public Function select(Type.Map rawType, List<Type> instantiations) {
		return getClassRepresentation(thinOutMapType(rawType, instantiations)).getSelect();
	}

	/**
	 * Get the store function for a given map type.
	 *
	 * @param rawType
	 * @param instantiations receives the instantiations of the abstraction
	 *                       variables
	 * @return
	 */
	public Function store(Type.Map rawType, List<Type> instantiations) {
		return getClassRepresentation(thinOutMapType(rawType, instantiations)).getStore();
	}

	/**
	 * Translate a map type into an instance of the type constructor representing
	 * its class.
	 *
	 * @param rawType
	 * @return
	 */
	public Type.Constructor abstractMapType(Type.Map rawType) {
		ArrayList<Type> instantiations = new ArrayList<>();
		Type.Map abstraction = thinOutMapType(rawType, instantiations);
		ClassRepresentation repr = getClassRepresentation(abstraction);
		if (repr.getRepresentingType().getArity() != instantiations.size()) {
			throw new IllegalStateException("inconsistent abstraction of map type " + rawType);
		}
		return Type.CONSTRUCTOR(repr.getRepresentingType(), instantiations);
	}

	// =========================================================================
	// Abstraction
	// =========================================================================

	/**
	 * Abstract a map type, recording the types replaced by abstraction variables
	 * in order.
	 *
	 * @param rawType
	 * @param instantiations
	 * @return
	 */
	protected Type.Map thinOutMapType(Type.Map rawType, List<Type> instantiations) {
		ArrayList<Type> newArguments = new ArrayList<>();
		for (Type t : rawType.getArguments()) {
			newArguments.add(thinOutType(t, rawType.getTypeParameters(), instantiations));
		}
		Type newResult = thinOutType(rawType.getResult(), rawType.getTypeParameters(), instantiations);
		return Type.MAP(rawType.getTypeParameters(), newArguments, newResult);
	}

	private Type thinOutType(Type rawType, List<Type.Variable> boundTypeParams, List<Type> instantiations) {
		if (axBuilder.getOptions().getMonomorphize() && axBuilder.unchangedType(rawType)) {
			return rawType;
		}
		boolean closed = true;
		for (Type.Variable var : rawType.getFreeVariables()) {
			closed &= !boundTypeParams.contains(var);
		}
		if (closed) {
			// no bound type parameters, so the whole type is abstracted
			Type.Variable abstractionVar = abstractionVariable(instantiations.size());
			instantiations.add(rawType);
			return abstractionVar;
		} else if (rawType instanceof Type.Variable) {
			// must be bound
			return rawType;
		} else if (rawType instanceof Type.Map) {
			Type.Constructor abstraction = abstractMapType((Type.Map) rawType);
			return thinOutType(abstraction, boundTypeParams, instantiations);
		} else if (rawType instanceof Type.Constructor) {
			Type.Constructor ctype = (Type.Constructor) rawType;
			ArrayList<Type> newArguments = new ArrayList<>();
			for (Type t : ctype.getArguments()) {
				newArguments.add(thinOutType(t, boundTypeParams, instantiations));
			}
			return Type.CONSTRUCTOR(ctype.getDecl(), newArguments);
		} else {
			throw new IllegalArgumentException("unknown type encountered (" + rawType + ")");
		}
	}

	/**
	 * The untyped representation of a class of map types: a type constructor
	 * and a select/store pair.
	 */
	public static final class ClassRepresentation {
		private final Type.Decl representingType;
		private final Function select;
		private final Function store;

		public ClassRepresentation(Type.Decl representingType, Function select, Function store) {
			this.representingType = representingType;
			this.select = select;
			this.store = store;
		}

		public Type.Decl getRepresentingType() {
			return representingType;
		}

		public Function getSelect() {
			return select;
		}

		public Function getStore() {
			return store;
		}
	}
}
