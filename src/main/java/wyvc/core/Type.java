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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import wyvc.io.VCExprPrinter;

/**
 * Represents a semantic type as attached to variables, operators and function
 * declarations. Types are immutable and compared structurally, except for type
 * variables and type constructor declarations which are compared by identity.
 * Map types bind their own type parameters and are compared modulo the
 * renaming of those parameters.
 *
 * @author David J. Pearce
 *
 */
public interface Type {
	public static final Bool BOOL = new Bool();
	public static final Int INT = new Int();

	/**
	 * Get the free type variables of this type, in order of first occurrence.
	 *
	 * @return
	 */
	public List<Variable> getFreeVariables();

	/**
	 * Apply a given substitution to all free occurrences of type variables in
	 * this type.
	 *
	 * @param binding
	 * @return
	 */
	public Type substitute(java.util.Map<Variable, Type> binding);

	public default boolean isBasic() {
		return false;
	}

	public default boolean isBitVector() {
		return false;
	}

	public default boolean isVariable() {
		return false;
	}

	public default boolean isConstructor() {
		return false;
	}

	public default boolean isMap() {
		return false;
	}

	public static BitVector BV(int bits) {
		return new BitVector(bits);
	}

	public static Constructor CONSTRUCTOR(Decl decl, Type... arguments) {
		return new Constructor(decl, ImmutableList.copyOf(arguments));
	}

	public static Constructor CONSTRUCTOR(Decl decl, List<? extends Type> arguments) {
		return new Constructor(decl, ImmutableList.copyOf(arguments));
	}

	public static Map MAP(List<Variable> parameters, List<? extends Type> arguments, Type result) {
		return new Map(ImmutableList.copyOf(parameters), ImmutableList.copyOf(arguments), result);
	}

	public static Map MAP(List<? extends Type> arguments, Type result) {
		return new Map(ImmutableList.of(), ImmutableList.copyOf(arguments), result);
	}

	public static abstract class AbstractType implements Type {

		@Override
		public List<Variable> getFreeVariables() {
			LinkedHashSet<Variable> result = new LinkedHashSet<>();
			collectFreeVariables(Collections.emptySet(), result);
			return new ArrayList<>(result);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof AbstractType && equivalent((AbstractType) o, Collections.emptyMap());
		}

		@Override
		public int hashCode() {
			return hash(Collections.emptyMap());
		}

		@Override
		public String toString() {
			return VCExprPrinter.toString(this);
		}

		/**
		 * Check whether this type is equivalent to another under a given
		 * correspondence between bound type variables.
		 */
		abstract boolean equivalent(AbstractType other, java.util.Map<Variable, Variable> renaming);

		abstract int hash(java.util.Map<Variable, Integer> bound);

		abstract void collectFreeVariables(Set<Variable> bound, Set<Variable> result);
	}

	// =========================================================================
	// Basic Types
	// =========================================================================

	public static class Bool extends AbstractType {
		private Bool() {
		}

		@Override
		public boolean isBasic() {
			return true;
		}

		@Override
		public Type substitute(java.util.Map<Variable, Type> binding) {
			return this;
		}

		@Override
		boolean equivalent(AbstractType other, java.util.Map<Variable, Variable> renaming) {
			return other instanceof Bool;
		}

		@Override
		int hash(java.util.Map<Variable, Integer> bound) {
			return 1;
		}

		@Override
		void collectFreeVariables(Set<Variable> bound, Set<Variable> result) {
		}
	}

	public static class Int extends AbstractType {
		private Int() {
		}

		@Override
		public boolean isBasic() {
			return true;
		}

		@Override
		public Type substitute(java.util.Map<Variable, Type> binding) {
			return this;
		}

		@Override
		boolean equivalent(AbstractType other, java.util.Map<Variable, Variable> renaming) {
			return other instanceof Int;
		}

		@Override
		int hash(java.util.Map<Variable, Integer> bound) {
			return 2;
		}

		@Override
		void collectFreeVariables(Set<Variable> bound, Set<Variable> result) {
		}
	}

	public static class BitVector extends AbstractType {
		private final int bits;

		private BitVector(int bits) {
			Preconditions.checkArgument(bits >= 0, "invalid bitvector width (" + bits + ")");
			this.bits = bits;
		}

		public int getBits() {
			return bits;
		}

		@Override
		public boolean isBitVector() {
			return true;
		}

		@Override
		public Type substitute(java.util.Map<Variable, Type> binding) {
			return this;
		}

		@Override
		boolean equivalent(AbstractType other, java.util.Map<Variable, Variable> renaming) {
			return other instanceof BitVector && ((BitVector) other).bits == bits;
		}

		@Override
		int hash(java.util.Map<Variable, Integer> bound) {
			return 3 + (bits * 31);
		}

		@Override
		void collectFreeVariables(Set<Variable> bound, Set<Variable> result) {
		}
	}

	// =========================================================================
	// Type Variables
	// =========================================================================

	/**
	 * A type variable. Two type variables are only ever equal when they are the
	 * same object, regardless of their names.
	 */
	public static class Variable extends AbstractType {
		private final String name;

		public Variable(String name) {
			this.name = name;
		}

		public String getName() {
			return name;
		}

		@Override
		public boolean isVariable() {
			return true;
		}

		@Override
		public Type substitute(java.util.Map<Variable, Type> binding) {
			Type t = binding.get(this);
			return t == null ? this : t;
		}

		@Override
		public boolean equals(Object o) {
			return this == o;
		}

		@Override
		public int hashCode() {
			return System.identityHashCode(this);
		}

		@Override
		boolean equivalent(AbstractType other, java.util.Map<Variable, Variable> renaming) {
			Variable v = renaming.get(this);
			if (v != null) {
				return v == other;
			} else {
				return this == other && !renaming.containsValue(other);
			}
		}

		@Override
		int hash(java.util.Map<Variable, Integer> bound) {
			java.lang.Integer index = bound.get(this);
			return index != null ? 17 + (index * 31) : System.identityHashCode(this);
		}

		@Override
		void collectFreeVariables(Set<Variable> bound, Set<Variable> result) {
			if (!bound.contains(this)) {
				result.add(this);
			}
		}
	}

	// =========================================================================
	// Constructed Types
	// =========================================================================

	/**
	 * The declaration of a named type constructor with a fixed number of
	 * arguments. Declarations are compared by identity.
	 */
	public static class Decl {
		private final String name;
		private final int arity;

		public Decl(String name, int arity) {
			Preconditions.checkArgument(arity >= 0, "invalid type constructor arity");
			this.name = name;
			this.arity = arity;
		}

		public String getName() {
			return name;
		}

		public int getArity() {
			return arity;
		}

		@Override
		public String toString() {
			return name;
		}
	}

	public static class Constructor extends AbstractType {
		private final Decl decl;
		private final ImmutableList<Type> arguments;

		private Constructor(Decl decl, ImmutableList<Type> arguments) {
			Preconditions.checkArgument(decl.getArity() == arguments.size(),
					"type constructor " + decl.getName() + " expects " + decl.getArity() + " arguments");
			this.decl = decl;
			this.arguments = arguments;
		}

		public Decl getDecl() {
			return decl;
		}

		public List<Type> getArguments() {
			return arguments;
		}

		public Type getArgument(int i) {
			return arguments.get(i);
		}

		@Override
		public boolean isConstructor() {
			return true;
		}

		@Override
		public Type substitute(java.util.Map<Variable, Type> binding) {
			if (arguments.isEmpty()) {
				return this;
			}
			ImmutableList.Builder<Type> nArguments = ImmutableList.builder();
			for (Type t : arguments) {
				nArguments.add(t.substitute(binding));
			}
			return new Constructor(decl, nArguments.build());
		}

		@Override
		boolean equivalent(AbstractType other, java.util.Map<Variable, Variable> renaming) {
			if (other instanceof Constructor) {
				Constructor c = (Constructor) other;
				return c.decl == decl && Type.equivalentAll(arguments, c.arguments, renaming);
			}
			return false;
		}

		@Override
		int hash(java.util.Map<Variable, Integer> bound) {
			return (System.identityHashCode(decl) * 31) + Type.hashAll(arguments, bound);
		}

		@Override
		void collectFreeVariables(Set<Variable> bound, Set<Variable> result) {
			for (Type t : arguments) {
				((AbstractType) t).collectFreeVariables(bound, result);
			}
		}
	}

	// =========================================================================
	// Map Types
	// =========================================================================

	/**
	 * A (possibly polymorphic) map type <code>&lt;a,b&gt;[A,B]R</code>. The type
	 * parameters are bound by the map type itself.
	 */
	public static class Map extends AbstractType {
		private final ImmutableList<Variable> parameters;
		private final ImmutableList<Type> arguments;
		private final Type result;

		private Map(ImmutableList<Variable> parameters, ImmutableList<Type> arguments, Type result) {
			Preconditions.checkArgument(new HashSet<>(parameters).size() == parameters.size(),
					"duplicate map type parameter");
			this.parameters = parameters;
			this.arguments = arguments;
			this.result = result;
		}

		public List<Variable> getTypeParameters() {
			return parameters;
		}

		public List<Type> getArguments() {
			return arguments;
		}

		public Type getArgument(int i) {
			return arguments.get(i);
		}

		public Type getResult() {
			return result;
		}

		@Override
		public boolean isMap() {
			return true;
		}

		@Override
		public Type substitute(java.util.Map<Variable, Type> binding) {
			HashMap<Variable, Type> nBinding = new HashMap<>(binding);
			for (Variable p : parameters) {
				nBinding.remove(p);
			}
			// Rename parameters which would otherwise capture a free variable
			HashSet<Variable> range = new HashSet<>();
			for (Type t : nBinding.values()) {
				range.addAll(t.getFreeVariables());
			}
			ImmutableList<Variable> nParameters = parameters;
			if (!Collections.disjoint(range, parameters)) {
				ImmutableList.Builder<Variable> renamed = ImmutableList.builder();
				for (Variable p : parameters) {
					Variable q = new Variable(p.getName());
					nBinding.put(p, q);
					renamed.add(q);
				}
				nParameters = renamed.build();
			}
			ImmutableList.Builder<Type> nArguments = ImmutableList.builder();
			for (Type t : arguments) {
				nArguments.add(t.substitute(nBinding));
			}
			return new Map(nParameters, nArguments.build(), result.substitute(nBinding));
		}

		@Override
		boolean equivalent(AbstractType other, java.util.Map<Variable, Variable> renaming) {
			if (other instanceof Map) {
				Map m = (Map) other;
				if (m.parameters.size() != parameters.size() || m.arguments.size() != arguments.size()) {
					return false;
				}
				HashMap<Variable, Variable> nRenaming = new HashMap<>(renaming);
				for (int i = 0; i != parameters.size(); ++i) {
					nRenaming.put(parameters.get(i), m.parameters.get(i));
				}
				return Type.equivalentAll(arguments, m.arguments, nRenaming)
						&& ((AbstractType) result).equivalent((AbstractType) m.result, nRenaming);
			}
			return false;
		}

		@Override
		int hash(java.util.Map<Variable, Integer> bound) {
			HashMap<Variable, Integer> nBound = new HashMap<>(bound);
			for (int i = 0; i != parameters.size(); ++i) {
				nBound.put(parameters.get(i), bound.size() + i);
			}
			return (parameters.size() * 961) + (Type.hashAll(arguments, nBound) * 31)
					+ ((AbstractType) result).hash(nBound);
		}

		@Override
		void collectFreeVariables(Set<Variable> bound, Set<Variable> result) {
			HashSet<Variable> nBound = new HashSet<>(bound);
			nBound.addAll(parameters);
			for (Type t : arguments) {
				((AbstractType) t).collectFreeVariables(nBound, result);
			}
			((AbstractType) this.result).collectFreeVariables(nBound, result);
		}
	}

	// =========================================================================
	// Helpers
	// =========================================================================

	private static boolean equivalentAll(List<Type> lhs, List<Type> rhs, java.util.Map<Variable, Variable> renaming) {
		if (lhs.size() != rhs.size()) {
			return false;
		}
		for (int i = 0; i != lhs.size(); ++i) {
			if (!((AbstractType) lhs.get(i)).equivalent((AbstractType) rhs.get(i), renaming)) {
				return false;
			}
		}
		return true;
	}

	private static int hashAll(List<Type> types, java.util.Map<Variable, Integer> bound) {
		int h = 0;
		for (Type t : types) {
			h = (h * 31) + ((AbstractType) t).hash(bound);
		}
		return h;
	}
}
