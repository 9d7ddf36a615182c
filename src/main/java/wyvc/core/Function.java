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

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * The declaration of a (possibly polymorphic) function symbol. Function
 * declarations are compared by identity, so two declarations with the same
 * name denote different symbols.
 *
 * @author David J. Pearce
 *
 */
public class Function {
	private final String name;
	private final ImmutableList<Type.Variable> typeParameters;
	private final ImmutableList<Type> parameterTypes;
	private final Type returnType;
	private final ImmutableMap<String, String> attributes;

	public Function(String name, List<Type.Variable> typeParameters, List<? extends Type> parameterTypes,
			Type returnType, Map<String, String> attributes) {
		this.name = name;
		this.typeParameters = ImmutableList.copyOf(typeParameters);
		this.parameterTypes = ImmutableList.copyOf(parameterTypes);
		this.returnType = Preconditions.checkNotNull(returnType);
		this.attributes = ImmutableMap.copyOf(attributes);
	}

	public Function(String name, List<Type.Variable> typeParameters, List<? extends Type> parameterTypes,
			Type returnType) {
		this(name, typeParameters, parameterTypes, returnType, Collections.emptyMap());
	}

	/**
	 * Construct a monomorphic function with the given result and parameter types.
	 */
	public static Function create(String name, Type returnType, Type... parameterTypes) {
		return new Function(name, Collections.emptyList(), ImmutableList.copyOf(parameterTypes), returnType);
	}

	/**
	 * Construct a monomorphic function whose parameters all have the same type.
	 */
	public static Function uniform(String name, int arity, Type parameterType, Type returnType) {
		return new Function(name, Collections.emptyList(), Collections.nCopies(arity, parameterType), returnType);
	}

	public String getName() {
		return name;
	}

	public List<Type.Variable> getTypeParameters() {
		return typeParameters;
	}

	public List<Type> getParameterTypes() {
		return parameterTypes;
	}

	public Type getParameterType(int i) {
		return parameterTypes.get(i);
	}

	public int getArity() {
		return parameterTypes.size();
	}

	public Type getReturnType() {
		return returnType;
	}

	public Map<String, String> getAttributes() {
		return attributes;
	}

	public String getAttribute(String key) {
		return attributes.get(key);
	}

	/**
	 * Construct the binding of this function's type parameters to a given list
	 * of type arguments.
	 *
	 * @param typeArguments
	 * @return
	 */
	public Map<Type.Variable, Type> bind(List<Type> typeArguments) {
		Preconditions.checkArgument(typeArguments.size() == typeParameters.size(),
				"function " + name + " expects " + typeParameters.size() + " type arguments");
		HashMap<Type.Variable, Type> binding = new HashMap<>();
		for (int i = 0; i != typeParameters.size(); ++i) {
			binding.put(typeParameters.get(i), typeArguments.get(i));
		}
		return binding;
	}

	@Override
	public String toString() {
		return name;
	}
}
