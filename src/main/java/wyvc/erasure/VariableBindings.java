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

import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import wyvc.core.Type;
import wyvc.core.VCExpr;

/**
 * The bindings in scope at some point during erasure: typed term variables
 * bound to their untyped counterparts, and type variables bound to the terms
 * representing them. Bindings are immutable, and extending them produces a new
 * object, so bindings made inside one scope never leak into another.
 *
 * @author David J. Pearce
 *
 */
public final class VariableBindings {
	public static final VariableBindings EMPTY = new VariableBindings(ImmutableMap.of(), ImmutableMap.of());

	private final ImmutableMap<VCExpr.Variable, VCExpr.Variable> variableBindings;
	private final ImmutableMap<Type.Variable, VCExpr> typeVariableBindings;

	private VariableBindings(ImmutableMap<VCExpr.Variable, VCExpr.Variable> variableBindings,
			ImmutableMap<Type.Variable, VCExpr> typeVariableBindings) {
		this.variableBindings = variableBindings;
		this.typeVariableBindings = typeVariableBindings;
	}

	public VCExpr.Variable getVariable(VCExpr.Variable var) {
		return variableBindings.get(var);
	}

	public VCExpr getTypeVariable(Type.Variable var) {
		return typeVariableBindings.get(var);
	}

	public Map<VCExpr.Variable, VCExpr.Variable> getVariableBindings() {
		return variableBindings;
	}

	public Map<Type.Variable, VCExpr> getTypeVariableBindings() {
		return typeVariableBindings;
	}

	/**
	 * Extend these bindings by binding each old variable to the new variable at
	 * the same position. Existing bindings of the old variables are shadowed.
	 *
	 * @param oldVars
	 * @param newVars
	 * @return
	 */
	public VariableBindings bindVariables(List<VCExpr.Variable> oldVars, List<VCExpr.Variable> newVars) {
		Preconditions.checkArgument(oldVars.size() == newVars.size(), "mismatched variable bindings");
		if (oldVars.isEmpty()) {
			return this;
		}
		ImmutableMap.Builder<VCExpr.Variable, VCExpr.Variable> builder = ImmutableMap.builder();
		builder.putAll(variableBindings);
		for (int i = 0; i != oldVars.size(); ++i) {
			builder.put(oldVars.get(i), newVars.get(i));
		}
		return new VariableBindings(builder.buildKeepingLast(), typeVariableBindings);
	}

	public VariableBindings bindVariable(VCExpr.Variable oldVar, VCExpr.Variable newVar) {
		return bindVariables(ImmutableList.of(oldVar), ImmutableList.of(newVar));
	}

	/**
	 * Extend these bindings with the given type variable bindings. Existing
	 * bindings of the same type variables are shadowed.
	 *
	 * @param bindings
	 * @return
	 */
	public VariableBindings bindTypeVariables(Map<Type.Variable, ? extends VCExpr> bindings) {
		if (bindings.isEmpty()) {
			return this;
		}
		ImmutableMap.Builder<Type.Variable, VCExpr> builder = ImmutableMap.builder();
		builder.putAll(typeVariableBindings);
		builder.putAll(bindings);
		return new VariableBindings(variableBindings, builder.buildKeepingLast());
	}
}
