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
import wyvc.core.VCExpr;
import wyvc.core.VCExpressionGenerator;

/**
 * Extends the type axiom builder with the sorts left over after erasure.
 * These are <code>U</code> (all values whose type is erased),
 * <code>T</code> (types), and the types the prover supports natively:
 * <code>int</code>, <code>bool</code>, bitvectors and (optionally) maps. Values
 * of a native type are moved in and out of <code>U</code> with a pair of cast
 * functions.
 *
 * @author David J. Pearce
 *
 */
public abstract class TypeAxiomBuilderIntBoolU extends TypeAxiomBuilder {
	private static final Logger LOGGER = Logger.getLogger(TypeAxiomBuilderIntBoolU.class);

	private final HashMap<Type, TypeCastSet> typeCasts;

	public TypeAxiomBuilderIntBoolU(VCExpressionGenerator gen, ErasureOptions options) {
		super(gen, options);
		this.typeCasts = new HashMap<>();
	}

	protected TypeAxiomBuilderIntBoolU(TypeAxiomBuilderIntBoolU builder) {
		super(builder);
		this.typeCasts = new HashMap<>(builder.typeCasts);
	}

	@Override
	public void setup() {
		super.setup();
		getTypeCasts(Type.INT);
		getTypeCasts(Type.BOOL);
	}

	/**
	 * Generate the axiom stating that casting from <code>U</code> and back
	 * again is the identity, under appropriate premises.
	 */
	protected abstract VCExpr genReverseCastAxiom(Function castToU, Function castFromU);

	/**
	 * Generate the equation <code>toU(fromU(x)) == x</code> for a fresh
	 * variable <code>x</code> of sort <code>U</code>, along with the trigger
	 * <code>fromU(x)</code>.
	 *
	 * @param castToU
	 * @param castFromU
	 * @param var receives the variable
	 * @param triggers receives the trigger
	 * @return
	 */
	protected VCExpr genReverseCastEq(Function castToU, Function castFromU, List<VCExpr.Variable> var,
			List<VCExpr.Trigger> triggers) {
		VCExpr.Variable x = gen.variable("x", getU());
		VCExpr inner = gen.function(castFromU, x);
		VCExpr lhs = gen.function(castToU, inner);
		var.add(x);
		triggers.add(gen.trigger(true, inner));
		return gen.eq(lhs, x);
	}

	protected abstract VCExpr genCastTypeAxioms(Function castToU, Function castFromU);

	// =========================================================================
	// Casts
	// =========================================================================

	private TypeCastSet getTypeCasts(Type type) {
		TypeCastSet result = typeCasts.get(type);
		if (result == null) {
			Function castToU = Function.create(type + "_2_U", getU(), type);
			Function castFromU = Function.create("U_2_" + type, type, getU());
			addTypeAxiom(genLeftInverseAxiom(castToU, castFromU, 0));
			addTypeAxiom(genReverseCastAxiom(castToU, castFromU));
			addTypeAxiom(genCastTypeAxioms(castToU, castFromU));
			result = new TypeCastSet(castToU, castFromU);
			typeCasts.put(type, result);
			if (LOGGER.isDebugEnabled()) {
				LOGGER.debug("registered casts " + castToU + " and " + castFromU);
			}
		}
		return result;
	}

	/**
	 * Get the function casting from <code>U</code> to a given native type.
	 */
	public Function castTo(Type type) {
		checkUnchanged(type);
		return getTypeCasts(type).castFromU;
	}

	/**
	 * Get the function casting from a given native type to <code>U</code>.
	 */
	public Function castFrom(Type type) {
		checkUnchanged(type);
		return getTypeCasts(type).castToU;
	}

	public boolean isCast(Function fun) {
		if (fun.getArity() != 1) {
			return false;
		}
		Type inType = fun.getParameterType(0);
		Type outType = fun.getReturnType();
		if (inType.equals(getU())) {
			TypeCastSet casts = typeCasts.get(outType);
			return casts != null && casts.castFromU == fun;
		} else {
			TypeCastSet casts = typeCasts.get(inType);
			return casts != null && outType.equals(getU()) && casts.castToU == fun;
		}
	}

	// =========================================================================
	// Erasure
	// =========================================================================

	@Override
	public Type typeAfterErasure(Type type) {
		if (unchangedType(type)) {
			// these types are kept
			return type;
		} else {
			return getU();
		}
	}

	@Override
	public boolean unchangedType(Type type) {
		return type.isBasic() || type.isBitVector() || (type.isMap() && options.getUseArrayTheory());
	}

	/**
	 * Cast an expression of sort <code>U</code> or of a native type to another
	 * such type.
	 *
	 * @param expr
	 * @param toType
	 * @return
	 * @throws IllegalArgumentException if either type is neither <code>U</code>
	 *                                  nor a native type.
	 */
	public VCExpr cast(VCExpr expr, Type toType) {
		Type fromType = expr.getType();
		if (!fromType.equals(getU()) && !unchangedType(fromType)) {
			throw new IllegalArgumentException("cannot cast from type " + fromType);
		} else if (!toType.equals(getU()) && !unchangedType(toType)) {
			throw new IllegalArgumentException("cannot cast to type " + toType);
		} else if (fromType.equals(toType)) {
			return expr;
		} else if (toType.equals(getU())) {
			return gen.function(castFrom(fromType), expr);
		} else if (fromType.equals(getU())) {
			return gen.function(castTo(toType), expr);
		} else {
			throw new IllegalArgumentException("cannot cast from " + fromType + " to " + toType);
		}
	}

	public List<VCExpr> castSeq(List<VCExpr> exprs, Type toType) {
		ArrayList<VCExpr> result = new ArrayList<>();
		for (VCExpr e : exprs) {
			result.add(cast(e, toType));
		}
		return result;
	}

	private void checkUnchanged(Type type) {
		if (!unchangedType(type)) {
			throw new IllegalArgumentException("no casts for erased type " + type);
		}
	}

	private static final class TypeCastSet {
		private final Function castToU;
		private final Function castFromU;

		private TypeCastSet(Function castToU, Function castFromU) {
			this.castToU = castToU;
			this.castFromU = castFromU;
		}
	}
}
