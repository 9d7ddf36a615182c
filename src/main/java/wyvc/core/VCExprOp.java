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

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.google.common.base.Preconditions;

/**
 * An operator which can be applied to a list of argument expressions (and,
 * possibly, a list of explicit type arguments). Every operator has a fixed
 * arity and a fixed number of type parameters, and the type of an application
 * is determined entirely by the types of its arguments and type arguments.
 *
 * @author David J. Pearce
 *
 */
public abstract class VCExprOp {

	/**
	 * The closed set of operator kinds. Consumers dispatch on this rather than
	 * on the concrete operator class.
	 */
	public enum Kind {
		NOT, EQ, NEQ, AND, OR, IMPLIES, DISTINCT, LABEL, IF_THEN_ELSE, CUSTOM, ADD, SUB, MUL, DIV, MOD, LT, LE, GT,
		GE, SUBTYPE, SUBTYPE3, BV, BV_EXTRACT, BV_CONCAT, SELECT, STORE, FUNCTION
	}

	public static final VCExprOp NOT = new Fixed(Kind.NOT, 1, "!");
	public static final VCExprOp EQ = new Fixed(Kind.EQ, 2, "==");
	public static final VCExprOp NEQ = new Fixed(Kind.NEQ, 2, "!=");
	public static final VCExprOp AND = new Fixed(Kind.AND, 2, "&&");
	public static final VCExprOp OR = new Fixed(Kind.OR, 2, "||");
	public static final VCExprOp IMPLIES = new Fixed(Kind.IMPLIES, 2, "==>");
	public static final VCExprOp IF_THEN_ELSE = new Fixed(Kind.IF_THEN_ELSE, 3, "if");
	public static final VCExprOp ADD = new Fixed(Kind.ADD, 2, "+");
	public static final VCExprOp SUB = new Fixed(Kind.SUB, 2, "-");
	public static final VCExprOp MUL = new Fixed(Kind.MUL, 2, "*");
	public static final VCExprOp DIV = new Fixed(Kind.DIV, 2, "div");
	public static final VCExprOp MOD = new Fixed(Kind.MOD, 2, "mod");
	public static final VCExprOp LT = new Fixed(Kind.LT, 2, "<");
	public static final VCExprOp LE = new Fixed(Kind.LE, 2, "<=");
	public static final VCExprOp GT = new Fixed(Kind.GT, 2, ">");
	public static final VCExprOp GE = new Fixed(Kind.GE, 2, ">=");
	public static final VCExprOp SUBTYPE = new Fixed(Kind.SUBTYPE, 2, "<:");
	public static final VCExprOp SUBTYPE3 = new Fixed(Kind.SUBTYPE3, 3, "<::");

	private final Kind kind;

	protected VCExprOp(Kind kind) {
		this.kind = kind;
	}

	public Kind getKind() {
		return kind;
	}

	public abstract int getArity();

	public int getTypeParamArity() {
		return 0;
	}

	/**
	 * Determine the type of an application of this operator. This also checks
	 * that the arguments are well-typed for this operator.
	 *
	 * @param arguments
	 * @param typeArguments
	 * @return
	 * @throws IllegalArgumentException if the arguments are ill-typed.
	 */
	public abstract Type inferType(List<VCExpr> arguments, List<Type> typeArguments);

	/**
	 * The operators of fixed arity which have no further parameters. Each has
	 * exactly one instance.
	 */
	public static final class Fixed extends VCExprOp {
		private final int arity;
		private final String symbol;

		private Fixed(Kind kind, int arity, String symbol) {
			super(kind);
			this.arity = arity;
			this.symbol = symbol;
		}

		@Override
		public int getArity() {
			return arity;
		}

		public String getSymbol() {
			return symbol;
		}

		@Override
		public Type inferType(List<VCExpr> arguments, List<Type> typeArguments) {
			switch (getKind()) {
			case NOT:
			case AND:
			case OR:
			case IMPLIES:
				for (VCExpr arg : arguments) {
					checkType(arg, Type.BOOL);
				}
				return Type.BOOL;
			case EQ:
			case NEQ:
			case SUBTYPE:
				checkSameType(arguments.get(0), arguments.get(1));
				return Type.BOOL;
			case SUBTYPE3:
				return Type.BOOL;
			case ADD:
			case SUB:
			case MUL:
			case DIV:
			case MOD:
				checkType(arguments.get(0), Type.INT);
				checkType(arguments.get(1), Type.INT);
				return Type.INT;
			case LT:
			case LE:
			case GT:
			case GE:
				checkType(arguments.get(0), Type.INT);
				checkType(arguments.get(1), Type.INT);
				return Type.BOOL;
			case IF_THEN_ELSE:
				checkType(arguments.get(0), Type.BOOL);
				checkSameType(arguments.get(1), arguments.get(2));
				return arguments.get(1).getType();
			default:
				throw new IllegalArgumentException("unknown operator encountered (" + getKind() + ")");
			}
		}

		@Override
		public String toString() {
			return symbol;
		}
	}

	public static final class Distinct extends VCExprOp {
		private final int arity;

		public Distinct(int arity) {
			super(Kind.DISTINCT);
			this.arity = arity;
		}

		@Override
		public int getArity() {
			return arity;
		}

		@Override
		public Type inferType(List<VCExpr> arguments, List<Type> typeArguments) {
			return Type.BOOL;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Distinct && ((Distinct) o).arity == arity;
		}

		@Override
		public int hashCode() {
			return arity * 917632481;
		}

		@Override
		public String toString() {
			return "distinct";
		}
	}

	/**
	 * A positive or negative label attached to a boolean expression.
	 */
	public static final class Label extends VCExprOp {
		private final boolean positive;
		private final String name;

		public Label(boolean positive, String name) {
			super(Kind.LABEL);
			this.positive = positive;
			this.name = name;
		}

		public boolean isPositive() {
			return positive;
		}

		public String getName() {
			return name;
		}

		@Override
		public int getArity() {
			return 1;
		}

		@Override
		public Type inferType(List<VCExpr> arguments, List<Type> typeArguments) {
			return arguments.get(0).getType();
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Label) {
				Label l = (Label) o;
				return l.positive == positive && l.name.equals(name);
			}
			return false;
		}

		@Override
		public int hashCode() {
			return (positive ? 1 : 2) + name.hashCode() * 7;
		}
	}

	/**
	 * An uninterpreted operator passed through to the prover as-is.
	 */
	public static final class Custom extends VCExprOp {
		private final String name;
		private final int arity;
		private final Type type;

		public Custom(String name, int arity, Type type) {
			super(Kind.CUSTOM);
			this.name = name;
			this.arity = arity;
			this.type = type;
		}

		public String getName() {
			return name;
		}

		@Override
		public int getArity() {
			return arity;
		}

		@Override
		public Type inferType(List<VCExpr> arguments, List<Type> typeArguments) {
			return type;
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Custom) {
				Custom c = (Custom) o;
				return c.name.equals(name) && c.arity == arity && c.type.equals(type);
			}
			return false;
		}

		@Override
		public int hashCode() {
			return Objects.hash(name, arity, type);
		}
	}

	// =========================================================================
	// Bitvectors
	// =========================================================================

	/**
	 * Constructs a bitvector literal of a given width from an integer literal.
	 */
	public static final class BitVector extends VCExprOp {
		private final int bits;

		public BitVector(int bits) {
			super(Kind.BV);
			this.bits = bits;
		}

		public int getBits() {
			return bits;
		}

		@Override
		public int getArity() {
			return 1;
		}

		@Override
		public Type inferType(List<VCExpr> arguments, List<Type> typeArguments) {
			Preconditions.checkArgument(arguments.get(0) instanceof VCExpr.Integer,
					"bitvector literal requires integer literal");
			return Type.BV(bits);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof BitVector && ((BitVector) o).bits == bits;
		}

		@Override
		public int hashCode() {
			return bits * 81748912;
		}
	}

	public static final class BvExtract extends VCExprOp {
		private final int start;
		private final int end;
		private final int total;

		public BvExtract(int start, int end, int total) {
			super(Kind.BV_EXTRACT);
			Preconditions.checkArgument(0 <= start && start <= end && end <= total, "invalid bitvector extract");
			this.start = start;
			this.end = end;
			this.total = total;
		}

		public int getStart() {
			return start;
		}

		public int getEnd() {
			return end;
		}

		@Override
		public int getArity() {
			return 1;
		}

		@Override
		public Type inferType(List<VCExpr> arguments, List<Type> typeArguments) {
			checkType(arguments.get(0), Type.BV(total));
			return Type.BV(end - start);
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof BvExtract) {
				BvExtract e = (BvExtract) o;
				return e.start == start && e.end == end && e.total == total;
			}
			return false;
		}

		@Override
		public int hashCode() {
			return start * 81912 + end * 978132 + total;
		}
	}

	public static final class BvConcat extends VCExprOp {
		private final int first;
		private final int second;

		public BvConcat(int first, int second) {
			super(Kind.BV_CONCAT);
			this.first = first;
			this.second = second;
		}

		public int getFirst() {
			return first;
		}

		public int getSecond() {
			return second;
		}

		@Override
		public int getArity() {
			return 2;
		}

		@Override
		public Type inferType(List<VCExpr> arguments, List<Type> typeArguments) {
			checkType(arguments.get(0), Type.BV(first));
			checkType(arguments.get(1), Type.BV(second));
			return Type.BV(first + second);
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof BvConcat) {
				BvConcat c = (BvConcat) o;
				return c.first == first && c.second == second;
			}
			return false;
		}

		@Override
		public int hashCode() {
			return first * 123 + second * 8231;
		}
	}

	// =========================================================================
	// Maps
	// =========================================================================

	/**
	 * Reads from a map <code>m[i1,...,in]</code>. The first argument is the map
	 * and the type arguments instantiate the map's own type parameters.
	 */
	public static final class Select extends VCExprOp {
		private final int arity;
		private final int typeParamArity;

		public Select(int arity, int typeParamArity) {
			super(Kind.SELECT);
			Preconditions.checkArgument(arity > 1, "select requires a map and at least one index");
			this.arity = arity;
			this.typeParamArity = typeParamArity;
		}

		@Override
		public int getArity() {
			return arity;
		}

		@Override
		public int getTypeParamArity() {
			return typeParamArity;
		}

		@Override
		public Type inferType(List<VCExpr> arguments, List<Type> typeArguments) {
			Type.Map type = checkMapType(arguments, 1);
			Map<Type.Variable, Type> binding = bind(type, typeArguments);
			for (int i = 1; i < arguments.size(); ++i) {
				checkType(arguments.get(i), type.getArgument(i - 1).substitute(binding));
			}
			return type.getResult().substitute(binding);
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Select) {
				Select s = (Select) o;
				return s.arity == arity && s.typeParamArity == typeParamArity;
			}
			return false;
		}

		@Override
		public int hashCode() {
			return arity * 1212481 + typeParamArity * 298734;
		}
	}

	/**
	 * Updates a map <code>m[i1,...,in := v]</code>.
	 */
	public static final class Store extends VCExprOp {
		private final int arity;

		public Store(int arity) {
			super(Kind.STORE);
			Preconditions.checkArgument(arity > 2, "store requires a map, at least one index and a value");
			this.arity = arity;
		}

		@Override
		public int getArity() {
			return arity;
		}

		@Override
		public Type inferType(List<VCExpr> arguments, List<Type> typeArguments) {
			Type.Map type = checkMapType(arguments, 2);
			if (type.getTypeParameters().isEmpty()) {
				int n = arguments.size() - 1;
				for (int i = 1; i < n; ++i) {
					checkType(arguments.get(i), type.getArgument(i - 1));
				}
				checkType(arguments.get(n), type.getResult());
			}
			return type;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Store && ((Store) o).arity == arity;
		}

		@Override
		public int hashCode() {
			return arity * 7127341;
		}
	}

	// =========================================================================
	// Functions
	// =========================================================================

	/**
	 * Applies a declared function symbol. Two such operators are equal when they
	 * apply the same declaration.
	 */
	public static final class FunctionApplication extends VCExprOp {
		private final Function function;

		public FunctionApplication(Function function) {
			super(Kind.FUNCTION);
			this.function = function;
		}

		public Function getFunction() {
			return function;
		}

		@Override
		public int getArity() {
			return function.getArity();
		}

		@Override
		public int getTypeParamArity() {
			return function.getTypeParameters().size();
		}

		@Override
		public Type inferType(List<VCExpr> arguments, List<Type> typeArguments) {
			Map<Type.Variable, Type> binding = function.bind(typeArguments);
			for (int i = 0; i != arguments.size(); ++i) {
				checkType(arguments.get(i), function.getParameterType(i).substitute(binding));
			}
			return function.getReturnType().substitute(binding);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof FunctionApplication && ((FunctionApplication) o).function == function;
		}

		@Override
		public int hashCode() {
			return System.identityHashCode(function);
		}

		@Override
		public String toString() {
			return function.getName();
		}
	}

	// =========================================================================
	// Helpers
	// =========================================================================

	private static void checkType(VCExpr arg, Type expected) {
		if (!arg.getType().equals(expected)) {
			throw new IllegalArgumentException(
					"expected argument of type " + expected + ", found " + arg.getType() + " (" + arg + ")");
		}
	}

	private static void checkSameType(VCExpr lhs, VCExpr rhs) {
		if (!lhs.getType().equals(rhs.getType())) {
			throw new IllegalArgumentException(
					"incompatible operand types " + lhs.getType() + " and " + rhs.getType());
		}
	}

	private static Type.Map checkMapType(List<VCExpr> arguments, int extra) {
		Type type = arguments.get(0).getType();
		if (!(type instanceof Type.Map)) {
			throw new IllegalArgumentException("expected map type, found " + type);
		}
		Type.Map map = (Type.Map) type;
		Preconditions.checkArgument(map.getArguments().size() + extra == arguments.size(),
				"incorrect number of map indices");
		return map;
	}

	private static Map<Type.Variable, Type> bind(Type.Map type, List<Type> typeArguments) {
		Preconditions.checkArgument(type.getTypeParameters().size() == typeArguments.size(),
				"incorrect number of map type arguments");
		HashMap<Type.Variable, Type> binding = new HashMap<>();
		for (int i = 0; i != typeArguments.size(); ++i) {
			binding.put(type.getTypeParameters().get(i), typeArguments.get(i));
		}
		return binding;
	}
}
