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

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import wyvc.io.VCExprPrinter;

/**
 * Represents a verification-condition expression. Expressions are immutable
 * and may be shared freely. They are constructed through a
 * {@link VCExpressionGenerator}, which checks arities and types.
 *
 * @author David J. Pearce
 *
 */
public abstract class VCExpr {
	public static final Boolean TRUE = new Boolean(true);
	public static final Boolean FALSE = new Boolean(false);

	public abstract Type getType();

	@Override
	public String toString() {
		return VCExprPrinter.toString(this);
	}

	// =========================================================================
	// Literals
	// =========================================================================

	public static abstract class Literal extends VCExpr {
	}

	/**
	 * A boolean literal. There are exactly two instances, so these are compared
	 * by identity.
	 */
	public static final class Boolean extends Literal {
		private final boolean value;

		private Boolean(boolean value) {
			this.value = value;
		}

		public boolean getValue() {
			return value;
		}

		@Override
		public Type getType() {
			return Type.BOOL;
		}
	}

	public static final class Integer extends Literal {
		private final BigInteger value;

		Integer(BigInteger value) {
			this.value = value;
		}

		public BigInteger getValue() {
			return value;
		}

		@Override
		public Type getType() {
			return Type.INT;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Integer && ((Integer) o).value.equals(value);
		}

		@Override
		public int hashCode() {
			return value.hashCode() * 71321;
		}
	}

	// =========================================================================
	// Operator Applications
	// =========================================================================

	/**
	 * The application of an operator to zero or more arguments. The hash of an
	 * application is computed once, from the already known hashes of its
	 * children, and equality is checked without recursing through nested
	 * applications.
	 */
	public static final class NAry extends VCExpr {
		private final VCExprOp op;
		private final ImmutableList<VCExpr> arguments;
		private final ImmutableList<Type> typeArguments;
		private final Type type;
		private final int hash;

		NAry(VCExprOp op, ImmutableList<VCExpr> arguments, ImmutableList<Type> typeArguments) {
			this.op = op;
			this.arguments = arguments;
			this.typeArguments = typeArguments;
			this.type = op.inferType(arguments, typeArguments);
			int h = op.hashCode() * 31 + typeArguments.hashCode();
			for (VCExpr arg : arguments) {
				h = h * 31 + arg.hashCode();
			}
			this.hash = h;
		}

		public VCExprOp getOperator() {
			return op;
		}

		public int size() {
			return arguments.size();
		}

		public VCExpr get(int i) {
			return arguments.get(i);
		}

		public List<VCExpr> getArguments() {
			return arguments;
		}

		public List<Type> getTypeArguments() {
			return typeArguments;
		}

		@Override
		public Type getType() {
			return type;
		}

		@Override
		public int hashCode() {
			return hash;
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) {
				return true;
			} else if (!(o instanceof NAry) || ((NAry) o).hash != hash) {
				return false;
			}
			ArrayDeque<VCExpr> lhs = new ArrayDeque<>();
			ArrayDeque<VCExpr> rhs = new ArrayDeque<>();
			lhs.push(this);
			rhs.push((NAry) o);
			while (!lhs.isEmpty()) {
				VCExpr l = lhs.pop();
				VCExpr r = rhs.pop();
				if (l == r) {
					continue;
				} else if (l instanceof NAry && r instanceof NAry) {
					NAry ln = (NAry) l;
					NAry rn = (NAry) r;
					if (ln.hash != rn.hash || ln.arguments.size() != rn.arguments.size() || !ln.op.equals(rn.op)
							|| !ln.typeArguments.equals(rn.typeArguments)) {
						return false;
					}
					for (int i = 0; i != ln.arguments.size(); ++i) {
						lhs.push(ln.arguments.get(i));
						rhs.push(rn.arguments.get(i));
					}
				} else if (l instanceof NAry || r instanceof NAry || !l.equals(r)) {
					return false;
				}
			}
			return true;
		}
	}

	// =========================================================================
	// Variables
	// =========================================================================

	/**
	 * A term variable. Names need not be unique; variables are compared by
	 * identity.
	 */
	public static final class Variable extends VCExpr {
		private final String name;
		private final Type type;

		Variable(String name, Type type) {
			this.name = name;
			this.type = type;
		}

		public String getName() {
			return name;
		}

		@Override
		public Type getType() {
			return type;
		}
	}

	// =========================================================================
	// Binders
	// =========================================================================

	public static abstract class Binder extends VCExpr {
		private final ImmutableList<Variable> boundVariables;
		private final VCExpr body;

		Binder(ImmutableList<Variable> boundVariables, VCExpr body) {
			this.boundVariables = boundVariables;
			this.body = body;
		}

		public List<Variable> getBoundVariables() {
			return boundVariables;
		}

		public VCExpr getBody() {
			return body;
		}

		@Override
		public Type getType() {
			return body.getType();
		}
	}

	public static final class Quantifier extends Binder {
		public enum Kind {
			ALL, EX
		}

		private final Kind kind;
		private final ImmutableList<Type.Variable> typeParameters;
		private final ImmutableList<Trigger> triggers;
		private final Info info;
		private final int hash;

		Quantifier(Kind kind, ImmutableList<Type.Variable> typeParameters, ImmutableList<Variable> boundVariables,
				ImmutableList<Trigger> triggers, Info info, VCExpr body) {
			super(boundVariables, body);
			this.kind = kind;
			this.typeParameters = typeParameters;
			this.triggers = triggers;
			this.info = info;
			this.hash = ((kind.hashCode() * 31 + typeParameters.hashCode()) * 31 + boundVariables.hashCode()) * 31
					+ triggers.hashCode() * 7 + body.hashCode();
		}

		public Kind getKind() {
			return kind;
		}

		public List<Type.Variable> getTypeParameters() {
			return typeParameters;
		}

		public List<Trigger> getTriggers() {
			return triggers;
		}

		public Info getInfo() {
			return info;
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Quantifier) {
				Quantifier q = (Quantifier) o;
				return q.hash == hash && q.kind == kind && q.typeParameters.equals(typeParameters)
						&& q.getBoundVariables().equals(getBoundVariables()) && q.triggers.equals(triggers)
						&& q.getBody().equals(getBody());
			}
			return false;
		}

		@Override
		public int hashCode() {
			return hash;
		}

		/**
		 * Naming and attribute information attached to a quantifier. This is not
		 * considered when comparing quantifiers.
		 */
		public static final class Info {
			public static final Info EMPTY = new Info(null, -1, ImmutableMap.of());

			private final String qid;
			private final int uniqueId;
			private final ImmutableMap<String, Object> attributes;

			public Info(String qid, int uniqueId, Map<String, Object> attributes) {
				this.qid = qid;
				this.uniqueId = uniqueId;
				this.attributes = ImmutableMap.copyOf(attributes);
			}

			public Info(String qid) {
				this(qid, -1, ImmutableMap.of());
			}

			public String getQid() {
				return qid;
			}

			public int getUniqueId() {
				return uniqueId;
			}

			public Map<String, Object> getAttributes() {
				return attributes;
			}
		}
	}

	/**
	 * A pattern guiding instantiation of a quantifier. Negative triggers list
	 * terms which should not be used for instantiation.
	 */
	public static final class Trigger {
		private final boolean positive;
		private final ImmutableList<VCExpr> exprs;

		Trigger(boolean positive, ImmutableList<VCExpr> exprs) {
			this.positive = positive;
			this.exprs = exprs;
		}

		public boolean isPositive() {
			return positive;
		}

		public List<VCExpr> getExprs() {
			return exprs;
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Trigger) {
				Trigger t = (Trigger) o;
				return t.positive == positive && t.exprs.equals(exprs);
			}
			return false;
		}

		@Override
		public int hashCode() {
			return (positive ? 1 : 2) + exprs.hashCode() * 3;
		}
	}

	/**
	 * A let expression with simultaneous bindings. Every bound variable is in
	 * scope both in the body and in all right-hand sides.
	 */
	public static final class Let extends Binder {
		private final ImmutableList<LetBinding> bindings;
		private final int hash;

		Let(ImmutableList<LetBinding> bindings, VCExpr body) {
			super(toVariables(bindings), body);
			this.bindings = bindings;
			this.hash = bindings.hashCode() * 31 + body.hashCode();
		}

		public List<LetBinding> getBindings() {
			return bindings;
		}

		public int size() {
			return bindings.size();
		}

		public LetBinding get(int i) {
			return bindings.get(i);
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Let) {
				Let l = (Let) o;
				return l.hash == hash && l.bindings.equals(bindings) && l.getBody().equals(getBody());
			}
			return false;
		}

		@Override
		public int hashCode() {
			return hash;
		}

		private static ImmutableList<Variable> toVariables(List<LetBinding> bindings) {
			ImmutableList.Builder<Variable> vars = ImmutableList.builder();
			for (LetBinding b : bindings) {
				vars.add(b.getVariable());
			}
			return vars.build();
		}
	}

	public static final class LetBinding {
		private final Variable variable;
		private final VCExpr expr;

		LetBinding(Variable variable, VCExpr expr) {
			this.variable = variable;
			this.expr = expr;
		}

		public Variable getVariable() {
			return variable;
		}

		public VCExpr getExpr() {
			return expr;
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof LetBinding) {
				LetBinding b = (LetBinding) o;
				return b.variable == variable && b.expr.equals(expr);
			}
			return false;
		}

		@Override
		public int hashCode() {
			return variable.hashCode() * 31 + expr.hashCode();
		}
	}
}
