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
package wyvc.io;

import java.io.OutputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.io.Writer;
import java.util.List;

import wyvc.core.Type;
import wyvc.core.VCExpr;
import wyvc.core.VCExprOp;

/**
 * Writes expressions and types in a Boogie-like concrete syntax. This is
 * intended for diagnostics, not as input for any particular prover.
 *
 * @author David J. Pearce
 *
 */
public class VCExprPrinter {
	private final PrintWriter out;

	public VCExprPrinter(OutputStream output) {
		this.out = new PrintWriter(output);
	}

	public VCExprPrinter(Writer output) {
		this.out = new PrintWriter(output);
	}

	public void flush() {
		out.flush();
	}

	public void writeExpressionWithBraces(VCExpr e) {
		if (e instanceof VCExpr.NAry && isInfix(((VCExpr.NAry) e).getOperator())) {
			out.print("(");
			writeExpression(e);
			out.print(")");
		} else {
			writeExpression(e);
		}
	}

	public void writeExpression(VCExpr e) {
		if (e instanceof VCExpr.Boolean) {
			out.print(((VCExpr.Boolean) e).getValue() ? "true" : "false");
		} else if (e instanceof VCExpr.Integer) {
			out.print(((VCExpr.Integer) e).getValue());
		} else if (e instanceof VCExpr.Variable) {
			out.print(((VCExpr.Variable) e).getName());
		} else if (e instanceof VCExpr.NAry) {
			writeNAry((VCExpr.NAry) e);
		} else if (e instanceof VCExpr.Quantifier) {
			writeQuantifier((VCExpr.Quantifier) e);
		} else if (e instanceof VCExpr.Let) {
			writeLet((VCExpr.Let) e);
		} else {
			throw new IllegalArgumentException("unknown expression encountered (" + e.getClass().getName() + ")");
		}
	}

	private void writeNAry(VCExpr.NAry e) {
		VCExprOp op = e.getOperator();
		switch (op.getKind()) {
		case NOT:
			out.print("!");
			writeExpressionWithBraces(e.get(0));
			break;
		case EQ:
		case NEQ:
		case AND:
		case OR:
		case IMPLIES:
		case ADD:
		case SUB:
		case MUL:
		case DIV:
		case MOD:
		case LT:
		case LE:
		case GT:
		case GE:
		case SUBTYPE:
			writeExpressionWithBraces(e.get(0));
			out.print(" " + ((VCExprOp.Fixed) op).getSymbol() + " ");
			writeExpressionWithBraces(e.get(1));
			break;
		case IF_THEN_ELSE:
			out.print("(if ");
			writeExpression(e.get(0));
			out.print(" then ");
			writeExpression(e.get(1));
			out.print(" else ");
			writeExpression(e.get(2));
			out.print(")");
			break;
		case LABEL: {
			VCExprOp.Label l = (VCExprOp.Label) op;
			out.print("(" + (l.isPositive() ? "lblpos " : "lblneg ") + l.getName() + " ");
			writeExpression(e.get(0));
			out.print(")");
			break;
		}
		case BV:
			out.print(((VCExpr.Integer) e.get(0)).getValue() + "bv" + ((VCExprOp.BitVector) op).getBits());
			break;
		case BV_EXTRACT: {
			VCExprOp.BvExtract x = (VCExprOp.BvExtract) op;
			writeExpressionWithBraces(e.get(0));
			out.print("[" + x.getEnd() + ":" + x.getStart() + "]");
			break;
		}
		case BV_CONCAT:
			writeExpressionWithBraces(e.get(0));
			out.print(" ++ ");
			writeExpressionWithBraces(e.get(1));
			break;
		case SELECT:
			writeExpressionWithBraces(e.get(0));
			out.print("[");
			writeExpressions(e.getArguments().subList(1, e.size()));
			out.print("]");
			break;
		case STORE:
			writeExpressionWithBraces(e.get(0));
			out.print("[");
			writeExpressions(e.getArguments().subList(1, e.size() - 1));
			out.print(" := ");
			writeExpression(e.get(e.size() - 1));
			out.print("]");
			break;
		case DISTINCT:
			out.print("distinct(");
			writeExpressions(e.getArguments());
			out.print(")");
			break;
		case SUBTYPE3:
			out.print("subtype3(");
			writeExpressions(e.getArguments());
			out.print(")");
			break;
		case CUSTOM:
			out.print(((VCExprOp.Custom) op).getName() + "(");
			writeExpressions(e.getArguments());
			out.print(")");
			break;
		case FUNCTION:
			out.print(((VCExprOp.FunctionApplication) op).getFunction().getName());
			if (!e.getTypeArguments().isEmpty()) {
				out.print("<");
				writeTypes(e.getTypeArguments());
				out.print(">");
			}
			out.print("(");
			writeExpressions(e.getArguments());
			out.print(")");
			break;
		default:
			throw new IllegalArgumentException("unknown operator encountered (" + op.getKind() + ")");
		}
	}

	private void writeExpressions(List<VCExpr> exprs) {
		for (int i = 0; i != exprs.size(); ++i) {
			if (i != 0) {
				out.print(", ");
			}
			writeExpression(exprs.get(i));
		}
	}

	private void writeQuantifier(VCExpr.Quantifier e) {
		out.print(e.getKind() == VCExpr.Quantifier.Kind.ALL ? "(forall" : "(exists");
		if (!e.getTypeParameters().isEmpty()) {
			out.print("<");
			writeTypes(e.getTypeParameters());
			out.print(">");
		}
		List<VCExpr.Variable> vars = e.getBoundVariables();
		for (int i = 0; i != vars.size(); ++i) {
			out.print(i == 0 ? " " : ", ");
			out.print(vars.get(i).getName() + ":");
			writeType(vars.get(i).getType());
		}
		out.print(" ::");
		for (VCExpr.Trigger t : e.getTriggers()) {
			out.print(t.isPositive() ? " {" : " {:nopats ");
			writeExpressions(t.getExprs());
			out.print("}");
		}
		out.print(" ");
		writeExpression(e.getBody());
		out.print(")");
	}

	private void writeLet(VCExpr.Let e) {
		out.print("(let ");
		for (int i = 0; i != e.size(); ++i) {
			VCExpr.LetBinding b = e.get(i);
			if (i != 0) {
				out.print(", ");
			}
			out.print(b.getVariable().getName() + " := ");
			writeExpression(b.getExpr());
		}
		out.print("; ");
		writeExpression(e.getBody());
		out.print(")");
	}

	// =========================================================================
	// Types
	// =========================================================================

	public void writeType(Type t) {
		if (t == Type.BOOL) {
			out.print("bool");
		} else if (t == Type.INT) {
			out.print("int");
		} else if (t instanceof Type.BitVector) {
			out.print("bv" + ((Type.BitVector) t).getBits());
		} else if (t instanceof Type.Variable) {
			out.print(((Type.Variable) t).getName());
		} else if (t instanceof Type.Constructor) {
			Type.Constructor c = (Type.Constructor) t;
			out.print(c.getDecl().getName());
			for (Type arg : c.getArguments()) {
				out.print(" ");
				writeTypeWithBraces(arg);
			}
		} else if (t instanceof Type.Map) {
			Type.Map m = (Type.Map) t;
			if (!m.getTypeParameters().isEmpty()) {
				out.print("<");
				writeTypes(m.getTypeParameters());
				out.print(">");
			}
			out.print("[");
			writeTypes(m.getArguments());
			out.print("]");
			writeType(m.getResult());
		} else {
			throw new IllegalArgumentException("unknown type encountered (" + t.getClass().getName() + ")");
		}
	}

	private void writeTypeWithBraces(Type t) {
		if (t instanceof Type.Constructor && !((Type.Constructor) t).getArguments().isEmpty()
				|| t instanceof Type.Map) {
			out.print("(");
			writeType(t);
			out.print(")");
		} else {
			writeType(t);
		}
	}

	private void writeTypes(List<? extends Type> types) {
		for (int i = 0; i != types.size(); ++i) {
			if (i != 0) {
				out.print(",");
			}
			writeType(types.get(i));
		}
	}

	private static boolean isInfix(VCExprOp op) {
		switch (op.getKind()) {
		case EQ:
		case NEQ:
		case AND:
		case OR:
		case IMPLIES:
		case ADD:
		case SUB:
		case MUL:
		case DIV:
		case MOD:
		case LT:
		case LE:
		case GT:
		case GE:
		case SUBTYPE:
		case BV_CONCAT:
			return true;
		default:
			return false;
		}
	}

	public static String toString(VCExpr expr) {
		StringWriter buf = new StringWriter();
		VCExprPrinter p = new VCExprPrinter(buf);
		p.writeExpression(expr);
		p.flush();
		return buf.toString();
	}

	public static String toString(Type type) {
		StringWriter buf = new StringWriter();
		VCExprPrinter p = new VCExprPrinter(buf);
		p.writeType(type);
		p.flush();
		return buf.toString();
	}
}
