package org.erl2ex.codegen.ir;

import org.erl2ex.codegen.ir.expr.Quoted;

import java.util.List;

/**
 * A function definition made of one or more clauses.
 *
 * @param isPublic Whether the function is exported.
 * @param clauses The clauses in source order. Must not be empty.
 * @param specs Spec expressions rendered above the first clause.
 * @param comments Comment lines rendered above the function.
 */
public record IrFunction(boolean isPublic, List<Clause> clauses, List<Quoted> specs, List<String> comments) implements IrForm {

	public IrFunction {
		clauses = List.copyOf(clauses);
		specs = List.copyOf(specs);
		comments = List.copyOf(comments);
	}

	/**
	 * A single function clause.
	 * @param signature The call signature, optionally wrapped in a {@code when} guard.
	 * @param body The body expressions, one per line.
	 * @param comments Comment lines rendered above the clause.
	 */
	public record Clause(Quoted signature, List<Quoted> body, List<String> comments) {
		public Clause {
			body = List.copyOf(body);
			comments = List.copyOf(comments);
		}
	}

	@Override
	public <A, R> R accept(IrFormVisitor<A, R> visitor, A arg) {
		return visitor.visitFunction(this, arg);
	}
}
