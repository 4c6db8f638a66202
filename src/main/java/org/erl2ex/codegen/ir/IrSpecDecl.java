package org.erl2ex.codegen.ir;

import org.erl2ex.codegen.ir.expr.Quoted;

import java.util.List;

/**
 * A standalone spec or callback declaration.
 *
 * @param kind The declaration kind.
 * @param specs The spec expressions, one line each.
 * @param comments Comment lines rendered above the declaration.
 */
public record IrSpecDecl(Kind kind, List<Quoted> specs, List<String> comments) implements IrForm {

	public IrSpecDecl {
		specs = List.copyOf(specs);
		comments = List.copyOf(comments);
	}

	public enum Kind {
		SPEC("spec"),
		CALLBACK("callback");

		private final String attribute;

		Kind(String attribute) {
			this.attribute = attribute;
		}

		public String attribute() {
			return attribute;
		}
	}

	@Override
	public <A, R> R accept(IrFormVisitor<A, R> visitor, A arg) {
		return visitor.visitSpecDecl(this, arg);
	}
}
