package org.erl2ex.codegen.ir;

import org.erl2ex.codegen.ir.expr.Quoted;

import java.util.List;

/**
 * A type declaration.
 *
 * @param kind The declaration kind.
 * @param signature The type name and parameters.
 * @param definition The type definition.
 * @param comments Comment lines rendered above the declaration.
 */
public record IrTypeDecl(Kind kind, Quoted signature, Quoted definition, List<String> comments) implements IrForm {

	public IrTypeDecl {
		comments = List.copyOf(comments);
	}

	/**
	 * Type declaration kinds, named after the attribute they render as.
	 */
	public enum Kind {
		TYPE("type"),
		TYPEP("typep"),
		OPAQUE("opaque");

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
		return visitor.visitTypeDecl(this, arg);
	}
}
