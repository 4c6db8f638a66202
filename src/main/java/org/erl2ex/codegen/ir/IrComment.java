package org.erl2ex.codegen.ir;

import java.util.List;

/**
 * A standalone block of full-line comments.
 */
public record IrComment(List<String> comments) implements IrForm {
	public IrComment {
		comments = List.copyOf(comments);
	}

	@Override
	public <A, R> R accept(IrFormVisitor<A, R> visitor, A arg) {
		return visitor.visitComment(this, arg);
	}
}
