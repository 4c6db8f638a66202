package org.erl2ex.codegen.ir;

import org.erl2ex.codegen.ir.expr.Quoted;

import java.util.List;

/**
 * An import of selected functions from another module.
 *
 * @param module The source module expression.
 * @param functions The imported functions, as a keyword list of name to arity.
 * @param comments Comment lines rendered above the import.
 */
public record IrImport(Quoted module, Quoted functions, List<String> comments) implements IrForm {
	public IrImport {
		comments = List.copyOf(comments);
	}

	@Override
	public <A, R> R accept(IrFormVisitor<A, R> visitor, A arg) {
		return visitor.visitImport(this, arg);
	}
}
