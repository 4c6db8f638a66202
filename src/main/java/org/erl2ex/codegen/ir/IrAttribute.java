package org.erl2ex.codegen.ir;

import org.erl2ex.codegen.ir.expr.Quoted;

import java.util.List;

/**
 * A module attribute assignment.
 *
 * @param name The attribute name.
 * @param value The attribute value.
 * @param register Whether the attribute must first be registered as persistent and accumulating.
 * @param comments Comment lines rendered above the attribute.
 */
public record IrAttribute(String name, Quoted value, boolean register, List<String> comments) implements IrForm {
	public IrAttribute {
		comments = List.copyOf(comments);
	}

	@Override
	public <A, R> R accept(IrFormVisitor<A, R> visitor, A arg) {
		return visitor.visitAttribute(this, arg);
	}
}
