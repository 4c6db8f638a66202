package org.erl2ex.codegen.ir;

import org.erl2ex.codegen.ir.expr.Quoted;

import java.util.List;

/**
 * A record definition.
 *
 * @param tag The record tag, usually an atom.
 * @param macro The name of the generated record macro.
 * @param dataAttribute The attribute storing the ordered field names.
 * @param fields The fields with their defaults, in declaration order.
 * @param comments Comment lines rendered above the record.
 */
public record IrRecord(Quoted tag, String macro, String dataAttribute, List<Field> fields, List<String> comments) implements IrForm {

	public IrRecord {
		fields = List.copyOf(fields);
		comments = List.copyOf(comments);
	}

	/**
	 * A record field.
	 * @param name The field name.
	 * @param defaultValue The default value, {@code nil} when the source declares none.
	 */
	public record Field(String name, Quoted defaultValue) {}

	@Override
	public <A, R> R accept(IrFormVisitor<A, R> visitor, A arg) {
		return visitor.visitRecord(this, arg);
	}
}
