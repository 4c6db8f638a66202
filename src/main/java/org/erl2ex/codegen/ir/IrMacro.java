package org.erl2ex.codegen.ir;

import org.erl2ex.codegen.ir.expr.Quoted;

import java.util.List;

/**
 * A legacy macro definition, rendered as a private target-language macro.
 *
 * @param macroName The macro's name as registered in the dispatch table.
 * @param signature The macro call signature.
 * @param trackingAttribute Attribute set to {@code true} once the macro is defined, or {@code null}.
 * @param dispatchAttribute Attribute registering the macro for dispatch, or {@code null}.
 * @param stringifications Arguments that must also be captured as their literal source text.
 * @param expr The default expansion.
 * @param guardExpr The expansion used inside guards, or {@code null} if the default is guard-safe.
 * @param comments Comment lines rendered above the macro.
 */
public record IrMacro(
		String macroName,
		Quoted signature,
		String trackingAttribute,
		String dispatchAttribute,
		List<Stringification> stringifications,
		Quoted expr,
		Quoted guardExpr,
		List<String> comments
) implements IrForm {

	public IrMacro {
		stringifications = List.copyOf(stringifications);
		comments = List.copyOf(comments);
	}

	/**
	 * Binds the literal text of a macro argument to a variable.
	 * @param argument The macro argument variable.
	 * @param textVariable The variable receiving the argument's source text as a charlist.
	 */
	public record Stringification(String argument, String textVariable) {}

	@Override
	public <A, R> R accept(IrFormVisitor<A, R> visitor, A arg) {
		return visitor.visitMacro(this, arg);
	}
}
