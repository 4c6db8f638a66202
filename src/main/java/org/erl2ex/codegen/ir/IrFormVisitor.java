package org.erl2ex.codegen.ir;

/**
 * Exhaustive visitor over {@link IrForm} kinds.
 *
 * @param <A> The type of the pass-through argument.
 * @param <R> The result type.
 */
public interface IrFormVisitor<A, R> {
	R visitHeader(IrHeader header, A arg);
	R visitComment(IrComment comment, A arg);
	R visitFunction(IrFunction function, A arg);
	R visitAttribute(IrAttribute attribute, A arg);
	R visitDirective(IrDirective directive, A arg);
	R visitImport(IrImport importForm, A arg);
	R visitRecord(IrRecord record, A arg);
	R visitTypeDecl(IrTypeDecl typeDecl, A arg);
	R visitSpecDecl(IrSpecDecl specDecl, A arg);
	R visitMacro(IrMacro macro, A arg);
}
