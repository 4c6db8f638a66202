package org.erl2ex.codegen.ir;

/**
 * A top-level unit of the converted module. The set of form kinds is closed;
 * every backend pass dispatches through {@link IrFormVisitor} so that a new
 * kind cannot be added without handling it everywhere.
 */
public sealed interface IrForm permits IrHeader, IrComment, IrFunction, IrAttribute, IrDirective, IrImport, IrRecord, IrTypeDecl, IrSpecDecl, IrMacro {

	/**
	 * Dispatches this form to the matching visitor method.
	 * @param visitor The visitor.
	 * @param arg An argument passed through to the visitor.
	 * @return The visitor's result.
	 */
	<A, R> R accept(IrFormVisitor<A, R> visitor, A arg);
}
