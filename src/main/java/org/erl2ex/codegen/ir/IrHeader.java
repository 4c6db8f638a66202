package org.erl2ex.codegen.ir;

import java.util.List;

/**
 * Synthesized prelude supporting the translated preprocessor constructs.
 *
 * @param useBitwise Whether the bitwise operators must be imported.
 * @param initMacros Flags whose initial value is read from the build environment.
 * @param recordNames Names of the records defined in the module.
 * @param hasIsRecord Whether record-ness is tested anywhere in the module.
 * @param recordSizeMacro Name of the record size helper macro, or {@code null} if not needed.
 * @param recordIndexMacro Name of the record field index helper macro, or {@code null} if not needed.
 * @param macroDispatcher Name of the fallback macro dispatcher, or {@code null} if not needed.
 */
public record IrHeader(
		boolean useBitwise,
		List<InitMacro> initMacros,
		List<String> recordNames,
		boolean hasIsRecord,
		String recordSizeMacro,
		String recordIndexMacro,
		String macroDispatcher
) implements IrForm {

	public IrHeader {
		initMacros = List.copyOf(initMacros);
		recordNames = List.copyOf(recordNames);
	}

	/**
	 * A macro whose definedness is discovered at build time.
	 * @param macroName The legacy macro name, appended to the define prefix to form the lookup key.
	 * @param flagAttribute The module attribute holding the flag.
	 */
	public record InitMacro(String macroName, String flagAttribute) {}

	@Override
	public <A, R> R accept(IrFormVisitor<A, R> visitor, A arg) {
		return visitor.visitHeader(this, arg);
	}
}
