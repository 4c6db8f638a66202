package org.erl2ex.codegen.ir;

import java.util.List;

/**
 * A legacy preprocessor control directive.
 *
 * @param kind The directive kind.
 * @param flagAttribute The flag attribute the directive reads or writes. Required for
 *                      {@link Kind#UNDEF}, {@link Kind#IFDEF} and {@link Kind#IFNDEF}, {@code null} otherwise.
 * @param comments Comment lines rendered above the directive.
 */
public record IrDirective(Kind kind, String flagAttribute, List<String> comments) implements IrForm {

	public IrDirective {
		comments = List.copyOf(comments);
	}

	/**
	 * The supported directive kinds.
	 */
	public enum Kind {
		UNDEF,
		IFDEF,
		IFNDEF,
		ELSE,
		ENDIF;

		/**
		 * @return Whether this kind refers to a flag attribute.
		 */
		public boolean takesFlag() {
			return this == UNDEF || this == IFDEF || this == IFNDEF;
		}
	}

	@Override
	public <A, R> R accept(IrFormVisitor<A, R> visitor, A arg) {
		return visitor.visitDirective(this, arg);
	}
}
