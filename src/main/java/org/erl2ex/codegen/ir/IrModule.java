package org.erl2ex.codegen.ir;

import java.util.List;

/**
 * A converted module ready for rendering. The order of forms is the output
 * order and is preserved by the backend.
 *
 * @param name The module name, or {@code null} to render the forms without a module envelope.
 * @param forms The forms in output order.
 * @param fileComments Comment lines placed at the top of the file.
 * @param comments Comment lines placed directly above the module envelope.
 */
public record IrModule(String name, List<IrForm> forms, List<String> fileComments, List<String> comments) {
	public IrModule {
		forms = List.copyOf(forms);
		fileComments = List.copyOf(fileComments);
		comments = List.copyOf(comments);
	}

	/**
	 * Creates a named module without comments.
	 */
	public static IrModule of(String name, List<IrForm> forms) {
		return new IrModule(name, forms, List.of(), List.of());
	}
}
