package org.erl2ex.codegen.backend.emit;

import org.erl2ex.codegen.backend.layout.CodeWriter;
import org.erl2ex.codegen.backend.layout.RenderContext;
import org.erl2ex.codegen.ir.IrForm;

/**
 * Renders one kind of form.
 *
 * @param <F> The form type handled by this renderer.
 */
public interface IFormRenderer<F extends IrForm> {

	/**
	 * Writes the given form and returns the context for whatever follows it.
	 *
	 * @param ctx  The context before the form.
	 * @param form The form to render.
	 * @param out  The output writer.
	 * @return The context after the form. Its indent equals the indent of {@code ctx}.
	 */
	RenderContext render(RenderContext ctx, F form, CodeWriter out);
}
