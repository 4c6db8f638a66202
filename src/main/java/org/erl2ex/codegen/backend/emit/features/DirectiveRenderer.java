package org.erl2ex.codegen.backend.emit.features;

import org.erl2ex.codegen.backend.emit.IFormRenderer;
import org.erl2ex.codegen.backend.emit.features.preproc.FlagAttributes;
import org.erl2ex.codegen.backend.layout.CodeWriter;
import org.erl2ex.codegen.backend.layout.FormKind;
import org.erl2ex.codegen.backend.layout.RenderContext;
import org.erl2ex.codegen.ir.IrDirective;

/**
 * Writes a preprocessor control directive. Conditional bodies are not
 * indented; they stay at the level of the surrounding forms.
 */
public final class DirectiveRenderer implements IFormRenderer<IrDirective> {
    @Override
    public RenderContext render(RenderContext ctx, IrDirective directive, CodeWriter out) {
        String line = FlagAttributes.directiveLine(directive);
        ctx = out.writeLines(out.skipLines(ctx, FormKind.DIRECTIVE), directive.comments());
        return out.writeLine(ctx, line);
    }
}
