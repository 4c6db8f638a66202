package org.erl2ex.codegen.backend.emit.features;

import org.erl2ex.codegen.backend.emit.IFormRenderer;
import org.erl2ex.codegen.backend.layout.CodeWriter;
import org.erl2ex.codegen.backend.layout.FormKind;
import org.erl2ex.codegen.backend.layout.RenderContext;
import org.erl2ex.codegen.backend.unparse.ExprUnparser;
import org.erl2ex.codegen.ir.IrImport;

/**
 * Writes an import restricted to the listed functions.
 */
public final class ImportRenderer implements IFormRenderer<IrImport> {

    private final ExprUnparser unparser;

    public ImportRenderer(ExprUnparser unparser) {
        this.unparser = unparser;
    }

    @Override
    public RenderContext render(RenderContext ctx, IrImport form, CodeWriter out) {
        ctx = out.writeLines(out.skipLines(ctx, FormKind.ATTR), form.comments());
        return out.writeLine(ctx, "import " + unparser.unparse(form.module())
                + ", only: " + unparser.unparse(form.functions()));
    }
}
