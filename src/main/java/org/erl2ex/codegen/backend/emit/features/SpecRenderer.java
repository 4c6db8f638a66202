package org.erl2ex.codegen.backend.emit.features;

import org.erl2ex.codegen.backend.emit.IFormRenderer;
import org.erl2ex.codegen.backend.layout.CodeWriter;
import org.erl2ex.codegen.backend.layout.FormKind;
import org.erl2ex.codegen.backend.layout.RenderContext;
import org.erl2ex.codegen.backend.unparse.ExprUnparser;
import org.erl2ex.codegen.ir.IrSpecDecl;
import org.erl2ex.codegen.ir.expr.Quoted;

/**
 * Writes a standalone spec or callback declaration, one attribute line per spec.
 */
public final class SpecRenderer implements IFormRenderer<IrSpecDecl> {

    private final ExprUnparser unparser;

    public SpecRenderer(ExprUnparser unparser) {
        this.unparser = unparser;
    }

    @Override
    public RenderContext render(RenderContext ctx, IrSpecDecl decl, CodeWriter out) {
        ctx = out.writeLines(out.skipLines(ctx, FormKind.ATTR), decl.comments());
        for (Quoted spec : decl.specs()) {
            ctx = out.writeLine(ctx, "@" + decl.kind().attribute() + " " + unparser.unparse(spec));
        }
        return ctx;
    }
}
