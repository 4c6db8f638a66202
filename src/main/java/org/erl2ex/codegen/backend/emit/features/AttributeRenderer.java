package org.erl2ex.codegen.backend.emit.features;

import org.erl2ex.codegen.backend.emit.IFormRenderer;
import org.erl2ex.codegen.backend.layout.CodeWriter;
import org.erl2ex.codegen.backend.layout.FormKind;
import org.erl2ex.codegen.backend.layout.RenderContext;
import org.erl2ex.codegen.backend.unparse.ExprUnparser;
import org.erl2ex.codegen.backend.unparse.QuotedPrinter;
import org.erl2ex.codegen.ir.IrAttribute;

/**
 * Writes a module attribute, registering it first when it must persist and accumulate.
 */
public final class AttributeRenderer implements IFormRenderer<IrAttribute> {

    private final ExprUnparser unparser;

    public AttributeRenderer(ExprUnparser unparser) {
        this.unparser = unparser;
    }

    @Override
    public RenderContext render(RenderContext ctx, IrAttribute attr, CodeWriter out) {
        ctx = out.writeLines(out.skipLines(ctx, FormKind.ATTR), attr.comments());
        if (attr.register()) {
            ctx = out.writeLine(ctx, "Module.register_attribute(__MODULE__, "
                    + QuotedPrinter.atomToString(attr.name()) + ", persist: true, accumulate: true)");
        }
        return out.writeLine(ctx, "@" + attr.name() + " " + unparser.unparse(attr.value()));
    }
}
