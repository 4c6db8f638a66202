package org.erl2ex.codegen.backend.emit.features;

import org.erl2ex.codegen.backend.emit.IFormRenderer;
import org.erl2ex.codegen.backend.layout.CodeWriter;
import org.erl2ex.codegen.backend.layout.FormKind;
import org.erl2ex.codegen.backend.layout.RenderContext;
import org.erl2ex.codegen.backend.unparse.ExprUnparser;
import org.erl2ex.codegen.ir.IrTypeDecl;

/**
 * Writes a type, private type or opaque type declaration as one attribute line.
 */
public final class TypeRenderer implements IFormRenderer<IrTypeDecl> {

    private final ExprUnparser unparser;

    public TypeRenderer(ExprUnparser unparser) {
        this.unparser = unparser;
    }

    @Override
    public RenderContext render(RenderContext ctx, IrTypeDecl type, CodeWriter out) {
        ctx = out.writeLines(out.skipLines(ctx, FormKind.ATTR), type.comments());
        return out.writeLine(ctx, "@" + type.kind().attribute() + " " + unparser.unparse(type.signature())
                + " :: " + unparser.unparse(type.definition()));
    }
}
