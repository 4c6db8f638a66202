package org.erl2ex.codegen.backend.emit.features;

import org.erl2ex.codegen.backend.emit.IFormRenderer;
import org.erl2ex.codegen.backend.emit.features.preproc.MacroExpansion;
import org.erl2ex.codegen.backend.layout.CodeWriter;
import org.erl2ex.codegen.backend.layout.FormKind;
import org.erl2ex.codegen.backend.layout.RenderContext;
import org.erl2ex.codegen.backend.unparse.ExprUnparser;
import org.erl2ex.codegen.backend.unparse.QuotedPrinter;
import org.erl2ex.codegen.ir.IrMacro;

/**
 * Writes a legacy macro as a private {@code defmacrop}, followed by the
 * attributes that mark it as defined and register it for dispatch.
 */
public final class MacroRenderer implements IFormRenderer<IrMacro> {

    private final ExprUnparser unparser;
    private final MacroExpansion expansion;

    public MacroRenderer(ExprUnparser unparser) {
        this.unparser = unparser;
        this.expansion = new MacroExpansion(unparser);
    }

    @Override
    public RenderContext render(RenderContext ctx, IrMacro macro, CodeWriter out) {
        ctx = out.writeCommentBlock(ctx, macro.comments(), FormKind.FUNC_HEADER);
        ctx = out.skipLines(ctx, FormKind.FUNC_CLAUSE_FIRST);
        ctx = out.writeLine(ctx, "defmacrop " + unparser.unparseSignature(macro.signature()) + " do");
        ctx = expansion.writeBody(ctx.incrementIndent(), macro, out).decrementIndent();
        ctx = out.writeLine(ctx, "end");
        if (macro.trackingAttribute() != null) {
            ctx = out.writeLine(ctx, "@" + macro.trackingAttribute() + " true");
        }
        if (macro.dispatchAttribute() != null) {
            ctx = out.writeLine(ctx, "@" + macro.dispatchAttribute() + " " + QuotedPrinter.atomToString(macro.macroName()));
        }
        return ctx;
    }
}
