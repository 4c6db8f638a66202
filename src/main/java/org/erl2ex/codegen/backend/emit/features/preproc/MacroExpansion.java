package org.erl2ex.codegen.backend.emit.features.preproc;

import org.erl2ex.codegen.backend.layout.CodeWriter;
import org.erl2ex.codegen.backend.layout.RenderContext;
import org.erl2ex.codegen.backend.unparse.ExprUnparser;
import org.erl2ex.codegen.ir.IrMacro;
import org.erl2ex.codegen.ir.expr.Quoted;

/**
 * Writes the body of a translated macro: argument stringification, then the
 * quoted expansion, selected by guard context when a guard-safe variant exists.
 */
public final class MacroExpansion {

    private final ExprUnparser unparser;

    public MacroExpansion(ExprUnparser unparser) {
        this.unparser = unparser;
    }

    /**
     * Writes the macro body at the current indent.
     *
     * @param ctx The context inside the macro definition.
     * @param macro The macro.
     * @param out The output writer.
     * @return The context after the body, at the same indent.
     */
    public RenderContext writeBody(RenderContext ctx, IrMacro macro, CodeWriter out) {
        for (IrMacro.Stringification s : macro.stringifications()) {
            ctx = out.writeLine(ctx, s.textVariable() + " = Macro.to_string(quote do: unquote("
                    + s.argument() + ")) |> String.to_charlist");
        }
        if (macro.guardExpr() == null) {
            return writeQuote(ctx, macro.expr(), out);
        }
        ctx = out.writeLine(ctx, "if Macro.Env.in_guard?(__CALLER__) do");
        ctx = writeQuote(ctx.incrementIndent(), macro.guardExpr(), out).decrementIndent();
        ctx = out.writeLine(ctx, "else");
        ctx = writeQuote(ctx.incrementIndent(), macro.expr(), out).decrementIndent();
        return out.writeLine(ctx, "end");
    }

    private RenderContext writeQuote(RenderContext ctx, Quoted expr, CodeWriter out) {
        ctx = out.writeLine(ctx, "quote do");
        ctx = out.writeLine(ctx.incrementIndent(), unparser.unparse(expr)).decrementIndent();
        return out.writeLine(ctx, "end");
    }
}
