package org.erl2ex.codegen.backend.emit.features.preproc;

import org.erl2ex.codegen.backend.layout.CodeWriter;
import org.erl2ex.codegen.backend.layout.RenderContext;

/**
 * Fallback for macro invocations whose target is only known at expansion
 * time. A plain name resolves through the module attribute of the same name
 * (the dispatch table entry written after each macro); anything else is
 * expanded as a macro first.
 */
public final class MacroDispatcher {

    private MacroDispatcher() {}

    public static RenderContext write(RenderContext ctx, String name, CodeWriter out) {
        ctx = out.writeLine(ctx, "defmacrop " + name + "(name, args) when is_atom(name), do:");
        ctx = out.writeLine(ctx.incrementIndent(), "{Module.get_attribute(__MODULE__, name), [], args}").decrementIndent();
        ctx = out.writeLine(ctx, "defmacrop " + name + "(macro, args), do:");
        return out.writeLine(ctx.incrementIndent(), "{Macro.expand(macro, __CALLER__), [], args}").decrementIndent();
    }
}
