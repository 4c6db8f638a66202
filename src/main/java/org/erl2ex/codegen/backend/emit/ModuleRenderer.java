package org.erl2ex.codegen.backend.emit;

import org.erl2ex.codegen.backend.layout.CodeWriter;
import org.erl2ex.codegen.backend.layout.FormKind;
import org.erl2ex.codegen.backend.layout.RenderContext;
import org.erl2ex.codegen.backend.unparse.QuotedPrinter;
import org.erl2ex.codegen.ir.IrForm;
import org.erl2ex.codegen.ir.IrModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes a whole module: file comments, module comments, and the forms,
 * wrapped in {@code defmodule} when the module has a name.
 */
public final class ModuleRenderer {

    private static final Logger LOG = LoggerFactory.getLogger(ModuleRenderer.class);

    private final FormRendererRegistry registry;

    public ModuleRenderer(FormRendererRegistry registry) {
        this.registry = registry;
    }

    /**
     * Renders the module.
     *
     * @param ctx The initial context.
     * @param module The module to render.
     * @param out The output writer.
     * @return The context after the module.
     */
    public RenderContext render(RenderContext ctx, IrModule module, CodeWriter out) {
        ctx = out.writeCommentBlock(ctx, module.fileComments(), FormKind.STRUCTURE_COMMENTS);
        if (module.name() == null) {
            if (!module.comments().isEmpty()) {
                LOG.warn("Dropping {} module comment line(s): module has no name to attach them to", module.comments().size());
            }
            return renderForms(ctx, module, out);
        }

        ctx = out.writeCommentBlock(ctx, module.comments(), FormKind.MODULE_COMMENTS);
        ctx = out.skipLines(ctx, FormKind.MODULE_BEGIN);
        ctx = out.writeLine(ctx, "defmodule " + QuotedPrinter.atomToString(module.name()) + " do");
        ctx = renderForms(ctx.incrementIndent(), module, out).decrementIndent();
        ctx = out.skipLines(ctx, FormKind.MODULE_END);
        return out.writeLine(ctx, "end");
    }

    private RenderContext renderForms(RenderContext ctx, IrModule module, CodeWriter out) {
        for (IrForm form : module.forms()) {
            ctx = registry.render(ctx, form, out);
        }
        return ctx;
    }
}
