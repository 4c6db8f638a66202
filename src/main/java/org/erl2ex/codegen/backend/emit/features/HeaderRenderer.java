package org.erl2ex.codegen.backend.emit.features;

import org.erl2ex.codegen.backend.emit.IFormRenderer;
import org.erl2ex.codegen.backend.emit.features.preproc.FlagAttributes;
import org.erl2ex.codegen.backend.emit.features.preproc.MacroDispatcher;
import org.erl2ex.codegen.backend.emit.features.preproc.RecordHelperMacros;
import org.erl2ex.codegen.backend.layout.CodeWriter;
import org.erl2ex.codegen.backend.layout.FormKind;
import org.erl2ex.codegen.backend.layout.RenderContext;
import org.erl2ex.codegen.ir.IrHeader;

/**
 * Writes the synthesized prelude. Each part is spaced like an attribute so
 * that the prelude stays one tight group.
 */
public final class HeaderRenderer implements IFormRenderer<IrHeader> {

    /**
     * {@inheritDoc}
     * <p>
     * Parts are written in a fixed order: bitwise operators, macro flag
     * initializers, record support, and finally the macro dispatcher.
     */
    @Override
    public RenderContext render(RenderContext ctx, IrHeader header, CodeWriter out) {
        if (header.useBitwise()) {
            ctx = out.writeLine(out.skipLines(ctx, FormKind.ATTR), "use Bitwise, only_operators: true");
        }
        for (IrHeader.InitMacro macro : header.initMacros()) {
            ctx = out.skipLines(ctx, FormKind.ATTR);
            ctx = out.writeLine(ctx, FlagAttributes.initializer(ctx, macro));
        }
        if (!header.recordNames().isEmpty() || header.hasIsRecord()) {
            ctx = out.writeLine(out.skipLines(ctx, FormKind.ATTR), "require Record");
            if (header.recordSizeMacro() != null) {
                ctx = RecordHelperMacros.writeSizeMacro(out.skipLines(ctx, FormKind.ATTR), header.recordSizeMacro(), out);
            }
            if (header.recordIndexMacro() != null) {
                ctx = RecordHelperMacros.writeIndexMacro(out.skipLines(ctx, FormKind.ATTR), header.recordIndexMacro(), out);
            }
        }
        if (header.macroDispatcher() != null) {
            ctx = MacroDispatcher.write(out.skipLines(ctx, FormKind.ATTR), header.macroDispatcher(), out);
        }
        return ctx;
    }
}
