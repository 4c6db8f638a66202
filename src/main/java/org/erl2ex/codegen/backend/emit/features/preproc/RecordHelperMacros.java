package org.erl2ex.codegen.backend.emit.features.preproc;

import org.erl2ex.codegen.backend.layout.CodeWriter;
import org.erl2ex.codegen.backend.layout.RenderContext;

/**
 * Helper macros backing {@code is_record} tests. Both read the field-name
 * list stored in a record's data attribute at expansion time.
 */
public final class RecordHelperMacros {

    private RecordHelperMacros() {}

    /**
     * Writes the size helper, which expands to the record tuple size
     * (field count plus one for the tag).
     */
    public static RenderContext writeSizeMacro(RenderContext ctx, String name, CodeWriter out) {
        ctx = out.writeLine(ctx, "defmacrop " + name + "(data_attr) do");
        ctx = out.writeLine(ctx.incrementIndent(),
                "__MODULE__ |> Module.get_attribute(data_attr) |> Enum.count |> +(1)");
        return out.writeLine(ctx.decrementIndent(), "end");
    }

    /**
     * Writes the index helper, which expands to the one-based tuple index of
     * a field, or 0 if the record has no such field.
     */
    public static RenderContext writeIndexMacro(RenderContext ctx, String name, CodeWriter out) {
        ctx = out.writeLine(ctx, "defmacrop " + name + "(data_attr, field) do");
        ctx = ctx.incrementIndent();
        ctx = out.writeLine(ctx,
                "index = __MODULE__ |> Module.get_attribute(data_attr) |> Enum.find_index(&(&1 == field))");
        ctx = out.writeLine(ctx, "if index == nil, do: 0, else: index + 1");
        return out.writeLine(ctx.decrementIndent(), "end");
    }
}
