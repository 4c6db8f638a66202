package org.erl2ex.codegen.backend.emit.features;

import org.erl2ex.codegen.backend.emit.IFormRenderer;
import org.erl2ex.codegen.backend.layout.CodeWriter;
import org.erl2ex.codegen.backend.layout.FormKind;
import org.erl2ex.codegen.backend.layout.RenderContext;
import org.erl2ex.codegen.backend.unparse.ExprUnparser;
import org.erl2ex.codegen.backend.unparse.QuotedPrinter;
import org.erl2ex.codegen.ir.IrRecord;
import org.erl2ex.codegen.ir.expr.Quoted;

import java.util.ArrayList;
import java.util.List;

/**
 * Writes a record as the attribute holding its field names, immediately
 * followed by the {@code Record.defrecordp} call defining its macro.
 */
public final class RecordRenderer implements IFormRenderer<IrRecord> {

    private final ExprUnparser unparser;

    public RecordRenderer(ExprUnparser unparser) {
        this.unparser = unparser;
    }

    @Override
    public RenderContext render(RenderContext ctx, IrRecord record, CodeWriter out) {
        List<Quoted> names = new ArrayList<>();
        List<Quoted> fields = new ArrayList<>();
        for (IrRecord.Field field : record.fields()) {
            names.add(Quoted.atom(field.name()));
            fields.add(Quoted.keyword(field.name(), field.defaultValue()));
        }
        ctx = out.writeLines(out.skipLines(ctx, FormKind.ATTR), record.comments());
        ctx = out.writeLine(ctx, "@" + record.dataAttribute() + " " + unparser.unparse(Quoted.list(names)));
        return out.writeLine(ctx, "Record.defrecordp " + QuotedPrinter.atomToString(record.macro())
                + ", " + unparser.unparse(record.tag())
                + ", " + unparser.unparse(Quoted.list(fields)));
    }
}
