package org.erl2ex.codegen.backend.emit;

import org.erl2ex.codegen.backend.layout.CodeWriter;
import org.erl2ex.codegen.backend.layout.RenderContext;
import org.erl2ex.codegen.ir.IrAttribute;
import org.erl2ex.codegen.ir.IrComment;
import org.erl2ex.codegen.ir.IrDirective;
import org.erl2ex.codegen.ir.IrForm;
import org.erl2ex.codegen.ir.IrFunction;
import org.erl2ex.codegen.ir.IrHeader;
import org.erl2ex.codegen.ir.IrImport;
import org.erl2ex.codegen.ir.IrMacro;
import org.erl2ex.codegen.ir.IrRecord;
import org.erl2ex.codegen.ir.IrSpecDecl;
import org.erl2ex.codegen.ir.IrTypeDecl;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.erl2ex.codegen.ir.expr.Quoted.atom;
import static org.erl2ex.codegen.ir.expr.Quoted.call;
import static org.erl2ex.codegen.ir.expr.Quoted.list;
import static org.erl2ex.codegen.testutils.RenderHarness.start;

@Tag("unit")
class FormRendererRegistryTest {

    private static <F extends IrForm> IFormRenderer<F> named(String name) {
        return (ctx, form, out) -> out.writeLine(ctx, name);
    }

    private final FormRendererRegistry registry = new FormRendererRegistry(
            named("header"), named("comment"), named("function"), named("attribute"), named("directive"),
            named("import"), named("record"), named("type"), named("spec"), named("macro"));

    @Test
    void dispatchesEachFormToItsRenderer() {
        List<IrForm> forms = List.of(
                new IrHeader(false, List.of(), List.of(), false, null, null, null),
                new IrComment(List.of("# c")),
                new IrFunction(true, List.of(new IrFunction.Clause(call("f"), List.of(atom("ok")), List.of())), List.of(), List.of()),
                new IrAttribute("x", atom("y"), false, List.of()),
                new IrDirective(IrDirective.Kind.ENDIF, null, List.of()),
                new IrImport(atom("lists"), list(), List.of()),
                new IrRecord(atom("r"), "r", "fields_r", List.of(), List.of()),
                new IrTypeDecl(IrTypeDecl.Kind.TYPE, call("t"), call("any"), List.of()),
                new IrSpecDecl(IrSpecDecl.Kind.SPEC, List.of(), List.of()),
                new IrMacro("M", call("m"), null, null, List.of(), atom("ok"), null, List.of()));
        StringBuilder sb = new StringBuilder();
        CodeWriter out = new CodeWriter(sb);

        RenderContext ctx = start();
        for (IrForm form : forms) {
            ctx = registry.render(ctx, form, out);
        }

        assertThat(sb.toString()).isEqualTo(
                "header\ncomment\nfunction\nattribute\ndirective\nimport\nrecord\ntype\nspec\nmacro\n");
    }

    @Test
    void rejectsNullForm() {
        assertThatThrownBy(() -> registry.render(start(), null, new CodeWriter(new StringBuilder())))
                .isInstanceOf(IllegalStateException.class);
    }
}
