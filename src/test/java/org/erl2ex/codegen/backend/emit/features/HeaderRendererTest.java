package org.erl2ex.codegen.backend.emit.features;

import org.erl2ex.codegen.api.CodegenOptions;
import org.erl2ex.codegen.backend.layout.CodeWriter;
import org.erl2ex.codegen.backend.layout.FormKind;
import org.erl2ex.codegen.backend.layout.RenderContext;
import org.erl2ex.codegen.ir.IrHeader;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.erl2ex.codegen.testutils.RenderHarness.render;

@Tag("unit")
class HeaderRendererTest {

    private final HeaderRenderer renderer = new HeaderRenderer();

    @Test
    void writesBitwiseAndEnvironmentFlagsAsOneGroup() {
        IrHeader header = new IrHeader(true, List.of(new IrHeader.InitMacro("FOO", "__defined_FOO")),
                List.of(), false, null, null, null);

        assertThat(render(renderer, header)).isEqualTo(
                "use Bitwise, only_operators: true\n"
                        + "@__defined_FOO System.get_env(\"DEFINE_FOO\") != nil\n");
    }

    @Test
    void readsFlagsFromApplicationConfigWhenConfigured() {
        RenderContext ctx = new RenderContext(0, FormKind.START, "DEFINE_", "my_app");
        IrHeader header = new IrHeader(false, List.of(new IrHeader.InitMacro("FOO", "__defined_FOO")),
                List.of(), false, null, null, null);

        assertThat(render(renderer, ctx, header))
                .isEqualTo("@__defined_FOO Application.get_env(:my_app, :DEFINE_FOO) != nil\n");
    }

    @Test
    void usesConfiguredDefinePrefix() {
        RenderContext ctx = new RenderContext(0, FormKind.START, "ERL_", null);
        IrHeader header = new IrHeader(false, List.of(new IrHeader.InitMacro("DEBUG", "__defined_DEBUG")),
                List.of(), false, null, null, null);

        assertThat(render(renderer, ctx, header))
                .isEqualTo("@__defined_DEBUG System.get_env(\"ERL_DEBUG\") != nil\n");
    }

    @Test
    void writesRecordSupportAndHelpers() {
        IrHeader header = new IrHeader(false, List.of(), List.of("rec"), true,
                "erlrecordsize", "erlrecordindex", null);

        assertThat(render(renderer, header)).isEqualTo(
                "require Record\n"
                        + "defmacrop erlrecordsize(data_attr) do\n"
                        + "  __MODULE__ |> Module.get_attribute(data_attr) |> Enum.count |> +(1)\n"
                        + "end\n"
                        + "defmacrop erlrecordindex(data_attr, field) do\n"
                        + "  index = __MODULE__ |> Module.get_attribute(data_attr) |> Enum.find_index(&(&1 == field))\n"
                        + "  if index == nil, do: 0, else: index + 1\n"
                        + "end\n");
    }

    @Test
    void skipsRecordHelpersWithoutRecords() {
        IrHeader header = new IrHeader(false, List.of(), List.of(), false, "erlrecordsize", "erlrecordindex", null);

        assertThat(render(renderer, header)).isEmpty();
    }

    @Test
    void writesMacroDispatcher() {
        IrHeader header = new IrHeader(false, List.of(), List.of(), false, null, null, "erlmacro");

        assertThat(render(renderer, header)).isEqualTo(
                "defmacrop erlmacro(name, args) when is_atom(name), do:\n"
                        + "  {Module.get_attribute(__MODULE__, name), [], args}\n"
                        + "defmacrop erlmacro(macro, args), do:\n"
                        + "  {Macro.expand(macro, __CALLER__), [], args}\n");
    }

    @Test
    void emptyHeaderWritesNothing() {
        RenderContext start = RenderContext.initial(CodegenOptions.defaults());
        IrHeader header = new IrHeader(false, List.of(), List.of(), false, null, null, null);
        StringBuilder sb = new StringBuilder();

        RenderContext after = renderer.render(start, header, new CodeWriter(sb));

        assertThat(sb.toString()).isEmpty();
        assertThat(after.lastForm()).isEqualTo(FormKind.START);
    }
}
