package org.erl2ex.codegen.backend.emit.features;

import org.erl2ex.codegen.ir.IrDirective;
import org.erl2ex.codegen.ir.IrDirective.Kind;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.erl2ex.codegen.testutils.RenderHarness.render;
import static org.erl2ex.codegen.testutils.RenderHarness.start;

@Tag("unit")
class DirectiveRendererTest {

    private final DirectiveRenderer renderer = new DirectiveRenderer();

    @Test
    void translatesEachDirective() {
        assertThat(render(renderer, new IrDirective(Kind.UNDEF, "__defined_FOO", List.of()))).isEqualTo("@__defined_FOO false\n");
        assertThat(render(renderer, new IrDirective(Kind.IFDEF, "__defined_FOO", List.of()))).isEqualTo("if @__defined_FOO do\n");
        assertThat(render(renderer, new IrDirective(Kind.IFNDEF, "__defined_FOO", List.of()))).isEqualTo("if not @__defined_FOO do\n");
        assertThat(render(renderer, new IrDirective(Kind.ELSE, null, List.of()))).isEqualTo("else\n");
        assertThat(render(renderer, new IrDirective(Kind.ENDIF, null, List.of()))).isEqualTo("end\n");
    }

    @Test
    void writesCommentsBeforeTheDirective() {
        assertThat(render(renderer, new IrDirective(Kind.IFDEF, "f", List.of("# c")))).isEqualTo("# c\nif @f do\n");
    }

    @Test
    void indentsWithContext() {
        assertThat(render(renderer, start().incrementIndent(), new IrDirective(Kind.IFDEF, "f", List.of())))
                .isEqualTo("  if @f do\n");
    }

    @Test
    void requiresFlagForConditionals() {
        assertThatThrownBy(() -> render(renderer, new IrDirective(Kind.IFDEF, null, List.of())))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> render(renderer, new IrDirective(Kind.UNDEF, null, List.of())))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void rejectsFlagOnElseAndEndif() {
        assertThatThrownBy(() -> render(renderer, new IrDirective(Kind.ELSE, "f", List.of())))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("'f'");
        assertThatThrownBy(() -> render(renderer, new IrDirective(Kind.ENDIF, "f", List.of())))
                .isInstanceOf(IllegalStateException.class);
    }
}
