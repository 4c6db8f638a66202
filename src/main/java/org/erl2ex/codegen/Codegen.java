package org.erl2ex.codegen;

import org.erl2ex.codegen.api.CodegenException;
import org.erl2ex.codegen.api.CodegenOptions;
import org.erl2ex.codegen.api.ICodegen;
import org.erl2ex.codegen.backend.emit.FormRendererRegistry;
import org.erl2ex.codegen.backend.emit.ModuleRenderer;
import org.erl2ex.codegen.backend.layout.CodeWriter;
import org.erl2ex.codegen.backend.layout.RenderContext;
import org.erl2ex.codegen.backend.unparse.ExprUnparser;
import org.erl2ex.codegen.ir.IrModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;

/**
 * The code generation backend. Renders one converted module per call into
 * Elixir source text. Rendering is deterministic: the same module and options
 * always produce identical output.
 * <p>
 * Instances hold only immutable configuration and may be reused.
 */
public class Codegen implements ICodegen {

    private static final Logger LOG = LoggerFactory.getLogger(Codegen.class);

    private final CodegenOptions options;
    private final ModuleRenderer moduleRenderer;

    /**
     * Creates a backend with the default options.
     */
    public Codegen() {
        this(CodegenOptions.defaults());
    }

    /**
     * Creates a backend with the given options.
     * @param options The render options.
     */
    public Codegen(CodegenOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("options must not be null");
        }
        this.options = options;
        this.moduleRenderer = new ModuleRenderer(FormRendererRegistry.initializeWithDefaults(new ExprUnparser()));
    }

    /**
     * @return The options this backend renders with.
     */
    public CodegenOptions options() {
        return options;
    }

    /**
     * {@inheritDoc}
     * <p>
     * If the sink fails, output written before the failure remains in the sink.
     */
    @Override
    public void render(IrModule module, Appendable out) throws CodegenException {
        if (out == null) {
            throw new IllegalArgumentException("out must not be null");
        }
        try {
            renderTo(module, out);
        } catch (UncheckedIOException e) {
            throw new CodegenException("Failed to write module " + describe(module), e.getCause());
        }
    }

    @Override
    public String render(IrModule module) {
        StringBuilder sb = new StringBuilder();
        renderTo(module, sb);
        LOG.debug("Rendered module {}: {} characters", describe(module), sb.length());
        return sb.toString();
    }

    private void renderTo(IrModule module, Appendable out) {
        if (module == null) {
            throw new IllegalArgumentException("module must not be null");
        }
        LOG.debug("Rendering module {} with {} form(s)", describe(module), module.forms().size());
        moduleRenderer.render(RenderContext.initial(options), module, new CodeWriter(out));
    }

    private static String describe(IrModule module) {
        return module.name() != null ? module.name() : "<unnamed>";
    }
}
