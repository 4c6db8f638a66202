package org.erl2ex.codegen.backend.layout;

import org.erl2ex.codegen.api.CodegenOptions;

/**
 * Formatting state threaded through every render call. Instances are
 * immutable; each step returns the context for the next one.
 *
 * @param indent The current nesting level, two spaces per level. Never negative.
 * @param lastForm The kind of the last emitted text.
 * @param definePrefix Prefix of the environment keys used for macro presence flags.
 * @param definesFromConfig Application whose configuration holds the macro presence
 *                          flags, or {@code null} to read them from the process environment.
 */
public record RenderContext(int indent, FormKind lastForm, String definePrefix, String definesFromConfig) {

    public RenderContext {
        if (indent < 0) {
            throw new IllegalStateException("Indent level must not be negative: " + indent);
        }
    }

    /**
     * Creates the context for the start of a module.
     * @param options The render options.
     * @return A context at indent 0 with nothing emitted yet.
     */
    public static RenderContext initial(CodegenOptions options) {
        return new RenderContext(0, FormKind.START, options.definePrefix(), options.definesFromConfig());
    }

    public RenderContext incrementIndent() {
        return new RenderContext(indent + 1, lastForm, definePrefix, definesFromConfig);
    }

    public RenderContext decrementIndent() {
        return new RenderContext(indent - 1, lastForm, definePrefix, definesFromConfig);
    }

    public RenderContext withLastForm(FormKind kind) {
        return new RenderContext(indent, kind, definePrefix, definesFromConfig);
    }

    /**
     * @return The line prefix for the current indent level.
     */
    public String indentation() {
        return "  ".repeat(indent);
    }
}
