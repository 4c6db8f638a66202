package org.erl2ex.codegen.backend.layout;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Append-only line writer over the output sink. It never reads back what was
 * written; all formatting decisions come from the {@link RenderContext}.
 */
public final class CodeWriter {

    private final Appendable out;

    public CodeWriter(Appendable out) {
        this.out = out;
    }

    /**
     * Inserts the vertical whitespace required before text of the given kind
     * and records that kind as the last emitted one.
     *
     * @param ctx The current context.
     * @param next The kind of the text about to be written.
     * @return The context with {@code next} as its last form.
     */
    public RenderContext skipLines(RenderContext ctx, FormKind next) {
        int blank = SpacingPolicy.blankLines(ctx.lastForm(), next);
        for (int i = 0; i < blank; i++) {
            append("\n");
        }
        return ctx.withLastForm(next);
    }

    /**
     * Writes text at the current indent. Multi-line text is split and every
     * line gets the same prefix.
     *
     * @param ctx The current context.
     * @param text The text to write.
     * @return The unchanged context.
     */
    public RenderContext writeLine(RenderContext ctx, String text) {
        String indent = ctx.indentation();
        for (String line : text.split("\n", -1)) {
            append(indent);
            append(line);
            append("\n");
        }
        return ctx;
    }

    /**
     * Writes each string with {@link #writeLine}.
     */
    public RenderContext writeLines(RenderContext ctx, List<String> lines) {
        for (String line : lines) {
            ctx = writeLine(ctx, line);
        }
        return ctx;
    }

    /**
     * Writes a block of full-line comments as text of the given kind. An empty
     * block writes nothing and leaves the spacing state untouched.
     *
     * @param ctx The current context.
     * @param comments The comment lines, written verbatim.
     * @param kind The form kind used for spacing.
     * @return The updated context.
     */
    public RenderContext writeCommentBlock(RenderContext ctx, List<String> comments, FormKind kind) {
        if (comments.isEmpty()) {
            return ctx;
        }
        return writeLines(skipLines(ctx, kind), comments);
    }

    private void append(String s) {
        try {
            out.append(s);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write generated code", e);
        }
    }
}
