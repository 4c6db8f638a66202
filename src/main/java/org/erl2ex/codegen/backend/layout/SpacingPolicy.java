package org.erl2ex.codegen.backend.layout;

/**
 * Vertical whitespace between consecutive pieces of output.
 * <p>
 * The result is a line-break count N: N lines separate the previous text from
 * the next, so N - 1 blank lines are inserted. N is 0 only at the start of
 * the output. Clauses, specs and attributes stay tight; unrelated top-level
 * forms are separated by one blank line.
 */
public final class SpacingPolicy {

    private SpacingPolicy() {}

    /**
     * Computes the line-break count between two form kinds.
     * @param previous The kind of the last emitted text.
     * @param next The kind of the text about to be emitted.
     * @return The line-break count, 0, 1 or 2.
     */
    public static int lineBreaks(FormKind previous, FormKind next) {
        if (previous == FormKind.START) return 0;
        if (previous == FormKind.MODULE_COMMENTS && next == FormKind.MODULE_BEGIN) return 1;
        if (previous == FormKind.MODULE_BEGIN) return 1;
        if (next == FormKind.MODULE_END) return 1;
        if (previous == FormKind.FUNC_HEADER && next == FormKind.FUNC_SPECS) return 1;
        if (previous == FormKind.FUNC_HEADER && next == FormKind.FUNC_CLAUSE_FIRST) return 1;
        if (previous == FormKind.FUNC_SPECS && next == FormKind.FUNC_CLAUSE_FIRST) return 1;
        if (previous == FormKind.FUNC_CLAUSE_FIRST && next == FormKind.FUNC_CLAUSE) return 1;
        if (previous == FormKind.FUNC_CLAUSE && next == FormKind.FUNC_CLAUSE) return 1;
        if (previous == FormKind.ATTR && next == FormKind.ATTR) return 1;
        return 2;
    }

    /**
     * @return The number of blank lines to insert between two form kinds.
     */
    public static int blankLines(FormKind previous, FormKind next) {
        return Math.max(0, lineBreaks(previous, next) - 1);
    }
}
