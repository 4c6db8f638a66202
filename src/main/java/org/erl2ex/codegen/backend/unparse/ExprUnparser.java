package org.erl2ex.codegen.backend.unparse;

import org.erl2ex.codegen.ir.expr.Quoted;

import java.util.ArrayList;
import java.util.List;

/**
 * Unparses converter output. Wraps {@link QuotedPrinter} with character
 * literal restoration and corrects signatures that the printer would
 * otherwise turn into keyword blocks.
 */
public final class ExprUnparser {

    private static final String GUARD = "when";
    private static final String FILLER = "a";
    private static final String SPURIOUS_BLOCK_END = "\nend";
    private static final String FILLER_SUFFIX = ", " + FILLER + ": :" + FILLER + ")";

    private final QuotedPrinter printer = new QuotedPrinter(new CharLiteralHook());

    /**
     * @param expr The expression.
     * @return The expression's source text.
     */
    public String unparse(Quoted expr) {
        return printer.print(expr);
    }

    /**
     * Unparses a function or macro signature.
     * <p>
     * When the last parameter is a keyword list whose keys are all block
     * keywords (for instance a pattern {@code [do: x]}), the printer emits a
     * {@code do ... end} block. In that case a filler pair is appended to the
     * keyword list, which forces the plain keyword form, and the filler is
     * stripped from the resulting text. A guarded signature
     * {@code head when guard} has the correction applied to its head.
     *
     * @param signature The call signature.
     * @return The signature's source text.
     * @throws IllegalStateException if the signature prints as a block but cannot be corrected.
     */
    public String unparseSignature(Quoted signature) {
        String text = unparse(signature);
        if (signature instanceof Quoted.Call guarded && GUARD.equals(guarded.targetName()) && guarded.args().size() == 2) {
            String head = unparse(guarded.args().get(0));
            if (text.startsWith(head + " " + GUARD + " ")) {
                return unparseSignature(guarded.args().get(0)) + text.substring(head.length());
            }
        }
        if (!text.endsWith(SPURIOUS_BLOCK_END)) {
            return text;
        }
        if (!(signature instanceof Quoted.Call call) || call.args().isEmpty()
                || !(call.args().get(call.args().size() - 1) instanceof Quoted.ListOf keywords)) {
            throw new IllegalStateException("Cannot unparse signature ending in a block: " + text);
        }
        List<Quoted> padded = new ArrayList<>(keywords.elements());
        padded.add(Quoted.keyword(FILLER, Quoted.atom(FILLER)));
        List<Quoted> args = new ArrayList<>(call.args());
        args.set(args.size() - 1, new Quoted.ListOf(padded));

        String corrected = unparse(new Quoted.Call(call.target(), call.meta(), args));
        if (!corrected.endsWith(FILLER_SUFFIX)) {
            throw new IllegalStateException("Cannot unparse signature ending in a block: " + text);
        }
        return corrected.substring(0, corrected.length() - FILLER_SUFFIX.length()) + ")";
    }
}
