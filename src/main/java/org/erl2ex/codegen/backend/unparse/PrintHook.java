package org.erl2ex.codegen.backend.unparse;

import org.erl2ex.codegen.ir.expr.Quoted;

/**
 * Post-processes the text produced for each node. Hooks run bottom-up, so a
 * parent sees the already-hooked text of its children.
 */
@FunctionalInterface
public interface PrintHook {

    /** Leaves every node's text unchanged. */
    PrintHook IDENTITY = (node, text) -> text;

    /**
     * @param node The node that was printed.
     * @param text The text produced for it.
     * @return The text to use instead.
     */
    String apply(Quoted node, String text);
}
