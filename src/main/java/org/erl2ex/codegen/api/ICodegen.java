package org.erl2ex.codegen.api;

import org.erl2ex.codegen.ir.IrModule;

/**
 * Defines the public interface of the code generation backend.
 */
public interface ICodegen {

    /**
     * Renders the given module to the given sink. The sink is neither flushed
     * nor closed.
     *
     * @param module The converted module.
     * @param out The destination for the generated source text.
     * @throws CodegenException if the sink fails while writing.
     */
    void render(IrModule module, Appendable out) throws CodegenException;

    /**
     * Renders the given module to a string.
     *
     * @param module The converted module.
     * @return The generated source text.
     */
    String render(IrModule module);
}
