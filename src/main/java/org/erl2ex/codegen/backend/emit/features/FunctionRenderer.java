package org.erl2ex.codegen.backend.emit.features;

import org.erl2ex.codegen.backend.emit.IFormRenderer;
import org.erl2ex.codegen.backend.layout.CodeWriter;
import org.erl2ex.codegen.backend.layout.FormKind;
import org.erl2ex.codegen.backend.layout.RenderContext;
import org.erl2ex.codegen.backend.unparse.ExprUnparser;
import org.erl2ex.codegen.ir.IrFunction;
import org.erl2ex.codegen.ir.expr.Quoted;

import java.util.List;

/**
 * Writes a function as its comments, its specs and one {@code def}/{@code defp}
 * per clause. Clauses and specs are kept tight; the first clause is spaced
 * from whatever precedes the function.
 */
public final class FunctionRenderer implements IFormRenderer<IrFunction> {

    private final ExprUnparser unparser;

    public FunctionRenderer(ExprUnparser unparser) {
        this.unparser = unparser;
    }

    /**
     * {@inheritDoc}
     *
     * @throws IllegalStateException if the function has no clauses.
     */
    @Override
    public RenderContext render(RenderContext ctx, IrFunction function, CodeWriter out) {
        if (function.clauses().isEmpty()) {
            throw new IllegalStateException("Function has no clauses");
        }
        ctx = out.writeCommentBlock(ctx, function.comments(), FormKind.FUNC_HEADER);
        ctx = writeSpecs(ctx, function.specs(), out);

        String keyword = function.isPublic() ? "def" : "defp";
        List<IrFunction.Clause> clauses = function.clauses();
        ctx = writeClause(ctx, keyword, clauses.get(0), FormKind.FUNC_CLAUSE_FIRST, out);
        for (IrFunction.Clause clause : clauses.subList(1, clauses.size())) {
            ctx = writeClause(ctx, keyword, clause, FormKind.FUNC_CLAUSE, out);
        }
        return ctx;
    }

    private RenderContext writeSpecs(RenderContext ctx, List<Quoted> specs, CodeWriter out) {
        if (specs.isEmpty()) {
            return ctx;
        }
        ctx = out.skipLines(ctx, FormKind.FUNC_SPECS);
        for (Quoted spec : specs) {
            ctx = out.writeLine(ctx, "@spec " + unparser.unparse(spec));
        }
        return ctx;
    }

    private RenderContext writeClause(RenderContext ctx, String keyword, IrFunction.Clause clause, FormKind kind, CodeWriter out) {
        ctx = out.writeLines(out.skipLines(ctx, kind), clause.comments());
        ctx = out.writeLine(ctx, keyword + " " + unparser.unparseSignature(clause.signature()) + " do");
        ctx = ctx.incrementIndent();
        for (Quoted expr : clause.body()) {
            ctx = out.writeLine(ctx, unparser.unparse(expr));
        }
        return out.writeLine(ctx.decrementIndent(), "end");
    }
}
