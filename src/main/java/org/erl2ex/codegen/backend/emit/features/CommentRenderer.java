package org.erl2ex.codegen.backend.emit.features;

import org.erl2ex.codegen.backend.emit.IFormRenderer;
import org.erl2ex.codegen.backend.layout.CodeWriter;
import org.erl2ex.codegen.backend.layout.FormKind;
import org.erl2ex.codegen.backend.layout.RenderContext;
import org.erl2ex.codegen.ir.IrComment;

/**
 * Writes a standalone comment block verbatim.
 */
public final class CommentRenderer implements IFormRenderer<IrComment> {
    @Override
    public RenderContext render(RenderContext ctx, IrComment form, CodeWriter out) {
        return out.writeCommentBlock(ctx, form.comments(), FormKind.STRUCTURE_COMMENTS);
    }
}
