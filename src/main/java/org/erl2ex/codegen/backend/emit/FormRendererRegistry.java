package org.erl2ex.codegen.backend.emit;

import org.erl2ex.codegen.backend.emit.features.AttributeRenderer;
import org.erl2ex.codegen.backend.emit.features.CommentRenderer;
import org.erl2ex.codegen.backend.emit.features.DirectiveRenderer;
import org.erl2ex.codegen.backend.emit.features.FunctionRenderer;
import org.erl2ex.codegen.backend.emit.features.HeaderRenderer;
import org.erl2ex.codegen.backend.emit.features.ImportRenderer;
import org.erl2ex.codegen.backend.emit.features.MacroRenderer;
import org.erl2ex.codegen.backend.emit.features.RecordRenderer;
import org.erl2ex.codegen.backend.emit.features.SpecRenderer;
import org.erl2ex.codegen.backend.emit.features.TypeRenderer;
import org.erl2ex.codegen.backend.layout.CodeWriter;
import org.erl2ex.codegen.backend.layout.RenderContext;
import org.erl2ex.codegen.backend.unparse.ExprUnparser;
import org.erl2ex.codegen.ir.IrAttribute;
import org.erl2ex.codegen.ir.IrComment;
import org.erl2ex.codegen.ir.IrDirective;
import org.erl2ex.codegen.ir.IrForm;
import org.erl2ex.codegen.ir.IrFormVisitor;
import org.erl2ex.codegen.ir.IrFunction;
import org.erl2ex.codegen.ir.IrHeader;
import org.erl2ex.codegen.ir.IrImport;
import org.erl2ex.codegen.ir.IrMacro;
import org.erl2ex.codegen.ir.IrRecord;
import org.erl2ex.codegen.ir.IrSpecDecl;
import org.erl2ex.codegen.ir.IrTypeDecl;

/**
 * Holds one renderer per form kind and dispatches forms to them.
 */
public final class FormRendererRegistry {

	private final IFormRenderer<IrHeader> header;
	private final IFormRenderer<IrComment> comment;
	private final IFormRenderer<IrFunction> function;
	private final IFormRenderer<IrAttribute> attribute;
	private final IFormRenderer<IrDirective> directive;
	private final IFormRenderer<IrImport> importRenderer;
	private final IFormRenderer<IrRecord> record;
	private final IFormRenderer<IrTypeDecl> type;
	private final IFormRenderer<IrSpecDecl> spec;
	private final IFormRenderer<IrMacro> macro;

	public FormRendererRegistry(
			IFormRenderer<IrHeader> header,
			IFormRenderer<IrComment> comment,
			IFormRenderer<IrFunction> function,
			IFormRenderer<IrAttribute> attribute,
			IFormRenderer<IrDirective> directive,
			IFormRenderer<IrImport> importRenderer,
			IFormRenderer<IrRecord> record,
			IFormRenderer<IrTypeDecl> type,
			IFormRenderer<IrSpecDecl> spec,
			IFormRenderer<IrMacro> macro) {
		this.header = header;
		this.comment = comment;
		this.function = function;
		this.attribute = attribute;
		this.directive = directive;
		this.importRenderer = importRenderer;
		this.record = record;
		this.type = type;
		this.spec = spec;
		this.macro = macro;
	}

	/**
	 * Initializes a new registry with the default renderers.
	 * @param unparser The expression unparser shared by all renderers.
	 * @return A new registry with default renderers.
	 */
	public static FormRendererRegistry initializeWithDefaults(ExprUnparser unparser) {
		return new FormRendererRegistry(
				new HeaderRenderer(),
				new CommentRenderer(),
				new FunctionRenderer(unparser),
				new AttributeRenderer(unparser),
				new DirectiveRenderer(),
				new ImportRenderer(unparser),
				new RecordRenderer(unparser),
				new TypeRenderer(unparser),
				new SpecRenderer(unparser),
				new MacroRenderer(unparser));
	}

	/**
	 * Renders a single form with the renderer registered for its kind.
	 *
	 * @param ctx  The context before the form.
	 * @param form The form to render.
	 * @param out  The output writer.
	 * @return The context after the form.
	 * @throws IllegalStateException if the form is {@code null}.
	 */
	public RenderContext render(RenderContext ctx, IrForm form, CodeWriter out) {
		if (form == null) {
			throw new IllegalStateException("Module contains a null form");
		}
		return form.accept(new Dispatch(out), ctx);
	}

	private final class Dispatch implements IrFormVisitor<RenderContext, RenderContext> {

		private final CodeWriter out;

		Dispatch(CodeWriter out) {
			this.out = out;
		}

		@Override
		public RenderContext visitHeader(IrHeader form, RenderContext ctx) {
			return header.render(ctx, form, out);
		}

		@Override
		public RenderContext visitComment(IrComment form, RenderContext ctx) {
			return comment.render(ctx, form, out);
		}

		@Override
		public RenderContext visitFunction(IrFunction form, RenderContext ctx) {
			return function.render(ctx, form, out);
		}

		@Override
		public RenderContext visitAttribute(IrAttribute form, RenderContext ctx) {
			return attribute.render(ctx, form, out);
		}

		@Override
		public RenderContext visitDirective(IrDirective form, RenderContext ctx) {
			return directive.render(ctx, form, out);
		}

		@Override
		public RenderContext visitImport(IrImport form, RenderContext ctx) {
			return importRenderer.render(ctx, form, out);
		}

		@Override
		public RenderContext visitRecord(IrRecord form, RenderContext ctx) {
			return record.render(ctx, form, out);
		}

		@Override
		public RenderContext visitTypeDecl(IrTypeDecl form, RenderContext ctx) {
			return type.render(ctx, form, out);
		}

		@Override
		public RenderContext visitSpecDecl(IrSpecDecl form, RenderContext ctx) {
			return spec.render(ctx, form, out);
		}

		@Override
		public RenderContext visitMacro(IrMacro form, RenderContext ctx) {
			return macro.render(ctx, form, out);
		}
	}
}
