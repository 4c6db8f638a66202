package org.erl2ex.codegen.backend.emit.features.preproc;

import org.erl2ex.codegen.backend.layout.RenderContext;
import org.erl2ex.codegen.backend.unparse.QuotedPrinter;
import org.erl2ex.codegen.ir.IrDirective;
import org.erl2ex.codegen.ir.IrHeader;
import org.erl2ex.codegen.ir.expr.Quoted;

/**
 * Emulates preprocessor macro definedness with boolean module attributes.
 * <p>
 * {@code -ifdef}/{@code -ifndef} become compile-time {@code if} blocks over the
 * flag attribute, {@code -undef} clears it, and flags of externally defined
 * macros are initialized from the environment or application config when the
 * module is compiled.
 */
public final class FlagAttributes {

    private static final QuotedPrinter PRINTER = new QuotedPrinter();

    private FlagAttributes() {}

    /**
     * @return The environment variable (or config key) deciding whether the macro is defined.
     */
    public static String environmentKey(RenderContext ctx, String macroName) {
        return ctx.definePrefix() + macroName;
    }

    /**
     * Builds the expression that is true iff the externally defined macro is present.
     *
     * @param ctx The context holding the define prefix and config application.
     * @param macroName The legacy macro name.
     * @return The presence check expression.
     */
    public static String presenceCheck(RenderContext ctx, String macroName) {
        String key = environmentKey(ctx, macroName);
        String lookup;
        if (ctx.definesFromConfig() != null) {
            lookup = "Application.get_env(" + QuotedPrinter.atomToString(ctx.definesFromConfig())
                    + ", " + QuotedPrinter.atomToString(key) + ")";
        } else {
            lookup = "System.get_env(" + PRINTER.print(Quoted.string(key)) + ")";
        }
        return lookup + " != nil";
    }

    /**
     * @return The attribute assignment initializing the flag of an externally defined macro.
     */
    public static String initializer(RenderContext ctx, IrHeader.InitMacro macro) {
        return "@" + macro.flagAttribute() + " " + presenceCheck(ctx, macro.macroName());
    }

    /**
     * Translates a control directive to its single line of output.
     *
     * @param directive The directive.
     * @return The translated line.
     * @throws IllegalStateException if a flag is missing where required, or present where not allowed.
     */
    public static String directiveLine(IrDirective directive) {
        IrDirective.Kind kind = directive.kind();
        String flag = directive.flagAttribute();
        if (kind.takesFlag() && flag == null) {
            throw new IllegalStateException("Directive " + kind + " requires a flag attribute");
        }
        if (!kind.takesFlag() && flag != null) {
            throw new IllegalStateException("Directive " + kind + " must not reference flag attribute '" + flag + "'");
        }
        return switch (kind) {
            case UNDEF -> "@" + flag + " false";
            case IFDEF -> "if @" + flag + " do";
            case IFNDEF -> "if not @" + flag + " do";
            case ELSE -> "else";
            case ENDIF -> "end";
        };
    }
}
