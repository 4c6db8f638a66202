package org.erl2ex.codegen.backend.unparse;

import org.erl2ex.codegen.ir.expr.Quoted;

/**
 * Restores character literals. The converter cannot express {@code ?c}
 * syntax in a quoted tree, so it emits a variable named {@code ?} carrying
 * the code point in its metadata; this hook replaces that variable's text
 * with the literal.
 */
public final class CharLiteralHook implements PrintHook {

    @Override
    public String apply(Quoted node, String text) {
        if (node instanceof Quoted.Var v && Quoted.CHAR_PLACEHOLDER.equals(v.name())
                && v.meta().get(Quoted.CHAR_META) instanceof Number code) {
            return "?" + escapeChar(code.intValue());
        }
        return text;
    }

    /**
     * Returns the text following {@code ?} in a character literal.
     * @param codePoint The character's code point.
     * @return A two-character escape for the special characters, otherwise the character itself.
     */
    public static String escapeChar(int codePoint) {
        return switch (codePoint) {
            case '\\' -> "\\\\";
            case 7 -> "\\a";
            case '\b' -> "\\b";
            case 127 -> "\\d";
            case 27 -> "\\e";
            case '\f' -> "\\f";
            case '\n' -> "\\n";
            case '\r' -> "\\r";
            case ' ' -> "\\s";
            case '\t' -> "\\t";
            case 11 -> "\\v";
            case 0 -> "\\0";
            default -> new String(Character.toChars(codePoint));
        };
    }
}
