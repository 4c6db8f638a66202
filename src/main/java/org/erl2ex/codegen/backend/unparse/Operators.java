package org.erl2ex.codegen.backend.unparse;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Operator table of the target grammar. Higher precedence binds tighter.
 */
public final class Operators {

    /**
     * A binary operator.
     * @param symbol The operator text.
     * @param precedence Binding strength.
     * @param rightAssociative Whether the operator groups to the right.
     */
    public record Binary(String symbol, int precedence, boolean rightAssociative) {

        /**
         * @return Whether the operator is written without surrounding spaces.
         */
        public boolean tight() {
            return symbol.equals("..");
        }
    }

    private static final Map<String, Binary> BINARY = new HashMap<>();
    private static final Set<String> UNARY = Set.of("not", "!", "-", "+", "^", "~~~");

    static {
        left(1, "<-", "\\\\");
        right(2, "when");
        right(3, "::");
        right(4, "|");
        right(5, "=>");
        right(7, "=");
        left(8, "||", "|||", "or");
        left(9, "&&", "&&&", "and");
        left(10, "==", "!=", "=~", "===", "!==");
        left(11, "<", ">", "<=", ">=");
        left(12, "|>", "<<<", ">>>", "<~", "~>", "<<~", "~>>", "<~>");
        left(13, "in");
        left(14, "^^^");
        right(15, "++", "--", "..", "<>");
        left(16, "+", "-");
        left(17, "*", "/");
    }

    private Operators() {}

    private static void left(int precedence, String... symbols) {
        for (String s : symbols) BINARY.put(s, new Binary(s, precedence, false));
    }

    private static void right(int precedence, String... symbols) {
        for (String s : symbols) BINARY.put(s, new Binary(s, precedence, true));
    }

    /**
     * @return The binary operator with the given symbol, or {@code null}.
     */
    public static Binary binary(String symbol) {
        return symbol == null ? null : BINARY.get(symbol);
    }

    public static boolean isUnary(String symbol) {
        return symbol != null && UNARY.contains(symbol);
    }
}
