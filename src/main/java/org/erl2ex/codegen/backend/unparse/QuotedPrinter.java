package org.erl2ex.codegen.backend.unparse;

import org.erl2ex.codegen.ir.expr.Quoted;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Converts a {@link Quoted} tree to Elixir source text.
 * <p>
 * This is the generic printer: it knows the surface grammar (literals,
 * operators and their precedence, calls, keyword blocks, anonymous functions)
 * but nothing about how the converter uses it. Every node's text is passed
 * through the configured {@link PrintHook} before its parent sees it.
 * <p>
 * A call whose last argument is a keyword list starting with {@code do} and
 * made only of block keywords ({@code do}, {@code catch}, {@code rescue},
 * {@code after}, {@code else}) is printed in block form,
 * {@code name(args) do ... end}, with the blocks in the given order.
 * Signature printing in {@link ExprUnparser} has to compensate for that.
 */
public final class QuotedPrinter {

    private static final List<String> BLOCK_KEYWORDS = List.of("do", "catch", "rescue", "after", "else");
    private static final Set<String> BARE_ATOMS = Set.of("nil", "true", "false");
    private static final Set<String> OPERATOR_ATOMS = Set.of("@", "&", ".", "!", "^", "~~~", "not");
    private static final Pattern PLAIN_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_@]*[?!]?");

    private final PrintHook hook;

    public QuotedPrinter() {
        this(PrintHook.IDENTITY);
    }

    public QuotedPrinter(PrintHook hook) {
        this.hook = hook;
    }

    /**
     * Prints the given expression.
     * @param expr The expression tree.
     * @return The source text; may span several lines.
     */
    public String print(Quoted expr) {
        String text;
        if (expr instanceof Quoted.Atom a) {
            text = atomToString(a.name());
        } else if (expr instanceof Quoted.Int i) {
            text = i.value().toString();
        } else if (expr instanceof Quoted.Flt f) {
            text = Double.toString(f.value()).replace('E', 'e');
        } else if (expr instanceof Quoted.Str s) {
            text = "\"" + escape(s.value(), '"') + "\"";
        } else if (expr instanceof Quoted.ListOf l) {
            text = listToString(l.elements());
        } else if (expr instanceof Quoted.Tuple t) {
            text = "{" + join(t.elements()) + "}";
        } else if (expr instanceof Quoted.Var v) {
            text = v.name();
        } else if (expr instanceof Quoted.Call c) {
            text = callToString(c);
        } else {
            throw new IllegalStateException("Unsupported expression node: " + expr);
        }
        return hook.apply(expr, text);
    }

    /**
     * Prints an atom literal, quoting it when its name is not a plain identifier.
     * @param name The atom name.
     * @return The atom as source text.
     */
    public static String atomToString(String name) {
        if (BARE_ATOMS.contains(name)) {
            return name;
        }
        if (PLAIN_NAME.matcher(name).matches() || OPERATOR_ATOMS.contains(name) || Operators.binary(name) != null) {
            return ":" + name;
        }
        return ":\"" + escape(name, '"') + "\"";
    }

    private String callToString(Quoted.Call call) {
        String name = call.targetName();
        List<Quoted> args = call.args();
        if (name != null) {
            if (name.equals("__block__")) return blockExpression(args);
            if (name.equals("__aliases__")) return aliases(args);
            if (name.equals("{}")) return "{" + join(args) + "}";
            if (name.equals("%{}")) return mapToString(args);
            if (name.equals("<<>>")) return bitstringToString(args);
            if (name.equals("fn")) return fnToString(args);
            if (name.equals("->") && args.size() == 2) return arrowInline(args);
            if (name.equals(".") && args.size() == 2) return remoteCallee(args);
            if (name.equals("@") && args.size() == 1) return attributeToString(args.get(0));
            if (name.equals("&") && args.size() == 1) return captureToString(args.get(0));

            Operators.Binary op = Operators.binary(name);
            if (op != null && args.size() == 2) return binaryOperator(op, args);
            if (Operators.isUnary(name) && args.size() == 1) return unaryOperator(name, args.get(0));

            String callee = PLAIN_NAME.matcher(name).matches() ? name : "unquote(" + atomToString(name) + ")";
            return callWithArgs(callee, args);
        }
        return callWithArgs(calleeText(call), args);
    }

    /**
     * Text of a call's target, without the argument list.
     */
    private String calleeText(Quoted.Call call) {
        String name = call.targetName();
        if (name != null) {
            return name;
        }
        if (call.target() instanceof Quoted.Call dot && ".".equals(dot.targetName())) {
            if (dot.args().size() == 2) {
                return remoteCallee(dot.args());
            }
            if (dot.args().size() == 1) {
                // anonymous function call
                return print(dot.args().get(0)) + ".";
            }
        }
        return print(call.target()) + ".";
    }

    private String remoteCallee(List<Quoted> dotArgs) {
        Quoted receiver = dotArgs.get(0);
        String left = print(receiver);
        if (binaryOf(receiver) != null) {
            left = "(" + left + ")";
        }
        Quoted fun = dotArgs.get(1);
        String right;
        if (fun instanceof Quoted.Atom a) {
            right = PLAIN_NAME.matcher(a.name()).matches() ? a.name() : "\"" + escape(a.name(), '"') + "\"";
        } else {
            right = print(fun);
        }
        return left + "." + right;
    }

    private String callWithArgs(String callee, List<Quoted> args) {
        if (!args.isEmpty() && isBlockKeywords(args.get(args.size() - 1))) {
            Quoted.ListOf blocks = (Quoted.ListOf) args.get(args.size() - 1);
            return callee + "(" + argsToString(args.subList(0, args.size() - 1)) + ")" + keywordBlocks(blocks);
        }
        return callee + "(" + argsToString(args) + ")";
    }

    private String argsToString(List<Quoted> args) {
        if (args.isEmpty()) {
            return "";
        }
        Quoted last = args.get(args.size() - 1);
        if (last instanceof Quoted.ListOf kw && isKeywordList(kw.elements())) {
            String keywords = keywordsToString(kw.elements());
            if (args.size() == 1) {
                return keywords;
            }
            return join(args.subList(0, args.size() - 1)) + ", " + keywords;
        }
        return join(args);
    }

    private String keywordBlocks(Quoted.ListOf blocks) {
        StringBuilder sb = new StringBuilder(" ");
        for (Quoted entry : blocks.elements()) {
            Quoted.Tuple pair = (Quoted.Tuple) entry;
            sb.append(keyOf(pair))
                    .append("\n  ")
                    .append(indentNewLines(blockToString(pair.elements().get(1))))
                    .append("\n");
        }
        return sb.append("end").toString();
    }

    /**
     * Prints the body of a keyword block: clause lists one clause per entry,
     * blocks one expression per line.
     */
    private String blockToString(Quoted body) {
        if (body instanceof Quoted.ListOf list && !list.elements().isEmpty() && isArrow(list.elements().get(0))) {
            return clausesToString(list.elements());
        }
        if (body instanceof Quoted.Call call && "__block__".equals(call.targetName())) {
            return call.args().stream().map(this::print).collect(Collectors.joining("\n"));
        }
        return print(body);
    }

    private String clausesToString(List<Quoted> clauses) {
        List<String> parts = new ArrayList<>();
        for (Quoted clause : clauses) {
            List<Quoted> arrow = ((Quoted.Call) clause).args();
            parts.add(params(arrow.get(0), false) + "->\n  " + indentNewLines(blockToString(arrow.get(1))));
        }
        return String.join("\n", parts);
    }

    private String blockExpression(List<Quoted> exprs) {
        if (exprs.isEmpty()) {
            return "nil";
        }
        if (exprs.size() == 1) {
            return print(exprs.get(0));
        }
        String body = exprs.stream().map(this::print).collect(Collectors.joining("\n"));
        return "(\n  " + indentNewLines(body) + "\n)";
    }

    private String fnToString(List<Quoted> clauses) {
        if (clauses.size() == 1 && isArrow(clauses.get(0))) {
            List<Quoted> arrow = ((Quoted.Call) clauses.get(0)).args();
            Quoted body = arrow.get(1);
            if (!(body instanceof Quoted.Call call && "__block__".equals(call.targetName()))) {
                return "fn " + arrowInline(arrow) + " end";
            }
            return "fn " + clausesToString(clauses) + "\nend";
        }
        return "fn\n  " + indentNewLines(clausesToString(clauses)) + "\nend";
    }

    private String arrowInline(List<Quoted> arrow) {
        return params(arrow.get(0), true) + "-> " + print(arrow.get(1));
    }

    private String params(Quoted params, boolean emptyParens) {
        if (params instanceof Quoted.ListOf list) {
            if (list.elements().isEmpty()) {
                return emptyParens ? "() " : "";
            }
            return join(list.elements()) + " ";
        }
        return print(params) + " ";
    }

    private String aliases(List<Quoted> segments) {
        return segments.stream()
                .map(s -> s instanceof Quoted.Atom a ? a.name() : print(s))
                .collect(Collectors.joining("."));
    }

    private String mapToString(List<Quoted> args) {
        if (args.size() == 1 && args.get(0) instanceof Quoted.Call update
                && "|".equals(update.targetName()) && update.args().size() == 2
                && update.args().get(1) instanceof Quoted.ListOf pairs) {
            return "%{" + print(update.args().get(0)) + " | " + mapPairs(pairs.elements()) + "}";
        }
        return "%{" + mapPairs(args) + "}";
    }

    private String mapPairs(List<Quoted> pairs) {
        if (isKeywordList(pairs)) {
            return keywordsToString(pairs);
        }
        List<String> parts = new ArrayList<>();
        for (Quoted pair : pairs) {
            if (pair instanceof Quoted.Tuple t && t.elements().size() == 2) {
                parts.add(print(t.elements().get(0)) + " => " + print(t.elements().get(1)));
            } else {
                parts.add(print(pair));
            }
        }
        return String.join(", ", parts);
    }

    private String bitstringToString(List<Quoted> segments) {
        List<String> parts = new ArrayList<>();
        for (Quoted segment : segments) {
            if (segment instanceof Quoted.Call c && "::".equals(c.targetName()) && c.args().size() == 2) {
                parts.add(print(c.args().get(0)) + "::" + print(c.args().get(1)));
            } else {
                parts.add(print(segment));
            }
        }
        return "<<" + String.join(", ", parts) + ">>";
    }

    private String attributeToString(Quoted attr) {
        if (attr instanceof Quoted.Var v) {
            return "@" + v.name();
        }
        if (attr instanceof Quoted.Call c && c.targetName() != null) {
            if (c.args().isEmpty()) {
                return "@" + c.targetName();
            }
            return "@" + c.targetName() + " " + join(c.args());
        }
        return "@" + print(attr);
    }

    private String captureToString(Quoted captured) {
        if (captured instanceof Quoted.Int i) {
            return "&" + i.value();
        }
        if (captured instanceof Quoted.Call c && "/".equals(c.targetName()) && c.args().size() == 2) {
            Quoted fun = c.args().get(0);
            String funText = fun instanceof Quoted.Call ref && ref.args().isEmpty() ? calleeText(ref) : print(fun);
            return "&" + funText + "/" + print(c.args().get(1));
        }
        return "&(" + print(captured) + ")";
    }

    private String unaryOperator(String symbol, Quoted operand) {
        String text = print(operand);
        boolean word = symbol.equals("not");
        if (binaryOf(operand) != null || (!word && (isUnaryOperation(operand) || text.startsWith("-") || text.startsWith("+")))) {
            text = "(" + text + ")";
        }
        return word ? "not " + text : symbol + text;
    }

    private static boolean isUnaryOperation(Quoted expr) {
        return expr instanceof Quoted.Call c && c.args().size() == 1 && Operators.isUnary(c.targetName());
    }

    private String binaryOperator(Operators.Binary op, List<Quoted> args) {
        String left = operand(args.get(0), op, false);
        String right = operand(args.get(1), op, true);
        if (op.tight()) {
            return left + op.symbol() + right;
        }
        return left + " " + op.symbol() + " " + right;
    }

    private String operand(Quoted operand, Operators.Binary parent, boolean rightSide) {
        String text = print(operand);
        Operators.Binary child = binaryOf(operand);
        if (child == null) {
            return text;
        }
        boolean weaker = child.precedence() < parent.precedence();
        boolean sameLevelAgainstAssociativity = child.precedence() == parent.precedence()
                && rightSide != parent.rightAssociative();
        return weaker || sameLevelAgainstAssociativity ? "(" + text + ")" : text;
    }

    private static Operators.Binary binaryOf(Quoted expr) {
        if (expr instanceof Quoted.Call c && c.args().size() == 2) {
            return Operators.binary(c.targetName());
        }
        return null;
    }

    private String listToString(List<Quoted> elements) {
        if (isKeywordList(elements)) {
            return "[" + keywordsToString(elements) + "]";
        }
        return "[" + join(elements) + "]";
    }

    private String keywordsToString(List<Quoted> pairs) {
        List<String> parts = new ArrayList<>();
        for (Quoted pair : pairs) {
            Quoted.Tuple t = (Quoted.Tuple) pair;
            String key = ((Quoted.Atom) t.elements().get(0)).name();
            String keyText = PLAIN_NAME.matcher(key).matches() ? key : "\"" + escape(key, '"') + "\"";
            parts.add(keyText + ": " + print(t.elements().get(1)));
        }
        return String.join(", ", parts);
    }

    private String join(List<Quoted> exprs) {
        return exprs.stream().map(this::print).collect(Collectors.joining(", "));
    }

    private static boolean isKeywordList(List<Quoted> elements) {
        if (elements.isEmpty()) {
            return false;
        }
        for (Quoted e : elements) {
            if (!(e instanceof Quoted.Tuple t && t.elements().size() == 2 && t.elements().get(0) instanceof Quoted.Atom)) {
                return false;
            }
        }
        return true;
    }

    private static boolean isBlockKeywords(Quoted expr) {
        if (!(expr instanceof Quoted.ListOf list) || !isKeywordList(list.elements())
                || !"do".equals(keyOf(list.elements().get(0)))) {
            return false;
        }
        for (Quoted e : list.elements()) {
            if (!BLOCK_KEYWORDS.contains(keyOf(e))) {
                return false;
            }
        }
        return true;
    }

    private static String keyOf(Quoted keywordEntry) {
        return ((Quoted.Atom) ((Quoted.Tuple) keywordEntry).elements().get(0)).name();
    }

    private static boolean isArrow(Quoted expr) {
        return expr instanceof Quoted.Call c && "->".equals(c.targetName()) && c.args().size() == 2;
    }

    private static String indentNewLines(String text) {
        return text.replace("\n", "\n  ");
    }

    /**
     * Escapes text for use inside a double-quoted literal.
     */
    static String escape(String text, char quote) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == quote) {
                sb.append('\\').append(c);
                continue;
            }
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                case '\f' -> sb.append("\\f");
                case '\b' -> sb.append("\\b");
                case 0 -> sb.append("\\0");
                case 7 -> sb.append("\\a");
                case 11 -> sb.append("\\v");
                case 27 -> sb.append("\\e");
                case 127 -> sb.append("\\d");
                case '#' -> sb.append(i + 1 < text.length() && text.charAt(i + 1) == '{' ? "\\#" : "#");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\x%02X", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.toString();
    }
}
