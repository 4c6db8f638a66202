package org.erl2ex.codegen.backend.unparse;

import org.erl2ex.codegen.ir.expr.Quoted;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.erl2ex.codegen.ir.expr.Quoted.alias;
import static org.erl2ex.codegen.ir.expr.Quoted.atom;
import static org.erl2ex.codegen.ir.expr.Quoted.block;
import static org.erl2ex.codegen.ir.expr.Quoted.call;
import static org.erl2ex.codegen.ir.expr.Quoted.clause;
import static org.erl2ex.codegen.ir.expr.Quoted.flt;
import static org.erl2ex.codegen.ir.expr.Quoted.integer;
import static org.erl2ex.codegen.ir.expr.Quoted.keyword;
import static org.erl2ex.codegen.ir.expr.Quoted.list;
import static org.erl2ex.codegen.ir.expr.Quoted.nil;
import static org.erl2ex.codegen.ir.expr.Quoted.remote;
import static org.erl2ex.codegen.ir.expr.Quoted.string;
import static org.erl2ex.codegen.ir.expr.Quoted.tuple;
import static org.erl2ex.codegen.ir.expr.Quoted.var;

@Tag("unit")
class QuotedPrinterTest {

    private final QuotedPrinter printer = new QuotedPrinter();

    @Test
    void printsAtoms() {
        assertThat(printer.print(atom("ok"))).isEqualTo(":ok");
        assertThat(printer.print(atom("Foo"))).isEqualTo(":Foo");
        assertThat(printer.print(nil())).isEqualTo("nil");
        assertThat(printer.print(atom("true"))).isEqualTo("true");
        assertThat(printer.print(atom("hello world"))).isEqualTo(":\"hello world\"");
    }

    @Test
    void printsNumbers() {
        assertThat(printer.print(integer(-42))).isEqualTo("-42");
        assertThat(printer.print(flt(1.5))).isEqualTo("1.5");
        assertThat(printer.print(flt(1.0e10))).isEqualTo("1.0e10");
    }

    @Test
    void escapesStrings() {
        assertThat(printer.print(string("say \"hi\"\n#{x}"))).isEqualTo("\"say \\\"hi\\\"\\n\\#{x}\"");
        assertThat(printer.print(string("#1"))).isEqualTo("\"#1\"");
    }

    @Test
    void printsListsTuplesAndKeywords() {
        assertThat(printer.print(list(integer(1), integer(2)))).isEqualTo("[1, 2]");
        assertThat(printer.print(list(keyword("a", integer(1)), keyword("b", atom("x"))))).isEqualTo("[a: 1, b: :x]");
        assertThat(printer.print(tuple(integer(1), atom("a")))).isEqualTo("{1, :a}");
        assertThat(printer.print(list(call("|", var("h"), var("t"))))).isEqualTo("[h | t]");
        assertThat(printer.print(list())).isEqualTo("[]");
    }

    @Test
    void printsCalls() {
        assertThat(printer.print(remote(atom("lists"), "reverse", var("l")))).isEqualTo(":lists.reverse(l)");
        assertThat(printer.print(remote(alias("Enum"), "count", var("x")))).isEqualTo("Enum.count(x)");
        assertThat(printer.print(call("foo", integer(1), list(keyword("a", integer(2)))))).isEqualTo("foo(1, a: 2)");
        assertThat(printer.print(call("bar"))).isEqualTo("bar()");
    }

    @Test
    void quotesCallsToNamesThatAreNotIdentifiers() {
        assertThat(printer.print(call("do it", var("x")))).isEqualTo("unquote(:\"do it\")(x)");
    }

    @Test
    void parenthesizesByPrecedenceAndAssociativity() {
        Quoted a = var("a");
        Quoted b = var("b");
        Quoted c = var("c");

        assertThat(printer.print(call("*", call("+", a, b), c))).isEqualTo("(a + b) * c");
        assertThat(printer.print(call("+", a, call("*", b, c)))).isEqualTo("a + b * c");
        assertThat(printer.print(call("-", call("-", a, b), c))).isEqualTo("a - b - c");
        assertThat(printer.print(call("-", a, call("-", b, c)))).isEqualTo("a - (b - c)");
        assertThat(printer.print(call("++", a, call("++", b, c)))).isEqualTo("a ++ b ++ c");
        assertThat(printer.print(call("++", call("++", a, b), c))).isEqualTo("(a ++ b) ++ c");
        assertThat(printer.print(call("..", integer(1), integer(10)))).isEqualTo("1..10");
    }

    @Test
    void printsUnaryOperators() {
        assertThat(printer.print(call("-", var("x")))).isEqualTo("-x");
        assertThat(printer.print(call("not", call("==", var("a"), var("b"))))).isEqualTo("not (a == b)");
        assertThat(printer.print(call("not", call("-", var("x"))))).isEqualTo("not -x");
    }

    @Test
    void separatesNestedSignsFromTheirOperator() {
        assertThat(printer.print(call("-", integer(-1)))).isEqualTo("-(-1)");
        assertThat(printer.print(call("-", flt(-1.5)))).isEqualTo("-(-1.5)");
        assertThat(printer.print(call("-", call("-", var("x"))))).isEqualTo("-(-x)");
        assertThat(printer.print(call("+", call("+", var("x"))))).isEqualTo("+(+x)");
        assertThat(printer.print(call("!", call("!", var("x"))))).isEqualTo("!(!x)");
        assertThat(printer.print(call("-", integer(1)))).isEqualTo("-1");
    }

    @Test
    void printsKeywordBlocksInGivenOrder() {
        Quoted expr = call("if", var("x"), list(keyword("do", atom("a")), keyword("else", atom("b"))));
        Quoted attempt = call("try", list(keyword("do", var("x")), keyword("after", atom("done")), keyword("rescue", var("e"))));

        assertThat(printer.print(expr)).isEqualTo("if(x) do\n  :a\nelse\n  :b\nend");
        assertThat(printer.print(attempt)).isEqualTo("try() do\n  x\nafter\n  :done\nrescue\n  e\nend");
    }

    @Test
    void keepsBlockKeywordsWithoutLeadingDoAsArguments() {
        assertThat(printer.print(call("f", var("x"), list(keyword("else", integer(1)))))).isEqualTo("f(x, else: 1)");
        assertThat(printer.print(call("g", list(keyword("after", var("t")))))).isEqualTo("g(after: t)");
        assertThat(printer.print(call("if", var("x"), list(keyword("else", atom("b")), keyword("do", atom("a"))))))
                .isEqualTo("if(x, else: :b, do: :a)");
    }

    @Test
    void printsClausesInsideBlocks() {
        Quoted expr = call("case", var("x"), list(keyword("do", list(
                clause(List.of(integer(1)), atom("a")),
                clause(List.of(var("_")), atom("b"))))));

        assertThat(printer.print(expr)).isEqualTo("case(x) do\n  1 ->\n    :a\n  _ ->\n    :b\nend");
    }

    @Test
    void printsAnonymousFunctions() {
        assertThat(printer.print(call("fn", clause(List.of(var("x")), call("+", var("x"), integer(1))))))
                .isEqualTo("fn x -> x + 1 end");
        assertThat(printer.print(call("fn",
                clause(List.of(integer(0)), atom("zero")),
                clause(List.of(var("_")), atom("other")))))
                .isEqualTo("fn\n  0 ->\n    :zero\n  _ ->\n    :other\nend");
    }

    @Test
    void printsMapsAndBinaries() {
        assertThat(printer.print(call("%{}", tuple(string("k"), integer(1))))).isEqualTo("%{\"k\" => 1}");
        assertThat(printer.print(call("%{}", keyword("a", integer(1))))).isEqualTo("%{a: 1}");
        assertThat(printer.print(call("%{}", call("|", var("m"), list(keyword("a", integer(2)))))))
                .isEqualTo("%{m | a: 2}");
        assertThat(printer.print(call("<<>>", var("x"), call("::", var("y"), call("size", integer(8))))))
                .isEqualTo("<<x, y::size(8)>>");
    }

    @Test
    void printsCapturesAndAttributes() {
        assertThat(printer.print(call("&", integer(1)))).isEqualTo("&1");
        assertThat(printer.print(call("&", call("/", call("foo"), integer(2))))).isEqualTo("&foo/2");
        assertThat(printer.print(call("&", call("/", remote(atom("lists"), "map"), integer(2))))).isEqualTo("&:lists.map/2");
        assertThat(printer.print(call("&", call("is_nil", call("&", integer(1)))))).isEqualTo("&(is_nil(&1))");
        assertThat(printer.print(call("@", var("foo")))).isEqualTo("@foo");
        assertThat(printer.print(call("@", call("doc", string("x"))))).isEqualTo("@doc \"x\"");
    }

    @Test
    void printsAnonymousFunctionCalls() {
        Quoted anonymous = new Quoted.Call(call(".", var("f")), Map.of(), List.of(var("x")));

        assertThat(printer.print(anonymous)).isEqualTo("f.(x)");
    }

    @Test
    void printsBlocksAndGuards() {
        assertThat(printer.print(block(var("a"), var("b")))).isEqualTo("(\n  a\n  b\n)");
        assertThat(printer.print(call("when", call("f", var("x")), call(">", var("x"), integer(0)))))
                .isEqualTo("f(x) when x > 0");
    }

    @Test
    void hookSeesEveryNode() {
        QuotedPrinter upper = new QuotedPrinter((node, text) -> node instanceof Quoted.Var ? text.toUpperCase() : text);

        assertThat(upper.print(call("+", var("x"), integer(1)))).isEqualTo("X + 1");
    }
}
