package com.p6tree.factory;

import com.p6tree.Factory;
import com.p6tree.FactoryException;
import com.p6tree.TestMatches;
import com.p6tree.TestMatches.Node;
import com.p6tree.UnhandledMatchException;
import com.p6tree.ast.Operator;
import com.p6tree.ast.Statement;
import com.p6tree.ast.WordListString;
import com.p6tree.match.Match;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.p6tree.TreeAssertions.childTypes;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Operators, brackets, calls and pairs. Operator expressions flatten into
 * siblings of the statement.
 */
public class ExpressionRulesTest {

    /** A single-semicolon-free statement holding {@code expr}. */
    private static Node statementOf(TestMatches m, Node expr) {
        return m.statement(expr);
    }

    /** {@code semilist{statement{EXPR}}} over {@code expr}. */
    private static Node semilist(TestMatches m, Node expr) {
        return m.node(expr.from(), expr.to()).put("statement", statementOf(m, expr));
    }

    @Test
    @DisplayName("Nested binary operators flatten in source order")
    void testBinaryOperators() {
        TestMatches m = TestMatches.of("1 + 2 * 3");
        Node product = m.infix("*", m.decimal("2"), m.decimal("3"));
        Statement statement = Builds.statement(m, m.infix("+", m.decimal("1"), product));

        assertEquals(List.of("DecimalNumber", "WS", "Operator.Infix", "WS", "DecimalNumber", "WS",
            "Operator.Infix", "WS", "DecimalNumber"), childTypes(statement));
        assertEquals("+", statement.child(2).text());
        assertEquals(6, statement.child(6).from());
    }

    @Test
    @DisplayName("Every comma of a list is located")
    void testList() {
        TestMatches m = TestMatches.of("1, 2, 3");
        Statement statement = Builds.statement(m, m.infix(",", m.decimal("1"), m.decimal("2"), m.decimal("3")));

        assertEquals(List.of("DecimalNumber", "Operator.Infix", "WS", "DecimalNumber", "Operator.Infix", "WS",
            "DecimalNumber"), childTypes(statement));
        assertEquals(1, statement.child(1).from());
        assertEquals(4, statement.child(4).from());
    }

    @Test
    @DisplayName("An operator comes from its capture, not from a comment that mentions it")
    void testOperatorAfterCommentMentioningIt() {
        TestMatches m = TestMatches.of("1 # first, item\n, 2;");
        Node expr = m.node(0, 19).put("infix", m.node(16, 17)).put("OPER", m.node(16, 17))
            .add(m.decimal("1")).add(m.decimal("2"));
        Statement statement = Builds.statement(m, expr);

        assertEquals(List.of("DecimalNumber", "WS", "Comment", "WS", "Operator.Infix", "WS", "DecimalNumber",
            "Semicolon"), childTypes(statement));
        assertEquals("# first, item", statement.child(2).text());
        assertEquals(16, statement.child(4).from());
    }

    @Test
    @DisplayName("Operators without a capture of their own skip comments too")
    void testLocatedOperatorSkipsComment() {
        TestMatches m = TestMatches.of("1, 2 # x, y\n, 3");
        Statement statement = Builds.statement(m, m.infix(",", m.decimal("1"), m.decimal("2"), m.decimal("3")));

        assertEquals(List.of("DecimalNumber", "Operator.Infix", "WS", "DecimalNumber", "WS", "Comment", "WS",
            "Operator.Infix", "WS", "DecimalNumber"), childTypes(statement));
        assertEquals(1, statement.child(1).from());
        assertEquals(12, statement.child(7).from());
    }

    @Test
    void testTernary() {
        TestMatches m = TestMatches.of("$a ?? 1 !! 2");
        Node infix = m.node(3, 10).put("EXPR", m.decimal("1"));
        Node expr = m.node(0, 12).put("infix", infix).put("OPER", m.node(3, 10))
            .add(m.variable("$a")).add(m.decimal("2"));
        Statement statement = Builds.statement(m, expr);

        assertEquals(List.of("Variable", "WS", "Operator.Infix", "WS", "DecimalNumber", "WS", "Operator.Infix", "WS",
            "DecimalNumber"), childTypes(statement));
        assertEquals("??", statement.child(2).text());
        assertEquals("!!", statement.child(6).text());
    }

    @Test
    @DisplayName("A ternary without its second half cannot be located")
    void testTernaryMissingElse() {
        TestMatches m = TestMatches.of("$a ?? 1 :: 2");
        Node infix = m.node(3, 10).put("EXPR", m.decimal("1"));
        Node expr = m.node(0, 12).put("infix", infix).put("OPER", m.node(3, 10))
            .add(m.variable("$a")).add(m.decimal("2"));
        Match root = m.compUnit(m.statement(expr));

        FactoryException e = assertThrows(FactoryException.class, () -> new Factory().build(root));
        assertTrue(e.getMessage().contains("!!"), e.getMessage());
    }

    @Test
    void testPrefixAndPostfix() {
        TestMatches negate = TestMatches.of("-$x");
        Node prefix = negate.node(0, 3).put("prefix", negate.node(0, 1)).put("OPER", negate.node(0, 1))
            .add(negate.variable("$x"));
        assertEquals(List.of("Operator.Prefix", "Variable"), childTypes(Builds.statement(negate, prefix)));

        TestMatches increment = TestMatches.of("$i++");
        Node postfix = increment.node(0, 4).put("postfix", increment.node(2, 4)).put("OPER", increment.node(2, 4))
            .add(increment.variable("$i"));
        Statement statement = Builds.statement(increment, postfix);
        assertEquals(List.of("Variable", "Operator.Postfix"), childTypes(statement));
        assertEquals("++", statement.child(1).text());
    }

    @Test
    void testHyperAndReduction() {
        TestMatches hyper = TestMatches.of("@a >>+<< @b");
        Node expr = hyper.node(0, 11)
            .put("infix_circumfix_meta_operator", hyper.node(3, 8))
            .put("OPER", hyper.node(3, 8))
            .add(hyper.variable("@a")).add(hyper.variable("@b"));
        Statement statement = Builds.statement(hyper, expr);
        assertEquals(List.of("Variable", "WS", "Operator.Hyper", "WS", "Variable"), childTypes(statement));
        assertEquals(">>+<<", statement.child(2).text());

        TestMatches sum = TestMatches.of("[+] @a");
        Node reduction = sum.node(0, 6)
            .put("prefix_circumfix_meta_operator", sum.node(0, 3))
            .put("OPER", sum.node(0, 3))
            .add(sum.variable("@a"));
        assertEquals(List.of("Operator.Prefix", "WS", "Variable"), childTypes(Builds.statement(sum, reduction)));
    }

    @Test
    @DisplayName("Subscripts attach to the preceding term")
    void testSubscript() {
        TestMatches m = TestMatches.of("@a[0]");
        Node postcircumfix = m.node(2, 5).put("semilist", semilist(m, m.decimal("0")));
        Node expr = m.node(0, 5).put("postcircumfix", postcircumfix).put("OPER", m.node(2, 5)).add(m.variable("@a"));
        Statement statement = Builds.statement(m, expr);

        assertEquals(List.of("Variable", "Operator.PostCircumfix"), childTypes(statement));
        assertEquals(List.of("Balanced.Enter", "DecimalNumber", "Balanced.Exit"), childTypes(statement.child(1)));
    }

    @Test
    @DisplayName("A word-list subscript keeps its brackets outside the words")
    void testWordListSubscript() {
        TestMatches m = TestMatches.of("%h<a b>");
        Node postcircumfix = m.node(2, 7).put("nibble", m.node(3, 6));
        Node expr = m.node(0, 7).put("postcircumfix", postcircumfix).put("OPER", m.node(2, 7)).add(m.variable("%h"));
        Statement statement = Builds.statement(m, expr);

        Operator.PostCircumfix subscript = (Operator.PostCircumfix) statement.child(1);
        assertEquals(List.of("Balanced.Enter", "WordListString", "Balanced.Exit"), childTypes(subscript));
        WordListString words = (WordListString) subscript.child(1);
        assertEquals("a b", words.content());
        assertEquals("<", words.lexeme());
        assertEquals("", words.quoting().open());
        assertEquals("a b", words.body());
    }

    @Test
    @DisplayName("A method call is a dot, a name and its arguments")
    void testMethodCall() {
        TestMatches m = TestMatches.of("$obj.say(1)");
        Node args = m.node(8, 11).put("semiarglist",
            m.node(9, 10).put("arglist", m.node(9, 10).put("EXPR", m.decimal("1"))));
        Node methodop = m.node(5, 11).put("longname", m.node("say")).put("args", args);
        Node dotty = m.node(4, 11).put("sym", m.node(".")).put("dottyop", m.node(5, 11).put("methodop", methodop));
        Node expr = m.node(0, 11).put("dotty", dotty).put("OPER", m.node(4, 11)).add(m.variable("$obj"));
        Statement statement = Builds.statement(m, expr);

        assertEquals(List.of("Variable", "Operator.Infix", "Bareword", "Operator.PostCircumfix"), childTypes(statement));
        assertEquals(List.of("Balanced.Enter", "DecimalNumber", "Balanced.Exit"), childTypes(statement.child(3)));
    }

    @Test
    @DisplayName("Parenthesized call arguments")
    void testCallWithArguments() {
        TestMatches m = TestMatches.of("say(1, 2)");
        Node list = m.infix(",", m.decimal("1"), m.decimal("2"));
        Node args = m.node(3, 9).put("semiarglist", m.node(4, 8).put("arglist", m.node(4, 8).put("EXPR", list)));
        Statement statement = Builds.statement(m, m.identifier("say", args));

        assertEquals(List.of("Bareword", "Operator.PostCircumfix"), childTypes(statement));
        assertEquals(List.of("Balanced.Enter", "DecimalNumber", "Operator.Infix", "WS", "DecimalNumber",
            "Balanced.Exit"), childTypes(statement.child(1)));
    }

    @Test
    void testFatArrow() {
        TestMatches m = TestMatches.of("a => 1");
        Node term = m.node(0, 6).put("fatarrow", m.node(0, 6).put("key", m.node(0, 1)).put("val", m.decimal("1")));
        Statement statement = Builds.statement(m, term);

        assertEquals(List.of("Bareword", "WS", "Operator.Infix", "WS", "DecimalNumber"), childTypes(statement));
        assertEquals("=>", statement.child(2).text());
    }

    @Test
    @DisplayName("Colon pairs: adverbs, adverbs with values and variables")
    void testColonPairs() {
        TestMatches flag = TestMatches.of(":foo");
        Node adverb = flag.node(0, 4).put("colonpair", flag.node(0, 4).put("identifier", flag.node(1, 4)));
        assertEquals(List.of("Adverb"), childTypes(Builds.statement(flag, adverb)));

        TestMatches valued = TestMatches.of(":foo(1)");
        Node circumfix = valued.node(4, 7).put("semilist", semilist(valued, valued.decimal("1")));
        Node colonpair = valued.node(0, 7)
            .put("identifier", valued.node(1, 4))
            .put("coloncircumfix", valued.node(4, 7).put("circumfix", circumfix));
        Statement statement = Builds.statement(valued, valued.node(0, 7).put("colonpair", colonpair));
        assertEquals(List.of("Adverb", "Operator.Circumfix"), childTypes(statement));
        assertEquals(":foo", statement.child(0).text());

        TestMatches variable = TestMatches.of(":$x");
        Node var = variable.node(0, 3).put("colonpair",
            variable.node(0, 3).put("var", variable.variableMatch(variable.node("$x"))));
        assertEquals(List.of("Operator.Prefix", "Variable"), childTypes(Builds.statement(variable, var)));
    }

    @Test
    @DisplayName("The opening bracket decides what a circumfix becomes")
    void testCircumfix() {
        TestMatches parens = TestMatches.of("(1)");
        Node grouped = parens.node(0, 3).put("circumfix",
            parens.node(0, 3).put("semilist", semilist(parens, parens.decimal("1"))));
        assertEquals(List.of("Operator.Circumfix"), childTypes(Builds.statement(parens, grouped)));

        TestMatches array = TestMatches.of("[]");
        Node empty = array.node(0, 2).put("circumfix", array.node(0, 2));
        Statement statement = Builds.statement(array, empty);
        assertEquals(List.of("Balanced.Enter", "Balanced.Exit"), childTypes(statement.child(0)));

        TestMatches braces = TestMatches.of("{ }");
        Node block = braces.node(0, 3).put("circumfix", braces.node(0, 3));
        Statement blockStatement = Builds.statement(braces, block);
        assertEquals(List.of("Block"), childTypes(blockStatement));
        assertEquals(List.of("Balanced.Enter", "WS", "Balanced.Exit"), childTypes(blockStatement.child(0)));
    }

    @Test
    @DisplayName("Bare terms are barewords")
    void testBareTerm() {
        TestMatches m = TestMatches.of("self");
        Statement statement = Builds.statement(m, m.node(0, 4));
        assertEquals(List.of("Bareword"), childTypes(statement));
    }

    @Test
    @DisplayName("Qualified and capitalized names are package names")
    void testLongnames() {
        TestMatches qualified = TestMatches.of("Foo::Bar");
        Node term = qualified.node(0, 8).put("longname", qualified.node(0, 8));
        assertEquals(List.of("PackageName"), childTypes(Builds.statement(qualified, term)));

        TestMatches lower = TestMatches.of("foo::bar");
        Node lowerTerm = lower.node(0, 8).put("longname", lower.node(0, 8));
        assertEquals(List.of("PackageName"), childTypes(Builds.statement(lower, lowerTerm)));

        TestMatches plain = TestMatches.of("foo");
        Node plainTerm = plain.node(0, 3).put("longname", plain.node(0, 3));
        assertEquals(List.of("Bareword"), childTypes(Builds.statement(plain, plainTerm)));
    }

    @Test
    @DisplayName("A unary operator with two operands is unhandled")
    void testUnaryWithTwoOperands() {
        TestMatches m = TestMatches.of("-1 2");
        Node expr = m.node(0, 4).put("prefix", m.node(0, 1)).put("OPER", m.node(0, 1))
            .add(m.decimal("1")).add(m.decimal("2"));
        Match root = m.compUnit(m.statement(expr));

        UnhandledMatchException e = assertThrows(UnhandledMatchException.class, () -> new Factory().build(root));
        assertEquals("EXPR:prefix", e.rule());
    }
}
