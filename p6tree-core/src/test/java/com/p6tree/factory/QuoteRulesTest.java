package com.p6tree.factory;

import com.p6tree.Factory;
import com.p6tree.TestMatches;
import com.p6tree.TestMatches.Node;
import com.p6tree.UnhandledMatchException;
import com.p6tree.ast.Element;
import com.p6tree.ast.InterpolatedString;
import com.p6tree.ast.LiteralString;
import com.p6tree.ast.Regex;
import com.p6tree.ast.ShellString;
import com.p6tree.ast.Statement;
import com.p6tree.ast.StringLiteral;
import com.p6tree.ast.WordListString;
import com.p6tree.match.Match;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Strings, word lists and regexes.
 */
public class QuoteRulesTest {

    private static Element single(TestMatches m, Node term) {
        Statement statement = Builds.statement(m, term);
        assertEquals(1, statement.size(), statement.children().toString());
        return statement.child(0);
    }

    /** A term holding a quote over the whole source. */
    private static Node quoteTerm(TestMatches m, Node quote) {
        return m.node(quote.from(), quote.to()).put("value", m.node(quote.from(), quote.to()).put("quote", quote));
    }

    /** {@code 'abc'}, {@code "abc"}, {@code /abc/}: delimiters around a nibble. */
    private static Node plain(TestMatches m) {
        int to = m.orig().length();
        return quoteTerm(m, m.node(0, to).put("nibble", m.node(1, to - 1)));
    }

    /** {@code q{x}}, {@code qqx/ls/}: a lexeme of {@code lexemeLength} characters, then a delimited nibble. */
    private static Node quibbled(TestMatches m, int lexemeLength) {
        int to = m.orig().length();
        Node quibble = m.node(lexemeLength, to).put("nibble", m.node(lexemeLength + 1, to - 1));
        return quoteTerm(m, m.node(0, to).put("quibble", quibble));
    }

    @Test
    void testSingleQuoted() {
        TestMatches m = TestMatches.of("'abc'");
        LiteralString string = (LiteralString) single(m, plain(m));
        assertEquals("'", string.lexeme());
        assertEquals("'", string.quoting().open());
        assertEquals("'", string.quoting().close());
        assertEquals("abc", string.body());
        assertFalse(string.isInterpolating());
        assertFalse(string.isHereDoc());
        assertTrue(string.adverbs().isEmpty());
    }

    @Test
    void testDoubleQuoted() {
        TestMatches m = TestMatches.of("\"a $x\"");
        InterpolatedString string = (InterpolatedString) single(m, plain(m));
        assertEquals("\"", string.lexeme());
        assertEquals("a $x", string.body());
        assertTrue(string.isInterpolating());
    }

    @Test
    @DisplayName("A slash-delimited quote is a regex")
    void testSlashRegex() {
        TestMatches m = TestMatches.of("/ab+/");
        Regex regex = (Regex) single(m, plain(m));
        assertEquals("/", regex.lexeme());
        assertEquals("/ab+/", regex.content());
    }

    @Test
    @DisplayName("Quoting constructs take their lexeme from the text before the delimiter")
    void testQuotingConstructs() {
        TestMatches q = TestMatches.of("q{x}");
        LiteralString literal = (LiteralString) single(q, quibbled(q, 1));
        assertEquals("q", literal.lexeme());
        assertEquals("{", literal.quoting().open());
        assertEquals("}", literal.quoting().close());
        assertEquals("x", literal.body());

        TestMatches qqx = TestMatches.of("qqx/ls/");
        ShellString shell = (ShellString) single(qqx, quibbled(qqx, 3));
        assertEquals("qqx", shell.lexeme());
        assertEquals("ls", shell.body());
        assertTrue(shell.isInterpolating());

        TestMatches qw = TestMatches.of("qw<a b>");
        WordListString words = (WordListString) single(qw, quibbled(qw, 2));
        assertEquals("qw", words.lexeme());
        assertEquals(">", words.quoting().close());
        assertFalse(words.isInterpolating());
    }

    @Test
    @DisplayName("Adverbs are listed without their colons")
    void testAdverbs() {
        TestMatches m = TestMatches.of("q:x:c[ls]");
        Node babble = m.node(1, 5).put("quotepair", m.node(1, 3)).put("quotepair", m.node(3, 5));
        Node quibble = m.node(1, 9).put("babble", babble).put("nibble", m.node(6, 8));
        StringLiteral string = (StringLiteral) single(m, quoteTerm(m, m.node(0, 9).put("quibble", quibble)));
        assertEquals(List.of("x", "c"), string.adverbs());
        assertEquals("[", string.quoting().open());
        assertEquals("]", string.quoting().close());
        assertEquals("ls", string.body());
    }

    @Test
    void testRegexConstructs() {
        TestMatches rx = TestMatches.of("rx:i/a/");
        Node quote = rx.node(0, 7)
            .put("sym", rx.node("rx"))
            .put("rx_adverbs", rx.node(2, 4))
            .put("quibble", rx.node(4, 7).put("nibble", rx.node(5, 6)));
        Regex regex = (Regex) single(rx, quoteTerm(rx, quote));
        assertEquals("rx", regex.lexeme());
        assertEquals("rx:i/a/", regex.content());

        TestMatches s = TestMatches.of("s/a/b/");
        Node substitution = s.node(0, 6).put("sym", s.node(0, 1)).put("sibble", s.node(1, 6));
        assertEquals("s", ((Regex) single(s, quoteTerm(s, substitution))).lexeme());
    }

    @Test
    @DisplayName("Angle brackets as a term are a word list")
    void testAngleWordList() {
        TestMatches m = TestMatches.of("<a b>");
        Node term = m.node(0, 5).put("circumfix", m.node(0, 5).put("nibble", m.node(1, 4)));
        WordListString words = (WordListString) single(m, term);
        assertEquals("<", words.lexeme());
        assertEquals("a b", words.body());
        assertFalse(words.isInterpolating());

        TestMatches french = TestMatches.of("«a $b»");
        Node quoted = french.node(0, 6).put("circumfix", french.node(0, 6).put("nibble", french.node(1, 5)));
        WordListString interpolating = (WordListString) single(french, quoted);
        assertEquals("»", interpolating.quoting().close());
        assertTrue(interpolating.isInterpolating());
    }

    @Test
    @DisplayName("An unknown quoting construct is unhandled")
    void testUnknownLexeme() {
        TestMatches m = TestMatches.of("zz{x}");
        Match root = m.compUnit(m.statement(quibbled(m, 2)));
        UnhandledMatchException e = assertThrows(UnhandledMatchException.class, () -> new Factory().build(root));
        assertEquals("quote:zz", e.rule());
    }
}
