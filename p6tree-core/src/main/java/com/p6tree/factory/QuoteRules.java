package com.p6tree.factory;

import com.p6tree.FactoryException;
import com.p6tree.HereDocTable;
import com.p6tree.ast.Element;
import com.p6tree.ast.InterpolatedString;
import com.p6tree.ast.LiteralString;
import com.p6tree.ast.Quoting;
import com.p6tree.ast.Regex;
import com.p6tree.ast.ShellString;
import com.p6tree.ast.StringLiteral;
import com.p6tree.ast.WordListString;
import com.p6tree.match.Match;
import com.p6tree.match.Shape;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Quoting constructs: strings, word lists, shell quotes, regexes and
 * here-documents.
 *
 * <p>A here-document is registered in the build's {@link HereDocTable} as soon as
 * its opener is classified, so that its body, which lies lexically further down,
 * is never mistaken for code when the gaps are filled.</p>
 */
final class QuoteRules extends RuleSet {

    private enum Kind {
        LITERAL,
        INTERPOLATED,
        SHELL,
        WORDS,
        REGEX
    }

    private static final Map<String, Kind> LEXEMES = Map.ofEntries(
        Map.entry("'", Kind.LITERAL),
        Map.entry("q", Kind.LITERAL),
        Map.entry("Q", Kind.LITERAL),
        Map.entry("「", Kind.LITERAL),
        Map.entry("\"", Kind.INTERPOLATED),
        Map.entry("qq", Kind.INTERPOLATED),
        Map.entry("qx", Kind.SHELL),
        Map.entry("qqx", Kind.SHELL),
        Map.entry("Qx", Kind.SHELL),
        Map.entry("qw", Kind.WORDS),
        Map.entry("qqw", Kind.WORDS),
        Map.entry("qww", Kind.WORDS),
        Map.entry("qqww", Kind.WORDS),
        Map.entry("Qw", Kind.WORDS),
        Map.entry("<", Kind.WORDS),
        Map.entry("<<", Kind.WORDS),
        Map.entry("«", Kind.WORDS),
        Map.entry("/", Kind.REGEX),
        Map.entry("rx", Kind.REGEX),
        Map.entry("m", Kind.REGEX),
        Map.entry("s", Kind.REGEX),
        Map.entry("tr", Kind.REGEX)
    );

    private static final Map<Character, Character> CLOSERS = Map.of(
        '(', ')',
        '[', ']',
        '{', '}',
        '<', '>',
        '«', '»',
        '「', '」'
    );

    QuoteRules(Rules rules) {
        super(rules);
    }

    Element quote(Match p) {
        Shape shape = shape(p);
        if (shape.is("nibble") || shape.isBare()) {
            String lexeme = plainLexeme(p);
            Kind kind = kind(lexeme, p);
            if (kind == Kind.REGEX) {
                return adapter.fromMatch((from, to, content) -> new Regex(from, to, content, lexeme), p);
            }
            String open = p.str().substring(0, lexeme.length());
            String close = p.str().substring(p.str().length() - lexeme.length());
            return make(kind, p, new Quoting(lexeme, open, close, List.of(), null));
        }
        if (shape.is("quibble")) {
            Match quibble = p.get("quibble");
            String lexeme = orig.substring(p.from(), quibble.from()).trim();
            return quoted(p, lexeme, quibble);
        }
        if (shape.isOptionally(keys("sym", "quibble"), "rx_adverbs")) {
            return quoted(p, sym(p), p.get("quibble"));
        }
        if (shape.isOptionally(keys("sym", "sibble"), "rx_adverbs")
            || shape.isOptionally(keys("sym", "tribble"), "rx_adverbs")) {
            String lexeme = sym(p);
            return adapter.fromMatch((from, to, content) -> new Regex(from, to, content, lexeme), p);
        }
        throw unhandled("quote", p);
    }

    /** The lexeme of a quote written with delimiters alone: {@code 'a'}, {@code "a"}, {@code /a/}. */
    private String plainLexeme(Match p) {
        String text = p.str();
        if (text.startsWith("<<")) {
            return "<<";
        }
        if (text.isEmpty()) {
            throw unhandled("quote", p);
        }
        return text.substring(0, 1);
    }

    private Kind kind(String lexeme, Match p) {
        Kind kind = LEXEMES.get(lexeme);
        if (kind == null) {
            throw unhandled("quote:" + lexeme, p);
        }
        return kind;
    }

    private Element quoted(Match p, String lexeme, Match quibble) {
        Kind kind = kind(lexeme, p);
        Shape shape = shape(quibble);
        if (!shape.isOptionally(keys(), "babble", "nibble")) {
            throw unhandled("quibble", quibble);
        }
        Match babble = quibble.get("babble");
        List<String> adverbs = babble == null ? List.of() : babble(babble);
        if (kind == Kind.REGEX) {
            return adapter.fromMatch((from, to, content) -> new Regex(from, to, content, lexeme), p);
        }

        int open = skipWhitespace(babble == null ? quibble.from() : babble.to());
        if (open >= p.to()) {
            throw unhandled("quibble", quibble);
        }
        char opener = orig.charAt(open);
        String openText = String.valueOf(opener);
        String closeText = String.valueOf(CLOSERS.getOrDefault(opener, opener));
        if (adverbs.contains("to") || adverbs.contains("heredoc")) {
            Match nibble = quibble.get("nibble");
            String terminator = (nibble != null ? nibble.str() : orig.substring(open + 1, p.to() - 1)).trim();
            Quoting.HereDoc hereDoc = hereDoc(p, terminator);
            return make(kind, p, new Quoting(lexeme, openText, closeText, adverbs, hereDoc));
        }
        return make(kind, p, new Quoting(lexeme, openText, closeText, adverbs, null));
    }

    /** Adverbs of a quote, without their colons: {@code :to}, {@code :x}, {@code :qq}. */
    private List<String> babble(Match p) {
        Shape shape = shape(p);
        if (shape.is("quotepair")) {
            List<String> adverbs = new ArrayList<>();
            for (Match pair : p.getAll("quotepair")) {
                String text = pair.str().trim();
                adverbs.add(text.startsWith(":") ? text.substring(1) : text);
            }
            return adverbs;
        }
        if (shape.isBare()) {
            return List.of();
        }
        throw unhandled("babble", p);
    }

    /**
     * Finds the body of the here-document opened by {@code p}: the lines after the
     * opener's line (and after the bodies of earlier here-documents opened on the
     * same line) up to the line holding only the terminator.
     */
    private Quoting.HereDoc hereDoc(Match p, String terminator) {
        HereDocTable hereDocs = rules.context().hereDocs();
        int newline = orig.indexOf('\n', p.to());
        if (newline < 0) {
            throw new FactoryException("Here-document at " + p.from() + " has no body");
        }
        int bodyFrom = hereDocs.nextBodyStart(newline + 1);
        int lineStart = bodyFrom;
        while (lineStart <= orig.length()) {
            int lineStop = orig.indexOf('\n', lineStart);
            if (lineStop < 0) {
                lineStop = orig.length();
            }
            if (orig.substring(lineStart, lineStop).trim().equals(terminator)) {
                hereDocs.register(p.from(), p.to(), bodyFrom, lineStop, terminator);
                return new Quoting.HereDoc(terminator, bodyFrom, lineStop, orig.substring(bodyFrom, lineStart));
            }
            lineStart = lineStop + 1;
        }
        throw new FactoryException(
            "Here-document at " + p.from() + " is not terminated by '" + terminator + "'");
    }

    private StringLiteral make(Kind kind, Match p, Quoting quoting) {
        switch (kind) {
            case LITERAL:
                return adapter.fromMatch((from, to, content) -> new LiteralString(from, to, content, quoting), p);
            case INTERPOLATED:
                return adapter.fromMatch((from, to, content) -> new InterpolatedString(from, to, content, quoting), p);
            case SHELL:
                return adapter.fromMatch((from, to, content) -> new ShellString(from, to, content, quoting), p);
            case WORDS:
                return adapter.fromMatch((from, to, content) -> new WordListString(from, to, content, quoting), p);
            default:
                throw new IllegalStateException("Not a string quote: " + kind);
        }
    }

    // ========================================================================
    // Word lists
    // ========================================================================

    /** A bracketed word list used as a term: {@code <a b>}, {@code <<a $b>>}, {@code «a b»}. */
    WordListString wordList(Match circumfix) {
        String text = circumfix.str();
        String front = text.startsWith("<<") ? "<<" : text.substring(0, 1);
        String back = front.equals("<<") ? ">>" : String.valueOf(CLOSERS.get(front.charAt(0)));
        Quoting quoting = new Quoting(front, front, back, List.of(), null);
        return adapter.fromMatch((from, to, content) -> new WordListString(from, to, content, quoting), circumfix);
    }

    /** The words inside a subscript such as {@code %h<a b>}; the brackets belong to the subscript. */
    WordListString wordListBody(Match nibble, String lexeme) {
        Quoting quoting = new Quoting(lexeme, "", "", List.of(), null);
        return adapter.fromMatch((from, to, content) -> new WordListString(from, to, content, quoting), nibble);
    }
}
