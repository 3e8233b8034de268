package com.p6tree.factory;

import com.p6tree.FactoryException;
import com.p6tree.UnhandledMatchException;
import com.p6tree.ast.Contextualizer;
import com.p6tree.ast.Element;
import com.p6tree.match.Match;
import com.p6tree.match.Shape;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Common ground for the rule families. Each family handles a group of grammar
 * productions and reaches the others through {@link Rules}.
 */
abstract class RuleSet {

    protected final Rules rules;
    protected final MatchAdapter adapter;
    protected final String orig;

    RuleSet(Rules rules) {
        this.rules = rules;
        this.adapter = rules.adapter();
        this.orig = rules.context().orig();
    }

    protected static Shape shape(Match match) {
        return Shape.of(match);
    }

    protected static String[] keys(String... keys) {
        return keys;
    }

    /** The failure every rule ends in when no shape matched. */
    protected static UnhandledMatchException unhandled(String rule, Match match) {
        Shape shape = Shape.of(match);
        return new UnhandledMatchException(rule, match.from(), match.str(), shape.contentKeys(), shape.emptyKeys());
    }

    /** Text of the {@code sym} capture, or empty. */
    protected static String sym(Match match) {
        Match sym = match.get("sym");
        return sym == null ? "" : sym.str();
    }

    /** Where the source covered by the last element of {@code elements} ends. */
    protected static int end(List<Element> elements, int fallback) {
        if (elements.isEmpty()) {
            return fallback;
        }
        Element last = elements.get(elements.size() - 1);
        return last instanceof Contextualizer contextualizer ? contextualizer.extent() : last.to();
    }

    protected static int start(List<Element> elements, int fallback) {
        return elements.isEmpty() ? fallback : elements.get(0).from();
    }

    /**
     * Locates {@code token} in the source between two already built elements. The
     * grammar does not capture every keyword and separator, so these are found in
     * the text the surrounding captures leave uncovered.
     */
    protected <T extends Element> T locate(MatchAdapter.LeafMaker<T> maker, int from, int to, String token) {
        T element = adapter.find(maker, from, to, token);
        if (element == null) {
            throw new FactoryException(
                "Expected '" + token + "' between " + from + " and " + to
                    + " but found '" + excerpt(from, to) + "'");
        }
        return element;
    }

    protected <T extends Element> T locate(MatchAdapter.LeafMaker<T> maker, int from, int to, Pattern pattern) {
        T element = adapter.find(maker, from, to, pattern);
        if (element == null) {
            throw new FactoryException(
                "Expected " + pattern.pattern() + " between " + from + " and " + to
                    + " but found '" + excerpt(from, to) + "'");
        }
        return element;
    }

    /** Offset of the first non-whitespace character at or after {@code offset}. */
    protected int skipWhitespace(int offset) {
        int i = offset;
        while (i < orig.length() && Character.isWhitespace(orig.charAt(i))) {
            i++;
        }
        return i;
    }

    /**
     * Offset of the first character at or after {@code offset} that is neither
     * whitespace nor part of a comment or Pod block. Stops at {@code limit} and at
     * here-document bodies.
     */
    protected int skipWhitespaceAndComments(int offset, int limit) {
        BuildContext context = rules.context();
        int i = offset;
        while (i < limit && !context.hereDocs().isInsideBody(i)) {
            if (Character.isWhitespace(orig.charAt(i))) {
                i++;
                continue;
            }
            int code = context.gaps().skipNonCode(i, limit);
            if (code == i) {
                break;
            }
            i = code;
        }
        return i;
    }

    /** Offset just past the last non-whitespace character before {@code offset}. */
    protected int skipWhitespaceBack(int offset) {
        int i = offset;
        while (i > 0 && Character.isWhitespace(orig.charAt(i - 1))) {
            i--;
        }
        return i;
    }

    private String excerpt(int from, int to) {
        if (from < 0 || to > orig.length() || from > to) {
            return "";
        }
        return orig.substring(from, to).replace("\n", "\\n");
    }
}
