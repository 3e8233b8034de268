package com.p6tree.factory;

import com.p6tree.FactoryException;
import com.p6tree.GapTokenizer;
import com.p6tree.HereDocTable;
import com.p6tree.ast.Balanced;
import com.p6tree.ast.Contextualizer;
import com.p6tree.ast.Element;
import com.p6tree.match.Match;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns matches and source offsets into elements.
 *
 * <p>Every element a rule creates goes through here, so no element keeps a
 * reference to a match and origin stamping happens in one place.</p>
 */
public final class MatchAdapter {

    /** Constructor of a content-bearing element. */
    @FunctionalInterface
    public interface LeafMaker<T extends Element> {
        T make(int from, int to, String content);
    }

    /** Constructor of an element with children. */
    @FunctionalInterface
    public interface BranchMaker<T extends Element> {
        T make(int from, int to, List<Element> children);
    }

    private static final StackWalker WALKER = StackWalker.getInstance();
    private static final String RULE_PACKAGE = "com.p6tree.factory.";

    private final String orig;
    private final boolean recordOrigin;
    private final GapTokenizer gaps;

    public MatchAdapter(String orig, boolean recordOrigin) {
        this(orig, recordOrigin, new GapTokenizer(orig, new HereDocTable(), false));
    }

    /**
     * @param gaps tokenizer whose comments, Pod and here-document bodies
     *             {@code find} steps over
     */
    public MatchAdapter(String orig, boolean recordOrigin, GapTokenizer gaps) {
        this.orig = orig;
        this.recordOrigin = recordOrigin;
        this.gaps = gaps;
    }

    public String orig() {
        return orig;
    }

    // ========================================================================
    // Leaves
    // ========================================================================

    /** An element covering exactly the match. */
    public <T extends Element> T fromMatch(LeafMaker<T> maker, Match match) {
        return fromRange(maker, match.from(), match.to());
    }

    /** An element covering the match without its surrounding whitespace. */
    public <T extends Element> T fromMatchTrimmed(LeafMaker<T> maker, Match match) {
        int from = match.from();
        int to = match.to();
        while (from < to && Character.isWhitespace(orig.charAt(from))) {
            from++;
        }
        while (to > from && Character.isWhitespace(orig.charAt(to - 1))) {
            to--;
        }
        return fromRange(maker, from, to);
    }

    /** An element for {@code literal} placed at {@code offset}, not backed by a match. */
    public <T extends Element> T fromInt(LeafMaker<T> maker, int offset, String literal) {
        return stamp(maker.make(offset, offset + literal.length(), literal));
    }

    /** An element covering {@code [from, to)} of the source. */
    public <T extends Element> T fromRange(LeafMaker<T> maker, int from, int to) {
        return stamp(maker.make(from, to, orig.substring(from, to)));
    }

    /**
     * An element covering the first occurrence of {@code token} within the match,
     * or null when the match does not contain it.
     */
    public <T extends Element> T fromSample(LeafMaker<T> maker, Match match, String token) {
        return find(maker, match.from(), match.to(), token);
    }

    /**
     * The first occurrence of {@code token} in {@code [from, to)} outside comments,
     * Pod and here-document bodies, or null.
     */
    public <T extends Element> T find(LeafMaker<T> maker, int from, int to, String token) {
        if (from < 0 || to > orig.length() || from > to || token.isEmpty()) {
            return null;
        }
        int i = from;
        while (i + token.length() <= to) {
            int code = gaps.skipNonCode(i, to);
            if (code > i) {
                i = code;
            } else if (orig.startsWith(token, i)) {
                return fromInt(maker, i, token);
            } else {
                i++;
            }
        }
        return null;
    }

    /**
     * The first non-empty match of {@code pattern} in {@code [from, to)} that starts
     * outside comments, Pod and here-document bodies, or null.
     */
    public <T extends Element> T find(LeafMaker<T> maker, int from, int to, Pattern pattern) {
        if (from < 0 || to > orig.length() || from > to) {
            return null;
        }
        Matcher matcher = pattern.matcher(orig);
        matcher.useTransparentBounds(true);
        int i = from;
        while (i < to) {
            int code = gaps.skipNonCode(i, to);
            if (code > i) {
                i = code;
                continue;
            }
            matcher.region(i, to);
            if (matcher.lookingAt() && matcher.end() > matcher.start()) {
                return fromRange(maker, matcher.start(), matcher.end());
            }
            i++;
        }
        return null;
    }

    // ========================================================================
    // Branches
    // ========================================================================

    /**
     * A branch spanning its children; {@code [from, to)} is used when there are none.
     */
    public <T extends Element> T branch(BranchMaker<T> maker, List<Element> children, int from, int to) {
        if (children.isEmpty()) {
            return stamp(maker.make(from, to, children));
        }
        Element last = children.get(children.size() - 1);
        int end = last.to();
        if (last instanceof Contextualizer contextualizer) {
            end = contextualizer.extent();
        }
        return stamp(maker.make(children.get(0).from(), end, children));
    }

    /**
     * {@code [Enter, ...children, Exit]} where the delimiters are the first and last
     * characters of the match.
     */
    public <T extends Element> T balanced(BranchMaker<T> maker, Match match, List<Element> children) {
        return balanced(maker, match.from(), match.to(), children);
    }

    /** As {@link #balanced(BranchMaker, Match, List)} for a bare range. */
    public <T extends Element> T balanced(BranchMaker<T> maker, int from, int to, List<Element> children) {
        return balanced(maker, from, to, orig.substring(from, from + 1), orig.substring(to - 1, to), children);
    }

    /**
     * {@code [Enter, ...children, Exit]} with explicit delimiters at the edges of the
     * match, for delimiters longer than one character such as {@code <<} and
     * {@code >>}.
     */
    public <T extends Element> T balanced(BranchMaker<T> maker, Match match, String front, String back,
                                          List<Element> children) {
        return balanced(maker, match.from(), match.to(), front, back, children);
    }

    public <T extends Element> T balanced(BranchMaker<T> maker, int from, int to, String front, String back,
                                          List<Element> children) {
        List<Element> all = new ArrayList<>(children.size() + 2);
        all.add(fromInt(Balanced.Enter::new, from, front));
        all.addAll(children);
        all.add(fromInt(Balanced.Exit::new, to - back.length(), back));
        return stamp(maker.make(from, to, all));
    }

    /**
     * {@code [Enter, ...children, Exit]} for a match that excludes its delimiters:
     * the nearest non-whitespace character before the match opens it and the
     * nearest one after closes it.
     *
     * @throws FactoryException if the match touches either end of the source
     */
    public <T extends Element> T balancedOuter(BranchMaker<T> maker, Match match, List<Element> children) {
        int open = match.from() - 1;
        while (open >= 0 && Character.isWhitespace(orig.charAt(open))) {
            open--;
        }
        int close = match.to();
        while (close < orig.length() && Character.isWhitespace(orig.charAt(close))) {
            close++;
        }
        if (open < 0 || close >= orig.length()) {
            throw new FactoryException(
                "No delimiters around [" + match.from() + ", " + match.to() + ")");
        }
        return balanced(maker, open, close + 1, children);
    }

    // ========================================================================
    // Origin
    // ========================================================================

    public <T extends Element> T stamp(T element) {
        if (recordOrigin && element.origin() == null) {
            element.setOrigin(callingRule());
        }
        return element;
    }

    private static String callingRule() {
        return WALKER.walk(frames -> frames
            .filter(frame -> frame.getClassName().startsWith(RULE_PACKAGE)
                && !frame.getClassName().equals(MatchAdapter.class.getName())
                && !frame.getClassName().equals(RuleSet.class.getName()))
            .findFirst()
            .map(frame -> simpleName(frame.getClassName()) + "." + frame.getMethodName() + ":" + frame.getLineNumber())
            .orElse(null));
    }

    private static String simpleName(String className) {
        String name = className.substring(className.lastIndexOf('.') + 1);
        int nested = name.indexOf('$');
        return nested < 0 ? name : name.substring(0, nested);
    }
}
