package com.p6tree;

import com.p6tree.ast.Comment;
import com.p6tree.ast.Element;
import com.p6tree.ast.HereDocBody;
import com.p6tree.ast.Pod;
import com.p6tree.ast.WS;
import com.p6tree.util.TreeLogger;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies source text that no rule claimed: whitespace, comments, Pod and
 * here-document bodies.
 */
public final class GapTokenizer {

    private static final Logger LOGGER = TreeLogger.getLogger(GapTokenizer.class);

    private static final Pattern POD_BEGIN = Pattern.compile("=begin[ \\t]+(\\S+)");
    private static final Pattern POD_DIRECTIVE = Pattern.compile("=[A-Za-z]");
    private static final Pattern POD_FINISH = Pattern.compile("=(?:finish|END)\\b");
    private static final String OPENERS = "([{<«";
    private static final String CLOSERS = ")]}>»";

    private final String orig;
    private final HereDocTable hereDocs;
    private final boolean author;

    public GapTokenizer(String orig, HereDocTable hereDocs, boolean author) {
        this.orig = orig;
        this.hereDocs = hereDocs;
        this.author = author;
    }

    /**
     * Tokenizes {@code [from, to)}. An inverted or negative interval yields no
     * elements.
     */
    public List<Element> tokenize(int from, int to) {
        List<Element> tokens = new ArrayList<>();
        if (from < 0 || to < 0 || from > to || to > orig.length()) {
            if (author) {
                LOGGER.warn("Skipping gap with invalid interval [{}, {})", from, to);
            }
            return tokens;
        }

        int i = from;
        while (i < to) {
            char c = orig.charAt(i);
            HereDocTable.Entry hereDoc = hereDocs.bodyStartingAt(i);
            if (hereDoc != null && hereDoc.bodyTo() <= i) {
                hereDoc = null;
            }
            if (hereDoc != null && hereDoc.bodyFrom() == i) {
                i = addHereDoc(tokens, hereDoc, i, to);
                continue;
            }
            if (Character.isWhitespace(c)) {
                int j = i + 1;
                while (j < to && Character.isWhitespace(orig.charAt(j)) && !hereDocs.isBodyStart(j)) {
                    j++;
                }
                tokens.add(new WS(i, j, orig.substring(i, j)));
                i = j;
                continue;
            }

            if (c == '#') {
                int j = commentEnd(i, to);
                tokens.add(new Comment(i, j, orig.substring(i, j)));
                i = j;
                continue;
            }
            if (c == '=' && isAtLineStart(i)) {
                int j = podEnd(i, to);
                if (j > i) {
                    tokens.add(new Pod(i, j, orig.substring(i, j)));
                    i = j;
                    continue;
                }
            }
            if (hereDoc != null) {
                i = addHereDoc(tokens, hereDoc, i, to);
                continue;
            }

            int j = i;
            while (j < to && !Character.isWhitespace(orig.charAt(j))) {
                j++;
            }
            if (author) {
                LOGGER.warn("Unclassified text '{}' at [{}, {})", orig.substring(i, j), i, j);
            }
            i = j;
        }
        return tokens;
    }

    /**
     * End of the comment, Pod block or here-document body starting at
     * {@code offset}, or {@code offset} itself when source code starts there.
     */
    public int skipNonCode(int offset, int limit) {
        if (offset < 0 || offset >= limit || limit > orig.length()) {
            return offset;
        }
        HereDocTable.Entry hereDoc = hereDocs.bodyStartingAt(offset);
        if (hereDoc != null && hereDoc.bodyFrom() == offset && hereDoc.bodyTo() > offset) {
            return Math.min(hereDoc.bodyTo(), limit);
        }
        char c = orig.charAt(offset);
        if (c == '#') {
            return commentEnd(offset, limit);
        }
        if (c == '=' && isAtLineStart(offset)) {
            return podEnd(offset, limit);
        }
        return offset;
    }

    private int addHereDoc(List<Element> tokens, HereDocTable.Entry hereDoc, int from, int to) {
        int end = Math.min(hereDoc.bodyTo(), to);
        tokens.add(new HereDocBody(from, end, orig.substring(from, end), hereDoc.opener()));
        return end;
    }

    // ========================================================================
    // Comments
    // ========================================================================

    private int commentEnd(int start, int limit) {
        if (start + 2 < limit) {
            char marker = orig.charAt(start + 1);
            int bracket = OPENERS.indexOf(orig.charAt(start + 2));
            if ((marker == '`' || marker == '|' || marker == '=') && bracket >= 0) {
                int end = embeddedEnd(start + 2, OPENERS.charAt(bracket), CLOSERS.charAt(bracket), limit);
                if (end > 0) {
                    return end;
                }
            }
        }
        return lineEnd(start, limit);
    }

    private int embeddedEnd(int open, char opener, char closer, int limit) {
        int depth = 0;
        for (int i = open; i < limit; i++) {
            char c = orig.charAt(i);
            if (c == opener) {
                depth++;
            } else if (c == closer) {
                depth--;
                if (depth == 0) {
                    return i + 1;
                }
            }
        }
        return -1;
    }

    private int lineEnd(int start, int limit) {
        int i = start;
        while (i < limit && orig.charAt(i) != '\n' && orig.charAt(i) != '\r') {
            i++;
        }
        return i;
    }

    // ========================================================================
    // Pod
    // ========================================================================

    private boolean isAtLineStart(int offset) {
        int i = offset - 1;
        while (i >= 0 && (orig.charAt(i) == ' ' || orig.charAt(i) == '\t')) {
            i--;
        }
        return i < 0 || orig.charAt(i) == '\n';
    }

    /** End of the Pod block starting at {@code start}, or {@code start} when there is none. */
    private int podEnd(int start, int limit) {
        String rest = orig.substring(start, limit);
        if (POD_FINISH.matcher(rest).lookingAt()) {
            return limit;
        }
        Matcher begin = POD_BEGIN.matcher(rest);
        if (begin.lookingAt()) {
            Pattern end = Pattern.compile("(?m)^[ \\t]*=end[ \\t]+" + Pattern.quote(begin.group(1)) + "\\b");
            Matcher close = end.matcher(rest);
            if (close.find(begin.end())) {
                return lineEnd(start + close.end(), limit);
            }
            return limit;
        }
        if (POD_DIRECTIVE.matcher(rest).lookingAt()) {
            Matcher blank = Pattern.compile("\\n[ \\t]*(?:\\n|$)").matcher(rest);
            if (blank.find()) {
                return start + blank.start();
            }
            return trimTrailingWhitespace(start, limit);
        }
        return start;
    }

    private int trimTrailingWhitespace(int start, int limit) {
        int end = limit;
        while (end > start && Character.isWhitespace(orig.charAt(end - 1))) {
            end--;
        }
        return end;
    }
}
