package com.p6tree.ast;

import java.util.List;

/**
 * Base of the string elements. For a here-document the element covers only the
 * opening quote (e.g. {@code q:to/END/}); the body is reachable through
 * {@link #hereDoc()} and is represented in the tree by a {@link HereDocBody}.
 */
public abstract class StringLiteral extends Leaf {

    private final Quoting quoting;

    protected StringLiteral(int from, int to, String content, Quoting quoting) {
        super(from, to, content);
        this.quoting = quoting;
    }

    public Quoting quoting() {
        return quoting;
    }

    public String lexeme() {
        return quoting.lexeme();
    }

    public List<String> adverbs() {
        return quoting.adverbs();
    }

    public boolean isHereDoc() {
        return quoting.isHereDoc();
    }

    public Quoting.HereDoc hereDoc() {
        return quoting.hereDoc();
    }

    /** True when variables and closures are interpolated into the string. */
    public abstract boolean isInterpolating();

    /**
     * The text between the delimiters, or the here-document body.
     */
    public String body() {
        if (quoting.isHereDoc()) {
            return quoting.hereDoc().body();
        }
        String text = content();
        int start = text.length() - quoting.close().length();
        int open = text.indexOf(quoting.open());
        if (open < 0 || start < open + quoting.open().length()) {
            return "";
        }
        return text.substring(open + quoting.open().length(), start);
    }
}
