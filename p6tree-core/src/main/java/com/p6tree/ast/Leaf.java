package com.p6tree.ast;

/**
 * An atomic token. Its content is the exact source slice it covers.
 */
public abstract non-sealed class Leaf extends Element {

    private final String content;

    protected Leaf(int from, int to, String content) {
        super(from, to);
        if (content == null || content.length() != to - from) {
            throw new IllegalArgumentException(
                "Content '" + content + "' does not cover [" + from + ", " + to + ")");
        }
        this.content = content;
    }

    public String content() {
        return content;
    }

    @Override
    public String text() {
        return content;
    }

    @Override
    public boolean isLeaf() {
        return true;
    }

    @Override
    public String toString() {
        return type() + "(" + from + ", " + to + ", '" + content + "')";
    }
}
