package com.p6tree.ast;

/**
 * The body of a here-document.
 *
 * <p>The body sits lexically after the statement that opened it, so it shows up
 * as a gap between two unrelated elements. This node fills that gap to keep the
 * source range complete; it does not belong to the statement it sits in and
 * reports {@link #isSemantic()} as false.</p>
 */
public final class HereDocBody extends Leaf {

    private final int opener;

    public HereDocBody(int from, int to, String content, int opener) {
        super(from, to, content);
        this.opener = opener;
    }

    /** Offset of the quote that opened this here-document. */
    public int opener() {
        return opener;
    }

    @Override
    public boolean isSemantic() {
        return false;
    }
}
