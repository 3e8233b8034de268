package com.p6tree.ast;

/** The key of a colon pair, e.g. {@code :foo} or {@code :!foo}. */
public final class ColonBareword extends Leaf {

    public ColonBareword(int from, int to, String content) {
        super(from, to, content);
    }
}
