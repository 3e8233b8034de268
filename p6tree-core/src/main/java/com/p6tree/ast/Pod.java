package com.p6tree.ast;

/** A Pod block found between statements. */
public final class Pod extends Leaf {

    public Pod(int from, int to, String content) {
        super(from, to, content);
    }
}
