package com.p6tree.ast;

/** A run of whitespace, synthesized while filling gaps. */
public final class WS extends Leaf {

    public WS(int from, int to, String content) {
        super(from, to, content);
    }
}
