package com.p6tree.ast;

/** An identifier used as a keyword, function or method name. */
public final class Bareword extends Leaf {

    public Bareword(int from, int to, String content) {
        super(from, to, content);
    }
}
