package com.p6tree.ast;

/** {@code 0o17}. */
public final class OctalNumber extends NumberLiteral {

    public OctalNumber(int from, int to, String content) {
        super(from, to, content);
    }

    @Override
    public int base() {
        return 8;
    }
}
