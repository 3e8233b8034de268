package com.p6tree.ast;

/** {@code Inf} or {@code ∞}. */
public final class Infinity extends NumberLiteral {

    public Infinity(int from, int to, String content) {
        super(from, to, content);
    }

    @Override
    public int base() {
        return 10;
    }
}
