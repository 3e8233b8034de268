package com.p6tree.ast;

/** {@code NaN}. */
public final class NotANumber extends NumberLiteral {

    public NotANumber(int from, int to, String content) {
        super(from, to, content);
    }

    @Override
    public int base() {
        return 10;
    }
}
