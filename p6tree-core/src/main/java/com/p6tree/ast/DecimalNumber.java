package com.p6tree.ast;

/** {@code 42}, {@code 1_000}, {@code 3.14}. */
public final class DecimalNumber extends NumberLiteral {

    public DecimalNumber(int from, int to, String content) {
        super(from, to, content);
    }

    @Override
    public int base() {
        return 10;
    }
}
