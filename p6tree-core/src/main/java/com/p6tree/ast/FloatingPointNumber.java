package com.p6tree.ast;

/** A number with an exponent, e.g. {@code 1e10} or {@code 2.5E-3}. */
public final class FloatingPointNumber extends NumberLiteral {

    public FloatingPointNumber(int from, int to, String content) {
        super(from, to, content);
    }

    @Override
    public int base() {
        return 10;
    }
}
