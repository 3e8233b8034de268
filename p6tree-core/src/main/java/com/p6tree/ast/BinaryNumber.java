package com.p6tree.ast;

/** {@code 0b1010}. */
public final class BinaryNumber extends NumberLiteral {

    public BinaryNumber(int from, int to, String content) {
        super(from, to, content);
    }

    @Override
    public int base() {
        return 2;
    }
}
