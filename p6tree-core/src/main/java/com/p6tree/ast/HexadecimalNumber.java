package com.p6tree.ast;

/** {@code 0xff}. */
public final class HexadecimalNumber extends NumberLiteral {

    public HexadecimalNumber(int from, int to, String content) {
        super(from, to, content);
    }

    @Override
    public int base() {
        return 16;
    }
}
