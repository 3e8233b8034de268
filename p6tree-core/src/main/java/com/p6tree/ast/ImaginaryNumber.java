package com.p6tree.ast;

/** {@code 3i}, {@code 1.5i}. */
public final class ImaginaryNumber extends NumberLiteral {

    public ImaginaryNumber(int from, int to, String content) {
        super(from, to, content);
    }

    @Override
    public int base() {
        return 10;
    }
}
