package com.p6tree.ast;

/** {@code :16<FF>}, {@code :2<1010>}. */
public final class RadixNumber extends NumberLiteral {

    private final int radix;

    public RadixNumber(int from, int to, String content, int radix) {
        super(from, to, content);
        this.radix = radix;
    }

    @Override
    public int base() {
        return radix;
    }
}
