package com.p6tree.ast;

/** {@code "foo $x"}, {@code qq{foo}}. */
public final class InterpolatedString extends StringLiteral {

    public InterpolatedString(int from, int to, String content, Quoting quoting) {
        super(from, to, content, quoting);
    }

    @Override
    public boolean isInterpolating() {
        return true;
    }
}
