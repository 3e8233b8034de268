package com.p6tree.ast;

/** {@code 'foo'}, {@code q{foo}}, {@code Q[foo]}, {@code 「foo」}. */
public final class LiteralString extends StringLiteral {

    public LiteralString(int from, int to, String content, Quoting quoting) {
        super(from, to, content, quoting);
    }

    @Override
    public boolean isInterpolating() {
        return quoting().adverbs().contains("qq") || quoting().adverbs().contains("s");
    }
}
