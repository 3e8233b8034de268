package com.p6tree.ast;

/** {@code <a b c>}, {@code qw{a b c}}, {@code «a $b»}. */
public final class WordListString extends StringLiteral {

    public WordListString(int from, int to, String content, Quoting quoting) {
        super(from, to, content, quoting);
    }

    @Override
    public boolean isInterpolating() {
        return quoting().lexeme().startsWith("qq") || quoting().lexeme().equals("<<") || quoting().lexeme().equals("«");
    }
}
