package com.p6tree.ast;

/** {@code qx{ls}}, {@code qqx{ls $dir}}, {@code Qx{ls}}. */
public final class ShellString extends StringLiteral {

    public ShellString(int from, int to, String content, Quoting quoting) {
        super(from, to, content, quoting);
    }

    @Override
    public boolean isInterpolating() {
        return quoting().lexeme().startsWith("qq");
    }
}
