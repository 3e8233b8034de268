package com.p6tree.ast;

/**
 * A regex: {@code /foo/}, {@code rx:i/foo/}, {@code m/foo/}, {@code s/a/b/}, or the
 * body of a {@code token}/{@code rule}/{@code regex} declaration.
 */
public final class Regex extends Leaf {

    private final String lexeme;

    public Regex(int from, int to, String content, String lexeme) {
        super(from, to, content);
        this.lexeme = lexeme;
    }

    /** {@code /}, {@code rx}, {@code m}, {@code s}, {@code tr}, or empty for a declaration body. */
    public String lexeme() {
        return lexeme;
    }
}
