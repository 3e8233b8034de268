package com.p6tree.ast;

/** A statement terminator. */
public final class Semicolon extends Leaf {

    public Semicolon(int from, int to, String content) {
        super(from, to, content);
    }
}
