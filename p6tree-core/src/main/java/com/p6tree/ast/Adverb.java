package com.p6tree.ast;

/** A quoting adverb, e.g. {@code :to} in {@code q:to/END/}. */
public final class Adverb extends Leaf {

    public Adverb(int from, int to, String content) {
        super(from, to, content);
    }
}
