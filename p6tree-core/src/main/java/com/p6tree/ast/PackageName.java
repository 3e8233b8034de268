package com.p6tree.ast;

/** A (possibly qualified) type or package name such as {@code Foo::Bar}. */
public final class PackageName extends Leaf {

    public PackageName(int from, int to, String content) {
        super(from, to, content);
    }
}
