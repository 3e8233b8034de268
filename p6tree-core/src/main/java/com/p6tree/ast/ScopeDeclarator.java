package com.p6tree.ast;

import java.util.List;

/**
 * A scope declaration such as {@code my $x} or {@code our Int @list}: the scope
 * keyword and what it declares. An initializer follows the declarator as its
 * sibling.
 */
public final class ScopeDeclarator extends Branch {

    public ScopeDeclarator(int from, int to, List<? extends Element> children) {
        super(from, to, children);
    }

    /** {@code my}, {@code our}, {@code has}, {@code state}, {@code anon}, {@code augment}, {@code unit}... */
    public String scope() {
        Element first = firstChild();
        return first instanceof Leaf leaf ? leaf.content() : "";
    }
}
