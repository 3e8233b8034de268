package com.p6tree.ast;

/**
 * Base of the numeric literal elements. The base is fixed by the variant, except
 * for {@link RadixNumber}, which reads it from the source.
 */
public abstract class NumberLiteral extends Leaf {

    protected NumberLiteral(int from, int to, String content) {
        super(from, to, content);
    }

    public abstract int base();
}
