package com.p6tree.ast;

import java.util.List;

/**
 * A signature. Routine signatures are parenthesized,
 * {@code [Enter '(', parameters..., Exit ')']}; the signature of a pointy block
 * ({@code -> $a, $b}) holds its parameters alone.
 */
public final class Signature extends Branch {

    public Signature(int from, int to, List<? extends Element> children) {
        super(from, to, children);
    }
}
