package com.p6tree.ast;

import java.util.List;

/** A brace-delimited block: {@code [Enter '{', statements..., Exit '}']}. */
public final class Block extends Branch {

    public Block(int from, int to, List<? extends Element> children) {
        super(from, to, children);
    }
}
