package com.p6tree.ast;

import java.util.List;

/** One statement, including its terminating semicolon when there is one. */
public final class Statement extends Branch {

    public Statement(int from, int to, List<? extends Element> children) {
        super(from, to, children);
    }
}
