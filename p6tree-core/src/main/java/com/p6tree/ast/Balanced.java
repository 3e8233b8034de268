package com.p6tree.ast;

/**
 * Opening and closing markers of a bracketed construct.
 */
public final class Balanced {

    private Balanced() {
    }

    public static final class Enter extends Leaf {
        public Enter(int from, int to, String content) {
            super(from, to, content);
        }
    }

    public static final class Exit extends Leaf {
        public Exit(int from, int to, String content) {
            super(from, to, content);
        }
    }
}
