package com.p6tree.ast;

import java.util.List;

/**
 * Operator elements. Prefix, infix, postfix and hyper operators are single
 * tokens; circumfix and post-circumfix operators own their bracketed contents.
 */
public final class Operator {

    private Operator() {
    }

    public static final class Prefix extends Leaf {
        public Prefix(int from, int to, String content) {
            super(from, to, content);
        }
    }

    public static final class Infix extends Leaf {
        public Infix(int from, int to, String content) {
            super(from, to, content);
        }
    }

    public static final class Postfix extends Leaf {
        public Postfix(int from, int to, String content) {
            super(from, to, content);
        }
    }

    /** A hyper or meta operator such as {@code >>+<<} or {@code «~»}. */
    public static final class Hyper extends Leaf {
        public Hyper(int from, int to, String content) {
            super(from, to, content);
        }
    }

    /** {@code ( ... )} or {@code [ ... ]} as a term. */
    public static final class Circumfix extends Branch {
        public Circumfix(int from, int to, List<? extends Element> children) {
            super(from, to, children);
        }
    }

    /** Subscripts and call arguments attached to the preceding term. */
    public static final class PostCircumfix extends Branch {
        public PostCircumfix(int from, int to, List<? extends Element> children) {
            super(from, to, children);
        }
    }
}
