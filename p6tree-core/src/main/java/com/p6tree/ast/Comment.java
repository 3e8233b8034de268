package com.p6tree.ast;

/**
 * A comment: either {@code #} to the end of the line or an embedded
 * {@code #`( ... )} comment.
 */
public final class Comment extends Leaf {

    public Comment(int from, int to, String content) {
        super(from, to, content);
    }
}
