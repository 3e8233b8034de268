package com.p6tree.ast;

import java.util.List;

/**
 * How a string literal was quoted.
 *
 * @param lexeme    quoting construct: {@code q}, {@code qq}, {@code Q}, {@code qw}...,
 *                  or the opening delimiter itself for plain quotes ({@code '}, {@code "})
 * @param open      opening delimiter
 * @param close     closing delimiter; for a here-document, the one around the terminator
 * @param adverbs   adverbs in source order, without the leading colon
 * @param hereDoc   here-document details, or null
 */
public record Quoting(
    String lexeme,
    String open,
    String close,
    List<String> adverbs,
    HereDoc hereDoc
) {

    public Quoting {
        adverbs = List.copyOf(adverbs);
    }

    public boolean isHereDoc() {
        return hereDoc != null;
    }

    /**
     * A here-document body.
     *
     * @param terminator the line that ends the body
     * @param bodyFrom   offset of the first body character
     * @param bodyTo     offset just past the terminator
     * @param body       body text, terminator line excluded
     */
    public record HereDoc(String terminator, int bodyFrom, int bodyTo, String body) {
    }
}
