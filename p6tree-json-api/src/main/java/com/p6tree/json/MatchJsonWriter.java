package com.p6tree.json;

import com.p6tree.match.Match;

/**
 * Interface for writing match trees as JSON, in the format {@link MatchJsonReader}
 * reads.
 */
public interface MatchJsonWriter {

    /**
     * Writes a match tree and its source text as one JSON document.
     *
     * @param root the root match
     * @return the JSON document
     * @throws MatchJsonException if writing fails
     */
    String write(Match root) throws MatchJsonException;

    /**
     * Writes a match tree as a pretty-printed JSON document.
     *
     * @param root the root match
     * @return the pretty-printed JSON document
     * @throws MatchJsonException if writing fails
     */
    String writePretty(Match root) throws MatchJsonException;
}
