package com.p6tree.json;

import com.p6tree.match.Match;

import java.io.InputStream;

/**
 * Interface for reading match trees that a grammar engine dumped as JSON.
 *
 * <p>The expected document is {@code {"orig": "<source>", "match": <node>}} where a
 * node is {@code {"from": int, "to": int, "hash": {...}, "list": [...]}}. A hash
 * value is either a node (a single capture) or an array of nodes (a quantified
 * capture, possibly empty).</p>
 */
public interface MatchJsonReader {

    /**
     * Reads the root match of a JSON document.
     *
     * @param json the JSON document
     * @return the root match, backed by the document's source text
     * @throws MatchJsonException if the document is malformed
     */
    Match read(String json) throws MatchJsonException;

    /**
     * Reads the root match of a JSON document from a stream. The stream is not
     * closed.
     *
     * @param in the JSON document, UTF-8 encoded
     * @return the root match
     * @throws MatchJsonException if the stream cannot be read or the document is malformed
     */
    Match read(InputStream in) throws MatchJsonException;
}
