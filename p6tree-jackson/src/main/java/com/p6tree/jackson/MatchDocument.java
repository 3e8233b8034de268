package com.p6tree.jackson;

import com.p6tree.match.Match;

/**
 * A match tree together with the source text it was matched against: the
 * top-level object of a JSON match document.
 *
 * @param orig  the complete source text
 * @param match the root match
 */
public record MatchDocument(String orig, Match match) {
}
