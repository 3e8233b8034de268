package com.p6tree.match;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.p6tree.match.Shape.keys;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Shape predicates over a match of {@code "ab"} whose {@code a} capture has text,
 * {@code b} matched nothing and {@code c} is a quantified capture with no
 * matches.
 */
public class ShapeTest {

    private static final String ORIG = "ab";

    private static Match sample() {
        return ParsedMatch.builder(ORIG, 0, 2)
            .put("a", ParsedMatch.builder(ORIG, 0, 1).build())
            .put("b", ParsedMatch.builder(ORIG, 1, 1).build())
            .putAll("c", List.of())
            .build();
    }

    @Test
    void testKeySets() {
        Shape shape = Shape.of(sample());
        assertEquals(Set.of("a"), shape.contentKeys());
        assertEquals(Set.of("b", "c"), shape.emptyKeys());
        assertFalse(shape.isBare());
    }

    @Test
    @DisplayName("is() compares the keys with content exactly")
    void testIs() {
        Shape shape = Shape.of(sample());
        assertTrue(shape.is("a"));
        assertFalse(shape.is("a", "b"));
        assertFalse(shape.is());
        assertFalse(shape.is("x"));
    }

    @Test
    @DisplayName("is() with empty keys also requires them present and empty")
    void testIsWithEmptyKeys() {
        Shape shape = Shape.of(sample());
        assertTrue(shape.is(keys("a"), "b"));
        assertTrue(shape.is(keys("a"), "b", "c"));
        assertFalse(shape.is(keys("a"), "d"));
        assertFalse(shape.is(keys("a"), "a"));
        assertFalse(shape.is(keys(), "b"));
    }

    @Test
    @DisplayName("isOptionally() allows extra keys from the optional list only")
    void testIsOptionally() {
        Shape shape = Shape.of(sample());
        assertTrue(shape.isOptionally(keys("a")));
        assertTrue(shape.isOptionally(keys("a"), "x", "y"));
        assertTrue(shape.isOptionally(keys(), "a"));
        assertFalse(shape.isOptionally(keys()));
        assertFalse(shape.isOptionally(keys("b"), "a"));
    }

    @Test
    void testBare() {
        Match bare = ParsedMatch.builder(ORIG, 0, 2)
            .put("b", ParsedMatch.builder(ORIG, 1, 1).build())
            .build();
        Shape shape = Shape.of(bare);
        assertTrue(shape.isBare());
        assertTrue(shape.is());
        assertTrue(shape.is(keys(), "b"));
        assertEquals("with content [], present but empty [b]", shape.toString());
    }

    @Test
    @DisplayName("Matches expose their text and captures")
    void testParsedMatch() {
        Match match = sample();
        assertEquals("ab", match.str());
        assertEquals("a", match.get("a").str());
        assertTrue(match.has("c"));
        assertNull(match.get("c"));
        assertTrue(match.getAll("c").isEmpty());
        assertNull(match.get("missing"));
        assertTrue(match.getAll("missing").isEmpty());
        assertTrue(match.list().isEmpty());
    }
}
