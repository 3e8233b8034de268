package com.p6tree.match;

import java.util.Arrays;
import java.util.Set;
import java.util.TreeSet;

/**
 * Which named captures of a match carry text and which are present but empty.
 *
 * <p>Computed once per match and then tested against the shapes a rule knows
 * about, in the rule's order. A shape test passes when the keys with content are
 * exactly the required ones and every listed empty key is present without
 * content.</p>
 */
public final class Shape {

    private final Set<String> content = new TreeSet<>();
    private final Set<String> empty = new TreeSet<>();

    private Shape(Match match) {
        for (String key : match.keys()) {
            boolean hasContent = false;
            for (Match capture : match.getAll(key)) {
                if (capture.to() > capture.from()) {
                    hasContent = true;
                    break;
                }
            }
            if (hasContent) {
                content.add(key);
            } else {
                empty.add(key);
            }
        }
    }

    public static Shape of(Match match) {
        return new Shape(match);
    }

    /** Keys whose captures carry text. */
    public Set<String> contentKeys() {
        return content;
    }

    /** Keys that were captured but matched nothing. */
    public Set<String> emptyKeys() {
        return empty;
    }

    /** True when the keys with content are exactly {@code keys}. */
    public boolean is(String... keys) {
        if (content.size() != keys.length) {
            return false;
        }
        for (String key : keys) {
            if (!content.contains(key)) {
                return false;
            }
        }
        return true;
    }

    /**
     * True when the keys with content are exactly {@code keys} and each of
     * {@code emptyKeys} is present without content.
     */
    public boolean is(String[] keys, String... emptyKeys) {
        if (!is(keys)) {
            return false;
        }
        for (String key : emptyKeys) {
            if (!empty.contains(key)) {
                return false;
            }
        }
        return true;
    }

    /**
     * True when the keys with content are all of {@code keys} plus any of
     * {@code optional}.
     */
    public boolean isOptionally(String[] keys, String... optional) {
        Set<String> required = new TreeSet<>(Arrays.asList(keys));
        if (!content.containsAll(required)) {
            return false;
        }
        Set<String> allowed = new TreeSet<>(required);
        allowed.addAll(Arrays.asList(optional));
        return allowed.containsAll(content);
    }

    /** True when no capture carries text. */
    public boolean isBare() {
        return content.isEmpty();
    }

    public static String[] keys(String... keys) {
        return keys;
    }

    @Override
    public String toString() {
        return "with content " + content + ", present but empty " + empty;
    }
}
