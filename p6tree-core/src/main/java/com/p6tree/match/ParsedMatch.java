package com.p6tree.match;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable {@link Match} built by grammar front ends and match-tree readers.
 */
public final class ParsedMatch implements Match {

    private final String orig;
    private final int from;
    private final int to;
    private final Map<String, List<Match>> hash;
    private final List<Match> list;

    private ParsedMatch(String orig, int from, int to, Map<String, List<Match>> hash, List<Match> list) {
        if (from < 0 || to < from || to > orig.length()) {
            throw new IllegalArgumentException(
                "Match range [" + from + ", " + to + ") outside source of length " + orig.length());
        }
        this.orig = orig;
        this.from = from;
        this.to = to;
        this.hash = hash;
        this.list = list;
    }

    public static Builder builder(String orig, int from, int to) {
        return new Builder(orig, from, to);
    }

    @Override
    public int from() {
        return from;
    }

    @Override
    public int to() {
        return to;
    }

    @Override
    public String orig() {
        return orig;
    }

    @Override
    public Set<String> keys() {
        return hash.keySet();
    }

    @Override
    public Match get(String key) {
        List<Match> captures = hash.get(key);
        return captures == null || captures.isEmpty() ? null : captures.get(0);
    }

    @Override
    public List<Match> getAll(String key) {
        List<Match> captures = hash.get(key);
        return captures == null ? List.of() : captures;
    }

    @Override
    public List<Match> list() {
        return list;
    }

    @Override
    public String toString() {
        return "Match[" + from + ", " + to + ") " + hash.keySet() + " '" + str() + "'";
    }

    public static final class Builder {
        private final String orig;
        private final int from;
        private final int to;
        private final Map<String, List<Match>> hash = new LinkedHashMap<>();
        private final List<Match> list = new ArrayList<>();

        private Builder(String orig, int from, int to) {
            this.orig = orig;
            this.from = from;
            this.to = to;
        }

        /** Adds a capture under {@code key}; repeated calls make it quantified. */
        public Builder put(String key, Match match) {
            hash.computeIfAbsent(key, k -> new ArrayList<>()).add(match);
            return this;
        }

        /** Declares {@code key} as a quantified capture holding {@code matches}, possibly none. */
        public Builder putAll(String key, List<? extends Match> matches) {
            hash.computeIfAbsent(key, k -> new ArrayList<>()).addAll(matches);
            return this;
        }

        public Builder add(Match match) {
            list.add(match);
            return this;
        }

        public ParsedMatch build() {
            Map<String, List<Match>> frozen = new LinkedHashMap<>();
            hash.forEach((key, value) -> frozen.put(key, List.copyOf(value)));
            return new ParsedMatch(orig, from, to,
                Collections.unmodifiableMap(frozen), List.copyOf(list));
        }
    }
}
