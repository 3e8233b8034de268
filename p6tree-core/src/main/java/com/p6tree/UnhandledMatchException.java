package com.p6tree;

import java.util.List;
import java.util.Set;

/**
 * A rule met a match whose shape it has no case for. This means the match tree
 * came from a grammar this factory does not know, so the whole build is abandoned.
 */
public class UnhandledMatchException extends FactoryException {

    private static final int EXCERPT = 40;

    private final String rule;
    private final int from;
    private final String text;
    private final List<String> contentKeys;
    private final List<String> emptyKeys;

    public UnhandledMatchException(String rule, int from, String text, Set<String> contentKeys, Set<String> emptyKeys) {
        super("Unhandled match in " + rule + " at " + from
            + ": keys with content " + contentKeys
            + ", keys present but empty " + emptyKeys
            + ", text '" + excerpt(text) + "'");
        this.rule = rule;
        this.from = from;
        this.text = text;
        this.contentKeys = List.copyOf(contentKeys);
        this.emptyKeys = List.copyOf(emptyKeys);
    }

    private static String excerpt(String text) {
        String oneLine = text.replace("\n", "\\n");
        return oneLine.length() <= EXCERPT ? oneLine : oneLine.substring(0, EXCERPT) + "...";
    }

    public String rule() {
        return rule;
    }

    public int from() {
        return from;
    }

    public String text() {
        return text;
    }

    public List<String> contentKeys() {
        return contentKeys;
    }

    public List<String> emptyKeys() {
        return emptyKeys;
    }
}
