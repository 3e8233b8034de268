package com.p6tree.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The kind of a variable: its sigil and its twigil state. There are exactly
 * {@code 4 x 10} kinds, all reachable through {@link #lookup(String)} with the
 * sigil and twigil characters as key ({@code "$"}, {@code "$*"}, {@code "@!"}...).
 */
public record VariableKind(Sigil sigil, Twigil twigil) {

    public enum Sigil {
        SCALAR('$'),
        ARRAY('@'),
        HASH('%'),
        CALLABLE('&');

        private final char symbol;

        Sigil(char symbol) {
            this.symbol = symbol;
        }

        public char symbol() {
            return symbol;
        }

        public static Sigil of(char symbol) {
            for (Sigil sigil : values()) {
                if (sigil.symbol == symbol) {
                    return sigil;
                }
            }
            throw new IllegalArgumentException("Not a sigil: '" + symbol + "'");
        }
    }

    public enum Twigil {
        PLAIN(""),
        DYNAMIC("*"),
        ATTRIBUTE("!"),
        COMPILE_TIME("?"),
        MATCH_INDEX("<"),
        POSITIONAL("^"),
        NAMED(":"),
        POD("="),
        SUBLANGUAGE("~"),
        ACCESSOR(".");

        private final String symbol;

        Twigil(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public static boolean isTwigil(char c) {
            return "*!?<^:=~.".indexOf(c) >= 0;
        }
    }

    private static final Map<String, VariableKind> TABLE;

    static {
        Map<String, VariableKind> table = new LinkedHashMap<>();
        for (Sigil sigil : Sigil.values()) {
            for (Twigil twigil : Twigil.values()) {
                table.put(sigil.symbol() + twigil.symbol(), new VariableKind(sigil, twigil));
            }
        }
        TABLE = Collections.unmodifiableMap(table);
    }

    /** Every kind, keyed by sigil and twigil. */
    public static Map<String, VariableKind> table() {
        return TABLE;
    }

    /** Returns the kind for a sigil+twigil key, or null for an unknown key. */
    public static VariableKind lookup(String key) {
        return TABLE.get(key);
    }

    public String key() {
        return sigil.symbol() + twigil.symbol();
    }
}
