package com.p6tree.match;

import java.util.List;
import java.util.Set;

/**
 * One successful match of a grammar production, as handed over by the grammar
 * engine.
 *
 * <p>Named captures may be absent, present with content, or present with empty
 * text. Rules tell these apart, so implementations must keep a key that was
 * captured with an empty match.</p>
 */
public interface Match {

    /** Offset of the first matched character. */
    int from();

    /** Offset just past the last matched character. */
    int to();

    /** The complete source text. */
    String orig();

    /** The matched text, {@code orig().substring(from(), to())}. */
    default String str() {
        return orig().substring(from(), to());
    }

    /** Names of all named captures, in capture order. */
    Set<String> keys();

    default boolean has(String key) {
        return keys().contains(key);
    }

    /** The first capture under {@code key}, or null when the key is absent or empty. */
    Match get(String key);

    /** Every capture under {@code key}; quantified captures may hold several. */
    List<Match> getAll(String key);

    /** Positional captures. */
    List<Match> list();
}
