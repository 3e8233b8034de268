package com.p6tree;

import com.p6tree.util.TreeLogger;
import org.slf4j.Logger;

import java.util.TreeMap;

/**
 * Here-documents seen during one build, keyed by the offset where their opener
 * ends.
 *
 * <p>Strings register their here-document while the match tree is classified;
 * the gap filler consults the table afterwards, so the body text is never
 * tokenized as code.</p>
 */
public final class HereDocTable {

    private static final Logger LOGGER = TreeLogger.getLogger(HereDocTable.class);

    /** One registered here-document. */
    public record Entry(int opener, int openerEnd, int bodyFrom, int bodyTo, String terminator) {
    }

    private final TreeMap<Integer, Entry> entries = new TreeMap<>();

    public void register(int opener, int openerEnd, int bodyFrom, int bodyTo, String terminator) {
        LOGGER.debug("Here-doc at {} terminated by '{}': body [{}, {})", opener, terminator, bodyFrom, bodyTo);
        entries.put(openerEnd, new Entry(opener, openerEnd, bodyFrom, bodyTo, terminator));
    }

    /**
     * The here-document whose body can start at {@code offset}: among those whose
     * opener ends at or before {@code offset} and whose body has not started yet,
     * the one with the earliest body. Returns null when there is none.
     */
    public Entry bodyStartingAt(int offset) {
        Entry best = null;
        for (Entry entry : entries.headMap(offset, true).values()) {
            if (entry.bodyFrom() >= offset && (best == null || entry.bodyFrom() < best.bodyFrom())) {
                best = entry;
            }
        }
        return best;
    }

    /**
     * Where the next body after {@code lineEnd} starts: just after {@code lineEnd}
     * unless earlier here-documents opened on the same line already claimed the
     * following lines.
     */
    public int nextBodyStart(int lineEnd) {
        int start = lineEnd;
        for (Entry entry : entries.values()) {
            if (entry.bodyFrom() >= lineEnd && entry.bodyTo() >= start) {
                start = entry.bodyTo() + 1;
            }
        }
        return start;
    }

    /** True when a registered body starts exactly at {@code offset}. */
    public boolean isBodyStart(int offset) {
        for (Entry entry : entries.values()) {
            if (entry.bodyFrom() == offset) {
                return true;
            }
        }
        return false;
    }

    /** True when {@code offset} lies inside a registered body. */
    public boolean isInsideBody(int offset) {
        for (Entry entry : entries.values()) {
            if (offset >= entry.bodyFrom() && offset < entry.bodyTo()) {
                return true;
            }
        }
        return false;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }
}
