package com.p6tree.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands out SLF4J loggers without letting SLF4J report its own initialization.
 */
public final class TreeLogger {
    static {
        System.setProperty("slf4j.internal.verbosity", "WARN");
    }

    private TreeLogger() {
        // utility class
    }

    /**
     * @param clazz Class for which the logger will be used
     * @return an SLF4J Logger instance
     */
    public static Logger getLogger(Class<?> clazz) {
        return LoggerFactory.getLogger(clazz);
    }
}
