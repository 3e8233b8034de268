package com.p6tree.factory;

import com.p6tree.FactoryOptions;
import com.p6tree.GapTokenizer;
import com.p6tree.HereDocTable;

/**
 * State of one build: the source, the options, the here-document table and the
 * tokenizer that reads the text between captures. A fresh context is created for
 * every document.
 */
public final class BuildContext {

    private final String orig;
    private final FactoryOptions options;
    private final HereDocTable hereDocs = new HereDocTable();
    private final GapTokenizer gaps;

    public BuildContext(String orig, FactoryOptions options) {
        this.orig = orig;
        this.options = options;
        this.gaps = new GapTokenizer(orig, hereDocs, options.author());
    }

    public String orig() {
        return orig;
    }

    public FactoryOptions options() {
        return options;
    }

    public HereDocTable hereDocs() {
        return hereDocs;
    }

    public GapTokenizer gaps() {
        return gaps;
    }
}
