package com.p6tree;

/**
 * Options for one {@link Factory}.
 *
 * @param author       log diagnostics for gaps the tokenizer cannot classify
 * @param recordOrigin stamp every element with the rule that produced it
 */
public record FactoryOptions(boolean author, boolean recordOrigin) {

    public static FactoryOptions defaults() {
        return new FactoryOptions(false, false);
    }

    public FactoryOptions withAuthor(boolean author) {
        return new FactoryOptions(author, recordOrigin);
    }

    public FactoryOptions withRecordOrigin(boolean recordOrigin) {
        return new FactoryOptions(author, recordOrigin);
    }
}
