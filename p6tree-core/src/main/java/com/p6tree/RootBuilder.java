package com.p6tree;

import com.p6tree.ast.Document;
import com.p6tree.ast.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * Wraps the top-level statements in a {@link Document} covering the whole source.
 * Text before the first statement and after the last one (a shebang line,
 * trailing comments) is tokenized like any other gap.
 */
final class RootBuilder {

    private RootBuilder() {
    }

    static Document build(String orig, List<Element> statements, GapTokenizer tokenizer) {
        int length = orig.length();
        List<Element> children = new ArrayList<>();
        if (statements.isEmpty()) {
            children.addAll(tokenizer.tokenize(0, length));
            return new Document(0, length, children);
        }

        Element first = statements.get(0);
        Element last = statements.get(statements.size() - 1);
        if (first.from() > 0) {
            children.addAll(tokenizer.tokenize(0, first.from()));
        }
        children.addAll(statements);
        int end = GapFiller.end(last);
        if (end < length) {
            children.addAll(tokenizer.tokenize(end, length));
        }
        return new Document(0, length, children);
    }
}
