package com.p6tree.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * The root of an element tree. It covers the whole source and is its own parent.
 */
public final class Document extends Branch {

    private boolean rangePropagation;

    public Document(int from, int to, List<? extends Element> children) {
        super(from, to, children);
    }

    /**
     * When on, {@link Element#remove()}, {@link Element#insertBefore(Element)} and
     * {@link Element#insertAfter(Element)} shift the ranges of everything after the
     * edit so that adjacent links keep touching.
     */
    public boolean isRangePropagation() {
        return rangePropagation;
    }

    public void setRangePropagation(boolean rangePropagation) {
        this.rangePropagation = rangePropagation;
    }

    /** The linear chain, first link to last. */
    public List<Element> links() {
        List<Element> result = new ArrayList<>();
        Element node = firstLink(this);
        if (node == null) {
            return result;
        }
        while (!node.isStart()) {
            node = node.previous();
        }
        while (true) {
            result.add(node);
            if (node.isEnd()) {
                break;
            }
            node = node.next();
        }
        return result;
    }

    private static Element firstLink(Element element) {
        if (!(element instanceof Branch)) {
            return element;
        }
        for (Element child : element.childList()) {
            Element link = firstLink(child);
            if (link != null) {
                return link;
            }
        }
        return null;
    }

    /** Top-level statements. */
    public List<Statement> statements() {
        List<Statement> result = new ArrayList<>();
        for (Element child : children()) {
            if (child instanceof Statement statement) {
                result.add(statement);
            }
        }
        return result;
    }

    /**
     * Top-level children that carry meaning: statements and anything else except
     * whitespace, comments, Pod and here-document bodies.
     */
    public List<Element> semanticChildren() {
        List<Element> result = new ArrayList<>();
        for (Element child : children()) {
            if (child.isSemantic() && !(child instanceof WS) && !(child instanceof Comment) && !(child instanceof Pod)) {
                result.add(child);
            }
        }
        return result;
    }
}
