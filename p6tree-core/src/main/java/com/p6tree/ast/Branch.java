package com.p6tree.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A composite element: an ordered, possibly empty list of children and no content
 * of its own.
 */
public abstract non-sealed class Branch extends Element {

    private final List<Element> children;

    protected Branch(int from, int to, List<? extends Element> children) {
        super(from, to);
        this.children = new ArrayList<>(children);
    }

    /** A branch whose range is that of its first and last child. */
    protected Branch(List<? extends Element> children) {
        this(children.get(0).from(), children.get(children.size() - 1).to(), children);
    }

    public List<Element> children() {
        return Collections.unmodifiableList(children);
    }

    public Element child(int index) {
        return children.get(index);
    }

    public int size() {
        return children.size();
    }

    public boolean isEmpty() {
        return children.isEmpty();
    }

    public Element firstChild() {
        return children.isEmpty() ? null : children.get(0);
    }

    public Element lastChild() {
        return children.isEmpty() ? null : children.get(children.size() - 1);
    }

    /**
     * Inserts synthesized elements at {@code index}. Used while filling gaps, before
     * the tree is linked.
     */
    public void splice(int index, List<? extends Element> elements) {
        children.addAll(index, elements);
    }

    @Override
    public boolean isTwig() {
        return true;
    }

    @Override
    public String text() {
        StringBuilder sb = new StringBuilder();
        for (Element child : children) {
            sb.append(child.text());
        }
        return sb.toString();
    }

    @Override
    List<Element> childList() {
        return children;
    }

    int indexOf(Element child) {
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) == child) {
                return i;
            }
        }
        return -1;
    }

    void attach(int index, Element child) {
        children.add(Math.max(0, Math.min(index, children.size())), child);
    }

    void detach(Element child) {
        int index = indexOf(child);
        if (index >= 0) {
            children.remove(index);
        }
    }
}
