package com.p6tree.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A contextualizer such as {@code $( ... )} or {@code @( ... )}.
 *
 * <p>This is the one element that is both token-like and a parent. Its own range
 * and content cover the sigil only; the parenthesized part follows it as its
 * children, {@code [Enter, ..., Exit]}. In the linear chain it is linked like a
 * leaf, immediately before its first child.</p>
 */
public final class Contextualizer extends Element {

    private final String content;
    private final List<Element> children;

    public Contextualizer(int from, int to, String content, List<? extends Element> children) {
        super(from, to);
        if (content.length() != to - from) {
            throw new IllegalArgumentException(
                "Content '" + content + "' does not cover [" + from + ", " + to + ")");
        }
        this.content = content;
        this.children = new ArrayList<>(children);
    }

    public String content() {
        return content;
    }

    public VariableKind.Sigil sigil() {
        return VariableKind.Sigil.of(content.charAt(0));
    }

    public List<Element> children() {
        return Collections.unmodifiableList(children);
    }

    /** End of the parenthesized part, or of the sigil when there is none. */
    public int extent() {
        return children.isEmpty() ? to : children.get(children.size() - 1).to();
    }

    public void splice(int index, List<? extends Element> elements) {
        children.addAll(index, elements);
    }

    @Override
    public boolean isTwig() {
        return true;
    }

    @Override
    public String text() {
        StringBuilder sb = new StringBuilder(content);
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

    @Override
    public String toString() {
        return "Contextualizer(" + from + ", " + to + ", '" + content + "')";
    }
}
