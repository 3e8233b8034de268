package com.p6tree.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Base class of every node in the element tree.
 *
 * <p>Every element carries its source range ({@code from} inclusive, {@code to}
 * exclusive) and three navigation links. Unset links point back at the element
 * itself rather than at null, so a freshly built element is simultaneously a
 * root, a stream start and a stream end:</p>
 * <ul>
 *   <li>{@link #isRoot()} - {@code parent() == this}</li>
 *   <li>{@link #isStart()} - {@code previous() == this}</li>
 *   <li>{@link #isEnd()} - {@code next() == this}</li>
 * </ul>
 *
 * <p>The {@code next}/{@code previous} chain is the linear, document-order view of
 * the tokens. The parent/child relation is the tree view. Branches are not links
 * of the linear chain.</p>
 */
public abstract sealed class Element permits Leaf, Branch, Contextualizer {

    int from;
    int to;
    Element next;
    Element previous;
    Element parent;
    private String origin;

    protected Element(int from, int to) {
        if (from < 0 || from > to) {
            throw new IllegalArgumentException("Invalid range [" + from + ", " + to + ")");
        }
        this.from = from;
        this.to = to;
        this.next = this;
        this.previous = this;
        this.parent = this;
    }

    public int from() {
        return from;
    }

    public int to() {
        return to;
    }

    /** Number of glyphs covered. */
    public int length() {
        return to - from;
    }

    public Element next() {
        return next;
    }

    public Element previous() {
        return previous;
    }

    public Element parent() {
        return parent;
    }

    /**
     * The dispatch rule that produced this element, or null when origin
     * recording was off for the build.
     */
    public String origin() {
        return origin;
    }

    public void setOrigin(String origin) {
        this.origin = origin;
    }

    /** Short type name used in diagnostics, e.g. {@code Operator.Infix}. */
    public String type() {
        Class<?> type = getClass();
        if (type.getEnclosingClass() != null) {
            return type.getEnclosingClass().getSimpleName() + "." + type.getSimpleName();
        }
        return type.getSimpleName();
    }

    public boolean isRoot() {
        return parent == this;
    }

    public boolean isStart() {
        return previous == this;
    }

    public boolean isEnd() {
        return next == this;
    }

    public boolean isLeaf() {
        return false;
    }

    /** True for elements that own a child list. */
    public boolean isTwig() {
        return false;
    }

    /**
     * False for elements that only exist to keep the source range complete and are
     * not part of the statement they sit in.
     */
    public boolean isSemantic() {
        return true;
    }

    /** Source text covered by this element. */
    public abstract String text();

    /** The root reached by following parent links. */
    public Element root() {
        Element node = this;
        while (!node.isRoot()) {
            node = node.parent;
        }
        return node;
    }

    // ========================================================================
    // Post-hoc editing
    // ========================================================================

    /**
     * Splices this element out of the linear chain and out of its parent's child
     * list. When the owning document propagates ranges, everything after this
     * element moves left by {@link #length()}.
     *
     * <p>Editing is meant for links of the linear chain (leaves and
     * contextualizers). Nothing checks that the result is still legal Perl 6.</p>
     */
    public void remove() {
        Document document = owningDocument();
        boolean propagate = document != null && document.isRangePropagation();
        List<Element> ancestors = propagate ? ancestors() : List.of();
        int delta = length();
        int at = to;
        Element root = root();

        Element before = previous;
        Element after = next;
        if (!isStart() && !isEnd()) {
            before.next = after;
            after.previous = before;
        } else if (!isEnd()) {
            after.previous = after;
        } else if (!isStart()) {
            before.next = before;
        }
        if (!isRoot() && parent instanceof Branch branch) {
            branch.detach(this);
        } else if (!isRoot() && parent instanceof Contextualizer contextualizer) {
            contextualizer.detach(this);
        }

        if (propagate) {
            Set<Element> grow = identitySet(ancestors);
            shift(document, at, -delta, grow, this);
        }
        next = this;
        previous = this;
        parent = this;
        if (root != this) {
            relink(root);
        }
    }

    /**
     * Splices {@code node} into the chain immediately before this element and into
     * this element's parent just before it.
     */
    public void insertBefore(Element node) {
        Document document = owningDocument();
        boolean propagate = document != null && document.isRangePropagation();
        int delta = node.length();
        int at = from;

        if (isStart()) {
            node.previous = node;
        } else {
            node.previous = previous;
            previous.next = node;
        }
        node.next = this;
        previous = node;
        if (!isRoot()) {
            node.parent = parent;
            attachNextTo(node, 0);
            relink(root());
        }

        if (propagate) {
            node.moveTo(at);
            shift(document, at, delta, identitySet(node.ancestors()), node);
        }
    }

    /**
     * Splices {@code node} into the chain immediately after this element and into
     * this element's parent just after it.
     */
    public void insertAfter(Element node) {
        Document document = owningDocument();
        boolean propagate = document != null && document.isRangePropagation();
        int delta = node.length();
        int at = to;

        if (isEnd()) {
            node.next = node;
        } else {
            node.next = next;
            next.previous = node;
        }
        node.previous = this;
        next = node;
        if (!isRoot()) {
            node.parent = parent;
            attachNextTo(node, 1);
            relink(root());
        }

        if (propagate) {
            node.moveTo(at);
            shift(document, at, delta, identitySet(node.ancestors()), node);
        }
    }

    private void attachNextTo(Element node, int offset) {
        if (parent instanceof Branch branch) {
            branch.attach(branch.indexOf(this) + offset, node);
        } else if (parent instanceof Contextualizer contextualizer) {
            contextualizer.attach(contextualizer.indexOf(this) + offset, node);
        }
    }

    /**
     * Threads the tree under {@code root} again after an edit, so that every branch
     * before or after the edit point sees the new neighbours.
     */
    private static void relink(Element root) {
        if (root instanceof Branch) {
            Linker.thread(root);
        }
    }

    void moveTo(int offset) {
        int delta = offset - from;
        from += delta;
        to += delta;
        for (Element child : childList()) {
            child.moveTo(child.from + delta);
        }
    }

    private Document owningDocument() {
        Element root = root();
        return root instanceof Document document ? document : null;
    }

    List<Element> ancestors() {
        List<Element> result = new ArrayList<>();
        Element node = this;
        while (!node.isRoot()) {
            node = node.parent;
            result.add(node);
        }
        return result;
    }

    private static Set<Element> identitySet(List<Element> elements) {
        Set<Element> set = Collections.newSetFromMap(new IdentityHashMap<>());
        set.addAll(elements);
        return set;
    }

    /**
     * Moves every element at or after {@code at} by {@code delta}; elements in
     * {@code enclosing} only have their end moved.
     */
    private static void shift(Element node, int at, int delta, Set<Element> enclosing, Element skip) {
        if (node == skip) {
            return;
        }
        if (enclosing.contains(node)) {
            node.to += delta;
        } else if (node.from >= at) {
            node.from += delta;
            node.to += delta;
        }
        for (Element child : node.childList()) {
            shift(child, at, delta, enclosing, skip);
        }
    }

    /** Children of this element, empty for leaves. */
    List<Element> childList() {
        return List.of();
    }

    @Override
    public String toString() {
        return type() + "(" + from + ", " + to + ")";
    }
}
