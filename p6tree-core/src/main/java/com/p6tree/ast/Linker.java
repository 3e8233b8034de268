package com.p6tree.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Threads an element tree into one document-order chain.
 *
 * <p>Leaves (and contextualizers) become links of the chain. Branches are
 * transparent: each gets the children's parent pointers, {@code previous} set to
 * the link before it and {@code next} set to the first link after it, but no link
 * points at a branch. Threading only depends on the shape of the tree, so
 * threading twice yields the same chain.</p>
 */
public final class Linker {

    private Element tail;
    private final List<Element> pending = new ArrayList<>();

    private Linker() {
    }

    public static void thread(Element root) {
        Linker linker = new Linker();
        root.parent = root;
        linker.visit(root);
        linker.finish();
    }

    private void visit(Element element) {
        if (element instanceof Leaf) {
            link(element);
        } else if (element instanceof Contextualizer contextualizer) {
            link(contextualizer);
            for (Element child : contextualizer.childList()) {
                child.parent = contextualizer;
                visit(child);
            }
        } else if (element instanceof Branch branch) {
            branch.previous = tail == null ? branch : tail;
            pending.add(branch);
            for (Element child : branch.childList()) {
                child.parent = branch;
                visit(child);
            }
        } else {
            throw new IllegalStateException(
                "Cannot thread " + element.getClass().getName() + " at " + element.from()
                    + ": neither leaf nor branch");
        }
    }

    private void link(Element element) {
        element.previous = tail == null ? element : tail;
        element.next = element;
        if (tail != null) {
            tail.next = element;
        }
        for (Element branch : pending) {
            branch.next = element;
        }
        pending.clear();
        tail = element;
    }

    private void finish() {
        for (Element branch : pending) {
            branch.next = branch;
        }
        pending.clear();
    }
}
