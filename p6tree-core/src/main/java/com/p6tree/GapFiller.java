package com.p6tree;

import com.p6tree.ast.Branch;
import com.p6tree.ast.Contextualizer;
import com.p6tree.ast.Element;

import java.util.List;

/**
 * Fills the holes between adjacent children with whitespace, comment, Pod and
 * here-document elements.
 *
 * <p>Children are visited last to first so that splicing at index {@code i} never
 * disturbs indices still to be visited, and each child is completed before the
 * gap in front of it is measured.</p>
 */
public final class GapFiller {

    private final GapTokenizer tokenizer;

    public GapFiller(GapTokenizer tokenizer) {
        this.tokenizer = tokenizer;
    }

    public void fill(Element element) {
        if (element instanceof Branch branch) {
            fillBranch(branch);
        } else if (element instanceof Contextualizer contextualizer) {
            fillContextualizer(contextualizer);
        }
    }

    private void fillBranch(Branch branch) {
        List<Element> children = branch.children();
        if (children.isEmpty()) {
            if (branch.to() > branch.from()) {
                branch.splice(0, tokenizer.tokenize(branch.from(), branch.to()));
            }
            return;
        }

        int last = children.size() - 1;
        Element lastChild = children.get(last);
        fill(lastChild);
        if (end(lastChild) < branch.to()) {
            branch.splice(last + 1, tokenizer.tokenize(end(lastChild), branch.to()));
        }
        for (int i = last; i > 0; i--) {
            Element current = branch.child(i);
            Element previous = branch.child(i - 1);
            fill(previous);
            if (end(previous) != current.from()) {
                branch.splice(i, tokenizer.tokenize(end(previous), current.from()));
            }
        }
        Element first = branch.child(0);
        if (branch.from() < first.from()) {
            branch.splice(0, tokenizer.tokenize(branch.from(), first.from()));
        }
    }

    private void fillContextualizer(Contextualizer contextualizer) {
        List<Element> children = contextualizer.children();
        for (int i = children.size() - 1; i >= 0; i--) {
            Element current = contextualizer.children().get(i);
            fill(current);
            int previousEnd = i == 0 ? contextualizer.to() : end(contextualizer.children().get(i - 1));
            if (previousEnd != current.from()) {
                contextualizer.splice(i, tokenizer.tokenize(previousEnd, current.from()));
            }
        }
    }

    /** Where the source covered by {@code element} and its descendants ends. */
    static int end(Element element) {
        if (element instanceof Contextualizer contextualizer) {
            return contextualizer.extent();
        }
        return element.to();
    }
}
