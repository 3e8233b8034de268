package com.p6tree;

import com.p6tree.ast.Document;
import com.p6tree.ast.Element;
import com.p6tree.ast.Linker;
import com.p6tree.factory.BuildContext;
import com.p6tree.factory.Rules;
import com.p6tree.match.Match;
import com.p6tree.util.TreeLogger;
import org.slf4j.Logger;

import java.util.List;

/**
 * Builds element trees from grammar match trees.
 *
 * <p>A build runs in four passes: the rules classify the match tree into
 * elements, the root builder wraps the top-level statements in a
 * {@link Document}, the gap filler turns every uncovered stretch of source into
 * whitespace, comment, Pod or here-document elements, and the linker threads the
 * result into one chain.</p>
 *
 * <pre>{@code
 * Document document = new Factory().build(match);
 * for (Element link : document.links()) {
 *     ...
 * }
 * }</pre>
 *
 * <p>No element of the result refers to the match tree. Each call works on its
 * own state, so one factory can build any number of documents.</p>
 */
public class Factory {

    private static final Logger LOGGER = TreeLogger.getLogger(Factory.class);

    private final FactoryOptions options;

    public Factory() {
        this(FactoryOptions.defaults());
    }

    public Factory(FactoryOptions options) {
        this.options = options;
    }

    public FactoryOptions options() {
        return options;
    }

    /**
     * @param root the match for {@code comp_unit}, the whole source
     * @throws UnhandledMatchException if a rule meets a shape it has no case for
     * @throws FactoryException        if an expected token is missing from the source
     */
    public Document build(Match root) {
        BuildContext context = new BuildContext(root.orig(), options);
        List<Element> statements = new Rules(context).compUnit(root);

        GapTokenizer tokenizer = context.gaps();
        Document document = RootBuilder.build(root.orig(), statements, tokenizer);
        new GapFiller(tokenizer).fill(document);
        Linker.thread(document);
        LOGGER.debug("Built {} top-level elements from {} characters", document.children().size(), root.orig().length());
        return document;
    }
}
