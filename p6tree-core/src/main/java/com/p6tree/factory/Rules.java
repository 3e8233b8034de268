package com.p6tree.factory;

import com.p6tree.ast.Element;
import com.p6tree.match.Match;

import java.util.List;

/**
 * Dispatch for one build: one method per grammar production, grouped into rule
 * families that call each other through this hub.
 *
 * <p>Each production method looks at which captures of its match carry text
 * (the match's {@link com.p6tree.match.Shape}), tests the shapes it knows in a
 * fixed order, and builds the elements of the first shape that fits. A match
 * that fits none raises {@link com.p6tree.UnhandledMatchException}.</p>
 */
public final class Rules {

    private final BuildContext context;
    private final MatchAdapter adapter;

    final StatementRules statements;
    final ExpressionRules expressions;
    final ValueRules values;
    final QuoteRules quotes;
    final VariableRules variables;
    final NameRules names;
    final DeclarationRules declarations;
    final RoutineRules routines;

    public Rules(BuildContext context) {
        this.context = context;
        this.adapter = new MatchAdapter(context.orig(), context.options().recordOrigin(), context.gaps());
        this.statements = new StatementRules(this);
        this.expressions = new ExpressionRules(this);
        this.values = new ValueRules(this);
        this.quotes = new QuoteRules(this);
        this.variables = new VariableRules(this);
        this.names = new NameRules(this);
        this.declarations = new DeclarationRules(this);
        this.routines = new RoutineRules(this);
    }

    BuildContext context() {
        return context;
    }

    MatchAdapter adapter() {
        return adapter;
    }

    /**
     * Classifies the root match ({@code comp_unit}, or a bare {@code statementlist})
     * into top-level statements.
     */
    public List<Element> compUnit(Match root) {
        return statements.compUnit(root);
    }
}
