package com.p6tree.factory;

import com.p6tree.ast.Balanced;
import com.p6tree.ast.Contextualizer;
import com.p6tree.ast.Element;
import com.p6tree.ast.Variable;
import com.p6tree.ast.VariableKind;
import com.p6tree.match.Match;
import com.p6tree.match.Shape;

import java.util.ArrayList;
import java.util.List;

/**
 * Variables, contextualizers and parameter variables.
 */
final class VariableRules extends RuleSet {

    VariableRules(Rules rules) {
        super(rules);
    }

    Element variable(Match p) {
        Shape shape = shape(p);
        if (shape.is("sigil", "desigilname")) {
            return variable(p, p.get("sigil").str());
        }
        if (shape.is("sigil", "twigil", "desigilname")) {
            return variable(p, p.get("sigil").str() + p.get("twigil").str());
        }
        if (shape.is("sigil", "index") || shape.is("sigil", "postcircumfix")) {
            // $0, $<name>
            return variable(p, p.get("sigil").str() + VariableKind.Twigil.MATCH_INDEX.symbol());
        }
        if (shape.is("contextualizer")) {
            return contextualizer(p.get("contextualizer"));
        }
        if (shape.is("special_variable")) {
            // $/, $!, $¢
            return variable(p.get("special_variable"), p.get("special_variable").str().substring(0, 1));
        }
        if (shape.is("sigil")) {
            return variable(p, p.get("sigil").str());
        }
        throw unhandled("variable", p);
    }

    private Variable variable(Match p, String key) {
        VariableKind kind = VariableKind.lookup(key);
        if (kind == null) {
            throw unhandled("variable:" + key, p);
        }
        return adapter.fromMatch((from, to, content) -> new Variable(from, to, content, kind), p);
    }

    /** {@code $( ... )}, {@code @( ... )}: the sigil, then the parenthesized part as children. */
    Contextualizer contextualizer(Match p) {
        Shape shape = shape(p);
        if (shape.is("sigil", "coercee") || shape.is("sigil")) {
            Match sigil = p.get("sigil");
            int open = skipWhitespace(sigil.to());
            int close = skipWhitespaceBack(p.to()) - 1;
            if (open >= close || orig.charAt(open) != '(' || orig.charAt(close) != ')') {
                throw unhandled("contextualizer", p);
            }
            List<Element> children = new ArrayList<>();
            children.add(adapter.fromInt(Balanced.Enter::new, open, "("));
            Match coercee = p.get("coercee");
            if (coercee != null) {
                children.addAll(rules.statements.semilist(coercee));
            }
            children.add(adapter.fromInt(Balanced.Exit::new, close, ")"));
            return adapter.stamp(new Contextualizer(sigil.from(), sigil.to(), sigil.str(), children));
        }
        throw unhandled("contextualizer", p);
    }

    /** The variable of a parameter: {@code $x}, {@code $!x}, {@code @}. */
    Variable paramVar(Match p) {
        Shape shape = shape(p);
        if (shape.is("sigil", "name")) {
            return variable(p, p.get("sigil").str());
        }
        if (shape.is("sigil", "twigil", "name")) {
            return variable(p, p.get("sigil").str() + p.get("twigil").str());
        }
        if (shape.is("sigil")) {
            return variable(p, p.get("sigil").str());
        }
        throw unhandled("param_var", p);
    }
}
