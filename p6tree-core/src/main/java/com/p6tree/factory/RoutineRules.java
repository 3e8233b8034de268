package com.p6tree.factory;

import com.p6tree.ast.Bareword;
import com.p6tree.ast.ColonBareword;
import com.p6tree.ast.Element;
import com.p6tree.ast.Operator;
import com.p6tree.ast.Signature;
import com.p6tree.match.Match;
import com.p6tree.match.Shape;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Routines, methods and their signatures.
 */
final class RoutineRules extends RuleSet {

    private static final Pattern SEPARATOR = Pattern.compile("[,;:]");

    RoutineRules(Rules rules) {
        super(rules);
    }

    /** {@code sub}, {@code method}, {@code submethod}, {@code macro}. */
    List<Element> routineDeclarator(Match p) {
        Shape shape = shape(p);
        List<Element> children = new ArrayList<>();
        if (shape.is("sym", "routine_def")) {
            children.add(adapter.fromMatch(Bareword::new, p.get("sym")));
            children.addAll(routineDef(p.get("routine_def")));
            return children;
        }
        if (shape.is("sym", "method_def")) {
            children.add(adapter.fromMatch(Bareword::new, p.get("sym")));
            children.addAll(methodDef(p.get("method_def")));
            return children;
        }
        throw unhandled("routine_declarator", p);
    }

    /** Name, signature and traits are all optional; the body is not. */
    List<Element> routineDef(Match p) {
        if (!shape(p).isOptionally(keys("blockoid"), "deflongname", "multisig", "trait")) {
            throw unhandled("routine_def", p);
        }
        List<Element> children = new ArrayList<>();
        Match name = p.get("deflongname");
        if (name != null) {
            children.add(adapter.fromMatch(Bareword::new, name));
        }
        Match multisig = p.get("multisig");
        if (multisig != null) {
            children.add(multisig(multisig));
        }
        children.addAll(rules.declarations.traits(p.getAll("trait")));
        StatementRules.sortBySource(children);
        children.add(rules.statements.blockoid(p.get("blockoid")));
        return children;
    }

    /** As a routine, plus {@code !} for private and {@code ^} for meta methods. */
    List<Element> methodDef(Match p) {
        if (!shape(p).isOptionally(keys("blockoid"), "specials", "longname", "deflongname", "multisig", "trait")) {
            throw unhandled("method_def", p);
        }
        List<Element> children = new ArrayList<>();
        Match specials = p.get("specials");
        if (specials != null) {
            children.add(adapter.fromMatchTrimmed(Operator.Prefix::new, specials));
        }
        Match name = p.get("longname") != null ? p.get("longname") : p.get("deflongname");
        if (name != null) {
            children.add(adapter.fromMatch(Bareword::new, name));
        }
        Match multisig = p.get("multisig");
        if (multisig != null) {
            children.add(multisig(multisig));
        }
        children.addAll(rules.declarations.traits(p.getAll("trait")));
        StatementRules.sortBySource(children);
        children.add(rules.statements.blockoid(p.get("blockoid")));
        return children;
    }

    /** {@code ($a, $b)}; the match includes the parentheses. */
    Signature multisig(Match p) {
        Shape shape = shape(p);
        int open = skipWhitespace(p.from());
        int close = skipWhitespaceBack(p.to());
        if (open >= close || orig.charAt(open) != '(' || orig.charAt(close - 1) != ')') {
            throw unhandled("multisig", p);
        }
        if (shape.is("signature")) {
            return adapter.balanced(Signature::new, open, close, parameters(p.get("signature")));
        }
        if (shape.isBare()) {
            return adapter.balanced(Signature::new, open, close, List.of());
        }
        throw unhandled("multisig", p);
    }

    /**
     * An empty {@code ()} between two offsets, for declarations whose grammar
     * drops the empty signature. Returns null when there are no parentheses.
     */
    Signature emptySignature(int from, int to) {
        int open = skipWhitespace(from);
        if (open + 1 >= to || orig.charAt(open) != '(') {
            return null;
        }
        int close = skipWhitespace(open + 1);
        if (close >= to || orig.charAt(close) != ')') {
            return null;
        }
        return adapter.balanced(Signature::new, open, close + 1, List.of());
    }

    /** The parameters of a pointy block, {@code -> $a, $b}, as an undelimited signature. */
    List<Element> signature(Match p) {
        List<Element> parameters = parameters(p);
        if (parameters.isEmpty()) {
            return List.of();
        }
        return List.of(adapter.branch(Signature::new, parameters, p.from(), p.to()));
    }

    /** Parameters with the separators located between them. */
    List<Element> parameters(Match p) {
        Shape shape = shape(p);
        if (shape.is("parameter")) {
            List<Element> children = new ArrayList<>();
            for (Match parameter : p.getAll("parameter")) {
                List<Element> elements = parameter(parameter);
                if (!children.isEmpty()) {
                    children.add(locate(Operator.Infix::new, end(children, p.from()),
                        start(elements, parameter.from()), SEPARATOR));
                }
                children.addAll(elements);
            }
            return children;
        }
        if (shape.isBare()) {
            return List.of();
        }
        throw unhandled("signature", p);
    }

    /** {@code Int $x}, {@code *@rest}, {@code $x?}, {@code :$named}, {@code $x = 1}, {@code $x is copy}. */
    private List<Element> parameter(Match p) {
        Shape shape = shape(p);
        if (shape.isBare()
            || !shape.isOptionally(keys(), "typename", "quant", "param_var", "named_param", "default_value", "trait")
            || (p.get("param_var") == null && p.get("named_param") == null && p.get("typename") == null)
            || (p.get("param_var") != null && p.get("named_param") != null)) {
            throw unhandled("parameter", p);
        }

        List<Element> children = new ArrayList<>();
        Match typename = p.get("typename");
        if (typename != null) {
            children.addAll(rules.names.typename(typename));
        }
        Match variable = p.get("param_var");
        if (variable != null) {
            children.add(rules.variables.paramVar(variable));
        }
        Match named = p.get("named_param");
        if (named != null) {
            children.addAll(namedParam(named));
        }
        Match quant = p.get("quant");
        if (quant != null) {
            Match target = variable != null ? variable : named;
            if (target != null && quant.from() < target.from()) {
                children.add(adapter.fromMatchTrimmed(Operator.Prefix::new, quant));
            } else {
                children.add(adapter.fromMatchTrimmed(Operator.Postfix::new, quant));
            }
        }
        children.addAll(rules.declarations.traits(p.getAll("trait")));
        StatementRules.sortBySource(children);

        Match defaultValue = p.get("default_value");
        if (defaultValue != null) {
            if (!shape(defaultValue).is("EXPR")) {
                throw unhandled("default_value", defaultValue);
            }
            List<Element> value = rules.expressions.expr(defaultValue.get("EXPR"));
            children.add(locate(Operator.Infix::new, end(children, p.from()), start(value, defaultValue.from()), "="));
            children.addAll(value);
        }
        return children;
    }

    /** {@code :$x}, {@code :name($x)}. */
    private List<Element> namedParam(Match p) {
        Shape shape = shape(p);
        List<Element> children = new ArrayList<>();
        if (shape.is("param_var")) {
            Match variable = p.get("param_var");
            children.add(locate(Operator.Prefix::new, p.from(), variable.from(), ":"));
            children.add(rules.variables.paramVar(variable));
            return children;
        }
        if (shape.is("name", "param_var")) {
            Match name = p.get("name");
            children.add(adapter.fromRange(ColonBareword::new, p.from(), name.to()));
            int open = skipWhitespace(name.to());
            int close = skipWhitespaceBack(p.to());
            if (open >= close || orig.charAt(open) != '(' || orig.charAt(close - 1) != ')') {
                throw unhandled("named_param", p);
            }
            children.add(adapter.balanced(Operator.Circumfix::new, open, close,
                List.of(rules.variables.paramVar(p.get("param_var")))));
            return children;
        }
        throw unhandled("named_param", p);
    }
}
