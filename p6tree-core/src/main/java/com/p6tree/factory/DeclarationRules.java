package com.p6tree.factory;

import com.p6tree.ast.Bareword;
import com.p6tree.ast.Block;
import com.p6tree.ast.Element;
import com.p6tree.ast.Operator;
import com.p6tree.ast.PackageName;
import com.p6tree.ast.Regex;
import com.p6tree.ast.ScopeDeclarator;
import com.p6tree.ast.Semicolon;
import com.p6tree.ast.Signature;
import com.p6tree.match.Match;
import com.p6tree.match.Shape;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Declarations: scoped variables, packages, regexes, traits and type
 * declarations.
 *
 * <p>A scope declaration becomes a {@link ScopeDeclarator} holding the scope
 * keyword and what it declares. An initializer is not part of it: {@code my $x = 1}
 * yields the declarator followed by {@code =} and {@code 1} as siblings.</p>
 */
final class DeclarationRules extends RuleSet {

    private static final Pattern WHERE = Pattern.compile("\\bwhere\\b");

    /** What a declarator declares, and what follows it outside the declaration. */
    private record Declared(List<Element> declared, List<Element> trailing) {

        static Declared of(List<Element> declared) {
            return new Declared(declared, List.of());
        }
    }

    DeclarationRules(Rules rules) {
        super(rules);
    }

    // ========================================================================
    // Scope declarators
    // ========================================================================

    /** {@code my $x}, {@code our @list = ...}, {@code has $.name is rw}, {@code my class Foo { }}. */
    List<Element> scopeDeclarator(Match p) {
        if (shape(p).is("sym", "scoped")) {
            List<Element> inside = new ArrayList<>();
            inside.add(adapter.fromMatch(Bareword::new, p.get("sym")));
            Declared declared = scoped(p.get("scoped"));
            inside.addAll(declared.declared());

            List<Element> children = new ArrayList<>();
            children.add(adapter.branch(ScopeDeclarator::new, inside, p.from(), p.to()));
            children.addAll(declared.trailing());
            return children;
        }
        throw unhandled("scope_declarator", p);
    }

    private Declared scoped(Match p) {
        Shape shape = shape(p);
        if (shape.is("declarator")) {
            return declarator(p.get("declarator"));
        }
        if (shape.is("typename", "declarator")) {
            List<Element> declared = new ArrayList<>(rules.names.typename(p.get("typename")));
            Declared rest = declarator(p.get("declarator"));
            declared.addAll(rest.declared());
            return new Declared(declared, rest.trailing());
        }
        if (shape.is("multi_declarator")) {
            return Declared.of(multiDeclarator(p.get("multi_declarator")));
        }
        if (shape.is("package_declarator")) {
            return Declared.of(packageDeclarator(p.get("package_declarator")));
        }
        if (shape.is("routine_declarator")) {
            return Declared.of(rules.routines.routineDeclarator(p.get("routine_declarator")));
        }
        if (shape.is("regex_declarator")) {
            return Declared.of(regexDeclarator(p.get("regex_declarator")));
        }
        throw unhandled("scoped", p);
    }

    private Declared declarator(Match p) {
        Shape shape = shape(p);
        if (shape.is("variable_declarator", "initializer")) {
            return new Declared(variableDeclarator(p.get("variable_declarator")), initializer(p.get("initializer")));
        }
        if (shape.is("variable_declarator")) {
            return Declared.of(variableDeclarator(p.get("variable_declarator")));
        }
        if (shape.is("signature", "initializer")) {
            return new Declared(List.of(signature(p.get("signature"))), initializer(p.get("initializer")));
        }
        if (shape.is("signature")) {
            return Declared.of(List.of(signature(p.get("signature"))));
        }
        if (shape.is("routine_declarator")) {
            return Declared.of(rules.routines.routineDeclarator(p.get("routine_declarator")));
        }
        if (shape.is("regex_declarator")) {
            return Declared.of(regexDeclarator(p.get("regex_declarator")));
        }
        if (shape.is("type_declarator")) {
            return Declared.of(typeDeclarator(p.get("type_declarator")));
        }
        throw unhandled("declarator", p);
    }

    /** {@code my ($a, $b)}; the parentheses lie outside the signature's match. */
    private Signature signature(Match p) {
        return adapter.balancedOuter(Signature::new, p, rules.routines.parameters(p));
    }

    private List<Element> variableDeclarator(Match p) {
        Shape shape = shape(p);
        if (shape.is("variable")) {
            return List.of(rules.variables.variable(p.get("variable")));
        }
        if (shape.is("variable", "trait")) {
            List<Element> children = new ArrayList<>();
            children.add(rules.variables.variable(p.get("variable")));
            children.addAll(traits(p.getAll("trait")));
            return children;
        }
        throw unhandled("variable_declarator", p);
    }

    /** {@code = 1}, {@code := $y}, {@code .= new}. */
    List<Element> initializer(Match p) {
        if (shape(p).is("sym", "EXPR")) {
            List<Element> children = new ArrayList<>();
            children.add(adapter.fromMatch(Operator.Infix::new, p.get("sym")));
            children.addAll(rules.expressions.expr(p.get("EXPR")));
            return children;
        }
        throw unhandled("initializer", p);
    }

    /** {@code multi sub foo}, {@code proto method bar}, {@code only baz}. */
    List<Element> multiDeclarator(Match p) {
        Shape shape = shape(p);
        List<Element> children = new ArrayList<>();
        if (shape.is("sym", "declarator")) {
            children.add(adapter.fromMatch(Bareword::new, p.get("sym")));
            Declared declared = declarator(p.get("declarator"));
            children.addAll(declared.declared());
            children.addAll(declared.trailing());
            return children;
        }
        if (shape.is("sym", "routine_def")) {
            children.add(adapter.fromMatch(Bareword::new, p.get("sym")));
            children.addAll(rules.routines.routineDef(p.get("routine_def")));
            return children;
        }
        throw unhandled("multi_declarator", p);
    }

    // ========================================================================
    // Packages
    // ========================================================================

    /** {@code class}, {@code role}, {@code grammar}, {@code module}, {@code package}... */
    List<Element> packageDeclarator(Match p) {
        if (shape(p).is("sym", "package_def")) {
            List<Element> children = new ArrayList<>();
            children.add(adapter.fromMatch(Bareword::new, p.get("sym")));
            children.addAll(packageDef(p.get("package_def")));
            return children;
        }
        throw unhandled("package_declarator", p);
    }

    private List<Element> packageDef(Match p) {
        Shape shape = shape(p);
        List<Element> children = new ArrayList<>();
        if (shape.isOptionally(keys("longname", "blockoid"), "trait")) {
            children.add(adapter.fromMatch(PackageName::new, p.get("longname")));
            children.addAll(traits(p.getAll("trait")));
            children.add(rules.statements.blockoid(p.get("blockoid")));
            return children;
        }
        if (shape.isOptionally(keys("longname", "statementlist"), "trait")) {
            // unit class Foo; followed by the rest of the file
            children.add(adapter.fromMatch(PackageName::new, p.get("longname")));
            children.addAll(traits(p.getAll("trait")));
            Match statementlist = p.get("statementlist");
            children.add(locate(Semicolon::new, end(children, p.from()),
                Math.min(statementlist.from() + 1, orig.length()), ";"));
            children.addAll(rules.statements.statementlist(statementlist));
            return children;
        }
        if (shape.is("longname")) {
            // stub: class Foo;
            children.add(adapter.fromMatch(PackageName::new, p.get("longname")));
            return children;
        }
        if (shape.is("blockoid")) {
            children.add(rules.statements.blockoid(p.get("blockoid")));
            return children;
        }
        throw unhandled("package_def", p);
    }

    // ========================================================================
    // Traits
    // ========================================================================

    List<Element> traits(List<Match> traits) {
        List<Element> children = new ArrayList<>();
        for (Match trait : traits) {
            if (!shape(trait).is("trait_mod")) {
                throw unhandled("trait", trait);
            }
            children.addAll(traitMod(trait.get("trait_mod")));
        }
        return children;
    }

    /** {@code is rw}, {@code is export(:DEFAULT)}, {@code does Role}, {@code of Int}, {@code returns Str}. */
    private List<Element> traitMod(Match p) {
        Shape shape = shape(p);
        List<Element> children = new ArrayList<>();
        if (shape.is("sym", "longname")) {
            children.add(adapter.fromMatch(Bareword::new, p.get("sym")));
            children.add(rules.names.longname(p.get("longname")));
            return children;
        }
        if (shape.is("sym", "longname", "circumfix")) {
            children.add(adapter.fromMatch(Bareword::new, p.get("sym")));
            children.add(rules.names.longname(p.get("longname")));
            children.addAll(rules.expressions.circumfix(p.get("circumfix")));
            return children;
        }
        if (shape.is("sym", "typename")) {
            children.add(adapter.fromMatch(Bareword::new, p.get("sym")));
            children.addAll(rules.names.typename(p.get("typename")));
            return children;
        }
        throw unhandled("trait_mod", p);
    }

    // ========================================================================
    // Regexes
    // ========================================================================

    /** {@code token}, {@code rule}, {@code regex}. */
    List<Element> regexDeclarator(Match p) {
        if (shape(p).is("sym", "regex_def")) {
            List<Element> children = new ArrayList<>();
            children.add(adapter.fromMatch(Bareword::new, p.get("sym")));
            children.addAll(regexDef(p.get("regex_def")));
            return children;
        }
        throw unhandled("regex_declarator", p);
    }

    private List<Element> regexDef(Match p) {
        Shape shape = shape(p);
        List<Element> children = new ArrayList<>();
        if (shape.is("deflongname", "nibble")) {
            Match name = p.get("deflongname");
            children.add(adapter.fromMatch(Bareword::new, name));
            Signature empty = rules.routines.emptySignature(name.to(), p.get("nibble").from());
            if (empty != null) {
                children.add(empty);
            }
            children.add(regexBody(p.get("nibble")));
            return children;
        }
        if (shape.is("deflongname", "signature", "nibble")) {
            children.add(adapter.fromMatch(Bareword::new, p.get("deflongname")));
            children.add(signature(p.get("signature")));
            children.add(regexBody(p.get("nibble")));
            return children;
        }
        throw unhandled("regex_def", p);
    }

    /** The braces around a regex body lie outside the body's match. */
    private Block regexBody(Match nibble) {
        List<Element> children = new ArrayList<>();
        if (!nibble.str().isBlank()) {
            children.add(adapter.fromMatchTrimmed((from, to, content) -> new Regex(from, to, content, ""), nibble));
        }
        return adapter.balancedOuter(Block::new, nibble, children);
    }

    // ========================================================================
    // Type declarations
    // ========================================================================

    /** {@code constant}, {@code enum}, {@code subset}. */
    List<Element> typeDeclarator(Match p) {
        String sym = sym(p);
        Shape shape = shape(p);
        List<Element> children = new ArrayList<>();
        if (sym.equals("constant")) {
            if (shape.is("sym", "defterm", "initializer")) {
                children.add(adapter.fromMatch(Bareword::new, p.get("sym")));
                children.add(adapter.fromMatch(Bareword::new, p.get("defterm")));
                children.addAll(initializer(p.get("initializer")));
                return children;
            }
            if (shape.is("sym", "variable", "initializer")) {
                children.add(adapter.fromMatch(Bareword::new, p.get("sym")));
                children.add(rules.variables.variable(p.get("variable")));
                children.addAll(initializer(p.get("initializer")));
                return children;
            }
        } else if (sym.equals("enum")) {
            if (shape.is("sym", "longname", "term")) {
                children.add(adapter.fromMatch(Bareword::new, p.get("sym")));
                children.add(adapter.fromMatch(PackageName::new, p.get("longname")));
                children.addAll(rules.expressions.expr(p.get("term")));
                return children;
            }
        } else if (sym.equals("subset")) {
            if (shape.isOptionally(keys("sym", "longname"), "trait", "EXPR")) {
                children.add(adapter.fromMatch(Bareword::new, p.get("sym")));
                children.add(adapter.fromMatch(PackageName::new, p.get("longname")));
                children.addAll(traits(p.getAll("trait")));
                Match where = p.get("EXPR");
                if (where != null) {
                    children.add(locate(Bareword::new, end(children, p.from()), where.from(), WHERE));
                    children.addAll(rules.expressions.expr(where));
                }
                return children;
            }
        }
        throw unhandled("type_declarator", p);
    }
}
